package com.contrastsecurity.appsource.config;

/**
 * GitHub repository whose latest release receives re-uploaded packages.
 */
public class UploadTarget {
    private String owner;
    private String repo;
    private String tokenEnv = "GITHUB_TOKEN";

    public UploadTarget() {
    }

    public UploadTarget(String owner, String repo) {
        this.owner = owner;
        this.repo = repo;
    }

    public String getOwner() {
        return owner;
    }

    public void setOwner(String owner) {
        this.owner = owner;
    }

    public String getRepo() {
        return repo;
    }

    public void setRepo(String repo) {
        this.repo = repo;
    }

    public String getTokenEnv() {
        return tokenEnv;
    }

    public void setTokenEnv(String tokenEnv) {
        this.tokenEnv = tokenEnv;
    }

    @Override
    public String toString() {
        return owner + "/" + repo;
    }
}
