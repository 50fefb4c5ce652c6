package com.contrastsecurity.appsource.config;

/**
 * A regex replacement applied to release tags before they are compared.
 */
public class TagRewrite {
    private String pattern;
    private String replacement = "";

    public TagRewrite() {
    }

    public TagRewrite(String pattern, String replacement) {
        this.pattern = pattern;
        this.replacement = replacement;
    }

    public String getPattern() {
        return pattern;
    }

    public void setPattern(String pattern) {
        this.pattern = pattern;
    }

    public String getReplacement() {
        return replacement;
    }

    public void setReplacement(String replacement) {
        this.replacement = replacement;
    }
}
