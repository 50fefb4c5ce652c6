package com.contrastsecurity.appsource.version;

import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * Turns a release tag into something comparable with catalog versions.
 *
 * Release tags are usually the display version with decoration around it
 * ({@code v1.2.0}, {@code release-1.2.0}). The normalizer first applies an optional
 * regex rewrite and then strips every leading character that appears in the strip set.
 */
public final class TagNormalizer implements UnaryOperator<String> {

    /** Strips a leading {@code v}, the most common tag decoration. */
    public static final TagNormalizer DEFAULT = new TagNormalizer("v", null, null);

    private final String stripChars;
    private final Pattern rewritePattern;
    private final String rewriteReplacement;

    private TagNormalizer(String stripChars, Pattern rewritePattern, String rewriteReplacement) {
        this.stripChars = stripChars != null ? stripChars : "";
        this.rewritePattern = rewritePattern;
        this.rewriteReplacement = rewriteReplacement != null ? rewriteReplacement : "";
    }

    /**
     * @param stripChars every leading character contained in this string is removed
     */
    public static TagNormalizer stripLeading(String stripChars) {
        return new TagNormalizer(stripChars, null, null);
    }

    /**
     * @param stripChars leading characters to remove after the rewrite
     * @param pattern regex whose matches are replaced, may be null
     * @param replacement replacement text, {@code $1}-style group references allowed
     */
    public static TagNormalizer of(String stripChars, String pattern, String replacement) {
        return new TagNormalizer(stripChars, pattern != null ? Pattern.compile(pattern) : null, replacement);
    }

    @Override
    public String apply(String tag) {
        if (tag == null) {
            return null;
        }
        String result = tag;
        if (rewritePattern != null) {
            result = rewritePattern.matcher(result).replaceAll(rewriteReplacement);
        }
        int start = 0;
        while (start < result.length() && stripChars.indexOf(result.charAt(start)) >= 0) {
            start++;
        }
        return result.substring(start);
    }

    @Override
    public String toString() {
        return "TagNormalizer{strip='" + stripChars + "'" +
                (rewritePattern != null ? ", rewrite=" + rewritePattern.pattern() + "->" + rewriteReplacement : "") +
                '}';
    }
}
