package com.contrastsecurity.appsource.version;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A parsed release version.
 *
 * Accepts the usual public version shapes found in release tags and app bundles:
 * {@code 1.2}, {@code 1.2.3}, {@code 2.0.0b1}, {@code 1.0-rc.2}, {@code 1.4.post1},
 * {@code 3.0.dev2}, {@code 1!2.0} and {@code 1.0+build.5}. Ordering follows the
 * release / pre-release / post-release / development-release rules used by Python
 * packaging, which is how catalog versions have always been compared:
 *
 * <pre>
 * 1.0.dev1 &lt; 1.0a1 &lt; 1.0b2 &lt; 1.0rc1 &lt; 1.0 == 1.0.0 &lt; 1.0.post1 &lt; 1.0+local
 * </pre>
 *
 * Anything else is rejected with a {@link VersionParseException}.
 */
public final class SemanticVersion implements Comparable<SemanticVersion> {

    private static final Pattern VERSION_PATTERN = Pattern.compile(
        "^v?" +
        "(?:(?<epoch>[0-9]+)!)?" +                                                   // 1!
        "(?<release>[0-9]+(?:\\.[0-9]+)*)" +                                         // 1.2.3
        "(?:[-_.]?(?<preLabel>alpha|a|beta|b|preview|pre|c|rc)[-_.]?(?<preNumber>[0-9]+)?)?" +
        "(?:-(?<implicitPost>[0-9]+)|[-_.]?(?<postLabel>post|rev|r)[-_.]?(?<postNumber>[0-9]+)?)?" +
        "(?:[-_.]?(?<devLabel>dev)[-_.]?(?<devNumber>[0-9]+)?)?" +
        "(?:\\+(?<local>[a-z0-9]+(?:[-_.][a-z0-9]+)*))?$",
        Pattern.CASE_INSENSITIVE
    );

    private static final Pattern LOCAL_SEPARATOR = Pattern.compile("[-_.]");

    private final String original;
    private final long epoch;
    private final long[] release;
    private final String preLabel;   // a, b or rc
    private final long preNumber;
    private final Long post;
    private final Long dev;
    private final List<String> local;

    private SemanticVersion(String original, long epoch, long[] release, String preLabel, long preNumber,
                            Long post, Long dev, List<String> local) {
        this.original = original;
        this.epoch = epoch;
        this.release = release;
        this.preLabel = preLabel;
        this.preNumber = preNumber;
        this.post = post;
        this.dev = dev;
        this.local = local;
    }

    /**
     * Parse a version string.
     *
     * @param version the version to parse, surrounding whitespace is ignored
     * @return the parsed version
     * @throws VersionParseException if the string is null, empty or not a recognizable version
     */
    public static SemanticVersion parse(String version) {
        if (version == null) {
            throw new VersionParseException(null, "Invalid version: null");
        }
        String trimmed = version.trim();
        Matcher matcher = VERSION_PATTERN.matcher(trimmed);
        if (!matcher.matches()) {
            throw new VersionParseException(version, "Invalid version: '" + version + "'");
        }

        try {
            long epoch = matcher.group("epoch") != null ? Long.parseLong(matcher.group("epoch")) : 0L;
            long[] release = Arrays.stream(matcher.group("release").split("\\."))
                    .mapToLong(Long::parseLong)
                    .toArray();

            String preLabel = null;
            long preNumber = 0L;
            if (matcher.group("preLabel") != null) {
                preLabel = normalizePreLabel(matcher.group("preLabel"));
                preNumber = matcher.group("preNumber") != null ? Long.parseLong(matcher.group("preNumber")) : 0L;
            }

            Long post = null;
            if (matcher.group("implicitPost") != null) {
                post = Long.parseLong(matcher.group("implicitPost"));
            } else if (matcher.group("postLabel") != null) {
                post = matcher.group("postNumber") != null ? Long.parseLong(matcher.group("postNumber")) : 0L;
            }

            Long dev = null;
            if (matcher.group("devLabel") != null) {
                dev = matcher.group("devNumber") != null ? Long.parseLong(matcher.group("devNumber")) : 0L;
            }

            List<String> local = null;
            if (matcher.group("local") != null) {
                local = new ArrayList<>(Arrays.asList(
                        LOCAL_SEPARATOR.split(matcher.group("local").toLowerCase(Locale.ROOT))));
            }

            return new SemanticVersion(version, epoch, release, preLabel, preNumber, post, dev, local);
        } catch (NumberFormatException e) {
            // numeric component too large for a long
            throw new VersionParseException(version, "Invalid version: '" + version + "'", e);
        }
    }

    /**
     * Check whether a string parses as a version without throwing.
     */
    public static boolean isValid(String version) {
        return version != null && VERSION_PATTERN.matcher(version.trim()).matches();
    }

    /**
     * Compare two version strings.
     *
     * @throws VersionParseException if either side is not a valid version
     */
    public static int compare(String left, String right) {
        return parse(left).compareTo(parse(right));
    }

    private static String normalizePreLabel(String label) {
        switch (label.toLowerCase(Locale.ROOT)) {
            case "alpha":
            case "a":
                return "a";
            case "beta":
            case "b":
                return "b";
            default:
                return "rc";  // c, rc, pre, preview
        }
    }

    private static int preLabelRank(String label) {
        switch (label) {
            case "a":
                return 0;
            case "b":
                return 1;
            default:
                return 2;
        }
    }

    public boolean isPrerelease() {
        return preLabel != null || dev != null;
    }

    public boolean isPostRelease() {
        return post != null;
    }

    public String getOriginal() {
        return original;
    }

    @Override
    public int compareTo(SemanticVersion other) {
        int result = Long.compare(epoch, other.epoch);
        if (result != 0) {
            return result;
        }
        result = compareRelease(release, other.release);
        if (result != 0) {
            return result;
        }
        result = comparePre(other);
        if (result != 0) {
            return result;
        }
        result = compareNullable(post, other.post, false);
        if (result != 0) {
            return result;
        }
        result = compareNullable(dev, other.dev, true);
        if (result != 0) {
            return result;
        }
        return compareLocal(local, other.local);
    }

    private static int compareRelease(long[] left, long[] right) {
        int length = Math.max(left.length, right.length);
        for (int i = 0; i < length; i++) {
            long l = i < left.length ? left[i] : 0L;
            long r = i < right.length ? right[i] : 0L;
            if (l != r) {
                return Long.compare(l, r);
            }
        }
        return 0;
    }

    /**
     * A bare development release sorts before every pre-release of the same version,
     * and a final release sorts after all of them.
     */
    private int comparePre(SemanticVersion other) {
        int leftBucket = preBucket();
        int rightBucket = other.preBucket();
        if (leftBucket != rightBucket) {
            return Integer.compare(leftBucket, rightBucket);
        }
        if (leftBucket != 1) {
            return 0;
        }
        int result = Integer.compare(preLabelRank(preLabel), preLabelRank(other.preLabel));
        return result != 0 ? result : Long.compare(preNumber, other.preNumber);
    }

    private int preBucket() {
        if (preLabel == null && post == null && dev != null) {
            return 0;
        }
        return preLabel != null ? 1 : 2;
    }

    private static int compareNullable(Long left, Long right, boolean nullIsHighest) {
        if (Objects.equals(left, right)) {
            return 0;
        }
        if (left == null) {
            return nullIsHighest ? 1 : -1;
        }
        if (right == null) {
            return nullIsHighest ? -1 : 1;
        }
        return Long.compare(left, right);
    }

    private static int compareLocal(List<String> left, List<String> right) {
        if (left == null || right == null) {
            return left == null ? (right == null ? 0 : -1) : 1;
        }
        int length = Math.min(left.size(), right.size());
        for (int i = 0; i < length; i++) {
            String l = left.get(i);
            String r = right.get(i);
            boolean lNumeric = l.chars().allMatch(Character::isDigit);
            boolean rNumeric = r.chars().allMatch(Character::isDigit);
            int result;
            if (lNumeric && rNumeric) {
                result = new java.math.BigInteger(l).compareTo(new java.math.BigInteger(r));
            } else if (lNumeric != rNumeric) {
                // numeric segments sort after alphanumeric ones
                result = lNumeric ? 1 : -1;
            } else {
                result = l.compareTo(r);
            }
            if (result != 0) {
                return result;
            }
        }
        return Integer.compare(left.size(), right.size());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return compareTo((SemanticVersion) o) == 0;
    }

    @Override
    public int hashCode() {
        int significant = release.length;
        while (significant > 1 && release[significant - 1] == 0L) {
            significant--;
        }
        return Objects.hash(epoch, Arrays.hashCode(Arrays.copyOf(release, significant)),
                preLabel, preLabel != null ? preNumber : 0L, post, dev, local);
    }

    @Override
    public String toString() {
        return original;
    }
}
