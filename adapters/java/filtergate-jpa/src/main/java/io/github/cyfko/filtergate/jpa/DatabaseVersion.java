package io.github.cyfko.filtergate.jpa;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Numeric backend version parsed from a version banner.
 *
 * <pre>{@code
 * DatabaseVersion.parse("PostgreSQL 14.5 on x86_64-pc-linux-gnu");  // 14.5.0
 * DatabaseVersion.parse("8.0.32-0ubuntu0.22.04.2");                // 8.0.32
 * DatabaseVersion.parse(null);                                     // 0.0.0
 * }</pre>
 *
 * @param major major version
 * @param minor minor version
 * @param patch patch version
 * @since 1.0.0
 */
public record DatabaseVersion(int major, int minor, int patch) implements Comparable<DatabaseVersion> {

    public static final DatabaseVersion UNKNOWN = new DatabaseVersion(0, 0, 0);

    private static final Pattern VERSION = Pattern.compile("(\\d+)(?:\\.(\\d+))?(?:\\.(\\d+))?");

    /**
     * Parses the first dotted number of a banner.
     *
     * @param banner version banner, may be {@code null}
     * @return the version, {@link #UNKNOWN} if none is found
     */
    public static DatabaseVersion parse(Object banner) {
        if (banner == null) {
            return UNKNOWN;
        }
        Matcher matcher = VERSION.matcher(banner.toString());
        if (!matcher.find()) {
            return UNKNOWN;
        }
        return new DatabaseVersion(group(matcher, 1), group(matcher, 2), group(matcher, 3));
    }

    private static int group(Matcher matcher, int index) {
        String value = matcher.group(index);
        return value == null ? 0 : Integer.parseInt(value);
    }

    public boolean atLeast(int major, int minor, int patch) {
        return compareTo(new DatabaseVersion(major, minor, patch)) >= 0;
    }

    public boolean atLeast(int major, int minor) {
        return atLeast(major, minor, 0);
    }

    public boolean isUnknown() {
        return this.equals(UNKNOWN);
    }

    @Override
    public int compareTo(DatabaseVersion other) {
        if (major != other.major) return Integer.compare(major, other.major);
        if (minor != other.minor) return Integer.compare(minor, other.minor);
        return Integer.compare(patch, other.patch);
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + patch;
    }
}
