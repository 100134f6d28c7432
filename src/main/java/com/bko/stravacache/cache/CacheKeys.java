package com.bko.stravacache.cache;

import java.util.regex.Pattern;

/**
 * Athlete and resource ids become path segments of the cache, so only a conservative character set is accepted.
 */
public final class CacheKeys {
    private static final Pattern SAFE_SEGMENT = Pattern.compile("[A-Za-z0-9_.-]+");

    private CacheKeys() {
    }

    public static boolean isValid(String value) {
        return value != null && SAFE_SEGMENT.matcher(value).matches() && !value.startsWith(".");
    }

    /**
     * @throws IllegalArgumentException when {@code value} is not a valid key
     */
    public static String require(String value, String name) {
        if (!isValid(value)) {
            throw new IllegalArgumentException("Invalid " + name + ": " + value);
        }
        return value;
    }
}
