package com.github.dimitryivaniuta.metergateway.gateway.cache;

/**
 * Key grammar: {@code namespace:identifier[:subfield[:parameter]]} - printable ASCII, colon-delimited,
 * no empty segments, no {@code *}. Invalidation patterns are a key prefix followed by {@code :*}.
 */
public final class CacheKeys {

    public static final char SEPARATOR = ':';
    public static final String WILDCARD_SUFFIX = ":*";
    public static final int MAX_KEY_LENGTH = 512;

    private CacheKeys() {}

    /** Joins segments with {@code :}, e.g. {@code of("meter", 42, "unit") -> "meter:42:unit"}. */
    public static String of(Object... segments) {
        if (segments == null || segments.length == 0) {
            throw new InvalidCacheKeyException("at least one key segment is required");
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < segments.length; i++) {
            if (i > 0) sb.append(SEPARATOR);
            sb.append(segments[i]);
        }
        return requireValidKey(sb.toString());
    }

    public static String requireValidKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new InvalidCacheKeyException("cache key must not be empty");
        }
        if (key.length() > MAX_KEY_LENGTH) {
            throw new InvalidCacheKeyException("cache key longer than " + MAX_KEY_LENGTH + " characters");
        }
        char previous = SEPARATOR;
        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            if (c < 0x21 || c > 0x7e) {
                throw new InvalidCacheKeyException("cache key must be printable ASCII: " + key);
            }
            if (c == '*') {
                throw new InvalidCacheKeyException("'*' is only allowed as a trailing wildcard segment: " + key);
            }
            if (c == SEPARATOR && previous == SEPARATOR) {
                throw new InvalidCacheKeyException("cache key has an empty segment: " + key);
            }
            previous = c;
        }
        if (previous == SEPARATOR) {
            throw new InvalidCacheKeyException("cache key has an empty trailing segment: " + key);
        }
        return key;
    }

    public static boolean isPattern(String keyOrPattern) {
        return keyOrPattern != null && keyOrPattern.endsWith(WILDCARD_SUFFIX);
    }

    /**
     * Converts {@code meter:42:*} into the literal prefix {@code meter:42:}.
     * The wildcard matches one or more trailing segments, never the bare prefix key itself.
     */
    public static String patternPrefix(String pattern) {
        if (!isPattern(pattern)) {
            throw new InvalidCacheKeyException("pattern must end with ':*': " + pattern);
        }
        String literal = pattern.substring(0, pattern.length() - WILDCARD_SUFFIX.length());
        requireValidKey(literal);
        return literal + SEPARATOR;
    }

    /** Segment-wise prefix match; {@code prefix} must come from {@link #patternPrefix(String)}. */
    public static boolean matchesPrefix(String key, String prefix) {
        return key.length() > prefix.length() && key.startsWith(prefix);
    }
}
