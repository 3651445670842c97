package com.watchtower.core.state;

import java.time.Duration;
import java.util.Objects;

/**
 * One write queued into an ephemeral store batch: either a {@code SET} with
 * expiry or a {@code DELETE}.
 *
 * @since 1.0.0
 */
public final class CacheWrite {

    private final String key;
    private final String value;
    private final Duration ttl;

    private CacheWrite(String key, String value, Duration ttl) {
        this.key = Objects.requireNonNull(key, "key must not be null");
        this.value = value;
        this.ttl = ttl;
    }

    /**
     * @param key   cache key
     * @param value value to store; must not be {@code null}
     * @param ttl   expiry; must be positive
     */
    public static CacheWrite set(String key, String value, Duration ttl) {
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(ttl, "ttl must not be null");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive, got: " + ttl);
        }
        return new CacheWrite(key, value, ttl);
    }

    public static CacheWrite delete(String key) {
        return new CacheWrite(key, null, null);
    }

    public boolean isDelete() {
        return value == null;
    }

    public String getKey() {
        return key;
    }

    /**
     * @return the value to set, {@code null} for deletes
     */
    public String getValue() {
        return value;
    }

    /**
     * @return the expiry, {@code null} for deletes
     */
    public Duration getTtl() {
        return ttl;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CacheWrite that))
            return false;
        return key.equals(that.key)
                && Objects.equals(value, that.value)
                && Objects.equals(ttl, that.ttl);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, value, ttl);
    }

    @Override
    public String toString() {
        return isDelete()
                ? "CacheWrite{DEL " + key + '}'
                : "CacheWrite{SET " + key + '=' + value + " EX " + ttl.getSeconds() + '}';
    }
}
