package com.watchtower.core.state;

import org.redisson.api.BatchOptions;
import org.redisson.api.BatchResult;
import org.redisson.api.RBatch;
import org.redisson.api.RBucketAsync;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisException;
import org.redisson.client.codec.StringCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * {@link EphemeralStateStore} backed by Redis through Redisson.
 *
 * <p>
 * Each call builds one {@link RBatch} (a Redis pipeline) and executes it
 * synchronously. Values are stored as plain strings via {@link StringCodec}
 * so they stay readable from {@code redis-cli}.
 * </p>
 *
 * @since 1.0.0
 */
public class RedissonEphemeralStateStore implements EphemeralStateStore {

    private static final Logger LOG = LoggerFactory.getLogger(RedissonEphemeralStateStore.class);

    private final RedissonClient redissonClient;

    public RedissonEphemeralStateStore(RedissonClient redissonClient) {
        this.redissonClient = Objects.requireNonNull(redissonClient, "RedissonClient must not be null");
    }

    @Override
    public List<String> getAll(List<String> keys) {
        Objects.requireNonNull(keys, "keys must not be null");
        if (keys.isEmpty()) {
            return List.of();
        }

        RBatch batch = redissonClient.createBatch(BatchOptions.defaults());
        for (String key : keys) {
            batch.<String>getBucket(key, StringCodec.INSTANCE).getAsync();
        }

        List<?> responses = execute(batch, "read " + keys.size() + " key(s)").getResponses();
        if (responses.size() != keys.size()) {
            throw new StateStoreException("Redis pipeline returned " + responses.size()
                    + " response(s) for " + keys.size() + " key(s)");
        }

        List<String> values = new ArrayList<>(responses.size());
        for (Object response : responses) {
            values.add(response != null ? response.toString() : null);
        }
        return values;
    }

    @Override
    public void writeAll(List<CacheWrite> writes) {
        Objects.requireNonNull(writes, "writes must not be null");
        if (writes.isEmpty()) {
            return;
        }

        RBatch batch = redissonClient.createBatch(BatchOptions.defaults());
        for (CacheWrite write : writes) {
            RBucketAsync<String> bucket = batch.getBucket(write.getKey(), StringCodec.INSTANCE);
            if (write.isDelete()) {
                bucket.deleteAsync();
            } else {
                bucket.setAsync(write.getValue(), write.getTtl().getSeconds(), TimeUnit.SECONDS);
            }
        }

        execute(batch, "write " + writes.size() + " key(s)");
        LOG.trace("Flushed {} ephemeral write(s)", writes.size());
    }

    private static BatchResult<?> execute(RBatch batch, String operation) {
        try {
            return batch.execute();
        } catch (RedisException e) {
            throw new StateStoreException("Redis pipeline failed to " + operation, e);
        }
    }
}
