/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.plugins.redis;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.intuitivedesigns.chainkernel.core.CheckpointStore;
import com.intuitivedesigns.chainkernel.error.CacheException;
import com.intuitivedesigns.chainkernel.model.ChainPosition;
import com.intuitivedesigns.chainkernel.model.Checkpoint;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;

import java.io.IOException;
import java.time.Instant;
import java.util.Optional;

/**
 * Checkpoints as Redis strings under {@code chainkernel:checkpoint:<source id>}, no expiry.
 * Value: {@code {"height":..,"index":..,"updated_at":<epoch ms>}}.
 */
public final class RedisCheckpointStore implements CheckpointStore {

    public static final String KEY_PREFIX = "chainkernel:checkpoint:";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final JedisPool jedisPool;

    public RedisCheckpointStore(JedisPool pool) {
        this.jedisPool = pool;
    }

    @Override
    public Optional<Checkpoint> load(String sourceId) throws CacheException {
        final String raw;
        try (Jedis jedis = jedisPool.getResource()) {
            raw = jedis.get(KEY_PREFIX + sourceId);
        } catch (Exception e) {
            throw new CacheException("Redis GET checkpoint failed for '" + sourceId + "': " + e.getMessage(), e);
        }
        return raw == null ? Optional.empty() : Optional.of(decode(sourceId, raw));
    }

    @Override
    public void save(Checkpoint checkpoint) throws CacheException {
        try (Jedis jedis = jedisPool.getResource()) {
            jedis.set(KEY_PREFIX + checkpoint.sourceId(), encode(checkpoint));
        } catch (Exception e) {
            throw new CacheException("Redis SET checkpoint failed for '" + checkpoint.sourceId() + "': " + e.getMessage(), e);
        }
    }

    @Override
    public void delete(String sourceId) throws CacheException {
        try (Jedis jedis = jedisPool.getResource()) {
            jedis.del(KEY_PREFIX + sourceId);
        } catch (Exception e) {
            throw new CacheException("Redis DEL checkpoint failed for '" + sourceId + "': " + e.getMessage(), e);
        }
    }

    @Override
    public void verify() throws CacheException {
        try (Jedis jedis = jedisPool.getResource()) {
            jedis.ping();
        } catch (Exception e) {
            throw new CacheException("Redis checkpoint store unreachable: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        if (jedisPool != null && !jedisPool.isClosed()) {
            jedisPool.close();
        }
    }

    static String encode(Checkpoint checkpoint) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("height", checkpoint.position().height());
        node.put("index", checkpoint.position().index());
        node.put("updated_at", checkpoint.updatedAt().toEpochMilli());
        return node.toString();
    }

    static Checkpoint decode(String sourceId, String raw) throws CacheException {
        try {
            JsonNode node = MAPPER.readTree(raw);
            if (!node.path("height").canConvertToLong() || !node.path("index").canConvertToInt()) {
                throw new CacheException("Corrupt checkpoint for '" + sourceId + "': " + raw);
            }
            return new Checkpoint(sourceId,
                    ChainPosition.of(node.get("height").asLong(), node.get("index").asInt()),
                    Instant.ofEpochMilli(node.path("updated_at").asLong(0)));
        } catch (IOException | IllegalArgumentException e) {
            throw new CacheException("Corrupt checkpoint for '" + sourceId + "': " + e.getMessage(), e);
        }
    }
}
