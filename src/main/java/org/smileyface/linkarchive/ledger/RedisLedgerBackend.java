package org.smileyface.linkarchive.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.smileyface.linkarchive.error.StorageException;
import org.smileyface.linkarchive.model.FailureRecord;
import org.smileyface.linkarchive.model.PermanentFailureEntry;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.Map;
import java.util.TreeMap;

/**
 * Redis-backed ledger, shared by pipeline runs on different hosts.
 *
 * Uses two Redis hashes: "{ns}:failures" (article id to failure record JSON) and
 * "{ns}:permanent" (article id to permanent entry JSON). Permanent entries are only ever
 * added with HSETNX so the first recorded failure details are kept.
 */
public class RedisLedgerBackend implements LedgerBackend {

    private final StringRedisTemplate redis;
    private final ObjectMapper mapper;
    private final String failuresKey;
    private final String permanentKey;

    public RedisLedgerBackend(StringRedisTemplate redisTemplate, ObjectMapper mapper, String namespace) {
        this.redis = redisTemplate;
        this.mapper = mapper;
        String ns = (namespace == null || namespace.isBlank()) ? "archiver" : namespace;
        this.failuresKey = ns + ":failures";
        this.permanentKey = ns + ":permanent";
    }

    @Override
    public Map<String, FailureRecord> loadFailures() {
        return loadHash(failuresKey, FailureRecord.class);
    }

    @Override
    public Map<String, PermanentFailureEntry> loadPermanent() {
        return loadHash(permanentKey, PermanentFailureEntry.class);
    }

    @Override
    public void saveFailure(FailureRecord record) {
        String json = toJson(record);
        try {
            redis.opsForHash().put(failuresKey, record.articleId(), json);
        } catch (DataAccessException e) {
            throw new StorageException("Cannot save failure record of " + record.articleId() + " to Redis", e);
        }
    }

    @Override
    public void appendPermanent(String articleId, PermanentFailureEntry entry) {
        String json = toJson(entry);
        try {
            redis.opsForHash().putIfAbsent(permanentKey, articleId, json);
        } catch (DataAccessException e) {
            throw new StorageException("Cannot append permanent failure " + articleId + " to Redis", e);
        }
    }

    @Override
    public void removePermanent(String articleId) {
        try {
            redis.opsForHash().delete(permanentKey, articleId);
        } catch (DataAccessException e) {
            throw new StorageException("Cannot remove permanent failure " + articleId + " from Redis", e);
        }
    }

    @Override
    public String name() {
        return "redis";
    }

    /** Deletes both hashes. Used by tests to start from an empty ledger. */
    public void reset() {
        try {
            redis.delete(failuresKey);
            redis.delete(permanentKey);
        } catch (DataAccessException e) {
            throw new StorageException("Cannot reset Redis ledger", e);
        }
    }

    private <T> Map<String, T> loadHash(String key, Class<T> type) {
        Map<Object, Object> raw;
        try {
            raw = redis.opsForHash().entries(key);
        } catch (DataAccessException e) {
            throw new StorageException("Cannot load " + key + " from Redis", e);
        }
        Map<String, T> out = new TreeMap<>();
        for (Map.Entry<Object, Object> e : raw.entrySet()) {
            try {
                out.put(String.valueOf(e.getKey()), mapper.readValue(String.valueOf(e.getValue()), type));
            } catch (JsonProcessingException ex) {
                throw new StorageException("Corrupt ledger entry " + e.getKey() + " in " + key, ex);
            }
        }
        return out;
    }

    private String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StorageException("Cannot serialize ledger entry", e);
        }
    }
}
