package com.autopost.scheduler.service;

import com.autopost.scheduler.dto.ScheduleEntry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Per-account calendar kept in Redis: one hash per account ({@code schedule:<accountId>},
 * field = post id) and a set of the accounts that have one. It is derived from the post
 * store, so write failures are logged and left for the next rebuild.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ScheduleIndex {

    static final String KEY_PREFIX = "schedule:";
    static final String ACCOUNTS_KEY = "schedule:accounts";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    public void put(ScheduleEntry entry) {
        try {
            redisTemplate.opsForHash().put(key(entry.getAccountId()), entry.getPostId().toString(), serialize(entry));
            redisTemplate.opsForSet().add(ACCOUNTS_KEY, entry.getAccountId());
        } catch (DataAccessException e) {
            log.warn("Could not index post {} for account {}: {}", entry.getPostId(), entry.getAccountId(), e.getMessage());
        }
    }

    public void remove(String accountId, UUID postId) {
        try {
            redisTemplate.opsForHash().delete(key(accountId), postId.toString());
        } catch (DataAccessException e) {
            log.warn("Could not remove post {} from the index of account {}: {}", postId, accountId, e.getMessage());
        }
    }

    /**
     * Entries of one account ordered by scheduled time, or none when Redis cannot be read.
     */
    public List<ScheduleEntry> entries(String accountId) {
        Map<Object, Object> raw;
        try {
            raw = redisTemplate.opsForHash().entries(key(accountId));
        } catch (DataAccessException e) {
            log.warn("Could not read the index of account {}: {}", accountId, e.getMessage());
            return List.of();
        }
        List<ScheduleEntry> entries = new ArrayList<>();
        for (Object value : raw.values()) {
            entries.add(deserialize((String) value));
        }
        entries.sort(Comparator.comparing(ScheduleEntry::getScheduledTime,
                Comparator.nullsLast(Comparator.naturalOrder())));
        return entries;
    }

    public Set<String> accounts() {
        try {
            Set<String> accounts = redisTemplate.opsForSet().members(ACCOUNTS_KEY);
            return accounts != null ? accounts : Set.of();
        } catch (DataAccessException e) {
            log.warn("Could not read the indexed accounts: {}", e.getMessage());
            return Set.of();
        }
    }

    /**
     * Drops every account's calendar and writes the given entries instead.
     */
    public void replaceAll(Collection<ScheduleEntry> entries) {
        Set<String> known = accounts();
        try {
            for (String accountId : known) {
                redisTemplate.delete(key(accountId));
            }
            redisTemplate.delete(ACCOUNTS_KEY);
        } catch (DataAccessException e) {
            log.warn("Could not clear the schedule index before rebuilding: {}", e.getMessage());
        }
        for (ScheduleEntry entry : entries) {
            put(entry);
        }
        log.info("Schedule index rebuilt: {} entries, {} account(s) cleared", entries.size(), known.size());
    }

    private String key(String accountId) {
        return KEY_PREFIX + accountId;
    }

    private String serialize(ScheduleEntry entry) {
        try {
            return objectMapper.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize schedule entry", e);
        }
    }

    private ScheduleEntry deserialize(String payload) {
        try {
            return objectMapper.readValue(payload, ScheduleEntry.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize schedule entry", e);
        }
    }
}
