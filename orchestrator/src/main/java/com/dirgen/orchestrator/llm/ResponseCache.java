package com.dirgen.orchestrator.llm;

import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded cache of model replies for idempotent task classes.
 *
 * Key: MD5 of the first {@code prefixChars} characters of the system prompt and
 * of the user prompt. When full, the oldest fifth of the entries is dropped in
 * one go. All access is synchronized.
 */
public class ResponseCache {

    private final int capacity;
    private final int prefixChars;
    private final Map<String, String> entries = new LinkedHashMap<>();

    public ResponseCache(int capacity, int prefixChars) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got " + capacity);
        }
        this.capacity    = capacity;
        this.prefixChars = prefixChars;
    }

    public String key(String systemPrompt, String userPrompt) {
        String material = head(systemPrompt) + "|" + head(userPrompt);
        return DigestUtils.md5DigestAsHex(material.getBytes(StandardCharsets.UTF_8));
    }

    public synchronized Optional<String> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public synchronized void put(String key, String value) {
        if (!entries.containsKey(key) && entries.size() >= capacity) {
            evictOldest(Math.max(1, capacity / 5));
        }
        entries.put(key, value);
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized void clear() {
        entries.clear();
    }

    private void evictOldest(int count) {
        Iterator<String> it = entries.keySet().iterator();
        for (int i = 0; i < count && it.hasNext(); i++) {
            it.next();
            it.remove();
        }
    }

    private String head(String s) {
        if (s == null) {
            return "";
        }
        return s.length() <= prefixChars ? s : s.substring(0, prefixChars);
    }
}
