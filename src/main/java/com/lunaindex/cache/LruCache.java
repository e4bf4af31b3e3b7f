package com.lunaindex.cache;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

// not thread-safe; the owner serializes access
public class LruCache<K, V> {
    public static final int DEFAULT_CAPACITY = 100;

    private final int capacity;
    private final LinkedHashMap<K, V> entries;

    public LruCache() {
        this(DEFAULT_CAPACITY);
    }

    public LruCache(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.capacity = capacity;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                return size() > LruCache.this.capacity;
            }
        };
    }

    public Optional<V> get(K key) {
        return Optional.ofNullable(entries.get(key));
    }

    public void set(K key, V value) {
        if (value == null) {
            throw new IllegalArgumentException("value must not be null");
        }
        entries.put(key, value);
    }

    public boolean has(K key) {
        return entries.containsKey(key);
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }
}
