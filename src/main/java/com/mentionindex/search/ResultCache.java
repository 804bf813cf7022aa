package com.mentionindex.search;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 固定容量的结果缓存，按插入顺序淘汰（FIFO）。
 *
 * <p>读取不会改变条目位置：容量溢出时总是移除最早插入的条目。
 */
public class ResultCache<K, V> {

    private final int capacity;
    private final LinkedHashMap<K, V> entries = new LinkedHashMap<>();

    public ResultCache(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("缓存容量必须为正数: " + capacity);
        }
        this.capacity = capacity;
    }

    public Optional<V> get(K key) {
        return Optional.ofNullable(entries.get(key));
    }

    public void put(K key, V value) {
        if (!entries.containsKey(key) && entries.size() >= capacity) {
            Iterator<Map.Entry<K, V>> iterator = entries.entrySet().iterator();
            iterator.next();
            iterator.remove();
        }
        entries.put(key, value);
    }

    public boolean containsKey(K key) {
        return entries.containsKey(key);
    }

    public int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }

    public void clear() {
        entries.clear();
    }
}
