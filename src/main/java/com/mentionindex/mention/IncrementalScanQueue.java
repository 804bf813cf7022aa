package com.mentionindex.mention;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * 有界、去重、先进先出的待扫描文档队列。
 */
final class IncrementalScanQueue {

    private final int capacity;
    private final LinkedHashSet<String> pending = new LinkedHashSet<>();

    IncrementalScanQueue(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("队列容量必须为正数: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * 入队；已在队列中视为成功，队满时拒绝。
     */
    boolean offer(String documentId) {
        if (pending.contains(documentId)) {
            return true;
        }
        if (pending.size() >= capacity) {
            return false;
        }
        return pending.add(documentId);
    }

    List<String> drain(int maxItems) {
        List<String> batch = new ArrayList<>(Math.min(maxItems, pending.size()));
        Iterator<String> iterator = pending.iterator();
        while (iterator.hasNext() && batch.size() < maxItems) {
            batch.add(iterator.next());
            iterator.remove();
        }
        return batch;
    }

    boolean isEmpty() {
        return pending.isEmpty();
    }

    int size() {
        return pending.size();
    }

    void clear() {
        pending.clear();
    }
}
