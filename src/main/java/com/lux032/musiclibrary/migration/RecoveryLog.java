package com.lux032.musiclibrary.migration;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * 恢复日志，进程内保留最近的条目，可被多个迁移线程同时写入
 */
public class RecoveryLog {

    public static final int DEFAULT_MAX_SIZE = 500;

    private final int maxSize;
    private final ConcurrentLinkedQueue<RecoveryLogEntry> entries = new ConcurrentLinkedQueue<>();

    public RecoveryLog() {
        this(DEFAULT_MAX_SIZE);
    }

    public RecoveryLog(int maxSize) {
        this.maxSize = Math.max(1, maxSize);
    }

    public void add(RecoveryLogEntry entry) {
        entries.offer(entry);

        // 超过上限时丢弃最旧的条目
        while (entries.size() > maxSize) {
            entries.poll();
        }
    }

    /**
     * 最近的 limit 条，旧的在前
     */
    public List<RecoveryLogEntry> getRecentEntries(int limit) {
        Object[] array = entries.toArray();
        int startIndex = Math.max(0, array.length - limit);
        List<RecoveryLogEntry> result = new ArrayList<>();
        for (int i = startIndex; i < array.length; i++) {
            result.add((RecoveryLogEntry) array[i]);
        }
        return result;
    }

    public List<RecoveryLogEntry> getEntries() {
        return new ArrayList<>(entries);
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }
}
