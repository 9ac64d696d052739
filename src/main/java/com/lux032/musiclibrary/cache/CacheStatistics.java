package com.lux032.musiclibrary.cache;

import lombok.Data;

/**
 * 缓存统计
 */
@Data
public class CacheStatistics {
    private int cacheDurationDays;
    private int totalDocuments;
    private int validDocuments;
    private int expiredDocuments;
    private int corruptedDocuments;
    private long totalSizeBytes;
    private String oldestDocument;
    private String newestDocument;
    private CacheStatus indexStatus;
}
