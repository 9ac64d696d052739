package com.lux032.musiclibrary.cache;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 单个乐队文档的缓存检查结果
 */
@Data
public class CacheValidationReport {
    private String bandName;
    private CacheStatus status;
    private long fileSizeBytes;
    private double ageDays;
    private String lastModified;
    private List<String> recommendations = new ArrayList<>();
}
