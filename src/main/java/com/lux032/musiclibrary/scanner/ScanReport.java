package com.lux032.musiclibrary.scanner;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 扫描报告
 * scan_errors 和 cache_warnings 不为空时扫描本身仍然是成功的
 */
@Data
public class ScanReport {
    private String status = "success";
    private String collectionPath;
    private int bandsDiscovered;
    private int bandsAdded;
    private int bandsRemoved;
    private int bandsUpdated;
    private int albumsDiscovered;
    private int totalTracks;
    private int missingAlbums;
    private List<String> scanErrors = new ArrayList<>();
    private List<String> cacheWarnings = new ArrayList<>();
    private List<String> changesDetected = new ArrayList<>();
    private boolean changesMade;
    private String scanTimestamp;
    private List<BandScanResult> bands = new ArrayList<>();
}
