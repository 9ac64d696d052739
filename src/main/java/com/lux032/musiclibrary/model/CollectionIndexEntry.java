package com.lux032.musiclibrary.model;

import lombok.Data;

/**
 * 索引中一个乐队的摘要
 */
@Data
public class CollectionIndexEntry {

    private String name;
    private int albumsCount;
    private int localAlbumsCount;
    private int missingAlbumsCount;
    private String folderPath = "";
    private boolean hasMetadata;
    private boolean hasAnalysis;
    private String lastUpdated;

    public CollectionIndexEntry() {
    }

    public CollectionIndexEntry(String name, int localAlbumsCount, int missingAlbumsCount, String folderPath) {
        this.name = name;
        this.localAlbumsCount = localAlbumsCount;
        this.missingAlbumsCount = missingAlbumsCount;
        this.folderPath = folderPath;
        correctCounts();
    }

    /**
     * 根据乐队文档生成索引条目，条目名取乐队目录名，与文档内的 band_name 无关
     */
    public static CollectionIndexEntry fromDocument(BandDocument document, String folderPath) {
        CollectionIndexEntry entry = new CollectionIndexEntry(
            folderPath,
            document.getLocalAlbumsCount(),
            document.getMissingAlbumsCount(),
            folderPath);
        entry.setHasMetadata(document.getLastMetadataSaved() != null);
        entry.setHasAnalysis(document.getAnalysis() != null);
        entry.setLastUpdated(document.getLastUpdated());
        return entry;
    }

    /**
     * 修正计数: albums_count 始终等于 local + missing
     */
    public void correctCounts() {
        if (localAlbumsCount < 0) {
            localAlbumsCount = 0;
        }
        if (missingAlbumsCount < 0) {
            missingAlbumsCount = 0;
        }
        albumsCount = localAlbumsCount + missingAlbumsCount;
        if (folderPath == null) {
            folderPath = "";
        }
    }
}
