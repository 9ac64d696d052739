package com.lux032.musiclibrary.model;

import lombok.AccessLevel;
import lombok.Data;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 收藏索引，对应根目录下的 {@code .collection_index.json}
 */
@Data
public class CollectionIndex {

    public static final String FILE_NAME = ".collection_index.json";
    public static final String CURRENT_METADATA_VERSION = "2.0";

    @Setter(AccessLevel.NONE)
    private CollectionStats stats = new CollectionStats();
    private List<CollectionIndexEntry> bands = new ArrayList<>();
    private String lastScan;
    private String metadataVersion = CURRENT_METADATA_VERSION;

    public CollectionIndexEntry getEntry(String bandName) {
        if (bands == null || bandName == null) {
            return null;
        }
        for (CollectionIndexEntry entry : bands) {
            if (bandName.equals(entry.getName())) {
                return entry;
            }
        }
        return null;
    }

    /**
     * 新增或替换乐队条目
     */
    public void upsert(CollectionIndexEntry entry) {
        if (bands == null) {
            bands = new ArrayList<>();
        }
        entry.correctCounts();
        for (int i = 0; i < bands.size(); i++) {
            if (bands.get(i).getName().equals(entry.getName())) {
                bands.set(i, entry);
                recomputeStats();
                return;
            }
        }
        bands.add(entry);
        bands.sort(Comparator.comparing(CollectionIndexEntry::getName, String.CASE_INSENSITIVE_ORDER));
        recomputeStats();
    }

    public boolean remove(String bandName) {
        if (bands == null) {
            return false;
        }
        boolean removed = bands.removeIf(entry -> entry.getName().equals(bandName));
        if (removed) {
            recomputeStats();
        }
        return removed;
    }

    /**
     * 从条目重新计算统计，同时修正每个条目的计数
     */
    public void recomputeStats() {
        if (bands == null) {
            bands = new ArrayList<>();
        }
        bands.removeIf(entry -> entry == null || entry.getName() == null);

        CollectionStats computed = new CollectionStats();
        for (CollectionIndexEntry entry : bands) {
            entry.correctCounts();
            computed.setTotalAlbums(computed.getTotalAlbums() + entry.getAlbumsCount());
            computed.setTotalLocalAlbums(computed.getTotalLocalAlbums() + entry.getLocalAlbumsCount());
            computed.setTotalMissingAlbums(computed.getTotalMissingAlbums() + entry.getMissingAlbumsCount());
            if (entry.isHasMetadata()) {
                computed.setBandsWithMetadata(computed.getBandsWithMetadata() + 1);
            }
            if (entry.isHasAnalysis()) {
                computed.setBandsWithAnalysis(computed.getBandsWithAnalysis() + 1);
            }
        }
        computed.setTotalBands(bands.size());

        if (computed.getTotalAlbums() > 0) {
            computed.setCompletionPercentage(
                round(computed.getTotalLocalAlbums() * 100.0 / computed.getTotalAlbums(), 1));
        } else {
            computed.setCompletionPercentage(100.0);
        }
        if (computed.getTotalBands() > 0) {
            computed.setAvgAlbumsPerBand(
                round((double) computed.getTotalAlbums() / computed.getTotalBands(), 2));
        }
        this.stats = computed;
    }

    private static double round(double value, int scale) {
        double factor = Math.pow(10, scale);
        return Math.round(value * factor) / factor;
    }
}
