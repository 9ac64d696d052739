package com.lux032.musiclibrary.model;

import lombok.Data;

/**
 * 收藏统计，只由 {@link CollectionIndex#recomputeStats()} 计算
 */
@Data
public class CollectionStats {
    private int totalBands;
    private int totalAlbums;
    private int totalLocalAlbums;
    private int totalMissingAlbums;
    private int bandsWithMetadata;
    private int bandsWithAnalysis;
    private double completionPercentage;
    private double avgAlbumsPerBand;
}
