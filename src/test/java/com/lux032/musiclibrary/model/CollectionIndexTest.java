package com.lux032.musiclibrary.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("收藏索引统计测试")
class CollectionIndexTest {

    @Test
    @DisplayName("统计从条目重新计算")
    void recomputeStats_fromEntries() {
        CollectionIndex index = new CollectionIndex();
        CollectionIndexEntry beatles = new CollectionIndexEntry("The Beatles", 2, 1, "The Beatles");
        beatles.setHasMetadata(true);
        CollectionIndexEntry queen = new CollectionIndexEntry("Queen", 3, 0, "Queen");
        queen.setHasAnalysis(true);
        index.upsert(beatles);
        index.upsert(queen);

        CollectionStats stats = index.getStats();
        assertEquals(2, stats.getTotalBands());
        assertEquals(6, stats.getTotalAlbums());
        assertEquals(5, stats.getTotalLocalAlbums());
        assertEquals(1, stats.getTotalMissingAlbums());
        assertEquals(1, stats.getBandsWithMetadata());
        assertEquals(1, stats.getBandsWithAnalysis());
        assertEquals(83.3, stats.getCompletionPercentage());
        assertEquals(3.0, stats.getAvgAlbumsPerBand());
        assertEquals("Queen", index.getBands().get(0).getName());
    }

    @Test
    @DisplayName("空索引完成度为 100")
    void recomputeStats_empty() {
        CollectionIndex index = new CollectionIndex();
        index.recomputeStats();

        assertEquals(0, index.getStats().getTotalBands());
        assertEquals(100.0, index.getStats().getCompletionPercentage());
        assertEquals(0.0, index.getStats().getAvgAlbumsPerBand());
    }

    @Test
    @DisplayName("替换条目时修正错误的 albums_count")
    void upsert_replacesAndCorrectsCounts() {
        CollectionIndex index = new CollectionIndex();
        index.upsert(new CollectionIndexEntry("Queen", 3, 0, "Queen"));

        CollectionIndexEntry replacement = new CollectionIndexEntry();
        replacement.setName("Queen");
        replacement.setLocalAlbumsCount(4);
        replacement.setMissingAlbumsCount(2);
        replacement.setAlbumsCount(99);
        index.upsert(replacement);

        assertEquals(1, index.getBands().size());
        assertEquals(6, index.getEntry("Queen").getAlbumsCount());
        assertEquals(6, index.getStats().getTotalAlbums());
    }

    @Test
    @DisplayName("移除乐队后统计更新")
    void remove_updatesStats() {
        CollectionIndex index = new CollectionIndex();
        index.upsert(new CollectionIndexEntry("Queen", 3, 0, "Queen"));
        index.upsert(new CollectionIndexEntry("Rush", 2, 2, "Rush"));

        assertTrue(index.remove("Rush"));
        assertFalse(index.remove("Rush"));
        assertEquals(1, index.getStats().getTotalBands());
        assertEquals(3, index.getStats().getTotalAlbums());
    }
}
