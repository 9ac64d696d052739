package com.lux032.musiclibrary.model;

import com.lux032.musiclibrary.LibraryFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("乐队文档不变式测试")
class BandDocumentTest {

    @Test
    @DisplayName("同一专辑同时在本地和缺失列表时保留本地")
    void normalizeAlbums_localWinsOverMissing() {
        BandDocument document = new BandDocument("Pink Floyd");
        document.getAlbums().add(LibraryFixtures.record("Animals", "1977", AlbumType.ALBUM, 5, "1977 - Animals"));
        document.getAlbumsMissing().add(LibraryFixtures.record("animals", "1977", AlbumType.ALBUM, 0, ""));
        document.getAlbumsMissing().add(LibraryFixtures.record("Meddle", "1971", AlbumType.ALBUM, 0, ""));

        document.normalizeAlbums();

        assertEquals(1, document.getAlbums().size());
        assertEquals(1, document.getAlbumsMissing().size());
        assertEquals("Meddle", document.getAlbumsMissing().get(0).getAlbumName());
        assertEquals(2, document.getAlbumsCount());
    }

    @Test
    @DisplayName("版本不同的同名专辑是不同专辑")
    void normalizeAlbums_editionsAreDistinct() {
        BandDocument document = new BandDocument("Pink Floyd");
        document.getAlbums().add(new AlbumRecord("Wish You Were Here", "1975", AlbumType.ALBUM, ""));
        document.getAlbums().add(new AlbumRecord("Wish You Were Here", "1975", AlbumType.ALBUM, "Remastered"));
        document.getAlbums().add(new AlbumRecord("Wish You Were Here", "1975", AlbumType.ALBUM, ""));
        document.getAlbums().add(new AlbumRecord(" ", "1975", AlbumType.ALBUM, ""));

        document.normalizeAlbums();

        assertEquals(2, document.getAlbums().size());
        assertEquals(2, document.getAlbumsCount());
    }

    @Test
    @DisplayName("反序列化留下的 null 字段被补齐")
    void normalizeAlbums_fillsNullFields() {
        BandDocument document = new BandDocument("Pink Floyd");
        AlbumRecord record = new AlbumRecord();
        record.setAlbumName("Meddle");
        record.setYear(null);
        record.setType(null);
        record.setGenres(null);
        document.getAlbums().add(record);
        document.setAlbumsMissing(null);
        document.setGenres(null);

        document.normalizeAlbums();

        assertEquals("", record.getYear());
        assertEquals(AlbumType.ALBUM, record.getType());
        assertNotNull(record.getGenres());
        assertNotNull(document.getAlbumsMissing());
        assertNotNull(document.getGenres());
        assertEquals(1, document.getAlbumsCount());
    }

    @Test
    @DisplayName("曲目数不会为负")
    void setTrackCount_clampsNegative() {
        AlbumRecord record = new AlbumRecord("Animals", "1977", AlbumType.ALBUM, "");
        record.setTrackCount(-3);
        assertEquals(0, record.getTrackCount());
    }
}
