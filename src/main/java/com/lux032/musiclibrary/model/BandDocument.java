package com.lux032.musiclibrary.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 单个乐队的元数据文档，对应 {@code <Band>/.band_metadata.json}
 */
@Data
public class BandDocument {

    public static final String FILE_NAME = ".band_metadata.json";

    private String bandName;
    private String formed = "";
    private List<String> genres = new ArrayList<>();
    private String origin = "";
    private List<String> members = new ArrayList<>();
    private String description = "";
    private List<AlbumRecord> albums = new ArrayList<>();
    private List<AlbumRecord> albumsMissing = new ArrayList<>();
    private int albumsCount;
    private BandAnalysis analysis;
    private FolderStructure folderStructure;
    private String lastUpdated;
    private String lastMetadataSaved;

    public BandDocument() {
    }

    public BandDocument(String bandName) {
        this.bandName = bandName;
    }

    /**
     * 维护专辑不变式:
     * 同一专辑键只能出现在 albums 或 albums_missing 之一（本地优先），
     * albums_count = albums + albums_missing
     */
    public void normalizeAlbums() {
        if (genres == null) {
            genres = new ArrayList<>();
        }
        if (members == null) {
            members = new ArrayList<>();
        }
        albums = dedupe(albums, new LinkedHashSet<>());

        Set<String> localKeys = new LinkedHashSet<>();
        for (AlbumRecord album : albums) {
            localKeys.add(album.identityKey());
        }
        albumsMissing = dedupe(albumsMissing, localKeys);
        albumsCount = albums.size() + albumsMissing.size();
    }

    private static List<AlbumRecord> dedupe(List<AlbumRecord> source, Set<String> seen) {
        List<AlbumRecord> result = new ArrayList<>();
        if (source == null) {
            return result;
        }
        Set<String> keys = new LinkedHashSet<>(seen);
        for (AlbumRecord album : source) {
            if (album == null || album.getAlbumName() == null || album.getAlbumName().trim().isEmpty()) {
                continue;
            }
            album.normalize();
            if (keys.add(album.identityKey())) {
                result.add(album);
            }
        }
        return result;
    }

    public int getLocalAlbumsCount() {
        return albums != null ? albums.size() : 0;
    }

    public int getMissingAlbumsCount() {
        return albumsMissing != null ? albumsMissing.size() : 0;
    }
}
