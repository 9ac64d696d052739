package com.lux032.musiclibrary.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 专辑元数据
 */
@Data
public class AlbumRecord {

    private String albumName;
    private String year = "";
    private AlbumType type = AlbumType.ALBUM;
    private String edition = "";
    private int trackCount;
    private String duration = "";
    private List<String> genres = new ArrayList<>();
    private String folderPath = "";

    public AlbumRecord() {
    }

    public AlbumRecord(String albumName, String year, AlbumType type, String edition) {
        this.albumName = albumName;
        this.year = year != null ? year : "";
        this.type = type != null ? type : AlbumType.ALBUM;
        this.edition = edition != null ? edition : "";
    }

    public void setTrackCount(int trackCount) {
        this.trackCount = Math.max(0, trackCount);
    }

    /**
     * 专辑身份键: (名称, 年份, 类型, 版本)，忽略大小写
     */
    public String identityKey() {
        return lower(albumName) + "|" + nullToEmpty(year).trim() + "|"
            + (type != null ? type.getDisplayName() : AlbumType.ALBUM.getDisplayName()).toLowerCase(Locale.ROOT)
            + "|" + lower(edition);
    }

    /**
     * 补齐反序列化后可能为 null 的字段
     */
    public void normalize() {
        year = nullToEmpty(year);
        edition = nullToEmpty(edition);
        duration = nullToEmpty(duration);
        folderPath = nullToEmpty(folderPath);
        if (type == null) {
            type = AlbumType.ALBUM;
        }
        if (genres == null) {
            genres = new ArrayList<>();
        }
        if (trackCount < 0) {
            trackCount = 0;
        }
    }

    private static String lower(String value) {
        return nullToEmpty(value).trim().toLowerCase(Locale.ROOT);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
