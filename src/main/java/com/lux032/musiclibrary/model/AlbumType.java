package com.lux032.musiclibrary.model;

/**
 * 专辑类型
 */
public enum AlbumType {
    ALBUM("Album", "albums"),
    EP("EP", "eps"),
    LIVE("Live", "lives"),
    DEMO("Demo", "demos"),
    COMPILATION("Compilation", "compilations"),
    SINGLE("Single", "singles"),
    INSTRUMENTAL("Instrumental", "instrumentals"),
    SPLIT("Split", "splits");

    private final String displayName;
    private final String pluralName;

    AlbumType(String displayName, String pluralName) {
        this.displayName = displayName;
        this.pluralName = pluralName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * 按显示名解析，忽略大小写，无法识别时返回 null
     */
    public static AlbumType fromString(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        for (AlbumType type : values()) {
            if (type.displayName.equalsIgnoreCase(trimmed) || type.name().equalsIgnoreCase(trimmed)) {
                return type;
            }
        }
        return null;
    }

    /**
     * 判断文件夹名是否是类型文件夹（Album/Albums、EP/EPs、Live/Lives ...）
     */
    public static AlbumType fromTypeFolderName(String folderName) {
        AlbumType exact = fromString(folderName);
        if (exact != null) {
            return exact;
        }
        if (folderName == null) {
            return null;
        }
        String lower = folderName.trim().toLowerCase();
        for (AlbumType type : values()) {
            if (type.pluralName.equals(lower)) {
                return type;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
