package com.lux032.musiclibrary.scanner;

import com.lux032.musiclibrary.model.AlbumRecord;
import lombok.Data;

import java.nio.file.Path;

/**
 * 磁盘上发现的专辑文件夹
 */
@Data
public class DiscoveredAlbum {

    private Path folder;
    private String folderPath;     // 相对乐队目录，例如 "Live/1970 - Live at Leeds"
    private String typeFolder;     // 所在类型文件夹，平铺时为 null
    private ParsedAlbumFolder parsed;
    private int trackCount;

    public DiscoveredAlbum(Path folder, String folderPath, String typeFolder, ParsedAlbumFolder parsed, int trackCount) {
        this.folder = folder;
        this.folderPath = folderPath;
        this.typeFolder = typeFolder;
        this.parsed = parsed;
        this.trackCount = trackCount;
    }

    public boolean isInTypeFolder() {
        return typeFolder != null;
    }

    public AlbumRecord toAlbumRecord() {
        AlbumRecord record = new AlbumRecord(parsed.getAlbumName(), parsed.getYear(), parsed.getAlbumType(), parsed.getEdition());
        record.setTrackCount(trackCount);
        record.setFolderPath(folderPath);
        return record;
    }

    public String identityKey() {
        return toAlbumRecord().identityKey();
    }
}
