package com.lux032.musiclibrary.scanner;

import com.lux032.musiclibrary.model.AlbumType;
import lombok.Data;

/**
 * 专辑文件夹名解析结果
 */
@Data
public class ParsedAlbumFolder {
    private String folderName;
    private String albumName;
    private String year = "";
    private String edition = "";
    private AlbumFolderParser.PatternType patternType;
    private AlbumType albumType = AlbumType.ALBUM;
    private boolean typeFromFolder;   // 类型来自类型文件夹，而不是从名称推断

    public boolean hasYear() {
        return year != null && !year.isEmpty();
    }
}
