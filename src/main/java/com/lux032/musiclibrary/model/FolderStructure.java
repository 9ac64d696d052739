package com.lux032.musiclibrary.model;

import com.google.gson.annotations.SerializedName;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 乐队目录结构分析结果
 */
@Data
public class FolderStructure {

    private StructureType structureType = StructureType.UNKNOWN;
    private Consistency consistency = Consistency.UNKNOWN;
    private int albumsAnalyzed;
    private int albumsWithYearPrefix;
    private int albumsWithoutYearPrefix;
    private int albumsWithTypeFolders;
    private List<String> typeFoldersFound = new ArrayList<>();
    private List<String> recommendations = new ArrayList<>();

    public enum Consistency {
        @SerializedName("consistent")
        CONSISTENT,
        @SerializedName("mostly_consistent")
        MOSTLY_CONSISTENT,
        @SerializedName("inconsistent")
        INCONSISTENT,
        @SerializedName("unknown")
        UNKNOWN
    }
}
