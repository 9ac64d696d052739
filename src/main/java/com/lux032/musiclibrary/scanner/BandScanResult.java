package com.lux032.musiclibrary.scanner;

import com.lux032.musiclibrary.model.StructureType;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 单个乐队的扫描结果
 */
@Data
public class BandScanResult {
    private String bandName;
    private String folderPath;
    private int albumsCount;
    private int localAlbumsCount;
    private int missingAlbumsCount;
    private int totalTracks;
    private boolean hasMetadata;
    private StructureType structureType;
    private Map<String, Integer> albumTypesDistribution = new LinkedHashMap<>();
}
