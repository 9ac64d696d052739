package com.lux032.musiclibrary.cache;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 收藏一致性检查结果，只报告问题，不做修复
 */
@Data
public class CollectionValidationReport {
    private boolean consistent;
    private CacheStatus indexStatus;
    private int indexedBands;
    private int bandFolders;
    private int validDocuments;
    private int expiredDocuments;
    private int corruptedDocuments;
    private int missingDocuments;
    private List<String> indexedWithoutFolder = new ArrayList<>();
    private List<String> foldersNotIndexed = new ArrayList<>();
    private List<String> inconsistencies = new ArrayList<>();
    private List<String> recommendations = new ArrayList<>();
}
