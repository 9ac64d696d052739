package com.lux032.musiclibrary.scanner;

import com.lux032.musiclibrary.model.FolderStructure;
import com.lux032.musiclibrary.model.StructureType;
import com.lux032.musiclibrary.util.I18nUtil;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 根据发现的专辑文件夹判断乐队目录结构
 */
public class BandStructureDetector {

    public FolderStructure detect(List<DiscoveredAlbum> albums) {
        FolderStructure structure = new FolderStructure();
        structure.setAlbumsAnalyzed(albums.size());
        if (albums.isEmpty()) {
            return structure;
        }

        Set<String> typeFolders = new LinkedHashSet<>();
        Set<String> patterns = new HashSet<>();
        int direct = 0;
        for (DiscoveredAlbum album : albums) {
            if (album.isInTypeFolder()) {
                typeFolders.add(album.getTypeFolder());
                structure.setAlbumsWithTypeFolders(structure.getAlbumsWithTypeFolders() + 1);
            } else {
                direct++;
            }
            if (album.getParsed().getPatternType().isYearPrefixed()) {
                structure.setAlbumsWithYearPrefix(structure.getAlbumsWithYearPrefix() + 1);
            } else {
                structure.setAlbumsWithoutYearPrefix(structure.getAlbumsWithoutYearPrefix() + 1);
            }
            patterns.add((album.isInTypeFolder() ? "enhanced_" : "") + album.getParsed().getPatternType());
        }
        structure.getTypeFoldersFound().addAll(typeFolders);

        if (!typeFolders.isEmpty()) {
            structure.setStructureType(direct == 0 ? StructureType.ENHANCED : StructureType.MIXED);
        } else if (structure.getAlbumsWithoutYearPrefix() > 0) {
            structure.setStructureType(StructureType.LEGACY);
        } else {
            structure.setStructureType(StructureType.DEFAULT);
        }

        if (patterns.size() <= 1) {
            structure.setConsistency(FolderStructure.Consistency.CONSISTENT);
        } else if (patterns.size() == 2) {
            structure.setConsistency(FolderStructure.Consistency.MOSTLY_CONSISTENT);
        } else {
            structure.setConsistency(FolderStructure.Consistency.INCONSISTENT);
        }

        addRecommendations(structure);
        return structure;
    }

    private void addRecommendations(FolderStructure structure) {
        List<String> recommendations = structure.getRecommendations();
        if (structure.getConsistency() == FolderStructure.Consistency.INCONSISTENT) {
            recommendations.add(I18nUtil.getMessage("structure.recommend.standardize"));
        }
        switch (structure.getStructureType()) {
            case LEGACY:
                recommendations.add(I18nUtil.getMessage("structure.recommend.legacy"));
                break;
            case MIXED:
                recommendations.add(I18nUtil.getMessage("structure.recommend.mixed"));
                break;
            case DEFAULT:
                recommendations.add(I18nUtil.getMessage("structure.recommend.default"));
                break;
            default:
                break;
        }
        if (structure.getStructureType() != StructureType.LEGACY && structure.getAlbumsWithoutYearPrefix() > 0) {
            recommendations.add(I18nUtil.getMessage("structure.recommend.add.year", structure.getAlbumsWithoutYearPrefix()));
        }
    }
}
