package com.lux032.musiclibrary.migration;

import com.lux032.musiclibrary.error.ErrorKind;
import com.lux032.musiclibrary.error.LibraryException;
import com.lux032.musiclibrary.model.AlbumRecord;
import com.lux032.musiclibrary.model.AlbumType;
import com.lux032.musiclibrary.model.BandDocument;
import com.lux032.musiclibrary.model.FolderStructure;
import com.lux032.musiclibrary.model.StructureType;
import com.lux032.musiclibrary.scanner.AlbumFolderParser;
import com.lux032.musiclibrary.scanner.DiscoveredAlbum;
import com.lux032.musiclibrary.util.I18nUtil;
import lombok.extern.slf4j.Slf4j;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 生成迁移计划
 *
 * <p>专辑类型的优先级: 请求中的覆盖 > 所在类型文件夹 > 元数据记录 > 从名称推断。
 * 目标文件夹名统一为 "YYYY - 专辑名 (版本)"，年份和版本缺失时取元数据记录中的值。
 */
@Slf4j
public class MigrationPlanner {

    /**
     * 检查迁移类型与当前结构是否匹配，force 时跳过
     */
    public void validate(MigrationRequest request, FolderStructure structure) throws LibraryException {
        if (request.getMigrationType() == null) {
            throw new LibraryException(ErrorKind.VALIDATION, I18nUtil.getMessage("migration.validation.type.missing"));
        }
        StructureType current = structure.getStructureType();
        if (current == StructureType.UNKNOWN) {
            throw new LibraryException(ErrorKind.VALIDATION,
                I18nUtil.getMessage("migration.validation.no.albums", request.getBandName()));
        }
        if (!request.isForce() && !request.getMigrationType().appliesTo(current)) {
            throw new LibraryException(ErrorKind.VALIDATION, I18nUtil.getMessage("migration.validation.structure.mismatch",
                request.getMigrationType().getValue(), current.getValue()));
        }
    }

    public MigrationPlan plan(MigrationRequest request, List<DiscoveredAlbum> albums, BandDocument document) {
        MigrationPlan plan = new MigrationPlan();
        MigrationType migrationType = request.getMigrationType();
        Set<String> excluded = lowerSet(request.getExcludeAlbums());
        Set<String> plannedTargets = new HashSet<>();
        // 已有的专辑文件夹也算占用的目标
        Set<String> occupied = new HashSet<>();
        for (DiscoveredAlbum album : albums) {
            occupied.add(album.getFolderPath().toLowerCase(Locale.ROOT));
        }

        for (DiscoveredAlbum album : albums) {
            String folderName = album.getFolder().getFileName().toString();
            String albumName = album.getParsed().getAlbumName();

            if (excluded.contains(folderName.toLowerCase(Locale.ROOT))
                    || excluded.contains(albumName.toLowerCase(Locale.ROOT))) {
                plan.getSkippedAlbums().add(I18nUtil.getMessage("migration.skip.excluded", album.getFolderPath()));
                continue;
            }
            // 类型文件夹里直接放了音轨，不能把它移进自己
            if (!album.isInTypeFolder() && AlbumType.fromTypeFolderName(folderName) != null) {
                plan.getSkippedAlbums().add(I18nUtil.getMessage("migration.skip.type.folder", album.getFolderPath()));
                continue;
            }

            AlbumRecord record = findRecord(document, album);
            AlbumType type = resolveType(request.getAlbumTypeOverrides(), album, record);

            String targetParent;
            switch (migrationType) {
                case DEFAULT_TO_ENHANCED:
                    if (album.isInTypeFolder()) {
                        continue;
                    }
                    targetParent = type.getDisplayName();
                    break;
                case MIXED_TO_ENHANCED:
                    targetParent = type.getDisplayName();
                    break;
                case ENHANCED_TO_DEFAULT:
                    if (!album.isInTypeFolder()) {
                        continue;
                    }
                    targetParent = "";
                    break;
                case LEGACY_TO_DEFAULT:
                default:
                    targetParent = album.isInTypeFolder() ? album.getTypeFolder() : "";
                    break;
            }

            String year = album.getParsed().getYear();
            if (year.isEmpty() && record != null && AlbumFolderParser.isValidYear(record.getYear())) {
                year = record.getYear();
            }
            if (migrationType == MigrationType.LEGACY_TO_DEFAULT && year.isEmpty()) {
                plan.getSkippedAlbums().add(I18nUtil.getMessage("migration.skip.no.year", album.getFolderPath()));
                continue;
            }
            String edition = album.getParsed().getEdition();
            if (edition.isEmpty() && record != null) {
                edition = record.getEdition();
            }

            String targetName = AlbumFolderParser.formatFolderName(albumName, year, edition);
            String targetPath = targetParent.isEmpty() ? targetName : targetParent + "/" + targetName;
            if (targetPath.equals(album.getFolderPath())) {
                continue;
            }
            String targetKey = targetPath.toLowerCase(Locale.ROOT);
            boolean caseOnlyRename = targetKey.equals(album.getFolderPath().toLowerCase(Locale.ROOT));
            if ((occupied.contains(targetKey) && !caseOnlyRename) || !plannedTargets.add(targetKey)) {
                plan.getSkippedAlbums().add(I18nUtil.getMessage("migration.skip.duplicate.target",
                    album.getFolderPath(), targetPath));
                continue;
            }

            String sourceParent = album.isInTypeFolder() ? album.getTypeFolder() : "";
            OperationType operationType = sourceParent.equals(targetParent) ? OperationType.RENAME : OperationType.MOVE;
            MigrationOperation operation = new MigrationOperation(albumName, album.getFolderPath(), targetPath,
                type, operationType);
            operation.setYear(year);
            operation.setEdition(edition);
            plan.getOperations().add(operation);
        }

        log.info("迁移计划 [{}] {}: {} 个操作, {} 个专辑跳过", migrationType.getValue(), request.getBandName(),
            plan.getOperations().size(), plan.getSkippedAlbums().size());
        return plan;
    }

    AlbumType resolveType(Map<String, AlbumType> overrides, DiscoveredAlbum album, AlbumRecord record) {
        if (overrides != null && !overrides.isEmpty()) {
            String folderName = album.getFolder().getFileName().toString();
            for (Map.Entry<String, AlbumType> entry : overrides.entrySet()) {
                String key = entry.getKey();
                if (entry.getValue() != null && (key.equalsIgnoreCase(folderName)
                        || key.equalsIgnoreCase(album.getParsed().getAlbumName())
                        || key.equalsIgnoreCase(album.getFolderPath()))) {
                    return entry.getValue();
                }
            }
        }
        if (album.getParsed().isTypeFromFolder()) {
            return album.getParsed().getAlbumType();
        }
        if (record != null && record.getType() != null) {
            return record.getType();
        }
        return album.getParsed().getAlbumType();
    }

    /**
     * 先按 folder_path 匹配，再按专辑名加兼容的年份匹配
     */
    static AlbumRecord findRecord(BandDocument document, DiscoveredAlbum album) {
        if (document == null || document.getAlbums() == null) {
            return null;
        }
        for (AlbumRecord record : document.getAlbums()) {
            if (album.getFolderPath().equalsIgnoreCase(record.getFolderPath())) {
                return record;
            }
        }
        String year = album.getParsed().getYear();
        for (AlbumRecord record : document.getAlbums()) {
            if (album.getParsed().getAlbumName().equalsIgnoreCase(record.getAlbumName())
                    && (year.isEmpty() || record.getYear() == null || record.getYear().isEmpty()
                        || year.equals(record.getYear()))) {
                return record;
            }
        }
        return null;
    }

    private static Set<String> lowerSet(List<String> values) {
        Set<String> result = new HashSet<>();
        if (values != null) {
            for (String value : values) {
                if (value != null) {
                    result.add(value.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        return result;
    }
}
