package com.lux032.musiclibrary.cache;

import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.lux032.musiclibrary.error.ErrorKind;
import com.lux032.musiclibrary.error.LibraryException;
import com.lux032.musiclibrary.model.BandDocument;
import com.lux032.musiclibrary.model.CollectionIndex;
import com.lux032.musiclibrary.model.CollectionIndexEntry;
import com.lux032.musiclibrary.storage.AtomicFileStore;
import com.lux032.musiclibrary.storage.BackupMode;
import com.lux032.musiclibrary.storage.BandDocumentRepository;
import com.lux032.musiclibrary.storage.CollectionIndexRepository;
import com.lux032.musiclibrary.storage.DocumentSchemaMigrator;
import com.lux032.musiclibrary.util.I18nUtil;
import com.lux032.musiclibrary.util.LibraryLayout;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 缓存有效性检查和结构升级
 *
 * <p>文档超过有效期视为过期；在有效期内但无法解析视为损坏。
 * 一致性检查只报告问题，不修改任何文件。
 */
@Slf4j
public class CacheValidator {

    private final Path musicRoot;
    private final AtomicFileStore store;
    private final BandDocumentRepository bandRepository;
    private final CollectionIndexRepository indexRepository;
    private final DocumentSchemaMigrator schemaMigrator;
    private final Duration ttl;
    private final Clock clock;

    public CacheValidator(Path musicRoot, AtomicFileStore store, BandDocumentRepository bandRepository,
                          CollectionIndexRepository indexRepository, DocumentSchemaMigrator schemaMigrator,
                          Duration ttl, Clock clock) {
        this.musicRoot = musicRoot;
        this.store = store;
        this.bandRepository = bandRepository;
        this.indexRepository = indexRepository;
        this.schemaMigrator = schemaMigrator;
        this.ttl = ttl;
        this.clock = clock;
    }

    public Duration getTtl() {
        return ttl;
    }

    /**
     * 检查任意 JSON 文档的状态
     */
    public CacheStatus status(Path path) throws LibraryException {
        return status(path, null);
    }

    /**
     * 检查乐队文档状态，额外校验能否映射为 {@link BandDocument}
     */
    public CacheStatus bandStatus(String bandName) throws LibraryException {
        return status(bandRepository.documentPath(bandName), BandDocument.class);
    }

    private CacheStatus status(Path path, Class<?> structure) throws LibraryException {
        if (!Files.exists(path)) {
            return CacheStatus.MISSING;
        }
        if (isExpired(path)) {
            return CacheStatus.EXPIRED;
        }
        try {
            JsonObject tree = store.loadTree(path);
            if (structure != null) {
                store.getGson().fromJson(tree, structure);
            }
            return CacheStatus.VALID;
        } catch (JsonParseException | IllegalStateException | NumberFormatException e) {
            log.warn("文档结构无效: {} - {}", path, e.getMessage());
            return CacheStatus.CORRUPTED;
        } catch (LibraryException e) {
            switch (e.getKind()) {
                case DOCUMENT_CORRUPT:
                    log.warn("文档已损坏: {}", path);
                    return CacheStatus.CORRUPTED;
                case DOCUMENT_NOT_FOUND:
                    return CacheStatus.MISSING;
                default:
                    throw e;
            }
        }
    }

    private boolean isExpired(Path path) throws LibraryException {
        return Duration.between(lastModified(path), clock.instant()).compareTo(ttl) > 0;
    }

    private Instant lastModified(Path path) throws LibraryException {
        try {
            return Files.getLastModifiedTime(path).toInstant();
        } catch (IOException e) {
            throw new LibraryException(ErrorKind.STORAGE_IO, "无法读取文件修改时间: " + path, e);
        }
    }

    /**
     * 单个乐队文档的详细检查
     */
    public CacheValidationReport validateBand(String bandName) throws LibraryException {
        Path path = bandRepository.documentPath(bandName);
        CacheValidationReport report = new CacheValidationReport();
        report.setBandName(bandName);
        report.setStatus(bandStatus(bandName));

        if (report.getStatus() != CacheStatus.MISSING) {
            Instant modified = lastModified(path);
            try {
                report.setFileSizeBytes(Files.size(path));
            } catch (IOException e) {
                throw new LibraryException(ErrorKind.STORAGE_IO, "无法读取文件大小: " + path, e);
            }
            report.setAgeDays(Math.round(Duration.between(modified, clock.instant()).toHours() / 24.0 * 10) / 10.0);
            report.setLastModified(format(modified));
        }

        switch (report.getStatus()) {
            case MISSING:
                report.getRecommendations().add(I18nUtil.getMessage("cache.recommendation.missing", bandName));
                break;
            case EXPIRED:
                report.getRecommendations().add(I18nUtil.getMessage("cache.recommendation.expired", ttl.toDays()));
                break;
            case CORRUPTED:
                report.getRecommendations().add(I18nUtil.getMessage("cache.recommendation.corrupted"));
                break;
            default:
                break;
        }
        return report;
    }

    /**
     * 纯内存结构升级，不写文件
     */
    public SchemaMigrationOutcome migrate(JsonObject document, String targetVersion) throws LibraryException {
        requireSupported(targetVersion);
        return new SchemaMigrationOutcome(targetVersion, schemaMigrator.upgradeBand(document, targetVersion));
    }

    /**
     * 升级磁盘上的乐队文档，有变化时先写带时间戳的备份
     */
    public SchemaMigrationOutcome migrateDocument(Path path, String targetVersion) throws LibraryException {
        requireSupported(targetVersion);
        if (!Files.exists(path)) {
            throw new LibraryException(ErrorKind.DOCUMENT_NOT_FOUND, "文档不存在: " + path);
        }
        List<String> changes = new ArrayList<>();
        store.update(path, (JsonObject tree) -> tree, (JsonObject tree) -> {
            if (tree == null) {
                return null;
            }
            changes.addAll(schemaMigrator.upgradeBand(tree, targetVersion));
            return changes.isEmpty() ? null : tree;
        }, BackupMode.TIMESTAMPED);

        SchemaMigrationOutcome outcome = new SchemaMigrationOutcome(targetVersion, changes);
        if (outcome.isChanged()) {
            Path backup = store.latestTimestampedBackup(path);
            outcome.setBackupPath(backup != null ? backup.toString() : null);
            log.info("文档结构已升级到 {}: {} {}", targetVersion, path, changes);
        }
        return outcome;
    }

    /**
     * 升级全部乐队文档和索引版本号，单个文档失败不影响其他文档
     */
    public SchemaMigrationReport migrateCollection(String targetVersion) throws LibraryException {
        requireSupported(targetVersion);
        SchemaMigrationReport report = new SchemaMigrationReport();
        report.setTargetVersion(targetVersion);

        for (Path folder : bandFolders()) {
            Path documentPath = folder.resolve(BandDocument.FILE_NAME);
            if (!Files.exists(documentPath)) {
                continue;
            }
            report.setDocumentsChecked(report.getDocumentsChecked() + 1);
            try {
                if (migrateDocument(documentPath, targetVersion).isChanged()) {
                    report.setDocumentsMigrated(report.getDocumentsMigrated() + 1);
                    report.getMigratedBands().add(folder.getFileName().toString());
                }
            } catch (LibraryException e) {
                log.warn("乐队文档升级失败: {} - {}", folder.getFileName(), e.getMessage());
                report.getErrors().add(folder.getFileName() + ": " + e.getMessage());
            }
        }

        Path indexPath = indexRepository.indexPath();
        if (Files.exists(indexPath)) {
            try {
                JsonObject updated = store.update(indexPath, (JsonObject tree) -> tree, (JsonObject tree) -> {
                    if (tree == null) {
                        return null;
                    }
                    return schemaMigrator.upgradeIndex(tree, targetVersion).isEmpty() ? null : tree;
                }, BackupMode.TIMESTAMPED);
                report.setIndexMigrated(updated != null);
            } catch (LibraryException e) {
                log.warn("索引升级失败: {}", e.getMessage());
                report.getErrors().add(CollectionIndex.FILE_NAME + ": " + e.getMessage());
            }
        }

        log.info("结构升级完成: 检查 {} 个文档，升级 {} 个，错误 {} 个",
            report.getDocumentsChecked(), report.getDocumentsMigrated(), report.getErrors().size());
        return report;
    }

    /**
     * 索引和磁盘目录的交叉检查
     */
    public CollectionValidationReport validateCollection() throws LibraryException {
        CollectionValidationReport report = new CollectionValidationReport();
        report.setIndexStatus(status(indexRepository.indexPath(), CollectionIndex.class));

        CollectionIndex index = null;
        if (report.getIndexStatus().isUsable()) {
            try {
                index = indexRepository.loadIfPresent();
            } catch (LibraryException e) {
                if (e.getKind() != ErrorKind.DOCUMENT_CORRUPT) {
                    throw e;
                }
                report.setIndexStatus(CacheStatus.CORRUPTED);
            }
        }

        List<Path> folders = bandFolders();
        report.setBandFolders(folders.size());
        Set<String> folderNames = new HashSet<>();
        for (Path folder : folders) {
            String bandName = folder.getFileName().toString();
            folderNames.add(bandName);
            switch (bandStatus(bandName)) {
                case VALID:
                    report.setValidDocuments(report.getValidDocuments() + 1);
                    break;
                case EXPIRED:
                    report.setExpiredDocuments(report.getExpiredDocuments() + 1);
                    break;
                case CORRUPTED:
                    report.setCorruptedDocuments(report.getCorruptedDocuments() + 1);
                    report.getInconsistencies().add(I18nUtil.getMessage("cache.issue.corrupted", bandName));
                    break;
                default:
                    report.setMissingDocuments(report.getMissingDocuments() + 1);
                    break;
            }
        }

        if (index != null) {
            report.setIndexedBands(index.getBands().size());
            Set<String> indexedNames = new HashSet<>();
            for (CollectionIndexEntry entry : index.getBands()) {
                indexedNames.add(entry.getName());
                if (!folderNames.contains(entry.getName())) {
                    report.getIndexedWithoutFolder().add(entry.getName());
                    report.getInconsistencies().add(I18nUtil.getMessage("cache.issue.folder.missing", entry.getName()));
                    continue;
                }
                checkEntryCounts(entry, report);
            }
            for (String folderName : folderNames) {
                if (!indexedNames.contains(folderName)) {
                    report.getFoldersNotIndexed().add(folderName);
                    report.getInconsistencies().add(I18nUtil.getMessage("cache.issue.not.indexed", folderName));
                }
            }
        } else if (!folders.isEmpty()) {
            report.getInconsistencies().add(I18nUtil.getMessage("cache.issue.index." + report.getIndexStatus().name().toLowerCase()));
        }

        report.getIndexedWithoutFolder().sort(String.CASE_INSENSITIVE_ORDER);
        report.getFoldersNotIndexed().sort(String.CASE_INSENSITIVE_ORDER);
        report.setConsistent(report.getInconsistencies().isEmpty());

        if (!report.getIndexedWithoutFolder().isEmpty() || !report.getFoldersNotIndexed().isEmpty()
            || index == null) {
            report.getRecommendations().add(I18nUtil.getMessage("cache.recommendation.rescan"));
        }
        if (report.getCorruptedDocuments() > 0) {
            report.getRecommendations().add(I18nUtil.getMessage("cache.recommendation.corrupted"));
        }
        if (report.getExpiredDocuments() > 0) {
            report.getRecommendations().add(I18nUtil.getMessage("cache.recommendation.expired", ttl.toDays()));
        }
        return report;
    }

    private void checkEntryCounts(CollectionIndexEntry entry, CollectionValidationReport report) throws LibraryException {
        BandDocument document;
        try {
            document = bandRepository.loadIfPresent(entry.getName());
        } catch (LibraryException e) {
            if (e.getKind() == ErrorKind.DOCUMENT_CORRUPT) {
                return;
            }
            throw e;
        }
        if (document == null) {
            return;
        }
        if (document.getLocalAlbumsCount() != entry.getLocalAlbumsCount()
            || document.getMissingAlbumsCount() != entry.getMissingAlbumsCount()) {
            report.getInconsistencies().add(I18nUtil.getMessage("cache.issue.count.mismatch", entry.getName(),
                entry.getLocalAlbumsCount(), entry.getMissingAlbumsCount(),
                document.getLocalAlbumsCount(), document.getMissingAlbumsCount()));
        }
    }

    /**
     * 缓存统计
     */
    public CacheStatistics statistics() throws LibraryException {
        CacheStatistics stats = new CacheStatistics();
        stats.setCacheDurationDays((int) ttl.toDays());
        stats.setIndexStatus(status(indexRepository.indexPath(), CollectionIndex.class));

        Instant oldest = null;
        Instant newest = null;
        for (Path folder : bandFolders()) {
            String bandName = folder.getFileName().toString();
            Path path = folder.resolve(BandDocument.FILE_NAME);
            CacheStatus status = bandStatus(bandName);
            if (status == CacheStatus.MISSING) {
                continue;
            }
            stats.setTotalDocuments(stats.getTotalDocuments() + 1);
            switch (status) {
                case VALID:
                    stats.setValidDocuments(stats.getValidDocuments() + 1);
                    break;
                case EXPIRED:
                    stats.setExpiredDocuments(stats.getExpiredDocuments() + 1);
                    break;
                default:
                    stats.setCorruptedDocuments(stats.getCorruptedDocuments() + 1);
                    break;
            }
            try {
                stats.setTotalSizeBytes(stats.getTotalSizeBytes() + Files.size(path));
            } catch (IOException e) {
                log.debug("无法读取文件大小: {}", path);
            }
            Instant modified = lastModified(path);
            if (oldest == null || modified.isBefore(oldest)) {
                oldest = modified;
                stats.setOldestDocument(bandName);
            }
            if (newest == null || modified.isAfter(newest)) {
                newest = modified;
                stats.setNewestDocument(bandName);
            }
        }
        return stats;
    }

    private List<Path> bandFolders() throws LibraryException {
        if (!Files.isDirectory(musicRoot)) {
            throw new LibraryException(ErrorKind.VALIDATION, "音乐库根目录不存在: " + musicRoot);
        }
        try {
            return LibraryLayout.listBandFolders(musicRoot);
        } catch (IOException e) {
            throw new LibraryException(ErrorKind.STORAGE_IO, "无法列出乐队目录: " + musicRoot, e);
        }
    }

    private static void requireSupported(String targetVersion) throws LibraryException {
        if (!DocumentSchemaMigrator.isSupported(targetVersion)) {
            throw new LibraryException(ErrorKind.VALIDATION, "不支持的结构版本: " + targetVersion
                + "，可选: " + DocumentSchemaMigrator.SUPPORTED_VERSIONS);
        }
    }

    private static String format(Instant instant) {
        return LocalDateTime.ofInstant(instant, ZoneId.systemDefault()).format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
    }
}
