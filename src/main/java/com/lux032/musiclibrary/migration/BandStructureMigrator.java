package com.lux032.musiclibrary.migration;

import com.lux032.musiclibrary.error.ErrorKind;
import com.lux032.musiclibrary.error.LibraryException;
import com.lux032.musiclibrary.model.AlbumRecord;
import com.lux032.musiclibrary.model.BandDocument;
import com.lux032.musiclibrary.model.CollectionIndexEntry;
import com.lux032.musiclibrary.model.FolderStructure;
import com.lux032.musiclibrary.scanner.AlbumFolderLocator;
import com.lux032.musiclibrary.scanner.BandStructureDetector;
import com.lux032.musiclibrary.scanner.DiscoveredAlbum;
import com.lux032.musiclibrary.storage.BandDocumentRepository;
import com.lux032.musiclibrary.storage.CollectionIndexRepository;
import com.lux032.musiclibrary.util.FileSystemUtils;
import com.lux032.musiclibrary.util.I18nUtil;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 乐队目录结构迁移
 *
 * <p>流程: 发现专辑 → 校验迁移类型 → 生成计划 → (dry run 到此为止) → 空间检查与备份 → 按顺序执行
 * → 出错时走恢复流程 → 成功后清理空类型文件夹并更新乐队文档和收藏索引。
 * 未指定 force 时，任何需要人工处理的错误都会中止迁移并回滚已完成的操作。
 *
 * <p>同一乐队的迁移不可并发执行，调用方负责串行化。
 */
@Slf4j
public class BandStructureMigrator {

    private final BandDocumentRepository bandRepository;
    private final CollectionIndexRepository indexRepository;
    private final AlbumFolderLocator locator;
    private final BandStructureDetector structureDetector;
    private final MigrationPlanner planner;
    private final MigrationBackupManager backupManager;
    private final DiskSpaceMonitor diskSpaceMonitor;
    private final MigrationErrorAnalyzer errorAnalyzer;
    private final MigrationRecoveryManager recoveryManager;
    private final AlbumMover mover;

    public BandStructureMigrator(BandDocumentRepository bandRepository, CollectionIndexRepository indexRepository,
                                 AlbumFolderLocator locator, BandStructureDetector structureDetector,
                                 MigrationPlanner planner, MigrationBackupManager backupManager,
                                 DiskSpaceMonitor diskSpaceMonitor, MigrationErrorAnalyzer errorAnalyzer,
                                 MigrationRecoveryManager recoveryManager, AlbumMover mover) {
        this.bandRepository = bandRepository;
        this.indexRepository = indexRepository;
        this.locator = locator;
        this.structureDetector = structureDetector;
        this.planner = planner;
        this.backupManager = backupManager;
        this.diskSpaceMonitor = diskSpaceMonitor;
        this.errorAnalyzer = errorAnalyzer;
        this.recoveryManager = recoveryManager;
        this.mover = mover;
    }

    public MigrationResult migrate(MigrationRequest request) throws LibraryException {
        return migrate(request, MigrationProgressListener.NONE);
    }

    public MigrationResult migrate(MigrationRequest request, MigrationProgressListener listener) throws LibraryException {
        long startTime = System.currentTimeMillis();
        MigrationProgressListener progress = listener != null ? listener : MigrationProgressListener.NONE;

        String bandName = request.getBandName();
        Path bandFolder = bandRepository.bandFolder(bandName);
        if (!Files.isDirectory(bandFolder)) {
            throw new LibraryException(ErrorKind.VALIDATION,
                I18nUtil.getMessage("migration.validation.band.missing", bandName));
        }

        BandDocument document = bandRepository.loadIfPresent(bandName);
        List<DiscoveredAlbum> albums = discover(bandFolder);
        FolderStructure structure = structureDetector.detect(albums);
        planner.validate(request, structure);

        MigrationPlan plan = planner.plan(request, albums, document);
        MigrationResult result = new MigrationResult(bandName, request.getMigrationType(), request.isDryRun());
        result.setOperations(plan.getOperations());
        result.setSkippedAlbums(plan.getSkippedAlbums());

        if (request.isDryRun() || plan.isEmpty()) {
            result.setStatus(MigrationStatus.SUCCESS);
            result.setMigrationTimeSeconds(elapsedSeconds(startTime));
            log.info("{}迁移 {} [{}]: {} 个操作", request.isDryRun() ? "预演" : "", bandName,
                request.getMigrationType().getValue(), plan.getOperations().size());
            return result;
        }

        BackupInfo backup = null;
        if (request.isBackupOriginal()) {
            diskSpaceMonitor.ensureSpaceForBackup(bandFolder);
            backup = backupManager.createBackup(bandFolder, structure.getStructureType());
            result.setBackupInfo(backup);
            result.setRollbackAvailable(true);
        }

        log.info("开始迁移 {} [{}]: {} 个操作", bandName, request.getMigrationType().getValue(), plan.getOperations().size());
        List<MigrationOperation> completed = new ArrayList<>();
        ErrorClassification abortCause = null;
        int processed = 0;
        int total = plan.getOperations().size();

        for (MigrationOperation operation : plan.getOperations()) {
            Path source = bandFolder.resolve(operation.getSourcePath());
            Path target = bandFolder.resolve(operation.getTargetPath());
            try {
                mover.move(source, target);
                operation.setCompleted(true);
            } catch (IOException | RuntimeException e) {
                MigrationContext context = new MigrationContext(bandName, operation, result.isRollbackAvailable(),
                    request.isForce());
                ErrorClassification classification = errorAnalyzer.classify(e, context);
                log.warn("迁移操作失败: {} -> {} - {}", operation.getSourcePath(), operation.getTargetPath(),
                    classification.getTechnicalMessage());

                RecoveryOutcome outcome = recoveryManager.recover(classification, source,
                    merge -> execute(source, target, merge));
                result.getRecoveryLog().addAll(outcome.getTransitions());

                if (outcome.isResolved()) {
                    operation.setCompleted(true);
                } else {
                    operation.setErrorMessage(classification.getUserMessage() + " (" + outcome.getLastErrorMessage() + ")");
                    result.getErrorMessages().add(operation.getErrorMessage());
                    if (outcome.isBlocking() && !request.isForce()) {
                        abortCause = classification;
                    }
                }
            }

            if (operation.isCompleted()) {
                completed.add(operation);
            }
            processed++;
            reportProgress(progress, I18nUtil.getMessage("migration.progress", operation.getSourcePath(),
                operation.getTargetPath()), processed * 100.0 / total);
            if (abortCause != null) {
                break;
            }
        }

        if (abortCause != null) {
            rollback(bandFolder, backup, completed, abortCause, result);
            result.setMigrationTimeSeconds(elapsedSeconds(startTime));
            return result;
        }

        removeEmptyTypeFolders(bandFolder, completed);
        result.setAlbumsMigrated(completed.size());
        result.setAlbumsFailed(total - completed.size());

        if (!completed.isEmpty()) {
            try {
                persist(bandName, bandFolder, completed, request.getMigrationType());
            } catch (LibraryException e) {
                log.error("迁移后更新元数据失败: {} - {}", bandName, e.getMessage());
                result.getErrorMessages().add(e.getMessage());
                result.setAlbumsFailed(Math.max(result.getAlbumsFailed(), 1));
            }
        }

        if (result.getAlbumsFailed() == 0 && result.getErrorMessages().isEmpty()) {
            result.setStatus(MigrationStatus.SUCCESS);
        } else if (result.getAlbumsMigrated() > 0) {
            result.setStatus(MigrationStatus.PARTIAL_SUCCESS);
        } else {
            result.setStatus(MigrationStatus.FAILED);
        }
        result.setMigrationTimeSeconds(elapsedSeconds(startTime));
        log.info("迁移完成 {}: {} - 成功 {}, 失败 {}", bandName, result.getStatus(),
            result.getAlbumsMigrated(), result.getAlbumsFailed());
        return result;
    }

    /**
     * 回调异常只记录，不影响迁移本身
     */
    private static void reportProgress(MigrationProgressListener progress, String message, double percentage) {
        try {
            progress.onProgress(message, percentage);
        } catch (RuntimeException e) {
            log.warn("进度回调失败: {}", e.getMessage(), e);
        }
    }

    private List<DiscoveredAlbum> discover(Path bandFolder) throws LibraryException {
        List<String> errors = new ArrayList<>();
        try {
            List<DiscoveredAlbum> albums = locator.discover(bandFolder, errors);
            for (String error : errors) {
                log.warn("迁移前扫描出错: {}", error);
            }
            return albums;
        } catch (IOException e) {
            throw new LibraryException(ErrorKind.SCANNING, "无法读取乐队目录: " + bandFolder, e);
        }
    }

    private void execute(Path source, Path target, boolean merge) throws IOException {
        if (merge && Files.exists(target)) {
            mover.merge(source, target);
        } else {
            mover.move(source, target);
        }
    }

    private void rollback(Path bandFolder, BackupInfo backup, List<MigrationOperation> completed,
                          ErrorClassification cause, MigrationResult result) throws LibraryException {
        String bandName = result.getBandName();
        if (backup != null) {
            backupManager.restore(bandFolder, backup);
        } else {
            undo(bandFolder, completed);
        }

        for (MigrationOperation operation : result.getOperations()) {
            operation.setCompleted(false);
        }
        result.getRecoveryLog().add(recoveryManager.recordRollback(bandName, cause.getErrorType(),
            cause.getUserMessage()));
        result.setAlbumsMigrated(0);
        result.setAlbumsFailed(result.getOperations().size());
        result.setStatus(MigrationStatus.ROLLED_BACK);
    }

    /**
     * 没有备份时按相反顺序撤销已完成的移动
     */
    private void undo(Path bandFolder, List<MigrationOperation> completed) throws LibraryException {
        List<String> failures = new ArrayList<>();
        for (int i = completed.size() - 1; i >= 0; i--) {
            MigrationOperation operation = completed.get(i);
            try {
                mover.move(bandFolder.resolve(operation.getTargetPath()), bandFolder.resolve(operation.getSourcePath()));
            } catch (IOException | RuntimeException e) {
                failures.add(operation.getTargetPath() + ": " + e.getMessage());
            }
        }
        removeEmptyTypeFolders(bandFolder, completed);
        if (!failures.isEmpty()) {
            throw new LibraryException(ErrorKind.MIGRATION_ROLLBACK,
                I18nUtil.getMessage("migration.error.rollback", bandFolder.getFileName(), String.join("; ", failures)));
        }
    }

    /**
     * 删除迁移后变空的类型文件夹
     */
    private void removeEmptyTypeFolders(Path bandFolder, List<MigrationOperation> operations) {
        Set<Path> parents = new LinkedHashSet<>();
        for (MigrationOperation operation : operations) {
            for (String relative : new String[]{operation.getSourcePath(), operation.getTargetPath()}) {
                Path parent = bandFolder.resolve(relative).getParent();
                if (parent != null && !parent.equals(bandFolder)) {
                    parents.add(parent);
                }
            }
        }
        for (Path parent : parents) {
            try {
                if (Files.isDirectory(parent) && FileSystemUtils.isEmptyDirectory(parent)) {
                    Files.delete(parent);
                    log.debug("已删除空类型文件夹: {}", parent);
                }
            } catch (IOException e) {
                log.warn("删除空文件夹失败: {} - {}", parent, e.getMessage());
            }
        }
    }

    /**
     * 更新乐队文档中已迁移专辑的路径、类型和版本，目录结构按迁移后的实际情况重新检测，并刷新索引
     */
    private void persist(String bandName, Path bandFolder, List<MigrationOperation> completed,
                         MigrationType migrationType) throws LibraryException {
        FolderStructure structure = structureDetector.detect(discover(bandFolder));
        if (structure.getStructureType() != migrationType.getTargetStructure()) {
            log.info("迁移后目录结构为 {}，未达到目标 {}: {}", structure.getStructureType().getValue(),
                migrationType.getTargetStructure().getValue(), bandName);
        }

        BandDocument saved = bandRepository.update(bandName, current -> {
            BandDocument document = current != null ? current : new BandDocument(bandName);
            for (MigrationOperation operation : completed) {
                AlbumRecord record = findRecord(document, operation);
                if (record == null) {
                    record = new AlbumRecord(operation.getAlbumName(), operation.getYear(),
                        operation.getAlbumType(), operation.getEdition());
                    document.getAlbums().add(record);
                }
                record.setFolderPath(operation.getTargetPath());
                record.setType(operation.getAlbumType());
                if (!operation.getEdition().isEmpty()) {
                    record.setEdition(operation.getEdition());
                }
                if (record.getYear().isEmpty()) {
                    record.setYear(operation.getYear());
                }
                if (record.getTrackCount() == 0) {
                    record.setTrackCount(countTracks(bandFolder.resolve(operation.getTargetPath())));
                }
            }
            document.setFolderStructure(structure);
            return document;
        });

        indexRepository.upsertEntry(CollectionIndexEntry.fromDocument(saved, bandName));
        log.debug("迁移后已更新元数据: {} -> {}", bandName, structure.getStructureType().getValue());
    }

    private static AlbumRecord findRecord(BandDocument document, MigrationOperation operation) {
        for (AlbumRecord record : document.getAlbums()) {
            if (operation.getSourcePath().equalsIgnoreCase(record.getFolderPath())) {
                return record;
            }
        }
        for (AlbumRecord record : document.getAlbums()) {
            if (operation.getAlbumName().equalsIgnoreCase(record.getAlbumName())
                    && (record.getYear().isEmpty() || record.getYear().equals(operation.getYear()))) {
                return record;
            }
        }
        return null;
    }

    private static int countTracks(Path folder) {
        try {
            return FileSystemUtils.countMusicFiles(folder);
        } catch (IOException e) {
            log.debug("无法统计音轨: {} - {}", folder, e.getMessage());
            return 0;
        }
    }

    private static double elapsedSeconds(long startTime) {
        return Math.round((System.currentTimeMillis() - startTime) / 10.0) / 100.0;
    }
}
