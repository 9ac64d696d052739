package com.lux032.musiclibrary.core;

import com.lux032.musiclibrary.cache.CacheValidationReport;
import com.lux032.musiclibrary.cache.CacheValidator;
import com.lux032.musiclibrary.cache.CollectionValidationReport;
import com.lux032.musiclibrary.cache.SchemaMigrationReport;
import com.lux032.musiclibrary.config.MusicConfig;
import com.lux032.musiclibrary.error.ErrorKind;
import com.lux032.musiclibrary.error.LibraryError;
import com.lux032.musiclibrary.error.LibraryException;
import com.lux032.musiclibrary.migration.AlbumMover;
import com.lux032.musiclibrary.migration.BandStructureMigrator;
import com.lux032.musiclibrary.migration.DiskSpaceMonitor;
import com.lux032.musiclibrary.migration.FileLockDetector;
import com.lux032.musiclibrary.migration.FilesAlbumMover;
import com.lux032.musiclibrary.migration.MigrationBackupManager;
import com.lux032.musiclibrary.migration.MigrationErrorAnalyzer;
import com.lux032.musiclibrary.migration.MigrationPlanner;
import com.lux032.musiclibrary.migration.MigrationProgressListener;
import com.lux032.musiclibrary.migration.MigrationRecoveryManager;
import com.lux032.musiclibrary.migration.MigrationRequest;
import com.lux032.musiclibrary.migration.MigrationResult;
import com.lux032.musiclibrary.migration.RecoveryLog;
import com.lux032.musiclibrary.model.BandAnalysis;
import com.lux032.musiclibrary.model.BandDocument;
import com.lux032.musiclibrary.model.CollectionIndex;
import com.lux032.musiclibrary.model.CollectionIndexEntry;
import com.lux032.musiclibrary.scanner.AlbumFolderLocator;
import com.lux032.musiclibrary.scanner.AlbumFolderParser;
import com.lux032.musiclibrary.scanner.AlbumReconciler;
import com.lux032.musiclibrary.scanner.BandStructureDetector;
import com.lux032.musiclibrary.scanner.MusicScanner;
import com.lux032.musiclibrary.scanner.ScanReport;
import com.lux032.musiclibrary.scanner.TrackDurationReader;
import com.lux032.musiclibrary.storage.AtomicFileStore;
import com.lux032.musiclibrary.storage.BackupCleanupResult;
import com.lux032.musiclibrary.storage.BandDocumentRepository;
import com.lux032.musiclibrary.storage.CollectionIndexRepository;
import com.lux032.musiclibrary.storage.DocumentSchemaMigrator;
import com.lux032.musiclibrary.util.JsonSupport;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * 音乐库管理入口
 *
 * <p>由 {@link MusicConfig} 显式构造并装配所有组件。所有操作都返回 {@link LibraryResponse}，
 * 内部异常在这里统一转换为错误结构，不会抛给调用方。
 */
@Slf4j
@Getter
public class MusicLibraryService {

    private final MusicConfig config;
    private final Clock clock;

    private final AtomicFileStore store;
    private final DocumentSchemaMigrator schemaMigrator;
    private final BandDocumentRepository bandRepository;
    private final CollectionIndexRepository indexRepository;
    private final CacheValidator cacheValidator;
    private final MusicScanner scanner;
    private final RecoveryLog recoveryLog;
    private final MigrationRecoveryManager recoveryManager;
    private final MigrationBackupManager migrationBackupManager;
    private final BandStructureMigrator migrator;

    public MusicLibraryService(MusicConfig config) {
        this(config, Clock.systemDefaultZone(), new FilesAlbumMover());
    }

    public MusicLibraryService(MusicConfig config, Clock clock, AlbumMover mover) {
        this.config = config;
        this.clock = clock;
        Path musicRoot = config.getMusicRoot();

        // 1. 存储层
        this.store = new AtomicFileStore(Duration.ofSeconds(config.getLockTimeoutSeconds()), JsonSupport.gson(), clock);
        this.schemaMigrator = new DocumentSchemaMigrator(clock);
        this.bandRepository = new BandDocumentRepository(musicRoot, store, schemaMigrator, clock);
        this.indexRepository = new CollectionIndexRepository(musicRoot, store, schemaMigrator);

        // 2. 缓存校验
        this.cacheValidator = new CacheValidator(musicRoot, store, bandRepository, indexRepository, schemaMigrator,
            Duration.ofDays(config.getCacheDurationDays()), clock);

        // 3. 扫描
        AlbumFolderLocator locator = new AlbumFolderLocator(new AlbumFolderParser());
        BandStructureDetector structureDetector = new BandStructureDetector();
        TrackDurationReader durationReader = config.isReadDurations() ? new TrackDurationReader() : null;
        this.scanner = new MusicScanner(musicRoot, store, bandRepository, indexRepository, cacheValidator,
            locator, structureDetector, new AlbumReconciler(), durationReader, clock);

        // 4. 迁移
        MigrationErrorAnalyzer errorAnalyzer = new MigrationErrorAnalyzer();
        this.recoveryLog = new RecoveryLog();
        this.recoveryManager = new MigrationRecoveryManager(recoveryLog, errorAnalyzer, new FileLockDetector(),
            config.getMigrationMaxRetries(), Duration.ofSeconds(config.getLockWaitSeconds()),
            Duration.ofMillis(config.getLockCheckIntervalMillis()), clock);
        this.migrationBackupManager = new MigrationBackupManager(clock);
        this.migrator = new BandStructureMigrator(bandRepository, indexRepository, locator, structureDetector,
            new MigrationPlanner(), migrationBackupManager, new DiskSpaceMonitor(config.getMinFreeSpaceMb()),
            errorAnalyzer, recoveryManager, mover);

        log.info("音乐库服务已初始化: {}", musicRoot);
    }

    @FunctionalInterface
    private interface LibraryAction<T> {
        T run() throws LibraryException;
    }

    public LibraryResponse<ScanReport> scan() {
        return execute("scan", ErrorKind.SCANNING, scanner::scan);
    }

    /**
     * 保存乐队元数据
     * 新文档没有 analysis / folder_structure 时保留已存储的值，同时更新索引条目
     */
    public LibraryResponse<BandDocument> saveDocument(String bandName, BandDocument document) {
        return execute("saveDocument", ErrorKind.STORAGE_IO, () -> {
            if (document == null) {
                throw new LibraryException(ErrorKind.VALIDATION, "文档不能为空");
            }
            BandDocumentRepository.validateBandName(bandName);

            BandDocument saved = bandRepository.update(bandName, current -> {
                document.setBandName(bandName);
                if (current != null) {
                    if (document.getAnalysis() == null) {
                        document.setAnalysis(current.getAnalysis());
                    }
                    if (document.getFolderStructure() == null) {
                        document.setFolderStructure(current.getFolderStructure());
                    }
                }
                document.setLastMetadataSaved(JsonSupport.now(clock));
                return document;
            });

            updateIndexEntry(saved, bandName);
            log.info("已保存乐队元数据: {} ({} 张专辑)", bandName, saved.getAlbumsCount());
            return saved;
        });
    }

    public LibraryResponse<BandDocument> saveAnalysis(String bandName, BandAnalysis analysis) {
        return execute("saveAnalysis", ErrorKind.STORAGE_IO, () -> {
            if (analysis == null || !analysis.hasValidRates()) {
                throw new LibraryException(ErrorKind.VALIDATION, "评分必须在 "
                    + (int) BandAnalysis.MIN_RATE + " 到 " + (int) BandAnalysis.MAX_RATE + " 之间");
            }
            BandDocumentRepository.validateBandName(bandName);

            BandDocument saved = bandRepository.update(bandName, current -> {
                BandDocument document = current != null ? current : new BandDocument(bandName);
                document.setAnalysis(analysis);
                return document;
            });

            updateIndexEntry(saved, bandName);
            log.info("已保存乐队分析: {}", bandName);
            return saved;
        });
    }

    /**
     * 不存在时 data 为 null
     */
    public LibraryResponse<BandDocument> loadDocument(String bandName) {
        return execute("loadDocument", ErrorKind.STORAGE_IO, () -> bandRepository.loadIfPresent(bandName));
    }

    /**
     * 不存在时 data 为 null
     */
    public LibraryResponse<CollectionIndex> loadIndex() {
        return execute("loadIndex", ErrorKind.STORAGE_IO, indexRepository::loadIfPresent);
    }

    public LibraryResponse<CollectionIndex> updateIndex(CollectionIndex index) {
        return execute("updateIndex", ErrorKind.STORAGE_IO, () -> {
            if (index == null) {
                throw new LibraryException(ErrorKind.VALIDATION, "索引不能为空");
            }
            index.setLastScan(JsonSupport.now(clock));
            indexRepository.save(index);
            return index;
        });
    }

    public LibraryResponse<MigrationResult> migrate(MigrationRequest request, MigrationProgressListener listener) {
        return execute("migrate", ErrorKind.MIGRATION_UNKNOWN, () -> {
            if (request == null || request.getBandName() == null) {
                throw new LibraryException(ErrorKind.VALIDATION, "迁移请求缺少乐队名");
            }
            return migrator.migrate(request, listener);
        });
    }

    public LibraryResponse<CollectionValidationReport> validateCollection() {
        return execute("validateCollection", ErrorKind.STORAGE_IO, cacheValidator::validateCollection);
    }

    public LibraryResponse<CacheValidationReport> cacheStatus(String bandName) {
        return execute("cacheStatus", ErrorKind.STORAGE_IO, () -> cacheValidator.validateBand(bandName));
    }

    public LibraryResponse<SchemaMigrationReport> migrateSchema(String targetVersion) {
        return execute("migrateSchema", ErrorKind.STORAGE_IO, () -> cacheValidator.migrateCollection(targetVersion));
    }

    /**
     * 每个文档只保留最新的 maxBackups 个带时间戳的备份
     */
    public LibraryResponse<BackupCleanupResult> cleanupBackups(int maxBackups) {
        return execute("cleanupBackups", ErrorKind.STORAGE_IO,
            () -> store.cleanupBackups(config.getMusicRoot(), maxBackups));
    }

    /**
     * 只保留乐队目录下最新的 keep 个迁移备份
     */
    public LibraryResponse<Integer> cleanupMigrationBackups(String bandName, int keep) {
        return execute("cleanupMigrationBackups", ErrorKind.STORAGE_IO, () -> {
            Path bandFolder = bandRepository.bandFolder(bandName);
            try {
                return migrationBackupManager.cleanupBackups(bandFolder, keep);
            } catch (IOException e) {
                throw new LibraryException(ErrorKind.STORAGE_IO, "清理迁移备份失败: " + bandFolder, e);
            }
        });
    }

    private void updateIndexEntry(BandDocument document, String bandName) throws LibraryException {
        indexRepository.upsertEntry(CollectionIndexEntry.fromDocument(document, bandName));
    }

    private <T> LibraryResponse<T> execute(String operation, ErrorKind fallbackKind, LibraryAction<T> action) {
        try {
            return LibraryResponse.ok(action.run());
        } catch (LibraryException e) {
            log.warn("{} 失败: {}", operation, e.getError());
            return LibraryResponse.error(e.getError());
        } catch (IllegalArgumentException e) {
            log.warn("{} 参数错误: {}", operation, e.getMessage());
            return LibraryResponse.error(LibraryError.of(ErrorKind.VALIDATION, e.getMessage()));
        } catch (RuntimeException e) {
            log.error("{} 发生未预期的错误", operation, e);
            return LibraryResponse.error(LibraryError.of(fallbackKind, e.getClass().getSimpleName() + ": " + e.getMessage()));
        }
    }
}
