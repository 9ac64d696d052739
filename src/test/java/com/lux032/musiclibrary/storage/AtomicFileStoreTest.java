package com.lux032.musiclibrary.storage;

import com.google.gson.JsonObject;
import com.lux032.musiclibrary.LibraryFixtures;
import com.lux032.musiclibrary.error.ErrorKind;
import com.lux032.musiclibrary.error.LibraryException;
import com.lux032.musiclibrary.model.AlbumType;
import com.lux032.musiclibrary.model.BandDocument;
import com.lux032.musiclibrary.util.JsonSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("原子文件存储测试")
class AtomicFileStoreTest {

    @TempDir
    Path tempDir;

    private AtomicFileStore store;
    private Path documentPath;

    @BeforeEach
    void setUp() {
        store = new AtomicFileStore(Duration.ofSeconds(10), JsonSupport.gson(), Clock.systemDefaultZone());
        documentPath = tempDir.resolve("The Beatles").resolve(BandDocument.FILE_NAME);
    }

    private static BandDocument beatles(int albums) {
        BandDocument document = new BandDocument("The Beatles");
        document.setFormed("1960");
        document.getGenres().add("Rock");
        for (int i = 0; i < albums; i++) {
            document.getAlbums().add(LibraryFixtures.record("Album " + i, "196" + i, AlbumType.ALBUM, 10 + i, ""));
        }
        document.normalizeAlbums();
        return document;
    }

    @Test
    @DisplayName("保存后读取得到相同文档，且创建父目录")
    void save_thenLoad_returnsSameDocument() throws Exception {
        BandDocument document = beatles(3);

        store.save(documentPath, document, BackupMode.SIDECAR);
        BandDocument loaded = store.load(documentPath, BandDocument.class);

        assertEquals(document, loaded);
        assertTrue(Files.isDirectory(documentPath.getParent()));
    }

    @Test
    @DisplayName("JSON 使用下划线字段名")
    void save_writesSnakeCaseFields() throws Exception {
        store.save(documentPath, beatles(1), false);

        String json = new String(Files.readAllBytes(documentPath), StandardCharsets.UTF_8);
        assertTrue(json.contains("\"band_name\": \"The Beatles\""));
        assertTrue(json.contains("\"track_count\": 10"));
        assertTrue(json.contains("\"albums_missing\""));
    }

    @Test
    @DisplayName("保存后不留下锁文件和临时文件")
    void save_releasesLockAndLeavesNoTempFiles() throws Exception {
        store.save(documentPath, beatles(1), BackupMode.SIDECAR);
        store.save(documentPath, beatles(2), BackupMode.SIDECAR);

        assertFalse(Files.exists(SidecarLock.lockFileFor(documentPath)));
        try (Stream<Path> files = Files.list(documentPath.getParent())) {
            List<String> names = files.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList());
            assertEquals(List.of(".band_metadata.json", ".band_metadata.json.backup"), names);
        }
    }

    @Test
    @DisplayName("覆盖写入前的版本可以从 .backup 恢复")
    void restoreFromBackup_recoversPreviousVersion() throws Exception {
        BandDocument first = beatles(1);
        store.save(documentPath, first, BackupMode.SIDECAR);
        store.save(documentPath, beatles(5), BackupMode.SIDECAR);

        store.restoreFromBackup(documentPath);

        assertEquals(first, store.load(documentPath, BandDocument.class));
    }

    @Test
    @DisplayName("锁被占用时超时失败，原文件不变")
    void save_whenLockHeld_failsWithLockTimeout() throws Exception {
        AtomicFileStore impatient = new AtomicFileStore(Duration.ofMillis(300));
        impatient.save(documentPath, beatles(1), false);
        byte[] before = Files.readAllBytes(documentPath);
        Files.write(SidecarLock.lockFileFor(documentPath), "4242".getBytes(StandardCharsets.UTF_8));

        LibraryException e = assertThrows(LibraryException.class,
            () -> impatient.save(documentPath, beatles(4), false));

        assertEquals(ErrorKind.LOCK_TIMEOUT, e.getKind());
        assertEquals("4242", e.getError().getDetails().get("holder"));
        assertArrayEquals(before, Files.readAllBytes(documentPath));
    }

    @Test
    @DisplayName("文件不存在时抛出 DOCUMENT_NOT_FOUND")
    void load_missingFile_raisesNotFound() {
        LibraryException e = assertThrows(LibraryException.class, () -> store.load(documentPath, BandDocument.class));
        assertEquals(ErrorKind.DOCUMENT_NOT_FOUND, e.getKind());
    }

    @Test
    @DisplayName("JSON 无法解析时抛出 DOCUMENT_CORRUPT，并释放锁")
    void load_corruptJson_raisesCorrupt() throws Exception {
        Files.createDirectories(documentPath.getParent());
        Files.write(documentPath, "{ \"band_name\": ".getBytes(StandardCharsets.UTF_8));

        LibraryException e = assertThrows(LibraryException.class, () -> store.loadTree(documentPath));

        assertEquals(ErrorKind.DOCUMENT_CORRUPT, e.getKind());
        assertFalse(Files.exists(SidecarLock.lockFileFor(documentPath)));
    }

    @Test
    @DisplayName("mutator 返回 null 时不写入")
    void update_nullResult_doesNotWrite() throws Exception {
        JsonObject result = store.update(documentPath, (JsonObject tree) -> tree, (JsonObject tree) -> null, BackupMode.NONE);

        assertNull(result);
        assertFalse(Files.exists(documentPath));
    }

    @Test
    @DisplayName("带时间戳的备份使用 .backup_yyyyMMdd_HHmmss_SSS 命名")
    void createTimestampedBackup_usesTimestampName() throws Exception {
        store.save(documentPath, beatles(1), false);

        Path backup = store.createTimestampedBackup(documentPath);

        assertTrue(backup.getFileName().toString().matches("\\.band_metadata\\.json\\.backup_\\d{8}_\\d{6}_\\d{3}"));
        assertEquals(backup, store.latestTimestampedBackup(documentPath));
    }

    @Test
    @DisplayName("清理时每个文档只保留最新的 N 个时间戳备份")
    void cleanupBackups_keepsNewest() throws Exception {
        Path band = documentPath.getParent();
        Files.createDirectories(band);
        String[] stamps = {"20260101_000000_000", "20260102_000000_000", "20260103_000000_000", "20260104_000000_000"};
        for (String stamp : stamps) {
            Files.write(band.resolve(BandDocument.FILE_NAME + ".backup_" + stamp), new byte[]{1, 2});
        }

        BackupCleanupResult result = store.cleanupBackups(tempDir, 2);

        assertEquals(2, result.getBackupsRemoved());
        assertEquals(4, result.getBytesFreed());
        assertTrue(Files.exists(band.resolve(BandDocument.FILE_NAME + ".backup_20260104_000000_000")));
        assertTrue(Files.exists(band.resolve(BandDocument.FILE_NAME + ".backup_20260103_000000_000")));
        assertFalse(Files.exists(band.resolve(BandDocument.FILE_NAME + ".backup_20260101_000000_000")));
    }

    @Test
    @DisplayName("两个并发保存: 不死锁，不留锁文件，结果是其中之一")
    void concurrentSaves_lastWriterWins() throws Exception {
        BandDocument a = beatles(2);
        BandDocument b = beatles(7);
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            List<Callable<Void>> tasks = new ArrayList<>();
            for (BandDocument document : new BandDocument[]{a, b}) {
                tasks.add(() -> {
                    start.await();
                    store.save(documentPath, document, BackupMode.SIDECAR);
                    return null;
                });
            }
            List<Future<Void>> futures = new ArrayList<>();
            for (Callable<Void> task : tasks) {
                futures.add(executor.submit(task));
            }
            start.countDown();
            for (Future<Void> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        BandDocument result = store.load(documentPath, BandDocument.class);
        assertTrue(result.equals(a) || result.equals(b));
        assertFalse(Files.exists(SidecarLock.lockFileFor(documentPath)));
    }

    @Test
    @DisplayName("并发读-改-写不丢失更新")
    void concurrentUpdates_doNotLoseWrites() throws Exception {
        Path counterPath = tempDir.resolve("counter.json");
        int threads = 4;
        int perThread = 10;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < perThread; i++) {
                        store.update(counterPath, (JsonObject tree) -> tree, (JsonObject tree) -> {
                            JsonObject next = tree != null ? tree : new JsonObject();
                            int count = next.has("count") ? next.get("count").getAsInt() : 0;
                            next.addProperty("count", count + 1);
                            return next;
                        }, BackupMode.NONE);
                    }
                    return null;
                }));
            }
            for (Future<?> future : futures) {
                future.get(60, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(threads * perThread, store.loadTree(counterPath).get("count").getAsInt());
    }
}
