package com.lux032.musiclibrary.scanner;

import com.lux032.musiclibrary.LibraryFixtures;
import com.lux032.musiclibrary.cache.CacheValidator;
import com.lux032.musiclibrary.error.ErrorKind;
import com.lux032.musiclibrary.error.LibraryException;
import com.lux032.musiclibrary.model.AlbumRecord;
import com.lux032.musiclibrary.model.AlbumType;
import com.lux032.musiclibrary.model.BandDocument;
import com.lux032.musiclibrary.model.CollectionIndex;
import com.lux032.musiclibrary.model.CollectionIndexEntry;
import com.lux032.musiclibrary.model.StructureType;
import com.lux032.musiclibrary.storage.AtomicFileStore;
import com.lux032.musiclibrary.storage.BandDocumentRepository;
import com.lux032.musiclibrary.storage.CollectionIndexRepository;
import com.lux032.musiclibrary.storage.DocumentSchemaMigrator;
import com.lux032.musiclibrary.util.JsonSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("音乐库扫描测试")
class MusicScannerTest {

    @TempDir
    Path musicRoot;

    private AtomicFileStore store;
    private BandDocumentRepository bandRepository;
    private CollectionIndexRepository indexRepository;
    private DocumentSchemaMigrator schemaMigrator;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.systemDefaultZone();
        store = new AtomicFileStore(Duration.ofSeconds(5), JsonSupport.gson(), clock);
        schemaMigrator = new DocumentSchemaMigrator(clock);
        bandRepository = new BandDocumentRepository(musicRoot, store, schemaMigrator, clock);
        indexRepository = new CollectionIndexRepository(musicRoot, store, schemaMigrator);
    }

    private MusicScanner scanner(Clock clock) {
        CacheValidator validator = new CacheValidator(musicRoot, store, bandRepository, indexRepository,
            schemaMigrator, Duration.ofDays(30), clock);
        return new MusicScanner(musicRoot, store, bandRepository, indexRepository, validator,
            new AlbumFolderLocator(new AlbumFolderParser()), new BandStructureDetector(),
            new AlbumReconciler(), null, clock);
    }

    private MusicScanner scanner() {
        return scanner(Clock.systemDefaultZone());
    }

    @Test
    @DisplayName("已有元数据中磁盘上不存在的专辑移入缺失列表")
    void scan_existingDocument_missingAlbumMovedToMissing() throws Exception {
        Path beatles = musicRoot.resolve("The Beatles");
        Files.createDirectories(beatles);
        BandDocument document = new BandDocument("The Beatles");
        AlbumRecord abbeyRoad = LibraryFixtures.record("Abbey Road", "1969", AlbumType.ALBUM, 17, "1969 - Abbey Road");
        abbeyRoad.getGenres().add("Rock");
        document.getAlbums().add(abbeyRoad);
        document.getAlbums().add(LibraryFixtures.record("Help!", "1965", AlbumType.ALBUM, 14, "1965 - Help!"));
        document.getAlbums().add(LibraryFixtures.record("Revolver", "1966", AlbumType.ALBUM, 14, "1966 - Revolver"));
        bandRepository.save(document);

        LibraryFixtures.album(beatles, "1969 - Abbey Road", 17);
        LibraryFixtures.album(beatles, "1965 - Help!", 14);

        ScanReport report = scanner().scan();

        assertEquals(1, report.getBandsDiscovered());
        assertEquals(2, report.getAlbumsDiscovered());
        assertEquals(31, report.getTotalTracks());
        assertEquals(1, report.getMissingAlbums());
        assertTrue(report.getScanErrors().isEmpty());

        BandDocument saved = bandRepository.load("The Beatles");
        assertEquals(2, saved.getAlbums().size());
        assertEquals(1, saved.getAlbumsMissing().size());
        assertEquals(3, saved.getAlbumsCount());
        AlbumRecord revolver = saved.getAlbumsMissing().get(0);
        assertEquals("Revolver", revolver.getAlbumName());
        assertEquals(0, revolver.getTrackCount());
        assertEquals("", revolver.getFolderPath());
        assertEquals("Rock", LibraryFixtures.localAlbum(saved, "Abbey Road").getGenres().get(0));
        assertEquals(StructureType.DEFAULT, saved.getFolderStructure().getStructureType());

        CollectionIndexEntry entry = indexRepository.load().getEntry("The Beatles");
        assertEquals(3, entry.getAlbumsCount());
        assertEquals(2, entry.getLocalAlbumsCount());
        assertEquals(1, entry.getMissingAlbumsCount());
    }

    @Test
    @DisplayName("没有元数据的乐队生成新文档和索引条目")
    void scan_newBand_createsDocumentAndIndex() throws Exception {
        Path band = musicRoot.resolve("The Who");
        LibraryFixtures.album(band, "Live/1970 - Live at Leeds", 6);
        LibraryFixtures.album(band, "Album/1971 - Who's Next", 9);
        Files.createDirectories(band.resolve("Artwork"));

        ScanReport report = scanner().scan();

        assertEquals(2, report.getAlbumsDiscovered());
        assertEquals(1, report.getBandsAdded());
        assertTrue(report.isChangesMade());
        assertEquals(1, report.getChangesDetected().size());

        BandDocument saved = bandRepository.load("The Who");
        assertEquals(StructureType.ENHANCED, saved.getFolderStructure().getStructureType());
        AlbumRecord leeds = LibraryFixtures.localAlbum(saved, "Live at Leeds");
        assertEquals(AlbumType.LIVE, leeds.getType());
        assertEquals("1970", leeds.getYear());
        assertEquals("Live/1970 - Live at Leeds", leeds.getFolderPath());
        assertEquals(6, leeds.getTrackCount());

        BandScanResult result = report.getBands().get(0);
        assertEquals(15, result.getTotalTracks());
        assertEquals(Integer.valueOf(1), result.getAlbumTypesDistribution().get("Live"));

        CollectionIndex index = indexRepository.load();
        assertEquals(1, index.getStats().getTotalBands());
        assertEquals(2, index.getStats().getTotalAlbums());
        assertEquals(100.0, index.getStats().getCompletionPercentage());
    }

    @Test
    @DisplayName("内容没有变化时第二次扫描不改写文档")
    void scan_twice_secondScanWritesNothing() throws Exception {
        LibraryFixtures.album(musicRoot.resolve("Queen"), "1975 - A Night at the Opera", 12);
        MusicScanner scanner = scanner();
        scanner.scan();
        Path document = bandRepository.documentPath("Queen");
        String before = new String(Files.readAllBytes(document), StandardCharsets.UTF_8);

        ScanReport second = scanner.scan();

        assertFalse(second.isChangesMade());
        assertTrue(second.getChangesDetected().isEmpty());
        assertEquals(before, new String(Files.readAllBytes(document), StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("损坏的文档被备份后重新生成，扫描继续")
    void scan_corruptedDocument_backedUpAndRebuilt() throws Exception {
        Path queen = musicRoot.resolve("Queen");
        LibraryFixtures.album(queen, "1975 - A Night at the Opera", 12);
        LibraryFixtures.album(musicRoot.resolve("Rush"), "1981 - Moving Pictures", 7);
        Files.write(queen.resolve(BandDocument.FILE_NAME), "{broken".getBytes(StandardCharsets.UTF_8));

        ScanReport report = scanner().scan();

        assertEquals(2, report.getBandsDiscovered());
        assertEquals(1, report.getScanErrors().size());
        assertEquals(1, bandRepository.load("Queen").getLocalAlbumsCount());
        try (Stream<Path> files = Files.list(queen)) {
            long backups = files.map(p -> p.getFileName().toString())
                .filter(name -> name.startsWith(BandDocument.FILE_NAME + AtomicFileStore.TIMESTAMPED_BACKUP_MARKER))
                .count();
            assertEquals(1, backups);
        }
        assertNotNull(indexRepository.load().getEntry("Rush"));
    }

    @Test
    @DisplayName("既过期又损坏的文档同样被备份后重新生成")
    void scan_expiredCorruptedDocument_backedUpAndRebuilt() throws Exception {
        Path queen = musicRoot.resolve("Queen");
        LibraryFixtures.album(queen, "1975 - A Night at the Opera", 12);
        Path document = queen.resolve(BandDocument.FILE_NAME);
        Files.write(document, "{broken".getBytes(StandardCharsets.UTF_8));
        Files.setLastModifiedTime(document, FileTime.from(Instant.now().minus(Duration.ofDays(60))));
        MusicScanner scanner = scanner();

        ScanReport first = scanner.scan();

        assertEquals(1, first.getScanErrors().size());
        assertEquals(1, bandRepository.load("Queen").getLocalAlbumsCount());
        assertNotNull(indexRepository.load().getEntry("Queen"));
        try (Stream<Path> files = Files.list(queen)) {
            long backups = files.map(p -> p.getFileName().toString())
                .filter(name -> name.startsWith(BandDocument.FILE_NAME + AtomicFileStore.TIMESTAMPED_BACKUP_MARKER))
                .count();
            assertEquals(1, backups);
        }

        ScanReport second = scanner.scan();

        assertTrue(second.getScanErrors().isEmpty());
        assertTrue(second.getCacheWarnings().isEmpty());
    }

    @Test
    @DisplayName("文档内乐队名与目录名不同时索引仍按目录名记录")
    void scan_bandNameDiffersFromFolder_indexKeyedByFolder() throws Exception {
        Path beatles = musicRoot.resolve("The Beatles");
        LibraryFixtures.album(beatles, "1969 - Abbey Road", 17);
        Files.write(beatles.resolve(BandDocument.FILE_NAME),
            "{\"band_name\": \"Beatles\", \"albums\": []}".getBytes(StandardCharsets.UTF_8));
        MusicScanner scanner = scanner();
        scanner.scan();

        ScanReport second = scanner.scan();

        assertEquals(0, second.getBandsRemoved());
        assertTrue(second.getChangesDetected().isEmpty());
        CollectionIndex index = indexRepository.load();
        assertEquals(1, index.getBands().size());
        assertNotNull(index.getEntry("The Beatles"));
        assertNull(index.getEntry("Beatles"));
        assertEquals("Beatles", bandRepository.load("The Beatles").getBandName());
    }

    @Test
    @DisplayName("过期文档产生缓存警告并被重写")
    void scan_expiredDocument_warnsAndRewrites() throws Exception {
        LibraryFixtures.album(musicRoot.resolve("Queen"), "1975 - A Night at the Opera", 12);
        scanner().scan();

        ScanReport later = scanner(Clock.offset(Clock.systemDefaultZone(), Duration.ofDays(31))).scan();

        assertEquals(1, later.getCacheWarnings().size());
        assertTrue(later.isChangesMade());
    }

    @Test
    @DisplayName("目录被删除的乐队从索引中移除")
    void scan_removedBand_droppedFromIndex() throws Exception {
        LibraryFixtures.album(musicRoot.resolve("Queen"), "1975 - A Night at the Opera", 12);
        Path rush = LibraryFixtures.album(musicRoot.resolve("Rush"), "1981 - Moving Pictures", 7).getParent();
        MusicScanner scanner = scanner();
        scanner.scan();

        try (Stream<Path> files = Files.walk(rush)) {
            for (Path path : files.sorted((a, b) -> b.compareTo(a)).collect(Collectors.toList())) {
                Files.delete(path);
            }
        }
        ScanReport report = scanner.scan();

        assertEquals(1, report.getBandsRemoved());
        assertNull(indexRepository.load().getEntry("Rush"));
        assertEquals(1, indexRepository.load().getStats().getTotalBands());
    }

    @Test
    @DisplayName("损坏的索引被重新生成")
    void scan_corruptedIndex_rebuilt() throws Exception {
        LibraryFixtures.album(musicRoot.resolve("Queen"), "1975 - A Night at the Opera", 12);
        Files.write(indexRepository.indexPath(), "[]".getBytes(StandardCharsets.UTF_8));

        ScanReport report = scanner().scan();

        assertEquals(1, report.getScanErrors().size());
        assertNotNull(indexRepository.load().getEntry("Queen"));
    }

    @Test
    @DisplayName("根目录不存在时报校验错误")
    void scan_missingRoot_throwsValidation() {
        MusicScanner scanner = new MusicScanner(musicRoot.resolve("nope"), store, bandRepository, indexRepository,
            null, new AlbumFolderLocator(new AlbumFolderParser()), new BandStructureDetector(),
            new AlbumReconciler(), null, Clock.systemDefaultZone());

        LibraryException e = assertThrows(LibraryException.class, scanner::scan);
        assertEquals(ErrorKind.VALIDATION, e.getKind());
    }
}
