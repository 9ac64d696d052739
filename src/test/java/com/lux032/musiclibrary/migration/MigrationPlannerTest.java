package com.lux032.musiclibrary.migration;

import com.lux032.musiclibrary.LibraryFixtures;
import com.lux032.musiclibrary.error.ErrorKind;
import com.lux032.musiclibrary.error.LibraryException;
import com.lux032.musiclibrary.model.AlbumType;
import com.lux032.musiclibrary.model.BandDocument;
import com.lux032.musiclibrary.model.FolderStructure;
import com.lux032.musiclibrary.model.StructureType;
import com.lux032.musiclibrary.scanner.AlbumFolderLocator;
import com.lux032.musiclibrary.scanner.AlbumFolderParser;
import com.lux032.musiclibrary.scanner.DiscoveredAlbum;
import com.lux032.musiclibrary.util.I18nUtil;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("迁移计划测试")
class MigrationPlannerTest {

    @TempDir
    Path band;

    private final MigrationPlanner planner = new MigrationPlanner();
    private final AlbumFolderLocator locator = new AlbumFolderLocator(new AlbumFolderParser());

    @BeforeEach
    void setUp() {
        I18nUtil.init("en_US");
    }

    private List<DiscoveredAlbum> discover() throws Exception {
        return locator.discover(band, new ArrayList<>());
    }

    @Test
    @DisplayName("混合结构: 平铺专辑移入类型文件夹，已在类型文件夹的不动")
    void plan_mixedToEnhanced() throws Exception {
        LibraryFixtures.album(band, "1970 - Live at Leeds", 6);
        LibraryFixtures.album(band, "Album/1971 - Who's Next", 9);

        MigrationPlan plan = planner.plan(new MigrationRequest("The Who", MigrationType.MIXED_TO_ENHANCED),
            discover(), null);

        assertEquals(1, plan.getOperations().size());
        MigrationOperation operation = plan.getOperations().get(0);
        assertEquals("Live/1970 - Live at Leeds", operation.getTargetPath());
        assertEquals(AlbumType.LIVE, operation.getAlbumType());
        assertEquals(OperationType.MOVE, operation.getOperationType());
    }

    @Test
    @DisplayName("目标已被其他专辑占用时跳过")
    void plan_occupiedTarget_skipped() throws Exception {
        LibraryFixtures.album(band, "1971 - Who's Next", 9);
        LibraryFixtures.album(band, "Album/1971 - Who's Next", 9);

        MigrationPlan plan = planner.plan(new MigrationRequest("The Who", MigrationType.MIXED_TO_ENHANCED),
            discover(), null);

        assertTrue(plan.isEmpty());
        assertEquals(1, plan.getSkippedAlbums().size());
    }

    @Test
    @DisplayName("直接放音轨的类型文件夹跳过")
    void plan_typeFolderWithLooseTracks_skipped() throws Exception {
        LibraryFixtures.album(band, "Live", 3);
        LibraryFixtures.album(band, "Live/1970 - Live at Leeds", 6);

        MigrationPlan plan = planner.plan(new MigrationRequest("The Who", MigrationType.MIXED_TO_ENHANCED),
            discover(), null);

        assertTrue(plan.isEmpty());
        assertEquals(1, plan.getSkippedAlbums().size());
    }

    @Test
    @DisplayName("类型优先级: 覆盖 > 类型文件夹 > 元数据 > 推断")
    void resolveType_precedence() throws Exception {
        LibraryFixtures.album(band, "1975 - Live Killers", 10);
        BandDocument document = new BandDocument("Queen");
        document.getAlbums().add(LibraryFixtures.record("Live Killers", "1975", AlbumType.COMPILATION, 10, ""));
        DiscoveredAlbum album = discover().get(0);

        assertEquals(AlbumType.LIVE, planner.resolveType(null, album, null));
        assertEquals(AlbumType.COMPILATION,
            planner.resolveType(null, album, MigrationPlanner.findRecord(document, album)));

        MigrationRequest request = new MigrationRequest("Queen", MigrationType.DEFAULT_TO_ENHANCED);
        request.getAlbumTypeOverrides().put("live killers", AlbumType.DEMO);
        assertEquals(AlbumType.DEMO, planner.resolveType(request.getAlbumTypeOverrides(), album,
            MigrationPlanner.findRecord(document, album)));
    }

    @Test
    @DisplayName("校验: 缺少类型、没有专辑、结构不符")
    void validate_rejectsInvalidRequests() {
        FolderStructure structure = new FolderStructure();
        structure.setStructureType(StructureType.DEFAULT);

        LibraryException missingType = assertThrows(LibraryException.class,
            () -> planner.validate(new MigrationRequest("Queen", null), structure));
        assertEquals(ErrorKind.VALIDATION, missingType.getKind());

        assertThrows(LibraryException.class, () ->
            planner.validate(new MigrationRequest("Queen", MigrationType.DEFAULT_TO_ENHANCED), new FolderStructure()));
        assertThrows(LibraryException.class, () ->
            planner.validate(new MigrationRequest("Queen", MigrationType.MIXED_TO_ENHANCED), structure));

        MigrationRequest forced = new MigrationRequest("Queen", MigrationType.MIXED_TO_ENHANCED);
        forced.setForce(true);
        assertDoesNotThrow(() -> planner.validate(forced, structure));
    }
}
