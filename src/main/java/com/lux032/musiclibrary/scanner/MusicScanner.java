package com.lux032.musiclibrary.scanner;

import com.google.gson.Gson;
import com.lux032.musiclibrary.cache.CacheStatus;
import com.lux032.musiclibrary.cache.CacheValidator;
import com.lux032.musiclibrary.error.ErrorKind;
import com.lux032.musiclibrary.error.LibraryException;
import com.lux032.musiclibrary.model.AlbumRecord;
import com.lux032.musiclibrary.model.BandDocument;
import com.lux032.musiclibrary.model.CollectionIndex;
import com.lux032.musiclibrary.model.CollectionIndexEntry;
import com.lux032.musiclibrary.model.FolderStructure;
import com.lux032.musiclibrary.storage.AtomicFileStore;
import com.lux032.musiclibrary.storage.BandDocumentRepository;
import com.lux032.musiclibrary.storage.CollectionIndexRepository;
import com.lux032.musiclibrary.util.I18nUtil;
import com.lux032.musiclibrary.util.JsonSupport;
import com.lux032.musiclibrary.util.LibraryLayout;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 音乐库扫描
 *
 * <p>遍历根目录下的乐队目录，发现专辑文件夹，与已有元数据对齐后写回乐队文档，
 * 最后一次性更新收藏索引。单个乐队或文件夹的读取错误记录在 scan_errors 中，不中断扫描。
 */
@Slf4j
public class MusicScanner {

    private final Path musicRoot;
    private final AtomicFileStore store;
    private final BandDocumentRepository bandRepository;
    private final CollectionIndexRepository indexRepository;
    private final CacheValidator cacheValidator;
    private final AlbumFolderLocator locator;
    private final BandStructureDetector structureDetector;
    private final AlbumReconciler reconciler;
    private final TrackDurationReader durationReader;
    private final Clock clock;

    /**
     * @param durationReader 为 null 时不读取专辑时长
     */
    public MusicScanner(Path musicRoot, AtomicFileStore store, BandDocumentRepository bandRepository,
                        CollectionIndexRepository indexRepository, CacheValidator cacheValidator,
                        AlbumFolderLocator locator, BandStructureDetector structureDetector,
                        AlbumReconciler reconciler, TrackDurationReader durationReader, Clock clock) {
        this.musicRoot = musicRoot;
        this.store = store;
        this.bandRepository = bandRepository;
        this.indexRepository = indexRepository;
        this.cacheValidator = cacheValidator;
        this.locator = locator;
        this.structureDetector = structureDetector;
        this.reconciler = reconciler;
        this.durationReader = durationReader;
        this.clock = clock;
    }

    public ScanReport scan() throws LibraryException {
        if (!Files.isDirectory(musicRoot)) {
            throw new LibraryException(ErrorKind.VALIDATION, "音乐库根目录不存在: " + musicRoot);
        }

        ScanReport report = new ScanReport();
        report.setCollectionPath(musicRoot.toString());
        report.setScanTimestamp(JsonSupport.now(clock));

        log.info("========================================");
        log.info("开始扫描音乐库: {}", musicRoot);

        List<Path> bandFolders;
        try {
            bandFolders = LibraryLayout.listBandFolders(musicRoot);
        } catch (IOException e) {
            throw new LibraryException(ErrorKind.SCANNING, "无法列出乐队目录: " + musicRoot + " - " + e.getMessage(), e);
        }
        report.setBandsDiscovered(bandFolders.size());

        Map<String, CollectionIndexEntry> scanned = new LinkedHashMap<>();
        Set<String> failed = new LinkedHashSet<>();
        int documentsWritten = 0;

        for (Path bandFolder : bandFolders) {
            String bandName = bandFolder.getFileName().toString();
            try {
                BandOutcome outcome = scanBand(bandFolder, report);
                scanned.put(bandName, outcome.entry);
                report.getBands().add(outcome.result);
                if (outcome.written) {
                    documentsWritten++;
                }
            } catch (LibraryException e) {
                log.warn("扫描乐队失败: {} - {}", bandName, e.getMessage());
                report.getScanErrors().add(bandName + ": " + e.getMessage());
                failed.add(bandName);
            }
        }

        updateIndex(scanned, failed, report);
        report.setChangesMade(documentsWritten > 0 || !report.getChangesDetected().isEmpty());

        log.info("扫描完成: 乐队 {} 个，专辑 {} 张，曲目 {} 首，缺失专辑 {} 张，错误 {} 个",
            report.getBandsDiscovered(), report.getAlbumsDiscovered(), report.getTotalTracks(),
            report.getMissingAlbums(), report.getScanErrors().size());
        log.info("========================================");
        return report;
    }

    private BandOutcome scanBand(Path bandFolder, ScanReport report) throws LibraryException {
        String bandName = bandFolder.getFileName().toString();
        List<String> folderErrors = new ArrayList<>();
        List<DiscoveredAlbum> albums;
        try {
            albums = locator.discover(bandFolder, folderErrors);
        } catch (IOException e) {
            throw new LibraryException(ErrorKind.SCANNING, "无法读取乐队目录: " + e.getMessage(), e);
        }
        report.getScanErrors().addAll(folderErrors);

        FolderStructure structure = structureDetector.detect(albums);
        Map<String, String> durations = readDurations(albums);
        Gson gson = store.getGson();

        BandDocument document;
        boolean written = true;
        CacheStatus status = cacheValidator.bandStatus(bandName);
        if (status == CacheStatus.CORRUPTED) {
            document = rebuild(bandName, albums, structure, durations, report);
        } else {
            if (status == CacheStatus.EXPIRED) {
                report.getCacheWarnings().add(I18nUtil.getMessage("scan.warning.expired", bandName,
                    cacheValidator.getTtl().toDays()));
            }
            BandDocument[] latest = new BandDocument[1];
            try {
                BandDocument updated = bandRepository.update(bandName, current -> {
                    BandDocument doc = current != null ? current : new BandDocument(bandName);
                    String before = current != null ? gson.toJson(current) : null;
                    apply(doc, albums, structure, durations);
                    latest[0] = doc;
                    // 内容没变时不写，过期文档总是重写以刷新修改时间
                    boolean unchanged = before != null && before.equals(gson.toJson(doc));
                    return unchanged && status != CacheStatus.EXPIRED ? null : doc;
                });
                document = latest[0];
                written = updated != null;
            } catch (LibraryException e) {
                // 过期状态只看修改时间，内容可能同时已损坏
                if (e.getKind() != ErrorKind.DOCUMENT_CORRUPT) {
                    throw e;
                }
                document = rebuild(bandName, albums, structure, durations, report);
            }
        }

        for (DiscoveredAlbum album : albums) {
            report.setTotalTracks(report.getTotalTracks() + album.getTrackCount());
        }
        report.setAlbumsDiscovered(report.getAlbumsDiscovered() + albums.size());
        report.setMissingAlbums(report.getMissingAlbums() + document.getMissingAlbumsCount());

        BandOutcome outcome = new BandOutcome();
        outcome.entry = CollectionIndexEntry.fromDocument(document, bandName);
        outcome.result = toResult(document, bandName, structure);
        outcome.written = written;
        return outcome;
    }

    private BandDocument rebuild(String bandName, List<DiscoveredAlbum> albums, FolderStructure structure,
                                 Map<String, String> durations, ScanReport report) throws LibraryException {
        Path backup = store.createTimestampedBackup(bandRepository.documentPath(bandName));
        log.warn("乐队元数据已损坏，重新生成: {}，备份: {}", bandName, backup);
        report.getScanErrors().add(I18nUtil.getMessage("scan.error.corrupted", bandName, backup.getFileName()));
        BandDocument document = new BandDocument(bandName);
        apply(document, albums, structure, durations);
        bandRepository.save(document);
        return document;
    }

    private void apply(BandDocument document, List<DiscoveredAlbum> albums, FolderStructure structure,
                       Map<String, String> durations) {
        AlbumReconciler.ReconcileResult reconciled = reconciler.reconcile(document, albums);
        log.debug("专辑对齐 {}: 匹配 {}, 新增 {}, 缺失 {}", document.getBandName(),
            reconciled.getMatched(), reconciled.getAdded(), reconciled.getMissing());
        document.setFolderStructure(structure);
        for (AlbumRecord album : document.getAlbums()) {
            String duration = durations.get(album.getFolderPath());
            if (album.getDuration().isEmpty() && duration != null && !duration.isEmpty()) {
                album.setDuration(duration);
            }
        }
    }

    private Map<String, String> readDurations(List<DiscoveredAlbum> albums) {
        Map<String, String> durations = new HashMap<>();
        if (durationReader == null) {
            return durations;
        }
        for (DiscoveredAlbum album : albums) {
            durations.put(album.getFolderPath(), durationReader.readAlbumDuration(album.getFolder()));
        }
        return durations;
    }

    private BandScanResult toResult(BandDocument document, String bandName, FolderStructure structure) {
        BandScanResult result = new BandScanResult();
        result.setBandName(bandName);
        result.setFolderPath(bandName);
        result.setAlbumsCount(document.getAlbumsCount());
        result.setLocalAlbumsCount(document.getLocalAlbumsCount());
        result.setMissingAlbumsCount(document.getMissingAlbumsCount());
        result.setHasMetadata(document.getLastMetadataSaved() != null);
        result.setStructureType(structure.getStructureType());
        for (AlbumRecord album : document.getAlbums()) {
            result.setTotalTracks(result.getTotalTracks() + album.getTrackCount());
            result.getAlbumTypesDistribution().merge(album.getType().getDisplayName(), 1, Integer::sum);
        }
        return result;
    }

    private void updateIndex(Map<String, CollectionIndexEntry> scanned, Set<String> failed, ScanReport report)
            throws LibraryException {
        try {
            indexRepository.update(current -> applyScan(current, scanned, failed, report));
        } catch (LibraryException e) {
            if (e.getKind() != ErrorKind.DOCUMENT_CORRUPT) {
                throw e;
            }
            Path backup = store.createTimestampedBackup(indexRepository.indexPath());
            log.warn("收藏索引已损坏，重新生成，备份: {}", backup);
            report.getScanErrors().add(I18nUtil.getMessage("scan.error.index.corrupted", backup.getFileName()));
            indexRepository.save(applyScan(new CollectionIndex(), scanned, failed, report));
        }
    }

    /**
     * 用本次扫描结果替换索引条目，并和上一次的索引比较得出变化
     */
    private CollectionIndex applyScan(CollectionIndex previous, Map<String, CollectionIndexEntry> scanned,
                                      Set<String> failed, ScanReport report) {
        Map<String, CollectionIndexEntry> previousEntries = new HashMap<>();
        for (CollectionIndexEntry entry : previous.getBands()) {
            previousEntries.put(entry.getName(), entry);
        }

        List<String> changes = new ArrayList<>();
        int added = 0;
        int updated = 0;
        int removed = 0;
        List<CollectionIndexEntry> entries = new ArrayList<>();

        for (CollectionIndexEntry entry : scanned.values()) {
            CollectionIndexEntry old = previousEntries.get(entry.getName());
            if (old == null) {
                added++;
                changes.add(I18nUtil.getMessage("scan.change.added", entry.getName(), entry.getAlbumsCount()));
            } else if (old.getAlbumsCount() != entry.getAlbumsCount()
                || old.getLocalAlbumsCount() != entry.getLocalAlbumsCount()) {
                updated++;
                changes.add(I18nUtil.getMessage("scan.change.updated", entry.getName(),
                    String.format("%+d", entry.getLocalAlbumsCount() - old.getLocalAlbumsCount())));
            }
            entries.add(entry);
        }
        for (String bandName : failed) {
            CollectionIndexEntry old = previousEntries.get(bandName);
            if (old != null) {
                entries.add(old);
            }
        }
        for (CollectionIndexEntry old : previous.getBands()) {
            if (!scanned.containsKey(old.getName()) && !failed.contains(old.getName())) {
                removed++;
                changes.add(I18nUtil.getMessage("scan.change.removed", old.getName()));
                log.info("乐队目录已不存在，从索引移除: {}", old.getName());
            }
        }

        entries.sort(Comparator.comparing(CollectionIndexEntry::getName, String.CASE_INSENSITIVE_ORDER));
        previous.setBands(entries);
        previous.setLastScan(report.getScanTimestamp());
        previous.setMetadataVersion(CollectionIndex.CURRENT_METADATA_VERSION);

        report.setBandsAdded(added);
        report.setBandsUpdated(updated);
        report.setBandsRemoved(removed);
        report.setChangesDetected(changes);
        return previous;
    }

    private static final class BandOutcome {
        private CollectionIndexEntry entry;
        private BandScanResult result;
        private boolean written;
    }
}
