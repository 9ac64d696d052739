package com.lux032.musiclibrary.scanner;

import com.lux032.musiclibrary.model.AlbumRecord;
import com.lux032.musiclibrary.model.AlbumType;
import com.lux032.musiclibrary.model.BandDocument;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 把磁盘上的专辑和已有元数据对齐
 *
 * <p>先按专辑身份键匹配，匹配不到时再按名称匹配（年份、版本有一方为空或相同）。
 * 匹配到的专辑保留年份、流派、时长等已有信息，刷新曲目数和路径；
 * 没有匹配到的已有专辑移入 albums_missing；新专辑追加到 albums。
 */
@Slf4j
public class AlbumReconciler {

    @Data
    public static class ReconcileResult {
        private int matched;
        private int added;
        private int missing;
    }

    public ReconcileResult reconcile(BandDocument document, List<DiscoveredAlbum> discovered) {
        ReconcileResult result = new ReconcileResult();

        List<AlbumRecord> existing = new ArrayList<>();
        if (document.getAlbums() != null) {
            existing.addAll(document.getAlbums());
        }
        if (document.getAlbumsMissing() != null) {
            existing.addAll(document.getAlbumsMissing());
        }

        Map<String, DiscoveredAlbum> byKey = new HashMap<>();
        for (DiscoveredAlbum album : discovered) {
            byKey.putIfAbsent(album.identityKey(), album);
        }

        Set<DiscoveredAlbum> used = new HashSet<>();
        List<AlbumRecord> local = new ArrayList<>();
        List<AlbumRecord> missing = new ArrayList<>();

        for (AlbumRecord album : existing) {
            DiscoveredAlbum match = byKey.get(album.identityKey());
            if (match == null || used.contains(match)) {
                match = findByName(album, discovered, used);
            }
            if (match != null) {
                used.add(match);
                refresh(album, match);
                local.add(album);
                result.setMatched(result.getMatched() + 1);
            } else {
                album.setTrackCount(0);
                album.setFolderPath("");
                missing.add(album);
                result.setMissing(result.getMissing() + 1);
                log.debug("专辑不在本地: {} - {}", document.getBandName(), album.getAlbumName());
            }
        }

        for (DiscoveredAlbum album : discovered) {
            if (!used.contains(album)) {
                AlbumRecord record = album.toAlbumRecord();
                local.add(record);
                result.setAdded(result.getAdded() + 1);
                log.debug("新增本地专辑: {} - {}", document.getBandName(), record.getAlbumName());
            }
        }

        document.setAlbums(local);
        document.setAlbumsMissing(missing);
        document.normalizeAlbums();
        return result;
    }

    private DiscoveredAlbum findByName(AlbumRecord album, List<DiscoveredAlbum> discovered, Set<DiscoveredAlbum> used) {
        for (DiscoveredAlbum candidate : discovered) {
            if (used.contains(candidate)) {
                continue;
            }
            ParsedAlbumFolder parsed = candidate.getParsed();
            if (parsed.getAlbumName().equalsIgnoreCase(album.getAlbumName().trim())
                && compatible(album.getYear(), parsed.getYear())
                && compatible(album.getEdition(), parsed.getEdition())) {
                return candidate;
            }
        }
        return null;
    }

    private static boolean compatible(String stored, String detected) {
        return stored == null || stored.isEmpty() || detected == null || detected.isEmpty()
            || stored.equalsIgnoreCase(detected);
    }

    private static void refresh(AlbumRecord album, DiscoveredAlbum match) {
        ParsedAlbumFolder parsed = match.getParsed();
        album.setTrackCount(match.getTrackCount());
        album.setFolderPath(match.getFolderPath());
        if (parsed.isTypeFromFolder() || parsed.getAlbumType() != AlbumType.ALBUM) {
            album.setType(parsed.getAlbumType());
        }
        if (!parsed.getEdition().isEmpty()) {
            album.setEdition(parsed.getEdition());
        }
        if (album.getYear().isEmpty() && parsed.hasYear()) {
            album.setYear(parsed.getYear());
        }
    }
}
