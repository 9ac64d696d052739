package com.lux032.musiclibrary.storage;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.lux032.musiclibrary.util.JsonSupport;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.BiConsumer;

/**
 * 文档结构升级
 *
 * <p>每条规则对应一个版本，只补齐或改名字段；规则在已升级的文档上不产生任何变化，
 * 因此重复执行是安全的。
 */
public class DocumentSchemaMigrator {

    public static final String CURRENT_VERSION = "2.0";
    public static final List<String> SUPPORTED_VERSIONS = Collections.unmodifiableList(Arrays.asList("1.0", "2.0"));

    private final Clock clock;
    private final List<Rule> bandRules;

    public DocumentSchemaMigrator(Clock clock) {
        this.clock = clock;
        this.bandRules = Arrays.asList(
            new Rule("1.0", "backfill last_updated", this::backfillLastUpdated),
            new Rule("1.0", "genre -> genres", DocumentSchemaMigrator::genreToGenres),
            new Rule("1.0", "tracks_count -> track_count", DocumentSchemaMigrator::renameTracksCount),
            new Rule("1.0", "backfill albums_count", DocumentSchemaMigrator::backfillAlbumsCount),
            new Rule("2.0", "missing flag -> albums_missing", DocumentSchemaMigrator::splitMissingAlbums),
            new Rule("2.0", "analyze -> analysis", DocumentSchemaMigrator::renameAnalyze)
        );
    }

    public static boolean isSupported(String version) {
        return SUPPORTED_VERSIONS.contains(version);
    }

    /**
     * 升级乐队文档（原地修改）
     * @return 变更说明，为空表示文档已是目标版本
     */
    public List<String> upgradeBand(JsonObject document, String targetVersion) {
        List<String> changes = new ArrayList<>();
        for (Rule rule : bandRules) {
            if (compareVersions(rule.version, targetVersion) <= 0) {
                rule.action.accept(document, changes);
            }
        }
        return changes;
    }

    /**
     * 升级索引文档（原地修改）
     */
    public List<String> upgradeIndex(JsonObject index, String targetVersion) {
        List<String> changes = new ArrayList<>();
        String current = index.has("metadata_version") && index.get("metadata_version").isJsonPrimitive()
            ? index.get("metadata_version").getAsString() : "1.0";
        if (compareVersions(current, targetVersion) < 0) {
            index.addProperty("metadata_version", targetVersion);
            changes.add("metadata_version: " + current + " -> " + targetVersion);
        } else if (!index.has("metadata_version")) {
            index.addProperty("metadata_version", current);
            changes.add("added metadata_version " + current);
        }
        if (!index.has("bands") || !index.get("bands").isJsonArray()) {
            index.add("bands", new JsonArray());
            changes.add("added bands list");
        }
        return changes;
    }

    static int compareVersions(String left, String right) {
        String[] a = left.split("\\.");
        String[] b = right.split("\\.");
        for (int i = 0; i < Math.max(a.length, b.length); i++) {
            int x = i < a.length ? parsePart(a[i]) : 0;
            int y = i < b.length ? parsePart(b[i]) : 0;
            if (x != y) {
                return Integer.compare(x, y);
            }
        }
        return 0;
    }

    private static int parsePart(String part) {
        try {
            return Integer.parseInt(part.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    // ---- 规则 ----

    private void backfillLastUpdated(JsonObject doc, List<String> changes) {
        if (!doc.has("last_updated") || doc.get("last_updated").isJsonNull()) {
            doc.addProperty("last_updated", JsonSupport.now(clock));
            changes.add("added last_updated");
        }
    }

    private static void genreToGenres(JsonObject doc, List<String> changes) {
        if (!doc.has("genre")) {
            return;
        }
        JsonElement genre = doc.remove("genre");
        if (!doc.has("genres")) {
            JsonArray genres = new JsonArray();
            if (genre.isJsonPrimitive() && !genre.getAsString().trim().isEmpty()) {
                genres.add(genre.getAsString().trim());
            } else if (genre.isJsonArray()) {
                genres.addAll(genre.getAsJsonArray());
            }
            doc.add("genres", genres);
        }
        changes.add("renamed genre to genres");
    }

    private static void renameTracksCount(JsonObject doc, List<String> changes) {
        int renamed = 0;
        for (JsonObject album : albumObjects(doc, "albums")) {
            renamed += renameTracksCountOnAlbum(album);
        }
        for (JsonObject album : albumObjects(doc, "albums_missing")) {
            renamed += renameTracksCountOnAlbum(album);
        }
        if (renamed > 0) {
            changes.add("renamed tracks_count to track_count on " + renamed + " album(s)");
        }
    }

    private static int renameTracksCountOnAlbum(JsonObject album) {
        if (!album.has("tracks_count")) {
            return 0;
        }
        JsonElement legacy = album.remove("tracks_count");
        if (!album.has("track_count")) {
            album.add("track_count", legacy.isJsonPrimitive() ? legacy : new JsonPrimitive(0));
        }
        return 1;
    }

    private static void backfillAlbumsCount(JsonObject doc, List<String> changes) {
        if (!doc.has("albums_count")) {
            doc.addProperty("albums_count", albumObjects(doc, "albums").size() + albumObjects(doc, "albums_missing").size());
            changes.add("added albums_count");
        }
    }

    private static void splitMissingAlbums(JsonObject doc, List<String> changes) {
        if (!doc.has("albums_missing") || !doc.get("albums_missing").isJsonArray()) {
            doc.add("albums_missing", new JsonArray());
            changes.add("added albums_missing");
        }
        JsonArray missing = doc.getAsJsonArray("albums_missing");
        if (!doc.has("albums") || !doc.get("albums").isJsonArray()) {
            return;
        }

        JsonArray local = new JsonArray();
        int moved = 0;
        for (JsonElement element : doc.getAsJsonArray("albums")) {
            if (!element.isJsonObject()) {
                continue;
            }
            JsonObject album = element.getAsJsonObject();
            boolean flagged = album.has("missing") && album.get("missing").isJsonPrimitive()
                && album.get("missing").getAsBoolean();
            if (album.has("missing")) {
                album.remove("missing");
            }
            if (flagged) {
                missing.add(album);
                moved++;
            } else {
                local.add(album);
            }
        }
        for (JsonObject album : albumObjects(doc, "albums_missing")) {
            album.remove("missing");
        }
        if (moved > 0) {
            doc.add("albums", local);
            doc.addProperty("albums_count", local.size() + missing.size());
            changes.add("moved " + moved + " missing album(s) to albums_missing");
        }
    }

    private static void renameAnalyze(JsonObject doc, List<String> changes) {
        if (!doc.has("analyze")) {
            return;
        }
        JsonElement analyze = doc.remove("analyze");
        if (!doc.has("analysis") && !analyze.isJsonNull()) {
            doc.add("analysis", analyze);
        }
        changes.add("renamed analyze to analysis");
    }

    private static List<JsonObject> albumObjects(JsonObject doc, String field) {
        List<JsonObject> result = new ArrayList<>();
        if (doc.has(field) && doc.get(field).isJsonArray()) {
            for (JsonElement element : doc.getAsJsonArray(field)) {
                if (element.isJsonObject()) {
                    result.add(element.getAsJsonObject());
                }
            }
        }
        return result;
    }

    private static final class Rule {
        private final String version;
        private final String description;
        private final BiConsumer<JsonObject, List<String>> action;

        private Rule(String version, String description, BiConsumer<JsonObject, List<String>> action) {
            this.version = version;
            this.description = description;
            this.action = action;
        }

        @Override
        public String toString() {
            return version + ": " + description;
        }
    }
}
