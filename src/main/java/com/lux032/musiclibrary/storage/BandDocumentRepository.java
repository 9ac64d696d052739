package com.lux032.musiclibrary.storage;

import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.lux032.musiclibrary.error.ErrorKind;
import com.lux032.musiclibrary.error.LibraryException;
import com.lux032.musiclibrary.model.BandDocument;
import com.lux032.musiclibrary.util.JsonSupport;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/**
 * 乐队元数据文档的读写
 * 读取时先做结构升级再反序列化，写入前维护专辑不变式
 */
@Slf4j
public class BandDocumentRepository {

    private final Path musicRoot;
    private final AtomicFileStore store;
    private final DocumentSchemaMigrator schemaMigrator;
    private final Clock clock;

    public BandDocumentRepository(Path musicRoot, AtomicFileStore store, DocumentSchemaMigrator schemaMigrator, Clock clock) {
        this.musicRoot = musicRoot;
        this.store = store;
        this.schemaMigrator = schemaMigrator;
        this.clock = clock;
    }

    public Path getMusicRoot() {
        return musicRoot;
    }

    public Path bandFolder(String bandName) throws LibraryException {
        validateBandName(bandName);
        return musicRoot.resolve(bandName);
    }

    public Path documentPath(String bandName) throws LibraryException {
        return bandFolder(bandName).resolve(BandDocument.FILE_NAME);
    }

    public boolean exists(String bandName) throws LibraryException {
        return store.exists(documentPath(bandName));
    }

    /**
     * 读取文档，不存在时抛出 DOCUMENT_NOT_FOUND
     */
    public BandDocument load(String bandName) throws LibraryException {
        return store.<BandDocument>load(documentPath(bandName), tree -> decode(bandName, tree));
    }

    /**
     * 读取文档，不存在时返回 null
     */
    public BandDocument loadIfPresent(String bandName) throws LibraryException {
        try {
            return load(bandName);
        } catch (LibraryException e) {
            if (e.getKind() == ErrorKind.DOCUMENT_NOT_FOUND) {
                return null;
            }
            throw e;
        }
    }

    /**
     * 整体写入，写入前备份旧文件
     */
    public void save(BandDocument document) throws LibraryException {
        prepareForWrite(document);
        store.save(documentPath(document.getBandName()), document, BackupMode.SIDECAR);
    }

    /**
     * 锁内读-改-写，mutator 收到最新文档（不存在时为 null）
     */
    public BandDocument update(String bandName, AtomicFileStore.DocumentMutator<BandDocument> mutator) throws LibraryException {
        return store.<BandDocument>update(documentPath(bandName), tree -> decode(bandName, tree), current -> {
            BandDocument updated = mutator.apply(current);
            if (updated != null) {
                if (updated.getBandName() == null) {
                    updated.setBandName(bandName);
                }
                prepareForWrite(updated);
            }
            return updated;
        }, BackupMode.SIDECAR);
    }

    private void prepareForWrite(BandDocument document) throws LibraryException {
        validateBandName(document.getBandName());
        document.normalizeAlbums();
        document.setLastUpdated(JsonSupport.now(clock));
    }

    BandDocument decode(String bandName, JsonObject tree) throws LibraryException {
        List<String> changes = schemaMigrator.upgradeBand(tree, DocumentSchemaMigrator.CURRENT_VERSION);
        if (!changes.isEmpty()) {
            log.debug("乐队文档 {} 读取时结构升级: {}", bandName, changes);
        }
        BandDocument document;
        try {
            document = store.getGson().fromJson(tree, BandDocument.class);
        } catch (JsonParseException | IllegalStateException | NumberFormatException e) {
            throw new LibraryException(ErrorKind.DOCUMENT_CORRUPT, "乐队文档格式错误: " + bandName + " - " + e.getMessage(), e);
        }
        if (document.getBandName() == null || document.getBandName().trim().isEmpty()) {
            document.setBandName(bandName);
        }
        document.normalizeAlbums();
        return document;
    }

    public static void validateBandName(String bandName) throws LibraryException {
        if (bandName == null || bandName.trim().isEmpty()) {
            throw new LibraryException(ErrorKind.VALIDATION, "乐队名称不能为空");
        }
        if (bandName.contains("/") || bandName.contains("\\") || bandName.equals(".") || bandName.equals("..")) {
            throw new LibraryException(ErrorKind.VALIDATION, "乐队名称不能包含路径: " + bandName);
        }
    }
}
