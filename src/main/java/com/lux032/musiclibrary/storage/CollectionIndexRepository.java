package com.lux032.musiclibrary.storage;

import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.lux032.musiclibrary.error.ErrorKind;
import com.lux032.musiclibrary.error.LibraryException;
import com.lux032.musiclibrary.model.CollectionIndex;
import com.lux032.musiclibrary.model.CollectionIndexEntry;

import java.nio.file.Path;

/**
 * 收藏索引的读写
 * 索引文件是所有索引修改的唯一串行化点
 */
public class CollectionIndexRepository {

    private final Path musicRoot;
    private final AtomicFileStore store;
    private final DocumentSchemaMigrator schemaMigrator;

    public CollectionIndexRepository(Path musicRoot, AtomicFileStore store, DocumentSchemaMigrator schemaMigrator) {
        this.musicRoot = musicRoot;
        this.store = store;
        this.schemaMigrator = schemaMigrator;
    }

    public Path indexPath() {
        return musicRoot.resolve(CollectionIndex.FILE_NAME);
    }

    public boolean exists() {
        return store.exists(indexPath());
    }

    public CollectionIndex load() throws LibraryException {
        return store.load(indexPath(), this::decode);
    }

    public CollectionIndex loadIfPresent() throws LibraryException {
        try {
            return load();
        } catch (LibraryException e) {
            if (e.getKind() == ErrorKind.DOCUMENT_NOT_FOUND) {
                return null;
            }
            throw e;
        }
    }

    public void save(CollectionIndex index) throws LibraryException {
        index.recomputeStats();
        store.save(indexPath(), index, BackupMode.SIDECAR);
    }

    /**
     * 锁内读-改-写，索引不存在时 mutator 收到一个空索引
     */
    public CollectionIndex update(AtomicFileStore.DocumentMutator<CollectionIndex> mutator) throws LibraryException {
        return store.update(indexPath(), this::decode, current -> {
            CollectionIndex updated = mutator.apply(current != null ? current : new CollectionIndex());
            if (updated != null) {
                updated.recomputeStats();
            }
            return updated;
        }, BackupMode.SIDECAR);
    }

    /**
     * 只更新一个乐队的条目
     */
    public CollectionIndex upsertEntry(CollectionIndexEntry entry) throws LibraryException {
        return update(index -> {
            CollectionIndexEntry previous = index.getEntry(entry.getName());
            if (previous != null && (entry.getFolderPath() == null || entry.getFolderPath().isEmpty())) {
                entry.setFolderPath(previous.getFolderPath());
            }
            index.upsert(entry);
            return index;
        });
    }

    CollectionIndex decode(JsonObject tree) throws LibraryException {
        schemaMigrator.upgradeIndex(tree, DocumentSchemaMigrator.CURRENT_VERSION);
        CollectionIndex index;
        try {
            index = store.getGson().fromJson(tree, CollectionIndex.class);
        } catch (JsonParseException | IllegalStateException | NumberFormatException e) {
            throw new LibraryException(ErrorKind.DOCUMENT_CORRUPT, "收藏索引格式错误: " + e.getMessage(), e);
        }
        index.recomputeStats();
        return index;
    }
}
