package com.lux032.musiclibrary.storage;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.lux032.musiclibrary.error.ErrorKind;
import com.lux032.musiclibrary.error.LibraryError;
import com.lux032.musiclibrary.error.LibraryException;
import com.lux032.musiclibrary.util.JsonSupport;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * JSON 文档原子读写
 *
 * <p>写入流程: 获取旁路锁 → (可选) 备份当前文件 → 写入同目录临时文件 → 原子重命名覆盖原文件。
 * 重命名之前的任何失败都会删除临时文件，原文件保持不变。
 */
@Slf4j
public class AtomicFileStore {

    public static final String BACKUP_SUFFIX = ".backup";
    public static final String TIMESTAMPED_BACKUP_MARKER = ".backup_";
    private static final String TEMP_SUFFIX = ".tmp";
    private static final DateTimeFormatter BACKUP_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");

    private final Duration lockTimeout;
    private final Gson gson;
    private final Clock clock;

    public AtomicFileStore(Duration lockTimeout) {
        this(lockTimeout, JsonSupport.gson(), Clock.systemDefaultZone());
    }

    public AtomicFileStore(Duration lockTimeout, Gson gson, Clock clock) {
        this.lockTimeout = lockTimeout;
        this.gson = gson;
        this.clock = clock;
    }

    /**
     * 解析 JSON 树为业务对象
     */
    @FunctionalInterface
    public interface DocumentDecoder<T> {
        T decode(JsonObject tree) throws LibraryException;
    }

    /**
     * 读-改-写中的修改步骤，参数为当前文档（不存在时为 null），返回 null 表示无需写入
     */
    @FunctionalInterface
    public interface DocumentMutator<T> {
        T apply(T current) throws LibraryException;
    }

    public Gson getGson() {
        return gson;
    }

    public boolean exists(Path path) {
        return Files.exists(path);
    }

    /**
     * 读取并解析为指定类型
     */
    public <T> T load(Path path, Class<T> type) throws LibraryException {
        return load(path, tree -> decodeAs(path, tree, type));
    }

    public <T> T load(Path path, DocumentDecoder<T> decoder) throws LibraryException {
        try (SidecarLock lock = SidecarLock.acquire(path, lockTimeout)) {
            return decoder.decode(readTree(path));
        }
    }

    /**
     * 读取原始 JSON 树
     */
    public JsonObject loadTree(Path path) throws LibraryException {
        try (SidecarLock lock = SidecarLock.acquire(path, lockTimeout)) {
            return readTree(path);
        }
    }

    /**
     * 原子写入整个文档
     */
    public void save(Path path, Object document, boolean backup) throws LibraryException {
        save(path, document, backup ? BackupMode.SIDECAR : BackupMode.NONE);
    }

    public void save(Path path, Object document, BackupMode backupMode) throws LibraryException {
        if (document == null) {
            throw new LibraryException(ErrorKind.VALIDATION, "写入的文档不能为空: " + path);
        }
        try (SidecarLock lock = SidecarLock.acquire(path, lockTimeout)) {
            writeLocked(path, document, backupMode);
        }
    }

    /**
     * 在同一个锁范围内重新读取最新内容、修改并写回
     * 并发写入时后拿到锁的一方总是基于前一方的结果修改
     */
    public <T> T update(Path path, DocumentDecoder<T> decoder, DocumentMutator<T> mutator,
                        BackupMode backupMode) throws LibraryException {
        try (SidecarLock lock = SidecarLock.acquire(path, lockTimeout)) {
            T current = Files.exists(path) ? decoder.decode(readTree(path)) : null;
            T updated = mutator.apply(current);
            if (updated != null) {
                writeLocked(path, updated, backupMode);
            }
            return updated;
        }
    }

    /**
     * 创建带时间戳的备份 {@code <file>.backup_yyyyMMdd_HHmmss_SSS}
     */
    public Path createTimestampedBackup(Path path) throws LibraryException {
        try (SidecarLock lock = SidecarLock.acquire(path, lockTimeout)) {
            if (!Files.exists(path)) {
                throw new LibraryException(ErrorKind.DOCUMENT_NOT_FOUND, "文档不存在: " + path);
            }
            return copyToTimestampedBackup(path);
        }
    }

    /**
     * 用 {@code <file>.backup} 恢复文档
     */
    public void restoreFromBackup(Path path) throws LibraryException {
        Path backupPath = sidecarBackupPath(path);
        try (SidecarLock lock = SidecarLock.acquire(path, lockTimeout)) {
            if (!Files.exists(backupPath)) {
                throw new LibraryException(ErrorKind.DOCUMENT_NOT_FOUND, "备份文件不存在: " + backupPath);
            }
            Path temp = null;
            try {
                temp = Files.createTempFile(path.toAbsolutePath().getParent(), "." + path.getFileName(), TEMP_SUFFIX);
                Files.copy(backupPath, temp, StandardCopyOption.REPLACE_EXISTING);
                moveAtomically(temp, path);
                log.info("已从备份恢复: {}", path);
            } catch (IOException e) {
                deleteTemp(temp);
                throw new LibraryException(ErrorKind.STORAGE_IO, "从备份恢复失败: " + path, e);
            }
        }
    }

    /**
     * 查找最新的时间戳备份，没有时返回 null
     */
    public Path latestTimestampedBackup(Path path) throws LibraryException {
        List<Path> backups = listTimestampedBackups(path);
        return backups.isEmpty() ? null : backups.get(0);
    }

    /**
     * 每个文档只保留最新的 maxBackups 个时间戳备份
     * 扫描根目录及其下一层目录
     */
    public BackupCleanupResult cleanupBackups(Path root, int maxBackups) throws LibraryException {
        BackupCleanupResult result = new BackupCleanupResult();
        Map<Path, List<Path>> grouped = new HashMap<>();

        try (Stream<Path> stream = Files.walk(root, 2)) {
            for (Path file : stream.filter(Files::isRegularFile).collect(Collectors.toList())) {
                String name = file.getFileName().toString();
                int marker = name.indexOf(TIMESTAMPED_BACKUP_MARKER);
                if (marker > 0) {
                    Path document = file.resolveSibling(name.substring(0, marker));
                    grouped.computeIfAbsent(document, k -> new ArrayList<>()).add(file);
                }
            }
        } catch (IOException e) {
            throw new LibraryException(ErrorKind.STORAGE_IO, "无法遍历备份目录: " + root, e);
        }

        for (List<Path> backups : grouped.values()) {
            backups.sort(Comparator.comparing((Path p) -> p.getFileName().toString()).reversed());
            for (Path old : backups.subList(Math.min(maxBackups, backups.size()), backups.size())) {
                try {
                    long size = Files.size(old);
                    Files.delete(old);
                    result.setBackupsRemoved(result.getBackupsRemoved() + 1);
                    result.setBytesFreed(result.getBytesFreed() + size);
                    log.debug("已删除旧备份: {}", old);
                } catch (IOException e) {
                    log.warn("删除旧备份失败: {} - {}", old, e.getMessage());
                    result.getErrors().add(old + ": " + e.getMessage());
                }
            }
        }

        if (result.getBackupsRemoved() > 0) {
            log.info("清理旧备份 {} 个，释放 {} 字节", result.getBackupsRemoved(), result.getBytesFreed());
        }
        return result;
    }

    public static Path sidecarBackupPath(Path path) {
        return path.resolveSibling(path.getFileName() + BACKUP_SUFFIX);
    }

    // ---- 以下方法要求调用方已持有锁 ----

    private JsonObject readTree(Path path) throws LibraryException {
        if (!Files.exists(path)) {
            throw new LibraryException(ErrorKind.DOCUMENT_NOT_FOUND, "文档不存在: " + path);
        }
        String content;
        try {
            content = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new LibraryException(ErrorKind.STORAGE_IO, "读取文档失败: " + path, e);
        }
        try {
            JsonElement element = JsonParser.parseString(content);
            if (!element.isJsonObject()) {
                throw corrupt(path, "根节点不是 JSON 对象", null);
            }
            return element.getAsJsonObject();
        } catch (JsonParseException e) {
            throw corrupt(path, e.getMessage(), e);
        }
    }

    private <T> T decodeAs(Path path, JsonObject tree, Class<T> type) throws LibraryException {
        try {
            return gson.fromJson(tree, type);
        } catch (JsonParseException | IllegalStateException | NumberFormatException e) {
            throw corrupt(path, e.getMessage(), e);
        }
    }

    private void writeLocked(Path path, Object document, BackupMode backupMode) throws LibraryException {
        Path parent = path.toAbsolutePath().getParent();
        Path temp = null;
        try {
            Files.createDirectories(parent);
            if (Files.exists(path)) {
                switch (backupMode) {
                    case SIDECAR:
                        Files.copy(path, sidecarBackupPath(path), StandardCopyOption.REPLACE_EXISTING);
                        break;
                    case TIMESTAMPED:
                        copyToTimestampedBackup(path);
                        break;
                    default:
                        break;
                }
            }

            temp = Files.createTempFile(parent, "." + path.getFileName(), TEMP_SUFFIX);
            try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                gson.toJson(document, writer);
            }
            moveAtomically(temp, path);
            log.debug("文档已保存: {}", path);
        } catch (IOException | RuntimeException e) {
            deleteTemp(temp);
            throw new LibraryException(LibraryError.of(ErrorKind.STORAGE_IO, "写入文档失败: " + path + " - " + e.getMessage())
                .withDetail("path", path.toString()), e);
        }
    }

    private Path copyToTimestampedBackup(Path path) throws LibraryException {
        String base = path.getFileName() + TIMESTAMPED_BACKUP_MARKER + LocalDateTime.now(clock).format(BACKUP_TIMESTAMP);
        Path backup = path.resolveSibling(base);
        int suffix = 1;
        while (Files.exists(backup)) {
            backup = path.resolveSibling(base + "_" + suffix++);
        }
        try {
            Files.copy(path, backup);
            log.debug("已创建备份: {}", backup);
            return backup;
        } catch (IOException e) {
            throw new LibraryException(ErrorKind.STORAGE_IO, "创建备份失败: " + backup, e);
        }
    }

    private List<Path> listTimestampedBackups(Path path) throws LibraryException {
        List<Path> backups = new ArrayList<>();
        Path parent = path.toAbsolutePath().getParent();
        if (!Files.isDirectory(parent)) {
            return backups;
        }
        String prefix = path.getFileName() + TIMESTAMPED_BACKUP_MARKER;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(parent, prefix + "*")) {
            for (Path entry : stream) {
                backups.add(entry);
            }
        } catch (IOException e) {
            throw new LibraryException(ErrorKind.STORAGE_IO, "无法列出备份: " + parent, e);
        }
        backups.sort(Comparator.comparing((Path p) -> p.getFileName().toString()).reversed());
        return backups;
    }

    private static void moveAtomically(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteTemp(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("临时文件删除失败: {} - {}", temp, e.getMessage());
        }
    }

    private static LibraryException corrupt(Path path, String reason, Throwable cause) {
        LibraryError error = LibraryError.of(ErrorKind.DOCUMENT_CORRUPT, "文档已损坏: " + path + " - " + reason)
            .withDetail("path", path.toString());
        return cause != null ? new LibraryException(error, cause) : new LibraryException(error);
    }
}
