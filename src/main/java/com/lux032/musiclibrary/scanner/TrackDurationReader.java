package com.lux032.musiclibrary.scanner;

import lombok.extern.slf4j.Slf4j;
import org.jaudiotagger.audio.AudioFile;
import org.jaudiotagger.audio.AudioFileIO;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.lux032.musiclibrary.util.FileSystemUtils;

/**
 * 读取专辑总时长
 * 只读取音频头信息，单个文件读取失败时跳过
 */
@Slf4j
public class TrackDurationReader {

    static {
        // jaudiotagger 使用 JUL 输出大量 INFO 日志
        Logger.getLogger("org.jaudiotagger").setLevel(Level.WARNING);
    }

    /**
     * @return "MM:SS" 或 "H:MM:SS"，无法读取任何文件时返回空字符串
     */
    public String readAlbumDuration(Path albumFolder) {
        long totalSeconds = 0;
        int readable = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(albumFolder)) {
            for (Path file : stream) {
                if (!Files.isRegularFile(file) || !FileSystemUtils.isMusicFile(file)) {
                    continue;
                }
                int seconds = readTrackSeconds(file);
                if (seconds > 0) {
                    totalSeconds += seconds;
                    readable++;
                }
            }
        } catch (IOException e) {
            log.debug("无法读取专辑目录: {} - {}", albumFolder, e.getMessage());
            return "";
        }
        return readable == 0 ? "" : formatDuration(totalSeconds);
    }

    int readTrackSeconds(Path file) {
        try {
            AudioFile audioFile = AudioFileIO.read(file.toFile());
            return audioFile.getAudioHeader().getTrackLength();
        } catch (Exception e) {
            log.debug("读取音频时长失败: {} - {}", file.getFileName(), e.getMessage());
            return 0;
        }
    }

    static String formatDuration(long totalSeconds) {
        long hours = totalSeconds / 3600;
        long minutes = (totalSeconds % 3600) / 60;
        long seconds = totalSeconds % 60;
        if (hours > 0) {
            return String.format("%d:%02d:%02d", hours, minutes, seconds);
        }
        return String.format("%02d:%02d", minutes, seconds);
    }
}
