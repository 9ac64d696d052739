package com.lux032.musiclibrary;

import com.lux032.musiclibrary.config.MusicConfig;
import com.lux032.musiclibrary.core.LibraryResponse;
import com.lux032.musiclibrary.core.MusicLibraryService;
import com.lux032.musiclibrary.scanner.ScanReport;
import com.lux032.musiclibrary.util.I18nUtil;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 音乐库管理程序入口
 * 加载配置后扫描一次音乐库并输出结果
 *
 * <p>用法: {@code java -jar music-library-manager.jar [config.properties]}
 */
@Slf4j
public class Main {

    public static void main(String[] args) {
        try {
            // 1. 加载配置
            Path configPath = Paths.get(args.length > 0 ? args[0] : MusicConfig.DEFAULT_CONFIG_FILE);
            MusicConfig config = MusicConfig.load(configPath);

            // 2. 初始化国际化
            I18nUtil.init(config.getLanguage());

            if (!config.isValid()) {
                log.error(I18nUtil.getMessage("app.config.invalid"));
                return;
            }
            log.info(I18nUtil.getMessage("app.config.loaded"));
            log.info(I18nUtil.getMessage("app.music.root"), config.getMusicRootPath());

            // 3. 扫描
            MusicLibraryService service = new MusicLibraryService(config);
            LibraryResponse<ScanReport> response = service.scan();
            if (!response.isSuccess()) {
                log.error(I18nUtil.getMessage("app.scan.failed"), response.getError());
                return;
            }

            ScanReport report = response.getData();
            log.info(I18nUtil.getMessage("app.scan.summary"), report.getBandsDiscovered(),
                report.getAlbumsDiscovered(), report.getTotalTracks(), report.getMissingAlbums());
            for (String change : report.getChangesDetected()) {
                log.info("  {}", change);
            }
            for (String warning : report.getCacheWarnings()) {
                log.warn("  {}", warning);
            }
            for (String error : report.getScanErrors()) {
                log.warn("  {}", error);
            }
        } catch (Exception e) {
            log.error(I18nUtil.getMessage("app.error"), e);
        }
    }
}
