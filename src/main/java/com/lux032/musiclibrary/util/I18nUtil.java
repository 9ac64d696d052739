package com.lux032.musiclibrary.util;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * 国际化工具类
 * 用于加载错误处理建议、进度提示等多语言文本
 */
@Slf4j
public class I18nUtil {

    private static final String DEFAULT_LANGUAGE = "en_US";

    private static Properties messages;
    private static String currentLanguage = DEFAULT_LANGUAGE;

    /**
     * 初始化国际化资源
     * @param language 语言代码，如 zh_CN 或 en_US
     */
    public static synchronized void init(String language) {
        if (language == null || language.trim().isEmpty()) {
            language = DEFAULT_LANGUAGE;
        }

        String resourceFile = "/messages_" + language + ".properties";
        Properties loaded = new Properties();

        try (InputStream is = I18nUtil.class.getResourceAsStream(resourceFile)) {
            if (is == null) {
                throw new IOException("resource not found");
            }
            loaded.load(new InputStreamReader(is, StandardCharsets.UTF_8));
            messages = loaded;
            currentLanguage = language;
            log.debug("已加载语言资源: {}", resourceFile);
        } catch (IOException e) {
            log.warn("语言资源加载失败: {} - {}", resourceFile, e.getMessage());
            if (!DEFAULT_LANGUAGE.equals(language)) {
                init(DEFAULT_LANGUAGE);
            } else {
                messages = loaded;
                currentLanguage = language;
            }
        }
    }

    private static Properties messages() {
        if (messages == null) {
            init(currentLanguage);
        }
        return messages;
    }

    /**
     * 获取国际化消息，找不到时返回键本身
     */
    public static String getMessage(String key) {
        return messages().getProperty(key, key);
    }

    /**
     * 获取国际化消息（支持参数替换）
     * 支持 {} 和 {0} {1} 两种占位符
     */
    public static String getMessage(String key, Object... args) {
        String pattern = messages().getProperty(key, key);
        if (args == null || args.length == 0) {
            return pattern;
        }
        return formatMessage(pattern, args);
    }

    /**
     * 读取编号消息列表: prefix.1, prefix.2 ... 直到第一个缺失的编号
     */
    public static List<String> getMessageList(String prefix, Object... args) {
        List<String> result = new ArrayList<>();
        for (int i = 1; ; i++) {
            String key = prefix + "." + i;
            if (!messages().containsKey(key)) {
                break;
            }
            result.add(getMessage(key, args));
        }
        return result;
    }

    private static String formatMessage(String pattern, Object... args) {
        if (pattern.matches("(?s).*\\{\\d+\\}.*")) {
            try {
                return MessageFormat.format(pattern.replace("'", "''"), args);
            } catch (IllegalArgumentException e) {
                log.debug("消息格式化失败，改用 {{}} 占位符: {}", pattern);
            }
        }

        StringBuilder result = new StringBuilder();
        int argIndex = 0;
        int i = 0;
        while (i < pattern.length()) {
            if (i < pattern.length() - 1 && pattern.charAt(i) == '{' && pattern.charAt(i + 1) == '}') {
                if (argIndex < args.length) {
                    result.append(args[argIndex] != null ? args[argIndex].toString() : "null");
                    argIndex++;
                } else {
                    result.append("{}");
                }
                i += 2;
            } else {
                result.append(pattern.charAt(i));
                i++;
            }
        }
        return result.toString();
    }

    public static String getCurrentLanguage() {
        return currentLanguage;
    }
}
