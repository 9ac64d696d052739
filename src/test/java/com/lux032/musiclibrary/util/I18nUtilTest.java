package com.lux032.musiclibrary.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("国际化消息测试")
class I18nUtilTest {

    @AfterEach
    void tearDown() {
        I18nUtil.init("en_US");
    }

    @Test
    @DisplayName("两种占位符都能替换")
    void getMessage_formatsPlaceholders() {
        I18nUtil.init("en_US");

        assertEquals("Permission denied while moving Abbey Road",
            I18nUtil.getMessage("migration.error.permission", "Abbey Road"));
        assertEquals("no.such.key", I18nUtil.getMessage("no.such.key"));
    }

    @Test
    @DisplayName("编号消息按顺序读取到第一个缺失编号为止")
    void getMessageList_readsNumberedKeys() {
        I18nUtil.init("en_US");

        List<String> steps = I18nUtil.getMessageList("migration.solution.target.exists", "a", "Album/b");

        assertEquals(2, steps.size());
        assertEquals("Check the contents of Album/b", steps.get(0));
        assertTrue(I18nUtil.getMessageList("migration.solution.none").isEmpty());
    }

    @Test
    @DisplayName("未知语言回退到英文")
    void init_unknownLanguage_fallsBack() {
        I18nUtil.init("xx_XX");

        assertEquals("en_US", I18nUtil.getCurrentLanguage());
    }

    @Test
    @DisplayName("中文资源包含相同的键")
    void init_chinese() {
        I18nUtil.init("zh_CN");

        assertEquals("zh_CN", I18nUtil.getCurrentLanguage());
        assertNotEquals("migration.error.permission", I18nUtil.getMessage("migration.error.permission", "X"));
        assertEquals(4, I18nUtil.getMessageList("migration.solution.permission", "a", "b").size());
    }
}
