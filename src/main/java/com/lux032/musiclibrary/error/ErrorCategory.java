package com.lux032.musiclibrary.error;

/**
 * 错误大类
 */
public enum ErrorCategory {
    VALIDATION,
    STORAGE,
    SCANNING,
    MIGRATION
}
