package com.lux032.musiclibrary.error;

/**
 * 错误严重程度
 */
public enum ErrorSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isAtLeast(ErrorSeverity other) {
        return this.ordinal() >= other.ordinal();
    }
}
