package com.lux032.musiclibrary.migration;

import com.google.gson.annotations.SerializedName;

public enum OperationType {
    @SerializedName("move")
    MOVE,      // 移到其他目录
    @SerializedName("rename")
    RENAME     // 同目录内改名
}
