package com.lux032.musiclibrary.cache;

import com.google.gson.annotations.SerializedName;

/**
 * 缓存文档状态
 */
public enum CacheStatus {
    @SerializedName("missing")
    MISSING,
    @SerializedName("valid")
    VALID,
    @SerializedName("expired")
    EXPIRED,
    @SerializedName("corrupted")
    CORRUPTED;

    public boolean isUsable() {
        return this == VALID || this == EXPIRED;
    }
}
