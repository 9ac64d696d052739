package com.lux032.musiclibrary.migration;

import com.google.gson.annotations.SerializedName;

/**
 * 迁移最终状态
 */
public enum MigrationStatus {
    @SerializedName("success")
    SUCCESS,
    @SerializedName("partial_success")
    PARTIAL_SUCCESS,
    @SerializedName("failed")
    FAILED,
    @SerializedName("rolled_back")
    ROLLED_BACK
}
