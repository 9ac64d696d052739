package com.lux032.musiclibrary.model;

import com.google.gson.annotations.SerializedName;

/**
 * 乐队目录结构类型
 */
public enum StructureType {
    @SerializedName("default")
    DEFAULT("default"),          // 平铺: "YYYY - 专辑名 (版本)"
    @SerializedName("enhanced")
    ENHANCED("enhanced"),        // 按类型分文件夹: "Live/YYYY - 专辑名"
    @SerializedName("mixed")
    MIXED("mixed"),              // 平铺和类型文件夹混用
    @SerializedName("legacy")
    LEGACY("legacy"),            // 专辑名没有年份前缀
    @SerializedName("unknown")
    UNKNOWN("unknown");

    private final String value;

    StructureType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
