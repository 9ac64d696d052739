package com.lux032.musiclibrary.migration;

import com.google.gson.annotations.SerializedName;
import com.lux032.musiclibrary.model.StructureType;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * 目录结构迁移类型
 */
public enum MigrationType {
    @SerializedName("default_to_enhanced")
    DEFAULT_TO_ENHANCED("default_to_enhanced", StructureType.ENHANCED, StructureType.DEFAULT, StructureType.LEGACY),
    @SerializedName("legacy_to_default")
    LEGACY_TO_DEFAULT("legacy_to_default", StructureType.DEFAULT, StructureType.LEGACY),
    @SerializedName("mixed_to_enhanced")
    MIXED_TO_ENHANCED("mixed_to_enhanced", StructureType.ENHANCED, StructureType.MIXED),
    @SerializedName("enhanced_to_default")
    ENHANCED_TO_DEFAULT("enhanced_to_default", StructureType.DEFAULT, StructureType.ENHANCED, StructureType.MIXED);

    private final String value;
    private final StructureType targetStructure;
    private final Set<StructureType> sourceStructures;

    MigrationType(String value, StructureType targetStructure, StructureType... sourceStructures) {
        this.value = value;
        this.targetStructure = targetStructure;
        this.sourceStructures = Collections.unmodifiableSet(EnumSet.copyOf(Arrays.asList(sourceStructures)));
    }

    public String getValue() {
        return value;
    }

    public StructureType getTargetStructure() {
        return targetStructure;
    }

    /**
     * 当前结构是否适用该迁移（未指定 force 时检查）
     */
    public boolean appliesTo(StructureType current) {
        return sourceStructures.contains(current);
    }

    public static MigrationType fromString(String value) {
        if (value == null) {
            return null;
        }
        for (MigrationType type : values()) {
            if (type.value.equalsIgnoreCase(value.trim()) || type.name().equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        return null;
    }
}
