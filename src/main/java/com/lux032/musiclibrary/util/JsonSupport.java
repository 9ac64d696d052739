package com.lux032.musiclibrary.util;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import com.lux032.musiclibrary.model.AlbumType;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * JSON 序列化配置
 * 字段统一使用 snake_case，输出格式化后的 UTF-8 文本
 */
public final class JsonSupport {

    private static final Gson GSON = new GsonBuilder()
        .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
        .registerTypeAdapter(AlbumType.class, new AlbumTypeAdapter().nullSafe())
        .disableHtmlEscaping()
        .setPrettyPrinting()
        .create();

    private JsonSupport() {
    }

    public static Gson gson() {
        return GSON;
    }

    public static String now() {
        return now(Clock.systemDefaultZone());
    }

    /**
     * ISO-8601 本地时间戳，精确到毫秒
     */
    public static String now(Clock clock) {
        return LocalDateTime.now(clock).truncatedTo(ChronoUnit.MILLIS).format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
    }

    /**
     * 专辑类型按显示名读写，读取时忽略大小写，无法识别的值按 Album 处理
     */
    static class AlbumTypeAdapter extends TypeAdapter<AlbumType> {

        @Override
        public void write(JsonWriter out, AlbumType value) throws IOException {
            out.value(value.getDisplayName());
        }

        @Override
        public AlbumType read(JsonReader in) throws IOException {
            if (in.peek() != JsonToken.STRING) {
                in.skipValue();
                return AlbumType.ALBUM;
            }
            AlbumType type = AlbumType.fromString(in.nextString());
            return type != null ? type : AlbumType.ALBUM;
        }
    }
}
