package com.lux032.musiclibrary.error;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 结构化错误信息
 * 面向调用方的错误都携带类型、严重程度、技术信息和处理建议
 */
@Data
public class LibraryError {

    private ErrorKind kind;
    private ErrorSeverity severity;
    private String message;
    private List<String> solutionSteps = new ArrayList<>();
    private Map<String, Object> details = new LinkedHashMap<>();

    public LibraryError() {
    }

    public LibraryError(ErrorKind kind, String message) {
        this.kind = kind;
        this.severity = kind.defaultSeverity();
        this.message = message;
    }

    public static LibraryError of(ErrorKind kind, String message) {
        return new LibraryError(kind, message);
    }

    public LibraryError withSeverity(ErrorSeverity severity) {
        this.severity = severity;
        return this;
    }

    public LibraryError withSolutionSteps(List<String> steps) {
        if (steps != null) {
            this.solutionSteps = new ArrayList<>(steps);
        }
        return this;
    }

    public LibraryError withDetail(String key, Object value) {
        this.details.put(key, value);
        return this;
    }

    public ErrorCategory getCategory() {
        return kind != null ? kind.category() : null;
    }

    @Override
    public String toString() {
        return kind + " [" + severity + "]: " + message;
    }
}
