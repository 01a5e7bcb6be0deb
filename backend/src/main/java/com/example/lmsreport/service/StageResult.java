package com.example.lmsreport.service;

import java.util.List;

/**
 * ステージの結果。失敗しても value には空/既定の値が入り、原因は errors に積まれる。
 * 例外をステージ境界の外に投げないための型。
 */
public record StageResult<T>(T value, List<String> errors) {

    public StageResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static <T> StageResult<T> of(T value) {
        return new StageResult<>(value, List.of());
    }

    public static <T> StageResult<T> withErrors(T value, List<String> errors) {
        return new StageResult<>(value, errors);
    }

    public static <T> StageResult<T> failed(T fallback, String error) {
        return new StageResult<>(fallback, List.of(error));
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
