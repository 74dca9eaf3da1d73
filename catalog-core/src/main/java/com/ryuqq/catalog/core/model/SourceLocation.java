package com.ryuqq.catalog.core.model;

/**
 * 소스 위치 (파일, 행, 열).
 *
 * @param file 파일 경로
 * @param line 행 (1부터 시작)
 * @param column 열 (1부터 시작)
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public record SourceLocation(
    String file,
    int line,
    int column
) {

    public SourceLocation {
        if (file == null || file.isBlank()) {
            throw new IllegalArgumentException("file cannot be null or blank");
        }
        if (line < 1) {
            throw new IllegalArgumentException("line must be positive (current: " + line + ")");
        }
        if (column < 1) {
            throw new IllegalArgumentException("column must be positive (current: " + column + ")");
        }
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
