package com.ryuqq.catalog.adapter.runner;

import com.ryuqq.catalog.core.model.TopLevelType;
import com.ryuqq.catalog.core.result.ErrorKind;
import com.ryuqq.catalog.core.result.Result;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 최상위 선언 이름을 매니페스트 파일 경로로 변환.
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>NODE → {@code <manifests>/site.pp}</li>
 *   <li>{@code x} → {@code <modules>/x/manifests/init.pp}</li>
 *   <li>{@code a::b::c} → {@code <modules>/a/manifests/b/c.pp}</li>
 *   <li>선행 {@code ::}는 무시</li>
 * </ul>
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public final class SourcePathResolver {

    private final Path modulesPath;
    private final Path manifestPath;

    /**
     * 생성자.
     *
     * @param config 컴파일러 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public SourcePathResolver(CompilerConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.modulesPath = config.modulesPath();
        this.manifestPath = config.manifestPath();
    }

    /**
     * 경로 계산.
     *
     * @param type 선언 종류
     * @param name 선언 이름
     * @return 파일 경로, 이름에 세그먼트가 없으면 INTERNAL_ERROR
     */
    public Result<Path> resolve(TopLevelType type, String name) {
        if (type == null || name == null) {
            throw new IllegalArgumentException("type and name cannot be null");
        }
        if (type == TopLevelType.NODE) {
            return Result.ok(manifestPath.resolve("site.pp"));
        }

        List<String> segments = new ArrayList<>();
        for (String segment : name.split("::")) {
            if (!segment.isEmpty()) {
                segments.add(segment);
            }
        }
        if (segments.isEmpty()) {
            return Result.fail(ErrorKind.INTERNAL_ERROR, "Cannot resolve " + type + " with empty name '" + name + "'");
        }

        Path file = modulesPath.resolve(segments.get(0)).resolve("manifests");
        if (segments.size() == 1) {
            return Result.ok(file.resolve("init.pp"));
        }
        for (String directory : segments.subList(1, segments.size() - 1)) {
            file = file.resolve(directory);
        }
        return Result.ok(file.resolve(segments.get(segments.size() - 1) + ".pp"));
    }
}
