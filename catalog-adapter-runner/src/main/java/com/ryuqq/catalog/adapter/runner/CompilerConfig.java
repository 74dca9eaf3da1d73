package com.ryuqq.catalog.adapter.runner;

import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * DefaultCatalogCompiler 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>modulesPath: 모듈 디렉터리 ({@code <module>/manifests/...pp})</li>
 *   <li>manifestPath: {@code site.pp}가 있는 디렉터리</li>
 *   <li>extraTests: 카탈로그 검사 실행 여부 (기본 false)</li>
 *   <li>strict: 정의되지 않은 변수를 오류로 처리 (기본 false)</li>
 *   <li>publishExports: 성공한 카탈로그의 export 리소스 저장 (기본 false)</li>
 *   <li>ignoredModules: 로드하지 않는 모듈 (클래스는 본문 없이 기록, define 리소스는 펼치지 않음)</li>
 *   <li>externalModules: 다른 곳에서 제공되는 모듈 (클래스 정의가 없어도 오류가 아님)</li>
 * </ul>
 *
 * @author Catalog Team
 * @since 1.0.0
 * @param modulesPath 모듈 디렉터리
 * @param manifestPath 매니페스트 디렉터리
 * @param extraTests 카탈로그 검사 실행 여부
 * @param strict strict 모드
 * @param publishExports export 리소스 저장 여부
 * @param ignoredModules 무시할 모듈 이름 (소문자)
 * @param externalModules 외부 모듈 이름 (소문자)
 */
public record CompilerConfig(
    Path modulesPath,
    Path manifestPath,
    boolean extraTests,
    boolean strict,
    boolean publishExports,
    Set<String> ignoredModules,
    Set<String> externalModules
) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 경로가 null인 경우
     */
    public CompilerConfig {
        if (modulesPath == null) {
            throw new IllegalArgumentException("modulesPath cannot be null");
        }
        if (manifestPath == null) {
            throw new IllegalArgumentException("manifestPath cannot be null");
        }
        ignoredModules = normalizeModules(ignoredModules);
        externalModules = normalizeModules(externalModules);
    }

    /**
     * 모듈 목록 없이 생성.
     */
    public CompilerConfig(Path modulesPath, Path manifestPath, boolean extraTests, boolean strict,
                          boolean publishExports) {
        this(modulesPath, manifestPath, extraTests, strict, publishExports, Set.of(), Set.of());
    }

    /**
     * 기본 디렉터리 구조로 생성.
     *
     * <p>{@code <dir>/modules}와 {@code <dir>/manifests}를 사용하며 모든 옵션은 꺼져 있습니다.</p>
     *
     * @param puppetDir 루트 디렉터리
     * @return 기본 설정
     */
    public static CompilerConfig of(Path puppetDir) {
        if (puppetDir == null) {
            throw new IllegalArgumentException("puppetDir cannot be null");
        }
        return new CompilerConfig(puppetDir.resolve("modules"), puppetDir.resolve("manifests"), false, false, false);
    }

    /**
     * extraTests만 변경한 새 인스턴스 생성.
     */
    public CompilerConfig withExtraTests(boolean extraTests) {
        return new CompilerConfig(modulesPath, manifestPath, extraTests, strict, publishExports,
            ignoredModules, externalModules);
    }

    /**
     * strict만 변경한 새 인스턴스 생성.
     */
    public CompilerConfig withStrict(boolean strict) {
        return new CompilerConfig(modulesPath, manifestPath, extraTests, strict, publishExports,
            ignoredModules, externalModules);
    }

    /**
     * publishExports만 변경한 새 인스턴스 생성.
     */
    public CompilerConfig withPublishExports(boolean publishExports) {
        return new CompilerConfig(modulesPath, manifestPath, extraTests, strict, publishExports,
            ignoredModules, externalModules);
    }

    /**
     * ignoredModules만 변경한 새 인스턴스 생성.
     */
    public CompilerConfig withIgnoredModules(Set<String> ignoredModules) {
        return new CompilerConfig(modulesPath, manifestPath, extraTests, strict, publishExports,
            ignoredModules, externalModules);
    }

    /**
     * externalModules만 변경한 새 인스턴스 생성.
     */
    public CompilerConfig withExternalModules(Set<String> externalModules) {
        return new CompilerConfig(modulesPath, manifestPath, extraTests, strict, publishExports,
            ignoredModules, externalModules);
    }

    private static Set<String> normalizeModules(Set<String> modules) {
        if (modules == null) {
            return Set.of();
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String module : modules) {
            if (module == null || module.isBlank()) {
                throw new IllegalArgumentException("module name cannot be null or blank");
            }
            normalized.add(module.trim().toLowerCase(Locale.ROOT));
        }
        return Set.copyOf(normalized);
    }
}
