package com.ryuqq.catalog.application.compiler;

import com.ryuqq.catalog.core.model.Statement;
import com.ryuqq.catalog.core.spi.ComputeCache;
import com.ryuqq.catalog.core.types.TypeRegistry;

import java.nio.file.Path;
import java.util.List;

/**
 * 컴파일러 인스턴스가 공유하는 상태.
 *
 * <p>파싱 캐시와 측정 저장소만 가변이며 둘 다 스레드 안전해야 합니다.
 * 타입 레지스트리는 불변입니다.</p>
 *
 * @param parseCache 절대 경로별 파싱 결과 캐시
 * @param registry 리소스 타입 레지스트리
 * @param statistics 측정 저장소
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public record CompilationContext(
    ComputeCache<Path, List<Statement>> parseCache,
    TypeRegistry registry,
    CompilerStatistics statistics
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필드가 null인 경우
     */
    public CompilationContext {
        if (parseCache == null) {
            throw new IllegalArgumentException("parseCache cannot be null");
        }
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (statistics == null) {
            throw new IllegalArgumentException("statistics cannot be null");
        }
    }
}
