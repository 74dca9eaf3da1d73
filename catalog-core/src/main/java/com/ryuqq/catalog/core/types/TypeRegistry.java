package com.ryuqq.catalog.core.types;

import com.ryuqq.catalog.core.model.Resource;
import com.ryuqq.catalog.core.result.Result;
import com.ryuqq.catalog.core.validation.ValidatorPipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 리소스 타입 이름 → 검증 파이프라인 레지스트리.
 *
 * <p>시작 시 한 번 생성되며 이후 읽기 전용입니다. 동시 접근에 잠금이 필요 없습니다.</p>
 *
 * <p><strong>등록되지 않은 타입:</strong> 거부하지 않고
 * {@link ValidatorPipeline#acceptAll()}로 통과시킵니다 (하위 호환).</p>
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public final class TypeRegistry {

    private final Map<String, ValidatorPipeline> pipelines;

    private TypeRegistry(Map<String, ValidatorPipeline> pipelines) {
        this.pipelines = Collections.unmodifiableMap(new LinkedHashMap<>(pipelines));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 빈 레지스트리 (모든 타입이 acceptAll).
     *
     * @return TypeRegistry
     */
    public static TypeRegistry empty() {
        return new TypeRegistry(Map.of());
    }

    /**
     * 타입의 파이프라인 조회.
     *
     * @param type 타입 이름 (대소문자 무시)
     * @return 등록된 파이프라인, 없으면 acceptAll
     */
    public ValidatorPipeline pipelineFor(String type) {
        return pipelines.getOrDefault(normalize(type), ValidatorPipeline.acceptAll());
    }

    public boolean isRegistered(String type) {
        return pipelines.containsKey(normalize(type));
    }

    public Set<String> registeredTypes() {
        return pipelines.keySet();
    }

    /**
     * 리소스를 타입 파이프라인으로 검증.
     *
     * <p>실패 진단에는 리소스 식별자가 접두어로 붙고, 위치가 없으면 리소스 선언 위치가 채워집니다.</p>
     *
     * @param resource 리소스
     * @return 정규화된 리소스 또는 실패
     */
    public Result<Resource> validate(Resource resource) {
        return pipelineFor(resource.type())
            .validate(resource)
            .mapDiagnostic(d -> d.prefixed(resource.id().toString()).orAt(resource.location().orElse(null)));
    }

    private static String normalize(String type) {
        return type == null ? "" : type.toLowerCase(Locale.ROOT);
    }

    /**
     * TypeRegistry 빌더.
     */
    public static final class Builder {

        private final Map<String, ValidatorPipeline> pipelines = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * 타입 등록.
         *
         * @param type 타입 이름
         * @param pipeline 파이프라인
         * @return this
         * @throws IllegalArgumentException 이미 등록된 타입인 경우
         */
        public Builder register(String type, ValidatorPipeline pipeline) {
            if (type == null || type.isBlank()) {
                throw new IllegalArgumentException("type cannot be null or blank");
            }
            if (pipeline == null) {
                throw new IllegalArgumentException("pipeline cannot be null");
            }
            if (pipelines.putIfAbsent(normalize(type), pipeline) != null) {
                throw new IllegalArgumentException("type already registered: " + type);
            }
            return this;
        }

        public TypeRegistry build() {
            return new TypeRegistry(pipelines);
        }
    }
}
