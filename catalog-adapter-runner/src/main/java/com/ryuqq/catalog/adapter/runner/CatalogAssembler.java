package com.ryuqq.catalog.adapter.runner;

import com.ryuqq.catalog.core.model.ArrayValue;
import com.ryuqq.catalog.core.model.Catalog;
import com.ryuqq.catalog.core.model.RelationType;
import com.ryuqq.catalog.core.model.Resource;
import com.ryuqq.catalog.core.model.ResourceId;
import com.ryuqq.catalog.core.model.StringValue;
import com.ryuqq.catalog.core.model.Value;
import com.ryuqq.catalog.core.model.Warning;
import com.ryuqq.catalog.core.result.Diagnostic;
import com.ryuqq.catalog.core.result.ErrorKind;
import com.ryuqq.catalog.core.result.Result;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 검증된 리소스로 카탈로그 구성.
 *
 * <p><strong>처리 순서:</strong></p>
 * <ol>
 *   <li>식별자 중복 검사 (로컬과 export 전체) → DUPLICATE_RESOURCE</li>
 *   <li>export / 로컬 분리</li>
 *   <li>로컬 리소스의 관계 메타파라미터를 의존성 간선으로 변환</li>
 *   <li>선언 리소스와 수집 리소스를 순서대로 knownResources에 기록</li>
 * </ol>
 *
 * <p>관계 대상은 로컬 리소스 중에서만 찾습니다. 없으면 UNRESOLVED_REFERENCE,
 * 참조 형식이 아니면 INVALID_FORMAT. 순환은 검사하지 않습니다.</p>
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public final class CatalogAssembler {

    /**
     * 카탈로그 구성.
     *
     * @param declared 검증을 거친 선언 리소스
     * @param collected 수집된 리소스 (로컬)
     * @param warnings 해석 경고
     * @return 카탈로그 또는 첫 번째 오류
     */
    public Result<Catalog> assemble(List<Resource> declared, List<Resource> collected, List<Warning> warnings) {
        Map<ResourceId, Resource> local = new LinkedHashMap<>();
        Map<ResourceId, Resource> exported = new LinkedHashMap<>();

        List<Resource> all = new ArrayList<>(declared);
        all.addAll(collected);
        for (Resource resource : all) {
            Resource existing = local.containsKey(resource.id()) ? local.get(resource.id()) : exported.get(resource.id());
            if (existing != null) {
                String previous = existing.location().map(at -> " at " + at).orElse("");
                return Result.fail(ErrorKind.DUPLICATE_RESOURCE,
                    "Duplicate declaration: " + resource.id() + " is already declared" + previous,
                    resource.location().orElse(null));
            }
            (resource.isExported() ? exported : local).put(resource.id(), resource);
        }

        Map<ResourceId, Set<ResourceId>> edges = new LinkedHashMap<>();
        for (Resource resource : local.values()) {
            for (Map.Entry<String, Value> attribute : resource.attributes().entrySet()) {
                Optional<RelationType> relation = RelationType.fromParameter(attribute.getKey());
                if (relation.isEmpty()) {
                    continue;
                }
                for (Value target : flatten(attribute.getValue())) {
                    Result<ResourceId> targetId = resolveTarget(resource, attribute.getKey(), target, local);
                    if (targetId.isFail()) {
                        return Result.fail(targetId.diagnosticOrNull());
                    }
                    ResourceId dependency = targetId.valueOrNull();
                    if (relation.get().sourceDependsOnTarget()) {
                        edges.computeIfAbsent(resource.id(), id -> new LinkedHashSet<>()).add(dependency);
                    } else {
                        edges.computeIfAbsent(dependency, id -> new LinkedHashSet<>()).add(resource.id());
                    }
                }
            }
        }

        return Result.ok(new Catalog(local, edges, exported, warnings, all));
    }

    private static Result<ResourceId> resolveTarget(Resource source, String parameter, Value target,
                                                    Map<ResourceId, Resource> local) {
        if (!(target instanceof StringValue reference)) {
            return Result.fail(invalid(source, parameter, target.render()));
        }
        Optional<ResourceId> parsed = ResourceId.parseReference(reference.value());
        if (parsed.isEmpty()) {
            return Result.fail(invalid(source, parameter, reference.render()));
        }
        if (!local.containsKey(parsed.get())) {
            return Result.fail(ErrorKind.UNRESOLVED_REFERENCE,
                "Unknown resource " + parsed.get() + " in " + parameter + " of " + source.id(),
                source.location().orElse(null));
        }
        return Result.ok(parsed.get());
    }

    private static Diagnostic invalid(Resource source, String parameter, String rendered) {
        return new Diagnostic(ErrorKind.INVALID_FORMAT,
            "Invalid resource reference " + rendered + " in " + parameter + " of " + source.id(),
            source.location().orElse(null));
    }

    private static List<Value> flatten(Value value) {
        List<Value> values = new ArrayList<>();
        if (value instanceof ArrayValue array) {
            for (Value element : array.elements()) {
                values.addAll(flatten(element));
            }
        } else {
            values.add(value);
        }
        return values;
    }
}
