package com.ryuqq.catalog.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 한 노드의 최종 카탈로그.
 *
 * <p>검증과 충돌 검사를 마친 리소스 집합과 의존 그래프입니다. 요청마다 한 번 조립되며
 * 조립 이후에는 변경할 수 없습니다.</p>
 *
 * <p><strong>구성:</strong></p>
 * <ul>
 *   <li>resources: 로컬 리소스 (식별자 → 리소스, 수집된 리소스 포함)</li>
 *   <li>edges: 식별자 → 그 리소스가 의존하는 식별자 집합 (의존이 있는 키만 포함)</li>
 *   <li>exported: 이 노드가 내보내는 리소스</li>
 *   <li>warnings: 인터프리터 경고 (발생 순서)</li>
 *   <li>knownResources: 해석 중 알게 된 모든 리소스 (선언, export, 수집 순서)</li>
 * </ul>
 *
 * @param resources 로컬 리소스
 * @param edges 의존 그래프
 * @param exported 내보내는 리소스
 * @param warnings 경고 목록
 * @param knownResources 알려진 리소스 목록
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public record Catalog(
    Map<ResourceId, Resource> resources,
    Map<ResourceId, Set<ResourceId>> edges,
    Map<ResourceId, Resource> exported,
    List<Warning> warnings,
    List<Resource> knownResources
) {

    public Catalog {
        if (resources == null || edges == null || exported == null || warnings == null || knownResources == null) {
            throw new IllegalArgumentException("catalog components cannot be null");
        }
        resources = Collections.unmodifiableMap(new LinkedHashMap<>(resources));
        Map<ResourceId, Set<ResourceId>> frozen = new LinkedHashMap<>();
        edges.forEach((id, deps) -> frozen.put(id, Set.copyOf(deps)));
        edges = Collections.unmodifiableMap(frozen);
        exported = Collections.unmodifiableMap(new LinkedHashMap<>(exported));
        warnings = List.copyOf(warnings);
        knownResources = List.copyOf(knownResources);
    }

    /**
     * 알려진 리소스를 로컬 리소스와 export 리소스로 채워 생성.
     */
    public Catalog(Map<ResourceId, Resource> resources, Map<ResourceId, Set<ResourceId>> edges,
                   Map<ResourceId, Resource> exported, List<Warning> warnings) {
        this(resources, edges, exported, warnings, concat(resources, exported));
    }

    private static List<Resource> concat(Map<ResourceId, Resource> resources, Map<ResourceId, Resource> exported) {
        if (resources == null || exported == null) {
            throw new IllegalArgumentException("catalog components cannot be null");
        }
        List<Resource> all = new ArrayList<>(resources.values());
        all.addAll(exported.values());
        return all;
    }

    /**
     * 리소스 조회.
     *
     * @param id 식별자
     * @return 리소스, 없으면 null
     */
    public Resource resource(ResourceId id) {
        return resources.get(id);
    }

    /**
     * 리소스의 의존 대상.
     *
     * @param id 식별자
     * @return 의존 대상 집합 (없으면 빈 집합)
     */
    public Set<ResourceId> dependenciesOf(ResourceId id) {
        return edges.getOrDefault(id, Set.of());
    }
}
