package com.ryuqq.catalog.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 선언된 리소스.
 *
 * <p>식별자({@link ResourceId})와 속성 맵으로 구성됩니다. 메타파라미터(관계, 태그)도
 * 같은 속성 맵에 저장되며 타입별 파라미터와는 별도로 검증됩니다.</p>
 *
 * <p><strong>불변성:</strong> 모든 변경 메서드는 새 인스턴스를 반환합니다.</p>
 * <p><strong>식별자 변경:</strong> {@link #withTitle(String)}은 검증 단계(nameval)에서만
 * 사용되며, 식별자 기반 자료구조에 들어간 이후에는 호출하지 않습니다.</p>
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public final class Resource {

    private final ResourceId id;
    private final Map<String, Value> attributes;
    private final boolean exported;
    private final SourceLocation location;

    private Resource(ResourceId id, Map<String, Value> attributes, boolean exported, SourceLocation location) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (attributes == null) {
            throw new IllegalArgumentException("attributes cannot be null");
        }
        this.id = id;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.exported = exported;
        this.location = location;
    }

    /**
     * 로컬 리소스 생성.
     *
     * @param id 식별자
     * @param attributes 속성 맵
     * @return Resource
     * @throws IllegalArgumentException id 또는 attributes가 null인 경우
     */
    public static Resource of(ResourceId id, Map<String, Value> attributes) {
        return new Resource(id, attributes, false, null);
    }

    /**
     * 리소스 생성 (전체 필드 지정).
     *
     * @param id 식별자
     * @param attributes 속성 맵
     * @param exported 다른 노드로 내보내는 리소스 여부
     * @param location 선언 위치 (null 허용)
     * @return Resource
     */
    public static Resource of(ResourceId id, Map<String, Value> attributes, boolean exported, SourceLocation location) {
        return new Resource(id, attributes, exported, location);
    }

    public ResourceId id() {
        return id;
    }

    public String type() {
        return id.type();
    }

    public String title() {
        return id.title();
    }

    public Map<String, Value> attributes() {
        return attributes;
    }

    public boolean isExported() {
        return exported;
    }

    /**
     * 선언 위치.
     *
     * @return 위치, 알 수 없으면 empty
     */
    public Optional<SourceLocation> location() {
        return Optional.ofNullable(location);
    }

    /**
     * 속성 조회.
     *
     * @param name 속성 이름
     * @return 값, 없으면 empty
     */
    public Optional<Value> attribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    public boolean hasAttribute(String name) {
        return attributes.containsKey(name);
    }

    /**
     * 속성을 설정한 새 리소스.
     *
     * @param name 속성 이름
     * @param value 값
     * @return 새 Resource
     */
    public Resource withAttribute(String name, Value value) {
        if (name == null || value == null) {
            throw new IllegalArgumentException("attribute name and value cannot be null");
        }
        Map<String, Value> copy = new LinkedHashMap<>(attributes);
        copy.put(name, value);
        return new Resource(id, copy, exported, location);
    }

    /**
     * 속성을 제거한 새 리소스.
     *
     * @param name 속성 이름
     * @return 새 Resource (속성이 없으면 this)
     */
    public Resource withoutAttribute(String name) {
        if (!attributes.containsKey(name)) {
            return this;
        }
        Map<String, Value> copy = new LinkedHashMap<>(attributes);
        copy.remove(name);
        return new Resource(id, copy, exported, location);
    }

    /**
     * 속성 맵 전체를 교체한 새 리소스.
     *
     * @param newAttributes 새 속성 맵
     * @return 새 Resource
     */
    public Resource withAttributes(Map<String, Value> newAttributes) {
        return new Resource(id, newAttributes, exported, location);
    }

    /**
     * 타이틀(식별자)을 변경한 새 리소스.
     *
     * @param newTitle 새 타이틀
     * @return 새 Resource
     */
    public Resource withTitle(String newTitle) {
        return new Resource(id.withTitle(newTitle), attributes, exported, location);
    }

    /**
     * 내보내기 표시를 해제한 리소스 (수집된 리소스용).
     *
     * @return 로컬 Resource
     */
    public Resource asLocal() {
        return exported ? new Resource(id, attributes, false, location) : this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Resource other = (Resource) o;
        return exported == other.exported
            && id.equals(other.id)
            && attributes.equals(other.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, attributes, exported);
    }

    @Override
    public String toString() {
        return (exported ? "@@" : "") + id + attributes;
    }
}
