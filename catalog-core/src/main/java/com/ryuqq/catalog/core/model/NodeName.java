package com.ryuqq.catalog.core.model;

/**
 * 컴파일 대상 노드 이름.
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 점(.), 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public final class NodeName {

    private final String value;

    private NodeName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("NodeName cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("NodeName length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9.\\-_]+$")) {
            throw new IllegalArgumentException("NodeName contains invalid characters. Only alphanumeric, dot, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * NodeName 생성.
     *
     * @param value 노드 이름 (보통 FQDN)
     * @return NodeName 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static NodeName of(String value) {
        return new NodeName(value);
    }

    public String getValue() {
        return value;
    }

    /**
     * 첫 번째 점 이전의 호스트 이름.
     *
     * @return 호스트 이름 (점이 없으면 전체 값)
     */
    public String hostname() {
        int dot = value.indexOf('.');
        return dot < 0 ? value : value.substring(0, dot);
    }

    /**
     * 첫 번째 점 이후의 도메인.
     *
     * @return 도메인 (점이 없으면 빈 문자열)
     */
    public String domain() {
        int dot = value.indexOf('.');
        return dot < 0 ? "" : value.substring(dot + 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NodeName nodeName = (NodeName) o;
        return value.equals(nodeName.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
