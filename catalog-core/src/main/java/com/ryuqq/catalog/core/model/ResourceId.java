package com.ryuqq.catalog.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * 리소스 식별자 (타입, 타이틀).
 *
 * <p>타입 이름은 소문자로 정규화됩니다. 정규 참조 표기는 {@code type[title]}입니다.</p>
 *
 * <p><strong>참조 파싱 예시:</strong></p>
 * <pre>
 * ResourceId.parseReference("File['/etc/motd']");   // file[/etc/motd]
 * ResourceId.parseReference("service[ntp]");        // service[ntp]
 * ResourceId.parseReference("Foo::Bar[\"x\"]");     // foo::bar[x]
 * </pre>
 *
 * @param type 리소스 타입 (소문자)
 * @param title 리소스 타이틀
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public record ResourceId(
    String type,
    String title
) implements Comparable<ResourceId> {

    public ResourceId {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type cannot be null or blank");
        }
        if (title == null || title.isEmpty()) {
            throw new IllegalArgumentException("title cannot be null or empty");
        }
        type = type.toLowerCase(Locale.ROOT);
    }

    /**
     * ResourceId 생성.
     *
     * @param type 리소스 타입
     * @param title 리소스 타이틀
     * @return ResourceId
     * @throws IllegalArgumentException type 또는 title이 비어 있는 경우
     */
    public static ResourceId of(String type, String title) {
        return new ResourceId(type, title);
    }

    /**
     * 참조 문자열 파싱.
     *
     * @param reference {@code Type[title]} 형식 문자열 (타이틀은 따옴표로 감쌀 수 있음)
     * @return 파싱 결과, 형식이 잘못된 경우 empty
     */
    public static Optional<ResourceId> parseReference(String reference) {
        if (reference == null) {
            return Optional.empty();
        }
        String ref = reference.trim();
        int open = ref.indexOf('[');
        if (open <= 0 || !ref.endsWith("]")) {
            return Optional.empty();
        }
        String type = ref.substring(0, open).trim();
        String title = unquote(ref.substring(open + 1, ref.length() - 1).trim());
        if (type.isEmpty() || title.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ResourceId(type, title));
    }

    private static String unquote(String text) {
        if (text.length() >= 2) {
            char first = text.charAt(0);
            char last = text.charAt(text.length() - 1);
            if ((first == '\'' || first == '"') && first == last) {
                return text.substring(1, text.length() - 1);
            }
        }
        return text;
    }

    /**
     * 타이틀만 변경한 새 식별자.
     *
     * @param newTitle 새 타이틀
     * @return 새 ResourceId
     */
    public ResourceId withTitle(String newTitle) {
        return new ResourceId(type, newTitle);
    }

    @Override
    public int compareTo(ResourceId other) {
        int byType = type.compareTo(other.type);
        return byType != 0 ? byType : title.compareTo(other.title);
    }

    @Override
    public String toString() {
        return type + "[" + title + "]";
    }
}
