package com.ryuqq.catalog.core.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 값 배열.
 *
 * @param elements 원소 목록 (불변 복사본으로 보관)
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public record ArrayValue(List<Value> elements) implements Value {

    public ArrayValue {
        if (elements == null) {
            throw new IllegalArgumentException("elements cannot be null");
        }
        elements = List.copyOf(elements);
    }

    @Override
    public String render() {
        return elements.stream().map(Value::render).collect(Collectors.joining(", ", "[", "]"));
    }
}
