package com.ryuqq.catalog.adapter.manifest.interpreter;

import com.ryuqq.catalog.core.model.Value;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Variable scope. Lookups walk the parent chain; definitions are always local.
 *
 * @author Catalog Team
 * @since 1.0.0
 */
final class Scope {

    private final Scope parent;
    private final Map<String, Value> variables = new LinkedHashMap<>();

    Scope(Scope parent) {
        this.parent = parent;
    }

    Optional<Value> lookup(String name) {
        for (Scope scope = this; scope != null; scope = scope.parent) {
            Value value = scope.variables.get(name);
            if (value != null) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    Optional<Value> lookupLocal(String name) {
        return Optional.ofNullable(variables.get(name));
    }

    boolean isDefinedLocally(String name) {
        return variables.containsKey(name);
    }

    void define(String name, Value value) {
        variables.put(name, value);
    }

    /**
     * Every visible variable; inner scopes shadow outer ones.
     *
     * @return name to value
     */
    Map<String, Value> visibleVariables() {
        Deque<Scope> chain = new ArrayDeque<>();
        for (Scope scope = this; scope != null; scope = scope.parent) {
            chain.push(scope);
        }
        Map<String, Value> visible = new LinkedHashMap<>();
        for (Scope scope : chain) {
            visible.putAll(scope.variables);
        }
        return visible;
    }
}
