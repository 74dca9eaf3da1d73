package com.ryuqq.catalog.core.model;

/**
 * undef 값 (싱글턴).
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public enum UndefinedValue implements Value {

    INSTANCE;

    @Override
    public String render() {
        return "undef";
    }
}
