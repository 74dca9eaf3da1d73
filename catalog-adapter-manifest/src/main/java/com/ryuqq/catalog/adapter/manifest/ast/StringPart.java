package com.ryuqq.catalog.adapter.manifest.ast;

/**
 * One segment of a double-quoted string: literal text or an interpolated variable.
 *
 * @param variable true when {@code text} is a variable name
 * @param text literal text, or the variable name without {@code $}
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public record StringPart(boolean variable, String text) {

    public StringPart {
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
    }

    public static StringPart literal(String text) {
        return new StringPart(false, text);
    }

    public static StringPart variable(String name) {
        return new StringPart(true, name);
    }
}
