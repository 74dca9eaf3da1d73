package com.ryuqq.catalog.core.spi;

/**
 * A template to evaluate: either a named template file or inline source.
 *
 * @param name template name (file path relative to the modules directory, or {@code "inline"})
 * @param inlineSource template body for inline templates, null for files
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public record TemplateSource(
    String name,
    String inlineSource
) {

    public TemplateSource {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
    }

    public static TemplateSource file(String name) {
        return new TemplateSource(name, null);
    }

    public static TemplateSource inline(String source) {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        return new TemplateSource("inline", source);
    }

    public boolean isInline() {
        return inlineSource != null;
    }
}
