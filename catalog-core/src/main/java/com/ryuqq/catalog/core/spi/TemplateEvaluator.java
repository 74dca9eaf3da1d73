package com.ryuqq.catalog.core.spi;

import com.ryuqq.catalog.core.model.Value;
import com.ryuqq.catalog.core.result.Result;

import java.util.Map;

/**
 * Template Evaluator SPI.
 *
 * <p>Renders a template against the variables visible at the call site.
 * Implementations are not required to be thread-safe: the compiler routes
 * every call through a single serialized owner.</p>
 *
 * @author Catalog Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TemplateEvaluator {

    /**
     * Evaluates a template.
     *
     * @param source the template
     * @param scope variables visible to the template
     * @return rendered text, or {@code TEMPLATE_ERROR}
     */
    Result<String> evaluate(TemplateSource source, Map<String, Value> scope);
}
