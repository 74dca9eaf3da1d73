/**
 * Validator combinators for resource attributes.
 *
 * <p>A {@link com.ryuqq.catalog.core.validation.Validator} maps a resource to a
 * normalized resource or a diagnostic. Per-parameter rules are built with
 * {@link com.ryuqq.catalog.core.validation.Validators} and assembled per type by
 * {@link com.ryuqq.catalog.core.validation.ValidatorPipeline}.</p>
 *
 * @since 1.0.0
 * @author Catalog Team
 */
package com.ryuqq.catalog.core.validation;
