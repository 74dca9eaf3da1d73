/**
 * Resource type registry and the built-in types.
 *
 * @since 1.0.0
 * @author Catalog Team
 */
package com.ryuqq.catalog.core.types;
