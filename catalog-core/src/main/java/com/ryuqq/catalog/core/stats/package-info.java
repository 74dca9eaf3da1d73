/**
 * Timing samples and their aggregation.
 *
 * @author Catalog Team
 * @since 1.0.0
 */
package com.ryuqq.catalog.core.stats;
