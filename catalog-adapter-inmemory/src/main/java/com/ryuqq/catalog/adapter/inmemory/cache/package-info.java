/**
 * In-memory single-flight compute cache.
 *
 * @author Catalog Team
 * @since 1.0.0
 */
package com.ryuqq.catalog.adapter.inmemory.cache;
