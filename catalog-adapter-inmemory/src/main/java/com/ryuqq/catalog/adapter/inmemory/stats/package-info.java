/**
 * In-memory measurement store.
 *
 * @author Catalog Team
 * @since 1.0.0
 */
package com.ryuqq.catalog.adapter.inmemory.stats;
