/**
 * No-op SPI implementations for running without external backends.
 *
 * @since 1.0.0
 * @author Catalog Team
 */
package com.ryuqq.catalog.core.spi.noop;
