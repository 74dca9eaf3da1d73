/**
 * Manifest interpreter.
 *
 * @author Catalog Team
 * @since 1.0.0
 */
package com.ryuqq.catalog.adapter.manifest.interpreter;
