/**
 * Abstract syntax tree of parsed manifests.
 *
 * <p>All nodes are immutable records. {@link com.ryuqq.catalog.adapter.manifest.ast.ManifestStatement}
 * nodes for node, class and define declarations also implement
 * {@link com.ryuqq.catalog.core.model.TopLevelStatement}, which is all the compiler core sees.</p>
 *
 * @author Catalog Team
 * @since 1.0.0
 */
package com.ryuqq.catalog.adapter.manifest.ast;
