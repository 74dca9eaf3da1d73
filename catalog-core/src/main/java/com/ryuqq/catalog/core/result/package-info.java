/**
 * Failure-as-value results.
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.catalog.core.result.Result} - Sealed interface (permits Ok, Fail)</li>
 * </ul>
 *
 * <h2>Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.catalog.core.result.Ok} - Success with a value</li>
 *   <li>{@link com.ryuqq.catalog.core.result.Fail} - Failure with a {@link com.ryuqq.catalog.core.result.Diagnostic}</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * if (result instanceof Ok&lt;Catalog&gt; ok) {
 *     render(ok.value());
 * } else if (result instanceof Fail&lt;Catalog&gt; fail) {
 *     report(fail.diagnostic());
 * }
 * </pre>
 *
 * @since 1.0.0
 * @author Catalog Team
 */
package com.ryuqq.catalog.core.result;
