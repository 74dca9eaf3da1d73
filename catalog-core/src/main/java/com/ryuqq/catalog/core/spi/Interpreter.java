package com.ryuqq.catalog.core.spi;

import com.ryuqq.catalog.core.model.NodeName;
import com.ryuqq.catalog.core.model.TopLevelStatement;
import com.ryuqq.catalog.core.result.Result;

import java.util.Map;

/**
 * Manifest Interpreter SPI.
 *
 * <p>Evaluates a node statement against the node's facts and produces the
 * declared resources. Everything the interpreter needs from the outside
 * (other statements, templates, lookups, exported resources) comes through
 * {@link InterpreterServices}.</p>
 *
 * <p><strong>Contract:</strong></p>
 * <ul>
 *   <li>Declared resources are returned unvalidated, in declaration order</li>
 *   <li>Resources collected from the exported-resource store are returned separately</li>
 *   <li>Recoverable problems are reported as warnings, fatal ones as a diagnostic</li>
 * </ul>
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public interface Interpreter {

    /**
     * Interprets a node statement.
     *
     * @param start the node statement to evaluate
     * @param node the node being compiled
     * @param facts the node's facts
     * @param services the collaborators available during evaluation
     * @return the interpretation, or a diagnostic
     */
    Result<Interpretation> interpret(
        TopLevelStatement start,
        NodeName node,
        Map<String, String> facts,
        InterpreterServices services
    );
}
