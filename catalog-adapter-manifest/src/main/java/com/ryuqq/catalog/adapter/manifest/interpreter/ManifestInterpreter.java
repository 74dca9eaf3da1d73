package com.ryuqq.catalog.adapter.manifest.interpreter;

import com.ryuqq.catalog.core.model.NodeName;
import com.ryuqq.catalog.core.model.TopLevelStatement;
import com.ryuqq.catalog.core.result.DiagnosticException;
import com.ryuqq.catalog.core.result.Result;
import com.ryuqq.catalog.core.spi.Interpretation;
import com.ryuqq.catalog.core.spi.Interpreter;
import com.ryuqq.catalog.core.spi.InterpreterServices;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * {@link Interpreter} for the manifest DSL.
 *
 * <p><strong>Semantics:</strong></p>
 * <ul>
 *   <li>Facts are top-scope variables</li>
 *   <li>Classes are evaluated once, on first declaration, and appear as {@code class[name]}</li>
 *   <li>Define instances bind {@code $title}, {@code $name} and their parameters and appear as
 *       {@code type[title]} next to the resources they declare</li>
 *   <li>{@code undef} attribute values are dropped</li>
 *   <li>A non-native type without a define passes through as a plain resource</li>
 *   <li>Unknown variables are errors in strict mode, otherwise {@code undef} plus a warning</li>
 * </ul>
 *
 * <p>Stateless; each call builds its own evaluation state, so one instance can serve
 * concurrent compilations.</p>
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public class ManifestInterpreter implements Interpreter {

    private static final Logger log = LoggerFactory.getLogger(ManifestInterpreter.class);

    @Override
    public Result<Interpretation> interpret(
        TopLevelStatement start,
        NodeName node,
        Map<String, String> facts,
        InterpreterServices services
    ) {
        if (start == null || node == null || facts == null || services == null) {
            throw new IllegalArgumentException("start, node, facts and services cannot be null");
        }
        try {
            Interpretation interpretation = new Evaluation(facts, services).run(start);
            log.debug("Interpreted {}: {} resources, {} collected, {} warnings", node,
                interpretation.resources().size(), interpretation.collected().size(), interpretation.warnings().size());
            return Result.ok(interpretation);
        } catch (DiagnosticException e) {
            return Result.fail(e.getDiagnostic());
        }
    }
}
