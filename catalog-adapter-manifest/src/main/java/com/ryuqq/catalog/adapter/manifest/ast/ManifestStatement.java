package com.ryuqq.catalog.adapter.manifest.ast;

import com.ryuqq.catalog.core.model.SourceLocation;
import com.ryuqq.catalog.core.model.Statement;
import com.ryuqq.catalog.core.model.TopLevelStatement;
import com.ryuqq.catalog.core.model.TopLevelType;

import java.util.List;

/**
 * Manifest statement.
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public sealed interface ManifestStatement extends Statement {

    /** {@code node 'name' { ... }}; {@code default} is stored as the name "default". */
    record NodeDeclaration(String name, List<ManifestStatement> body, SourceLocation location)
        implements ManifestStatement, TopLevelStatement {

        public NodeDeclaration {
            body = List.copyOf(body);
        }

        @Override
        public TopLevelType type() {
            return TopLevelType.NODE;
        }
    }

    /** {@code class name($p = v) inherits parent { ... }}; parent is null when absent. */
    record ClassDeclaration(
        String name,
        List<Parameter> parameters,
        String parent,
        List<ManifestStatement> body,
        SourceLocation location
    ) implements ManifestStatement, TopLevelStatement {

        public ClassDeclaration {
            parameters = List.copyOf(parameters);
            body = List.copyOf(body);
        }

        @Override
        public TopLevelType type() {
            return TopLevelType.CLASS;
        }
    }

    record DefineDeclaration(
        String name,
        List<Parameter> parameters,
        List<ManifestStatement> body,
        SourceLocation location
    ) implements ManifestStatement, TopLevelStatement {

        public DefineDeclaration {
            parameters = List.copyOf(parameters);
            body = List.copyOf(body);
        }

        @Override
        public TopLevelType type() {
            return TopLevelType.DEFINE;
        }
    }

    record Include(List<Expression> classes, SourceLocation location) implements ManifestStatement {
        public Include {
            classes = List.copyOf(classes);
        }
    }

    record Assignment(String variable, Expression value, SourceLocation location) implements ManifestStatement {
    }

    /** {@code if}/{@code elsif} arms in order; {@code otherwise} is the (possibly empty) else body. */
    record Conditional(List<Branch> branches, List<ManifestStatement> otherwise, SourceLocation location)
        implements ManifestStatement {

        public Conditional {
            branches = List.copyOf(branches);
            otherwise = List.copyOf(otherwise);
        }
    }

    record ResourceDeclaration(String type, boolean exported, List<ResourceBody> bodies, SourceLocation location)
        implements ManifestStatement {

        public ResourceDeclaration {
            bodies = List.copyOf(bodies);
        }
    }

    /** {@code Type <<| |>>}; the type is stored lower-cased. */
    record Collector(String type, SourceLocation location) implements ManifestStatement {
    }

    record FunctionCallStatement(Expression.FunctionCall call, SourceLocation location) implements ManifestStatement {
    }
}
