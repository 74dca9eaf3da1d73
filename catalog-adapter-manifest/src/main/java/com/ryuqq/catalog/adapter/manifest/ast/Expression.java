package com.ryuqq.catalog.adapter.manifest.ast;

import com.ryuqq.catalog.core.model.SourceLocation;
import com.ryuqq.catalog.core.model.Value;

import java.util.List;

/**
 * Manifest expression.
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public sealed interface Expression {

    SourceLocation location();

    /** Literal value: string, number, boolean, {@code undef} or bare word. */
    record Literal(Value value, SourceLocation location) implements Expression {
    }

    /** Double-quoted string with at least one interpolated variable. */
    record Interpolation(List<StringPart> parts, SourceLocation location) implements Expression {
        public Interpolation {
            parts = List.copyOf(parts);
        }
    }

    /** Variable reference; the name excludes {@code $} and may be qualified. */
    record Variable(String name, SourceLocation location) implements Expression {
    }

    record ArrayLiteral(List<Expression> elements, SourceLocation location) implements Expression {
        public ArrayLiteral {
            elements = List.copyOf(elements);
        }
    }

    /** {@code Type['title', ...]}. */
    record Reference(String type, List<Expression> titles, SourceLocation location) implements Expression {
        public Reference {
            titles = List.copyOf(titles);
        }
    }

    record FunctionCall(String name, List<Expression> arguments, SourceLocation location) implements Expression {
        public FunctionCall {
            arguments = List.copyOf(arguments);
        }
    }

    /** {@code ==} or, when negated, {@code !=}. */
    record Comparison(Expression left, Expression right, boolean negated, SourceLocation location)
        implements Expression {
    }
}
