package com.ryuqq.catalog.adapter.manifest.parser;

import com.ryuqq.catalog.adapter.manifest.ast.AttributeOperation;
import com.ryuqq.catalog.adapter.manifest.ast.Branch;
import com.ryuqq.catalog.adapter.manifest.ast.Expression;
import com.ryuqq.catalog.adapter.manifest.ast.ManifestStatement;
import com.ryuqq.catalog.adapter.manifest.ast.Parameter;
import com.ryuqq.catalog.adapter.manifest.ast.ResourceBody;
import com.ryuqq.catalog.adapter.manifest.ast.StringPart;
import com.ryuqq.catalog.core.model.NumberValue;
import com.ryuqq.catalog.core.model.SourceLocation;
import com.ryuqq.catalog.core.model.Value;
import com.ryuqq.catalog.core.result.Diagnostic;
import com.ryuqq.catalog.core.result.DiagnosticException;
import com.ryuqq.catalog.core.result.ErrorKind;
import org.antlr.v4.runtime.Token;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Builds {@link ManifestStatement} records from a {@code ManifestDsl} parse tree.
 *
 * <p><strong>Conversion rules:</strong></p>
 * <ul>
 *   <li>{@code node 'a', 'b' { ... }} becomes one declaration per name sharing the body</li>
 *   <li>Class, define, resource and reference type names are lower-cased without a leading {@code ::}</li>
 *   <li>Integers with a leading zero ({@code 0644}) stay strings so file modes keep their digits</li>
 *   <li>Double-quoted strings are split into literal and variable parts; without variables they are literals</li>
 *   <li>Bare words {@code true}, {@code false} and {@code undef} become the matching values</li>
 * </ul>
 *
 * @author Catalog Team
 * @since 1.0.0
 */
final class ManifestAstBuilder {

    private static final Pattern LEADING_ZERO_INTEGER = Pattern.compile("-?0[0-9]+");

    private final String file;
    private final ExpressionBuilder expressions = new ExpressionBuilder();

    ManifestAstBuilder(String file) {
        this.file = file;
    }

    List<ManifestStatement> program(ManifestDslParser.ProgramContext ctx) {
        return statements(ctx.statement());
    }

    private List<ManifestStatement> statements(List<ManifestDslParser.StatementContext> contexts) {
        List<ManifestStatement> statements = new ArrayList<>();
        for (ManifestDslParser.StatementContext statement : contexts) {
            if (statement instanceof ManifestDslParser.NodeStatementContext node) {
                statements.addAll(nodes(node));
            } else {
                statements.add(statement(statement));
            }
        }
        return statements;
    }

    private List<ManifestStatement> block(ManifestDslParser.BlockContext ctx) {
        return statements(ctx.statement());
    }

    private List<ManifestStatement> nodes(ManifestDslParser.NodeStatementContext ctx) {
        List<ManifestStatement> body = block(ctx.block());
        SourceLocation at = at(ctx.NODE().getSymbol());
        List<ManifestStatement> declarations = new ArrayList<>();
        for (ManifestDslParser.NodeNameContext name : ctx.nodeName()) {
            declarations.add(new ManifestStatement.NodeDeclaration(nodeName(name), body, at));
        }
        return declarations;
    }

    private String nodeName(ManifestDslParser.NodeNameContext ctx) {
        if (ctx.NAME() != null) {
            return ctx.NAME().getText();
        }
        if (ctx.SQ_STRING() != null) {
            return singleQuoted(ctx.SQ_STRING().getText());
        }
        List<StringPart> parts = doubleQuoted(ctx.DQ_STRING().getSymbol());
        if (parts.stream().anyMatch(StringPart::variable)) {
            throw error(at(ctx.getStart()), "Node names cannot interpolate variables");
        }
        return joinLiteral(parts);
    }

    private ManifestStatement statement(ManifestDslParser.StatementContext ctx) {
        if (ctx instanceof ManifestDslParser.ClassStatementContext declaration) {
            String parent = declaration.parent == null ? null : normalizeName(declaration.parent.getText());
            return new ManifestStatement.ClassDeclaration(
                normalizeName(declaration.className.getText()),
                parameters(declaration.parameters()),
                parent,
                block(declaration.block()),
                at(declaration.CLASS().getSymbol()));
        }
        if (ctx instanceof ManifestDslParser.DefineStatementContext declaration) {
            return new ManifestStatement.DefineDeclaration(
                normalizeName(declaration.defineName.getText()),
                parameters(declaration.parameters()),
                block(declaration.block()),
                at(declaration.DEFINE().getSymbol()));
        }
        if (ctx instanceof ManifestDslParser.IncludeStatementContext include) {
            return new ManifestStatement.Include(expressions(include.expression()), at(include.INCLUDE().getSymbol()));
        }
        if (ctx instanceof ManifestDslParser.AssignmentStatementContext assignment) {
            Token variable = assignment.VARIABLE().getSymbol();
            return new ManifestStatement.Assignment(
                variableName(variable.getText()), expression(assignment.expression()), at(variable));
        }
        if (ctx instanceof ManifestDslParser.ConditionalStatementContext conditional) {
            return conditional(conditional);
        }
        if (ctx instanceof ManifestDslParser.ResourceStatementContext resource) {
            return resource(resource);
        }
        if (ctx instanceof ManifestDslParser.CollectorStatementContext collector) {
            Token type = collector.REF().getSymbol();
            return new ManifestStatement.Collector(normalizeName(type.getText()), at(type));
        }
        if (ctx instanceof ManifestDslParser.CallStatementContext callStatement) {
            Expression.FunctionCall call = functionCall(callStatement.functionCall());
            return new ManifestStatement.FunctionCallStatement(call, call.location());
        }
        throw error(at(ctx.getStart()), "Unsupported statement " + ctx.getText());
    }

    private ManifestStatement conditional(ManifestDslParser.ConditionalStatementContext ctx) {
        List<ManifestDslParser.ExpressionContext> conditions = ctx.expression();
        List<ManifestDslParser.BlockContext> blocks = ctx.block();
        List<Branch> branches = new ArrayList<>();
        for (int i = 0; i < conditions.size(); i++) {
            branches.add(new Branch(expression(conditions.get(i)), block(blocks.get(i))));
        }
        List<ManifestStatement> otherwise = ctx.ELSE() == null ? List.of() : block(blocks.get(blocks.size() - 1));
        return new ManifestStatement.Conditional(branches, otherwise, at(ctx.IF().getSymbol()));
    }

    private ManifestStatement resource(ManifestDslParser.ResourceStatementContext ctx) {
        Token type = ctx.resourceType().getStart();
        if (ctx.resourceBody().isEmpty()) {
            throw error(at(type), "Resource declaration without a title");
        }
        List<ResourceBody> bodies = new ArrayList<>();
        for (ManifestDslParser.ResourceBodyContext body : ctx.resourceBody()) {
            Expression title = expression(body.expression());
            List<AttributeOperation> attributes = new ArrayList<>();
            for (ManifestDslParser.AttributeContext attribute : body.attribute()) {
                Token name = attribute.NAME().getSymbol();
                attributes.add(new AttributeOperation(name.getText(), expression(attribute.expression()), at(name)));
            }
            bodies.add(new ResourceBody(title, attributes, title.location()));
        }
        return new ManifestStatement.ResourceDeclaration(
            normalizeName(type.getText()), ctx.EXPORT() != null, bodies, at(type));
    }

    private List<Parameter> parameters(ManifestDslParser.ParametersContext ctx) {
        if (ctx == null) {
            return List.of();
        }
        List<Parameter> parameters = new ArrayList<>();
        for (ManifestDslParser.ParameterContext parameter : ctx.parameter()) {
            Token variable = parameter.VARIABLE().getSymbol();
            Expression defaultValue = parameter.expression() == null ? null : expression(parameter.expression());
            parameters.add(new Parameter(variableName(variable.getText()), defaultValue, at(variable)));
        }
        return parameters;
    }

    // expressions

    private Expression expression(ManifestDslParser.ExpressionContext ctx) {
        return expressions.visit(ctx);
    }

    private List<Expression> expressions(List<ManifestDslParser.ExpressionContext> contexts) {
        List<Expression> built = new ArrayList<>(contexts.size());
        for (ManifestDslParser.ExpressionContext ctx : contexts) {
            built.add(expression(ctx));
        }
        return built;
    }

    private List<Expression> expressionList(ManifestDslParser.ExpressionListContext ctx) {
        return ctx == null ? List.of() : expressions(ctx.expression());
    }

    private Expression.FunctionCall functionCall(ManifestDslParser.FunctionCallContext ctx) {
        Token name = ctx.NAME().getSymbol();
        return new Expression.FunctionCall(name.getText(), expressionList(ctx.expressionList()), at(name));
    }

    private final class ExpressionBuilder extends ManifestDslBaseVisitor<Expression> {

        @Override
        public Expression visitExpression(ManifestDslParser.ExpressionContext ctx) {
            Expression left = visit(ctx.left);
            if (ctx.op == null) {
                return left;
            }
            boolean negated = ctx.op.getType() == ManifestDslParser.NOTEQ;
            return new Expression.Comparison(left, visit(ctx.right), negated, at(ctx.op));
        }

        @Override
        public Expression visitSingleQuoted(ManifestDslParser.SingleQuotedContext ctx) {
            Token token = ctx.SQ_STRING().getSymbol();
            return new Expression.Literal(Value.string(singleQuoted(token.getText())), at(token));
        }

        @Override
        public Expression visitDoubleQuoted(ManifestDslParser.DoubleQuotedContext ctx) {
            Token token = ctx.DQ_STRING().getSymbol();
            List<StringPart> parts = doubleQuoted(token);
            if (parts.stream().noneMatch(StringPart::variable)) {
                return new Expression.Literal(Value.string(joinLiteral(parts)), at(token));
            }
            return new Expression.Interpolation(parts, at(token));
        }

        @Override
        public Expression visitNumber(ManifestDslParser.NumberContext ctx) {
            Token token = ctx.NUMBER().getSymbol();
            String text = token.getText();
            if (LEADING_ZERO_INTEGER.matcher(text).matches()) {
                return new Expression.Literal(Value.string(text), at(token));
            }
            return new Expression.Literal(new NumberValue(new BigDecimal(text)), at(token));
        }

        @Override
        public Expression visitVariable(ManifestDslParser.VariableContext ctx) {
            Token token = ctx.VARIABLE().getSymbol();
            return new Expression.Variable(variableName(token.getText()), at(token));
        }

        @Override
        public Expression visitArray(ManifestDslParser.ArrayContext ctx) {
            return new Expression.ArrayLiteral(expressionList(ctx.expressionList()), at(ctx.LBRACK().getSymbol()));
        }

        @Override
        public Expression visitReference(ManifestDslParser.ReferenceContext ctx) {
            Token type = ctx.REF().getSymbol();
            return new Expression.Reference(normalizeName(type.getText()), expressionList(ctx.expressionList()), at(type));
        }

        @Override
        public Expression visitCall(ManifestDslParser.CallContext ctx) {
            return functionCall(ctx.functionCall());
        }

        @Override
        public Expression visitBareWord(ManifestDslParser.BareWordContext ctx) {
            Token token = ctx.NAME().getSymbol();
            return new Expression.Literal(bareWord(token.getText()), at(token));
        }

        @Override
        public Expression visitParenthesized(ManifestDslParser.ParenthesizedContext ctx) {
            return visit(ctx.expression());
        }
    }

    // strings

    private static String singleQuoted(String quoted) {
        String body = quoted.substring(1, quoted.length() - 1);
        StringBuilder text = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '\\' && i + 1 < body.length() && (body.charAt(i + 1) == '\'' || body.charAt(i + 1) == '\\')) {
                text.append(body.charAt(++i));
            } else {
                text.append(c);
            }
        }
        return text.toString();
    }

    private List<StringPart> doubleQuoted(Token token) {
        String quoted = token.getText();
        String body = quoted.substring(1, quoted.length() - 1);
        List<StringPart> parts = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c == '\\' && i + 1 < body.length()) {
                literal.append(unescape(body.charAt(i + 1)));
                i += 2;
            } else if (c == '$' && i + 1 < body.length() && body.charAt(i + 1) == '{') {
                int end = body.indexOf('}', i + 2);
                if (end < 0) {
                    throw error(at(token), "Expected '}' to close interpolation");
                }
                String name = body.substring(i + 2, end);
                if (name.isEmpty() || variableNameLength(name, 0) != name.length()) {
                    throw error(at(token), "Invalid variable name '" + name + "' in interpolation");
                }
                flush(literal, parts);
                parts.add(StringPart.variable(name));
                i = end + 1;
            } else if (c == '$' && variableNameLength(body, i + 1) > 0) {
                int length = variableNameLength(body, i + 1);
                flush(literal, parts);
                parts.add(StringPart.variable(body.substring(i + 1, i + 1 + length)));
                i += 1 + length;
            } else {
                literal.append(c);
                i++;
            }
        }
        flush(literal, parts);
        return parts;
    }

    /**
     * Length of the variable name starting at {@code from}: an optional leading {@code ::},
     * then word characters with {@code ::} separators. Zero when there is no name.
     */
    private static int variableNameLength(String text, int from) {
        int i = from;
        if (text.startsWith("::", i)) {
            i += 2;
        }
        int start = i;
        while (i < text.length()) {
            if (isWordChar(text.charAt(i))) {
                i++;
            } else if (i > start && text.startsWith("::", i) && i + 2 < text.length() && isWordChar(text.charAt(i + 2))) {
                i += 2;
            } else {
                break;
            }
        }
        return i == start ? 0 : i - from;
    }

    private static boolean isWordChar(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_';
    }

    private static String unescape(char c) {
        switch (c) {
            case 'n':
                return "\n";
            case 't':
                return "\t";
            case 'r':
                return "\r";
            case '"':
            case '\\':
            case '$':
            case '\'':
                return String.valueOf(c);
            default:
                return "\\" + c;
        }
    }

    private static void flush(StringBuilder literal, List<StringPart> parts) {
        if (literal.length() > 0) {
            parts.add(StringPart.literal(literal.toString()));
            literal.setLength(0);
        }
    }

    private static String joinLiteral(List<StringPart> parts) {
        StringBuilder text = new StringBuilder();
        for (StringPart part : parts) {
            text.append(part.variable() ? "${" + part.text() + "}" : part.text());
        }
        return text.toString();
    }

    // names

    private static String variableName(String token) {
        return token.substring(1);
    }

    private static Value bareWord(String word) {
        switch (word) {
            case "true":
                return Value.bool(true);
            case "false":
                return Value.bool(false);
            case "undef":
                return Value.undef();
            default:
                return Value.string(word);
        }
    }

    static String normalizeName(String name) {
        String bare = name.startsWith("::") ? name.substring(2) : name;
        return bare.toLowerCase(Locale.ROOT);
    }

    private SourceLocation at(Token token) {
        return new SourceLocation(file, Math.max(token.getLine(), 1), token.getCharPositionInLine() + 1);
    }

    private static DiagnosticException error(SourceLocation at, String message) {
        return new DiagnosticException(new Diagnostic(ErrorKind.PARSE_ERROR, message, at));
    }
}
