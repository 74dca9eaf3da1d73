package com.ryuqq.catalog.adapter.manifest.interpreter;

import com.ryuqq.catalog.adapter.manifest.ast.AttributeOperation;
import com.ryuqq.catalog.adapter.manifest.ast.Branch;
import com.ryuqq.catalog.adapter.manifest.ast.Expression;
import com.ryuqq.catalog.adapter.manifest.ast.ManifestStatement;
import com.ryuqq.catalog.adapter.manifest.ast.Parameter;
import com.ryuqq.catalog.adapter.manifest.ast.ResourceBody;
import com.ryuqq.catalog.adapter.manifest.ast.StringPart;
import com.ryuqq.catalog.core.model.ArrayValue;
import com.ryuqq.catalog.core.model.BooleanValue;
import com.ryuqq.catalog.core.model.Metaparameters;
import com.ryuqq.catalog.core.model.NumberValue;
import com.ryuqq.catalog.core.model.Resource;
import com.ryuqq.catalog.core.model.ResourceId;
import com.ryuqq.catalog.core.model.SourceLocation;
import com.ryuqq.catalog.core.model.StringValue;
import com.ryuqq.catalog.core.model.TopLevelStatement;
import com.ryuqq.catalog.core.model.TopLevelType;
import com.ryuqq.catalog.core.model.UndefinedValue;
import com.ryuqq.catalog.core.model.Value;
import com.ryuqq.catalog.core.model.Warning;
import com.ryuqq.catalog.core.result.Diagnostic;
import com.ryuqq.catalog.core.result.DiagnosticException;
import com.ryuqq.catalog.core.result.ErrorKind;
import com.ryuqq.catalog.core.result.Fail;
import com.ryuqq.catalog.core.result.Result;
import com.ryuqq.catalog.core.spi.Interpretation;
import com.ryuqq.catalog.core.spi.InterpreterServices;
import com.ryuqq.catalog.core.spi.TemplateSource;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * State of one node's interpretation. Not thread-safe; one instance per compile.
 *
 * <p><strong>Scoping:</strong></p>
 * <ul>
 *   <li>Facts live in the top scope and are also reachable as {@code $::name}</li>
 *   <li>The node body gets its own scope; classes and define instances are children of it</li>
 *   <li>{@code $cls::var} reads a variable of an already declared class</li>
 * </ul>
 *
 * <p>Classes of ignored modules, and missing classes of external modules, are recorded as
 * {@code class} resources without evaluating a body. Resources whose type comes from an ignored
 * module are kept as declared.</p>
 *
 * @author Catalog Team
 * @since 1.0.0
 */
final class Evaluation {

    private static final int MAX_DEPTH = 64;
    private static final Pattern NUMERIC = Pattern.compile("-?\\d+(\\.\\d+)?");

    private final InterpreterServices services;
    private final Scope topScope = new Scope(null);
    private final Map<String, Scope> classScopes = new HashMap<>();
    private final Set<String> declaredClasses = new HashSet<>();
    private final List<Resource> resources = new ArrayList<>();
    private final Map<ResourceId, Resource> collected = new LinkedHashMap<>();
    private final List<Warning> warnings = new ArrayList<>();
    private Scope nodeScope;
    private int depth;

    Evaluation(Map<String, String> facts, InterpreterServices services) {
        this.services = services;
        facts.forEach((name, value) -> topScope.define(name, Value.string(value)));
    }

    Interpretation run(TopLevelStatement start) {
        if (!(start instanceof ManifestStatement.NodeDeclaration node)) {
            throw error("Expected a node declaration, got " + start.type() + " " + start.name(), start.location());
        }
        nodeScope = new Scope(topScope);
        evaluateBlock(node.body(), nodeScope);

        Set<ResourceId> declared = resources.stream().map(Resource::id).collect(Collectors.toSet());
        List<Resource> collectedOnly = collected.values().stream()
            .filter(resource -> !declared.contains(resource.id()))
            .collect(Collectors.toList());
        return new Interpretation(resources, collectedOnly, warnings);
    }

    // statements

    private void evaluateBlock(List<ManifestStatement> body, Scope scope) {
        for (ManifestStatement statement : body) {
            evaluate(statement, scope);
        }
    }

    private void evaluate(ManifestStatement statement, Scope scope) {
        if (statement instanceof ManifestStatement.Assignment assignment) {
            assign(assignment, scope);
        } else if (statement instanceof ManifestStatement.Include include) {
            for (Expression expression : include.classes()) {
                for (String name : classNames(evaluate(expression, scope), expression.location())) {
                    declareClass(name, Map.of(), include.location());
                }
            }
        } else if (statement instanceof ManifestStatement.Conditional conditional) {
            evaluateConditional(conditional, scope);
        } else if (statement instanceof ManifestStatement.ResourceDeclaration declaration) {
            declareResources(declaration, scope);
        } else if (statement instanceof ManifestStatement.Collector collector) {
            collect(collector);
        } else if (statement instanceof ManifestStatement.FunctionCallStatement call) {
            call(call.call(), scope);
        } else {
            throw error("Declarations are only allowed at top level", statement.location());
        }
    }

    private void assign(ManifestStatement.Assignment assignment, Scope scope) {
        String name = assignment.variable();
        if (name.contains("::")) {
            throw error("Cannot assign to qualified variable $" + name, assignment.location());
        }
        if (scope.isDefinedLocally(name)) {
            throw error("Cannot reassign variable $" + name, assignment.location());
        }
        scope.define(name, evaluate(assignment.value(), scope));
    }

    private void evaluateConditional(ManifestStatement.Conditional conditional, Scope scope) {
        for (Branch branch : conditional.branches()) {
            if (isTruthy(evaluate(branch.condition(), scope))) {
                evaluateBlock(branch.body(), scope);
                return;
            }
        }
        evaluateBlock(conditional.otherwise(), scope);
    }

    private void declareResources(ManifestStatement.ResourceDeclaration declaration, Scope scope) {
        for (ResourceBody body : declaration.bodies()) {
            List<String> titles = titles(evaluate(body.title(), scope), body.location());
            Map<String, Value> attributes = new LinkedHashMap<>();
            Set<String> seen = new HashSet<>();
            for (AttributeOperation operation : body.attributes()) {
                if (!seen.add(operation.name())) {
                    throw error("Duplicate attribute '" + operation.name() + "'", operation.location());
                }
                Value value = evaluate(operation.value(), scope);
                if (!(value instanceof UndefinedValue)) {
                    attributes.put(operation.name(), value);
                }
            }
            for (String title : titles) {
                declareResource(declaration.type(), title, attributes, declaration.exported(), body.location());
            }
        }
    }

    private void declareResource(String type, String title, Map<String, Value> attributes,
                                 boolean exported, SourceLocation location) {
        if (type.equals("class")) {
            declareClass(title, attributes, location);
            return;
        }
        if (exported || services.nativeType().test(type) || services.isIgnored(type)) {
            resources.add(Resource.of(ResourceId.of(type, title), attributes, exported, location));
            return;
        }

        Result<TopLevelStatement> resolved = services.resolver().resolve(TopLevelType.DEFINE, type);
        if (resolved instanceof Fail<TopLevelStatement> fail) {
            if (fail.kind() == ErrorKind.MISSING_DEFINITION) {
                resources.add(Resource.of(ResourceId.of(type, title), attributes, false, location));
                return;
            }
            throw new DiagnosticException(fail.diagnostic().orAt(location));
        }
        if (!(resolved.valueOrNull() instanceof ManifestStatement.DefineDeclaration define)) {
            throw error(type + " is not a define", location);
        }
        expandDefine(define, title, attributes, location);
    }

    private void expandDefine(ManifestStatement.DefineDeclaration define, String title,
                              Map<String, Value> attributes, SourceLocation location) {
        ResourceId instance = ResourceId.of(define.name(), title);
        enter(location);
        try {
            rejectUnknownParameters(define.parameters(), attributes, instance.toString(), location);
            Scope scope = new Scope(nodeScope);
            scope.define("title", Value.string(title));
            scope.define("name", attributes.getOrDefault("name", Value.string(title)));
            bindParameters(define.parameters(), attributes, scope, instance.toString(), null, location);
            resources.add(Resource.of(instance, attributes, false, location));
            evaluateBlock(define.body(), scope);
        } finally {
            depth--;
        }
    }

    private void declareClass(String rawName, Map<String, Value> parameters, SourceLocation location) {
        String name = normalizeClassName(rawName);
        if (!declaredClasses.add(name)) {
            if (!parameters.isEmpty()) {
                throw error("Duplicate declaration: Class[" + name + "] is already declared", location);
            }
            return;
        }

        if (services.isIgnored(name)) {
            resources.add(Resource.of(ResourceId.of("class", name), parameters, false, location));
            return;
        }

        enter(location);
        try {
            Result<TopLevelStatement> resolved = services.resolver().resolve(TopLevelType.CLASS, name);
            if (resolved instanceof Fail<TopLevelStatement> fail) {
                if (fail.kind() == ErrorKind.MISSING_DEFINITION && services.isExternal(name)) {
                    resources.add(Resource.of(ResourceId.of("class", name), parameters, false, location));
                    return;
                }
                throw new DiagnosticException(fail.diagnostic().orAt(location));
            }
            TopLevelStatement statement = resolved.valueOrNull();
            if (!(statement instanceof ManifestStatement.ClassDeclaration declaration)) {
                throw error(name + " is not a class", location);
            }
            Scope parentScope = nodeScope;
            if (declaration.parent() != null) {
                declareClass(declaration.parent(), Map.of(), declaration.location());
                parentScope = classScopes.getOrDefault(declaration.parent(), nodeScope);
            }
            String owner = "class[" + name + "]";
            rejectUnknownParameters(declaration.parameters(), parameters, owner, location);
            Scope scope = new Scope(parentScope);
            classScopes.put(name, scope);
            bindParameters(declaration.parameters(), parameters, scope, owner, name, location);
            resources.add(Resource.of(ResourceId.of("class", name), parameters, false, location));
            evaluateBlock(declaration.body(), scope);
        } finally {
            depth--;
        }
    }

    private void rejectUnknownParameters(List<Parameter> parameters, Map<String, Value> given,
                                         String owner, SourceLocation location) {
        Set<String> declared = parameters.stream().map(Parameter::name).collect(Collectors.toSet());
        for (String name : given.keySet()) {
            if (!declared.contains(name) && !name.equals("name") && !Metaparameters.isMetaparameter(name)) {
                throw error("Invalid parameter '" + name + "' for " + owner, location);
            }
        }
    }

    /**
     * Binds parameters in declaration order: given value, then (for classes) the
     * hierarchical lookup of {@code class::param}, then the default.
     */
    private void bindParameters(List<Parameter> parameters, Map<String, Value> given, Scope scope,
                                String owner, String lookupPrefix, SourceLocation location) {
        for (Parameter parameter : parameters) {
            Value value = given.get(parameter.name());
            if (value == null && lookupPrefix != null) {
                Value found = lookup(lookupPrefix + "::" + parameter.name(), scope, location);
                if (!(found instanceof UndefinedValue)) {
                    value = found;
                }
            }
            if (value == null && parameter.defaultValue() != null) {
                value = evaluate(parameter.defaultValue(), scope);
            }
            if (value == null) {
                throw error("Missing parameter '" + parameter.name() + "' for " + owner, location);
            }
            scope.define(parameter.name(), value);
        }
    }

    private void collect(ManifestStatement.Collector collector) {
        Result<List<Resource>> found = services.exportedResources().exportedResources(collector.type());
        if (found instanceof Fail<List<Resource>> fail) {
            throw new DiagnosticException(fail.diagnostic().orAt(collector.location()));
        }
        for (Resource resource : found.valueOrNull()) {
            collected.putIfAbsent(resource.id(), resource.asLocal());
        }
    }

    // expressions

    private Value evaluate(Expression expression, Scope scope) {
        if (expression instanceof Expression.Literal literal) {
            return literal.value();
        }
        if (expression instanceof Expression.Variable variable) {
            return lookupVariable(variable.name(), scope, variable.location());
        }
        if (expression instanceof Expression.Interpolation interpolation) {
            StringBuilder text = new StringBuilder();
            for (StringPart part : interpolation.parts()) {
                text.append(part.variable()
                    ? text(lookupVariable(part.text(), scope, interpolation.location()))
                    : part.text());
            }
            return Value.string(text.toString());
        }
        if (expression instanceof Expression.ArrayLiteral array) {
            List<Value> elements = new ArrayList<>();
            for (Expression element : array.elements()) {
                elements.add(evaluate(element, scope));
            }
            return new ArrayValue(elements);
        }
        if (expression instanceof Expression.Reference reference) {
            return evaluateReference(reference, scope);
        }
        if (expression instanceof Expression.FunctionCall call) {
            return call(call, scope);
        }
        if (expression instanceof Expression.Comparison comparison) {
            boolean equal = looselyEqual(evaluate(comparison.left(), scope), evaluate(comparison.right(), scope));
            return BooleanValue.of(equal != comparison.negated());
        }
        throw error("Unsupported expression", expression.location());
    }

    private Value evaluateReference(Expression.Reference reference, Scope scope) {
        List<Value> references = new ArrayList<>();
        for (Expression titleExpression : reference.titles()) {
            for (String title : titles(evaluate(titleExpression, scope), titleExpression.location())) {
                String normalized = reference.type().equals("class") ? normalizeClassName(title) : title;
                references.add(Value.string(ResourceId.of(reference.type(), normalized).toString()));
            }
        }
        if (references.isEmpty()) {
            throw error("Empty resource reference " + reference.type() + "[]", reference.location());
        }
        return references.size() == 1 ? references.get(0) : new ArrayValue(references);
    }

    private Value lookupVariable(String name, Scope scope, SourceLocation location) {
        Optional<Value> value;
        if (name.startsWith("::")) {
            value = topScope.lookupLocal(name.substring(2));
        } else if (name.contains("::")) {
            int split = name.lastIndexOf("::");
            Scope classScope = classScopes.get(name.substring(0, split).toLowerCase(Locale.ROOT));
            value = classScope == null ? Optional.empty() : classScope.lookupLocal(name.substring(split + 2));
        } else {
            value = scope.lookup(name);
        }
        if (value.isPresent()) {
            return value.get();
        }
        if (services.strict()) {
            throw error("Unknown variable $" + name, location);
        }
        warnings.add(new Warning("Unknown variable $" + name, location));
        return Value.undef();
    }

    // functions

    private Value call(Expression.FunctionCall call, Scope scope) {
        List<Value> arguments = new ArrayList<>();
        for (Expression argument : call.arguments()) {
            arguments.add(evaluate(argument, scope));
        }
        SourceLocation location = call.location();

        switch (call.name()) {
            case "template": {
                requireArity(call, arguments, 1, Integer.MAX_VALUE);
                StringBuilder rendered = new StringBuilder();
                for (Value name : arguments) {
                    rendered.append(render(TemplateSource.file(text(name)), scope, location));
                }
                return Value.string(rendered.toString());
            }
            case "inline_template": {
                requireArity(call, arguments, 1, Integer.MAX_VALUE);
                StringBuilder rendered = new StringBuilder();
                for (Value source : arguments) {
                    rendered.append(render(TemplateSource.inline(text(source)), scope, location));
                }
                return Value.string(rendered.toString());
            }
            case "hiera":
            case "lookup": {
                requireArity(call, arguments, 1, 2);
                Value found = lookup(text(arguments.get(0)), scope, location);
                if (found instanceof UndefinedValue && arguments.size() == 2) {
                    return arguments.get(1);
                }
                return found;
            }
            case "fail": {
                String message = arguments.stream().map(Evaluation::text).collect(Collectors.joining(" "));
                throw error(message.isBlank() ? "fail() called" : message, location);
            }
            default:
                throw error("Unknown function " + call.name() + "()", location);
        }
    }

    private String render(TemplateSource source, Scope scope, SourceLocation location) {
        Result<String> rendered = services.templates().evaluate(source, scope.visibleVariables());
        if (rendered instanceof Fail<String> fail) {
            throw new DiagnosticException(fail.diagnostic().orAt(location));
        }
        return rendered.valueOrNull();
    }

    private Value lookup(String key, Scope scope, SourceLocation location) {
        Result<Value> found = services.lookup().lookup(key, scope.visibleVariables());
        if (found instanceof Fail<Value> fail) {
            throw new DiagnosticException(fail.diagnostic().orAt(location));
        }
        return found.valueOrNull();
    }

    private static void requireArity(Expression.FunctionCall call, List<Value> arguments, int min, int max) {
        if (arguments.size() < min || arguments.size() > max) {
            throw error(call.name() + "() called with " + arguments.size() + " arguments", call.location());
        }
    }

    // value helpers

    static String text(Value value) {
        if (value instanceof StringValue s) {
            return s.value();
        }
        if (value instanceof NumberValue n) {
            return n.canonicalText();
        }
        if (value instanceof BooleanValue b) {
            return Boolean.toString(b.value());
        }
        if (value instanceof UndefinedValue) {
            return "";
        }
        return value.render();
    }

    static boolean isTruthy(Value value) {
        if (value instanceof UndefinedValue) {
            return false;
        }
        if (value instanceof BooleanValue b) {
            return b.value();
        }
        if (value instanceof StringValue s) {
            return !s.value().isEmpty();
        }
        return true;
    }

    /**
     * {@code ==} semantics: strings compare case-insensitively, numeric strings compare
     * with numbers by value, and {@code undef} equals the empty string.
     */
    static boolean looselyEqual(Value left, Value right) {
        if (left instanceof StringValue l && right instanceof StringValue r) {
            return l.value().equalsIgnoreCase(r.value());
        }
        if (left instanceof NumberValue || right instanceof NumberValue) {
            BigDecimal l = numeric(left);
            BigDecimal r = numeric(right);
            return l != null && r != null && l.compareTo(r) == 0;
        }
        if (left instanceof UndefinedValue || right instanceof UndefinedValue) {
            return text(left).isEmpty() && text(right).isEmpty() && !(left instanceof ArrayValue || right instanceof ArrayValue);
        }
        return left.equals(right);
    }

    private static BigDecimal numeric(Value value) {
        if (value instanceof NumberValue n) {
            return n.value();
        }
        if (value instanceof StringValue s && NUMERIC.matcher(s.value().trim()).matches()) {
            return new BigDecimal(s.value().trim());
        }
        return null;
    }

    private List<String> titles(Value value, SourceLocation location) {
        List<String> titles = new ArrayList<>();
        flattenTitles(value, titles, location);
        return titles;
    }

    private void flattenTitles(Value value, List<String> into, SourceLocation location) {
        if (value instanceof ArrayValue array) {
            for (Value element : array.elements()) {
                flattenTitles(element, into, location);
            }
        } else if (value instanceof StringValue || value instanceof NumberValue) {
            String title = text(value);
            if (title.isEmpty()) {
                throw error("Resource title cannot be empty", location);
            }
            into.add(title);
        } else {
            throw error("Invalid resource title " + value.render(), location);
        }
    }

    private List<String> classNames(Value value, SourceLocation location) {
        Set<String> names = new LinkedHashSet<>(titles(value, location));
        return new ArrayList<>(names);
    }

    private static String normalizeClassName(String name) {
        String bare = name.startsWith("::") ? name.substring(2) : name;
        return bare.toLowerCase(Locale.ROOT);
    }

    private void enter(SourceLocation location) {
        if (++depth > MAX_DEPTH) {
            depth--;
            throw error("Maximum declaration depth of " + MAX_DEPTH + " exceeded", location);
        }
    }

    private static DiagnosticException error(String message, SourceLocation location) {
        return new DiagnosticException(new Diagnostic(ErrorKind.INTERPRETER_ERROR, message, location));
    }
}
