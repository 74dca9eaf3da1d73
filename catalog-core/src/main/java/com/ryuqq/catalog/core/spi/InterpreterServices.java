package com.ryuqq.catalog.core.spi;

import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Collaborators handed to the {@link Interpreter} for one compilation.
 *
 * @param resolver resolves classes and defines by name
 * @param templates template evaluation (serialized by the compiler)
 * @param lookup hierarchical data lookup
 * @param exportedResources source of collected resources
 * @param nativeType true for type names handled by the type registry
 * @param strict whether unknown variables are errors
 * @param ignoredModules modules whose classes and defines are never loaded: classes are recorded
 *        without evaluating their body and define instances are kept unexpanded
 * @param externalModules modules provided elsewhere: a missing class is recorded without a body
 *        instead of failing
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public record InterpreterServices(
    StatementResolver resolver,
    TemplateEvaluator templates,
    HierarchicalLookup lookup,
    ExportedResourceStore exportedResources,
    Predicate<String> nativeType,
    boolean strict,
    Set<String> ignoredModules,
    Set<String> externalModules
) {

    public InterpreterServices {
        if (resolver == null) {
            throw new IllegalArgumentException("resolver cannot be null");
        }
        if (templates == null) {
            throw new IllegalArgumentException("templates cannot be null");
        }
        if (lookup == null) {
            throw new IllegalArgumentException("lookup cannot be null");
        }
        if (exportedResources == null) {
            throw new IllegalArgumentException("exportedResources cannot be null");
        }
        if (nativeType == null) {
            throw new IllegalArgumentException("nativeType cannot be null");
        }
        if (ignoredModules == null || externalModules == null) {
            throw new IllegalArgumentException("module sets cannot be null");
        }
        ignoredModules = Set.copyOf(ignoredModules);
        externalModules = Set.copyOf(externalModules);
    }

    /**
     * Services with no ignored or external modules.
     */
    public InterpreterServices(StatementResolver resolver, TemplateEvaluator templates, HierarchicalLookup lookup,
                               ExportedResourceStore exportedResources, Predicate<String> nativeType, boolean strict) {
        this(resolver, templates, lookup, exportedResources, nativeType, strict, Set.of(), Set.of());
    }

    /**
     * True when the class or define {@code name} ({@code module::rest}) belongs to an ignored module.
     */
    public boolean isIgnored(String name) {
        return ignoredModules.contains(moduleOf(name));
    }

    /**
     * True when the class or define {@code name} belongs to an external module.
     */
    public boolean isExternal(String name) {
        return externalModules.contains(moduleOf(name));
    }

    /**
     * Module part of a class or define name: the text before the first {@code ::}, lower-cased.
     *
     * @param name class or define name, optionally with a leading {@code ::}
     * @return module name
     */
    public static String moduleOf(String name) {
        String bare = name.startsWith("::") ? name.substring(2) : name;
        int separator = bare.indexOf("::");
        return (separator < 0 ? bare : bare.substring(0, separator)).toLowerCase(Locale.ROOT);
    }
}
