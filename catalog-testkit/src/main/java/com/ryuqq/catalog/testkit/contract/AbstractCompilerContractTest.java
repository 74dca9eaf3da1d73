package com.ryuqq.catalog.testkit.contract;

import com.ryuqq.catalog.adapter.inmemory.cache.InMemoryComputeCache;
import com.ryuqq.catalog.adapter.inmemory.stats.InMemoryMeasurementStore;
import com.ryuqq.catalog.adapter.inmemory.store.InMemoryExportedResourceStore;
import com.ryuqq.catalog.adapter.manifest.interpreter.ManifestInterpreter;
import com.ryuqq.catalog.adapter.manifest.parser.DslManifestParser;
import com.ryuqq.catalog.adapter.runner.CompilerConfig;
import com.ryuqq.catalog.adapter.runner.DeclaredUsersAndGroupsCheck;
import com.ryuqq.catalog.adapter.runner.DefaultCatalogCompiler;
import com.ryuqq.catalog.application.compiler.CatalogCompiler;
import com.ryuqq.catalog.application.compiler.CompilationContext;
import com.ryuqq.catalog.application.compiler.CompilerStatistics;
import com.ryuqq.catalog.core.model.Catalog;
import com.ryuqq.catalog.core.model.NodeName;
import com.ryuqq.catalog.core.model.Resource;
import com.ryuqq.catalog.core.model.ResourceId;
import com.ryuqq.catalog.core.model.Statement;
import com.ryuqq.catalog.core.model.Value;
import com.ryuqq.catalog.core.result.Diagnostic;
import com.ryuqq.catalog.core.result.ErrorKind;
import com.ryuqq.catalog.core.result.Result;
import com.ryuqq.catalog.core.spi.HierarchicalLookup;
import com.ryuqq.catalog.core.spi.TemplateEvaluator;
import com.ryuqq.catalog.core.spi.noop.NoOpHierarchicalLookup;
import com.ryuqq.catalog.core.spi.noop.NoOpTemplateEvaluator;
import com.ryuqq.catalog.core.types.NativeTypes;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Abstract base class for compiler contract tests.
 *
 * <p>Each test gets a fresh manifest tree under a temporary directory and a compiler
 * wired from the real parser, interpreter and in-memory adapters.</p>
 *
 * <p><strong>Test Infrastructure:</strong></p>
 * <ul>
 *   <li>InMemoryComputeCache: shared parse cache</li>
 *   <li>InMemoryMeasurementStore: parsing, catalog and template timings</li>
 *   <li>InMemoryExportedResourceStore: exported resources and stored facts</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * public class MyContractTest extends AbstractCompilerContractTest {
 *     {@literal @}Test
 *     void testScenario() {
 *         writeSite("node 'web1' { package { 'nginx': } }");
 *
 *         Catalog catalog = compileOk("web1", Map.of());
 *
 *         assertHasResource(catalog, "package", "nginx");
 *     }
 * }
 * </pre>
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public abstract class AbstractCompilerContractTest {

    @TempDir
    protected Path puppetDir;

    protected InMemoryComputeCache<Path, List<Statement>> parseCache;
    protected InMemoryMeasurementStore parsingStats;
    protected InMemoryMeasurementStore catalogStats;
    protected InMemoryMeasurementStore templateStats;
    protected InMemoryExportedResourceStore exportStore;
    protected CompilationContext context;

    /**
     * Template evaluator handed to compilers built by {@link #compiler(CompilerConfig)}.
     * Tests may replace it before building a compiler.
     */
    protected TemplateEvaluator templateEngine;

    /**
     * Hierarchical lookup handed to compilers built by {@link #compiler(CompilerConfig)}.
     */
    protected HierarchicalLookup lookup;

    /**
     * Sets up test fixtures before each test.
     *
     * <p>Creates fresh adapters and a shared compilation context.</p>
     */
    @BeforeEach
    protected void setUp() {
        parseCache = new InMemoryComputeCache<>();
        parsingStats = new InMemoryMeasurementStore();
        catalogStats = new InMemoryMeasurementStore();
        templateStats = new InMemoryMeasurementStore();
        exportStore = new InMemoryExportedResourceStore();
        context = new CompilationContext(parseCache, NativeTypes.registry(),
            new CompilerStatistics(parsingStats, catalogStats, templateStats));
        templateEngine = new NoOpTemplateEvaluator();
        lookup = new NoOpHierarchicalLookup();
    }

    /**
     * Cleans up test fixtures after each test.
     */
    @AfterEach
    protected void tearDown() {
        if (parseCache != null) {
            parseCache.clear();
        }
        if (parsingStats != null) {
            parsingStats.clear();
            catalogStats.clear();
            templateStats.clear();
        }
        if (exportStore != null) {
            exportStore.clear();
        }
    }

    /**
     * Default configuration rooted at the temporary directory.
     */
    protected CompilerConfig config() {
        return CompilerConfig.of(puppetDir);
    }

    /**
     * Builds a compiler with the default configuration.
     */
    protected CatalogCompiler compiler() {
        return compiler(config());
    }

    /**
     * Builds a compiler sharing this test's context, exported store and user/group check.
     *
     * @param config compiler configuration
     * @return compiler
     */
    protected CatalogCompiler compiler(CompilerConfig config) {
        return new DefaultCatalogCompiler(config, context, new DslManifestParser(), new ManifestInterpreter(),
            templateEngine, lookup, exportStore, List.of(new DeclaredUsersAndGroupsCheck()));
    }

    /**
     * Writes {@code manifests/site.pp}.
     *
     * @param source manifest text
     * @return written file
     */
    protected Path writeSite(String source) {
        return writeFile("manifests/site.pp", source);
    }

    /**
     * Writes a module manifest, e.g. {@code writeModule("apache/manifests/vhost.pp", ...)}.
     *
     * @param relativePath path below {@code modules/}
     * @param source manifest text
     * @return written file
     */
    protected Path writeModule(String relativePath, String source) {
        return writeFile("modules/" + relativePath, source);
    }

    /**
     * Writes a file below the temporary root, creating parent directories.
     */
    protected Path writeFile(String relativePath, String source) {
        Path file = puppetDir.resolve(relativePath);
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, source);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + file, e);
        }
        return file;
    }

    // Helper Methods

    /**
     * Compiles with the default compiler and asserts success.
     */
    protected Catalog compileOk(String node, Map<String, String> facts) {
        return compileOk(compiler(), node, facts);
    }

    /**
     * Compiles and asserts success.
     *
     * @return the compiled catalog
     */
    protected Catalog compileOk(CatalogCompiler compiler, String node, Map<String, String> facts) {
        Result<Catalog> result = compiler.compile(NodeName.of(node), facts);
        assertTrue(result.isOk(), () -> "Compilation of " + node + " should succeed but got " + result.diagnosticOrNull());
        return result.valueOrNull();
    }

    /**
     * Compiles with the default compiler and asserts failure.
     */
    protected Diagnostic compileFail(String node, Map<String, String> facts) {
        return compileFail(compiler(), node, facts);
    }

    /**
     * Compiles and asserts failure.
     *
     * @return the single diagnostic
     */
    protected Diagnostic compileFail(CatalogCompiler compiler, String node, Map<String, String> facts) {
        Result<Catalog> result = compiler.compile(NodeName.of(node), facts);
        assertTrue(result.isFail(), () -> "Compilation of " + node + " should fail but got " + result.valueOrNull());
        return result.diagnosticOrNull();
    }

    // Assert Methods

    /**
     * Asserts a local resource exists and returns it.
     */
    protected Resource assertHasResource(Catalog catalog, String type, String title) {
        Resource resource = catalog.resource(ResourceId.of(type, title));
        assertNotNull(resource, "Catalog should contain " + type + "[" + title + "] but has " + catalog.resources().keySet());
        return resource;
    }

    /**
     * Asserts a string attribute value.
     */
    protected void assertAttribute(Resource resource, String name, String expected) {
        assertEquals(Value.string(expected), resource.attribute(name).orElse(null),
            "Attribute " + name + " of " + resource.id() + " should match");
    }

    /**
     * Asserts {@code source} depends on {@code target}.
     */
    protected void assertDependsOn(Catalog catalog, ResourceId source, ResourceId target) {
        assertTrue(catalog.dependenciesOf(source).contains(target),
            source + " should depend on " + target + " but depends on " + catalog.dependenciesOf(source));
    }

    /**
     * Asserts the failure kind and that the message contains the given fragment.
     */
    protected void assertDiagnostic(Diagnostic diagnostic, ErrorKind kind, String messageFragment) {
        assertEquals(kind, diagnostic.kind(), "Unexpected diagnostic " + diagnostic);
        assertTrue(diagnostic.message().contains(messageFragment),
            "Message should contain '" + messageFragment + "' but was: " + diagnostic.message());
    }
}
