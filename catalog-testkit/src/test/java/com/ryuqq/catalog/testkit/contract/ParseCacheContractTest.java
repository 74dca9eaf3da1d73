package com.ryuqq.catalog.testkit.contract;

import com.ryuqq.catalog.application.compiler.CatalogCompiler;
import com.ryuqq.catalog.core.model.Catalog;
import com.ryuqq.catalog.core.model.NodeName;
import com.ryuqq.catalog.core.result.Diagnostic;
import com.ryuqq.catalog.core.result.ErrorKind;
import com.ryuqq.catalog.core.result.Result;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for Scenario 3: Shared Parse Cache.
 *
 * <p>Each manifest file is parsed at most once per compilation context, including
 * under concurrent compilations and when parsing fails.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Concurrent compilations share one parse per file</li>
 *   <li>Failures are cached and replayed, also to concurrent compilations</li>
 *   <li>Manifests nested too deeply to parse fail every node the same way</li>
 *   <li>Compilers built on the same context share the cache</li>
 * </ul>
 *
 * @author Catalog Team
 * @since 1.0.0
 */
class ParseCacheContractTest extends AbstractCompilerContractTest {

    private static final int THREADS = 8;

    @Test
    void testParseCache_ConcurrentCompilations_EachFileParsedOnce() throws Exception {
        // Given
        writeSite("node default { include base }");
        writeModule("base/manifests/init.pp", "class base { package { 'curl': } }");
        CatalogCompiler compiler = compiler();
        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Result<Catalog>>> futures = new ArrayList<>();

        // When: all nodes start compiling at the same time
        try {
            for (int i = 0; i < THREADS; i++) {
                NodeName node = NodeName.of("node" + i + ".example.com");
                futures.add(executor.submit(() -> {
                    start.await();
                    return compiler.compile(node, Map.of());
                }));
            }
            start.countDown();

            // Then
            for (Future<Result<Catalog>> future : futures) {
                Result<Catalog> result = future.get(10, TimeUnit.SECONDS);
                assertTrue(result.isOk(), "Compilation should succeed: " + result.diagnosticOrNull());
                assertHasResource(result.valueOrNull(), "package", "curl");
            }
        } finally {
            executor.shutdownNow();
        }
        assertEquals(2, parsingStats.measurements().size(), "site.pp and base/init.pp parsed once each");
        assertEquals(2, parseCache.size(), "Two cache entries");
        assertEquals(THREADS, catalogStats.summaries().size(), "One catalog measurement key per node");
    }

    @Test
    void testParseCache_MissingFile_FailureReplayedWithoutReparsing() {
        // Given
        writeSite("node default { include nope }");

        // When
        Diagnostic first = compileFail("web1", Map.of());
        Diagnostic second = compileFail("web2", Map.of());

        // Then
        assertEquals(ErrorKind.MISSING_DEFINITION, first.kind());
        assertEquals(first.kind(), second.kind(), "Same failure replayed");
        assertEquals(2, parsingStats.measurements().size(), "site.pp and the missing file measured once each");
    }

    @Test
    void testParseCache_FileEditedAfterFirstParse_CachedStatementsKept() {
        // Given
        writeSite("node default { notify { 'first': } }");
        Catalog before = compileOk("web1", Map.of());

        // When: rewritten on disk, compiled by another compiler on the same context
        writeSite("node default { notify { 'second': } }");
        Catalog after = compileOk(compiler(), "web1", Map.of());

        // Then
        assertHasResource(before, "notify", "first");
        assertHasResource(after, "notify", "first");
        assertEquals(1, parsingStats.measurements().size(), "site.pp parsed once");
    }

    @Test
    void testParseCache_ConcurrentCompilationsOfBrokenSite_SameFailureParsedOnce() throws Exception {
        // Given
        writeSite("node default {\n  file { '/a' mode => 1 }\n}");

        // When
        List<Result<Catalog>> results = compileConcurrently(compiler());

        // Then
        Diagnostic expected = results.get(0).diagnosticOrNull();
        assertNotNull(expected, "Broken site must fail");
        assertDiagnostic(expected, ErrorKind.PARSE_ERROR, "Syntax error");
        for (Result<Catalog> result : results) {
            assertEquals(expected, result.diagnosticOrNull(), "Every node sees the cached failure");
        }
        assertEquals(1, parsingStats.measurements().size(), "site.pp parsed once despite failing");
    }

    @Test
    void testParseCache_DeeplyNestedSite_EveryNodeGetsParseError() throws Exception {
        // Given
        int depth = 200_000;
        writeSite("node default { $x = " + "[".repeat(depth) + "]".repeat(depth) + " }");

        // When
        List<Result<Catalog>> results = compileConcurrently(compiler());
        Diagnostic later = compileFail("web9.example.com", Map.of());

        // Then
        assertEquals(ErrorKind.PARSE_ERROR, later.kind(), "Nesting overflow reported as a parse error");
        for (Result<Catalog> result : results) {
            assertEquals(later, result.diagnosticOrNull(), "Same failure for every node");
        }
        assertEquals(1, parsingStats.measurements().size(), "site.pp parsed once");
    }

    private List<Result<Catalog>> compileConcurrently(CatalogCompiler compiler) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Result<Catalog>>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < THREADS; i++) {
                NodeName node = NodeName.of("node" + i + ".example.com");
                futures.add(executor.submit(() -> {
                    start.await();
                    return compiler.compile(node, Map.of());
                }));
            }
            start.countDown();
            List<Result<Catalog>> results = new ArrayList<>();
            for (Future<Result<Catalog>> future : futures) {
                results.add(future.get(30, TimeUnit.SECONDS));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }
}
