package com.ryuqq.catalog.testkit.contract;

import com.ryuqq.catalog.adapter.runner.FallbackFactProvider;
import com.ryuqq.catalog.adapter.runner.WorkerPoolCompilationRunner;
import com.ryuqq.catalog.adapter.runner.WorkerPoolConfig;
import com.ryuqq.catalog.application.batch.BatchCompilation;
import com.ryuqq.catalog.core.contract.CompileRequest;
import com.ryuqq.catalog.core.model.Catalog;
import com.ryuqq.catalog.core.model.NodeName;
import com.ryuqq.catalog.core.result.ErrorKind;
import com.ryuqq.catalog.core.result.Result;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for Scenario 7: Batch Compilation.
 *
 * <p>A worker pool compiles many nodes against one shared compiler and returns
 * results in request order.</p>
 *
 * @author Catalog Team
 * @since 1.0.0
 */
class BatchCompilationContractTest extends AbstractCompilerContractTest {

    private BatchCompilation runner;

    @BeforeEach
    void writeManifests() {
        writeSite(""
            + "node 'broken.example.com' { fail('decommissioned') }\n"
            + "node default {\n"
            + "  notify { \"hello ${hostname} in ${domain}\": }\n"
            + "  if $role == 'db' { package { 'postgresql': } }\n"
            + "}\n");
        FallbackFactProvider facts = new FallbackFactProvider(exportStore,
            node -> Result.ok(Map.of("role", "web")));
        runner = new WorkerPoolCompilationRunner(compiler(), facts, new WorkerPoolConfig(3));
    }

    @AfterEach
    void shutdownRunner() {
        runner.shutdown();
    }

    @Test
    void testBatch_CompileNodes_ResultsInRequestOrder() {
        // Given
        List<NodeName> nodes = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            nodes.add(NodeName.of("web" + i + ".example.com"));
        }

        // When
        List<Result<Catalog>> results = runner.compileNodes(nodes);

        // Then
        assertEquals(nodes.size(), results.size());
        for (int i = 0; i < nodes.size(); i++) {
            Result<Catalog> result = results.get(i);
            assertTrue(result.isOk(), "Node " + i + " should compile: " + result.diagnosticOrNull());
            assertHasResource(result.valueOrNull(), "notify", "hello web" + i + " in example.com");
        }
        assertEquals(1, parsingStats.measurements().size(), "site.pp parsed once for the whole batch");
    }

    @Test
    void testBatch_StoredFactsPreferred_OverLocalFacts() {
        // Given
        NodeName db = NodeName.of("db1.example.com");
        exportStore.putFacts(db, Map.of("hostname", "db1", "domain", "prod.example.com", "role", "db"));

        // When
        List<Result<Catalog>> results = runner.compileNodes(List.of(db));

        // Then
        Catalog catalog = results.get(0).orElseThrow();
        assertHasResource(catalog, "package", "postgresql");
        assertHasResource(catalog, "notify", "hello db1 in prod.example.com");
    }

    @Test
    void testBatch_OneNodeFails_OthersUnaffected() {
        // Given
        List<CompileRequest> requests = List.of(
            CompileRequest.of(NodeName.of("web1.example.com"), Map.of("hostname", "web1", "domain", "example.com")),
            CompileRequest.of(NodeName.of("broken.example.com"), Map.of()),
            CompileRequest.of(NodeName.of("web2.example.com"), Map.of("hostname", "web2", "domain", "example.com"))
        );

        // When
        List<Result<Catalog>> results = runner.compileAll(requests);

        // Then
        assertTrue(results.get(0).isOk(), "First node compiles");
        assertTrue(results.get(1).isFail(), "Broken node fails");
        assertEquals(ErrorKind.INTERPRETER_ERROR, results.get(1).diagnosticOrNull().kind());
        assertEquals("decommissioned", results.get(1).diagnosticOrNull().message());
        assertTrue(results.get(2).isOk(), "Third node compiles");
    }
}
