package com.ryuqq.catalog.adapter.runner;

import com.ryuqq.catalog.application.compiler.CatalogCompiler;
import com.ryuqq.catalog.core.contract.CompileRequest;
import com.ryuqq.catalog.core.model.Catalog;
import com.ryuqq.catalog.core.model.NodeName;
import com.ryuqq.catalog.core.result.ErrorKind;
import com.ryuqq.catalog.core.result.Result;
import com.ryuqq.catalog.core.spi.FactProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * WorkerPoolCompilationRunner 유닛 테스트.
 *
 * @author Catalog Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class WorkerPoolCompilationRunnerTest {

    private static final NodeName WEB1 = NodeName.of("web1");
    private static final NodeName WEB2 = NodeName.of("web2");
    private static final NodeName DB1 = NodeName.of("db1");

    @Mock
    private CatalogCompiler compiler;

    @Mock
    private FactProvider factProvider;

    private WorkerPoolCompilationRunner runner;

    @BeforeEach
    void setUp() {
        runner = new WorkerPoolCompilationRunner(compiler, factProvider, new WorkerPoolConfig(3));
    }

    @AfterEach
    void tearDown() {
        runner.shutdown();
    }

    private static Catalog emptyCatalog() {
        return new Catalog(Map.of(), Map.of(), Map.of(), List.of());
    }

    @Test
    void compileAll은_요청_순서대로_결과_반환() {
        // given
        Catalog web1 = emptyCatalog();
        when(compiler.compile(eq(WEB1), anyMap())).thenReturn(Result.ok(web1));
        when(compiler.compile(eq(WEB2), anyMap())).thenReturn(Result.fail(ErrorKind.PARSE_ERROR, "bad"));
        when(compiler.compile(eq(DB1), anyMap())).thenReturn(Result.ok(emptyCatalog()));

        // when
        List<Result<Catalog>> results = runner.compileAll(List.of(
            CompileRequest.of(WEB1, Map.of()),
            CompileRequest.of(WEB2, Map.of()),
            CompileRequest.of(DB1, Map.of())));

        // then
        assertThat(results).hasSize(3);
        assertThat(results.get(0).valueOrNull()).isSameAs(web1);
        assertThat(results.get(1).diagnosticOrNull().kind()).isEqualTo(ErrorKind.PARSE_ERROR);
        assertThat(results.get(2).isOk()).isTrue();
    }

    @Test
    void 작업자_예외는_해당_노드만_INTERNAL_ERROR() {
        // given
        when(compiler.compile(eq(WEB1), anyMap())).thenThrow(new IllegalStateException("worker died"));
        when(compiler.compile(eq(WEB2), anyMap())).thenReturn(Result.ok(emptyCatalog()));

        // when
        List<Result<Catalog>> results = runner.compileAll(List.of(
            CompileRequest.of(WEB1, Map.of()),
            CompileRequest.of(WEB2, Map.of())));

        // then
        assertThat(results.get(0).diagnosticOrNull().kind()).isEqualTo(ErrorKind.INTERNAL_ERROR);
        assertThat(results.get(0).diagnosticOrNull().message()).contains("web1").contains("worker died");
        assertThat(results.get(1).isOk()).isTrue();
    }

    @Test
    void compileNodes는_facts를_조회한_뒤_컴파일() {
        // given
        Map<String, String> facts = Map.of("osfamily", "Debian");
        when(factProvider.facts(WEB1)).thenReturn(Result.ok(facts));
        when(factProvider.facts(DB1)).thenReturn(Result.fail(ErrorKind.STORE_ERROR, "no facts"));
        when(compiler.compile(WEB1, facts)).thenReturn(Result.ok(emptyCatalog()));

        // when
        List<Result<Catalog>> results = runner.compileNodes(List.of(WEB1, DB1));

        // then
        assertThat(results.get(0).isOk()).isTrue();
        assertThat(results.get(1).diagnosticOrNull().kind()).isEqualTo(ErrorKind.STORE_ERROR);
        verify(compiler, never()).compile(eq(DB1), any());
    }

    @Test
    void 빈_요청은_빈_결과() {
        assertThat(runner.compileAll(List.of())).isEmpty();
    }

    @Test
    void 생성자_의존성이_null이면_예외() {
        WorkerPoolConfig config = new WorkerPoolConfig();
        assertThatThrownBy(() -> new WorkerPoolCompilationRunner(null, factProvider, config))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("compiler");
        assertThatThrownBy(() -> new WorkerPoolCompilationRunner(compiler, null, config))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("factProvider");
        assertThatThrownBy(() -> new WorkerPoolCompilationRunner(compiler, factProvider, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("config");
    }

    @Test
    void 작업자는_이름이_붙은_데몬_스레드에서_실행() {
        // given
        AtomicReference<Thread> worker = new AtomicReference<>();
        when(compiler.compile(eq(WEB1), anyMap())).thenAnswer(invocation -> {
            worker.set(Thread.currentThread());
            return Result.ok(emptyCatalog());
        });

        // when
        runner.compileAll(List.of(CompileRequest.of(WEB1, Map.of())));

        // then
        assertThat(worker.get()).isNotNull();
        assertThat(worker.get().isDaemon()).isTrue();
        assertThat(worker.get().getName()).startsWith(WorkerPoolCompilationRunner.WORKER_THREAD_PREFIX);
        assertThat(worker.get()).isNotSameAs(Thread.currentThread());
    }
}
