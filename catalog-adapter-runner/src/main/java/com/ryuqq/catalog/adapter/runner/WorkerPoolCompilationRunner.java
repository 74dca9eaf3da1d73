package com.ryuqq.catalog.adapter.runner;

import com.ryuqq.catalog.application.batch.BatchCompilation;
import com.ryuqq.catalog.application.compiler.CatalogCompiler;
import com.ryuqq.catalog.core.contract.CompileRequest;
import com.ryuqq.catalog.core.model.Catalog;
import com.ryuqq.catalog.core.model.NodeName;
import com.ryuqq.catalog.core.result.ErrorKind;
import com.ryuqq.catalog.core.result.Result;
import com.ryuqq.catalog.core.spi.FactProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 고정 크기 작업자 풀로 여러 노드를 동시에 컴파일하는 BatchCompilation 구현체.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * compileNodes(nodes)
 *   ↓
 * For each node (작업자 스레드):
 *   1. factProvider.facts(node)
 *   2. compiler.compile(node, facts)
 *   ↓
 * 요청 순서대로 Future 대기 → 결과 목록
 * </pre>
 *
 * <p>작업자에서 예외가 발생하면 해당 노드만 INTERNAL_ERROR가 됩니다.</p>
 *
 * <p>작업자 스레드는 {@code catalog-compiler-worker-N} 이름의 데몬 스레드이므로
 * {@link #shutdown()}을 호출하지 않아도 JVM 종료를 막지 않습니다.</p>
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public final class WorkerPoolCompilationRunner implements BatchCompilation {

    private static final Logger log = LoggerFactory.getLogger(WorkerPoolCompilationRunner.class);

    static final String WORKER_THREAD_PREFIX = "catalog-compiler-worker-";

    private static final AtomicInteger WORKER_COUNTER = new AtomicInteger(1);

    private final CatalogCompiler compiler;
    private final FactProvider factProvider;
    private final ExecutorService workerExecutor;

    /**
     * 생성자.
     *
     * @param compiler 카탈로그 컴파일러
     * @param factProvider compileNodes에서 사용할 fact 제공자
     * @param config 작업자 풀 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public WorkerPoolCompilationRunner(CatalogCompiler compiler, FactProvider factProvider, WorkerPoolConfig config) {
        if (compiler == null) {
            throw new IllegalArgumentException("compiler cannot be null");
        }
        if (factProvider == null) {
            throw new IllegalArgumentException("factProvider cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.compiler = compiler;
        this.factProvider = factProvider;
        this.workerExecutor = Executors.newFixedThreadPool(config.concurrency(), new ThreadFactory() {
            @Override
            public Thread newThread(Runnable task) {
                Thread thread = new Thread(task, WORKER_THREAD_PREFIX + WORKER_COUNTER.getAndIncrement());
                thread.setDaemon(true);
                return thread;
            }
        });
    }

    @Override
    public List<Result<Catalog>> compileAll(List<CompileRequest> requests) {
        if (requests == null) {
            throw new IllegalArgumentException("requests cannot be null");
        }
        List<NodeName> nodes = new ArrayList<>();
        List<Callable<Result<Catalog>>> tasks = new ArrayList<>();
        for (CompileRequest request : requests) {
            nodes.add(request.node());
            tasks.add(() -> compiler.compile(request.node(), request.facts()));
        }
        return run(nodes, tasks);
    }

    @Override
    public List<Result<Catalog>> compileNodes(List<NodeName> nodes) {
        if (nodes == null) {
            throw new IllegalArgumentException("nodes cannot be null");
        }
        List<Callable<Result<Catalog>>> tasks = new ArrayList<>();
        for (NodeName node : nodes) {
            tasks.add(() -> factProvider.facts(node).flatMap(facts -> compiler.compile(node, facts)));
        }
        return run(nodes, tasks);
    }

    /**
     * 작업자 풀 종료.
     *
     * <p>진행 중인 컴파일이 끝날 때까지 최대 60초 기다린 뒤 강제 종료합니다.</p>
     */
    @Override
    public void shutdown() {
        workerExecutor.shutdown();
        try {
            if (!workerExecutor.awaitTermination(60, TimeUnit.SECONDS)) {
                workerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            workerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private List<Result<Catalog>> run(List<NodeName> nodes, List<Callable<Result<Catalog>>> tasks) {
        log.info("Batch compilation started: {} nodes", nodes.size());

        List<Future<Result<Catalog>>> futures = new ArrayList<>();
        for (Callable<Result<Catalog>> task : tasks) {
            futures.add(workerExecutor.submit(task));
        }

        List<Result<Catalog>> results = new ArrayList<>();
        int failed = 0;
        for (int i = 0; i < futures.size(); i++) {
            Result<Catalog> result = await(nodes.get(i), futures.get(i));
            if (result.isFail()) {
                failed++;
            }
            results.add(result);
        }

        log.info("Batch compilation completed: {} succeeded, {} failed", results.size() - failed, failed);
        return results;
    }

    private Result<Catalog> await(NodeName node, Future<Result<Catalog>> future) {
        try {
            Result<Catalog> result = future.get();
            return result != null
                ? result
                : Result.fail(ErrorKind.INTERNAL_ERROR, "Compilation of " + node + " produced no result");
        } catch (ExecutionException e) {
            log.error("Worker crashed while compiling {}", node, e.getCause());
            return Result.fail(ErrorKind.INTERNAL_ERROR, "Worker crashed while compiling " + node + ": " + e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Result.fail(ErrorKind.INTERNAL_ERROR, "Interrupted while compiling " + node);
        }
    }
}
