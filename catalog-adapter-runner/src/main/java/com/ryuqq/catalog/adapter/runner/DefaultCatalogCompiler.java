package com.ryuqq.catalog.adapter.runner;

import com.ryuqq.catalog.application.compiler.CatalogCheck;
import com.ryuqq.catalog.application.compiler.CatalogCompiler;
import com.ryuqq.catalog.application.compiler.CompilationContext;
import com.ryuqq.catalog.application.compiler.CompilerStatistics;
import com.ryuqq.catalog.core.model.Catalog;
import com.ryuqq.catalog.core.model.NodeName;
import com.ryuqq.catalog.core.model.Resource;
import com.ryuqq.catalog.core.model.Statement;
import com.ryuqq.catalog.core.model.TopLevelStatement;
import com.ryuqq.catalog.core.model.TopLevelType;
import com.ryuqq.catalog.core.model.Warning;
import com.ryuqq.catalog.core.result.Diagnostic;
import com.ryuqq.catalog.core.result.ErrorKind;
import com.ryuqq.catalog.core.result.Fail;
import com.ryuqq.catalog.core.result.Result;
import com.ryuqq.catalog.core.spi.ExportedResourceStore;
import com.ryuqq.catalog.core.spi.HierarchicalLookup;
import com.ryuqq.catalog.core.spi.Interpretation;
import com.ryuqq.catalog.core.spi.Interpreter;
import com.ryuqq.catalog.core.spi.InterpreterServices;
import com.ryuqq.catalog.core.spi.ManifestParser;
import com.ryuqq.catalog.core.spi.TemplateEvaluator;
import com.ryuqq.catalog.core.spi.noop.NoOpExportedResourceStore;
import com.ryuqq.catalog.core.spi.noop.NoOpHierarchicalLookup;
import com.ryuqq.catalog.core.spi.noop.NoOpTemplateEvaluator;
import com.ryuqq.catalog.core.stats.Measurements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * CatalogCompiler 구현체.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * compile(node, facts)
 *   ↓
 * 1. site.pp 경로 계산 → 파싱 캐시 조회 (파일당 한 번 파싱)
 *   ↓
 * 2. 노드 선언 선택 (정확한 이름 → default → MISSING_DEFINITION)
 *   ↓
 * 3. Interpreter 실행 (class/define은 같은 경로 계산 + 캐시로 해석)
 *   ↓
 * 4. 선언 리소스 타입 검증 (nameval 재명명 포함, 수집 리소스는 제외)
 *   ↓
 * 5. CatalogAssembler (중복 검사, export 분리, 관계 간선)
 *   ↓
 * 6. extraTests → CatalogCheck, publishExports → ExportedResourceStore
 * </pre>
 *
 * <p><strong>실패 처리:</strong></p>
 * <ul>
 *   <li>첫 번째 오류에서 중단하고 진단 하나만 반환 (부분 카탈로그 없음, 재시도 없음)</li>
 *   <li>협력 객체 예외와 {@link StackOverflowError}는 단계별 ErrorKind로 변환되어 compile 밖으로 나가지 않음</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 여러 스레드에서 동시에 호출할 수 있습니다.
 * 공유 상태는 파싱 캐시와 측정 저장소뿐이며 둘 다 스레드 안전합니다.</p>
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public final class DefaultCatalogCompiler implements CatalogCompiler {

    private static final Logger log = LoggerFactory.getLogger(DefaultCatalogCompiler.class);

    private final CompilerConfig config;
    private final CompilationContext context;
    private final ManifestParser parser;
    private final Interpreter interpreter;
    private final TemplateEvaluator templates;
    private final HierarchicalLookup lookup;
    private final ExportedResourceStore exportedResources;
    private final List<CatalogCheck> checks;
    private final SourcePathResolver paths;
    private final CatalogAssembler assembler = new CatalogAssembler();

    /**
     * 생성자 (템플릿, 계층 조회, export 저장소는 no-op, 검사 없음).
     *
     * @param config 설정
     * @param context 캐시, 타입 레지스트리, 측정 저장소
     * @param parser 매니페스트 파서
     * @param interpreter 인터프리터
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DefaultCatalogCompiler(CompilerConfig config, CompilationContext context,
                                  ManifestParser parser, Interpreter interpreter) {
        this(config, context, parser, interpreter, new NoOpTemplateEvaluator(), new NoOpHierarchicalLookup(),
            new NoOpExportedResourceStore(), List.of());
    }

    /**
     * 생성자 (모든 협력 객체 주입).
     *
     * @param config 설정
     * @param context 캐시, 타입 레지스트리, 측정 저장소
     * @param parser 매니페스트 파서
     * @param interpreter 인터프리터
     * @param templates 템플릿 평가기 (직렬화 래퍼로 감싸서 사용)
     * @param lookup 계층 조회
     * @param exportedResources export 리소스 저장소
     * @param checks extraTests가 켜졌을 때 실행할 검사
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DefaultCatalogCompiler(CompilerConfig config, CompilationContext context,
                                  ManifestParser parser, Interpreter interpreter,
                                  TemplateEvaluator templates, HierarchicalLookup lookup,
                                  ExportedResourceStore exportedResources, List<CatalogCheck> checks) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        if (parser == null) {
            throw new IllegalArgumentException("parser cannot be null");
        }
        if (interpreter == null) {
            throw new IllegalArgumentException("interpreter cannot be null");
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
        if (checks == null) {
            throw new IllegalArgumentException("checks cannot be null");
        }

        this.config = config;
        this.context = context;
        this.parser = parser;
        this.interpreter = interpreter;
        this.templates = new SerializedTemplateEvaluator(templates, context.statistics().templates());
        this.lookup = lookup;
        this.exportedResources = exportedResources;
        this.checks = List.copyOf(checks);
        this.paths = new SourcePathResolver(config);
    }

    @Override
    public Result<Catalog> compile(NodeName node, Map<String, String> facts) {
        if (node == null) {
            throw new IllegalArgumentException("node cannot be null");
        }
        if (facts == null) {
            throw new IllegalArgumentException("facts cannot be null");
        }
        log.debug("Compile request received for {} ({} facts)", node, facts.size());

        long startNanos = System.nanoTime();
        Result<Catalog> result;
        try {
            result = Measurements.measure(context.statistics().catalog(), node.getValue(), () -> compileNode(node, facts));
        } catch (RuntimeException | StackOverflowError e) {
            log.error("Unexpected failure compiling {}", node, e);
            result = Result.fail(ErrorKind.INTERNAL_ERROR, "Unexpected failure compiling " + node + ": " + e);
        }

        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
        if (result instanceof Fail<Catalog> fail) {
            log.warn("Compilation failed for {}: {} {}", node, fail.kind(), fail.diagnostic().message());
        } else {
            log.info("Compiled catalog for {}: {} resources in {} ms",
                node, result.valueOrNull().resources().size(), elapsedMs);
        }
        return result;
    }

    @Override
    public CompilerStatistics statistics() {
        return context.statistics();
    }

    private Result<Catalog> compileNode(NodeName node, Map<String, String> facts) {
        Result<TopLevelStatement> start = resolveStatement(TopLevelType.NODE, node.getValue());
        if (start instanceof Fail<TopLevelStatement> fail) {
            return fail.cast();
        }

        Result<Interpretation> interpreted = interpret(start.valueOrNull(), node, facts);
        if (interpreted instanceof Fail<Interpretation> fail) {
            return fail.cast();
        }
        Interpretation interpretation = interpreted.valueOrNull();
        for (Warning warning : interpretation.warnings()) {
            log.warn("{}: {}", node, warning);
        }

        List<Resource> validated = new ArrayList<>();
        for (Resource resource : interpretation.resources()) {
            Result<Resource> checked = context.registry().validate(resource);
            if (checked instanceof Fail<Resource> fail) {
                return fail.cast();
            }
            validated.add(checked.valueOrNull());
        }

        Result<Catalog> assembled = assembler.assemble(validated, interpretation.collected(), interpretation.warnings());
        if (assembled.isFail()) {
            return assembled;
        }
        Catalog catalog = assembled.valueOrNull();

        if (config.extraTests()) {
            Optional<Diagnostic> problem = runChecks(catalog);
            if (problem.isPresent()) {
                Diagnostic diagnostic = problem.get();
                return Result.fail(ErrorKind.CHECK_FAILED, diagnostic.message(), diagnostic.location());
            }
        }
        if (config.publishExports()) {
            Result<Integer> published = publish(node, catalog);
            if (published instanceof Fail<Integer> fail) {
                return fail.cast();
            }
        }
        return Result.ok(catalog);
    }

    private Result<Interpretation> interpret(TopLevelStatement start, NodeName node, Map<String, String> facts) {
        InterpreterServices services = new InterpreterServices(
            this::resolveStatement,
            templates,
            lookup,
            exportedResources,
            context.registry()::isRegistered,
            config.strict(),
            config.ignoredModules(),
            config.externalModules()
        );
        try {
            Result<Interpretation> result = interpreter.interpret(start, node, facts, services);
            return result != null
                ? result
                : Result.fail(ErrorKind.INTERPRETER_ERROR, "Interpreter returned no result for " + node);
        } catch (RuntimeException | StackOverflowError e) {
            return Result.fail(ErrorKind.INTERPRETER_ERROR, "Interpreter failed for " + node + ": " + e);
        }
    }

    private Optional<Diagnostic> runChecks(Catalog catalog) {
        for (CatalogCheck check : checks) {
            try {
                Optional<Diagnostic> problem = check.check(catalog);
                if (problem != null && problem.isPresent()) {
                    return problem;
                }
            } catch (RuntimeException e) {
                return Optional.of(Diagnostic.of(ErrorKind.CHECK_FAILED,
                    check.getClass().getSimpleName() + " failed: " + e));
            }
        }
        return Optional.empty();
    }

    private Result<Integer> publish(NodeName node, Catalog catalog) {
        try {
            Result<Integer> published = exportedResources.replaceExports(node, new ArrayList<>(catalog.exported().values()));
            log.debug("Published {} exported resources for {}", catalog.exported().size(), node);
            return published;
        } catch (RuntimeException e) {
            return Result.fail(ErrorKind.STORE_ERROR, "Publishing exports failed for " + node + ": " + e);
        }
    }

    /**
     * 최상위 선언 조회 (경로 계산 → 캐시된 파싱 → 선택).
     */
    private Result<TopLevelStatement> resolveStatement(TopLevelType type, String name) {
        String wanted = type == TopLevelType.NODE ? name : normalize(name);
        Result<Path> path = paths.resolve(type, wanted);
        if (path instanceof Fail<Path> fail) {
            return fail.cast();
        }
        Path file = path.valueOrNull().toAbsolutePath().normalize();
        Result<List<Statement>> statements = context.parseCache().get(file,
            () -> Measurements.measure(context.statistics().parsing(), file.toString(), () -> parse(file)));
        if (statements instanceof Fail<List<Statement>> fail) {
            return fail.cast();
        }
        return select(statements.valueOrNull(), type, wanted, file);
    }

    private Result<List<Statement>> parse(Path file) {
        try {
            Result<List<Statement>> parsed = parser.parse(file);
            return parsed != null ? parsed : Result.fail(ErrorKind.PARSE_ERROR, "Parser returned no result for " + file);
        } catch (RuntimeException | StackOverflowError e) {
            return Result.fail(ErrorKind.PARSE_ERROR, "Parser failed for " + file + ": " + e);
        }
    }

    private static Result<TopLevelStatement> select(List<Statement> statements, TopLevelType type,
                                                    String wanted, Path file) {
        TopLevelStatement fallback = null;
        for (Statement statement : statements) {
            if (!(statement instanceof TopLevelStatement candidate) || candidate.type() != type) {
                continue;
            }
            if (candidate.name().equals(wanted)) {
                return Result.ok(candidate);
            }
            if (type == TopLevelType.NODE && fallback == null && candidate.name().equals("default")) {
                fallback = candidate;
            }
        }
        if (fallback != null) {
            return Result.ok(fallback);
        }
        return Result.fail(ErrorKind.MISSING_DEFINITION,
            "No " + type.name().toLowerCase(Locale.ROOT) + " named '" + wanted + "' in " + file);
    }

    private static String normalize(String name) {
        String bare = name.startsWith("::") ? name.substring(2) : name;
        return bare.toLowerCase(Locale.ROOT);
    }
}
