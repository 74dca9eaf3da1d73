package com.ryuqq.catalog.adapter.runner;

import com.ryuqq.catalog.core.model.Value;
import com.ryuqq.catalog.core.result.ErrorKind;
import com.ryuqq.catalog.core.result.Result;
import com.ryuqq.catalog.core.spi.MeasurementStore;
import com.ryuqq.catalog.core.spi.TemplateEvaluator;
import com.ryuqq.catalog.core.spi.TemplateSource;
import com.ryuqq.catalog.core.stats.Measurements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 템플릿 평가기를 단일 소유자로 직렬화하는 래퍼.
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>공정(fair) ReentrantLock으로 한 번에 하나의 평가만 실행</li>
 *   <li>평가 시간을 templates 저장소에 템플릿 이름으로 기록</li>
 *   <li>평가기 예외와 null 결과를 TEMPLATE_ERROR로 변환</li>
 * </ul>
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public final class SerializedTemplateEvaluator implements TemplateEvaluator {

    private static final Logger log = LoggerFactory.getLogger(SerializedTemplateEvaluator.class);

    private final TemplateEvaluator delegate;
    private final MeasurementStore measurements;
    private final ReentrantLock lock = new ReentrantLock(true);

    /**
     * 생성자.
     *
     * @param delegate 실제 템플릿 평가기
     * @param measurements templates 측정 저장소
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public SerializedTemplateEvaluator(TemplateEvaluator delegate, MeasurementStore measurements) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        if (measurements == null) {
            throw new IllegalArgumentException("measurements cannot be null");
        }
        this.delegate = delegate;
        this.measurements = measurements;
    }

    @Override
    public Result<String> evaluate(TemplateSource source, Map<String, Value> scope) {
        lock.lock();
        try {
            Result<String> result = Measurements.measure(measurements, source.name(), () -> delegate.evaluate(source, scope));
            if (result == null) {
                return Result.fail(ErrorKind.TEMPLATE_ERROR, "Template " + source.name() + " produced no result");
            }
            if (result.isFail()) {
                log.debug("Template {} failed: {}", source.name(), result.diagnosticOrNull());
            }
            return result;
        } catch (RuntimeException e) {
            log.warn("Template {} threw {}", source.name(), e.toString());
            return Result.fail(ErrorKind.TEMPLATE_ERROR, "Template " + source.name() + " failed: " + e.getMessage());
        } finally {
            lock.unlock();
        }
    }
}
