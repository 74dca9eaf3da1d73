package com.ryuqq.catalog.core.spi.noop;

import com.ryuqq.catalog.core.model.Value;
import com.ryuqq.catalog.core.result.ErrorKind;
import com.ryuqq.catalog.core.result.Result;
import com.ryuqq.catalog.core.spi.TemplateEvaluator;
import com.ryuqq.catalog.core.spi.TemplateSource;

import java.util.Map;

/**
 * Template Evaluator NoOp 구현.
 *
 * <p>템플릿 엔진이 구성되지 않은 경우 사용합니다. 모든 호출이 TEMPLATE_ERROR로 실패하므로
 * 템플릿을 사용하지 않는 매니페스트만 컴파일할 수 있습니다.</p>
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public final class NoOpTemplateEvaluator implements TemplateEvaluator {

    @Override
    public Result<String> evaluate(TemplateSource source, Map<String, Value> scope) {
        return Result.fail(ErrorKind.TEMPLATE_ERROR, "no template engine configured for " + source.name());
    }
}
