package com.ryuqq.catalog.core.validation;

import com.ryuqq.catalog.core.model.ArrayValue;
import com.ryuqq.catalog.core.model.BooleanValue;
import com.ryuqq.catalog.core.model.NumberValue;
import com.ryuqq.catalog.core.model.Resource;
import com.ryuqq.catalog.core.model.StringValue;
import com.ryuqq.catalog.core.model.Value;
import com.ryuqq.catalog.core.result.ErrorKind;
import com.ryuqq.catalog.core.result.Fail;
import com.ryuqq.catalog.core.result.Result;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;
import java.util.regex.Pattern;

/**
 * 파라미터 단위 검증 조합자 모음.
 *
 * <p>각 메서드는 {@link ParameterRule}로 쓸 수 있도록 파라미터 이름을 받아
 * {@link Validator}를 반환합니다. 값이 없는 파라미터는 {@link #mandatory(String)},
 * {@link #mandatoryIfNotAbsent(String)}, {@link #defaultValue(String)},
 * {@link #nameval(String)}을 제외하고 모두 통과합니다.</p>
 *
 * <p><strong>선언 예시:</strong></p>
 * <pre>
 * ValidatorPipeline.builder()
 *     .parameter("path", Validators::nameval, Validators::fullyQualified, Validators::noTrailingSlash)
 *     .parameter("ensure", Validators.values("present", "absent", "file", "directory", "link"))
 *     .validate(Validators.sourceOrContent())
 *     .build();
 * </pre>
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public final class Validators {

    private static final String PATH_SEPARATOR = "/";

    /** 십진 정수 표기만 허용 (지수 표기 제외). */
    private static final Pattern DECIMAL_INTEGER = Pattern.compile("[+-]?\\d+(\\.\\d*)?");

    private Validators() {
    }

    /**
     * 문자열 강제 변환.
     *
     * <p>Boolean은 "true"/"false", Number는 정규 십진 표기로 변환합니다.
     * 배열과 undef는 TYPE_MISMATCH입니다.</p>
     *
     * @param param 파라미터 이름
     * @return Validator
     */
    public static Validator string(String param) {
        return onPresent(param, (res, value) ->
            coerceString(param, value).map(coerced -> coerced.equals(value) ? res : res.withAttribute(param, coerced)));
    }

    /**
     * 배열 원소 단위 {@link #string(String)}.
     *
     * @param param 파라미터 이름
     * @return Validator
     */
    public static Validator strings(String param) {
        return elementwise(param, Validators::coerceString);
    }

    /**
     * 정수 강제 변환.
     *
     * <p>먼저 {@link #string(String)}을 적용한 뒤 정수로 정확히 표현 가능한지 확인하고
     * 정규 Number로 다시 씁니다.</p>
     *
     * @param param 파라미터 이름
     * @return Validator
     */
    public static Validator integer(String param) {
        return onPresent(param, (res, value) ->
            coerceInteger(param, value).map(number -> res.withAttribute(param, number)));
    }

    /**
     * 배열 원소 단위 {@link #integer(String)}.
     *
     * @param param 파라미터 이름
     * @return Validator
     */
    public static Validator integers(String param) {
        return elementwise(param, Validators::coerceInteger);
    }

    /**
     * 허용 값 목록 검사.
     *
     * @param allowed 허용 값
     * @return ParameterRule
     */
    public static ParameterRule values(String... allowed) {
        List<String> allowedValues = List.of(allowed);
        return param -> onPresent(param, (res, value) -> {
            if (value instanceof StringValue s && allowedValues.contains(s.value())) {
                return Result.ok(res);
            }
            return Result.fail(ErrorKind.INVALID_ENUM,
                "Parameter " + quoted(param) + " value should be one of " + allowedValues + " and not " + value.render());
        });
    }

    /**
     * 기본값 채우기 (기존 값은 덮어쓰지 않음).
     *
     * @param defaultValue 기본 문자열
     * @return ParameterRule
     */
    public static ParameterRule defaultValue(String defaultValue) {
        StringValue fallback = new StringValue(defaultValue);
        return param -> res -> Result.ok(res.hasAttribute(param) ? res : res.withAttribute(param, fallback));
    }

    /**
     * 필수 파라미터.
     *
     * @param param 파라미터 이름
     * @return Validator
     */
    public static Validator mandatory(String param) {
        return res -> res.hasAttribute(param)
            ? Result.ok(res)
            : Result.fail(ErrorKind.MISSING_REQUIRED, "Parameter " + quoted(param) + " should be set.");
    }

    /**
     * ensure가 "absent"가 아니면 필수.
     *
     * @param param 파라미터 이름
     * @return Validator
     */
    public static Validator mandatoryIfNotAbsent(String param) {
        return res -> {
            boolean absent = res.attribute("ensure").map(new StringValue("absent")::equals).orElse(false);
            if (absent || res.hasAttribute(param)) {
                return Result.ok(res);
            }
            return Result.fail(ErrorKind.MISSING_REQUIRED, "Parameter " + quoted(param) + " should be set.");
        };
    }

    /**
     * 절대 경로 검사.
     *
     * @param param 파라미터 이름
     * @return Validator
     */
    public static Validator fullyQualified(String param) {
        return onPresent(param, (res, value) -> checkAbsolute(param, value).map(ignored -> res));
    }

    /**
     * 배열 원소 단위 {@link #fullyQualified(String)}.
     *
     * @param param 파라미터 이름
     * @return Validator
     */
    public static Validator fullyQualifieds(String param) {
        return elementwise(param, Validators::checkAbsolute);
    }

    /**
     * 후행 경로 구분자 금지 (문자열이 아닌 값은 통과).
     *
     * @param param 파라미터 이름
     * @return Validator
     */
    public static Validator noTrailingSlash(String param) {
        return onPresent(param, (res, value) -> {
            if (value instanceof StringValue s && s.value().endsWith(PATH_SEPARATOR)) {
                return Result.fail(ErrorKind.INVALID_FORMAT,
                    "Parameter " + quoted(param) + " should not have a trailing slash");
            }
            return Result.ok(res);
        });
    }

    /**
     * IPv4 주소 검사 (점으로 구분된 0~255 십진수 4개).
     *
     * @param param 파라미터 이름
     * @return Validator
     */
    public static Validator ipaddr(String param) {
        return onPresent(param, (res, value) -> {
            if (!(value instanceof StringValue s)) {
                return Result.fail(ErrorKind.TYPE_MISMATCH,
                    "Parameter " + quoted(param) + " should be an IP address string, not " + value.render());
            }
            if (!isIpv4(s.value())) {
                return Result.fail(ErrorKind.INVALID_FORMAT, "Invalid IP address for parameter " + quoted(param));
            }
            return Result.ok(res);
        });
    }

    /**
     * 숫자 범위 검사 (lo ≤ v ≤ hi).
     *
     * @param lo 하한 (포함)
     * @param hi 상한 (포함)
     * @return ParameterRule
     */
    public static ParameterRule inRange(long lo, long hi) {
        BigDecimal min = BigDecimal.valueOf(lo);
        BigDecimal max = BigDecimal.valueOf(hi);
        return param -> onPresent(param, (res, value) -> {
            if (!(value instanceof NumberValue n)) {
                return Result.fail(ErrorKind.TYPE_MISMATCH,
                    "Parameter " + quoted(param) + " should be an integer, and not " + value.render());
            }
            if (n.value().compareTo(min) < 0 || n.value().compareTo(max) > 0) {
                return Result.fail(ErrorKind.OUT_OF_RANGE,
                    "Parameter " + quoted(param) + "'s value should be between " + lo + " and " + hi);
            }
            return Result.ok(res);
        });
    }

    /**
     * 단일 값을 원소 하나짜리 배열로 감싸기.
     *
     * @param param 파라미터 이름
     * @return Validator
     */
    public static Validator rarray(String param) {
        return onPresent(param, (res, value) -> value instanceof ArrayValue
            ? Result.ok(res)
            : Result.ok(res.withAttribute(param, new ArrayValue(List.of(value)))));
    }

    /**
     * 이름 파라미터 (namevar).
     *
     * <p>{@link #string(String)}을 포함합니다. 파라미터가 없으면 리소스 타이틀을 복사하고,
     * 있으면 그 값으로 리소스 타이틀(식별자)을 다시 씁니다. 식별자 기반 자료구조에
     * 들어가기 전에만 실행되어야 합니다.</p>
     *
     * @param param 파라미터 이름
     * @return Validator
     */
    public static Validator nameval(String param) {
        return string(param).andThen(res -> {
            Value value = res.attributes().get(param);
            if (value == null) {
                return Result.ok(res.withAttribute(param, new StringValue(res.title())));
            }
            if (value instanceof StringValue alias) {
                if (alias.value().isEmpty()) {
                    return Result.fail(ErrorKind.EMPTY_VALUE, "Parameter " + quoted(param) + " cannot be empty");
                }
                return Result.ok(res.withTitle(alias.value()));
            }
            return Result.fail(ErrorKind.TYPE_MISMATCH, "The alias must be a string, not " + value.render());
        });
    }

    /**
     * source와 content 동시 지정 금지.
     *
     * @return 리소스 단위 Validator
     */
    public static Validator sourceOrContent() {
        return res -> res.hasAttribute("source") && res.hasAttribute("content")
            ? Result.fail(ErrorKind.CONFLICTING_ATTRIBUTES, "Source and content can't be specified at the same time")
            : Result.ok(res);
    }

    // 내부 헬퍼

    private static Validator onPresent(String param, BiFunction<Resource, Value, Result<Resource>> check) {
        return res -> {
            Value value = res.attributes().get(param);
            return value == null ? Result.ok(res) : check.apply(res, value);
        };
    }

    private static Validator elementwise(String param, BiFunction<String, Value, Result<Value>> element) {
        return onPresent(param, (res, value) -> {
            if (!(value instanceof ArrayValue array)) {
                return Result.fail(ErrorKind.TYPE_MISMATCH,
                    "Parameter " + quoted(param) + " should be an array, not " + value.render());
            }
            List<Value> rewritten = new ArrayList<>(array.elements().size());
            for (Value item : array.elements()) {
                Result<Value> checked = element.apply(param, item);
                if (checked instanceof Fail<Value> fail) {
                    return fail.cast();
                }
                rewritten.add(checked.valueOrNull());
            }
            ArrayValue result = new ArrayValue(rewritten);
            return Result.ok(result.equals(array) ? res : res.withAttribute(param, result));
        });
    }

    private static Result<Value> coerceString(String param, Value value) {
        if (value instanceof StringValue) {
            return Result.ok(value);
        }
        if (value instanceof BooleanValue b) {
            return Result.ok(new StringValue(Boolean.toString(b.value())));
        }
        if (value instanceof NumberValue n) {
            return Result.ok(new StringValue(n.canonicalText()));
        }
        return Result.fail(ErrorKind.TYPE_MISMATCH,
            "Parameter " + quoted(param) + " should be a string, and not " + value.render());
    }

    private static Result<Value> coerceInteger(String param, Value value) {
        return coerceString(param, value).flatMap(text -> parseInteger(param, ((StringValue) text).value()));
    }

    private static Result<Value> parseInteger(String param, String text) {
        if (!DECIMAL_INTEGER.matcher(text).matches()) {
            return notAnInteger(param, text);
        }
        NumberValue number = new NumberValue(new BigDecimal(text));
        return number.isIntegral() ? Result.ok(number) : notAnInteger(param, text);
    }

    private static Result<Value> notAnInteger(String param, String text) {
        return Result.fail(ErrorKind.TYPE_MISMATCH, "Parameter " + quoted(param) + " must be an integer, not '" + text + "'");
    }

    private static Result<Value> checkAbsolute(String param, Value value) {
        if (!(value instanceof StringValue path)) {
            return Result.fail(ErrorKind.TYPE_MISMATCH,
                "Path is not a resolved string, but " + value.render() + " for parameter " + quoted(param));
        }
        if (path.value().isEmpty()) {
            return Result.fail(ErrorKind.EMPTY_VALUE, "Empty path for parameter " + quoted(param));
        }
        if (!path.value().startsWith(PATH_SEPARATOR)) {
            return Result.fail(ErrorKind.NOT_ABSOLUTE,
                "Path must be absolute, not '" + path.value() + "' for parameter " + quoted(param));
        }
        return Result.ok(value);
    }

    static boolean isIpv4(String ip) {
        String[] octets = ip.split("\\.", -1);
        if (octets.length != 4) {
            return false;
        }
        for (String octet : octets) {
            if (octet.isEmpty()) {
                return false;
            }
            int acc = 0;
            for (int i = 0; i < octet.length(); i++) {
                char c = octet.charAt(i);
                if (c < '0' || c > '9') {
                    return false;
                }
                acc = acc * 10 + (c - '0');
                if (acc > 255) {
                    return false;
                }
            }
        }
        return true;
    }

    private static String quoted(String param) {
        return "'" + param + "'";
    }
}
