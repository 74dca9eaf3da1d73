package com.ryuqq.catalog.core.result;

/**
 * 진단 오류 종류.
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public enum ErrorKind {

    /** 매니페스트 구문 오류. */
    PARSE_ERROR,

    /** 타입에서 허용되지 않는 파라미터. */
    UNKNOWN_PARAMETER,

    /** 값의 종류가 기대와 다름. */
    TYPE_MISMATCH,

    /** 필수 파라미터 누락. */
    MISSING_REQUIRED,

    /** 허용 목록에 없는 값. */
    INVALID_ENUM,

    /** 허용 범위를 벗어난 숫자. */
    OUT_OF_RANGE,

    /** 형식 오류 (IP 주소, 후행 슬래시, 참조 표기 등). */
    INVALID_FORMAT,

    /** 빈 값. */
    EMPTY_VALUE,

    /** 절대 경로가 아님. */
    NOT_ABSOLUTE,

    /** 동시에 지정할 수 없는 속성. */
    CONFLICTING_ATTRIBUTES,

    /** 카탈로그에 없는 리소스를 참조. */
    UNRESOLVED_REFERENCE,

    /** 인터프리터 평가 오류. */
    INTERPRETER_ERROR,

    /** 캐시 계산 중 예외. */
    CACHE_COMPUTATION_ERROR,

    /** node, class, define 선언 또는 파일을 찾을 수 없음. */
    MISSING_DEFINITION,

    /** 같은 식별자의 리소스가 중복 선언됨. */
    DUPLICATE_RESOURCE,

    /** 템플릿 평가 실패. */
    TEMPLATE_ERROR,

    /** 계층형 데이터 조회 실패. */
    LOOKUP_ERROR,

    /** 내보낸 리소스 저장소 오류. */
    STORE_ERROR,

    /** 선택적 카탈로그 검사 실패. */
    CHECK_FAILED,

    /** 내부 오류 (호출자 입력과 무관). */
    INTERNAL_ERROR
}
