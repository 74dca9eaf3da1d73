package com.ryuqq.catalog.application.compiler;

import com.ryuqq.catalog.core.spi.MeasurementStore;

/**
 * 컴파일러의 세 가지 측정 저장소.
 *
 * <p><strong>구성:</strong></p>
 * <ul>
 *   <li><strong>parsing:</strong> 파일 경로별 파싱 시간</li>
 *   <li><strong>catalog:</strong> 노드 이름별 전체 컴파일 시간</li>
 *   <li><strong>templates:</strong> 템플릿 이름별 평가 시간</li>
 * </ul>
 *
 * @param parsing 파싱 측정
 * @param catalog 컴파일 측정
 * @param templates 템플릿 측정
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public record CompilerStatistics(
    MeasurementStore parsing,
    MeasurementStore catalog,
    MeasurementStore templates
) {

    public CompilerStatistics {
        if (parsing == null || catalog == null || templates == null) {
            throw new IllegalArgumentException("measurement stores cannot be null");
        }
        if (parsing == catalog || parsing == templates || catalog == templates) {
            throw new IllegalArgumentException("measurement stores must be distinct");
        }
    }
}
