/**
 * 카탈로그 컴파일 진입점.
 *
 * <p>{@link com.ryuqq.catalog.application.compiler.CatalogCompiler}는 노드 이름과 facts를 받아
 * 검증된 카탈로그 또는 단일 진단을 반환합니다. 컴파일러 인스턴스가 공유하는 상태는
 * {@link com.ryuqq.catalog.application.compiler.CompilationContext}에 모여 있습니다.</p>
 *
 * @author Catalog Team
 * @since 1.0.0
 */
package com.ryuqq.catalog.application.compiler;
