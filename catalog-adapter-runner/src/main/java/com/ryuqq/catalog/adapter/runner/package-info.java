/**
 * 카탈로그 컴파일러 실행 어댑터.
 *
 * <p>DefaultCatalogCompiler가 SPI 구현체들을 조립해 노드별 카탈로그를 만들고,
 * WorkerPoolCompilationRunner가 여러 노드를 동시에 컴파일합니다.</p>
 *
 * @author Catalog Team
 * @since 1.0.0
 */
package com.ryuqq.catalog.adapter.runner;
