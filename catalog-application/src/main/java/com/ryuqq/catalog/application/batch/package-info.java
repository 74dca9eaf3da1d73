/**
 * 여러 노드의 일괄 컴파일.
 *
 * @author Catalog Team
 * @since 1.0.0
 */
package com.ryuqq.catalog.application.batch;
