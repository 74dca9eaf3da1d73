/**
 * 컴파일 요청 계약.
 *
 * @author Catalog Team
 * @since 1.0.0
 */
package com.ryuqq.catalog.core.contract;
