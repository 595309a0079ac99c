/**
 * 컨테이너 계약.
 *
 * <h2>컨테이너</h2>
 * <ul>
 *   <li>{@link com.ryuqq.bilevel.core.contract.BilevelSet} - 그룹 키별로 묶인 pair 집합</li>
 *   <li>{@link com.ryuqq.bilevel.core.contract.BilevelMap} - pair마다 값을 하나씩 보관</li>
 * </ul>
 *
 * <h2>오류 모델</h2>
 * <ul>
 *   <li><strong>없음:</strong> false, {@link java.util.Optional#empty()} 또는 빈 뷰 (예외 아님)</li>
 *   <li><strong>null 인자:</strong> {@link java.lang.IllegalArgumentException}</li>
 *   <li><strong>뷰를 통한 변경:</strong> {@link java.lang.UnsupportedOperationException}</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Bilevel Team
 */
package com.ryuqq.bilevel.core.contract;
