/**
 * 키 모델: 전체 키를 그룹 키와 집계 키로 나누는 방법.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.bilevel.core.key.FullKey} - (그룹 키, 집계 키) 복합 키</li>
 *   <li>{@link com.ryuqq.bilevel.core.key.GroupEntry} - 한 그룹 안의 집계 키와 값</li>
 *   <li>{@link com.ryuqq.bilevel.core.key.BilevelEntry} - 그룹 키, 집계 키, 값</li>
 * </ul>
 *
 * <h2>계약</h2>
 * <ul>
 *   <li>{@link com.ryuqq.bilevel.core.key.KeyComposition} - 행(row)을 전체 키로 분해</li>
 *   <li>{@link com.ryuqq.bilevel.core.key.KeyCopier} - 복제 가능한 구성 요소의 복제</li>
 * </ul>
 *
 * <h2>키 요구사항</h2>
 * <ul>
 *   <li><strong>동등성:</strong> 그룹 키와 집계 키는 {@code equals}/{@code hashCode}로 색인</li>
 *   <li><strong>Non-null:</strong> 두 구성 요소 모두 null 불가</li>
 *   <li><strong>안정성:</strong> 저장된 동안 키의 hash code가 바뀌면 안 됨</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Bilevel Team
 */
package com.ryuqq.bilevel.core.key;
