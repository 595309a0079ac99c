/**
 * Bilevel 컨테이너용 재사용 가능한 계약 테스트와 불변식 검증.
 *
 * <p>새 구현체는 {@link com.ryuqq.bilevel.testkit.contract.AbstractBilevelSetContractTest} 또는
 * {@link com.ryuqq.bilevel.testkit.contract.AbstractBilevelMapContractTest}를 상속하고
 * 팩토리 메서드만 구현하면 모든 시나리오를 실행할 수 있습니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.bilevel.testkit.contract;
