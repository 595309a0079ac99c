package com.ryuqq.bilevel.adapter.inmemory.hybrid;

/**
 * HYBRID 전략의 주 저장소 키 (복제된 그룹 키, 멤버 슬롯).
 *
 * @param group 그룹 키 (주 저장소가 소유한 복제본)
 * @param member 집계 키의 슬롯 핸들
 * @param <G> 그룹 키 타입
 */
record MemberKey<G>(G group, int member) {
}
