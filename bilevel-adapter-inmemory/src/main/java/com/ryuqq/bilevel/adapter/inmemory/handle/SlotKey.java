package com.ryuqq.bilevel.adapter.inmemory.handle;

/**
 * HANDLE 전략의 주 저장소 키 (그룹 슬롯, 멤버 슬롯).
 *
 * @param group 그룹 키의 슬롯 핸들
 * @param member 집계 키의 슬롯 핸들
 */
record SlotKey(int group, int member) {
}
