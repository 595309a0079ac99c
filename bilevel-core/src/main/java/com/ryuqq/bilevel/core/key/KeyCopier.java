package com.ryuqq.bilevel.core.key;

/**
 * 키 구성 요소의 독립적인 복제본을 만듭니다.
 *
 * <p>구성 요소를 복제해 보관하는 소유권 전략(COPY 전략의 그룹 색인, HYBRID 전략의
 * 버킷 라벨)은 구성 요소를 저장할 때마다 복제기를 호출합니다.
 * {@link String}, 박싱된 숫자, 불변 필드로 된 record 같은 불변 값은 참조 공유만으로
 * 독립적이므로 {@link #identity()}를 사용합니다. 가변 키 타입은 실제 복제를 제공해야 합니다
 * (예: {@code List::copyOf}).</p>
 *
 * <p>복제 결과는 인자와 equals이고 hash code도 같아야 합니다.</p>
 *
 * @param <T> 구성 요소 타입
 * @author Bilevel Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface KeyCopier<T> {

    /**
     * 값을 복제합니다.
     *
     * @param value 복제할 값 (null 아님)
     * @return {@code value}와 같고 가변 상태를 공유하지 않는 값
     */
    T copy(T value);

    /**
     * 불변 값용 복제기.
     *
     * @param <T> 구성 요소 타입
     * @return 인자를 그대로 반환하는 복제기
     */
    static <T> KeyCopier<T> identity() {
        return value -> value;
    }
}
