package com.ryuqq.bilevel.core.config;

/**
 * 컨테이너 사전 할당 설정 (불변 record).
 *
 * <p>이 record는 컨테이너 생성 시 미리 확보할 공간의 크기를 담고 있습니다.
 * 값은 힌트일 뿐이며, 초과하더라도 컨테이너는 자동으로 확장됩니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>groups: 미리 확보할 그룹 수 (기본 0)</li>
 *   <li>perGroup: 새 그룹 키가 발견될 때 그룹마다 확보할 항목 수 (기본 4)</li>
 *   <li>aggregationKeys: 미리 확보할 서로 다른 집계 키 수 (기본 0)</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>그룹 수를 알고 있는 경우: groups 지정으로 재해싱 방지</li>
 *   <li>그룹이 크고 균일한 경우: perGroup 증가</li>
 *   <li>전체 키 수만 알고 있는 경우: {@link #ofFullKeys(int)} 사용</li>
 * </ul>
 *
 * @author Bilevel Team
 * @since 1.0.0
 * @param groups 그룹 수 (0 이상)
 * @param perGroup 그룹당 초기 용량 (1 이상)
 * @param aggregationKeys 집계 키 수 (0 이상)
 */
public record Capacity(int groups, int perGroup, int aggregationKeys) {

    /**
     * 그룹당 기본 초기 용량.
     */
    public static final int DEFAULT_PER_GROUP = 4;

    private static final int MAX_HINT = 1 << 30;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: groups=0, perGroup=4, aggregationKeys=0</p>
     */
    public Capacity() {
        this(0, DEFAULT_PER_GROUP, 0);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public Capacity {
        if (groups < 0) {
            throw new IllegalArgumentException(
                "groups cannot be negative (current: " + groups + ")"
            );
        }
        if (perGroup <= 0) {
            throw new IllegalArgumentException(
                "perGroup must be positive (current: " + perGroup + ")"
            );
        }
        if (aggregationKeys < 0) {
            throw new IllegalArgumentException(
                "aggregationKeys cannot be negative (current: " + aggregationKeys + ")"
            );
        }
    }

    /**
     * 예상 전체 키 수로부터 설정 생성.
     *
     * <p>그룹당 기본 용량을 가정하여 그룹 수를 추정합니다.</p>
     *
     * @param fullKeys 예상 전체 키 수 (0 이상)
     * @return 새 Capacity 인스턴스
     * @throws IllegalArgumentException fullKeys가 음수인 경우
     */
    public static Capacity ofFullKeys(int fullKeys) {
        if (fullKeys < 0) {
            throw new IllegalArgumentException(
                "fullKeys cannot be negative (current: " + fullKeys + ")"
            );
        }
        int groups = (fullKeys + DEFAULT_PER_GROUP - 1) / DEFAULT_PER_GROUP;
        return new Capacity(groups, DEFAULT_PER_GROUP, fullKeys);
    }

    /**
     * 기본 저장소(전체 키 → 항목)에 확보할 크기.
     *
     * @return groups × perGroup 과 aggregationKeys 중 큰 값 (상한 2^30)
     */
    public int fullKeys() {
        long product = (long) groups * perGroup;
        return (int) Math.min(MAX_HINT, Math.max(product, aggregationKeys));
    }

    /**
     * groups만 변경한 새 인스턴스 생성.
     *
     * @param groups 새로운 그룹 수
     * @return 새 Capacity 인스턴스
     */
    public Capacity withGroups(int groups) {
        return new Capacity(groups, this.perGroup, this.aggregationKeys);
    }

    /**
     * perGroup만 변경한 새 인스턴스 생성.
     *
     * @param perGroup 새로운 그룹당 초기 용량
     * @return 새 Capacity 인스턴스
     */
    public Capacity withPerGroup(int perGroup) {
        return new Capacity(this.groups, perGroup, this.aggregationKeys);
    }

    /**
     * aggregationKeys만 변경한 새 인스턴스 생성.
     *
     * @param aggregationKeys 새로운 집계 키 수
     * @return 새 Capacity 인스턴스
     */
    public Capacity withAggregationKeys(int aggregationKeys) {
        return new Capacity(this.groups, this.perGroup, aggregationKeys);
    }
}
