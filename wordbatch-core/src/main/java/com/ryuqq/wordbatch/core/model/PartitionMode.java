package com.ryuqq.wordbatch.core.model;

/**
 * 파티션 분할 방식.
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public enum PartitionMode {

    /**
     * 빈도 구간 분할.
     *
     * <p>rangeStart/rangeEnd는 빈도 값이며 양 끝 포함입니다 (예: 101-200).
     * 실제 처리 대상은 해당 빈도 구간에 속하는 행들의 최소~최대 행 번호 구간입니다.</p>
     */
    FREQUENCY,

    /**
     * 행 번호 분할.
     *
     * <p>rangeStart/rangeEnd는 0 기반 행 번호이며 rangeEnd는 제외입니다.
     * 전체 항목 수로 잘립니다.</p>
     */
    ROW
}
