package com.ryuqq.wordbatch.core.spi;

import java.nio.file.Path;

/**
 * 산출물 검증 SPI.
 *
 * <p>두 가지 임계값을 의도적으로 구분합니다:</p>
 * <ul>
 *   <li>배치 단위 건너뛰기 판단: 기대 항목 수의 50% 이상 ({@link #hasValidOutput})</li>
 *   <li>파일 단위 보존 판단: 1개 이상 ({@link #inspect(Path)})</li>
 * </ul>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public interface OutputValidator {

    /**
     * 배치 건너뛰기 임계 비율.
     */
    double SKIP_THRESHOLD_RATIO = 0.5;

    /**
     * 위치에 재사용 가능한 이전 산출물이 있는지 확인.
     *
     * <p>산출물별 파싱 오류는 로그만 남기고 다음 산출물을 검사합니다.</p>
     *
     * @param location 파티션 출력 폴더
     * @param expectedCount 파티션의 기대 항목 수
     * @return 항목 수가 expectedCount * 0.5 이상인 산출물이 하나라도 있으면 true
     */
    boolean hasValidOutput(Path location, int expectedCount);

    /**
     * 산출물 파일 하나를 파싱하고 항목 수를 셈.
     *
     * @param artifact 산출물 파일
     * @param minItems 최소 항목 수
     * @return 검사 결과 (실패 시 (false, 0))
     */
    ArtifactInspection inspect(Path artifact, int minItems);

    /**
     * minItems=1 로 검사.
     *
     * @param artifact 산출물 파일
     * @return 검사 결과
     */
    default ArtifactInspection inspect(Path artifact) {
        return inspect(artifact, 1);
    }
}
