package com.ryuqq.wordbatch.core.spi;

/**
 * 산출물 파일 하나의 검사 결과.
 *
 * @param valid 파싱 성공 및 최소 항목 수 충족 여부
 * @param itemCount 항목 수 (파싱 실패 시 0)
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public record ArtifactInspection(boolean valid, int itemCount) {

    private static final ArtifactInspection UNREADABLE = new ArtifactInspection(false, 0);

    public static ArtifactInspection unreadable() {
        return UNREADABLE;
    }
}
