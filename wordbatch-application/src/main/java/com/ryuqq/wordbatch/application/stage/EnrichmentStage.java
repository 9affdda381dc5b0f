package com.ryuqq.wordbatch.application.stage;

import com.ryuqq.wordbatch.core.model.EnrichedWord;
import com.ryuqq.wordbatch.core.model.RowRange;

import java.util.List;

/**
 * 보강 단계: 어휘 구간의 각 단어에 발음과 품사를 붙입니다.
 *
 * <p>개별 단어의 조회 실패는 빈 보강 결과로 대체되며 단계를 중단시키지 않습니다.
 * 결과는 원래 순서대로 중간 파일에 기록됩니다.</p>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public interface EnrichmentStage {

    /**
     * 구간 보강 실행.
     *
     * @param range 처리할 행 구간
     * @param resume true면 보강 체크포인트에 완료로 기록된 단어를 건너뜀
     * @return 원래 순서대로 정렬된 보강 결과 (재개 시 이전 결과 포함)
     */
    List<EnrichedWord> run(RowRange range, boolean resume);
}
