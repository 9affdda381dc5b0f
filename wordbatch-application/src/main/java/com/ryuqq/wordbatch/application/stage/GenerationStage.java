package com.ryuqq.wordbatch.application.stage;

/**
 * 생성 단계: 보강된 단어마다 정의와 예문을 생성해 최종 산출물에 누적합니다.
 *
 * <p><strong>실패 처리:</strong></p>
 * <ul>
 *   <li>응답 파싱 실패: 해당 단어만 실패 기록, 연속 실패 카운트 초기화</li>
 *   <li>생성 호출 실패: 해당 단어 실패 기록, 연속 실패 카운트 증가</li>
 *   <li>연속 실패 임계값 도달: {@link com.ryuqq.wordbatch.core.exception.SystemicFailureException}
 *       (마지막 주기 저장 이후 결과는 버림)</li>
 * </ul>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public interface GenerationStage {

    /**
     * 생성 실행.
     *
     * @param resume true면 생성 체크포인트에 완료로 기록된 단어를 건너뛰고 최신 산출물에 이어 씀
     * @return 실행 결과
     * @throws com.ryuqq.wordbatch.core.exception.SystemicFailureException 연속 실패 임계값 도달 시
     */
    GenerationReport run(boolean resume);
}
