/**
 * 도메인 모델 패키지.
 *
 * <p>어휘 항목, 보강 결과, 최종 산출물 항목, 체크포인트 기록, 파티션 등
 * 파이프라인 전반에서 공유하는 값 타입을 정의합니다.</p>
 *
 * <h2>주요 타입</h2>
 * <ul>
 *   <li>{@link com.ryuqq.wordbatch.core.model.VocabularyItem} - 선택된 어휘 목록의 한 행</li>
 *   <li>{@link com.ryuqq.wordbatch.core.model.CheckpointRecord} - 단계별 진행 기록</li>
 *   <li>{@link com.ryuqq.wordbatch.core.model.Partition} - 배치 단위 구간</li>
 *   <li>{@link com.ryuqq.wordbatch.core.model.FinalEntry} - 최종 산출물 항목 (word 기준 덮어쓰기)</li>
 * </ul>
 *
 * <p>JSON 필드 이름은 기존에 저장된 산출물과 호환되도록 snake_case를 유지합니다
 * (pos, selected_pos, translated_word, processed_words 등).</p>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
package com.ryuqq.wordbatch.core.model;
