/**
 * Service Provider Interface (SPI) 패키지.
 *
 * <p>Core가 정의하고 어댑터 모듈이 구현하는 인터페이스입니다.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.wordbatch.core.spi.CheckpointStore} - 단계별 진행 기록 (wordbatch-adapter-file, wordbatch-testkit)</li>
 *   <li>{@link com.ryuqq.wordbatch.core.spi.OutputValidator} - 산출물 검증 (wordbatch-adapter-file)</li>
 *   <li>{@link com.ryuqq.wordbatch.core.spi.DictionaryClient} - 사전 조회 (wordbatch-adapter-client)</li>
 *   <li>{@link com.ryuqq.wordbatch.core.spi.GenerationClient} - 정의/예문 생성 (wordbatch-adapter-client)</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core는 인터페이스만 정의, 어댑터가 구현</li>
 *   <li><strong>Dependency Inversion:</strong> Core는 파일 시스템이나 네트워크에 의존하지 않음</li>
 * </ul>
 *
 * @since 1.0.0
 * @author WordBatch Team
 */
package com.ryuqq.wordbatch.core.spi;
