/**
 * 파이프라인 단계 포트 (보강, 생성).
 *
 * <p>구현체는 wordbatch-adapter-runner 모듈에 있습니다:</p>
 * <ul>
 *   <li>{@code DictionaryEnrichmentStage}</li>
 *   <li>{@code ExampleGenerationStage}</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.wordbatch.application.stage;
