/**
 * 파일 시스템 어댑터.
 *
 * <ul>
 *   <li>{@code checkpoint} - JSON 체크포인트 저장소 (advisory lock)</li>
 *   <li>{@code output} - 생성 산출물 저장/검증</li>
 *   <li>{@code vocabulary} - 어휘 선택 및 로딩 (CSV, txt)</li>
 *   <li>{@code enrichment} - 보강 중간 결과</li>
 *   <li>{@code prompt} - 프롬프트 템플릿</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.wordbatch.adapter.file;
