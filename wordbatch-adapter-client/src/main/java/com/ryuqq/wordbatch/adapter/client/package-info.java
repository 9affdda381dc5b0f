/**
 * 외부 협력자 어댑터.
 *
 * <ul>
 *   <li>{@code dictionary} - Free Dictionary HTTP 클라이언트 ({@code java.net.http})</li>
 *   <li>{@code generation} - 외부 LLM 명령 호출 및 응답 파싱</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.wordbatch.adapter.client;
