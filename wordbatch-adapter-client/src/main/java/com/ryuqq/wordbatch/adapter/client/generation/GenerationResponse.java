package com.ryuqq.wordbatch.adapter.client.generation;

import com.ryuqq.wordbatch.core.model.GenerationResult;

/**
 * 생성 명령 출력의 파싱 결과.
 *
 * <ul>
 *   <li>{@link Parsed}: 필수 필드를 갖춘 결과</li>
 *   <li>{@link ParseError}: JSON을 찾거나 읽을 수 없음</li>
 *   <li>{@link SchemaError}: JSON은 읽었으나 필수 필드 누락</li>
 * </ul>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public sealed interface GenerationResponse
    permits GenerationResponse.Parsed, GenerationResponse.ParseError, GenerationResponse.SchemaError {

    record Parsed(GenerationResult result) implements GenerationResponse {
        public Parsed {
            if (result == null) {
                throw new IllegalArgumentException("result cannot be null");
            }
        }
    }

    record ParseError(String message) implements GenerationResponse {
    }

    record SchemaError(String missingField) implements GenerationResponse {
    }
}
