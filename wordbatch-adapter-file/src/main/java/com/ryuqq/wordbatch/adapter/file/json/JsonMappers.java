package com.ryuqq.wordbatch.adapter.file.json;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * 파이프라인 공용 ObjectMapper 팩토리.
 *
 * <p>모든 JSON 파일은 들여쓰기된 UTF-8로 기록되며, 알 수 없는 필드는 무시합니다.</p>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public final class JsonMappers {

    private JsonMappers() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static ObjectMapper create() {
        return new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}
