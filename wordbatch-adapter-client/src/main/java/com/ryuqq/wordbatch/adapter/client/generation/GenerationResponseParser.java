package com.ryuqq.wordbatch.adapter.client.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.wordbatch.core.model.ExampleSentence;
import com.ryuqq.wordbatch.core.model.GenerationResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 생성 명령 출력 파서.
 *
 * <p><strong>처리 순서:</strong></p>
 * <ol>
 *   <li>stdout 전체를 JSON으로 읽음 (실패 시 ParseError)</li>
 *   <li>{@code result} 또는 {@code content} 봉투가 있으면 그 값을 내용으로 사용</li>
 *   <li>내용이 객체면 그대로, 문자열이면 다음 순서로 JSON 객체를 찾음:
 *       전체 파싱, {@code ```json} 코드 블록, 첫 {@code {} 부터 마지막 {@code }} 까지</li>
 *   <li>필수 필드 {@code selected_pos}, {@code definition}, {@code examples} 확인 (누락 시 SchemaError)</li>
 * </ol>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public class GenerationResponseParser {

    static final List<String> REQUIRED_FIELDS = List.of("selected_pos", "definition", "examples");

    private static final Pattern FENCED_BLOCK = Pattern.compile("```(?:json)?\\s*(\\{[\\s\\S]*?\\})\\s*```");
    private static final Pattern OBJECT_SPAN = Pattern.compile("\\{[\\s\\S]*\\}");
    private static final int PREVIEW_LENGTH = 500;

    private final ObjectMapper mapper;

    public GenerationResponseParser(ObjectMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.mapper = mapper;
    }

    /**
     * 명령 출력 파싱.
     *
     * @param stdout 생성 명령의 표준 출력
     * @return 파싱 결과
     */
    public GenerationResponse parse(String stdout) {
        JsonNode envelope;
        try {
            envelope = mapper.readTree(stdout);
        } catch (JsonProcessingException e) {
            return new GenerationResponse.ParseError("Failed to parse response as JSON: " + e.getOriginalMessage());
        }
        if (envelope == null || envelope.isMissingNode()) {
            return new GenerationResponse.ParseError("Empty response");
        }

        JsonNode content = envelope;
        if (envelope.isObject() && envelope.has("result")) {
            content = envelope.get("result");
        } else if (envelope.isObject() && envelope.has("content")) {
            content = envelope.get("content");
        }

        Optional<JsonNode> payload = extractObject(content);
        if (payload.isEmpty()) {
            return new GenerationResponse.ParseError(
                "Could not extract JSON from response: " + preview(content.isTextual() ? content.asText() : content.toString())
            );
        }
        return toResult(payload.get());
    }

    private Optional<JsonNode> extractObject(JsonNode content) {
        if (content.isObject()) {
            return Optional.of(content);
        }
        if (!content.isTextual()) {
            return Optional.empty();
        }
        String text = content.asText();

        Optional<JsonNode> direct = readObject(text);
        if (direct.isPresent()) {
            return direct;
        }
        Matcher fenced = FENCED_BLOCK.matcher(text);
        if (fenced.find()) {
            Optional<JsonNode> block = readObject(fenced.group(1));
            if (block.isPresent()) {
                return block;
            }
        }
        Matcher span = OBJECT_SPAN.matcher(text);
        if (span.find()) {
            return readObject(span.group());
        }
        return Optional.empty();
    }

    private Optional<JsonNode> readObject(String text) {
        try {
            JsonNode node = mapper.readTree(text);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    private static GenerationResponse toResult(JsonNode data) {
        for (String field : REQUIRED_FIELDS) {
            if (!data.has(field)) {
                return new GenerationResponse.SchemaError(field);
            }
        }
        JsonNode examplesNode = data.get("examples");
        if (!examplesNode.isArray()) {
            return new GenerationResponse.SchemaError("examples");
        }

        List<ExampleSentence> examples = new ArrayList<>();
        for (JsonNode example : examplesNode) {
            JsonNode displayOrder = example.path("display_order");
            examples.add(new ExampleSentence(
                example.path("sentence").asText(""),
                example.path("style").asText(""),
                example.path("translation").asText(""),
                example.path("translated_word").asText(""),
                displayOrder.isInt() ? displayOrder.asInt() : null
            ));
        }
        return new GenerationResponse.Parsed(new GenerationResult(
            data.get("selected_pos").asText(""),
            data.get("definition").asText(""),
            examples
        ));
    }

    private static String preview(String text) {
        return text.length() <= PREVIEW_LENGTH ? text : text.substring(0, PREVIEW_LENGTH) + "...";
    }
}
