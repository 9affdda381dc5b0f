package com.ryuqq.wordbatch.adapter.file.prompt;

import com.ryuqq.wordbatch.core.exception.ConfigurationException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 프롬프트 템플릿 파일 로더.
 *
 * <p>템플릿은 {@code {word}}, {@code {pos}} 자리표시자를 가진 UTF-8 텍스트입니다.</p>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public class PromptTemplateLoader {

    private final Path location;

    public PromptTemplateLoader(Path location) {
        if (location == null) {
            throw new IllegalArgumentException("location cannot be null");
        }
        this.location = location;
    }

    /**
     * @return 템플릿 원문
     * @throws ConfigurationException 파일이 없거나 읽을 수 없거나 {word} 자리표시자가 없는 경우
     */
    public String load() {
        if (!Files.isRegularFile(location)) {
            throw new ConfigurationException("Prompt template not found: " + location);
        }
        String template;
        try {
            template = Files.readString(location, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read prompt template: " + location, e);
        }
        if (!template.contains("{word}")) {
            throw new ConfigurationException("Prompt template has no {word} placeholder: " + location);
        }
        return template;
    }
}
