package com.ryuqq.wordbatch.adapter.client.generation;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PromptTemplateTest {

    @Test
    void render_품사_목록_연결() {
        assertThat(PromptTemplate.render("{word} ({pos}) - {word}", "serene", List.of("adjective", "noun")))
            .isEqualTo("serene (adjective, noun) - serene");
    }

    @Test
    void render_품사가_없으면_unknown() {
        assertThat(PromptTemplate.render("{word}:{pos}", "qwzx", List.of()))
            .isEqualTo("qwzx:unknown");
    }
}
