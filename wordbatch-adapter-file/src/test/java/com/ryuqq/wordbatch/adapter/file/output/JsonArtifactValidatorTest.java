package com.ryuqq.wordbatch.adapter.file.output;

import com.ryuqq.wordbatch.adapter.file.json.JsonMappers;
import com.ryuqq.wordbatch.core.spi.ArtifactInspection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * JsonArtifactValidator 테스트.
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
class JsonArtifactValidatorTest {

    @TempDir
    Path dir;

    private JsonArtifactValidator validator;

    @BeforeEach
    void setUp() {
        validator = new JsonArtifactValidator(JsonMappers.create());
    }

    @Test
    void hasValidOutput_절반_이상이면_true() throws Exception {
        // given: 기대 80개, 산출물 40개 (정확히 50%)
        writeArtifact("final_output_20260101_000000.json", 40);

        // when & then
        assertThat(validator.hasValidOutput(dir, 80)).isTrue();
    }

    @Test
    void hasValidOutput_절반_미만이면_false() throws Exception {
        writeArtifact("final_output_20260101_000000.json", 39);

        assertThat(validator.hasValidOutput(dir, 80)).isFalse();
    }

    @Test
    void hasValidOutput_손상된_산출물은_건너뛰고_다음을_검사() throws Exception {
        // given
        Files.writeString(dir.resolve("final_output_20260101_000000.json"), "{ broken");
        writeArtifact("final_output_20260102_000000.json", 60);

        // when & then
        assertThat(validator.hasValidOutput(dir, 100)).isTrue();
    }

    @Test
    void hasValidOutput_폴더가_없으면_false() {
        assertThat(validator.hasValidOutput(dir.resolve("101-200"), 10)).isFalse();
    }

    @Test
    void hasValidOutput_빈_폴더면_false() throws Exception {
        // given
        Path partitionDir = Files.createDirectories(dir.resolve("101-200"));

        // when & then
        assertThat(validator.hasValidOutput(partitionDir, 10)).isFalse();
    }

    @Test
    void hasValidOutput_파싱_불가_산출물만_있으면_false() throws Exception {
        // given
        Files.writeString(dir.resolve("final_output_20260101_000000.json"), "{ broken");
        Files.writeString(dir.resolve("final_output_20260102_000000.json"), "{\"word\": \"x\"}");

        // when & then
        assertThat(validator.hasValidOutput(dir, 10)).isFalse();
    }

    @Test
    void inspect_항목_수와_유효성() throws Exception {
        Path one = writeArtifact("final_output_20260101_000000.json", 1);
        Path empty = writeArtifact("final_output_20260102_000000.json", 0);

        assertThat(validator.inspect(one)).isEqualTo(new ArtifactInspection(true, 1));
        assertThat(validator.inspect(empty)).isEqualTo(new ArtifactInspection(false, 0));
    }

    @Test
    void inspect_배열이_아니거나_파싱_실패면_unreadable() throws Exception {
        Path object = dir.resolve("final_output_20260101_000000.json");
        Files.writeString(object, "{\"word\": \"x\"}");
        Path garbage = dir.resolve("final_output_20260102_000000.json");
        Files.writeString(garbage, "not json at all");

        assertThat(validator.inspect(object)).isEqualTo(ArtifactInspection.unreadable());
        assertThat(validator.inspect(garbage)).isEqualTo(ArtifactInspection.unreadable());
        assertThat(validator.inspect(dir.resolve("missing.json"))).isEqualTo(ArtifactInspection.unreadable());
    }

    private Path writeArtifact(String name, int items) throws Exception {
        StringBuilder json = new StringBuilder("[");
        for (int i = 0; i < items; i++) {
            if (i > 0) {
                json.append(',');
            }
            json.append("{\"word\":\"w").append(i).append("\"}");
        }
        json.append(']');
        Path path = dir.resolve(name);
        Files.writeString(path, json.toString());
        return path;
    }
}
