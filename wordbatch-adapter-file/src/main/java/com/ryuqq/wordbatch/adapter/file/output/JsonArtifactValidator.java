package com.ryuqq.wordbatch.adapter.file.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.wordbatch.core.spi.ArtifactInspection;
import com.ryuqq.wordbatch.core.spi.OutputValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * JSON 배열 산출물 검증기.
 *
 * <p>산출물 하나의 항목 수는 최상위 JSON 배열의 원소 수입니다.
 * 배열이 아니거나 파싱할 수 없는 파일은 (false, 0)으로 취급합니다.</p>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public class JsonArtifactValidator implements OutputValidator {

    private static final Logger log = LoggerFactory.getLogger(JsonArtifactValidator.class);

    private final ObjectMapper mapper;

    public JsonArtifactValidator(ObjectMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.mapper = mapper;
    }

    @Override
    public boolean hasValidOutput(Path location, int expectedCount) {
        double threshold = expectedCount * SKIP_THRESHOLD_RATIO;
        for (Path artifact : FinalOutputRepository.findArtifacts(location)) {
            int count;
            try {
                count = countItems(artifact);
            } catch (IOException e) {
                log.warn("Error reading {}: {}", artifact, e.getMessage());
                continue;
            }
            if (count >= threshold) {
                log.debug("Found valid output: {} with {} words", artifact, count);
                return true;
            }
            log.debug("Output file {} has only {} words (expected {})", artifact, count, expectedCount);
        }
        return false;
    }

    @Override
    public ArtifactInspection inspect(Path artifact, int minItems) {
        try {
            int count = countItems(artifact);
            return new ArtifactInspection(count >= minItems, count);
        } catch (IOException e) {
            log.debug("Unreadable artifact {}: {}", artifact, e.getMessage());
            return ArtifactInspection.unreadable();
        }
    }

    private int countItems(Path artifact) throws IOException {
        JsonNode root = mapper.readTree(artifact.toFile());
        if (root == null || !root.isArray()) {
            throw new IOException("not a JSON array");
        }
        return root.size();
    }
}
