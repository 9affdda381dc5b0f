package com.ryuqq.wordbatch.adapter.client.generation;

import com.ryuqq.wordbatch.core.exception.GenerationException;
import com.ryuqq.wordbatch.core.exception.GenerationTimeoutException;
import com.ryuqq.wordbatch.core.exception.MalformedResponseException;
import com.ryuqq.wordbatch.core.model.GenerationResult;
import com.ryuqq.wordbatch.core.protection.BackoffCalculator;
import com.ryuqq.wordbatch.core.spi.GenerationClient;
import com.ryuqq.wordbatch.core.time.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * 외부 LLM 명령을 호출하는 {@link GenerationClient}.
 *
 * <p><strong>오류 매핑:</strong></p>
 * <ul>
 *   <li>시간 초과: maxTimeoutAttempts까지 backoff 재시도, 소진 시 {@link GenerationTimeoutException}</li>
 *   <li>0이 아닌 종료 코드: 재시도 없이 {@link GenerationException} (stderr 포함)</li>
 *   <li>ParseError / SchemaError: {@link MalformedResponseException}</li>
 * </ul>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public class CommandLineGenerationClient implements GenerationClient {

    private static final Logger log = LoggerFactory.getLogger(CommandLineGenerationClient.class);

    private final CommandExecutor executor;
    private final GenerationResponseParser parser;
    private final GenerationConfig config;
    private final BackoffCalculator backoff;
    private final Sleeper sleeper;

    public CommandLineGenerationClient(CommandExecutor executor, GenerationResponseParser parser,
                                       GenerationConfig config, Sleeper sleeper) {
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        if (parser == null) {
            throw new IllegalArgumentException("parser cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.executor = executor;
        this.parser = parser;
        this.config = config;
        this.sleeper = sleeper;
        this.backoff = new BackoffCalculator(
            config.backoffMultiplierMs(), config.minBackoffMs(), config.maxBackoffMs(), 0.0
        );
    }

    @Override
    public GenerationResult generate(String word, List<String> partsOfSpeech, String promptTemplate) {
        String prompt = PromptTemplate.render(promptTemplate, word, partsOfSpeech);
        CommandResult result = executeWithTimeoutRetry(config.command(prompt));

        if (!result.isSuccess()) {
            throw new GenerationException(
                "Generation command error (exit " + result.exitCode() + "): " + result.stderr().strip()
            );
        }

        GenerationResponse response = parser.parse(result.stdout());
        if (response instanceof GenerationResponse.Parsed parsed) {
            return parsed.result();
        }
        if (response instanceof GenerationResponse.SchemaError schemaError) {
            throw new MalformedResponseException("Response missing '" + schemaError.missingField() + "' field");
        }
        throw new MalformedResponseException(((GenerationResponse.ParseError) response).message());
    }

    private CommandResult executeWithTimeoutRetry(List<String> command) {
        for (int attempt = 1; ; attempt++) {
            try {
                return executor.execute(command, config.timeout());
            } catch (GenerationTimeoutException e) {
                if (attempt >= config.maxTimeoutAttempts()) {
                    throw e;
                }
                Duration delay = backoff.calculate(attempt);
                log.warn("Generation timed out (attempt {}/{}), retrying in {}s",
                    attempt, config.maxTimeoutAttempts(), delay.toSeconds());
                sleeper.sleep(delay);
            }
        }
    }
}
