package com.ryuqq.wordbatch.adapter.client.generation;

import com.ryuqq.wordbatch.core.exception.GenerationException;
import com.ryuqq.wordbatch.core.exception.GenerationTimeoutException;
import com.ryuqq.wordbatch.core.exception.WordBatchInterruptedException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * {@link ProcessBuilder} 기반 CommandExecutor.
 *
 * <p>stdout/stderr 는 파이프가 가득 차서 프로세스가 멈추지 않도록 별도 스레드에서 읽습니다.
 * 시간 초과 시 프로세스를 강제 종료합니다.</p>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public class ProcessCommandExecutor implements CommandExecutor {

    @Override
    public CommandResult execute(List<String> command, Duration timeout) {
        Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException e) {
            throw new GenerationException("Failed to start '" + command.get(0) + "': " + e.getMessage(), e);
        }
        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()));

        try {
            process.getOutputStream().close();
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new GenerationTimeoutException("Generation timed out after " + timeout.toSeconds() + "s");
            }
            return new CommandResult(process.exitValue(), stdout.get(), stderr.get());
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new WordBatchInterruptedException("Interrupted while waiting for '" + command.get(0) + "'", e);
        } catch (ExecutionException | IOException e) {
            throw new GenerationException("Failed to read output of '" + command.get(0) + "'", e);
        }
    }

    private static String drain(InputStream stream) {
        try (InputStream in = stream) {
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            in.transferTo(buffer);
            return buffer.toString(StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
