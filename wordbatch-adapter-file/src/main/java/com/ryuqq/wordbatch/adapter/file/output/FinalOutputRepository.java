package com.ryuqq.wordbatch.adapter.file.output;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.wordbatch.adapter.file.json.AtomicFiles;
import com.ryuqq.wordbatch.core.model.FinalEntry;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 생성 산출물 파일 저장소.
 *
 * <p>산출물은 작업 폴더의 {@code final_output_yyyyMMdd_HHmmss.json} 파일이며
 * {@link FinalEntry} JSON 배열을 담습니다. 파일 이름의 시각은 사전순 정렬이 곧 시간순이 되도록
 * 고정 폭으로 기록합니다.</p>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public class FinalOutputRepository {

    public static final String PREFIX = "final_output_";
    public static final String SUFFIX = ".json";
    public static final String GLOB = PREFIX + "*" + SUFFIX;

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final TypeReference<List<FinalEntry>> ENTRY_LIST = new TypeReference<>() {
    };

    private final Path workDir;
    private final ObjectMapper mapper;
    private final Clock clock;

    public FinalOutputRepository(Path workDir, ObjectMapper mapper, Clock clock) {
        if (workDir == null) {
            throw new IllegalArgumentException("workDir cannot be null");
        }
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.workDir = workDir;
        this.mapper = mapper;
        this.clock = clock;
    }

    /**
     * 현재 시각으로 새 산출물 경로 생성 (파일은 만들지 않음).
     *
     * @return data/final_output_{yyyyMMdd_HHmmss}.json
     */
    public Path newArtifactPath() {
        return workDir.resolve(PREFIX + LocalDateTime.now(clock).format(STAMP) + SUFFIX);
    }

    /**
     * 작업 폴더의 산출물 목록 (이름순).
     *
     * @return 산출물 경로 목록
     */
    public List<Path> findArtifacts() {
        return findArtifacts(workDir);
    }

    /**
     * 폴더 안의 산출물 목록 (이름순). 폴더가 없으면 빈 목록.
     *
     * @param dir 폴더
     * @return 산출물 경로 목록
     */
    public static List<Path> findArtifacts(Path dir) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        List<Path> artifacts = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, GLOB)) {
            for (Path path : stream) {
                if (Files.isRegularFile(path)) {
                    artifacts.add(path);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list artifacts in " + dir, e);
        }
        artifacts.sort(Comparator.comparing(path -> path.getFileName().toString()));
        return artifacts;
    }

    /**
     * 작업 폴더의 가장 최근 산출물.
     *
     * @return 최신 산출물, 없으면 empty
     */
    public Optional<Path> latestArtifact() {
        List<Path> artifacts = findArtifacts();
        return artifacts.isEmpty() ? Optional.empty() : Optional.of(artifacts.get(artifacts.size() - 1));
    }

    /**
     * 산출물 읽기.
     *
     * @param artifact 산출물 파일
     * @return 항목 목록 (파일이 없으면 빈 목록)
     * @throws UncheckedIOException 읽기 또는 파싱 실패 시
     */
    public List<FinalEntry> load(Path artifact) {
        if (!Files.exists(artifact)) {
            return List.of();
        }
        try {
            List<FinalEntry> entries = mapper.readValue(artifact.toFile(), ENTRY_LIST);
            return entries == null ? List.of() : entries;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read artifact " + artifact, e);
        }
    }

    /**
     * 산출물 전체 교체.
     *
     * @param artifact 산출물 파일
     * @param entries 항목 (순서 유지)
     * @throws UncheckedIOException 쓰기 실패 시
     */
    public void save(Path artifact, Collection<FinalEntry> entries) {
        try {
            AtomicFiles.write(artifact, mapper.writeValueAsBytes(new ArrayList<>(entries)));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write artifact " + artifact, e);
        }
    }

    public Path getWorkDir() {
        return workDir;
    }
}
