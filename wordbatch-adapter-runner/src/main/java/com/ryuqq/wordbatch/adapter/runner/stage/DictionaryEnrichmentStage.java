package com.ryuqq.wordbatch.adapter.runner.stage;

import com.ryuqq.wordbatch.adapter.file.enrichment.EnrichedWordRepository;
import com.ryuqq.wordbatch.adapter.runner.EnrichmentConfig;
import com.ryuqq.wordbatch.application.stage.EnrichmentStage;
import com.ryuqq.wordbatch.core.exception.DictionaryLookupException;
import com.ryuqq.wordbatch.core.exception.WordBatchException;
import com.ryuqq.wordbatch.core.exception.WordBatchInterruptedException;
import com.ryuqq.wordbatch.core.exception.WordNotFoundException;
import com.ryuqq.wordbatch.core.model.EnrichedWord;
import com.ryuqq.wordbatch.core.model.RowRange;
import com.ryuqq.wordbatch.core.model.VocabularyItem;
import com.ryuqq.wordbatch.core.spi.CheckpointStore;
import com.ryuqq.wordbatch.core.spi.DictionaryClient;
import com.ryuqq.wordbatch.core.time.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * 사전 조회 기반 보강 단계.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * run(range, resume)
 *   ↓
 * 1. 어휘에서 구간 추출 (dry-run이면 앞 10개)
 * 2. resume: 이전 보강 결과 로드 + 체크포인트에 완료된 단어 제외
 *    fresh: 체크포인트 초기화
 * 3. 고정 크기 풀(workers)에서 단어별 조회
 *      lookup → 결과 맵 기록 → markProcessed → requestDelay 대기
 * 4. 구간 순서대로 결과 정렬 → enriched_words.json 저장
 * </pre>
 *
 * <p>NotFound와 조회 실패는 빈 보강 결과(bare)로 대체됩니다. 그 밖의 예외는 단계를 중단시킵니다.</p>
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
public class DictionaryEnrichmentStage implements EnrichmentStage {

    private static final Logger log = LoggerFactory.getLogger(DictionaryEnrichmentStage.class);

    private final List<VocabularyItem> vocabulary;
    private final DictionaryClient dictionaryClient;
    private final CheckpointStore checkpoint;
    private final EnrichedWordRepository repository;
    private final EnrichmentConfig config;
    private final Sleeper sleeper;

    public DictionaryEnrichmentStage(List<VocabularyItem> vocabulary, DictionaryClient dictionaryClient,
                                     CheckpointStore checkpoint, EnrichedWordRepository repository,
                                     EnrichmentConfig config, Sleeper sleeper) {
        if (vocabulary == null) {
            throw new IllegalArgumentException("vocabulary cannot be null");
        }
        if (dictionaryClient == null) {
            throw new IllegalArgumentException("dictionaryClient cannot be null");
        }
        if (checkpoint == null) {
            throw new IllegalArgumentException("checkpoint cannot be null");
        }
        if (repository == null) {
            throw new IllegalArgumentException("repository cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.vocabulary = List.copyOf(vocabulary);
        this.dictionaryClient = dictionaryClient;
        this.checkpoint = checkpoint;
        this.repository = repository;
        this.config = config;
        this.sleeper = sleeper;
    }

    @Override
    public List<EnrichedWord> run(RowRange range, boolean resume) {
        log.info("Enriching words with dictionary data (rows {})...", range);

        List<VocabularyItem> slice = slice(range);
        if (config.dryRun() && slice.size() > EnrichmentConfig.DRY_RUN_LIMIT) {
            slice = slice.subList(0, EnrichmentConfig.DRY_RUN_LIMIT);
            log.info("Dry run: processing {} words", slice.size());
        }

        Map<String, EnrichedWord> results = new ConcurrentHashMap<>();
        List<VocabularyItem> pending = new ArrayList<>();
        if (resume) {
            for (EnrichedWord previous : repository.load()) {
                results.put(previous.word(), previous);
            }
            for (VocabularyItem item : slice) {
                if (!checkpoint.isProcessed(item.word())) {
                    pending.add(item);
                }
            }
        } else {
            checkpoint.reset();
            pending.addAll(slice);
        }

        if (pending.isEmpty()) {
            log.info("No words to process (all already completed)");
        } else {
            log.info("Processing {} words with {} workers...", pending.size(), config.workers());
            enrichAll(pending, results);
        }

        List<EnrichedWord> ordered = new ArrayList<>();
        for (VocabularyItem item : slice) {
            EnrichedWord enriched = results.get(item.word());
            if (enriched != null) {
                ordered.add(enriched);
            }
        }
        repository.save(ordered);
        log.info("Saved {} enriched words to: {}", ordered.size(), repository.getLocation());

        long withPhonetic = ordered.stream().filter(EnrichedWord::hasPhonetic).count();
        long withPartsOfSpeech = ordered.stream().filter(EnrichedWord::hasPartsOfSpeech).count();
        log.info("Words with phonetic: {}/{}", withPhonetic, ordered.size());
        log.info("Words with POS: {}/{}", withPartsOfSpeech, ordered.size());
        return ordered;
    }

    private List<VocabularyItem> slice(RowRange range) {
        int from = Math.min(range.start(), vocabulary.size());
        int to = Math.min(range.end(), vocabulary.size());
        return vocabulary.subList(from, to);
    }

    private void enrichAll(List<VocabularyItem> pending, Map<String, EnrichedWord> results) {
        ExecutorService pool = Executors.newFixedThreadPool(config.workers());
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (VocabularyItem item : pending) {
                futures.add(pool.submit(() -> enrichOne(item, results)));
            }
            for (Future<?> future : futures) {
                await(future);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    private void enrichOne(VocabularyItem item, Map<String, EnrichedWord> results) {
        String word = item.word();
        results.put(word, lookup(word));
        checkpoint.markProcessed(word, item.rowIndex());
        sleeper.sleep(config.requestDelay());
    }

    private EnrichedWord lookup(String word) {
        try {
            return dictionaryClient.lookup(word).enrich(word);
        } catch (WordNotFoundException e) {
            log.debug("Not in dictionary: {}", word);
            return EnrichedWord.bare(word);
        } catch (DictionaryLookupException e) {
            log.warn("Lookup failed for '{}', continuing without enrichment: {}", word, e.getMessage());
            return EnrichedWord.bare(word);
        }
    }

    private static void await(Future<?> future) {
        try {
            future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WordBatchInterruptedException("Enrichment interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new WordBatchException("Enrichment worker failed", cause);
        }
    }
}
