package com.whereq.helios.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.helios.config.HeliosProperties;
import com.whereq.helios.dto.CacheLookupRequest;
import com.whereq.helios.dto.CacheLookupResult;
import com.whereq.helios.dto.CacheStoreRequest;
import com.whereq.helios.model.CacheEntry;
import com.whereq.helios.model.CacheLevel;
import com.whereq.helios.store.SharedStateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;

/**
 * L3: approximate matching by cosine similarity of input embeddings within a task type.
 * Re-storing the same normalized input replaces the previous entry.
 */
@Slf4j
@Component
public class SemanticCacheTier extends AbstractStoreCacheTier {

    private final HeliosProperties.SemanticTierConfig config;

    private final EmbeddingProvider embeddingProvider;

    public SemanticCacheTier(SharedStateStore store, ObjectMapper objectMapper, Clock clock,
                             HeliosProperties properties, EmbeddingProvider embeddingProvider) {
        super(store, objectMapper, clock);
        this.config = properties.getCache().getL3();
        this.embeddingProvider = embeddingProvider;
    }

    @Override
    public CacheLevel level() {
        return CacheLevel.L3_SEMANTIC;
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled();
    }

    @Override
    protected Duration ttl() {
        return config.getTtl();
    }

    @Override
    public boolean eligibleForLookup(CacheLookupRequest request) {
        return true;
    }

    @Override
    public boolean eligibleForStore(CacheStoreRequest request) {
        return true;
    }

    @Override
    public Mono<CacheLookupResult> lookup(CacheLookupRequest request) {
        double threshold = request.getSimilarityThreshold() != null
            ? request.getSimilarityThreshold()
            : config.getSimilarityThreshold();

        return Mono.fromCallable(() -> embeddingFor(request.getEmbedding(), request.getInputText()))
            .flatMap(query -> readAll(request.getTaskType())
                .filter(keyed -> keyed.entry.getEmbedding() != null)
                .map(keyed -> new Candidate(keyed, cosineSimilarity(query, keyed.entry.getEmbedding())))
                .reduce((a, b) -> b.similarity > a.similarity ? b : a))
            .flatMap(best -> {
                if (best.similarity < threshold) {
                    log.debug("Closest {} entry for {} at similarity {} is below {}", level(),
                        request.getTaskType(), String.format("%.3f", best.similarity), threshold);
                    return Mono.empty();
                }
                return hit(best.keyed.key, best.keyed.entry, best.similarity);
            });
    }

    @Override
    public Mono<Boolean> store(CacheStoreRequest request) {
        String normalized = CacheKeys.normalize(request.getInputText());
        return Mono.fromCallable(() -> embeddingFor(request.getEmbedding(), request.getInputText()))
            .flatMap(embedding -> write(request.getTaskType(), CacheKeys.sha256(normalized), CacheEntry.builder()
                .inputText(normalized)
                .response(request.getResponse())
                .costUnits(request.getCostUnits())
                .embedding(embedding)));
    }

    private double[] embeddingFor(double[] supplied, String inputText) {
        if (supplied != null && supplied.length > 0) {
            return supplied;
        }
        return embeddingProvider.embed(CacheKeys.normalize(inputText));
    }

    /**
     * Cosine similarity, or -1 when the vectors cannot be compared
     */
    static double cosineSimilarity(double[] a, double[] b) {
        if (a.length != b.length || a.length == 0) {
            return -1.0;
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return -1.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    private static final class Candidate {
        final KeyedEntry keyed;
        final double similarity;

        Candidate(KeyedEntry keyed, double similarity) {
            this.keyed = keyed;
            this.similarity = similarity;
        }
    }
}
