package com.whereq.helios.cache;

import com.whereq.helios.config.HeliosProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Feature-hashed bag of words, L2-normalized.
 * Captures lexical overlap only; declare a {@code @Primary} model-backed {@link EmbeddingProvider} for paraphrase matching.
 */
@Component
public class HashingEmbeddingProvider implements EmbeddingProvider {

    private final int dimension;

    @Autowired
    public HashingEmbeddingProvider(HeliosProperties properties) {
        this(properties.getCache().getL3().getEmbeddingDimension());
    }

    public HashingEmbeddingProvider(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Embedding dimension must be positive: " + dimension);
        }
        this.dimension = dimension;
    }

    @Override
    public double[] embed(String text) {
        double[] vector = new double[dimension];
        if (text == null) {
            return vector;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (token.isEmpty()) {
                continue;
            }
            int hash = token.hashCode();
            int bucket = Math.floorMod(hash, dimension);
            vector[bucket] += (hash & 0x40000000) == 0 ? 1.0 : -1.0;
        }

        double norm = 0.0;
        for (double v : vector) {
            norm += v * v;
        }
        if (norm > 0) {
            norm = Math.sqrt(norm);
            for (int i = 0; i < vector.length; i++) {
                vector[i] /= norm;
            }
        }
        return vector;
    }
}
