package com.whereq.helios.cache;

/**
 * Turns text into a vector for semantic matching
 */
public interface EmbeddingProvider {

    /**
     * @param text input text
     * @return embedding vector; vectors from one provider always share a dimension
     */
    double[] embed(String text);
}
