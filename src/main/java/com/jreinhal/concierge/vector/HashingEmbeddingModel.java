package com.jreinhal.concierge.vector;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.zip.CRC32;
import org.springframework.ai.document.Document;
import org.springframework.ai.embedding.Embedding;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.embedding.EmbeddingRequest;
import org.springframework.ai.embedding.EmbeddingResponse;

/**
 * Offline embedding used when no embedding provider is configured. Tokens and token bigrams are
 * feature-hashed into a fixed number of signed buckets and the result is L2-normalized, so texts
 * sharing vocabulary land close together. Deterministic across restarts.
 */
public class HashingEmbeddingModel implements EmbeddingModel {
    public static final int DEFAULT_DIMENSIONS = 384;
    private final int dimensions;

    public HashingEmbeddingModel() {
        this(DEFAULT_DIMENSIONS);
    }

    public HashingEmbeddingModel(int dimensions) {
        if (dimensions < 8) {
            throw new IllegalArgumentException("Embedding dimensions must be at least 8");
        }
        this.dimensions = dimensions;
    }

    @Override
    public EmbeddingResponse call(EmbeddingRequest request) {
        List<Embedding> embeddings = new ArrayList<>();
        List<String> inputs = request.getInstructions();
        for (int i = 0; i < inputs.size(); i++) {
            embeddings.add(new Embedding(embedText(inputs.get(i)), i));
        }
        return new EmbeddingResponse(embeddings);
    }

    @Override
    public float[] embed(String text) {
        return embedText(text);
    }

    @Override
    public float[] embed(Document document) {
        return embedText(document != null ? document.getText() : null);
    }

    @Override
    public int dimensions() {
        return this.dimensions;
    }

    private float[] embedText(String text) {
        float[] vector = new float[this.dimensions];
        if (text == null || text.isBlank()) {
            return vector;
        }
        String[] tokens = text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+");
        String previous = null;
        for (String token : tokens) {
            if (token.isEmpty()) {
                continue;
            }
            addFeature(vector, token, 1.0f);
            if (previous != null) {
                addFeature(vector, previous + " " + token, 0.5f);
            }
            previous = token;
        }
        double norm = Math.sqrt(VectorMath.squaredNorm(vector));
        if (norm > 0.0) {
            for (int i = 0; i < vector.length; i++) {
                vector[i] = (float) (vector[i] / norm);
            }
        }
        return vector;
    }

    private void addFeature(float[] vector, String feature, float weight) {
        CRC32 crc = new CRC32();
        crc.update(feature.getBytes(StandardCharsets.UTF_8));
        long hash = crc.getValue();
        int bucket = (int) (hash % this.dimensions);
        float sign = ((hash >>> 16) & 1L) == 0L ? 1.0f : -1.0f;
        vector[bucket] += sign * weight;
    }
}
