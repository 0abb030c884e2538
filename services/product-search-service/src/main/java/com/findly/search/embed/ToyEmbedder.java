package com.findly.search.embed;

import com.findly.search.cache.CacheKeys;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import org.springframework.stereotype.Component;

/**
 * Hashed bag-of-tokens vectors for local runs without an embedding provider. Each token contributes a
 * pseudo-random direction seeded from its digest, so texts sharing words land close together.
 */
@Component
public class ToyEmbedder {
    private final EmbeddingProperties properties;

    public ToyEmbedder(EmbeddingProperties properties) {
        this.properties = properties;
    }

    public List<Double> embed(String text) {
        int dimension = Math.max(1, properties.getDimension());
        double[] sum = new double[dimension];
        List<String> tokens = tokens(text);
        if (tokens.isEmpty()) {
            tokens = List.of("");
        }
        for (String token : tokens) {
            Random random = new Random(seed(token));
            for (int i = 0; i < dimension; i++) {
                sum[i] += random.nextGaussian();
            }
        }
        double norm = 0.0;
        for (double value : sum) {
            norm += value * value;
        }
        norm = norm == 0.0 ? 1.0 : Math.sqrt(norm);
        List<Double> vector = new ArrayList<>(dimension);
        for (double value : sum) {
            vector.add(value / norm);
        }
        return vector;
    }

    private List<String> tokens(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null) {
            return tokens;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private long seed(String token) {
        return Long.parseUnsignedLong(CacheKeys.sha256Hex(token).substring(0, 15), 16);
    }
}
