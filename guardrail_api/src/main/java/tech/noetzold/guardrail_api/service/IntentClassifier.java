package tech.noetzold.guardrail_api.service;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;
import tech.noetzold.guardrail_api.model.ClassificationResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Zero-shot intent classifier: nearest prototype phrase in embedding space.
 * <p>
 * Each intent scores the best cosine similarity among its own prototypes; the globally best
 * intent wins if it clears the threshold, otherwise the result is {@code unknown}. Embedding
 * failures and timeouts never escape: they degrade to {@code unknown} with confidence 0.
 */
@Slf4j
@Service
public class IntentClassifier {

    private final EmbeddingModel embeddingModel;
    private final AsyncTaskExecutor executor;
    private final Map<String, List<String>> prototypes;
    private final double threshold;
    private final long timeoutMs;
    private final boolean lexicalFallback;

    private final Object initLock = new Object();
    private volatile Map<String, List<float[]>> prototypeVectors;

    @Autowired
    public IntentClassifier(EmbeddingModel embeddingModel,
                            @Qualifier("embeddingExecutor") AsyncTaskExecutor executor,
                            @Value("${guardrail.classifier.threshold:0.38}") double threshold,
                            @Value("${guardrail.classifier.embed-timeout-ms:2000}") long timeoutMs,
                            @Value("${guardrail.classifier.lexical-fallback:false}") boolean lexicalFallback) {
        this(embeddingModel, executor, IntentPrototypes.DEFAULT, threshold, timeoutMs, lexicalFallback);
    }

    public IntentClassifier(EmbeddingModel embeddingModel,
                            AsyncTaskExecutor executor,
                            Map<String, List<String>> prototypes,
                            double threshold,
                            long timeoutMs,
                            boolean lexicalFallback) {
        this.embeddingModel = embeddingModel;
        this.executor = executor;
        this.prototypes = Collections.unmodifiableMap(new LinkedHashMap<>(prototypes));
        this.threshold = threshold;
        this.timeoutMs = timeoutMs;
        this.lexicalFallback = lexicalFallback;
    }

    @PostConstruct
    public void warmUp() {
        try {
            long t0 = System.nanoTime();
            Map<String, List<float[]>> vectors = prototypeVectors();
            log.info("Embedded prototypes for {} intents in {} ms",
                    vectors.size(), TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0));
        } catch (RuntimeException e) {
            log.warn("Prototype warm-up failed, will retry on first request: {}", e.getMessage());
        }
    }

    public ClassificationResult classify(String text) {
        String input = text != null ? text.trim() : "";
        if (input.isEmpty()) {
            return ClassificationResult.unknown(0.0);
        }
        try {
            return withTimeout(() -> nearest(embed(input), prototypeVectors(), input));
        } catch (TimeoutException e) {
            log.warn("Embedding timed out after {} ms, classifying as unknown", timeoutMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Classification interrupted, classifying as unknown");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Embedding backend failed, classifying as unknown: {}", cause.toString());
        } catch (RejectedExecutionException e) {
            log.warn("Embedding pool saturated, classifying as unknown");
        } catch (RuntimeException e) {
            log.warn("Classification failed, classifying as unknown: {}", e.toString());
        }
        return ClassificationResult.unknown(0.0);
    }

    /** Readiness probe: embeds a fixed string and lets any failure propagate. */
    public void probe() throws Exception {
        withTimeout(() -> embed("ping"));
    }

    public double threshold() {
        return threshold;
    }

    ClassificationResult nearest(float[] query, Map<String, List<float[]>> vectors, String text) {
        String bestIntent = ClassificationResult.UNKNOWN_INTENT;
        double bestScore = 0.0;
        for (Map.Entry<String, List<float[]>> entry : vectors.entrySet()) {
            double score = 0.0;
            for (float[] prototype : entry.getValue()) {
                score = Math.max(score, cosine(query, prototype));
            }
            // strict: on an exact tie the earlier-declared intent keeps the slot
            if (score > bestScore) {
                bestScore = score;
                bestIntent = entry.getKey();
            }
        }
        bestScore = Math.min(1.0, bestScore);

        if (bestScore >= threshold && !ClassificationResult.UNKNOWN_INTENT.equals(bestIntent)) {
            return new ClassificationResult(bestIntent, bestScore);
        }
        if (lexicalFallback && IntentPrototypes.looksLikeOverride(text)) {
            log.debug("Sub-threshold text matched override keywords (score {})", bestScore);
            return new ClassificationResult(IntentPrototypes.ADMIN_OVERRIDE, bestScore);
        }
        return ClassificationResult.unknown(bestScore);
    }

    static double cosine(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Embedding dimensions differ: " + a.length + " vs " + b.length);
        }
        double dot = 0.0, normA = 0.0, normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) return 0.0;
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    private Map<String, List<float[]>> prototypeVectors() {
        Map<String, List<float[]>> local = prototypeVectors;
        if (local == null) {
            synchronized (initLock) {
                local = prototypeVectors;
                if (local == null) {
                    local = embedPrototypes();
                    prototypeVectors = local;
                }
            }
        }
        return local;
    }

    private Map<String, List<float[]>> embedPrototypes() {
        Map<String, List<float[]>> vectors = new LinkedHashMap<>();
        prototypes.forEach((intent, phrases) -> {
            List<TextSegment> segments = phrases.stream().map(TextSegment::from).toList();
            List<Embedding> embeddings = embeddingModel.embedAll(segments).content();
            List<float[]> forIntent = new ArrayList<>(embeddings.size());
            embeddings.forEach(e -> forIntent.add(e.vector()));
            vectors.put(intent, Collections.unmodifiableList(forIntent));
        });
        return Collections.unmodifiableMap(vectors);
    }

    private float[] embed(String text) {
        return embeddingModel.embed(text).content().vector();
    }

    private <T> T withTimeout(Callable<T> task) throws InterruptedException, ExecutionException, TimeoutException {
        Future<T> future = executor.submit(task);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException | InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }
}
