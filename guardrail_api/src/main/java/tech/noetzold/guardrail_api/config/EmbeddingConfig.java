package tech.noetzold.guardrail_api.config;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2.AllMiniLmL6V2EmbeddingModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class EmbeddingConfig {

    /** all-MiniLM-L6-v2, run in-process through ONNX. */
    @Bean
    public EmbeddingModel embeddingModel() {
        return new AllMiniLmL6V2EmbeddingModel();
    }

    /**
     * Bounded pool for embedding calls. ONNX inference ignores interrupts, so a hung backend keeps
     * its workers busy after the caller times out; once the queue is full new calls are rejected
     * and the classifier answers {@code unknown} right away.
     */
    @Bean(name = "embeddingExecutor")
    public ThreadPoolTaskExecutor embeddingExecutor(@Value("${guardrail.classifier.embed-threads:4}") int threads,
                                                    @Value("${guardrail.classifier.embed-queue-capacity:32}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.max(1, threads));
        executor.setMaxPoolSize(Math.max(1, threads));
        executor.setQueueCapacity(Math.max(0, queueCapacity));
        executor.setThreadNamePrefix("embed-");
        executor.setDaemon(true);
        executor.initialize();
        return executor;
    }
}
