package com.rfid.positioning.config;

import com.rfid.positioning.model.RegressionAlgorithm;
import jakarta.annotation.PreDestroy;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Beans shared by the positioning pipeline: the per-tag task executor and the configured
 * regression algorithm.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class PipelineConfig {

    private final PositioningProperties positioningProperties;

    // Keep reference to executor for graceful shutdown
    private ThreadPoolTaskExecutor taskExecutor;

    /**
     * Fixed-size pool running per-tag feature extraction and evaluation tasks. Saturation runs the
     * task on the submitting thread, so no tag is ever rejected.
     */
    @Bean(name = "positioningTaskExecutor")
    public ThreadPoolTaskExecutor positioningTaskExecutor() {
        int workers = positioningProperties.getProcessing().getWorkers();

        taskExecutor = new ThreadPoolTaskExecutor();
        taskExecutor.setCorePoolSize(workers);
        taskExecutor.setMaxPoolSize(workers);
        taskExecutor.setQueueCapacity(workers * 64);
        taskExecutor.setThreadNamePrefix("positioning-");
        taskExecutor.setKeepAliveSeconds(60);
        taskExecutor.setAllowCoreThreadTimeOut(true);
        taskExecutor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        taskExecutor.setWaitForTasksToCompleteOnShutdown(true);
        taskExecutor.setAwaitTerminationSeconds(30);
        taskExecutor.initialize();

        log.info("Initialized positioning executor - workers: {}", workers);
        return taskExecutor;
    }

    @Bean
    public RegressionAlgorithm regressionAlgorithm() {
        PositioningProperties.Model model = positioningProperties.getModel();
        RegressionAlgorithm algorithm = model.getAlgorithm().create(model);
        log.info("Using regression algorithm {}", algorithm.getName());
        return algorithm;
    }

    @PreDestroy
    public void shutdown() {
        if (taskExecutor != null) {
            ThreadPoolExecutor executor = taskExecutor.getThreadPoolExecutor();
            log.info("Shutting down positioning executor - Queue size: {}, Active threads: {}",
                executor.getQueue().size(), executor.getActiveCount());
            try {
                taskExecutor.shutdown();
                if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                    log.warn("Positioning tasks did not complete within 30 seconds, forcing shutdown");
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                log.warn("Shutdown interrupted, forcing immediate termination");
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }
}
