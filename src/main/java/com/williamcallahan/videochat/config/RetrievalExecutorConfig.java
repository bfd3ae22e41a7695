package com.williamcallahan.videochat.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded pool running the lexical and vector retrieval signals side by side.
 */
@Configuration
public class RetrievalExecutorConfig {

    private static final int CORE_THREADS = 4;
    private static final int MAX_THREADS = 16;
    private static final int QUEUE_CAPACITY = 256;
    private static final int KEEP_ALIVE_SECONDS = 60;
    private static final int SHUTDOWN_WAIT_SECONDS = 10;

    @Bean(name = "retrievalExecutor")
    public ThreadPoolTaskExecutor retrievalExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(CORE_THREADS);
        executor.setMaxPoolSize(MAX_THREADS);
        executor.setQueueCapacity(QUEUE_CAPACITY);
        executor.setKeepAliveSeconds(KEEP_ALIVE_SECONDS);
        executor.setThreadNamePrefix("retrieval-");
        executor.setDaemon(true);
        // saturation slows the caller instead of failing the request
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(SHUTDOWN_WAIT_SECONDS);
        return executor;
    }
}
