package com.ogt.tapak.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Pools dedicados a ogr2ogr y a la compresión: son bloqueantes y no deben ocupar
 * los hilos del contenedor mientras esperan.
 * <p>
 * Cargas y exportaciones van en pools separados: una carga puede quedar esperando el lock
 * de staging y las exportaciones nunca lo necesitan.
 */
@Configuration
@RequiredArgsConstructor
public class AsyncConfig {

    public static final String UPLOAD_EXECUTOR = "uploadExecutor";
    public static final String EXPORT_EXECUTOR = "exportExecutor";

    private final TapakProperties properties;

    @Bean(name = UPLOAD_EXECUTOR)
    public ThreadPoolTaskExecutor uploadExecutor() {
        return executor(properties.getConversion().getPoolSize(), "tapak-upload-");
    }

    @Bean(name = EXPORT_EXECUTOR)
    public ThreadPoolTaskExecutor exportExecutor() {
        return executor(properties.getConversion().getExportPoolSize(), "tapak-export-");
    }

    private ThreadPoolTaskExecutor executor(int poolSize, String threadPrefix) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(properties.getConversion().getQueueCapacity());
        executor.setThreadNamePrefix(threadPrefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}
