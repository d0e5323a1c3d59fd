package com.revolution.backend.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@RequiredArgsConstructor
public class AsyncConfig {

    private final SecurityProperties securityProperties;

    /**
     * Bounded pool for Argon2 work. Saturation rejects instead of queueing without limit, so a login storm
     * cannot pin every request thread on 64 MiB hash computations.
     */
    @Bean(name = "credentialHashingExecutor")
    public ThreadPoolTaskExecutor credentialHashingExecutor() {
        SecurityProperties.HashingPool pool = securityProperties.getHashingPool();
        int processors = Runtime.getRuntime().availableProcessors();
        int corePoolSize = Math.max(1, Math.min(pool.getCoreSize(), processors));
        int maxPoolSize = Math.max(corePoolSize, Math.min(pool.getMaxSize(), processors * 2));

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(pool.getQueueCapacity());
        executor.setThreadNamePrefix("credential-hash-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
