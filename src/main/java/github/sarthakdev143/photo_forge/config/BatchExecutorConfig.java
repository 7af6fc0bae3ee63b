package github.sarthakdev143.photo_forge.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@EnableConfigurationProperties(PhotoForgeProperties.class)
public class BatchExecutorConfig {

    public static final String JOB_EXECUTOR = "photoForgeJobExecutor";

    /**
     * Runs admitted batch jobs. Sized to the largest allowed concurrency cap so that admission, not
     * the pool, is what limits parallel jobs.
     */
    @Bean(name = JOB_EXECUTOR)
    public ThreadPoolTaskExecutor photoForgeJobExecutor(PhotoForgeProperties properties) {
        int poolSize = Math.max(
                PhotoForgeProperties.Batch.MAX_CONCURRENT_JOBS,
                properties.getBatch().getExecutorPoolSize());

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setThreadNamePrefix("batch-job-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
