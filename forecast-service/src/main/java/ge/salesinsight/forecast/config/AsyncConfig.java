package ge.salesinsight.forecast.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Worker pool for forecasting jobs, plus scheduling for job cleanup.
 */
@Slf4j
@Configuration
@EnableScheduling
public class AsyncConfig {

    @Value("${forecast.executor.core-pool-size:2}")
    private int corePoolSize;

    @Value("${forecast.executor.max-pool-size:4}")
    private int maxPoolSize;

    @Value("${forecast.executor.queue-capacity:10}")
    private int queueCapacity;

    /**
     * Jobs are submitted here by AsyncForecastService. A full queue rejects the
     * job (AbortPolicy) and the caller gets 503; queued jobs drain on shutdown.
     */
    @Bean(name = "trainingExecutor")
    public ThreadPoolTaskExecutor trainingExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("forecast-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(120);
        executor.initialize();

        log.info("Forecast pool ready: core={}, max={}, queue={}",
                executor.getCorePoolSize(), executor.getMaxPoolSize(), executor.getQueueCapacity());

        return executor;
    }
}
