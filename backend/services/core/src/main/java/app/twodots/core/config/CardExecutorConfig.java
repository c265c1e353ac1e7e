package app.twodots.core.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Two pools: feed fetches and strategy calls run on {@link #CARD_LOADER_EXECUTOR}
 * and block on entity lookups, which run on {@link #ENTITY_GROUP_EXECUTOR}.
 * Group fetches never wait on other tasks, so the inner pool cannot starve.
 */
@Configuration
public class CardExecutorConfig {

    public static final String CARD_LOADER_EXECUTOR = "cardLoaderExecutor";
    public static final String ENTITY_GROUP_EXECUTOR = "entityGroupExecutor";

    @Bean(name = CARD_LOADER_EXECUTOR)
    public ThreadPoolTaskExecutor cardLoaderExecutor(CardCoreProps props) {
        CardCoreProps.Executor cfg = props.executor();
        return newPool("card-loader-", cfg.corePoolSize(), cfg.maxPoolSize(), cfg.queueCapacity());
    }

    @Bean(name = ENTITY_GROUP_EXECUTOR)
    public ThreadPoolTaskExecutor entityGroupExecutor(CardCoreProps props) {
        int poolSize = props.loader().poolSize();
        return newPool("entity-group-", poolSize, poolSize, props.executor().queueCapacity());
    }

    private static ThreadPoolTaskExecutor newPool(String prefix, int core, int max, int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(core);
        executor.setMaxPoolSize(max);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(prefix);
        executor.setDaemon(true);
        // saturated pool runs the task on the caller thread
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
