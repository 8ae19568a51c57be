package com.example.seoagent.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Пулы потоков для прогонов анализа и для агентов.
 */
@Configuration
public class ExecutorConfig {

    /**
     * Пул для агентов и параллельных разделов синтеза плана.
     */
    @Bean(name = "agentExecutor")
    public ThreadPoolTaskExecutor agentExecutor(AppConfig appConfig) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(appConfig.getAgents().getPoolSize());
        executor.setMaxPoolSize(appConfig.getAgents().getPoolSize());
        executor.setThreadNamePrefix("agent-");
        executor.initialize();
        return executor;
    }

    /**
     * Пул, в котором выполняются сами прогоны. Отделён от пула агентов, чтобы прогон не ждал собственных задач.
     */
    @Bean(name = "analysisExecutor")
    public ThreadPoolTaskExecutor analysisExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setThreadNamePrefix("analysis-");
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
