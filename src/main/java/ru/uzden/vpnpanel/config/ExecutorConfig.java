package ru.uzden.vpnpanel.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class ExecutorConfig {

    /**
     * Ограниченный пул для параллельных запросов к панелям (health-check, синхронизация inbound'ов).
     */
    @Bean(name = "panelFanOutExecutor")
    public ThreadPoolTaskExecutor panelFanOutExecutor(PanelProperties props) {
        int parallelism = Math.max(1, props.fanOut().parallelism());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(parallelism);
        executor.setMaxPoolSize(parallelism);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("panel-fanout-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
