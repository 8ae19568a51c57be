package com.example.seoagent.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Основная конфигурация приложения.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "app")
public class AppConfig {

    private Agents agents = new Agents();

    private Insights insights = new Insights();

    @Data
    public static class Agents {
        /**
         * Максимальное время работы одного агента (в секундах)
         */
        private int timeoutSeconds = 120;

        /**
         * Размер пула потоков для агентов и синтеза
         */
        private int poolSize = 8;
    }

    @Data
    public static class Insights {
        /**
         * Пункты списка не длиннее этого значения отбрасываются; 0 убирает только пустые
         */
        private int minLineLength = 0;
    }
}
