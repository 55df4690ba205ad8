package com.dexcex.arb.config;

import com.dexcex.arb.core.ExchangeAdapter;
import com.dexcex.arb.domain.Exchange;
import com.dexcex.arb.infra.ExchangeApiClient;
import com.dexcex.arb.infra.ExchangeRegistry;
import com.dexcex.arb.infra.HttpTickerExchangeAdapter;
import com.dexcex.arb.infra.SimulatedExchangeAdapter;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Slf4j
@Configuration
@EnableConfigurationProperties(ArbitrageProperties.class)
public class ArbitrageConfiguration {

    private static final double API_PERMITS_PER_SECOND = 10.0;
    private static final Duration API_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration API_RETRY_BACKOFF = Duration.ofSeconds(1);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TaskScheduler monitoringScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("arb-monitor-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Bean(name = "samplingExecutor")
    public Executor samplingExecutor() {
        return Executors.newCachedThreadPool();
    }

    @Bean(name = "tradeExecutor")
    public ExecutorService tradeExecutor() {
        return Executors.newCachedThreadPool();
    }

    @Bean
    public ExchangeApiClient exchangeApiClient(ObjectMapper objectMapper) {
        return new ExchangeApiClient(objectMapper, API_PERMITS_PER_SECOND, API_TIMEOUT, API_RETRY_BACKOFF);
    }

    @Bean
    public ExchangeRegistry exchangeRegistry(ArbitrageProperties properties, ExchangeApiClient apiClient,
            Clock clock) {
        List<ExchangeAdapter> adapters = new ArrayList<>();
        for (ArbitrageProperties.ExchangeProperties config : properties.getExchanges()) {
            if (!StringUtils.hasText(config.getName())) {
                throw new IllegalStateException("arbitrage.exchanges entry without a name");
            }
            Exchange exchange = Exchange.builder()
                    .name(config.getName())
                    .kind(config.getKind())
                    .apiUrl(config.getApiUrl())
                    .build();
            BigDecimal feeRate = properties.getFees().forKind(config.getKind());

            adapters.add(switch (config.getAdapter()) {
                case SIMULATED -> new SimulatedExchangeAdapter(exchange, feeRate, config.getPriceBias(),
                        properties.getSimulation(),
                        // per-venue stream so one venue's call pattern cannot shift another's prices
                        new Random(properties.getSimulation().getSeed() ^ config.getName().hashCode()),
                        clock);
                case HTTP -> new HttpTickerExchangeAdapter(exchange, config, apiClient, feeRate, clock);
            });
        }
        log.info("Initialized {} exchange connections", adapters.size());
        return new ExchangeRegistry(adapters);
    }
}
