package io.b2mash.readiness.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Bounded executor that runs summary rebuilds after the triggering transaction commits. */
@Configuration
@EnableConfigurationProperties(ReadinessProperties.class)
public class AsyncConfig {

  public static final String RECOMPUTE_EXECUTOR = "attendanceRecomputeExecutor";

  @Bean(name = RECOMPUTE_EXECUTOR)
  public ThreadPoolTaskExecutor attendanceRecomputeExecutor(ReadinessProperties properties) {
    var sizing = properties.recompute().executor();
    var executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(sizing.corePoolSize());
    executor.setMaxPoolSize(sizing.maxPoolSize());
    executor.setQueueCapacity(sizing.queueCapacity());
    executor.setThreadNamePrefix("recompute-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.initialize();
    return executor;
  }
}
