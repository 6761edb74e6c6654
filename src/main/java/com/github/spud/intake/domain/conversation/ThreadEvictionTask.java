package com.github.spud.intake.domain.conversation;

import com.github.spud.intake.application.config.IntakeProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

/**
 * Periodic sweep of idle and surplus conversation threads
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class ThreadEvictionTask implements SchedulingConfigurer {

  private final ConversationStore store;

  private final IntakeProperties properties;

  @Override
  public void configureTasks(ScheduledTaskRegistrar taskRegistrar) {
    log.info("Thread eviction every {}: idle-ttl={}, max-threads={}",
      properties.getThreads().getSweepInterval(), properties.getThreads().getIdleTtl(),
      properties.getThreads().getMaxThreads());
    taskRegistrar.addFixedDelayTask(this::sweep, properties.getThreads().getSweepInterval());
  }

  void sweep() {
    try {
      store.evict();
    } catch (RuntimeException e) {
      log.error("Thread eviction sweep failed: {}", e.getMessage(), e);
    }
  }
}
