package com.github.spud.intake.application.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Conversation engine settings: dispatch loop bounds, thread eviction and local storage.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "intake")
public class IntakeProperties {

  private Dispatch dispatch = new Dispatch();

  private Threads threads = new Threads();

  private Storage storage = new Storage();

  @Getter
  @Setter
  public static class Dispatch {

    /**
     * Maximum number of model invocations in one turn before the turn fails
     */
    private int maxRounds = 8;

    /**
     * Wall clock budget for one turn, lock wait included
     */
    private Duration turnTimeout = Duration.ofSeconds(90);

    private Double temperature = 0.7;

    /**
     * Fixed instruction placed at the head of every thread
     */
    private String systemPrompt = "You are a helpful insurance intake assistant.";
  }

  @Getter
  @Setter
  public static class Threads {

    private int maxThreads = 10_000;

    private Duration idleTtl = Duration.ofHours(2);

    private Duration sweepInterval = Duration.ofMinutes(5);
  }

  @Getter
  @Setter
  public static class Storage {

    private String directory = "insurance_requests";
  }
}
