package com.github.spud.intake.application.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

@Getter
@Setter
@ConfigurationProperties(prefix = "intake.agencyzoom")
public class AgencyZoomProperties {

  private String baseUrl = "https://api.agencyzoom.com/v1";

  private String apiKey;

  private long pipelineId = 3816;

  private long stageId = 11446;

  private long leadSourceId = 113762;

  private long assignTo = 148687;

  private Duration timeout = Duration.ofSeconds(15);

  public boolean hasApiKey() {
    return StringUtils.hasText(apiKey);
  }

  /**
   * Base url normalized to end with {@code /v1}
   */
  public String normalizedBaseUrl() {
    String url = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    return url.endsWith("/v1") ? url : url + "/v1";
  }
}
