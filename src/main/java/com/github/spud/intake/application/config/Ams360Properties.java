package com.github.spud.intake.application.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "intake.ams360")
public class Ams360Properties {

  private String baseUrl = "https://wsapi.ams360.com/v3/WSAPIService.svc";

  private String agencyNo;

  private String loginId;

  private String password;

  private String employeeCode;

  /**
   * Local lifetime of a login ticket. The server does not declare one.
   */
  private Duration ticketTtl = Duration.ofMinutes(15);

  private Duration timeout = Duration.ofSeconds(20);

  /**
   * Cache key for the ticket, one per credential set
   */
  public String identity() {
    return agencyNo + "/" + loginId + "@" + baseUrl;
  }
}
