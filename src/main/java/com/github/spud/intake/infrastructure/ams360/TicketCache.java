package com.github.spud.intake.infrastructure.ams360;

import com.github.spud.intake.domain.common.AuthenticationFailedException;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Login ticket cache keyed by backend identity. At most one login per identity is in flight;
 * callers arriving meanwhile wait for that login and share its ticket or its failure. A failed
 * login leaves nothing cached.
 */
@Slf4j
public class TicketCache {

  private final Clock clock;

  private final Duration ttl;

  private final Map<String, SessionTicket> tickets = new ConcurrentHashMap<>();

  private final Map<String, CompletableFuture<SessionTicket>> inFlight = new ConcurrentHashMap<>();

  public TicketCache(Clock clock, Duration ttl) {
    this.clock = clock;
    this.ttl = ttl;
  }

  /**
   * Return a ticket that has not reached its expiry, logging in first when needed.
   *
   * @throws AuthenticationFailedException when the login exchange fails
   */
  public String getValidTicket(String identity, Supplier<String> login) {
    SessionTicket current = tickets.get(identity);
    if (current != null && !current.isExpiredAt(clock.instant())) {
      return current.getTicket();
    }

    CompletableFuture<SessionTicket> mine = new CompletableFuture<>();
    CompletableFuture<SessionTicket> running = inFlight.putIfAbsent(identity, mine);
    if (running == null) {
      running = mine;
      try {
        SessionTicket fresh = tickets.get(identity);
        if (fresh != null && !fresh.isExpiredAt(clock.instant())) {
          mine.complete(fresh);
        } else {
          mine.complete(login(identity, login));
        }
      } catch (Throwable e) {
        mine.completeExceptionally(e);
      } finally {
        inFlight.remove(identity, mine);
      }
    } else {
      log.debug("Waiting for in-flight login of {}", identity);
    }

    try {
      return running.join().getTicket();
    } catch (CompletionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      if (cause instanceof Error error) {
        throw error;
      }
      if (cause instanceof AuthenticationFailedException authFailure) {
        throw authFailure;
      }
      throw new AuthenticationFailedException("Login failed for " + identity + ": "
        + cause.getMessage(), cause);
    }
  }

  /**
   * Drop the cached ticket if it is still the one the backend rejected
   */
  public void invalidate(String identity, String rejectedTicket) {
    SessionTicket removed = tickets.computeIfPresent(identity,
      (key, cached) -> cached.getTicket().equals(rejectedTicket) ? null : cached);
    if (removed == null) {
      log.info("Ticket for {} invalidated after rejection", identity);
    }
  }

  private SessionTicket login(String identity, Supplier<String> login) {
    log.info("Ticket for {} missing or expired, logging in", identity);
    String value = login.get();
    if (value == null || value.isBlank()) {
      throw new AuthenticationFailedException("Login for " + identity + " returned no ticket");
    }
    SessionTicket ticket = new SessionTicket(value, clock.instant().plus(ttl));
    tickets.put(identity, ticket);
    log.info("Ticket for {} cached until {}", identity, ticket.getExpiresAt());
    return ticket;
  }
}
