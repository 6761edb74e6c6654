package com.github.spud.intake.infrastructure.ams360;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.github.spud.intake.domain.common.AuthenticationFailedException;
import com.github.spud.intake.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * 登录票据缓存测试
 */
class TicketCacheTest {

  private static final String IDENTITY = "1234/tester@https://ams.example.com";

  private MutableClock clock;
  private TicketCache cache;
  private AtomicInteger logins;
  private ExecutorService executor;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    cache = new TicketCache(clock, Duration.ofMinutes(15));
    logins = new AtomicInteger();
    executor = Executors.newFixedThreadPool(10);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  private Supplier<String> countingLogin() {
    return () -> "ticket-" + logins.incrementAndGet();
  }

  @Test
  void reusesTicketUntilExpiry() {
    assertThat(cache.getValidTicket(IDENTITY, countingLogin())).isEqualTo("ticket-1");

    clock.advance(Duration.ofMinutes(14));
    assertThat(cache.getValidTicket(IDENTITY, countingLogin())).isEqualTo("ticket-1");

    clock.advance(Duration.ofMinutes(1));
    assertThat(cache.getValidTicket(IDENTITY, countingLogin())).isEqualTo("ticket-2");
    assertThat(logins).hasValue(2);
  }

  @Test
  void identitiesAreCachedSeparately() {
    cache.getValidTicket(IDENTITY, countingLogin());
    cache.getValidTicket("other@https://ams.example.com", countingLogin());

    assertThat(logins).hasValue(2);
  }

  @Test
  @DisplayName("Concurrent callers with no ticket share one login")
  void concurrentCallersShareOneLogin() throws Exception {
    CountDownLatch start = new CountDownLatch(1);
    Supplier<String> slowLogin = () -> {
      sleep(200);
      return "ticket-" + logins.incrementAndGet();
    };

    List<Future<String>> results = submitTen(start, slowLogin);
    start.countDown();

    for (Future<String> result : results) {
      assertThat(result.get(5, TimeUnit.SECONDS)).isEqualTo("ticket-1");
    }
    assertThat(logins).hasValue(1);
  }

  @Test
  @DisplayName("A failed login is reported and not cached")
  void failedLoginIsNotCached() {
    Supplier<String> failing = () -> {
      logins.incrementAndGet();
      throw new AuthenticationFailedException("Invalid credentials");
    };

    assertThatThrownBy(() -> cache.getValidTicket(IDENTITY, failing))
      .isInstanceOf(AuthenticationFailedException.class)
      .hasMessage("Invalid credentials");

    assertThat(cache.getValidTicket(IDENTITY, countingLogin())).isEqualTo("ticket-2");
  }

  @Test
  @DisplayName("Concurrent callers during a failing login all see that failure")
  void concurrentCallersShareOneFailure() throws Exception {
    CountDownLatch start = new CountDownLatch(1);
    Supplier<String> slowFailingLogin = () -> {
      logins.incrementAndGet();
      sleep(200);
      throw new AuthenticationFailedException("Invalid credentials");
    };

    List<Future<String>> results = submitTen(start, slowFailingLogin);
    start.countDown();

    for (Future<String> result : results) {
      assertThatThrownBy(() -> result.get(5, TimeUnit.SECONDS))
        .isInstanceOf(ExecutionException.class)
        .cause()
        .isInstanceOf(AuthenticationFailedException.class)
        .hasMessage("Invalid credentials");
    }
    assertThat(logins).hasValue(1);
  }

  @Test
  @DisplayName("An Error thrown by the login is handed to waiting callers")
  void errorDuringLoginReleasesWaiters() throws Exception {
    CountDownLatch start = new CountDownLatch(1);
    Supplier<String> crashingLogin = () -> {
      logins.incrementAndGet();
      sleep(200);
      throw new AssertionError("login crashed");
    };

    List<Future<String>> results = submitTen(start, crashingLogin);
    start.countDown();

    for (Future<String> result : results) {
      assertThatThrownBy(() -> result.get(5, TimeUnit.SECONDS))
        .isInstanceOf(ExecutionException.class)
        .cause()
        .isInstanceOf(AssertionError.class)
        .hasMessage("login crashed");
    }
    assertThat(logins).hasValue(1);
    assertThat(cache.getValidTicket(IDENTITY, countingLogin())).isEqualTo("ticket-2");
  }

  private List<Future<String>> submitTen(CountDownLatch start, Supplier<String> login) {
    List<Future<String>> results = new ArrayList<>();
    for (int i = 0; i < 10; i++) {
      results.add(executor.submit(() -> {
        start.await();
        return cache.getValidTicket(IDENTITY, login);
      }));
    }
    return results;
  }

  private static void sleep(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  @Test
  void otherLoginFailuresBecomeAuthenticationFailures() {
    assertThatThrownBy(() -> cache.getValidTicket(IDENTITY, () -> {
      throw new IllegalStateException("connection reset");
    }))
      .isInstanceOf(AuthenticationFailedException.class)
      .hasMessageContaining("connection reset");
  }

  @Test
  void blankTicketIsAFailure() {
    assertThatThrownBy(() -> cache.getValidTicket(IDENTITY, () -> " "))
      .isInstanceOf(AuthenticationFailedException.class);
  }

  @Test
  void invalidateDropsOnlyTheRejectedTicket() {
    cache.getValidTicket(IDENTITY, countingLogin());

    cache.invalidate(IDENTITY, "some-older-ticket");
    assertThat(cache.getValidTicket(IDENTITY, countingLogin())).isEqualTo("ticket-1");

    cache.invalidate(IDENTITY, "ticket-1");
    assertThat(cache.getValidTicket(IDENTITY, countingLogin())).isEqualTo("ticket-2");
  }
}
