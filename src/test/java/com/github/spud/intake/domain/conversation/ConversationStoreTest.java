package com.github.spud.intake.domain.conversation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.github.spud.intake.application.config.IntakeProperties;
import com.github.spud.intake.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.messages.MessageType;

class ConversationStoreTest {

  private ThreadServicesFactory factory;
  private IntakeProperties properties;
  private MutableClock clock;
  private ConversationStore store;
  private ExecutorService executor;

  @BeforeEach
  void setUp() {
    factory = mock(ThreadServicesFactory.class);
    when(factory.create(anyString()))
      .thenAnswer(inv -> ThreadServices.builder().threadId(inv.getArgument(0)).build());
    properties = new IntakeProperties();
    properties.getDispatch().setSystemPrompt("Be helpful.");
    properties.getThreads().setIdleTtl(Duration.ofHours(2));
    properties.getThreads().setMaxThreads(3);
    clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    store = new ConversationStore(factory, properties, clock);
    executor = Executors.newSingleThreadExecutor();
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void createsThreadOnceWithSystemPrompt() {
    ConversationThread first = store.getOrCreate("a");
    ConversationThread second = store.getOrCreate("a");

    assertThat(second).isSameAs(first);
    assertThat(first.messages()).hasSize(1);
    assertThat(first.messages().get(0).getMessageType()).isEqualTo(MessageType.SYSTEM);
    assertThat(first.messages().get(0).getText()).isEqualTo("Be helpful.");
    verify(factory, times(1)).create("a");
  }

  @Test
  void removeDetachesThread() {
    ConversationThread thread = store.getOrCreate("a");

    assertThat(store.remove("a")).isTrue();
    assertThat(store.remove("a")).isFalse();
    assertThat(thread.isDetached()).isTrue();
    assertThat(store.find("a")).isEmpty();
  }

  @Test
  void evictsIdleThreads() {
    ConversationThread idle = store.getOrCreate("idle");
    clock.advance(Duration.ofHours(3));
    store.getOrCreate("fresh");

    assertThat(store.evict()).isEqualTo(1);
    assertThat(store.find("idle")).isEmpty();
    assertThat(store.find("fresh")).isPresent();
    assertThat(idle.isDetached()).isTrue();
  }

  @Test
  void evictsLeastRecentlyUsedOverCapacity() {
    for (String id : new String[]{"a", "b", "c", "d"}) {
      store.getOrCreate(id);
      clock.advance(Duration.ofSeconds(1));
    }
    // touching "a" makes "b" the oldest
    store.getOrCreate("a");

    assertThat(store.evict()).isEqualTo(1);
    assertThat(store.size()).isEqualTo(3);
    assertThat(store.find("b")).isEmpty();
    assertThat(store.find("a")).isPresent();
  }

  @Test
  void skipsThreadsWithATurnInProgress() throws Exception {
    ConversationThread busy = store.getOrCreate("busy");
    clock.advance(Duration.ofHours(3));
    CountDownLatch locked = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    executor.submit(() -> {
      busy.getLock().lock();
      try {
        locked.countDown();
        release.await(5, TimeUnit.SECONDS);
      } finally {
        busy.getLock().unlock();
      }
      return null;
    });
    assertThat(locked.await(5, TimeUnit.SECONDS)).isTrue();

    assertThat(store.evict()).isZero();
    assertThat(busy.isDetached()).isFalse();

    release.countDown();
    await().atMost(Duration.ofSeconds(5)).until(() -> !busy.getLock().isLocked());
    assertThat(store.evict()).isEqualTo(1);
  }
}
