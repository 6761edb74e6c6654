package com.github.spud.intake.domain.conversation;

import com.github.spud.intake.application.config.IntakeProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Process wide map of live conversation threads. Creation is atomic per thread id; threads of
 * different ids never contend. Eviction skips any thread whose lock is held.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConversationStore {

  private final Map<String, ConversationThread> threads = new ConcurrentHashMap<>();

  private final ThreadServicesFactory threadServicesFactory;

  private final IntakeProperties properties;

  private final Clock clock;

  public ConversationThread getOrCreate(String threadId) {
    ConversationThread thread = threads.computeIfAbsent(threadId, id -> {
      log.info("Creating conversation thread {}", id);
      return new ConversationThread(id, properties.getDispatch().getSystemPrompt(),
        threadServicesFactory.create(id), clock.instant());
    });
    thread.touch(clock.instant());
    return thread;
  }

  public Optional<ConversationThread> find(String threadId) {
    return Optional.ofNullable(threads.get(threadId));
  }

  /**
   * @return true when a thread was removed
   */
  public boolean remove(String threadId) {
    ConversationThread removed = threads.remove(threadId);
    if (removed == null) {
      return false;
    }
    removed.detach();
    log.info("Removed conversation thread {}", threadId);
    return true;
  }

  public int size() {
    return threads.size();
  }

  /**
   * Drop threads idle longer than the configured TTL, then the least recently used ones while
   * the store is over capacity.
   *
   * @return number of evicted threads
   */
  public int evict() {
    Instant now = clock.instant();
    Duration idleTtl = properties.getThreads().getIdleTtl();
    int evicted = 0;

    for (ConversationThread thread : List.copyOf(threads.values())) {
      if (Duration.between(thread.getLastAccess(), now).compareTo(idleTtl) > 0
        && tryEvict(thread)) {
        evicted++;
      }
    }

    int overflow = threads.size() - properties.getThreads().getMaxThreads();
    if (overflow > 0) {
      List<ConversationThread> byAge = threads.values().stream()
        .sorted(Comparator.comparing(ConversationThread::getLastAccess))
        .toList();
      for (ConversationThread thread : byAge) {
        if (overflow <= 0) {
          break;
        }
        if (tryEvict(thread)) {
          evicted++;
          overflow--;
        }
      }
    }

    if (evicted > 0) {
      log.info("Evicted {} conversation thread(s), {} remain", evicted, threads.size());
    }
    return evicted;
  }

  private boolean tryEvict(ConversationThread thread) {
    if (!thread.getLock().tryLock()) {
      log.debug("Thread {} is busy, not evicting", thread.getThreadId());
      return false;
    }
    try {
      if (!threads.remove(thread.getThreadId(), thread)) {
        return false;
      }
      thread.detach();
      log.debug("Evicted thread {}, last access {}", thread.getThreadId(),
        thread.getLastAccess());
      return true;
    } finally {
      thread.getLock().unlock();
    }
  }
}
