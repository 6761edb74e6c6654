package com.github.spud.intake.domain.conversation;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.github.spud.intake.application.config.IntakeProperties;
import org.junit.jupiter.api.Test;

class ThreadEvictionTaskTest {

  @Test
  void sweepFailureDoesNotStopTheSchedule() {
    ConversationStore store = mock(ConversationStore.class);
    when(store.evict()).thenThrow(new IllegalStateException("boom"));
    ThreadEvictionTask task = new ThreadEvictionTask(store, new IntakeProperties());

    assertThatCode(task::sweep).doesNotThrowAnyException();
    verify(store).evict();
  }
}
