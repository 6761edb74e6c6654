package com.github.spud.intake.domain.intake;

import java.util.EnumSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.statemachine.StateMachine;
import org.springframework.statemachine.StateMachineEventResult;
import org.springframework.statemachine.config.StateMachineBuilder;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Builds one intake state machine per session and drives it synchronously
 * <pre>
 *   *             --(SELECT_ACTION)--> COLLECTING
 *   COLLECTING    --(COLLECT)-------> COLLECTED
 *   COLLECTED     --(COLLECT)-------> COLLECTED
 *   SUBMITTED     --(COLLECT)-------> COLLECTED
 *   COLLECTED     --(SUBMIT)--------> SUBMITTED
 * </pre>
 */
@Slf4j
@Component
public class IntakeStateMachineDriver {

  public StateMachine<IntakeState, IntakeEvent> create(String machineId) {
    try {
      StateMachineBuilder.Builder<IntakeState, IntakeEvent> builder = StateMachineBuilder.builder();
      builder.configureConfiguration()
        .withConfiguration()
        .machineId(machineId)
        .autoStartup(false);
      configure(builder);
      StateMachine<IntakeState, IntakeEvent> sm = builder.build();
      sm.startReactively().block();
      return sm;
    } catch (Exception e) {
      throw new IllegalStateException("Cannot build intake state machine " + machineId, e);
    }
  }

  static void configure(StateMachineBuilder.Builder<IntakeState, IntakeEvent> builder)
    throws Exception {
    builder.configureStates()
      .withStates()
      .initial(IntakeState.UNINITIALIZED)
      .states(EnumSet.allOf(IntakeState.class));

    var transitions = builder.configureTransitions();
    for (IntakeState source : IntakeState.values()) {
      transitions.withExternal()
        .source(source).target(IntakeState.COLLECTING)
        .event(IntakeEvent.SELECT_ACTION);
    }
    transitions
      .withExternal()
      .source(IntakeState.COLLECTING).target(IntakeState.COLLECTED)
      .event(IntakeEvent.COLLECT)
      .and()
      .withExternal()
      .source(IntakeState.COLLECTED).target(IntakeState.COLLECTED)
      .event(IntakeEvent.COLLECT)
      .and()
      .withExternal()
      .source(IntakeState.SUBMITTED).target(IntakeState.COLLECTED)
      .event(IntakeEvent.COLLECT)
      .and()
      .withExternal()
      .source(IntakeState.COLLECTED).target(IntakeState.SUBMITTED)
      .event(IntakeEvent.SUBMIT);
  }

  public IntakeState currentState(StateMachine<IntakeState, IntakeEvent> sm) {
    return sm.getState().getId();
  }

  /**
   * Send an event and wait for the transition. Returns false when the current state rejects it.
   */
  public boolean sendEvent(StateMachine<IntakeState, IntakeEvent> sm, IntakeEvent event) {
    IntakeState before = currentState(sm);
    StateMachineEventResult<IntakeState, IntakeEvent> result = sm
      .sendEvent(Mono.just(MessageBuilder.withPayload(event).build()))
      .blockFirst();

    boolean accepted = result != null
      && result.getResultType() == StateMachineEventResult.ResultType.ACCEPTED;
    if (accepted) {
      log.debug("Intake event {} accepted: {} -> {}", event, before, currentState(sm));
    } else {
      log.warn("Intake event {} rejected in state {}", event, before);
    }
    return accepted;
  }
}
