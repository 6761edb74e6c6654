package com.github.spud.intake.domain.intake;

import com.github.spud.intake.domain.crm.LeadSubmissionAdapter;
import com.github.spud.intake.domain.crm.SubmitResult;
import com.github.spud.intake.domain.intake.record.AutoRecord;
import com.github.spud.intake.domain.intake.record.CommercialRecord;
import com.github.spud.intake.domain.intake.record.FloodRecord;
import com.github.spud.intake.domain.intake.record.HomeRecord;
import com.github.spud.intake.domain.intake.record.InsuredRecord;
import com.github.spud.intake.domain.intake.record.LifeRecord;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.statemachine.StateMachine;

/**
 * Per-thread intake workflow. Every operation returns an {@link IntakeOutcome}; bad input and
 * out-of-order calls come back as guidance text so the conversation can carry on.
 * <p>
 * Not thread safe. Callers hold the owning thread's lock.
 */
@Slf4j
public class IntakeSession {

  static final DateTimeFormatter SESSION_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

  @Getter
  private final String threadId;

  @Getter
  private final String sessionId;

  private final Validator validator;

  private final IntakeStateMachineDriver driver;

  private final StateMachine<IntakeState, IntakeEvent> stateMachine;

  private final IntakeRecordStore recordStore;

  private final LeadSubmissionAdapter leadSubmissionAdapter;

  private final Clock clock;

  private ActionType actionType;

  private InsuranceType insuranceType;

  private InsuredRecord collectedRecord;

  public IntakeSession(String threadId, Validator validator, IntakeStateMachineDriver driver,
    IntakeRecordStore recordStore, LeadSubmissionAdapter leadSubmissionAdapter, Clock clock) {
    this.threadId = threadId;
    this.clock = clock;
    this.sessionId = LocalDateTime.now(clock).format(SESSION_TIMESTAMP) + "_"
      + UUID.randomUUID().toString().substring(0, 8);
    this.validator = validator;
    this.driver = driver;
    this.stateMachine = driver.create("intake-" + sessionId);
    this.recordStore = recordStore;
    this.leadSubmissionAdapter = leadSubmissionAdapter;
    log.info("Intake session {} created for thread {}", sessionId, threadId);
  }

  public IntakeState getState() {
    return driver.currentState(stateMachine);
  }

  public Optional<ActionType> getActionType() {
    return Optional.ofNullable(actionType);
  }

  public Optional<InsuranceType> getInsuranceType() {
    return Optional.ofNullable(insuranceType);
  }

  public Optional<InsuredRecord> getCollectedRecord() {
    return Optional.ofNullable(collectedRecord);
  }

  public boolean isSubmitted() {
    return getState() == IntakeState.SUBMITTED;
  }

  public IntakeOutcome setUserAction(String action, String type) {
    Optional<ActionType> parsedAction = ActionType.fromWire(action);
    if (parsedAction.isEmpty()) {
      return IntakeOutcome.failure(IntakeErrorKind.INVALID_ACTION_TYPE,
        "Invalid action type. Please specify 'add' or 'update'.");
    }
    Optional<InsuranceType> parsedType = InsuranceType.fromWire(type);
    if (parsedType.isEmpty()) {
      return IntakeOutcome.failure(IntakeErrorKind.INVALID_INSURANCE_TYPE,
        "Invalid insurance type. Please choose from: home, auto, flood, life, or commercial.");
    }

    if (collectedRecord != null && collectedRecord.insuranceType() != parsedType.get()) {
      log.info("Session {} switching from {} to {}, dropping collected record", sessionId,
        collectedRecord.insuranceType().wire(), parsedType.get().wire());
      collectedRecord = null;
    }
    if (getState() == IntakeState.SUBMITTED) {
      collectedRecord = null;
    }
    driver.sendEvent(stateMachine, IntakeEvent.SELECT_ACTION);
    if (collectedRecord != null) {
      // same type re-selected, keep what was already collected
      driver.sendEvent(stateMachine, IntakeEvent.COLLECT);
    }
    actionType = parsedAction.get();
    insuranceType = parsedType.get();

    log.info("Session {} action set: {} {}", sessionId, actionType.wire(), insuranceType.wire());
    return IntakeOutcome.ok("Great! I'll help you " + actionType.wire() + " " + insuranceType.wire()
      + " insurance. Let me collect the necessary information from you.");
  }

  public IntakeOutcome collectHomeData(Supplier<HomeRecord> source) {
    return collect(InsuranceType.HOME, source);
  }

  public IntakeOutcome collectAutoData(Supplier<AutoRecord> source) {
    return collect(InsuranceType.AUTO, source);
  }

  public IntakeOutcome collectFloodData(Supplier<FloodRecord> source) {
    return collect(InsuranceType.FLOOD, source);
  }

  public IntakeOutcome collectLifeData(Supplier<LifeRecord> source) {
    return collect(InsuranceType.LIFE, source);
  }

  public IntakeOutcome collectCommercialData(Supplier<CommercialRecord> source) {
    return collect(InsuranceType.COMMERCIAL, source);
  }

  /**
   * Build the record from tool arguments, validate it and store it for the active type. The
   * source runs only after the workflow checks pass, so argument errors for the wrong type are
   * never reported.
   */
  IntakeOutcome collect(InsuranceType type, Supplier<? extends InsuredRecord> source) {
    if (insuranceType == null) {
      return noActionSet();
    }
    if (insuranceType != type) {
      return IntakeOutcome.failure(IntakeErrorKind.WRONG_INSURANCE_TYPE,
        "We're currently working on a " + insuranceType.wire() + " insurance request, so I can't"
          + " take " + type.wire() + " insurance details right now. If you'd like to switch to "
          + type.wire() + " insurance, just let me know.");
    }

    InsuredRecord candidate;
    try {
      candidate = source.get();
    } catch (InvalidFieldException e) {
      log.warn("Session {} rejected {} data: {}", sessionId, type.wire(), e.getMessage());
      return invalid(e.getMessage());
    }

    Set<ConstraintViolation<InsuredRecord>> violations = validator.validate(candidate);
    if (!violations.isEmpty()) {
      String problems = violations.stream()
        .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
        .map(v -> v.getPropertyPath() + " " + v.getMessage())
        .collect(Collectors.joining("; "));
      log.warn("Session {} rejected {} data: {}", sessionId, type.wire(), problems);
      return invalid(problems);
    }

    collectedRecord = candidate;
    driver.sendEvent(stateMachine, IntakeEvent.COLLECT);
    log.info("Session {} collected {} insurance data", sessionId, type.wire());
    log.debug("Collected record: {}", candidate);

    boolean saved = recordStore.saveSnapshot(IntakeSnapshot.builder()
      .sessionId(sessionId)
      .action(actionType)
      .insuranceType(type)
      .record(candidate)
      .build());
    if (!saved) {
      return IntakeOutcome.ok("I've collected your " + type.wire() + " insurance information, but"
        + " there was an issue saving it. The data is still stored and can be submitted.");
    }
    return IntakeOutcome.ok(type.confirmationLead() + " I've collected all your " + type.wire()
      + " insurance information. Your quote request is ready to be submitted.");
  }

  /**
   * Persist the collected record as a quote request, then hand it to the CRM once. A CRM
   * failure is recorded in the envelope and does not undo the submission.
   */
  public IntakeOutcome submitQuoteRequest() {
    if (insuranceType == null) {
      return noActionSet();
    }
    if (getState() == IntakeState.SUBMITTED) {
      return IntakeOutcome.failure(IntakeErrorKind.ALREADY_SUBMITTED,
        "Your " + insuranceType.wire() + " insurance quote request has already been submitted."
          + " Is there anything else I can help you with today?");
    }
    if (collectedRecord == null) {
      return nothingCollected();
    }

    QuoteSubmission submission = QuoteSubmission.builder()
      .submissionTimestamp(LocalDateTime.now(clock).format(SESSION_TIMESTAMP))
      .sessionId(sessionId)
      .threadId(threadId)
      .crmStatus("pending")
      .quoteRequest(QuoteSubmission.QuoteRequest.builder()
        .insuranceType(insuranceType)
        .action(actionType)
        .record(collectedRecord)
        .build())
      .build();
    if (!recordStore.saveSubmission(submission)) {
      log.warn("Session {} submission could not be written locally", sessionId);
    }

    SubmitResult crmResult = leadSubmissionAdapter.submit(collectedRecord, leadNotes());
    recordStore.saveSubmission(submission.toBuilder().crmStatus(crmResult.statusLine()).build());

    driver.sendEvent(stateMachine, IntakeEvent.SUBMIT);
    log.info("Session {} submitted {} quote request, crm={}", sessionId, insuranceType.wire(),
      crmResult.statusLine());

    StringBuilder message = new StringBuilder("Perfect! Your ")
      .append(insuranceType.wire())
      .append(" insurance quote request has been submitted successfully.");
    if (crmResult.isOk()) {
      message.append(" Your information has also been shared with our agency team.");
    }
    message.append(" Our team will review your information and contact you shortly with a")
      .append(" personalized quote. Is there anything else I can help you with today?");
    return IntakeOutcome.ok(message.toString());
  }

  /**
   * Push the collected record to the CRM on request, independent of quote submission
   */
  public IntakeOutcome submitCollectedDataToCrm() {
    if (insuranceType == null) {
      return IntakeOutcome.failure(IntakeErrorKind.NO_ACTION_SET,
        "No insurance data has been collected yet. Please collect insurance information first.");
    }
    if (collectedRecord == null) {
      return IntakeOutcome.failure(IntakeErrorKind.NOTHING_COLLECTED,
        "No " + insuranceType.wire() + " insurance data found. Please collect the information"
          + " first.");
    }
    SubmitResult result = leadSubmissionAdapter.submit(collectedRecord, leadNotes());
    if (!result.isOk()) {
      return IntakeOutcome.failure(IntakeErrorKind.CRM_SUBMISSION_FAILED,
        "Failed to submit data to AgencyZoom. The information is saved and can be submitted"
          + " manually.");
    }
    return IntakeOutcome.ok("Excellent! I've successfully submitted all your "
      + insuranceType.wire() + " insurance information to AgencyZoom. Our team will follow up"
      + " with you shortly!");
  }

  private String leadNotes() {
    return "Lead collected via AI chatbot. Thread ID: " + threadId + ", Session: " + sessionId;
  }

  private IntakeOutcome invalid(String problems) {
    return IntakeOutcome.failure(IntakeErrorKind.VALIDATION_ERROR,
      "I couldn't accept that information: " + problems
        + ". Please verify the details and try again.");
  }

  private IntakeOutcome noActionSet() {
    return IntakeOutcome.failure(IntakeErrorKind.NO_ACTION_SET,
      "No insurance type has been set. Please start by telling me what type of insurance you"
        + " need.");
  }

  private IntakeOutcome nothingCollected() {
    return IntakeOutcome.failure(IntakeErrorKind.NOTHING_COLLECTED,
      "I haven't collected the " + insuranceType.wire() + " insurance information yet. Please"
        + " provide the required details first.");
  }
}
