package com.github.spud.intake.domain.conversation;

import com.github.spud.intake.domain.crm.CrmGateway;
import com.github.spud.intake.domain.crm.LeadSubmissionAdapter;
import com.github.spud.intake.domain.intake.IntakeRecordStore;
import com.github.spud.intake.domain.intake.IntakeSession;
import com.github.spud.intake.domain.intake.IntakeStateMachineDriver;
import com.github.spud.intake.domain.policy.PolicyBackend;
import com.github.spud.intake.domain.policy.PolicyLookupSession;
import jakarta.validation.Validator;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ThreadServicesFactory {

  private final Validator validator;

  private final IntakeStateMachineDriver stateMachineDriver;

  private final IntakeRecordStore recordStore;

  private final LeadSubmissionAdapter leadSubmissionAdapter;

  private final PolicyBackend policyBackend;

  private final CrmGateway crmGateway;

  private final Clock clock;

  public ThreadServices create(String threadId) {
    return ThreadServices.builder()
      .threadId(threadId)
      .intake(new IntakeSession(threadId, validator, stateMachineDriver, recordStore,
        leadSubmissionAdapter, clock))
      .policies(new PolicyLookupSession(policyBackend))
      .crm(crmGateway)
      .build();
  }
}
