package com.github.spud.intake.domain.conversation;

import com.github.spud.intake.domain.crm.CrmGateway;
import com.github.spud.intake.domain.intake.IntakeSession;
import com.github.spud.intake.domain.policy.PolicyLookupSession;
import lombok.Builder;
import lombok.Getter;

/**
 * Per-thread service bundle handed to tool handlers. Created with the thread and dropped with it.
 */
@Getter
@Builder
public class ThreadServices {

  private final String threadId;

  private final IntakeSession intake;

  private final PolicyLookupSession policies;

  private final CrmGateway crm;
}
