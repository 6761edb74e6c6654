package com.github.spud.intake.domain.tools;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.github.spud.intake.domain.common.ExternalCallFailedException;
import com.github.spud.intake.domain.conversation.ThreadServices;
import com.github.spud.intake.domain.crm.CrmGateway;
import com.github.spud.intake.domain.crm.LeadSubmissionAdapter;
import com.github.spud.intake.domain.intake.IntakeRecordStore;
import com.github.spud.intake.domain.intake.IntakeSession;
import com.github.spud.intake.domain.intake.IntakeState;
import com.github.spud.intake.domain.intake.IntakeStateMachineDriver;
import com.github.spud.intake.domain.policy.PolicyBackend;
import com.github.spud.intake.domain.policy.PolicyLookupSession;
import com.github.spud.intake.support.TestRecords;
import com.github.spud.intake.util.JsonUtils;
import jakarta.validation.Validation;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Tool catalog registration and execution
 */
class ToolDispatcherTest {

  private ToolRegistry toolRegistry;
  private ToolDispatcher dispatcher;
  private CrmGateway crmGateway;
  private ThreadServices services;

  @BeforeEach
  void setUp() {
    Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:15:30Z"), ZoneOffset.UTC);
    toolRegistry = new ToolRegistry();
    new IntakeToolsConfig(toolRegistry, clock).registerIntakeTools();
    new BackendToolsConfig(toolRegistry).registerBackendTools();
    dispatcher = new ToolDispatcher(toolRegistry);

    IntakeRecordStore recordStore = mock(IntakeRecordStore.class);
    when(recordStore.saveSnapshot(any())).thenReturn(true);
    crmGateway = mock(CrmGateway.class);
    services = ThreadServices.builder()
      .threadId("thread-1")
      .intake(new IntakeSession("thread-1",
        Validation.buildDefaultValidatorFactory().getValidator(), new IntakeStateMachineDriver(),
        recordStore, new LeadSubmissionAdapter(crmGateway), clock))
      .policies(new PolicyLookupSession(mock(PolicyBackend.class)))
      .crm(crmGateway)
      .build();
  }

  @Test
  void registersTheWholeCatalog() {
    assertThat(toolRegistry.size()).isEqualTo(IntakeTool.values().length);
    for (IntakeTool tool : IntakeTool.values()) {
      assertThat(toolRegistry.getDefinition(tool)).isPresent();
      String schema = toolRegistry.getDefinition(tool).get().inputSchema();
      assertThat(JsonUtils.readTree(schema).path("type").asText()).as(tool.toolName())
        .isEqualTo("object");
    }
  }

  @Test
  void currentTimeUsesClock() {
    ToolDispatcher.ToolExecutionResult result =
      dispatcher.execute("get_current_time", "", services);

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.getResult()).isEqualTo("The current date and time is 2024-05-01 10:15.");
  }

  @Test
  void unknownToolIsReportedAsText() {
    ToolDispatcher.ToolExecutionResult result = dispatcher.execute("delete_everything", "{}",
      services);

    assertThat(result.isSuccess()).isFalse();
    assertThat(result.getResult()).isEqualTo("Unknown function: delete_everything");
  }

  @Test
  void malformedArgumentsAreReportedAsText() {
    ToolDispatcher.ToolExecutionResult result = dispatcher.execute("set_user_action",
      "{\"action_type\": ", services);

    assertThat(result.isSuccess()).isFalse();
    assertThat(result.getResult()).startsWith("Error executing set_user_action: ");
  }

  @Test
  void collectToolDrivesIntakeSession() {
    dispatcher.execute("set_user_action",
      "{\"action_type\": \"add\", \"insurance_type\": \"flood\"}", services);

    ToolDispatcher.ToolExecutionResult missing = dispatcher.execute(
      "collect_flood_insurance_data", "{\"full_name\": \"Jane Doe\"}", services);
    assertThat(missing.isSuccess()).isTrue();
    assertThat(missing.getResult()).startsWith("I couldn't accept that information:");

    ToolDispatcher.ToolExecutionResult collected = dispatcher.execute(
      "collect_flood_insurance_data", TestRecords.floodArguments(), services);
    assertThat(collected.getResult()).contains("I've collected all your flood insurance");
    assertThat(services.getIntake().getState()).isEqualTo(IntakeState.COLLECTED);
  }

  @Test
  void createLeadReportsCrmFailure() {
    when(crmGateway.createLead(anyMap())).thenThrow(new ExternalCallFailedException("down"));

    ToolDispatcher.ToolExecutionResult result = dispatcher.execute("create_agencyzoom_lead",
      "{\"first_name\": \"Jane\", \"last_name\": \"Doe\", \"email\": \"jane@example.com\","
        + " \"phone\": \"555-0100\", \"insurance_type\": \"home\"}", services);

    assertThat(result.getResult())
      .isEqualTo("Failed to create lead in AgencyZoom. Please check the logs for details.");
  }

  @Test
  void contactSearchCountsMatches() {
    when(crmGateway.searchContactsByEmail("jane@example.com"))
      .thenReturn(List.of(Map.of("id", 1), Map.of("id", 2)));

    ToolDispatcher.ToolExecutionResult result = dispatcher.execute(
      "search_agencyzoom_contact_by_email", "{\"email\": \"jane@example.com\"}", services);

    assertThat(result.getResult())
      .isEqualTo("Found 2 contact(s) in AgencyZoom with email jane@example.com.");
  }
}
