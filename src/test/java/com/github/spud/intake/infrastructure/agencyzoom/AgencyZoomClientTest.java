package com.github.spud.intake.infrastructure.agencyzoom;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.spud.intake.application.config.AgencyZoomProperties;
import com.github.spud.intake.domain.common.ExternalCallFailedException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

/**
 * AgencyZoom 客户端测试
 */
class AgencyZoomClientTest {

  private MockRestServiceServer mockServer;
  private AgencyZoomProperties properties;
  private AgencyZoomClient client;

  @BeforeEach
  void setUp() {
    RestClient.Builder restClientBuilder = RestClient.builder();
    mockServer = MockRestServiceServer.bindTo(restClientBuilder).build();

    properties = new AgencyZoomProperties();
    properties.setBaseUrl("https://api.example.com/");
    properties.setApiKey("secret-key");

    client = new AgencyZoomClient(restClientBuilder.build(), properties);
  }

  private static Map<String, Object> lead() {
    Map<String, Object> lead = new LinkedHashMap<>();
    lead.put("first_name", "Jane");
    lead.put("last_name", "Doe");
    lead.put("email", "jane@example.com");
    lead.put("phone", "555-0100");
    lead.put("insurance_type", "flood");
    lead.put("notes", "Lead collected via AI chatbot");
    lead.put("city", "Springfield");
    lead.put("vin", null);
    return lead;
  }

  @Test
  void createsLeadAndReturnsId() {
    mockServer.expect(requestTo("https://api.example.com/v1/api/leads/create"))
      .andExpect(method(HttpMethod.POST))
      .andExpect(header("Authorization", "Bearer secret-key"))
      .andExpect(jsonPath("$.firstname").value("Jane"))
      .andExpect(jsonPath("$.lastname").value("Doe"))
      .andExpect(jsonPath("$.pipelineId").value(3816))
      .andExpect(jsonPath("$.city").value("Springfield"))
      .andExpect(jsonPath("$.customFields[0].fieldName").value("insurance_type"))
      .andExpect(jsonPath("$.customFields[0].fieldValue[0]").value("flood"))
      .andRespond(withSuccess("{\"id\": 42}", MediaType.APPLICATION_JSON));

    assertThat(client.createLead(lead())).isEqualTo("42");
    mockServer.verify();
  }

  @Test
  void readsNestedLeadId() {
    mockServer.expect(requestTo("https://api.example.com/v1/api/leads/create"))
      .andRespond(withSuccess("{\"lead\": {\"id\": \"L-7\"}}", MediaType.APPLICATION_JSON));

    assertThat(client.createLead(lead())).isEqualTo("L-7");
  }

  @Test
  void serverErrorIsACallFailure() {
    mockServer.expect(requestTo("https://api.example.com/v1/api/leads/create"))
      .andRespond(withServerError());

    assertThatThrownBy(() -> client.createLead(lead()))
      .isInstanceOf(ExternalCallFailedException.class)
      .hasMessageContaining("AgencyZoom create lead failed");
  }

  @Test
  void missingApiKeyFailsWithoutCalling() {
    properties.setApiKey("");

    assertThatThrownBy(() -> client.createLead(lead()))
      .isInstanceOf(ExternalCallFailedException.class)
      .hasMessage("AgencyZoom API key not configured");
    assertThatThrownBy(() -> client.searchContactsByPhone("555-0100"))
      .isInstanceOf(ExternalCallFailedException.class);
    mockServer.verify();
  }

  @Test
  void searchReadsContactsWrapper() {
    mockServer.expect(requestTo("https://api.example.com/v1/contacts/search?phone=555-0100"))
      .andExpect(method(HttpMethod.GET))
      .andRespond(withSuccess("{\"contacts\": [{\"id\": 1}, {\"id\": 2}]}",
        MediaType.APPLICATION_JSON));

    List<Map<String, Object>> contacts = client.searchContactsByPhone("555-0100");

    assertThat(contacts).hasSize(2);
    assertThat(contacts.get(0)).containsEntry("id", 1);
  }

  @Test
  void searchWithNoMatchesIsEmpty() {
    mockServer.expect(requestTo("https://api.example.com/v1/contacts/search?phone=555-0199"))
      .andRespond(withSuccess("{\"total\": 0}", MediaType.APPLICATION_JSON));

    assertThat(client.searchContactsByPhone("555-0199")).isEmpty();
  }

  @Test
  void payloadSeparatesKnownAndCustomFields() {
    Map<String, Object> lead = lead();
    lead.put("coverages", List.of("building", "contents"));

    ObjectNode payload = client.toPayload(lead);

    assertThat(payload.path("email").asText()).isEqualTo("jane@example.com");
    assertThat(payload.path("assignTo").asLong()).isEqualTo(148687L);
    assertThat(payload.path("notes").asText()).isEqualTo("Lead collected via AI chatbot");
    assertThat(payload.has("first_name")).isFalse();

    JsonNode customFields = payload.path("customFields");
    assertThat(customFields).hasSize(2);
    assertThat(customFields.get(1).path("fieldName").asText()).isEqualTo("coverages");
    assertThat(customFields.get(1).path("fieldValue")).hasSize(2);
  }
}
