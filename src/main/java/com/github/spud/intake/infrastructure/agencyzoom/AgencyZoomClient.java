package com.github.spud.intake.infrastructure.agencyzoom;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.spud.intake.application.config.AgencyZoomProperties;
import com.github.spud.intake.domain.common.ExternalCallFailedException;
import com.github.spud.intake.domain.crm.CrmGateway;
import com.github.spud.intake.util.JsonUtils;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * AgencyZoom REST client. Lead data keys outside the lead schema are sent as custom fields.
 */
@Slf4j
@Component
public class AgencyZoomClient implements CrmGateway {

  /**
   * Optional lead fields the create endpoint accepts as top-level keys
   */
  static final List<String> OPTIONAL_FIELDS = List.of(
    "secondaryEmail", "secondaryPhone", "notes", "contactDate", "soldDate", "assignmentGroupId",
    "xDate", "quoteDate", "csrId", "streetAddress", "streetAddressLine2", "city", "state",
    "country", "zip", "agencyNumber", "departmentCode", "groupCode");

  private static final Set<String> MAPPED_FIELDS = Set.of(
    "firstname", "lastname", "first_name", "last_name", "email", "phone", "pipelineId",
    "stageId", "leadSourceId", "assignTo");

  private static final TypeReference<List<Map<String, Object>>> CONTACT_LIST =
    new TypeReference<>() {
    };

  private final RestClient restClient;

  private final AgencyZoomProperties properties;

  public AgencyZoomClient(@Qualifier("agencyZoomRestClient") RestClient restClient,
    AgencyZoomProperties properties) {
    this.restClient = restClient;
    this.properties = properties;
    log.info("AgencyZoomClient initialized: baseUrl={}, apiKeyConfigured={}",
      properties.normalizedBaseUrl(), properties.hasApiKey());
  }

  @Override
  public String createLead(Map<String, Object> leadData) {
    requireApiKey("create lead");
    ObjectNode payload = toPayload(leadData);
    log.debug("AgencyZoom create lead request: {}", payload);

    String body;
    try {
      body = restClient.post()
        .uri(properties.normalizedBaseUrl() + "/api/leads/create")
        .header(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey())
        .contentType(MediaType.APPLICATION_JSON)
        .accept(MediaType.APPLICATION_JSON)
        .body(JsonUtils.toJson(payload))
        .retrieve()
        .body(String.class);
    } catch (RestClientException e) {
      log.error("AgencyZoom create lead failed: {}", e.getMessage());
      throw new ExternalCallFailedException("AgencyZoom create lead failed: " + e.getMessage(), e);
    }

    String leadId = leadId(body);
    log.info("AgencyZoom lead created: id={}, email={}", leadId, payload.path("email").asText());
    return leadId;
  }

  @Override
  public List<Map<String, Object>> searchContactsByPhone(String phone) {
    return searchContacts("phone", phone);
  }

  @Override
  public List<Map<String, Object>> searchContactsByEmail(String email) {
    return searchContacts("email", email);
  }

  private List<Map<String, Object>> searchContacts(String key, String value) {
    requireApiKey("search contacts");
    String body;
    try {
      body = restClient.get()
        .uri(properties.normalizedBaseUrl() + "/contacts/search?{key}={value}", key, value)
        .header(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey())
        .accept(MediaType.APPLICATION_JSON)
        .retrieve()
        .body(String.class);
    } catch (RestClientException e) {
      log.error("AgencyZoom contact search by {} failed: {}", key, e.getMessage());
      throw new ExternalCallFailedException("AgencyZoom contact search failed: " + e.getMessage(),
        e);
    }

    JsonNode root = body == null || body.isBlank() ? null : JsonUtils.readTree(body);
    JsonNode contacts = root == null ? null : root.isArray() ? root : root.path("contacts");
    if (contacts == null || !contacts.isArray()) {
      log.info("AgencyZoom contact search by {} returned no contacts", key);
      return List.of();
    }
    List<Map<String, Object>> result = JsonUtils.convert(contacts, CONTACT_LIST);
    log.info("AgencyZoom contact search by {} returned {} contact(s)", key, result.size());
    return result;
  }

  ObjectNode toPayload(Map<String, Object> leadData) {
    ObjectNode payload = JsonUtils.objectMapper().createObjectNode();
    payload.put("firstname", firstText(leadData, "firstname", "first_name"));
    payload.put("lastname", firstText(leadData, "lastname", "last_name"));
    payload.put("email", firstText(leadData, "email"));
    payload.put("phone", firstText(leadData, "phone"));
    payload.put("pipelineId", properties.getPipelineId());
    payload.put("stageId", properties.getStageId());
    payload.put("leadSourceId", properties.getLeadSourceId());
    payload.put("assignTo", properties.getAssignTo());

    for (String field : OPTIONAL_FIELDS) {
      Object value = leadData.get(field);
      if (value != null) {
        payload.set(field, JsonUtils.objectMapper().valueToTree(value));
      }
    }

    ArrayNode customFields = JsonUtils.objectMapper().createArrayNode();
    leadData.forEach((field, value) -> {
      if (value == null || MAPPED_FIELDS.contains(field) || OPTIONAL_FIELDS.contains(field)) {
        return;
      }
      ObjectNode custom = customFields.addObject();
      custom.put("fieldName", field);
      ArrayNode values = custom.putArray("fieldValue");
      if (value instanceof List<?> list) {
        list.forEach(item -> values.add(String.valueOf(item)));
      } else {
        values.add(String.valueOf(value));
      }
    });
    if (!customFields.isEmpty()) {
      payload.set("customFields", customFields);
    }
    return payload;
  }

  private void requireApiKey(String operation) {
    if (!properties.hasApiKey()) {
      log.error("Cannot {}: AgencyZoom API key not configured", operation);
      throw new ExternalCallFailedException("AgencyZoom API key not configured");
    }
  }

  private static String firstText(Map<String, Object> data, String... keys) {
    for (String key : keys) {
      Object value = data.get(key);
      if (value != null && !String.valueOf(value).isBlank()) {
        return String.valueOf(value);
      }
    }
    return "";
  }

  /**
   * Lead id from the create response. Falls back to the raw body when no id field is present.
   */
  private static String leadId(String body) {
    if (body == null || body.isBlank()) {
      throw new ExternalCallFailedException("AgencyZoom create lead returned an empty response");
    }
    JsonNode root = JsonUtils.readTree(body);
    for (String field : List.of("id", "leadId")) {
      JsonNode id = root.path(field);
      if (!id.isMissingNode() && !id.isNull()) {
        return id.asText();
      }
    }
    JsonNode nested = root.path("lead").path("id");
    return nested.isMissingNode() || nested.isNull() ? root.toString() : nested.asText();
  }
}
