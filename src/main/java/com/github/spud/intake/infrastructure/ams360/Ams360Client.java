package com.github.spud.intake.infrastructure.ams360;

import com.github.spud.intake.application.config.Ams360Properties;
import com.github.spud.intake.domain.common.AuthenticationFailedException;
import com.github.spud.intake.domain.common.ExternalCallFailedException;
import com.github.spud.intake.domain.policy.CustomerDetail;
import com.github.spud.intake.domain.policy.PolicyBackend;
import com.github.spud.intake.domain.policy.PolicyDetail;
import com.github.spud.intake.domain.policy.PolicyReference;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * AMS360 WSAPI v3 SOAP client. Each operation asks the {@link TicketCache} for a ticket first;
 * a fault that rejects the ticket drops it and the operation is retried once with a new one.
 */
@Slf4j
@Component
public class Ams360Client implements PolicyBackend {

  private static final MediaType TEXT_XML = new MediaType("text", "xml", StandardCharsets.UTF_8);

  private final RestClient restClient;

  private final Ams360Properties properties;

  private final TicketCache ticketCache;

  public Ams360Client(@Qualifier("ams360RestClient") RestClient restClient,
    Ams360Properties properties, TicketCache ticketCache) {
    this.restClient = restClient;
    this.properties = properties;
    this.ticketCache = ticketCache;
  }

  public String getValidTicket() {
    return ticketCache.getValidTicket(properties.identity(), this::login);
  }

  /**
   * Login exchange. The ticket comes back in the WSAPISession header or in the login result.
   */
  String login() {
    String envelope = Ams360Xml.loginEnvelope(properties.getAgencyNo(), properties.getLoginId(),
      properties.getPassword(), properties.getEmployeeCode());
    Document response;
    try {
      response = post("Login", envelope);
    } catch (ExternalCallFailedException e) {
      throw new AuthenticationFailedException("AMS360 login failed: " + e.getMessage(), e);
    }
    String ticket = Ams360Xml.text(response, "Ticket");
    if (ticket == null) {
      throw new AuthenticationFailedException("AMS360 login response carried no ticket");
    }
    log.info("AMS360 login succeeded for agency {}", properties.getAgencyNo());
    return ticket;
  }

  @Override
  public Optional<PolicyReference> findPolicyByNumber(String policyNumber) {
    return withTicket("PolicyGetListByPolicyNumber", Map.of("PolicyNumber", policyNumber),
      doc -> Ams360Xml.first(doc, "PolicyInfo")
        .map(info -> PolicyReference.builder()
          .policyNumber(policyNumber)
          .customerId(Ams360Xml.text(info, "CustomerId"))
          .policyId(Ams360Xml.text(info, "PolicyId"))
          .build())
        .filter(ref -> ref.getCustomerId() != null && ref.getPolicyId() != null));
  }

  @Override
  public Optional<PolicyDetail> getPolicy(String policyId) {
    return withTicket("PolicyGet", Map.of("PolicyId", policyId),
      doc -> Ams360Xml.first(doc, "Policy").map(Ams360Client::toPolicyDetail));
  }

  @Override
  public List<PolicyDetail> getCustomerPolicies(String customerId) {
    return withTicket("PolicyGetListByCustomerId", Map.of("CustomerId", customerId),
      doc -> Ams360Xml.all(doc, "PolicyInfo").stream()
        .map(Ams360Client::toPolicyDetail)
        .toList());
  }

  @Override
  public Optional<CustomerDetail> getCustomerDetails(String customerId) {
    return withTicket("CustomerGetById", Map.of("CustomerId", customerId),
      doc -> Ams360Xml.first(doc, "Customer")
        .map(customer -> CustomerDetail.builder()
          .customerId(customerId)
          .attributes(Ams360Xml.leafValues(customer))
          .build()));
  }

  private <T> T withTicket(String operation, Map<String, String> fields,
    Function<Document, T> reader) {
    String ticket = getValidTicket();
    try {
      return reader.apply(invoke(operation, ticket, fields));
    } catch (Ams360FaultException e) {
      if (!e.isAuthenticationRejected()) {
        throw e;
      }
      log.warn("AMS360 rejected ticket on {}: {}, logging in again", operation,
        e.getFaultString());
      ticketCache.invalidate(properties.identity(), ticket);
      return reader.apply(invoke(operation, getValidTicket(), fields));
    }
  }

  private Document invoke(String operation, String ticket, Map<String, String> fields) {
    log.debug("AMS360 {} {}", operation, fields);
    return post(operation, Ams360Xml.operationEnvelope(operation, ticket, fields));
  }

  private Document post(String operation, String envelope) {
    String body;
    try {
      body = restClient.post()
        .uri(properties.getBaseUrl())
        .contentType(TEXT_XML)
        .header("SOAPAction", "\"" + Ams360Xml.SOAP_ACTION_PREFIX + operation + "\"")
        .body(envelope)
        .exchange((request, response) -> {
          String text = StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
          if (!response.getStatusCode().is2xxSuccessful() && !text.contains("Fault")) {
            throw new ExternalCallFailedException("AMS360 " + operation + " returned HTTP "
              + response.getStatusCode().value());
          }
          return text;
        });
    } catch (RestClientException e) {
      throw new ExternalCallFailedException("AMS360 " + operation + " call failed: "
        + e.getMessage(), e);
    }

    Document document = Ams360Xml.parse(body);
    Optional<Element> fault = Ams360Xml.first(document, "Fault");
    if (fault.isPresent()) {
      String reason = Ams360Xml.text(fault.get(), "faultstring");
      if (!StringUtils.hasText(reason)) {
        reason = Ams360Xml.text(fault.get(), "Text");
      }
      throw new Ams360FaultException(operation, reason != null ? reason : "unknown fault");
    }
    return document;
  }

  private static PolicyDetail toPolicyDetail(Element policy) {
    return PolicyDetail.builder()
      .policyNumber(Ams360Xml.text(policy, "PolicyNumber"))
      .policyId(Ams360Xml.text(policy, "PolicyId"))
      .customerId(Ams360Xml.text(policy, "CustomerId"))
      .typeOfBusiness(Ams360Xml.text(policy, "PolicyTypeOfBusiness"))
      .status(Ams360Xml.text(policy, "PolicyStatus"))
      .effectiveDate(Ams360Xml.text(policy, "PolicyEffectiveDate"))
      .expirationDate(Ams360Xml.text(policy, "PolicyExpirationDate"))
      .fullTermPremium(Ams360Xml.text(policy, "FullTermPremium"))
      .build();
  }
}
