package com.github.spud.intake.infrastructure.ams360;

import com.github.spud.intake.domain.common.ExternalCallFailedException;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/**
 * SOAP envelope templates and namespace agnostic DOM helpers for the WSAPI v3 service
 */
final class Ams360Xml {

  static final String SERVICE_NS = "http://www.WSAPI.AMS360.com/v3.0";

  static final String SOAP_ACTION_PREFIX = SERVICE_NS + "/WSAPIServiceContract/";

  private static final String REQUEST_OPEN = "<Request xmlns:a=\"" + SERVICE_NS + "/DataContract\""
    + " xmlns:i=\"http://www.w3.org/2001/XMLSchema-instance\">";

  private Ams360Xml() {
  }

  static String loginEnvelope(String agencyNo, String loginId, String password,
    String employeeCode) {
    String employee = employeeCode == null || employeeCode.isBlank()
      ? "<a:EmployeeCode/>"
      : "<a:EmployeeCode>" + escape(employeeCode) + "</a:EmployeeCode>";
    return "<s:Envelope xmlns:s=\"http://schemas.xmlsoap.org/soap/envelope/\">"
      + "<s:Body>"
      + "<Login xmlns=\"" + SERVICE_NS + "\">"
      + REQUEST_OPEN
      + "<a:AgencyNo>" + escape(agencyNo) + "</a:AgencyNo>"
      + "<a:LoginId>" + escape(loginId) + "</a:LoginId>"
      + "<a:Password>" + escape(password) + "</a:Password>"
      + employee
      + "</Request>"
      + "</Login>"
      + "</s:Body>"
      + "</s:Envelope>";
  }

  /**
   * Envelope for a ticketed operation whose request holds the given data contract fields
   */
  static String operationEnvelope(String operation, String ticket, Map<String, String> fields) {
    StringBuilder body = new StringBuilder();
    fields.forEach((name, value) ->
      body.append("<a:").append(name).append('>').append(escape(value))
        .append("</a:").append(name).append('>'));
    return "<s:Envelope xmlns:s=\"http://schemas.xmlsoap.org/soap/envelope/\">"
      + "<s:Header>"
      + "<WSAPISession xmlns=\"" + SERVICE_NS + "\">"
      + "<Ticket>" + escape(ticket) + "</Ticket>"
      + "</WSAPISession>"
      + "</s:Header>"
      + "<s:Body>"
      + "<" + operation + " xmlns=\"" + SERVICE_NS + "\">"
      + REQUEST_OPEN
      + body
      + "</Request>"
      + "</" + operation + ">"
      + "</s:Body>"
      + "</s:Envelope>";
  }

  static Document parse(String xml) {
    try {
      DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
      factory.setNamespaceAware(true);
      factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
      factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
      factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
      DocumentBuilder builder = factory.newDocumentBuilder();
      return builder.parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
    } catch (Exception e) {
      throw new ExternalCallFailedException("Unreadable AMS360 response: " + e.getMessage(), e);
    }
  }

  static Optional<Element> first(Node scope, String localName) {
    NodeList nodes = elements(scope, localName);
    return nodes.getLength() == 0 ? Optional.empty() : Optional.of((Element) nodes.item(0));
  }

  static List<Element> all(Node scope, String localName) {
    NodeList nodes = elements(scope, localName);
    List<Element> result = new ArrayList<>(nodes.getLength());
    for (int i = 0; i < nodes.getLength(); i++) {
      result.add((Element) nodes.item(i));
    }
    return result;
  }

  /**
   * Trimmed text of the first descendant with the given local name, null when absent or empty
   */
  static String text(Node scope, String localName) {
    return first(scope, localName)
      .map(Node::getTextContent)
      .map(String::trim)
      .filter(s -> !s.isEmpty())
      .orElse(null);
  }

  /**
   * Direct children without element children, by local name
   */
  static Map<String, String> leafValues(Element parent) {
    Map<String, String> values = new LinkedHashMap<>();
    NodeList children = parent.getChildNodes();
    for (int i = 0; i < children.getLength(); i++) {
      if (children.item(i) instanceof Element child && !hasElementChild(child)) {
        String value = child.getTextContent().trim();
        if (!value.isEmpty()) {
          values.put(child.getLocalName(), value);
        }
      }
    }
    return values;
  }

  static String escape(String value) {
    if (value == null) {
      return "";
    }
    StringBuilder sb = new StringBuilder(value.length());
    for (char c : value.toCharArray()) {
      switch (c) {
        case '&':
          sb.append("&amp;");
          break;
        case '<':
          sb.append("&lt;");
          break;
        case '>':
          sb.append("&gt;");
          break;
        case '"':
          sb.append("&quot;");
          break;
        case '\'':
          sb.append("&apos;");
          break;
        default:
          sb.append(c);
      }
    }
    return sb.toString();
  }

  private static NodeList elements(Node scope, String localName) {
    if (scope instanceof Document document) {
      return document.getElementsByTagNameNS("*", localName);
    }
    return ((Element) scope).getElementsByTagNameNS("*", localName);
  }

  private static boolean hasElementChild(Element element) {
    NodeList children = element.getChildNodes();
    for (int i = 0; i < children.getLength(); i++) {
      if (children.item(i).getNodeType() == Node.ELEMENT_NODE) {
        return true;
      }
    }
    return false;
  }
}
