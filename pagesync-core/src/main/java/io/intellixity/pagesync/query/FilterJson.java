package io.intellixity.pagesync.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.*;

/**
 * Canonical JSON reader for filter lists.
 * <p>
 * Accepts either a bare array of groups or an object with a {@code filters} array:
 * <pre>
 * [ {"logic": "AND", "rules": [ {"property": "status", "operator": "equals", "value": "open"} ]} ]
 * </pre>
 */
public final class FilterJson {
  private static final ObjectMapper JSON = new ObjectMapper();

  private FilterJson() {}

  public static List<FilterGroup> read(String json) {
    if (json == null || json.isBlank()) return List.of();
    JsonNode root;
    try {
      root = JSON.readTree(json);
    } catch (JsonProcessingException e) {
      throw new QueryValidationException("Filter JSON is not valid JSON", e);
    }
    return read(root);
  }

  public static List<FilterGroup> read(JsonNode root) {
    if (root == null || root.isNull() || root.isMissingNode()) return List.of();
    JsonNode groups = root.isObject() ? root.get("filters") : root;
    if (groups == null || groups.isNull()) return List.of();
    if (!groups.isArray()) throw new MalformedRuleException("Filter JSON must be an array of groups");

    List<FilterGroup> out = new ArrayList<>();
    for (JsonNode g : groups) {
      if (!g.isObject()) throw new MalformedRuleException("Filter group must be an object");
      Clause logic = Clause.parse(textOrNull(g.get("logic")));
      List<FilterRule> rules = new ArrayList<>();
      JsonNode rs = g.get("rules");
      if (rs != null && !rs.isNull()) {
        if (!rs.isArray()) throw new MalformedRuleException("Group 'rules' must be an array");
        for (JsonNode r : rs) rules.add(readRule(r));
      }
      out.add(new FilterGroup(logic, rules));
    }
    return out;
  }

  private static FilterRule readRule(JsonNode r) {
    if (!r.isObject()) throw new MalformedRuleException("Filter rule must be an object");
    String property = textOrNull(r.get("property"));
    String operator = textOrNull(r.get("operator"));
    if (property == null || operator == null) {
      throw new MalformedRuleException("Each rule must have 'property' and 'operator' keys");
    }
    FilterOperator op = FilterOperator.fromWire(operator);
    return new FilterRule(property, op, toValue(r.get("value")));
  }

  private static Object toValue(JsonNode v) {
    if (v == null || v.isNull() || v.isMissingNode()) return null;
    if (v.isArray()) {
      List<Object> out = new ArrayList<>();
      for (JsonNode x : v) out.add(toValue(x));
      return out;
    }
    if (v.isBoolean()) return v.booleanValue();
    if (v.isIntegralNumber()) return v.canConvertToLong() ? (Object) v.longValue() : v.bigIntegerValue();
    if (v.isNumber()) return v.decimalValue();
    if (v.isTextual()) return v.textValue();
    throw new MalformedRuleException("Unsupported rule value: " + v.getNodeType());
  }

  private static String textOrNull(JsonNode n) {
    if (n == null || n.isNull()) return null;
    String s = n.asText();
    return s.isBlank() ? null : s;
  }
}
