package com.polybot.finder.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.experimental.UtilityClass;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Maps Gamma market JSON onto {@link MarketRecord}. Each field is defaulted independently so one bad field
 * never discards the record.
 */
@UtilityClass
public class MarketRecordParser {

  private static final List<String> QUESTION_FIELDS = List.of("question", "title", "name");
  private static final List<String> ID_FIELDS = List.of("id", "marketId", "conditionId");
  private static final List<String> VOLUME_FIELDS = List.of("volume", "volumeNum");
  private static final List<String> CLOSE_FIELDS = List.of("endDate", "endDateIso", "closeDate");

  /**
   * Locates the market array in a {@code /markets} payload: either the root array, or a {@code data} /
   * {@code markets} array on a root object.
   *
   * @return empty when the payload has neither shape
   */
  public static Optional<List<JsonNode>> extractMarkets(JsonNode root) {
    if (root == null || root.isNull()) {
      return Optional.empty();
    }
    if (root.isArray()) {
      return Optional.of(asList(root));
    }
    if (root.isObject()) {
      for (String envelope : List.of("data", "markets")) {
        JsonNode arr = root.get(envelope);
        if (arr != null && arr.isArray()) {
          return Optional.of(asList(arr));
        }
      }
    }
    return Optional.empty();
  }

  /**
   * @return empty for entries that are not objects or carry no question text
   */
  public static Optional<MarketRecord> parse(JsonNode market, ObjectMapper objectMapper) {
    if (market == null || !market.isObject()) {
      return Optional.empty();
    }
    String question = firstText(market, QUESTION_FIELDS);
    if (question == null || question.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(new MarketRecord(
        trimmed(firstText(market, ID_FIELDS)),
        question.trim(),
        trimmed(text(market, "slug")),
        outcomePrices(market.get("outcomePrices"), objectMapper),
        volume(market),
        closeTime(market),
        text(market, "description"),
        market.path("closed").asBoolean(false)
    ));
  }

  static MarketRecord.OutcomePrices outcomePrices(JsonNode node, ObjectMapper objectMapper) {
    List<Double> prices = parseDoubleArray(node, objectMapper);
    if (prices.isEmpty()) {
      return MarketRecord.OutcomePrices.UNKNOWN;
    }
    double first = prices.get(0);
    double second = prices.size() > 1 ? prices.get(1) : 0.0;
    return new MarketRecord.OutcomePrices(first, second);
  }

  static BigDecimal volume(JsonNode market) {
    for (String field : VOLUME_FIELDS) {
      BigDecimal parsed = parseBigDecimal(market.get(field));
      if (parsed != null) {
        return parsed;
      }
    }
    return BigDecimal.ZERO;
  }

  static Instant closeTime(JsonNode market) {
    for (String field : CLOSE_FIELDS) {
      Instant parsed = parseInstant(market.get(field));
      if (parsed != null) {
        return parsed;
      }
    }
    return null;
  }

  private static List<JsonNode> asList(JsonNode arrayNode) {
    List<JsonNode> list = new ArrayList<>(arrayNode.size());
    for (JsonNode n : arrayNode) {
      list.add(n);
    }
    return list;
  }

  private static List<Double> parseDoubleArray(JsonNode node, ObjectMapper objectMapper) {
    if (node == null || node.isNull()) {
      return List.of();
    }
    if (node.isArray()) {
      List<Double> out = new ArrayList<>(node.size());
      for (JsonNode n : node) {
        BigDecimal value = parseBigDecimal(n);
        out.add(value == null ? 0.0 : value.doubleValue());
      }
      return out;
    }
    if (node.isTextual()) {
      String raw = node.asText();
      if (raw.isBlank()) {
        return List.of();
      }
      // Gamma ships outcomePrices as a JSON-encoded string, e.g. "[\"0.42\", \"0.58\"]".
      try {
        JsonNode parsed = objectMapper.readTree(raw);
        return parsed.isArray() ? parseDoubleArray(parsed, objectMapper) : List.of();
      } catch (Exception ignored) {
        return List.of();
      }
    }
    return List.of();
  }

  private static String firstText(JsonNode node, List<String> keys) {
    for (String k : keys) {
      String v = text(node, k);
      if (v != null && !v.isBlank()) {
        return v;
      }
    }
    return null;
  }

  private static String text(JsonNode node, String field) {
    JsonNode v = node.get(field);
    if (v == null || v.isNull() || v.isContainerNode()) {
      return null;
    }
    return v.asText();
  }

  private static String trimmed(String s) {
    return s == null ? null : s.trim();
  }

  private static BigDecimal parseBigDecimal(JsonNode node) {
    if (node == null || node.isNull()) {
      return null;
    }
    if (node.isNumber()) {
      // 1e400 arrives as an infinite DoubleNode, which has no decimal form
      if (node.isFloatingPointNumber() && !Double.isFinite(node.doubleValue())) {
        return null;
      }
      return node.decimalValue();
    }
    if (node.isTextual()) {
      String s = node.asText().trim();
      if (s.isEmpty()) {
        return null;
      }
      try {
        return new BigDecimal(s);
      } catch (NumberFormatException ignored) {
        return null;
      }
    }
    return null;
  }

  private static Instant parseInstant(JsonNode node) {
    if (node == null || node.isNull()) {
      return null;
    }
    if (node.isNumber()) {
      return fromEpoch(node.asLong());
    }
    if (!node.isTextual()) {
      return null;
    }
    String s = node.asText().trim();
    if (s.isEmpty()) {
      return null;
    }
    try {
      return Instant.parse(s);
    } catch (Exception ignored) {
      // not ISO-8601, maybe epoch digits
    }
    if (s.chars().allMatch(Character::isDigit)) {
      try {
        return fromEpoch(Long.parseLong(s));
      } catch (NumberFormatException ignored) {
        return null;
      }
    }
    return null;
  }

  private static Instant fromEpoch(long value) {
    if (value <= 0) {
      return null;
    }
    // Heuristic: values < 10^12 are seconds, otherwise millis.
    return value < 1_000_000_000_000L ? Instant.ofEpochSecond(value) : Instant.ofEpochMilli(value);
  }
}
