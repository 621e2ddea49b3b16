package com.polybot.finder.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class MarketRecordParserTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void parsesGammaMarketWithEncodedPrices() throws Exception {
    JsonNode market = objectMapper.readTree("""
        {
          "id": "516710",
          "question": "Will Trump end Department of Education in 2025?",
          "slug": "will-trump-end-department-of-education-in-2025",
          "outcomePrices": "[\\"0.035\\", \\"0.965\\"]",
          "volume": "1234567.89",
          "endDate": "2025-12-31T12:00:00Z",
          "description": "Resolves YES if ...",
          "closed": false
        }
        """);

    MarketRecord record = MarketRecordParser.parse(market, objectMapper).orElseThrow();

    assertThat(record.id()).isEqualTo("516710");
    assertThat(record.question()).isEqualTo("Will Trump end Department of Education in 2025?");
    assertThat(record.slug()).isEqualTo("will-trump-end-department-of-education-in-2025");
    assertThat(record.outcomePrices().first()).isEqualTo(0.035);
    assertThat(record.outcomePrices().second()).isEqualTo(0.965);
    assertThat(record.volume()).isEqualByComparingTo("1234567.89");
    assertThat(record.closeTime()).contains(Instant.parse("2025-12-31T12:00:00Z"));
    assertThat(record.description()).isEqualTo("Resolves YES if ...");
    assertThat(record.closed()).isFalse();
  }

  @Test
  void defaultsEveryMissingField() throws Exception {
    JsonNode market = objectMapper.readTree("{\"question\": \"Fed rate hike in 2025?\"}");

    MarketRecord record = MarketRecordParser.parse(market, objectMapper).orElseThrow();

    assertThat(record.id()).isEmpty();
    assertThat(record.slug()).isEmpty();
    assertThat(record.outcomePrices()).isEqualTo(MarketRecord.OutcomePrices.UNKNOWN);
    assertThat(record.volume()).isEqualByComparingTo(BigDecimal.ZERO);
    assertThat(record.closeTime()).isEmpty();
    assertThat(record.description()).isEmpty();
    assertThat(record.closed()).isFalse();
  }

  @Test
  void absorbsBrokenFieldValues() throws Exception {
    JsonNode market = objectMapper.readTree("""
        {
          "title": "  Recession in 2025?  ",
          "conditionId": "0xabc",
          "outcomePrices": "not json",
          "volume": -5,
          "volumeNum": 12,
          "endDate": "soon",
          "closeDate": 1767225600,
          "closed": "yes"
        }
        """);

    MarketRecord record = MarketRecordParser.parse(market, objectMapper).orElseThrow();

    assertThat(record.question()).isEqualTo("Recession in 2025?");
    assertThat(record.id()).isEqualTo("0xabc");
    assertThat(record.outcomePrices()).isEqualTo(MarketRecord.OutcomePrices.UNKNOWN);
    assertThat(record.volume()).isEqualByComparingTo(BigDecimal.ZERO);
    assertThat(record.closeTime()).contains(Instant.ofEpochSecond(1767225600L));
    assertThat(record.closed()).isFalse();
  }

  @Test
  void outOfRangePricesDefaultToZero() throws Exception {
    JsonNode market = objectMapper.readTree("{\"question\": \"q\", \"outcomePrices\": [1.7, \"0.4\"]}");

    MarketRecord record = MarketRecordParser.parse(market, objectMapper).orElseThrow();

    assertThat(record.outcomePrices().first()).isEqualTo(0.0);
    assertThat(record.outcomePrices().second()).isEqualTo(0.4);
  }

  @Test
  void infiniteNumbersDefaultLikeOtherBrokenValues() throws Exception {
    JsonNode market = objectMapper.readTree("""
        {"question": "Huge volume?", "volume": 1e400, "volumeNum": 25, "outcomePrices": [1e400, 0.6]}
        """);

    MarketRecord record = MarketRecordParser.parse(market, objectMapper).orElseThrow();

    assertThat(record.volume()).isEqualByComparingTo(new BigDecimal("25"));
    assertThat(record.outcomePrices().first()).isEqualTo(0.0);
    assertThat(record.outcomePrices().second()).isEqualTo(0.6);
  }

  @Test
  void dropsEntriesWithoutQuestion() throws Exception {
    assertThat(MarketRecordParser.parse(objectMapper.readTree("{\"slug\": \"x\"}"), objectMapper)).isEmpty();
    assertThat(MarketRecordParser.parse(objectMapper.readTree("{\"question\": \"   \"}"), objectMapper)).isEmpty();
    assertThat(MarketRecordParser.parse(objectMapper.readTree("42"), objectMapper)).isEmpty();
  }

  @Test
  void extractsMarketsFromArrayOrEnvelope() throws Exception {
    assertThat(MarketRecordParser.extractMarkets(objectMapper.readTree("[{}, {}]"))).hasValueSatisfying(l -> assertThat(l).hasSize(2));
    assertThat(MarketRecordParser.extractMarkets(objectMapper.readTree("{\"data\": [{}]}"))).hasValueSatisfying(l -> assertThat(l).hasSize(1));
    assertThat(MarketRecordParser.extractMarkets(objectMapper.readTree("{\"markets\": []}"))).contains(List.of());
  }

  @Test
  void rejectsPayloadsWithoutMarketArray() throws Exception {
    Optional<List<JsonNode>> extracted = MarketRecordParser.extractMarkets(objectMapper.readTree("{\"error\": \"nope\"}"));
    assertThat(extracted).isEmpty();
    assertThat(MarketRecordParser.extractMarkets(objectMapper.readTree("\"text\""))).isEmpty();
  }
}
