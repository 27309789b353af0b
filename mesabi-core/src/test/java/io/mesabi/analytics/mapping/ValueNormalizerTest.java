package io.mesabi.analytics.mapping;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class ValueNormalizerTest {
  private final ValueNormalizer n = new ValueNormalizer();

  @Test
  void widensWideIntegersAndDecimals() {
    assertEquals(12_345_678_901d, n.normalize(12_345_678_901L));
    assertEquals(12345678901234567890d, n.normalize(new BigInteger("12345678901234567890")));
    assertEquals(1234.5, n.normalize(new BigDecimal("1234.50")));
    assertEquals(42, n.normalize(42));
  }

  @Test
  void parsesOnlyFullyNumericStrings() {
    assertEquals(123.45, n.normalize("123.45"));
    assertEquals(-7d, n.normalize("-7"));
    assertEquals("12abc", n.normalize("12abc"));
    assertEquals("Curitiba", n.normalize("Curitiba"));
    assertEquals("", n.normalize(""));
  }

  @Test
  void rendersTemporalValuesAsIso() {
    assertEquals("2025-01-15T10:30:00", n.normalize(Timestamp.valueOf("2025-01-15 10:30:00")));
    assertEquals("2025-01-15T10:30:00", n.normalize(LocalDateTime.of(2025, 1, 15, 10, 30)));
    assertEquals("2025-01-15", n.normalize(LocalDate.of(2025, 1, 15)));
    assertEquals("2025-01-15T10:30:00Z",
        n.normalize(OffsetDateTime.of(2025, 1, 15, 10, 30, 0, 0, ZoneOffset.UTC)));
    assertEquals("2025-01-15", n.normalize(java.sql.Date.valueOf("2025-01-15")));
  }

  @Test
  void walksCollectionsAndMaps() {
    assertEquals(List.of(1d, "a", 2.5), n.normalize(new Object[] {1L, "a", new BigDecimal("2.5")}));
    assertEquals(List.of(List.of(3d)), n.normalize(List.of(List.of(3L))));

    Map<String, Object> nested = new LinkedHashMap<>();
    nested.put("total", new BigDecimal("10.00"));
    nested.put("empty", Map.of());
    Object out = n.normalize(nested);
    Map<String, Object> expected = new LinkedHashMap<>();
    expected.put("total", 10d);
    expected.put("empty", null);
    assertEquals(expected, out);
  }

  @Test
  void emptyMapIsNull() {
    assertNull(n.normalize(Map.of()));
    assertNull(n.normalize(null));
  }

  @Test
  void normalizesRowsInColumnOrder() {
    Map<String, Object> row = new LinkedHashMap<>();
    row.put("revenue", new BigDecimal("99.90"));
    row.put("channel_id", 3);
    row.put("orders", 12L);
    Map<String, Object> out = n.normalizeRow(row);
    assertEquals(List.of("revenue", "channel_id", "orders"), List.copyOf(out.keySet()));
    assertEquals(99.9, out.get("revenue"));
    assertEquals(12d, out.get("orders"));
  }
}
