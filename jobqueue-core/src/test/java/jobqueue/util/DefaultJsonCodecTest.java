package jobqueue.util;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DefaultJsonCodecTest {
  private final JsonCodec codec = JsonCodec.getDefault();

  @Test
  void writesNestedValues() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("kind", "screenshot");
    map.put("timestamps", List.of("00:00:01,000", "00:00:02,000"));
    map.put("quality", 3);
    map.put("missing", null);
    map.put("flag", true);

    assertEquals("{\"kind\":\"screenshot\",\"timestamps\":[\"00:00:01,000\",\"00:00:02,000\"],"
        + "\"quality\":3,\"missing\":null,\"flag\":true}", codec.toJson(map));
  }

  @Test
  void escapesControlCharacters() {
    String json = codec.toJson(Map.of("text", "line1\nline2 \"quoted\" \\ tab\t"));

    assertEquals("{\"text\":\"line1\\nline2 \\\"quoted\\\" \\\\ tab\\t\"}", json);
    assertEquals("line1\nline2 \"quoted\" \\ tab\t", codec.parseObject(json).get("text"));
  }

  @Test
  void emptyOrNullMapIsEmptyObject() {
    assertEquals("{}", codec.toJson(null));
    assertEquals("{}", codec.toJson(Map.of()));
    assertTrue(codec.parseObject(null).isEmpty());
    assertTrue(codec.parseObject("  ").isEmpty());
  }

  @Test
  void parsesTypes() {
    Map<String, Object> parsed = codec.parseObject(
        "{\"i\":42,\"d\":1.5,\"s\":\"caf\\u00e9\",\"b\":false,\"n\":null,\"a\":[1,\"x\"],\"o\":{\"k\":\"v\"}}");

    assertEquals(42L, parsed.get("i"));
    assertEquals(1.5, parsed.get("d"));
    assertEquals("café", parsed.get("s"));
    assertEquals(Boolean.FALSE, parsed.get("b"));
    assertTrue(parsed.containsKey("n"));
    assertNull(parsed.get("n"));
    assertEquals(List.of(1L, "x"), parsed.get("a"));
    assertEquals(Map.of("k", "v"), parsed.get("o"));
  }

  @Test
  void rejectsInvalidJson() {
    assertThrows(IllegalArgumentException.class, () -> codec.parseObject("[]"));
    assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"a\":1} trailing"));
    assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"a\":tru}"));
    assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"a\":\"open}"));
    assertThrows(IllegalArgumentException.class, () -> codec.toJson(Map.of("nan", Double.NaN)));
  }

  @Test
  void rejectsExcessiveNesting() {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < 40; i++) {
      sb.append("{\"a\":");
    }
    sb.append("1");
    for (int i = 0; i < 40; i++) {
      sb.append('}');
    }
    assertThrows(IllegalArgumentException.class, () -> codec.parseObject(sb.toString()));
  }
}
