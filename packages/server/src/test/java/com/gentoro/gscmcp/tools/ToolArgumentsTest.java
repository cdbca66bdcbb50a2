package com.gentoro.gscmcp.tools;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.gscmcp.exception.ValidationException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ToolArgumentsTest {

  private static ToolArguments args(Object... pairs) {
    Map<String, Object> map = new HashMap<>();
    for (int i = 0; i < pairs.length; i += 2) {
      map.put((String) pairs[i], pairs[i + 1]);
    }
    return new ToolArguments(map);
  }

  @Test
  void collectsEveryProblemBeforeFailing() {
    ToolArguments arguments = args("startDate", "01/02/2024", "rowLimit", 0, "type", "audio");

    arguments.requiredString("siteUrl");
    arguments.requiredDate("startDate");
    arguments.optionalInt("rowLimit", 1000, 1, 25_000);
    arguments.optionalEnum("type", List.of("web", "image"), null);

    ValidationException ex = assertThrows(ValidationException.class, arguments::ensureValid);
    assertTrue(ex.getMessage().startsWith("Invalid arguments: "));
    assertTrue(ex.getMessage().contains("siteUrl: Required"));
    assertTrue(ex.getMessage().contains("startDate: Expected a date in YYYY-MM-DD format"));
    assertTrue(ex.getMessage().contains("rowLimit: Must be at least 1"));
    assertTrue(ex.getMessage().contains("type: Expected one of web, image"));
    assertEquals(4, arguments.problems().size());
  }

  @Test
  void appliesDefaultsForAbsentValues() {
    ToolArguments arguments = args();

    assertEquals(Integer.valueOf(1000), arguments.optionalInt("rowLimit", 1000, 1, 25_000));
    assertEquals("all", arguments.optionalEnum("dataState", List.of("all", "final"), "all"));
    assertEquals(3.0, arguments.optionalDouble("maxCtr", 3.0));
    assertNull(arguments.optionalString("account"));
    assertEquals(List.of("query"), arguments.optionalCsv("dimensions", null, List.of("query")));
    arguments.ensureValid();
  }

  @Test
  void acceptsNumbersSentAsWholeDoublesOrStrings() {
    ToolArguments arguments = args("rowLimit", 250.0, "startRow", "10", "maxCtr", "2.5");

    assertEquals(Integer.valueOf(250), arguments.optionalInt("rowLimit", 1000, 1, 25_000));
    assertEquals(Integer.valueOf(10), arguments.optionalInt("startRow", null, 0, null));
    assertEquals(2.5, arguments.optionalDouble("maxCtr", 3.0));
    arguments.ensureValid();
  }

  @Test
  void rejectsFractionalAndOutOfRangeIntegers() {
    ToolArguments arguments = args("rowLimit", 10.5, "startRow", -1, "limit", 25_001);

    arguments.optionalInt("rowLimit", 1000, 1, 25_000);
    arguments.optionalInt("startRow", null, 0, null);
    arguments.optionalInt("limit", 50, 1, 25_000);

    assertEquals(
        List.of("rowLimit: Expected integer", "startRow: Must be at least 0", "limit: Must be at most 25000"),
        arguments.problems());
  }

  @Test
  void valuesBeyondTheIntRangeAreRejectedNotWrapped() {
    ToolArguments arguments =
        args("rowLimit", 4_294_967_297L, "startRow", -4_294_967_296L, "limit", 1e12);

    assertEquals(Integer.valueOf(1000), arguments.optionalInt("rowLimit", 1000, 1, 25_000));
    assertNull(arguments.optionalInt("startRow", null, 0, null));
    assertEquals(Integer.valueOf(50), arguments.optionalInt("limit", 50, 0, null));

    assertEquals(
        List.of(
            "rowLimit: Must be at most 25000",
            "startRow: Must be at least 0",
            "limit: Expected integer"),
        arguments.problems());
  }

  @Test
  void splitsAndValidatesCommaSeparatedDimensions() {
    ToolArguments ok = args("dimensions", " query, page ,date ");
    assertEquals(
        List.of("query", "page", "date"),
        ok.optionalCsv("dimensions", List.of("query", "page", "date"), null));

    ToolArguments bad = args("dimensions", "query,keyword");
    bad.optionalCsv("dimensions", List.of("query", "page"), null);
    assertEquals(1, bad.problems().size());
    assertTrue(bad.problems().get(0).contains("keyword"));
  }

  @Test
  void blankStringsCountAsMissing() {
    ToolArguments arguments = args("siteUrl", "   ", "account", "");

    assertNull(arguments.requiredString("siteUrl"));
    assertNull(arguments.optionalString("account"));
    assertEquals(List.of("siteUrl: Required"), arguments.problems());
  }

  @Test
  void wrongJsonTypesAreReported() {
    ToolArguments arguments = args("siteUrl", 42, "rowLimit", true);

    arguments.requiredString("siteUrl");
    arguments.optionalInt("rowLimit", 1000, 1, 25_000);

    assertEquals(List.of("siteUrl: Expected string", "rowLimit: Expected number"), arguments.problems());
  }
}
