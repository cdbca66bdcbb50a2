package com.gentoro.gscmcp.tools;

import com.gentoro.gscmcp.exception.ValidationException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Typed, validating view over the raw arguments of a tool call.
 *
 * <p>Accessors record a problem and return null instead of throwing, so that one call to {@link
 * #ensureValid()} reports every invalid field at once.
 */
public class ToolArguments {
  private static final Pattern DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");

  private final Map<String, Object> values;
  private final List<String> problems = new ArrayList<>();

  public ToolArguments(Map<String, Object> values) {
    this.values = values == null ? new HashMap<>() : values;
  }

  public String requiredString(String name) {
    String value = optionalString(name);
    if (value == null && !hasProblem(name)) {
      problems.add(name + ": Required");
    }
    return value;
  }

  public String optionalString(String name) {
    Object raw = values.get(name);
    if (raw == null) return null;
    if (!(raw instanceof String)) {
      problems.add(name + ": Expected string");
      return null;
    }
    String value = ((String) raw).trim();
    return value.isEmpty() ? null : value;
  }

  /** Required {@code YYYY-MM-DD} date. */
  public String requiredDate(String name) {
    String value = requiredString(name);
    if (value != null && !DATE.matcher(value).matches()) {
      problems.add(name + ": Expected a date in YYYY-MM-DD format");
      return null;
    }
    return value;
  }

  public String optionalEnum(String name, Collection<String> allowed, String defaultValue) {
    String value = optionalString(name);
    if (value == null) return defaultValue;
    if (!allowed.contains(value)) {
      problems.add(name + ": Expected one of " + String.join(", ", allowed));
      return defaultValue;
    }
    return value;
  }

  public Integer optionalInt(String name, Integer defaultValue, Integer min, Integer max) {
    Number number = number(name);
    if (number == null) return defaultValue;
    if (number.doubleValue() != Math.rint(number.doubleValue())) {
      problems.add(name + ": Expected integer");
      return defaultValue;
    }
    // compare before narrowing, intValue() wraps anything beyond the int range
    double value = number.doubleValue();
    if (min != null && value < min) {
      problems.add(name + ": Must be at least " + min);
      return defaultValue;
    }
    if (max != null && value > max) {
      problems.add(name + ": Must be at most " + max);
      return defaultValue;
    }
    if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
      problems.add(name + ": Expected integer");
      return defaultValue;
    }
    return (int) value;
  }

  public double optionalDouble(String name, double defaultValue) {
    Number number = number(name);
    return number == null ? defaultValue : number.doubleValue();
  }

  /**
   * Comma-separated list such as {@code "query, page"}; every item must be in {@code allowed} when
   * it is not null.
   */
  public List<String> optionalCsv(String name, Collection<String> allowed, List<String> defaultValue) {
    String value = optionalString(name);
    if (value == null) return defaultValue;
    List<String> items =
        Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .collect(Collectors.toList());
    if (items.isEmpty()) return defaultValue;
    if (allowed != null) {
      List<String> unknown = items.stream().filter(i -> !allowed.contains(i)).toList();
      if (!unknown.isEmpty()) {
        problems.add(
            name + ": Unsupported value(s) " + String.join(", ", unknown) + ", expected "
                + String.join(", ", allowed));
        return defaultValue;
      }
    }
    return items;
  }

  public List<String> problems() {
    return List.copyOf(problems);
  }

  /** @throws ValidationException listing every {@code field: problem} pair found so far */
  public void ensureValid() {
    if (!problems.isEmpty()) {
      throw new ValidationException("Invalid arguments: " + String.join(", ", problems));
    }
  }

  private Number number(String name) {
    Object raw = values.get(name);
    if (raw == null) return null;
    if (raw instanceof Number n) return n;
    if (raw instanceof String s && !s.isBlank()) {
      try {
        return Double.valueOf(s.trim());
      } catch (NumberFormatException e) {
        problems.add(name + ": Expected number");
        return null;
      }
    }
    problems.add(name + ": Expected number");
    return null;
  }

  private boolean hasProblem(String name) {
    return problems.stream().anyMatch(p -> p.startsWith(name + ":"));
  }
}
