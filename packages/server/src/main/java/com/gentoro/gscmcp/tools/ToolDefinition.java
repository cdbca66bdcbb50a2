package com.gentoro.gscmcp.tools;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Name, description and input parameters of a tool, independent of the MCP SDK types. */
public final class ToolDefinition {
  private final String name;
  private final String description;
  private final List<ToolProperty> properties;

  public ToolDefinition(String name, String description, List<ToolProperty> properties) {
    this.name = Objects.requireNonNull(name, "name");
    this.description = Objects.requireNonNull(description, "description");
    this.properties = properties == null ? List.of() : List.copyOf(properties);
  }

  public String name() {
    return name;
  }

  public String description() {
    return description;
  }

  public List<ToolProperty> properties() {
    return properties;
  }

  /** {@code properties} map of the input JSON schema, in declaration order. */
  public Map<String, Object> schemaProperties() {
    Map<String, Object> result = new LinkedHashMap<>();
    for (ToolProperty property : properties) {
      result.put(property.getName(), property.toSchema());
    }
    return result;
  }

  public List<String> requiredProperties() {
    List<String> required = new ArrayList<>();
    for (ToolProperty property : properties) {
      if (property.isRequired()) required.add(property.getName());
    }
    return required;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private String name;
    private String description;
    private final List<ToolProperty> properties = new ArrayList<>();

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder property(ToolProperty property) {
      this.properties.add(property);
      return this;
    }

    public Builder property(ToolProperty.Builder property) {
      return property(property.build());
    }

    public ToolDefinition build() {
      return new ToolDefinition(name, description, properties);
    }
  }
}
