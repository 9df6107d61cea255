package com.gentoro.nanobot.model;

import java.util.Objects;

/**
 * Provider-agnostic tool definition presented to the reasoning engine. Parameters follow a
 * simplified JSON-Schema-like structure described by {@link ToolProperty}; the schema is only
 * shown to the engine and never enforced by the runtime.
 */
public final class ToolDefinition {
  private final String name;
  private final String description;
  private final ToolProperty schema;

  public ToolDefinition(String name, String description, ToolProperty schema) {
    this.name = Objects.requireNonNull(name, "name");
    this.description = Objects.requireNonNull(description, "description");
    this.schema =
        schema != null
            ? schema
            : ToolProperty.builder().name("arguments").type(ToolProperty.Type.OBJECT).build();
  }

  public String name() {
    return name;
  }

  public String description() {
    return description;
  }

  public ToolProperty schema() {
    return schema;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private String name;
    private String description;
    private final ToolProperty.Builder schema =
        ToolProperty.builder().name("arguments").type(ToolProperty.Type.OBJECT);

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    /** Add a top-level parameter. */
    public Builder parameter(ToolProperty property) {
      this.schema.property(property);
      return this;
    }

    public ToolDefinition build() {
      return new ToolDefinition(name, description, schema.build());
    }
  }
}
