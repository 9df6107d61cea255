package com.gentoro.nanobot.tools;

import com.gentoro.nanobot.exception.ExceptionUtil;
import com.gentoro.nanobot.model.ToolDefinition;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Name-keyed table of capabilities offered to the reasoning engine.
 *
 * <p>Registration happens during setup; afterwards the registry is only read, from any number of
 * concurrent cycles. Re-registering a name replaces the previous binding but keeps its position.
 * {@link #execute} never throws: unknown names and executor failures, errors included, come back
 * as a failed {@link ToolResult} whose text starts with {@code "Error"}. Only VM-fatal errors
 * such as {@link OutOfMemoryError} propagate.
 */
public class ToolRegistry {
  private static final org.slf4j.Logger log =
      com.gentoro.nanobot.logging.LoggingService.getLogger(ToolRegistry.class);

  private record Binding(ToolDefinition definition, ToolExecutor executor) {}

  private final Map<String, Binding> bindings = new LinkedHashMap<>();

  public synchronized void register(Tool tool) {
    register(tool.definition(), tool);
  }

  public synchronized void register(ToolDefinition definition, ToolExecutor executor) {
    Objects.requireNonNull(definition, "definition");
    Objects.requireNonNull(executor, "executor");
    if (bindings.put(definition.name(), new Binding(definition, executor)) != null) {
      log.debug("Tool '{}' re-registered, previous binding replaced", definition.name());
    }
  }

  public synchronized boolean has(String name) {
    return bindings.containsKey(name);
  }

  public synchronized int size() {
    return bindings.size();
  }

  /** All descriptors, in registration order. */
  public synchronized List<ToolDefinition> definitions() {
    List<ToolDefinition> result = new ArrayList<>(bindings.size());
    bindings.values().forEach(b -> result.add(b.definition()));
    return result;
  }

  /** Run tool {@code name}. */
  public ToolResult execute(String name, Map<String, Object> arguments, ToolContext context) {
    Binding binding;
    synchronized (this) {
      binding = bindings.get(name);
    }
    if (binding == null) {
      log.warn("Engine requested unknown tool '{}'", name);
      return ToolResult.error("Error: Unknown tool: " + name);
    }
    try {
      String result =
          binding
              .executor()
              .execute(
                  arguments == null ? Map.of() : arguments,
                  context == null ? ToolContext.NONE : context);
      return ToolResult.ok(result);
    } catch (Throwable e) {
      ExceptionUtil.rethrowIfFatal(e);
      log.warn("Tool '{}' failed: {}", name, ExceptionUtil.describe(e));
      log.debug("Tool '{}' failure detail:\n{}", name, ExceptionUtil.formatCompactStackTrace(e));
      return ToolResult.error(
          "Error executing tool '%s': %s".formatted(name, ExceptionUtil.describe(e)));
    }
  }

  /** Copy of this registry without the named tools. */
  public synchronized ToolRegistry copyWithout(String... excluded) {
    Set<String> skip = Set.copyOf(Arrays.asList(excluded));
    ToolRegistry copy = new ToolRegistry();
    bindings.forEach(
        (name, binding) -> {
          if (!skip.contains(name)) {
            copy.bindings.put(name, binding);
          }
        });
    return copy;
  }
}
