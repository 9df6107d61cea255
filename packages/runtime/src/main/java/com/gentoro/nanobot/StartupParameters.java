package com.gentoro.nanobot;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Command line parameters given as {@code --name value} pairs.
 *
 * <ul>
 *   <li>{@code --mode}: agent (default), gateway, metrics, status, channels or help
 *   <li>{@code --config-file}: configuration location, default {@code classpath:application.yaml}
 *   <li>{@code --message}: agent mode, answer one message and exit
 *   <li>{@code --session}: agent mode, conversation key (default {@code cli:direct})
 *   <li>{@code --report}, {@code --hours}, {@code --last}: metrics mode; {@code --report reset}
 *       clears the recorded metrics and asks for confirmation unless {@code --yes} is given
 * </ul>
 */
public class StartupParameters {
  public static final Set<String> MODES = Set.of("agent", "gateway", "metrics", "status", "channels", "help");
  public static final Set<String> REPORTS = Set.of("summary", "tools", "sessions", "models", "reset");

  final Map<String, Object> parameters = new HashMap<>();

  {
    parameters.put("config-file", "classpath:application.yaml");
    parameters.put("mode", "agent");
    parameters.put("report", "summary");
  }

  public StartupParameters(String[] arguments) {
    this.parameters.putAll(parseArguments(arguments));
    this.validate();
  }

  private Map<String, Object> parseArguments(String[] arguments) {
    Map<String, Object> result = new HashMap<>();
    for (int p = 0; p < arguments.length; p++) {
      if (!arguments[p].startsWith("--")) {
        continue;
      }
      String paramName = arguments[p].substring(2);
      String paramValue = null;
      if (p < arguments.length - 1 && !arguments[p + 1].startsWith("--")) {
        paramValue = arguments[p + 1];
        p++;
      }
      result.put(paramName, paramValue);
    }
    return result;
  }

  private void validate() {
    Object mode = parameters.get("mode");
    if (mode == null || !MODES.contains(mode.toString())) {
      throw new IllegalArgumentException("Invalid mode: " + mode);
    }
    Object configFile = parameters.get("config-file");
    if (configFile == null || configFile.toString().isBlank()) {
      throw new IllegalArgumentException("Missing config file location");
    }
    Object report = parameters.get("report");
    if (report == null || !REPORTS.contains(report.toString())) {
      throw new IllegalArgumentException("Invalid report: " + report);
    }
    positiveNumber("hours");
    positiveNumber("last");
  }

  private void positiveNumber(String name) {
    Object value = parameters.get(name);
    if (value == null) return;
    try {
      if (Double.parseDouble(value.toString()) <= 0) {
        throw new IllegalArgumentException("--%s must be positive: %s".formatted(name, value));
      }
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("--%s is not a number: %s".formatted(name, value), e);
    }
  }

  public String mode() {
    return getParameter("mode", String.class);
  }

  /**
   * Returns the configuration location string. Examples: "classpath:application.yaml",
   * "/etc/nanobot.yaml", "config/local.yaml".
   */
  public String configFile() {
    return getOptionalParameter("config-file", String.class).orElse("classpath:application.yaml");
  }

  /** Look-back window in hours; reports default to 24, the model report to a week. */
  public double hours(double defaultValue) {
    return getOptionalParameter("hours", String.class).map(Double::parseDouble).orElse(defaultValue);
  }

  public int last(int defaultValue) {
    return getOptionalParameter("last", String.class)
        .map(v -> (int) Double.parseDouble(v))
        .orElse(defaultValue);
  }

  public <T> T getParameter(String name, Class<T> type) {
    return type.cast(parameters.get(name));
  }

  public <T> Optional<T> getOptionalParameter(String name, Class<T> type) {
    return Optional.ofNullable(type.cast(parameters.get(name)));
  }

  public boolean isParameterPresent(String name) {
    return parameters.containsKey(name);
  }
}
