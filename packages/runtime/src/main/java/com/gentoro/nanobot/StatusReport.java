package com.gentoro.nanobot;

import com.gentoro.nanobot.agent.AgentSettings;
import com.gentoro.nanobot.channels.ChannelManager;
import com.gentoro.nanobot.metrics.MetricsCollector;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;

/**
 * Snapshot of the effective setup printed by {@code --mode status}: configuration source,
 * workspace, models, the active engine profile, storage locations and channels. Secrets are only
 * reported as set or not set.
 */
public final class StatusReport {
  private StatusReport() {}

  public static Map<String, Object> of(String configLocation, Configuration configuration) {
    AgentSettings settings = AgentSettings.fromConfiguration(configuration);
    Map<String, Object> status = new LinkedHashMap<>();
    status.put("config", configLocation);

    Map<String, Object> workspace = new LinkedHashMap<>();
    workspace.put("path", settings.workspace());
    workspace.put("exists", Files.isDirectory(Path.of(settings.workspace())));
    status.put("workspace", workspace);

    String profile = configuration.getString("llm.active-profile", "default");
    Configuration llm = configuration.subset("llm." + profile);
    Map<String, Object> models = new LinkedHashMap<>();
    models.put("main", settings.model() != null ? settings.model() : llm.getString("model", null));
    models.put("subagent", settings.effectiveSubagentModel());
    status.put("models", models);

    Map<String, Object> engine = new LinkedHashMap<>();
    engine.put("profile", profile);
    engine.put("provider", llm.getString("provider", null));
    engine.put("api_key", isSet(llm.getString("apiKey", null)) ? "set" : "not set");
    String baseUrl = llm.getString("baseUrl", null);
    if (isSet(baseUrl)) {
      engine.put("base_url", baseUrl);
    }
    status.put("llm", engine);

    String sessionDir = configuration.getString("session.dir", null);
    status.put("sessions", isSet(sessionDir) ? sessionDir : "in-memory");

    MetricsCollector metrics = MetricsCollector.fromConfiguration(configuration);
    Map<String, Object> metricsStatus = new LinkedHashMap<>();
    metricsStatus.put("enabled", metrics.isEnabled());
    metricsStatus.put("dir", metrics.directory().toString());
    status.put("metrics", metricsStatus);

    Map<String, Object> channels = new LinkedHashMap<>();
    ChannelManager.status(configuration).forEach(c -> channels.put(c.providerId(), c.enabled()));
    status.put("channels", channels);
    return status;
  }

  // Unresolved ${env:...} placeholders count as missing.
  private static boolean isSet(String value) {
    return value != null && !value.isBlank() && !value.startsWith("${");
  }
}
