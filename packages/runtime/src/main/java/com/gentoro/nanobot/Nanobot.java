package com.gentoro.nanobot;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.rolling.RollingFileAppender;
import ch.qos.logback.core.rolling.TimeBasedRollingPolicy;
import com.gentoro.nanobot.agent.AgentLoop;
import com.gentoro.nanobot.agent.AgentSettings;
import com.gentoro.nanobot.agent.PromptContextAssembler;
import com.gentoro.nanobot.bus.InboundMessage;
import com.gentoro.nanobot.bus.MessageBus;
import com.gentoro.nanobot.channels.ChannelManager;
import com.gentoro.nanobot.exception.StateException;
import com.gentoro.nanobot.metrics.MetricsCollector;
import com.gentoro.nanobot.metrics.MetricsReport;
import com.gentoro.nanobot.model.LlmClient;
import com.gentoro.nanobot.model.LlmClientFactory;
import com.gentoro.nanobot.prompt.PromptRepository;
import com.gentoro.nanobot.prompt.PromptRepositoryFactory;
import com.gentoro.nanobot.session.FileSessionStore;
import com.gentoro.nanobot.session.InMemorySessionStore;
import com.gentoro.nanobot.session.SessionStore;
import com.gentoro.nanobot.tools.ToolRegistry;
import com.gentoro.nanobot.utility.JacksonUtility;
import com.gentoro.nanobot.utility.StdoutUtility;
import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import org.apache.commons.configuration2.Configuration;

/** Application context: loads configuration, wires the runtime and runs the selected mode. */
public class Nanobot {

  private static final org.slf4j.Logger log =
      com.gentoro.nanobot.logging.LoggingService.getLogger(Nanobot.class);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private MessageBus bus;
  private LlmClient llmClient;
  private MetricsCollector metrics;
  private AgentLoop agentLoop;
  private ChannelManager channelManager;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public Nanobot(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() throws IOException {
    // Route everything through SLF4J/Logback; silence java.util.logging.
    LogManager.getLogManager().reset();
    Logger.getLogger("").setLevel(Level.OFF);

    String mode = startupParameters.mode();
    if ("help".equals(mode)) {
      printHelp();
      return;
    }

    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    com.gentoro.nanobot.logging.LoggingService.applyConfiguration(configuration());
    this.metrics = MetricsCollector.fromConfiguration(configuration());

    switch (mode) {
      case "metrics" -> {
        if ("reset".equals(startupParameters.getParameter("report", String.class))) {
          resetMetrics();
        } else {
          printMetrics();
        }
        return;
      }
      case "status" -> {
        printYaml(StatusReport.of(startupParameters.configFile(), configuration()));
        return;
      }
      case "channels" -> {
        printYaml(ChannelManager.status(configuration()));
        return;
      }
      default -> {}
    }

    buildRuntime();
    switch (mode) {
      case "agent" -> runAgentMode();
      case "gateway" -> runGatewayMode();
      default -> throw new IllegalArgumentException("Invalid mode: " + mode);
    }
  }

  private void buildRuntime() {
    AgentSettings settings = AgentSettings.fromConfiguration(configuration());
    this.bus = new MessageBus();
    this.llmClient = LlmClientFactory.createProvider(configuration());
    PromptRepository prompts = PromptRepositoryFactory.create(configuration().subset("prompt"));

    String sessionDir = configuration().getString("session.dir", null);
    SessionStore sessions =
        (sessionDir == null || sessionDir.isBlank())
            ? new InMemorySessionStore()
            : new FileSessionStore(Path.of(sessionDir));

    this.agentLoop =
        new AgentLoop(
            bus,
            llmClient,
            sessions,
            new PromptContextAssembler(prompts, settings),
            new ToolRegistry(),
            settings,
            metrics);
    log.info(
        "Runtime ready: model {}, subagent model {}, {} tool(s), max {} iteration(s)",
        settings.model() != null ? settings.model() : llmClient.defaultModel(),
        settings.effectiveSubagentModel() != null
            ? settings.effectiveSubagentModel()
            : llmClient.defaultModel(),
        agentLoop.tools().size(),
        settings.maxIterations());
  }

  private void runAgentMode() throws IOException {
    String sessionKey =
        startupParameters
            .getOptionalParameter("session", String.class)
            .orElse(
                InboundMessage.sessionKey(AgentLoop.DIRECT_CHANNEL, AgentLoop.DIRECT_CHAT_ID));
    try {
      String message = startupParameters.getParameter("message", String.class);
      if (message != null) {
        StdoutUtility.printReply(System.out, agentLoop.processDirect(message, sessionKey));
        return;
      }
      configureFileOnlyLogging();
      new InteractiveConsole(
              agentLoop,
              sessionKey,
              new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
              System.out)
          .run();
    } finally {
      shutdown();
    }
  }

  private void runGatewayMode() {
    this.channelManager = ChannelManager.fromConfiguration(configuration());
    channelManager.startAll(bus);
    startDaemon("agent-loop", agentLoop::run);
    startDaemon("outbound-dispatcher", bus::dispatchOutbound);
    log.info("Gateway running, channels: {}", channelManager.enabledChannels());
    waitShutdownSignal();
  }

  private static void startDaemon(String name, Runnable task) {
    Thread thread = new Thread(task, name);
    thread.setDaemon(true);
    thread.start();
  }

  private void printMetrics() {
    MetricsReport report = new MetricsReport(metrics);
    Object result =
        switch (startupParameters.getParameter("report", String.class)) {
          case "tools" -> report.tools(startupParameters.hours(24));
          case "sessions" -> report.sessions(startupParameters.last(20));
          case "models" -> report.models(startupParameters.hours(168));
          default -> report.summary(startupParameters.hours(24));
        };
    printYaml(result);
  }

  private void resetMetrics() throws IOException {
    if (!startupParameters.isParameterPresent("yes")) {
      System.out.printf("Delete all metrics in %s? [y/N] ", metrics.directory());
      System.out.flush();
      String answer =
          new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)).readLine();
      if (answer == null || !answer.trim().toLowerCase().startsWith("y")) {
        StdoutUtility.printNewLine(System.out, "Metrics left untouched");
        return;
      }
    }
    StdoutUtility.printNewLine(
        System.out, metrics.reset() ? "Metrics data cleared" : "No metrics data found");
  }

  private static void printYaml(Object value) {
    try {
      System.out.println(JacksonUtility.getYamlMapper().writeValueAsString(value));
    } catch (IOException e) {
      throw new com.gentoro.nanobot.exception.SerializationException(
          "Failed to render report", e);
    }
  }

  private void printHelp() {
    System.out.println(
        """
        Usage: nanobot [--mode agent|gateway|metrics|status|channels|help] [--config-file <location>]

          agent     talk to the agent; --message <text> answers once and exits,
                    otherwise an interactive console starts. --session <channel:chat>
          gateway   run the message bus, the agent loop and the enabled channels
          metrics   print a report: --report summary|tools|sessions|models
                    --hours <n> look-back window, --last <n> recent sessions
                    --report reset [--yes] deletes all recorded metrics
          status    show configuration, workspace, models and engine profile
          channels  list discovered channel providers and whether each is enabled
          help      show this message
        """);
  }

  /**
   * Block the current thread until a shutdown signal is received (e.g., Ctrl+C or JVM termination).
   * When signaled, this method invokes {@link #shutdown()} to release resources before returning.
   */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "nanobot-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }
    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (shuttingDown.compareAndSet(false, true)) {
      try {
        if (agentLoop != null) agentLoop.shutdown();
        if (bus != null) bus.stop();
        if (channelManager != null) channelManager.stopAll();
        log.info("Shutdown complete");
      } finally {
        shutdownLatch.countDown();
      }
    }
  }

  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("Nanobot not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  /**
   * Reconfigure Logback to disable console output and enable only file-based logging. Used by the
   * interactive console to keep the terminal clean.
   */
  private void configureFileOnlyLogging() {
    LoggerContext context = (LoggerContext) org.slf4j.LoggerFactory.getILoggerFactory();
    ch.qos.logback.classic.Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);

    for (java.util.Iterator<Appender<ILoggingEvent>> it = root.iteratorForAppenders();
        it.hasNext(); ) {
      Appender<ILoggingEvent> app = it.next();
      if (app instanceof ConsoleAppender) {
        root.detachAppender(app);
      }
    }

    File logsDir = new File(configuration().getString("logging.dir", "logs"));
    if (!logsDir.exists() && !logsDir.mkdirs()) {
      log.warn("Could not create log directory {}", logsDir.getAbsolutePath());
    }

    RollingFileAppender<ILoggingEvent> fileAppender = new RollingFileAppender<>();
    fileAppender.setContext(context);
    fileAppender.setName("FILE");
    fileAppender.setFile(new File(logsDir, "nanobot.log").getPath());

    TimeBasedRollingPolicy<ILoggingEvent> rollingPolicy = new TimeBasedRollingPolicy<>();
    rollingPolicy.setContext(context);
    rollingPolicy.setParent(fileAppender);
    rollingPolicy.setFileNamePattern(new File(logsDir, "nanobot.%d{yyyy-MM-dd}.log.gz").getPath());
    rollingPolicy.setMaxHistory(7);
    rollingPolicy.start();

    PatternLayoutEncoder encoder = new PatternLayoutEncoder();
    encoder.setContext(context);
    encoder.setPattern(
        "%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %-5level %logger{36} [%X{session}] - %msg%n");
    encoder.start();

    fileAppender.setEncoder(encoder);
    fileAppender.setRollingPolicy(rollingPolicy);
    fileAppender.start();

    root.addAppender(fileAppender);
    log.info(
        "Interactive mode: console logging disabled; file logging enabled at {}",
        fileAppender.getFile());
  }
}
