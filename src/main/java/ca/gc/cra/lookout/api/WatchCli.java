package ca.gc.cra.lookout.api;

import ca.gc.cra.lookout.adapter.kafka.KafkaRecordPublisher;
import ca.gc.cra.lookout.application.monitor.SessionMonitor;
import ca.gc.cra.lookout.application.port.MetricsPort;
import ca.gc.cra.lookout.application.port.SessionRecordListener;
import ca.gc.cra.lookout.application.session.SessionAggregator;
import ca.gc.cra.lookout.config.IoMode;
import ca.gc.cra.lookout.config.MonitorConfig;
import ca.gc.cra.lookout.config.OutputConfig;
import ca.gc.cra.lookout.domain.session.SessionStats;
import ca.gc.cra.lookout.domain.tail.MonitorTarget;
import ca.gc.cra.lookout.infrastructure.events.LoggingErrorListener;
import ca.gc.cra.lookout.infrastructure.events.LoggingRecordListener;
import ca.gc.cra.lookout.infrastructure.output.NdjsonRecordWriter;
import ca.gc.cra.lookout.infrastructure.output.SessionStatsJsonEncoder;
import ca.gc.cra.lookout.infrastructure.time.SystemClockAdapter;
import ca.gc.cra.lookout.infrastructure.watch.NioDirectoryWatchAdapter;
import ca.gc.cra.lookout.logging.LoggingConfigurator;
import ca.gc.cra.lookout.validation.Numbers;
import ca.gc.cra.lookout.validation.Paths;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Live monitoring command: tails a session and streams its records to NDJSON or Kafka until interrupted or
 * until {@code durationSeconds} elapses, then logs the session statistics.
 *
 * @since 0.1.0
 */
public final class WatchCli {
  private static final Logger log = LoggerFactory.getLogger(WatchCli.class);
  private static final String SUMMARY_USAGE =
      "usage: watch workingDirectory=PATH|directory=PATH|sessionId=ID [logRoot=PATH] "
          + "[includeExisting=true|false] [outMode=FILE|KAFKA] [out=PATH|-] [kafkaBootstrap=HOST:PORT] "
          + "[kafkaTopic=TOPIC] [durationSeconds=N] [config=PATH] [--dry-run]";
  private static final String HELP_TEXT = """
      LOOKOUT watch

      Usage:
        watch workingDirectory=/work/app [options]

      Target (exactly one):
        workingDirectory=PATH     Agent working directory; its log directory is derived under logRoot
        directory=PATH            Project log directory to watch directly
        sessionId=ID              Session id; its log file is searched beneath logRoot

      Optional:
        logRoot=PATH              Root of per-project log directories (default ~/.claude/projects)
        includeExisting=BOOL      Read files that existed before the watch started (default false)
        toleranceSeconds=N        Files created this long before start count as new (default 2)
        pollMillis=N              Poll interval in milliseconds (default 100)
        watch=BOOL                Use file-system notifications in addition to polling (default true)
        readWorkers=N             Concurrent file readers (default 2)
        outMode=FILE|KAFKA        NDJSON output or Kafka publishing (default FILE)
        out=PATH|-                NDJSON file; '-' writes to stdout (default -)
        kafkaBootstrap=HOST:PORT  Required when outMode=KAFKA
        kafkaTopic=TOPIC          Kafka topic (default lookout.records)
        durationSeconds=N         Stop after N seconds; 0 runs until interrupted (default 0)
        config=PATH               YAML file with 'common' and 'watch' sections
        metricsExporter=otlp|none Metrics exporter (default none)
        otelEndpoint=URL          OTLP endpoint when metricsExporter=otlp
        otelResourceAttributes=K=V,...  Extra OpenTelemetry resource attributes
        --dry-run                 Print the resolved plan and exit
        --verbose                 Enable DEBUG logging
        --help                    Show this message
      """;

  private WatchCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Runs the command.
   *
   * @param args command arguments
   * @return exit code
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for watch");
    }

    Map<String, String> effective;
    String exporter;
    MonitorConfig config;
    MonitorTarget target;
    OutputConfig output;
    long durationSeconds;
    try {
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      effective = ConfigCliUtils.effectiveConfig("watch", kv, log);
      exporter = TelemetryConfigurator.configureMetrics(effective);
      config = MonitorConfig.fromMap(effective);
      Optional<MonitorTarget> resolved = MonitorConfig.targetFromMap(effective);
      if (resolved.isEmpty()) {
        throw new IllegalArgumentException("one of workingDirectory, directory or sessionId is required");
      }
      target = resolved.get();
      output = OutputConfig.fromMap(effective);
      if (output.file() != null) {
        output = new OutputConfig(output.mode(), Paths.validateWritableFile(output.file(), true),
            output.kafkaBootstrap(), output.kafkaTopic());
      }
      durationSeconds = Numbers.requireRange("durationSeconds",
          ConfigCliUtils.parseLong(effective, "durationSeconds", 0), 0, 31L * 24 * 3600);
    } catch (NoSuchFileException ex) {
      log.error("Configuration file does not exist: {}", ex.getFile());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration", ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid watch arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (input.hasFlag("--dry-run") || ConfigCliUtils.parseBoolean(effective, "dryRun", false)) {
      printDryRunPlan(config, target, output, durationSeconds);
      return ExitCode.SUCCESS;
    }

    MDC.put("pipeline", "watch");
    MetricsPort metrics = TelemetryConfigurator.createMetrics(exporter);
    try {
      SessionStats stats = watch(config, target, output, durationSeconds, metrics);
      log.info("Session {} summary: {}",
          stats.info().sessionId(), new SessionStatsJsonEncoder(false).encode(stats));
      return ExitCode.SUCCESS;
    } catch (IllegalArgumentException | IllegalStateException ex) {
      log.error("Watch configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Watch I/O failure for {}", target, ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Watch interrupted; shutting down", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure while watching {}", target, ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      TelemetryConfigurator.shutdown(metrics);
      MDC.remove("pipeline");
    }
  }

  private static SessionStats watch(
      MonitorConfig config, MonitorTarget target, OutputConfig output, long durationSeconds, MetricsPort metrics)
      throws IOException, InterruptedException {
    SessionAggregator aggregator = new SessionAggregator();
    CountDownLatch stopSignal = new CountDownLatch(1);
    CountDownLatch cleanedUp = new CountDownLatch(1);
    Thread hook = new Thread(() -> {
      stopSignal.countDown();
      try {
        cleanedUp.await(5, TimeUnit.SECONDS);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    }, "lookout-shutdown");
    Runtime.getRuntime().addShutdownHook(hook);

    try (SessionMonitor monitor = new SessionMonitor(
        config, NioDirectoryWatchAdapter::new, new SystemClockAdapter(), metrics);
         Output sink = openOutput(output, metrics, () -> monitor.sessionId().orElse(null))) {
      monitor.subscribe(aggregator);
      monitor.subscribe(sink.listener());
      monitor.subscribe(new LoggingRecordListener(metrics));
      monitor.onError(new LoggingErrorListener());
      monitor.start(target);
      if (durationSeconds > 0) {
        stopSignal.await(durationSeconds, TimeUnit.SECONDS);
      } else {
        stopSignal.await();
      }
      monitor.stop();
      log.info("Watch finished for {} ({} file(s) tracked)", target, monitor.trackedFiles().size());
    } finally {
      cleanedUp.countDown();
      removeHook(hook);
    }
    return aggregator.snapshot();
  }

  private static Output openOutput(OutputConfig output, MetricsPort metrics, Supplier<String> sessionId)
      throws IOException {
    if (output.mode() == IoMode.KAFKA) {
      KafkaRecordPublisher publisher = new KafkaRecordPublisher(
          output.kafkaBootstrap(), output.kafkaTopic(), sessionId, metrics);
      return new Output(publisher, publisher::close);
    }
    NdjsonRecordWriter writer = output.toStdout()
        ? NdjsonRecordWriter.toWriter(CliPrinter.writer(), metrics)
        : NdjsonRecordWriter.toFile(output.file(), metrics);
    return new Output(writer, writer::close);
  }

  private static void removeHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM shutdown in progress; shutdown hook left registered");
    }
  }

  private static void printDryRunPlan(
      MonitorConfig config, MonitorTarget target, OutputConfig output, long durationSeconds) {
    CliPrinter.printLines(
        "Watch dry-run: no files will be read.",
        " Target            : " + target.kind() + " " + target.value(),
        " Log root          : " + config.logRoot(),
        " Include existing  : " + config.includeExisting(),
        " Tolerance         : " + config.creationTolerance().toSeconds() + "s",
        " Poll interval     : " + config.pollInterval().toMillis() + "ms",
        " Notifications     : " + config.watchEnabled(),
        " Output            : " + describe(output),
        " Duration          : " + (durationSeconds == 0 ? "until interrupted" : durationSeconds + "s"),
        " Re-run without --dry-run to start watching.");
  }

  static String describe(OutputConfig output) {
    if (output.mode() == IoMode.KAFKA) {
      return "kafka " + output.kafkaBootstrap() + " topic " + output.kafkaTopic();
    }
    return output.toStdout() ? "stdout (NDJSON)" : output.file() + " (NDJSON)";
  }

  /** Output subscriber paired with the action that releases it. */
  private record Output(SessionRecordListener listener, Closer closer) implements AutoCloseable {
    @Override
    public void close() throws IOException {
      closer.close();
    }
  }

  @FunctionalInterface
  private interface Closer {
    void close() throws IOException;
  }
}
