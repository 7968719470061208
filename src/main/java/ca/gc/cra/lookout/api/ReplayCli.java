package ca.gc.cra.lookout.api;

import ca.gc.cra.lookout.adapter.kafka.KafkaRecordPublisher;
import ca.gc.cra.lookout.application.pipeline.SessionReplayUseCase;
import ca.gc.cra.lookout.application.port.MetricsPort;
import ca.gc.cra.lookout.application.port.SessionRecordListener;
import ca.gc.cra.lookout.config.IoMode;
import ca.gc.cra.lookout.config.MonitorConfig;
import ca.gc.cra.lookout.config.OutputConfig;
import ca.gc.cra.lookout.domain.session.SessionStats;
import ca.gc.cra.lookout.infrastructure.events.LoggingErrorListener;
import ca.gc.cra.lookout.infrastructure.output.NdjsonRecordWriter;
import ca.gc.cra.lookout.infrastructure.output.SessionStatsJsonEncoder;
import ca.gc.cra.lookout.logging.LoggingConfigurator;
import ca.gc.cra.lookout.util.PathUtils;
import ca.gc.cra.lookout.validation.Paths;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Offline command: reads a finished session (primary file plus sidecars) once and prints its statistics as
 * JSON on stdout. Records can additionally be written to an NDJSON file or published to Kafka.
 *
 * @since 0.1.0
 */
public final class ReplayCli {
  private static final Logger log = LoggerFactory.getLogger(ReplayCli.class);
  private static final String SUMMARY_USAGE =
      "usage: replay file=PATH|sessionId=ID [logRoot=PATH] [outMode=FILE|KAFKA] [out=PATH] "
          + "[kafkaBootstrap=HOST:PORT] [kafkaTopic=TOPIC] [pretty=true|false] [config=PATH]";
  private static final String HELP_TEXT = """
      LOOKOUT replay

      Usage:
        replay file=~/.claude/projects/-work-app/0f6c....jsonl [options]

      Input (exactly one):
        file=PATH                 Session log file; sidecars are read from the same directory
        sessionId=ID              Session id; its log file is searched beneath logRoot

      Optional:
        logRoot=PATH              Root of per-project log directories (default ~/.claude/projects)
        outMode=FILE|KAFKA        Also emit records: FILE writes NDJSON to 'out', KAFKA publishes
        out=PATH                  NDJSON record file (stdout is reserved for the report)
        kafkaBootstrap=HOST:PORT  Required when outMode=KAFKA
        kafkaTopic=TOPIC          Kafka topic (default lookout.records)
        pretty=BOOL               Indent the JSON report (default true)
        config=PATH               YAML file with 'common' and 'replay' sections
        metricsExporter=otlp|none Metrics exporter (default none)
        --verbose                 Enable DEBUG logging
        --help                    Show this message
      """;

  private ReplayCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    Map<String, String> effective;
    String exporter;
    MonitorConfig config;
    OutputConfig output;
    try {
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      effective = ConfigCliUtils.effectiveConfig("replay", kv, log);
      exporter = TelemetryConfigurator.configureMetrics(effective);
      config = MonitorConfig.fromMap(effective);
      output = OutputConfig.fromMap(effective);
      boolean hasFile = !effective.getOrDefault("file", "").isBlank();
      boolean hasSession = !effective.getOrDefault("sessionId", "").isBlank();
      if (hasFile == hasSession) {
        throw new IllegalArgumentException("exactly one of file or sessionId is required");
      }
      if (output.file() != null) {
        output = new OutputConfig(output.mode(), Paths.validateWritableFile(output.file(), true),
            output.kafkaBootstrap(), output.kafkaTopic());
      }
    } catch (NoSuchFileException ex) {
      log.error("Configuration file does not exist: {}", ex.getFile());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration", ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid replay arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    MDC.put("pipeline", "replay");
    MetricsPort metrics = TelemetryConfigurator.createMetrics(exporter);
    SessionReplayUseCase useCase = new SessionReplayUseCase(config, metrics);
    List<AutoCloseable> closeables = new ArrayList<>();
    try {
      Path file = effective.getOrDefault("file", "").isBlank()
          ? useCase.locate(effective.get("sessionId").trim())
          : Paths.requireReadableFile(Path.of(effective.get("file").trim()));
      List<SessionRecordListener> subscribers = openOutputs(output, metrics, file, closeables);
      SessionStats stats = useCase.replay(file, subscribers, new LoggingErrorListener());
      boolean pretty = ConfigCliUtils.parseBoolean(effective, "pretty", true);
      CliPrinter.println(new SessionStatsJsonEncoder(pretty).encode(stats));
      return ExitCode.SUCCESS;
    } catch (NoSuchFileException ex) {
      log.error("Session log not found: {}", ex.getFile());
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Replay configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Replay I/O failure", ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure during replay", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      closeAll(closeables);
      TelemetryConfigurator.shutdown(metrics);
      MDC.remove("pipeline");
    }
  }

  private static List<SessionRecordListener> openOutputs(
      OutputConfig output, MetricsPort metrics, Path file, List<AutoCloseable> closeables) throws IOException {
    List<SessionRecordListener> subscribers = new ArrayList<>();
    if (output.mode() == IoMode.KAFKA) {
      String sessionId = PathUtils.stem(file, ".jsonl").orElse(null);
      KafkaRecordPublisher publisher =
          new KafkaRecordPublisher(output.kafkaBootstrap(), output.kafkaTopic(), () -> sessionId, metrics);
      closeables.add(publisher);
      subscribers.add(publisher);
    } else if (output.file() != null) {
      NdjsonRecordWriter writer = NdjsonRecordWriter.toFile(output.file(), metrics);
      closeables.add(writer);
      subscribers.add(writer);
    }
    return subscribers;
  }

  private static void closeAll(List<AutoCloseable> closeables) {
    for (AutoCloseable closeable : closeables) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close replay output {}", closeable, ex);
      }
    }
  }
}
