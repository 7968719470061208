package ca.gc.cra.lookout.infrastructure.output;

import ca.gc.cra.lookout.application.port.MetricsPort;
import ca.gc.cra.lookout.application.port.SessionRecordListener;
import ca.gc.cra.lookout.domain.record.SessionRecord;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Subscriber that appends each record as one JSON line.
 * <p><strong>Role:</strong> FILE output mode of the {@code watch} command.</p>
 * <p><strong>Thread-safety:</strong> {@link #onRecord} and {@link #close} synchronize on the instance.</p>
 * <p><strong>Error handling:</strong> A write failure is thrown as {@link UncheckedIOException}; the record
 * bus reports it on the error channel and keeps delivering to other subscribers.</p>
 *
 * @since 0.1.0
 */
public final class NdjsonRecordWriter implements SessionRecordListener, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(NdjsonRecordWriter.class);

  private final Writer writer;
  private final RecordJsonEncoder encoder;
  private final MetricsPort metrics;
  private final boolean ownsWriter;
  private long written;
  private boolean closed;

  @SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "The destination writer is shared with its owner; records are written straight through.")
  NdjsonRecordWriter(Writer writer, boolean ownsWriter, RecordJsonEncoder encoder, MetricsPort metrics) {
    this.writer = Objects.requireNonNull(writer, "writer");
    this.ownsWriter = ownsWriter;
    this.encoder = Objects.requireNonNull(encoder, "encoder");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Opens a writer appending to {@code file}, creating it when missing.
   *
   * @param file output file
   * @param metrics metrics adapter; may be {@code null}
   * @return writer that closes the file on {@link #close()}
   * @throws IOException when the file cannot be opened
   */
  public static NdjsonRecordWriter toFile(Path file, MetricsPort metrics) throws IOException {
    Writer out = Files.newBufferedWriter(
        file, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    log.info("Writing session records to {}", file);
    return new NdjsonRecordWriter(out, true, new RecordJsonEncoder(), metrics);
  }

  /**
   * Wraps an existing writer such as the CLI stdout writer; the writer is flushed but never closed.
   *
   * @param writer destination
   * @param metrics metrics adapter; may be {@code null}
   * @return record writer
   */
  public static NdjsonRecordWriter toWriter(Writer writer, MetricsPort metrics) {
    return new NdjsonRecordWriter(writer, false, new RecordJsonEncoder(), metrics);
  }

  @Override
  public synchronized void onRecord(SessionRecord record) {
    if (closed) {
      log.debug("Dropping {} record after close", record.type());
      return;
    }
    try {
      writer.write(encoder.encode(record));
      writer.write('\n');
      writer.flush();
      written++;
      metrics.increment("lookout.output.ndjson.written");
    } catch (IOException ex) {
      metrics.increment("lookout.output.ndjson.failed");
      throw new UncheckedIOException("Failed to write " + record.type() + " record", ex);
    }
  }

  public synchronized long written() {
    return written;
  }

  @Override
  public synchronized void close() throws IOException {
    if (closed) {
      return;
    }
    closed = true;
    writer.flush();
    if (ownsWriter) {
      writer.close();
    }
  }
}
