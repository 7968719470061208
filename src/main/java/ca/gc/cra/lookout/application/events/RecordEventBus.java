package ca.gc.cra.lookout.application.events;

import ca.gc.cra.lookout.application.port.MetricsPort;
import ca.gc.cra.lookout.application.port.MonitorErrorListener;
import ca.gc.cra.lookout.application.port.SessionRecordListener;
import ca.gc.cra.lookout.application.port.Subscription;
import ca.gc.cra.lookout.domain.events.MonitorDiagnostic;
import ca.gc.cra.lookout.domain.record.SessionRecord;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Ordered fan-out of accepted session records to subscribers, plus an error
 * side-channel.
 * <p><strong>Why:</strong> Several files are read concurrently, yet every subscriber must observe a single,
 * globally consistent record order.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Run the dedup check and the delivery under one lock, so delivery order equals acceptance order.</li>
 *   <li>Isolate subscriber failures and forward them to the error channel.</li>
 *   <li>Allow subscribe and unsubscribe at any time, including from inside a callback.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent producers; deliveries never interleave.</p>
 * <p><strong>Performance:</strong> Listener lists are copy-on-write; producers block while another
 * delivery is running.</p>
 * <p><strong>Observability:</strong> Emits {@code lookout.bus.emitted}, {@code lookout.bus.duplicates} and
 * {@code lookout.bus.listenerFailed}.</p>
 *
 * @implNote Listeners must not publish back into the bus from their callback.
 * @since 0.1.0
 */
public final class RecordEventBus {
  private static final Logger log = LoggerFactory.getLogger(RecordEventBus.class);

  private final BoundedDeduplicator deduplicator;
  private final MetricsPort metrics;
  private final List<Registration<SessionRecordListener>> listeners = new CopyOnWriteArrayList<>();
  private final List<Registration<MonitorErrorListener>> errorListeners = new CopyOnWriteArrayList<>();
  private final ReentrantLock deliveryLock = new ReentrantLock();

  public RecordEventBus(BoundedDeduplicator deduplicator, MetricsPort metrics) {
    this.deduplicator = Objects.requireNonNull(deduplicator, "deduplicator");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Registers a record listener.
   *
   * @param listener listener invoked for every accepted record
   * @return handle whose {@code close()} unsubscribes
   */
  public Subscription subscribe(SessionRecordListener listener) {
    Registration<SessionRecordListener> registration =
        new Registration<>(Objects.requireNonNull(listener, "listener"), listeners);
    listeners.add(registration);
    return registration;
  }

  /**
   * Registers an error-channel listener.
   *
   * @param listener listener invoked for every diagnostic
   * @return handle whose {@code close()} unsubscribes
   */
  public Subscription onError(MonitorErrorListener listener) {
    Registration<MonitorErrorListener> registration =
        new Registration<>(Objects.requireNonNull(listener, "listener"), errorListeners);
    errorListeners.add(registration);
    return registration;
  }

  /**
   * Offers a record for emission.
   *
   * @param key dedup key of the record
   * @param record parsed record
   * @return {@code true} when the record was new and delivered; {@code false} for duplicates
   */
  public boolean offer(SeenKey key, SessionRecord record) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(record, "record");
    deliveryLock.lock();
    try {
      if (!deduplicator.tryMarkSeen(key)) {
        metrics.increment("lookout.bus.duplicates");
        return false;
      }
      metrics.increment("lookout.bus.emitted");
      for (Registration<SessionRecordListener> registration : listeners) {
        if (!registration.active()) {
          continue;
        }
        try {
          registration.listener().onRecord(record);
        } catch (RuntimeException ex) {
          metrics.increment("lookout.bus.listenerFailed");
          log.warn("Record listener {} failed on {} record {}",
              registration.listener().getClass().getName(), record.type(), record.uuid(), ex);
          reportError(MonitorDiagnostic.of(
              MonitorDiagnostic.Kind.LISTENER, null, "Record listener failed: " + ex.getMessage(), ex));
        }
      }
      return true;
    } finally {
      deliveryLock.unlock();
    }
  }

  /**
   * Publishes a diagnostic to error listeners.
   *
   * @param diagnostic non-fatal problem
   */
  public void reportError(MonitorDiagnostic diagnostic) {
    Objects.requireNonNull(diagnostic, "diagnostic");
    log.debug("Diagnostic {} for {}: {}", diagnostic.kind(), diagnostic.path(), diagnostic.message());
    for (Registration<MonitorErrorListener> registration : errorListeners) {
      if (!registration.active()) {
        continue;
      }
      try {
        registration.listener().onError(diagnostic);
      } catch (RuntimeException ex) {
        log.warn("Error listener {} failed", registration.listener().getClass().getName(), ex);
      }
    }
  }

  public int subscriberCount() {
    return listeners.size();
  }

  private static final class Registration<T> implements Subscription {
    private final T listener;
    private final List<Registration<T>> owner;
    private final AtomicBoolean active = new AtomicBoolean(true);

    private Registration(T listener, List<Registration<T>> owner) {
      this.listener = listener;
      this.owner = owner;
    }

    T listener() {
      return listener;
    }

    @Override
    public boolean active() {
      return active.get();
    }

    @Override
    public void close() {
      if (active.compareAndSet(true, false)) {
        owner.remove(this);
      }
    }
  }
}
