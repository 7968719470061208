package ca.gc.cra.lookout.infrastructure.events;

import ca.gc.cra.lookout.application.port.MonitorErrorListener;
import ca.gc.cra.lookout.domain.events.MonitorDiagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs monitor diagnostics at WARN. Parse failures are logged without a stack trace.
 *
 * @since 0.1.0
 */
public final class LoggingErrorListener implements MonitorErrorListener {
  private static final Logger log = LoggerFactory.getLogger(LoggingErrorListener.class);

  @Override
  public void onError(MonitorDiagnostic diagnostic) {
    if (diagnostic.kind() == MonitorDiagnostic.Kind.PARSE || diagnostic.cause() == null) {
      log.warn("monitor.{} path={} {}", diagnostic.kind(), diagnostic.path(), diagnostic.message());
    } else {
      log.warn("monitor.{} path={} {}", diagnostic.kind(), diagnostic.path(), diagnostic.message(),
          diagnostic.cause());
    }
  }
}
