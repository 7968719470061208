package ca.gc.cra.lookout.domain.record;

import java.util.Locale;

/**
 * Entry of the agent's todo list.
 *
 * @param content task description
 * @param status {@code pending}, {@code in_progress} or {@code completed}
 * @param activeForm present-tense label shown while the task runs, or {@code null}
 * @since 0.1.0
 */
public record TodoItem(String content, String status, String activeForm) {
  public TodoItem {
    content = content == null ? "" : content;
    status = status == null ? "pending" : status.trim().toLowerCase(Locale.ROOT);
  }

  public boolean completed() {
    return "completed".equals(status);
  }

  public boolean inProgress() {
    return "in_progress".equals(status);
  }

  public boolean pending() {
    return "pending".equals(status);
  }
}
