package ca.gc.cra.lookout.testutil;

import ca.gc.cra.lookout.application.port.MetricsPort;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Test double capturing metric usage for assertions.
 */
public final class RecordingMetricsPort implements MetricsPort {
  private final Map<String, Integer> counters = new ConcurrentHashMap<>();
  private final Map<String, List<Long>> observations = new ConcurrentHashMap<>();

  @Override
  public void increment(String key) {
    counters.merge(key, 1, Integer::sum);
  }

  @Override
  public void observe(String key, long value) {
    observations.computeIfAbsent(key, k -> Collections.synchronizedList(new ArrayList<>())).add(value);
  }

  public int count(String key) {
    return counters.getOrDefault(key, 0);
  }

  public List<Long> observed(String key) {
    return observations.getOrDefault(key, List.of());
  }

  public boolean hasCounter(String key) {
    return counters.containsKey(key);
  }

  public void clear() {
    counters.clear();
    observations.clear();
  }
}
