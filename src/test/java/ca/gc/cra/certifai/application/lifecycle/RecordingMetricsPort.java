package ca.gc.cra.certifai.application.lifecycle;

import ca.gc.cra.certifai.application.port.MetricsPort;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Test double capturing metric usage for assertions.
 */
final class RecordingMetricsPort implements MetricsPort {
  private final Map<String, Integer> counters = new HashMap<>();
  private final Map<String, List<Long>> observations = new HashMap<>();

  @Override
  public synchronized void increment(String key) {
    counters.merge(key, 1, Integer::sum);
  }

  @Override
  public synchronized void observe(String key, long value) {
    observations.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
  }

  synchronized int count(String key) {
    return counters.getOrDefault(key, 0);
  }

  synchronized List<Long> observed(String key) {
    return observations.getOrDefault(key, Collections.emptyList());
  }
}
