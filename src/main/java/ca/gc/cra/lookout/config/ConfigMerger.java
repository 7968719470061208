package ca.gc.cra.lookout.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Merges defaults, YAML and CLI settings with precedence CLI &gt; YAML &gt; defaults and checks cross-key
 * rules.
 *
 * @since 0.1.0
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective settings.
   *
   * @param mode active command
   * @param yaml YAML settings for the command; may be empty
   * @param cli CLI overrides; may be empty
   * @param defaults defaults for the command
   * @param warn receives a message for every CLI key that overrides a YAML key; may be {@code null}
   * @return immutable merged settings
   * @throws IllegalArgumentException when the merged settings are inconsistent
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Map<String, String> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Map<String, String> yamlCopy = yaml == null ? Map.of() : yaml;
    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    if (cli != null) {
      for (Map.Entry<String, String> entry : cli.entrySet()) {
        if (entry.getKey() == null || entry.getValue() == null) {
          continue;
        }
        if (yamlCopy.containsKey(entry.getKey()) && warn != null) {
          warn.accept("CLI overrides YAML for key: " + entry.getKey());
        }
        merged.put(entry.getKey(), entry.getValue());
      }
    }
    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    if (IoMode.fromString(effective.get("outMode")) == IoMode.KAFKA && trim(effective.get("kafkaBootstrap")).isEmpty()) {
      throw new IllegalArgumentException("kafkaBootstrap is required when outMode=KAFKA");
    }
    if ("watch".equalsIgnoreCase(mode)) {
      int targets = 0;
      for (String key : new String[] {"sessionId", "directory", "workingDirectory"}) {
        if (!trim(effective.get(key)).isEmpty()) {
          targets++;
        }
      }
      if (targets > 1) {
        throw new IllegalArgumentException("Specify only one of sessionId, directory or workingDirectory");
      }
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
