package ca.gc.cra.lookout.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads a LOOKOUT YAML file and flattens the {@code common} section plus the section of the active command
 * ({@code watch} or {@code replay}) into dotted {@code key=value} settings. The command section wins.
 *
 * <pre>
 * common:
 *   logRoot: /home/dev/.claude/projects
 * watch:
 *   workingDirectory: /work/app
 *   includeExisting: true
 * </pre>
 *
 * @since 0.1.0
 */
public final class YamlConfigLoader {

  private YamlConfigLoader() {}

  /**
   * Loads and flattens {@code path} for {@code mode}.
   *
   * @param path YAML file
   * @param mode command name
   * @return flattened settings; empty for an empty document
   * @throws NoSuchFileException when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the document is not a mapping or contains lists
   */
  public static Map<String, String> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(mode, "mode");
    if (!Files.exists(path)) {
      throw new NoSuchFileException(path.toString(), null, "config file not found");
    }
    String section = mode.trim().toLowerCase(Locale.ROOT);
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
      if (document == null) {
        return Map.of();
      }
      Map<String, Object> root = asMap(document, "root");
      Map<String, String> flattened = new LinkedHashMap<>();
      Object common = section(root, "common");
      if (common != null) {
        flatten(asMap(common, "common"), "", flattened);
      }
      Object modeSection = section(root, section);
      if (modeSection != null) {
        flatten(asMap(modeSection, section), "", flattened);
      }
      return Map.copyOf(flattened);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key) || key.isBlank()) {
        throw new IllegalArgumentException(context + " section contains a blank or non-string key");
      }
      map.put(key.trim(), entry.getValue());
    }
    return map;
  }

  private static Object section(Map<String, Object> root, String name) {
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (entry.getKey().toLowerCase(Locale.ROOT).equals(name)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = prefix.isEmpty() ? entry.getKey() : prefix + '.' + entry.getKey();
      Object value = entry.getValue();
      if (value == null) {
        target.put(key, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, key), key, target);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML lists are not supported for key " + key);
      } else {
        target.put(key, value.toString());
      }
    }
  }
}
