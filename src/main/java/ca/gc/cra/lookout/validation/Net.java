package ca.gc.cra.lookout.validation;

import java.util.regex.Pattern;

/**
 * Validation for {@code host:port} endpoints such as Kafka bootstrap servers.
 *
 * @since 0.1.0
 */
public final class Net {
  private static final int MAX_HOSTNAME_LENGTH = 253;
  private static final Pattern LABEL = Pattern.compile("^[A-Za-z0-9](?:[A-Za-z0-9-]{0,61}[A-Za-z0-9])?$");
  private static final Pattern IPV4 = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");

  private Net() {
    // Utility
  }

  /**
   * Validates a comma-separated list of {@code host:port} entries.
   *
   * @param value raw bootstrap list
   * @return normalized list without whitespace
   * @throws IllegalArgumentException when any entry is invalid
   */
  public static String validateBootstrapServers(String value) {
    String sanitized = Strings.requireNonBlank("kafkaBootstrap", value);
    StringBuilder out = new StringBuilder();
    for (String entry : sanitized.split(",")) {
      if (entry.isBlank()) {
        continue;
      }
      if (out.length() > 0) {
        out.append(',');
      }
      out.append(validateHostPort(entry));
    }
    if (out.length() == 0) {
      throw new IllegalArgumentException("kafkaBootstrap must list at least one host:port");
    }
    return out.toString();
  }

  /**
   * Validates one {@code host:port} entry; IPv6 hosts must be bracketed.
   *
   * @param value raw entry
   * @return normalized entry
   * @throws IllegalArgumentException when the entry is malformed
   */
  public static String validateHostPort(String value) {
    String sanitized = Strings.requireNonBlank("host:port", value);
    String host;
    String portPart;
    if (sanitized.startsWith("[")) {
      int idx = sanitized.indexOf(']');
      if (idx < 0 || idx + 2 > sanitized.length() || sanitized.charAt(idx + 1) != ':') {
        throw new IllegalArgumentException("host:port must use [IPv6]:PORT format");
      }
      host = sanitized.substring(0, idx + 1);
      portPart = sanitized.substring(idx + 2);
    } else {
      int lastColon = sanitized.lastIndexOf(':');
      if (lastColon <= 0 || lastColon == sanitized.length() - 1) {
        throw new IllegalArgumentException("host:port must use HOST:PORT format");
      }
      host = sanitized.substring(0, lastColon);
      portPart = sanitized.substring(lastColon + 1);
      if (host.indexOf(':') >= 0) {
        throw new IllegalArgumentException("IPv6 host must be wrapped in [ ]");
      }
      validateHost(host);
    }
    int port;
    try {
      port = Integer.parseInt(portPart);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("port must be numeric (was " + portPart + ")", ex);
    }
    Numbers.requireRange("port", port, 1, 65535);
    return host + ':' + port;
  }

  private static void validateHost(String host) {
    if (IPV4.matcher(host).matches()) {
      for (String octet : host.split("\\.")) {
        Numbers.requireRange("IPv4 octet", Integer.parseInt(octet), 0, 255);
      }
      return;
    }
    if (host.length() > MAX_HOSTNAME_LENGTH) {
      throw new IllegalArgumentException("invalid hostname length: " + host.length());
    }
    for (String label : host.split("\\.", -1)) {
      if (!LABEL.matcher(label).matches()) {
        throw new IllegalArgumentException("invalid hostname label: '" + label + "'");
      }
    }
  }
}
