package ca.gc.cra.lookout.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NetTest {

  @Test
  void validateHostPortHandlesHostname() {
    assertEquals("broker-1.example.com:9092", Net.validateHostPort("broker-1.example.com:9092"));
  }

  @Test
  void validateHostPortHandlesIpv4() {
    assertEquals("10.0.0.1:9092", Net.validateHostPort("10.0.0.1:9092"));
  }

  @Test
  void validateHostPortHandlesIpv6() {
    assertEquals("[2001:db8::1]:9093", Net.validateHostPort("[2001:db8::1]:9093"));
  }

  @Test
  void validateHostPortRejectsMissingPort() {
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("localhost"));
  }

  @Test
  void validateHostPortRejectsInvalidPort() {
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("localhost:70000"));
  }

  @Test
  void validateHostPortRejectsIpv6WithoutBrackets() {
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("2001:db8::1:443"));
  }

  @Test
  void bootstrapListIsNormalized() {
    assertEquals("a:9092,b:9093", Net.validateBootstrapServers(" a:9092 , ,b:9093 "));
  }

  @Test
  void bootstrapListRejectsEmptyEntries() {
    assertThrows(IllegalArgumentException.class, () -> Net.validateBootstrapServers(","));
  }
}
