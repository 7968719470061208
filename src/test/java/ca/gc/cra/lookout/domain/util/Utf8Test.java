package ca.gc.cra.lookout.domain.util;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class Utf8Test {

  @Test
  void decodesSliceAndDropsCarriageReturn() {
    byte[] data = "xx{\"é\":1}\r".getBytes(StandardCharsets.UTF_8);

    assertEquals("{\"é\":1}", Utf8.decodeLine(data, 2, data.length - 2));
  }

  @Test
  void emptyInputs() {
    assertEquals("", Utf8.decodeLine(null, 0, 3));
    assertEquals("", Utf8.decodeLine(new byte[] {'\r'}, 0, 1));
    assertEquals("", Utf8.decodeLine(new byte[] {'a'}, 0, 0));
  }
}
