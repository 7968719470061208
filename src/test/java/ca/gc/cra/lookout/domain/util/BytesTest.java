package ca.gc.cra.lookout.domain.util;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class BytesTest {

  @Test
  void lastIndexOfRespectsLength() {
    byte[] data = {'a', '\n', 'b', '\n', 'c'};

    assertEquals(3, Bytes.lastIndexOf(data, data.length, (byte) '\n'));
    assertEquals(1, Bytes.lastIndexOf(data, 3, (byte) '\n'));
    assertEquals(-1, Bytes.lastIndexOf(data, 1, (byte) '\n'));
    assertEquals(-1, Bytes.lastIndexOf(null, 4, (byte) '\n'));
  }

  @Test
  void concatJoinsHeadAndSlice() {
    byte[] joined = Bytes.concat(new byte[] {1, 2}, new byte[] {9, 3, 4, 9}, 1, 2);

    assertArrayEquals(new byte[] {1, 2, 3, 4}, joined);
    assertArrayEquals(new byte[] {5}, Bytes.concat(null, new byte[] {5}, 0, 1));
    assertEquals(0, Bytes.concat(null, null, 0, 0).length);
  }
}
