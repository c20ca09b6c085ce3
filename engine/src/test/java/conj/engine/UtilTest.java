package conj.engine;

import org.junit.Assert;
import org.junit.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class UtilTest {

  @Test
  public void testSortKeyIsShortlex() {
    List<byte[]> tapes = new ArrayList<>(Arrays.asList(
        new byte[] { 0, 0, 1 },
        new byte[] { (byte) 0xFF },
        new byte[] { },
        new byte[] { 0, (byte) 0x80 },
        new byte[] { 0, 1 }));
    tapes.sort(Util.SORT_KEY);
    Assert.assertArrayEquals(new byte[] { }, tapes.get(0));
    Assert.assertArrayEquals(new byte[] { (byte) 0xFF }, tapes.get(1));
    Assert.assertArrayEquals(new byte[] { 0, 1 }, tapes.get(2));
    Assert.assertArrayEquals(new byte[] { 0, (byte) 0x80 }, tapes.get(3));
    Assert.assertArrayEquals(new byte[] { 0, 0, 1 }, tapes.get(4));
    Assert.assertTrue(Util.sortKeyLess(new byte[] { 1 }, new byte[] { 0, 0 }));
    Assert.assertFalse(Util.sortKeyLess(new byte[] { 1 }, new byte[] { 1 }));
  }

  @Test
  public void testFindInteger() {
    Assert.assertEquals(0, Util.findInteger(n -> n < 1));
    Assert.assertEquals(3, Util.findInteger(n -> n <= 3));
    Assert.assertEquals(1000, Util.findInteger(n -> n <= 1000));
    // Only finds a local boundary when the predicate is not monotone
    int found = Util.findInteger(n -> n <= 2 || (n >= 10 && n <= 20));
    Assert.assertEquals(2, found);
  }

  @Test
  public void testIntegerConversions() {
    Assert.assertEquals(0x0102L, Util.bytesToLong(new byte[] { 1, 2 }));
    Assert.assertEquals(0xFFL, Util.bytesToLong(new byte[] { 0, 0, 0, 1, (byte) 0xFF }, 4, 5));
    Assert.assertArrayEquals(new byte[] { 0, 0, 1, 0 }, Util.longToBytes(256, 4));
    Assert.assertEquals(BigInteger.valueOf(0x8000), Util.bytesToBigInteger(new byte[] { (byte) 0x80, 0 }));
    Assert.assertArrayEquals(new byte[] { 0, 0, 7 }, Util.bigIntegerToBytes(BigInteger.valueOf(7), 3));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testBigIntegerTooLarge() {
    Util.bigIntegerToBytes(BigInteger.valueOf(256), 1);
  }

  @Test
  public void testByteHelpers() {
    byte[] buffer = { 1, 2, 3, 4, 5 };
    Assert.assertArrayEquals(new byte[] { 1, 4, 5 }, Util.withRemoved(buffer, 1, 3));
    Assert.assertArrayEquals(new byte[] { 1, 2, 3 }, Util.concat(new byte[] { 1 }, new byte[0], new byte[] { 2, 3 }));
    Assert.assertTrue(Util.startsWith(buffer, new byte[] { 1, 2 }));
    Assert.assertFalse(Util.startsWith(new byte[] { 1 }, new byte[] { 1, 2 }));
    Assert.assertTrue(Util.allZero(new byte[3]));
    Assert.assertArrayEquals(new byte[] { 3, 0 }, Util.nonZeroSuffix(new byte[] { 0, 0, 3, 0 }));
    Assert.assertEquals("00ff10", Util.hex(new byte[] { 0, (byte) 0xFF, 0x10 }));
  }
}
