package conj.engine.shrinking;

import conj.engine.Floats;
import conj.engine.Util;
import org.junit.Assert;
import org.junit.Test;

import java.util.Random;

public class LexicalShrinkerTest {

  @Test
  public void testShrinksAsInteger() {
    byte[] result = LexicalShrinker.shrink(new byte[] { (byte) 0xFF, (byte) 0xFF },
        b -> Util.bytesToLong(b) >= 300, new Random(0), true);
    Assert.assertArrayEquals(new byte[] { 1, 44 }, result);
  }

  @Test
  public void testEncodedFloatShrinksToInteger() {
    byte[] initial = Util.longToBytes(Floats.floatToLex(123.456), 8);
    byte[] result = LexicalShrinker.shrink(initial,
        b -> Floats.lexToFloat(Util.bytesToLong(b)) >= 100, new Random(0), true);
    Assert.assertEquals(100.0, Floats.lexToFloat(Util.bytesToLong(result)), 0.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testSizeIsFixed() {
    new LexicalShrinker(new byte[] { 1 }, b -> true, new Random(0), false).incorporate(new byte[2]);
  }
}
