package conj.engine.shrinking;

import org.junit.Assert;
import org.junit.Test;

import java.util.Random;

public class FloatShrinkerTest {

  @Test
  public void testShrinksToSimplestInteger() {
    Assert.assertEquals(2.0, FloatShrinker.shrink(123.456, f -> f >= 1.5, new Random(0), true), 0.0);
  }

  @Test
  public void testPrefersPositive() {
    Assert.assertEquals(3.0, FloatShrinker.shrink(-7.25, f -> Math.abs(f) >= 3, new Random(0), true), 0.0);
  }

  @Test
  public void testKeepsSignWhenRequired() {
    Assert.assertEquals(-1.0, FloatShrinker.shrink(-7.25, f -> f < 0, new Random(0), true), 0.0);
  }

  @Test
  public void testKeepsFractionWhenRequired() {
    double result = FloatShrinker.shrink(10.5, f -> f != Math.rint(f), new Random(0), true);
    Assert.assertEquals(0.5, result - Math.floor(result), 0.0);
    Assert.assertTrue(result < 10.5);
  }

  @Test
  public void testNaNShrinksToZeroWhenAllowed() {
    Assert.assertEquals(0.0, FloatShrinker.shrink(Double.NaN, f -> true, new Random(0), true), 0.0);
  }
}
