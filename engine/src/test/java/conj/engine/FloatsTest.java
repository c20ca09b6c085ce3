package conj.engine;

import org.junit.Assert;
import org.junit.Test;

public class FloatsTest {

  @Test
  public void testSmallIntegersComeFirst() {
    long zero = Floats.floatToLex(0.0);
    long one = Floats.floatToLex(1.0);
    long two = Floats.floatToLex(2.0);
    long oneAndHalf = Floats.floatToLex(1.5);
    Assert.assertEquals(0L, zero);
    Assert.assertEquals(1L, one);
    Assert.assertEquals(2L, two);
    Assert.assertTrue(Floats.compareLex(zero, one) < 0);
    Assert.assertTrue(Floats.compareLex(one, two) < 0);
    Assert.assertTrue(Floats.compareLex(two, oneAndHalf) < 0);
    // Anything that is not a simple integer has the top bit set
    Assert.assertTrue(oneAndHalf < 0);
  }

  @Test
  public void testSignIsIgnored() {
    Assert.assertEquals(Floats.floatToLex(3.0), Floats.floatToLex(-3.0));
    Assert.assertEquals(Floats.floatToLex(2.5), Floats.floatToLex(-2.5));
  }

  @Test
  public void testSimplerFractionsFirst() {
    // Half is a single fractional bit, a quarter needs two
    Assert.assertTrue(Floats.lexLess(2.5, 2.25));
    // Larger non-negative exponents come before negative ones
    Assert.assertTrue(Floats.lexLess(1.5, 0.5));
    Assert.assertTrue(Floats.lexLess(Double.MAX_VALUE, Double.POSITIVE_INFINITY));
    Assert.assertTrue(Floats.lexLess(Double.POSITIVE_INFINITY, Double.NaN));
  }

  @Test
  public void testDecodeMatchesEncode() {
    for (double f : new double[] { 0.0, 1.0, 1.5, 0.1, 123456.789, 0x1p60, Double.MIN_VALUE, Double.MAX_VALUE,
        Double.POSITIVE_INFINITY }) {
      Assert.assertEquals(Double.doubleToRawLongBits(f), Double.doubleToRawLongBits(Floats.lexToFloat(Floats.floatToLex(f))));
    }
    Assert.assertEquals(Double.doubleToRawLongBits(Double.NaN),
        Double.doubleToRawLongBits(Floats.lexToFloat(Floats.floatToLex(Double.NaN))));
  }

  @Test
  public void testNaNIsCanonical() {
    double payload = Double.longBitsToDouble(0x7ff8000000000001L);
    Assert.assertTrue(Double.isNaN(payload));
    Assert.assertEquals(Double.doubleToRawLongBits(Double.NaN), Double.doubleToRawLongBits(Floats.canonicalize(payload)));
    Assert.assertEquals(Floats.floatToLex(Double.NaN), Floats.floatToLex(payload));
    Assert.assertEquals(Double.doubleToRawLongBits(Double.NaN),
        Double.doubleToRawLongBits(Floats.lexToFloat(Floats.floatToLex(payload))));
  }

  @Test
  public void testNegativeZero() {
    // The magnitude is shared, the sign lives elsewhere
    Assert.assertEquals(0L, Floats.floatToLex(-0.0));
    Assert.assertEquals(Double.doubleToRawLongBits(-0.0), Double.doubleToRawLongBits(Floats.canonicalize(-0.0)));
  }

  @Test
  public void testIsSimple() {
    Assert.assertTrue(Floats.isSimple(0.0));
    Assert.assertTrue(Floats.isSimple(-17.0));
    Assert.assertFalse(Floats.isSimple(0.5));
    Assert.assertFalse(Floats.isSimple(0x1p56));
    Assert.assertFalse(Floats.isSimple(Double.NaN));
  }
}
