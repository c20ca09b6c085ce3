package conj.engine.shrinking;

import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;

public class MinimizerTest {

  private static int sum(byte[] bytes) {
    int sum = 0;
    for (byte b : bytes) sum += b & 0xFF;
    return sum;
  }

  @Test
  public void testMovesValueToTheEnd() {
    byte[] initial = new byte[8];
    Arrays.fill(initial, (byte) 0xFF);
    byte[] expected = new byte[8];
    expected[7] = 11;
    Assert.assertArrayEquals(expected, Minimizer.minimize(initial, b -> sum(b) > 10));
  }

  @Test
  public void testSingleByte() {
    Assert.assertArrayEquals(new byte[] { 17 },
        Minimizer.minimize(new byte[] { (byte) 200 }, b -> (b[0] & 0xFF) >= 17));
  }

  @Test
  public void testZeroIsLeftAlone() {
    Minimizer minimizer = new Minimizer(new byte[3], b -> true, true);
    minimizer.run();
    Assert.assertArrayEquals(new byte[3], minimizer.current());
    Assert.assertEquals(0, minimizer.changes());
  }

  @Test
  public void testNeverGrows() {
    byte[] initial = { 3, 1, 2 };
    // Only tapes with a 3 somewhere satisfy the condition
    byte[] result = Minimizer.minimize(initial, b -> {
      for (byte x : b) if (x == 3) return true;
      return false;
    });
    Assert.assertArrayEquals(new byte[] { 0, 0, 3 }, result);
  }

  @Test
  public void testSortsBytes() {
    byte[] result = Minimizer.minimize(new byte[] { 9, 4 }, b -> {
      int[] sorted = { b[0] & 0xFF, b[1] & 0xFF };
      Arrays.sort(sorted);
      return sorted[0] == 4 && sorted[1] == 9;
    });
    Assert.assertArrayEquals(new byte[] { 4, 9 }, result);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testSizeIsFixed() {
    new Minimizer(new byte[] { 1, 2 }, b -> true, true).incorporate(new byte[] { 0 });
  }
}
