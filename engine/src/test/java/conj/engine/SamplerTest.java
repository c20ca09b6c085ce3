package conj.engine;

import org.junit.Assert;
import org.junit.Test;

import java.util.Random;

public class SamplerTest {

  @Test
  public void testZeroDataPicksFirstPossibleIndex() {
    Assert.assertEquals(1, new Sampler(new double[] { 0, 1 }).sample(ConjectureData.forBuffer(new byte[8])));
    Assert.assertEquals(0, new Sampler(new double[] { 1, 1, 1 }).sample(ConjectureData.forBuffer(new byte[8])));
  }

  @Test
  public void testForcedIndexReplays() {
    Sampler sampler = new Sampler(new double[] { 1, 1, 1 });
    ConjectureData data = ConjectureData.forBuffer(new byte[8]);
    Assert.assertEquals(2, sampler.sample(data, 2));
    Assert.assertEquals(2, sampler.sample(ConjectureData.forBuffer(data.buffer())));
  }

  @Test
  public void testZeroWeightNeverDrawn() {
    Sampler sampler = new Sampler(new double[] { 3, 0, 1 });
    Random random = new Random(42);
    for (int i = 0; i < 200; i++) {
      byte[] buffer = new byte[64];
      random.nextBytes(buffer);
      Assert.assertNotEquals(1, sampler.sample(ConjectureData.forBuffer(buffer)));
    }
  }

  @Test(expected = ConjectureException.InvalidArgument.class)
  public void testZeroWeightCanNotBeForced() {
    new Sampler(new double[] { 1, 0 }).sample(ConjectureData.forBuffer(new byte[8]), 1);
  }

  @Test(expected = ConjectureException.InvalidArgument.class)
  public void testAllZeroWeights() {
    new Sampler(new double[] { 0, 0 });
  }
}
