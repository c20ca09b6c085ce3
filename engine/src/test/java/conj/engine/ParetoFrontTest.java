package conj.engine;

import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

public class ParetoFrontTest {

  private static ConjectureResult valid(int b, Double score) {
    ConjectureData data = ConjectureData.forBuffer(new byte[] { (byte) b });
    data.drawBits(8);
    if (score != null) data.target("score", score);
    data.freeze();
    return data.asResult();
  }

  private static ConjectureResult invalid(int b) {
    ConjectureData data = ConjectureData.forBuffer(new byte[] { (byte) b });
    data.drawBits(8);
    try {
      data.markInvalid();
    } catch (StopTest e) {
      Assert.assertEquals(data.testCounter, e.testCounter);
    }
    return data.asResult();
  }

  @Test
  public void testDominance() {
    ConjectureResult zero = valid(0, null);
    ConjectureResult one = valid(1, null);
    Assert.assertEquals(ParetoFront.Dominance.EQUAL, ParetoFront.dominance(zero, valid(0, null)));
    Assert.assertEquals(ParetoFront.Dominance.LEFT_DOMINATES, ParetoFront.dominance(zero, one));
    Assert.assertEquals(ParetoFront.Dominance.RIGHT_DOMINATES, ParetoFront.dominance(one, zero));
    // A simpler tape with a worse score dominates nothing
    Assert.assertEquals(ParetoFront.Dominance.NO_DOMINANCE,
        ParetoFront.dominance(valid(0, 1.0), valid(1, 2.0)));
    // Nor does a simpler tape with a worse status
    Assert.assertEquals(ParetoFront.Dominance.NO_DOMINANCE, ParetoFront.dominance(invalid(0), one));
  }

  @Test
  public void testDominatedMembersAreEvicted() {
    ParetoFront front = new ParetoFront(new Random(0));
    List<ConjectureResult> evicted = new ArrayList<>();
    front.onEvict(evicted::add);
    ConjectureResult one = valid(1, null);
    Assert.assertTrue(front.add(one));
    Assert.assertFalse(front.add(one));
    ConjectureResult zero = valid(0, null);
    Assert.assertTrue(front.add(zero));
    Assert.assertEquals(1, front.size());
    Assert.assertTrue(front.contains(zero));
    Assert.assertFalse(front.contains(one));
    Assert.assertEquals(1, evicted.size());
    Assert.assertSame(one, evicted.get(0));
  }

  @Test
  public void testDominatedAdditionIsRejected() {
    ParetoFront front = new ParetoFront(new Random(0));
    List<ConjectureResult> evicted = new ArrayList<>();
    front.onEvict(evicted::add);
    front.add(valid(0, null));
    Assert.assertFalse(front.add(valid(1, null)));
    Assert.assertEquals(1, front.size());
    // The rejected addition was never a member, so nothing was evicted
    Assert.assertTrue(evicted.isEmpty());
  }

  @Test
  public void testIncomparableResultsCoexist() {
    ParetoFront front = new ParetoFront(new Random(0));
    front.add(valid(0, 1.0));
    front.add(valid(1, 2.0));
    front.add(valid(2, 3.0));
    Assert.assertEquals(3, front.size());
    int count = 0;
    for (ConjectureResult ignored : front) count++;
    Assert.assertEquals(3, count);
  }

  @Test
  public void testInvalidResultsNeverAdded() {
    ParetoFront front = new ParetoFront(new Random(0));
    Assert.assertFalse(front.add(invalid(0)));
    Assert.assertEquals(0, front.size());
  }
}
