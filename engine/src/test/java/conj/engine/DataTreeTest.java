package conj.engine;

import org.junit.Assert;
import org.junit.Test;

import java.util.Random;

public class DataTreeTest {

  private static ConjectureResult run(byte[] buffer, TestFunction test) {
    ConjectureData data = ConjectureData.forBuffer(buffer);
    try {
      test.run(data);
    } catch (StopTest e) {
      Assert.assertEquals(data.testCounter, e.testCounter);
    }
    data.freeze();
    return data.asResult();
  }

  @Test
  public void testLookupFindsRecordedResults() {
    DataTree tree = new DataTree();
    TestFunction test = data -> data.drawBits(8);
    ConjectureResult five = run(new byte[] { 5 }, test);
    tree.record(five, 100);
    Assert.assertSame(five, tree.lookup(new byte[] { 5 }));
    Assert.assertSame(five, tree.lookup(new byte[] { 5, 1, 2 }));
    Assert.assertNull(tree.lookup(new byte[] { 6 }));
    Assert.assertSame(ConjectureResult.OVERRUN, tree.lookup(new byte[0]));
  }

  @Test
  public void testMaskedBytesShareAPath() {
    DataTree tree = new DataTree();
    TestFunction test = data -> data.drawBits(1);
    ConjectureResult one = run(new byte[] { 1 }, test);
    tree.record(one, 100);
    // 3 and 1 only differ in masked bits
    Assert.assertSame(one, tree.lookup(new byte[] { 3 }));
  }

  @Test
  public void testExhaustion() {
    DataTree tree = new DataTree();
    TestFunction test = data -> data.drawBoolean(0.5);
    tree.record(run(new byte[] { 0 }, test), 100);
    Assert.assertFalse(tree.isExhausted());
    byte[] prefix = tree.generateNovelPrefix(new Random(0), 100);
    Assert.assertArrayEquals(new byte[] { 1 }, prefix);
    tree.record(run(new byte[] { 1 }, test), 100);
    Assert.assertTrue(tree.isExhausted());
  }

  @Test
  public void testOverrunsDoNotKillNodes() {
    DataTree tree = new DataTree();
    TestFunction test = data -> data.drawBits(16);
    ConjectureResult overrun = run(new byte[] { 1 }, test);
    Assert.assertEquals(Status.OVERRUN, overrun.status);
    tree.record(overrun, 100);
    Assert.assertFalse(tree.isExhausted());
    Assert.assertNull(tree.lookup(new byte[] { 2, 0 }));
  }

  @Test
  public void testNovelPrefixAvoidsDeadBranches() {
    DataTree tree = new DataTree();
    TestFunction test = data -> {
      if (data.drawBits(2) == 0) data.drawBits(8);
    };
    for (byte b : new byte[] { 1, 2, 3 }) tree.record(run(new byte[] { b }, test), 100);
    Random random = new Random(7);
    for (int i = 0; i < 20; i++) {
      byte[] prefix = tree.generateNovelPrefix(random, 100);
      Assert.assertEquals(0, prefix[0]);
    }
  }

  @Test
  public void testReset() {
    DataTree tree = new DataTree();
    tree.record(run(new byte[0], data -> { }), 100);
    Assert.assertTrue(tree.isExhausted());
    tree.reset();
    Assert.assertFalse(tree.isExhausted());
    Assert.assertEquals(1, tree.nodeCount());
  }
}
