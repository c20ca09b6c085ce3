package conj.engine;

import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class ConjectureDataTest {

  private static final long CUSTOM_LABEL = Util.labelFor("custom");

  @Test
  public void testBooleanFromZeroAndMaxBytes() {
    Assert.assertFalse(ConjectureData.forBuffer(new byte[] { 0 }).drawBoolean(0.5));
    Assert.assertTrue(ConjectureData.forBuffer(new byte[] { (byte) 0xFF }).drawBoolean(0.5));
  }

  @Test
  public void testZerosGiveSimplestValues() {
    ConjectureData data = ConjectureData.forBuffer(new byte[64]);
    Assert.assertEquals(0, data.drawInteger(-10, 10));
    Assert.assertEquals(5, data.drawInteger(5, 10));
    Assert.assertEquals(-3, data.drawInteger(-10, -3));
    Assert.assertEquals(0.0, data.drawFloat(-100, 100, false), 0.0);
    Assert.assertEquals("aa", data.drawString("abc", 2, 5));
    Assert.assertEquals(0, data.drawBytes(0, 10).length);
    Assert.assertEquals(6, data.nodes().size());
  }

  @Test
  public void testForcedIntegerReplays() {
    ConjectureData data = ConjectureData.forBuffer(new byte[16]);
    Assert.assertEquals(-7, data.drawInteger(new ChoiceConstraints.ForInteger(-10, 10), -7L));
    Assert.assertTrue(data.nodes().get(0).wasForced);
    data.freeze();
    Assert.assertTrue(data.asResult().isForced(0));

    ConjectureData replay = ConjectureData.forBuffer(data.buffer());
    Assert.assertEquals(-7, replay.drawInteger(-10, 10));
    Assert.assertFalse(replay.nodes().get(0).wasForced);
  }

  @Test
  public void testForcedFloatReplays() {
    ConjectureData data = ConjectureData.forBuffer(new byte[16]);
    ChoiceConstraints.ForFloat constraints = new ChoiceConstraints.ForFloat(-100, 100, false);
    Assert.assertEquals(-1.5, data.drawFloat(constraints, -1.5), 0.0);
    // Eight bytes of magnitude and one of sign
    Assert.assertEquals(9, data.index());

    ConjectureData replay = ConjectureData.forBuffer(data.buffer());
    Assert.assertEquals(-1.5, replay.drawFloat(-100, 100, false), 0.0);
  }

  @Test
  public void testFloatSignAndNaNReplayExactly() {
    ChoiceConstraints.ForFloat constraints = new ChoiceConstraints.ForFloat(-100, 100, true);
    ConjectureData data = ConjectureData.forBuffer(new byte[32]);
    Assert.assertEquals(Double.doubleToRawLongBits(-0.0), Double.doubleToRawLongBits(data.drawFloat(constraints, -0.0)));
    double payload = Double.longBitsToDouble(0x7ff8000000000001L);
    Assert.assertEquals(Double.doubleToRawLongBits(Double.NaN),
        Double.doubleToRawLongBits(data.drawFloat(constraints, payload)));

    ConjectureData replay = ConjectureData.forBuffer(data.buffer());
    Assert.assertEquals(Double.doubleToRawLongBits(-0.0), Double.doubleToRawLongBits(replay.drawFloat(-100, 100, true)));
    Assert.assertEquals(Double.doubleToRawLongBits(Double.NaN),
        Double.doubleToRawLongBits(replay.drawFloat(-100, 100, true)));
  }

  @Test
  public void testFloatOutOfRangeIsClamped() {
    byte[] buffer = new byte[9];
    Arrays.fill(buffer, (byte) 0xFF);
    double value = ConjectureData.forBuffer(buffer).drawFloat(0, 1, false);
    Assert.assertTrue(value >= 0 && value <= 1);
  }

  @Test
  public void testRunningOutIsAnOverrun() {
    ConjectureData data = ConjectureData.forBuffer(new byte[1]);
    try {
      data.drawBits(16);
      Assert.fail();
    } catch (StopTest e) {
      Assert.assertEquals(data.testCounter, e.testCounter);
    }
    Assert.assertTrue(data.isFrozen());
    Assert.assertEquals(Status.OVERRUN, data.status());
  }

  @Test(expected = ConjectureException.Frozen.class)
  public void testFrozenDataCanNotDraw() {
    ConjectureData data = ConjectureData.forBuffer(new byte[4]);
    data.drawBits(8);
    data.freeze();
    data.drawBits(8);
  }

  @Test(expected = ConjectureException.InvalidArgument.class)
  public void testForcedValueMustFit() {
    ConjectureData.forBuffer(new byte[4]).drawBits(4, 16L);
  }

  @Test
  public void testMarkInteresting() {
    ConjectureData data = ConjectureData.forBuffer(new byte[] { 3 });
    data.drawBits(8);
    data.target("score", 2.5);
    InterestingOrigin origin = InterestingOrigin.of("boom");
    try {
      data.markInteresting(origin);
      Assert.fail();
    } catch (StopTest e) {
      Assert.assertEquals(data.testCounter, e.testCounter);
    }
    ConjectureResult result = data.asResult();
    Assert.assertEquals(Status.INTERESTING, result.status);
    Assert.assertEquals(origin, result.interestingOrigin);
    Assert.assertArrayEquals(new byte[] { 3 }, result.buffer());
    Assert.assertEquals(2.5, result.targetObservations.get("score"), 0.0);
    Assert.assertSame(result, data.asResult());
  }

  @Test(expected = ConjectureException.UnsatisfiedAssumption.class)
  public void testAssume() {
    ConjectureData data = ConjectureData.forBuffer(new byte[0]);
    data.assume(true);
    data.assume(false);
  }

  @Test
  public void testSpanTree() {
    ConjectureData data = ConjectureData.forBuffer(new byte[] { 1, 2, 3 });
    Assert.assertEquals(0, data.depth());
    data.startSpan(CUSTOM_LABEL);
    Assert.assertEquals(1, data.depth());
    data.drawBits(8);
    data.drawBits(8);
    data.stopSpan(false);
    data.startSpan(CUSTOM_LABEL);
    data.drawBits(8);
    data.stopSpan(true);
    data.freeze();

    List<Span> spans = data.spans();
    Assert.assertEquals(6, spans.size());
    Span top = spans.get(0);
    Assert.assertEquals(0, top.start);
    Assert.assertEquals(3, top.end);
    Assert.assertEquals(2, top.children.size());

    Span first = spans.get(1);
    Assert.assertEquals(CUSTOM_LABEL, first.label);
    Assert.assertEquals(0, first.start);
    Assert.assertEquals(2, first.end);
    Assert.assertEquals(2, first.children.size());
    Assert.assertEquals(0, first.parent);
    Assert.assertFalse(first.discarded);

    Span second = spans.get(4);
    Assert.assertTrue(second.discarded);
    Assert.assertEquals(2, second.start);
    Assert.assertTrue(data.hasDiscards());
    Assert.assertEquals(3, data.blocks().size());
  }

  @Test(expected = ConjectureException.InvalidState.class)
  public void testSpansNeedFreezing() {
    ConjectureData.forBuffer(new byte[0]).spans();
  }

  @Test
  public void testReplayChoices() {
    List<ChoiceNode> choices = Arrays.asList(
        ChoiceNode.of(new ChoiceConstraints.ForInteger(0, 100), 42L),
        ChoiceNode.of(new ChoiceConstraints.ForBoolean(0.5), true),
        ChoiceNode.of(new ChoiceConstraints.ForString("xyz", 0, 5), "zy"));
    ConjectureData data = ConjectureData.forChoices(choices);
    Assert.assertEquals(42, data.drawInteger(0, 100));
    Assert.assertTrue(data.drawBoolean(0.5));
    Assert.assertEquals("zy", data.drawString("xyz", 0, 5));
    Assert.assertEquals(3, data.nodes().size());
    for (int i = 0; i < choices.size(); i++) {
      Assert.assertTrue(data.nodes().get(i).sameChoice(choices.get(i)));
      Assert.assertFalse(data.nodes().get(i).wasForced);
    }

    // The tape written during replay reproduces the same draws
    ConjectureData fromTape = ConjectureData.forBuffer(data.buffer());
    Assert.assertEquals(42, fromTape.drawInteger(0, 100));
    Assert.assertTrue(fromTape.drawBoolean(0.5));
    Assert.assertEquals("zy", fromTape.drawString("xyz", 0, 5));
  }

  @Test
  public void testReplayMismatchIsAnOverrun() {
    ConjectureData data = ConjectureData.forChoices(Collections.singletonList(
        ChoiceNode.of(new ChoiceConstraints.ForInteger(0, 100), 42L)));
    try {
      data.drawBoolean(0.5);
      Assert.fail();
    } catch (StopTest e) {
      Assert.assertEquals(Status.OVERRUN, data.status());
    }

    ConjectureData otherRange = ConjectureData.forChoices(Collections.singletonList(
        ChoiceNode.of(new ChoiceConstraints.ForInteger(0, 100), 42L)));
    try {
      otherRange.drawInteger(0, 50);
      Assert.fail();
    } catch (StopTest e) {
      Assert.assertEquals(Status.OVERRUN, otherRange.status());
    }

    ConjectureData pastEnd = ConjectureData.forChoices(Collections.emptyList());
    try {
      pastEnd.drawInteger(0, 10);
      Assert.fail();
    } catch (StopTest e) {
      Assert.assertEquals(Status.OVERRUN, pastEnd.status());
    }
  }

  @Test
  public void testMissingChoiceIsSimplest() {
    ConjectureData data = ConjectureData.forChoices(Arrays.<ChoiceNode>asList(null, null));
    Assert.assertEquals(5, data.drawInteger(5, 10));
    Assert.assertFalse(data.drawBoolean(0.9));
  }
}
