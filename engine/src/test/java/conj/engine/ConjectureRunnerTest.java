package conj.engine;

import org.junit.Assert;
import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

public class ConjectureRunnerTest {

  private static final InterestingOrigin SMALL = InterestingOrigin.of("small");
  private static final InterestingOrigin LARGE = InterestingOrigin.of("large");

  private static ConjectureRunner.Config.Builder config() {
    return ConjectureRunner.Config.builder().random(new Random(1234));
  }

  private static byte[] onlyBuffer(ConjectureRunner runner) {
    Assert.assertEquals(1, runner.interestingExamples().size());
    return runner.interestingExamples().values().iterator().next().buffer();
  }

  @Test
  public void testShrinksSavedFailureToSmallestSum() {
    ExampleDatabase db = new ExampleDatabase.InMemory();
    byte[] key = "sum".getBytes(StandardCharsets.UTF_8);
    byte[] initial = new byte[10];
    Arrays.fill(initial, (byte) 0xFF);
    db.save(key, initial);
    ConjectureRunner runner = new ConjectureRunner(data -> {
      int sum = 0;
      for (int i = 0; i < 10; i++) sum += (int) data.drawBits(8);
      if (sum >= 2000) data.markInteresting(InterestingOrigin.of("sum"));
    }, config().database(db).databaseKey("sum").maxShrinks(100000).maxShrinkStall(100000).build());
    runner.run();
    byte[] expected = new byte[10];
    Arrays.fill(expected, (byte) 0xFF);
    expected[0] = 0;
    expected[1] = 0;
    expected[2] = (byte) 215;
    Assert.assertArrayEquals(expected, onlyBuffer(runner));
    Assert.assertEquals(ConjectureRunner.ExitReason.FINISHED, runner.exitReason());
    // The shrunk example replaces the saved one
    Assert.assertTrue(db.fetch(key).stream().anyMatch(v -> Arrays.equals(v, expected)));
  }

  @Test
  public void testFindsAndShrinksGeneratedFailure() {
    ConjectureRunner runner = new ConjectureRunner(data -> {
      if (data.drawInteger(0, 1000) > 900) data.markInteresting(LARGE);
    }, config().build());
    runner.run();
    byte[] buffer = onlyBuffer(runner);
    Assert.assertEquals(901, ConjectureData.forBuffer(buffer).drawInteger(0, 1000));
  }

  @Test
  public void testShrinksDistinctFailuresSeparately() {
    ExampleDatabase db = new ExampleDatabase.InMemory();
    byte[] key = "multi".getBytes(StandardCharsets.UTF_8);
    db.save(key, new byte[] { 0 });
    db.save(key, new byte[] { (byte) 0xFF });
    ConjectureRunner runner = new ConjectureRunner(data -> {
      long b = data.drawBits(8);
      if (b < 10) data.markInteresting(SMALL);
      if (b > 245) data.markInteresting(LARGE);
    }, config().database(db).databaseKey("multi").build());
    runner.run();
    Assert.assertEquals(2, runner.interestingExamples().size());
    Assert.assertArrayEquals(new byte[] { 0 }, runner.interestingExamples().get(SMALL).buffer());
    Assert.assertArrayEquals(new byte[] { (byte) 246 }, runner.interestingExamples().get(LARGE).buffer());
    Assert.assertTrue(db.fetch(key).stream().anyMatch(v -> Arrays.equals(v, new byte[] { (byte) 246 })));
    try {
      runner.raiseFailures();
      Assert.fail();
    } catch (ConjectureException.MultipleFailures e) {
      Assert.assertEquals(2, e.failures.size());
    }
  }

  @Test
  public void testOnlySimplestFailureRaisedWhenNotReportingMultiple() {
    ExampleDatabase db = new ExampleDatabase.InMemory();
    byte[] key = "single".getBytes(StandardCharsets.UTF_8);
    db.save(key, new byte[] { 3 });
    db.save(key, new byte[] { (byte) 0xFF });
    ConjectureRunner runner = new ConjectureRunner(TestFunction.failuresAsInteresting(data -> {
      long b = data.drawBits(8);
      if (b < 10) throw new IllegalStateException("small " + b);
      if (b > 245) throw new IllegalArgumentException("large " + b);
    }), config().database(db).databaseKey("single").reportMultipleBugs(false).build());
    runner.run();
    Assert.assertEquals(2, runner.interestingExamples().size());
    try {
      runner.raiseFailures();
      Assert.fail();
    } catch (IllegalStateException e) {
      Assert.assertEquals("small 0", e.getMessage());
    }
  }

  @Test
  public void testFlakyFailure() {
    AtomicInteger calls = new AtomicInteger();
    ConjectureRunner runner = new ConjectureRunner(data -> {
      data.drawBits(8);
      if (calls.getAndIncrement() == 0) data.markInteresting(SMALL);
    }, config().build());
    runner.run();
    Assert.assertEquals(ConjectureRunner.ExitReason.FLAKY, runner.exitReason());
    try {
      runner.raiseFailures();
      Assert.fail();
    } catch (ConjectureException.Flaky e) {
      Assert.assertTrue(e.getMessage().contains("no longer fails"));
    }
  }

  @Test
  public void testFailureWithDifferentOriginIsFlaky() {
    AtomicInteger calls = new AtomicInteger();
    ConjectureRunner runner = new ConjectureRunner(data -> {
      data.drawBits(8);
      data.markInteresting(calls.getAndIncrement() == 0 ? SMALL : LARGE);
    }, config().build());
    runner.run();
    Assert.assertEquals(ConjectureRunner.ExitReason.FLAKY, runner.exitReason());
    try {
      runner.raiseFailures();
      Assert.fail();
    } catch (ConjectureException.Flaky e) {
      Assert.assertTrue(e.getMessage().contains("failed differently"));
    }
  }

  @Test
  public void testValidResultsWithoutDatabaseKey() {
    ExampleDatabase.InMemory db = new ExampleDatabase.InMemory();
    ConjectureRunner runner = new ConjectureRunner(data -> {
      if (data.drawBits(8) == 7) data.markInteresting(SMALL);
    }, config().database(db).build());
    runner.run();
    Assert.assertTrue(runner.validExamples() > 0);
    Assert.assertTrue(runner.paretoFront().size() > 0);
    // Nothing is saved without a key
    Assert.assertTrue(db.backingMap.isEmpty());
  }

  @Test
  public void testFilterTooMuch() {
    ConjectureRunner runner = new ConjectureRunner(data -> {
      data.drawBits(8);
      data.reject();
    }, config().build());
    try {
      runner.run();
      Assert.fail();
    } catch (ConjectureException.FailedHealthCheck e) {
      Assert.assertEquals(ConjectureRunner.HealthCheck.FILTER_TOO_MUCH, e.check);
    }
  }

  @Test
  public void testDataTooLarge() {
    ConjectureRunner runner = new ConjectureRunner(data -> {
      // Any non-zero first byte asks for more than the buffer holds
      if (data.drawBits(8) != 0) data.drawBytes(new ChoiceConstraints.ForBytes(200, 200), null);
    }, config().bufferSize(64).build());
    try {
      runner.run();
      Assert.fail();
    } catch (ConjectureException.FailedHealthCheck e) {
      Assert.assertEquals(ConjectureRunner.HealthCheck.DATA_TOO_LARGE, e.check);
    }
  }

  @Test
  public void testLargeBaseExample() {
    ConjectureRunner runner = new ConjectureRunner(data -> data.drawBits(64),
        config().bufferSize(8).build());
    try {
      runner.run();
      Assert.fail();
    } catch (ConjectureException.FailedHealthCheck e) {
      Assert.assertEquals(ConjectureRunner.HealthCheck.LARGE_BASE_EXAMPLE, e.check);
    }
  }

  @Test
  public void testUnsatisfiable() {
    ConjectureRunner runner = new ConjectureRunner(data -> {
      data.drawBits(8);
      data.reject();
    }, config().maxExamples(10).
        suppressedHealthChecks(EnumSet.of(ConjectureRunner.HealthCheck.FILTER_TOO_MUCH)).build());
    runner.run();
    Assert.assertEquals(0, runner.validExamples());
    Assert.assertTrue(runner.interestingExamples().isEmpty());
    try {
      runner.raiseFailures();
      Assert.fail();
    } catch (ConjectureException.Unsatisfiable e) {
      Assert.assertTrue(runner.callCount() > 0);
    }
  }

  @Test
  public void testExhaustsSmallSpace() {
    ConjectureRunner runner = new ConjectureRunner(data -> {
      data.drawBoolean(0.5);
      data.drawBoolean(0.5);
    }, config().build());
    runner.run();
    Assert.assertEquals(ConjectureRunner.ExitReason.FINISHED, runner.exitReason());
    Assert.assertEquals(4, runner.callCount());
    Assert.assertTrue(runner.tree().isExhausted());
    runner.raiseFailures();
  }

  @Test
  public void testPassingRunStopsAtMaxExamples() {
    ConjectureRunner runner = new ConjectureRunner(data -> data.drawBits(64), config().maxExamples(20).build());
    runner.run();
    Assert.assertEquals(ConjectureRunner.ExitReason.MAX_EXAMPLES, runner.exitReason());
    Assert.assertEquals(20, runner.validExamples());
    runner.raiseFailures();
  }

  @Test
  public void testDeadlineExceededIsAFailure() {
    ConjectureRunner runner = new ConjectureRunner(data -> {
      data.drawBits(8);
      try {
        Thread.sleep(5);
      } catch (InterruptedException e) {
        throw new RuntimeException(e);
      }
    }, config().deadlinePerExampleMillis(1L).build());
    runner.run();
    Assert.assertEquals(1, runner.interestingExamples().size());
    InterestingOrigin origin = runner.interestingExamples().keySet().iterator().next();
    Assert.assertEquals("DeadlineExceeded", origin.kind);
    Assert.assertArrayEquals(new byte[] { 0 }, onlyBuffer(runner));
  }

  @Test
  public void testCachedTestFunction() {
    AtomicInteger calls = new AtomicInteger();
    ConjectureRunner runner = new ConjectureRunner(data -> {
      calls.incrementAndGet();
      data.drawBits(8);
    }, config().build());
    ConjectureResult first = runner.cachedTestFunction(new byte[] { 5 });
    Assert.assertSame(first, runner.cachedTestFunction(new byte[] { 5 }));
    // The tree knows the test stops reading after one byte
    Assert.assertSame(first, runner.cachedTestFunction(new byte[] { 5, 9 }));
    // And that it needs at least one
    Assert.assertSame(ConjectureResult.OVERRUN, runner.cachedTestFunction(new byte[0]));
    Assert.assertEquals(1, calls.get());
    Assert.assertEquals(1, runner.callCount());
  }

  @Test
  public void testCachedChoices() {
    ConjectureRunner runner = new ConjectureRunner(data -> data.drawInteger(0, 100), config().build());
    List<ChoiceNode> choices = Collections.singletonList(
        ChoiceNode.of(new ChoiceConstraints.ForInteger(0, 100), 42L));
    ConjectureResult result = runner.cachedTestFunction(choices);
    Assert.assertEquals(Status.VALID, result.status);
    Assert.assertEquals(42L, result.nodes.get(0).value);
    Assert.assertSame(result, runner.cachedTestFunction(result.buffer()));
  }

  @Test
  public void testDerandomizedRunsRepeat() {
    TestFunction test = data -> {
      long x = data.drawInteger(0, 10000);
      long y = data.drawInteger(0, 10000);
      if (x + y > 15000) data.markInteresting(LARGE);
    };
    ConjectureRunner first = new ConjectureRunner(test,
        ConjectureRunner.Config.builder().derandomize(true).databaseKey("repeat").build());
    first.run();
    ConjectureRunner second = new ConjectureRunner(test,
        ConjectureRunner.Config.builder().derandomize(true).databaseKey("repeat").build());
    second.run();
    Assert.assertEquals(first.callCount(), second.callCount());
    Assert.assertEquals(first.interestingExamples().size(), second.interestingExamples().size());
    if (!first.interestingExamples().isEmpty())
      Assert.assertArrayEquals(onlyBuffer(first), onlyBuffer(second));
  }

  @Test
  public void testTargetsTracked() {
    AtomicLong highest = new AtomicLong(-1);
    ConjectureRunner runner = new ConjectureRunner(data -> {
      long value = data.drawBits(8);
      highest.accumulateAndGet(value, Math::max);
      data.target("value", value);
    }, config().maxExamples(50).build());
    runner.run();
    ConjectureResult best = runner.bestExamplesOfTargets().get("value");
    Assert.assertNotNull(best);
    Assert.assertEquals((double) highest.get(), best.targetObservations.get("value"), 0.0);
    Assert.assertTrue(runner.paretoFront().size() > 0);
  }
}
