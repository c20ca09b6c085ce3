package conj.engine;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives a test function through the run phases: replaying saved examples, generating new ones, hill climbing on
 * target scores and shrinking every distinct failure found. Each execution is recorded in a {@link DataTree} so
 * repeats and known overruns are answered without running the test again.
 */
public class ConjectureRunner {
  private static final Logger log = LoggerFactory.getLogger(ConjectureRunner.class);

  /** A run going on longer than this fails {@link HealthCheck#HUNG_TEST} */
  public static final long HUNG_TEST_TIME_LIMIT_MILLIS = 5 * 60 * 1000;
  /** While no failure is known, the tree is reset after this many calls to bound memory */
  public static final int CACHE_RESET_FREQUENCY = 1000;
  /** Size of the exact tape cache */
  public static final int CACHE_SIZE = 10000;
  /** Unproductive mutations of one example before the mutator is replaced */
  public static final int MAX_MUTATIONS = 10;

  /** The parts of a run, each of which can be turned off */
  public enum Phase { REUSE, GENERATE, TARGET, SHRINK }

  /** Problems with the test itself rather than the code under test */
  public enum HealthCheck {
    /** Too many examples overran the buffer */
    DATA_TOO_LARGE,
    /** Too many examples were rejected */
    FILTER_TOO_MUCH,
    /** Drawing data took too long */
    TOO_SLOW,
    /** The simplest example is too large or overruns */
    LARGE_BASE_EXAMPLE,
    /** The whole run took too long */
    HUNG_TEST
  }

  /** Why a run stopped */
  public enum ExitReason { MAX_EXAMPLES, MAX_ITERATIONS, TIMEOUT, MAX_SHRINKS, FINISHED, FLAKY }

  /** The immutable runner config */
  public final Config config;
  /** The test being run */
  public final TestFunction test;

  private final Random random;
  private final DataTree tree = new DataTree();
  private final Map<ByteBuffer, ConjectureResult> cache = new LinkedHashMap<ByteBuffer, ConjectureResult>(16, 0.75f, true) {
    @Override
    protected boolean removeEldestEntry(Map.Entry<ByteBuffer, ConjectureResult> eldest) { return size() > CACHE_SIZE; }
  };
  private final Map<InterestingOrigin, ConjectureResult> interestingExamples = new LinkedHashMap<>();
  private final Set<InterestingOrigin> shrunkExamples = new HashSet<>();
  private final Map<String, ConjectureResult> bestExamplesOfTargets = new LinkedHashMap<>();
  private final ParetoFront paretoFront;
  private final TargetSelector targetSelector;
  private final byte[] databaseKey;

  private int callCount;
  private int validExamples;
  private int shrinks;
  private ExitReason exitReason;
  private String flakyMessage;
  private HealthCheckState healthCheckState;
  private long startMillis = System.currentTimeMillis();
  private boolean running;
  private boolean optimised;

  public ConjectureRunner(TestFunction test, Config config) {
    this.test = Objects.requireNonNull(test);
    this.config = Objects.requireNonNull(config);
    this.random = config.random;
    this.databaseKey = config.databaseKey == null ? null : config.databaseKey.getBytes(StandardCharsets.UTF_8);
    this.paretoFront = new ParetoFront(random);
    this.targetSelector = new TargetSelector(random);
    paretoFront.onEvict(result -> {
      if (database() != null) database().delete(subKey("pareto"), result.buffer());
    });
  }

  /** Create a runner with the default config */
  public ConjectureRunner(TestFunction test) { this(test, Config.builder().build()); }

  /**
   * Run every enabled phase until an exit condition is hit. Does not throw for failures in the test; see
   * {@link #raiseFailures()}. Failed health checks and errors raised outside the test function do propagate.
   */
  public void run() {
    startMillis = System.currentTimeMillis();
    running = true;
    try {
      reuseExistingExamples();
      generateNewExamples();
      if (interestingExamples.isEmpty()) optimiseTargets();
      shrinkInterestingExamples();
      exitWith(ExitReason.FINISHED);
    } catch (RunIsComplete e) {
      log.debug("Run complete with reason {}", exitReason);
    } finally {
      running = false;
    }
    for (ConjectureResult result : interestingExamples.values()) log.debug("Final example: {}", describe(result));
    config.reporter.report(String.format("Run complete after %d examples (%d valid) and %d shrinks",
        callCount, validExamples, shrinks));
  }

  /**
   * Throw what the run found. A single failure is rethrown as is when unchecked, several are bundled into a
   * {@link ConjectureException.MultipleFailures}. Also throws for a flaky run or one that never produced a valid
   * example. Returns normally if the run passed.
   */
  public void raiseFailures() {
    if (exitReason == ExitReason.FLAKY) throw new ConjectureException.Flaky(flakyMessage);
    if (interestingExamples.isEmpty()) {
      if (callCount > 0 && validExamples == 0 && config.phases.contains(Phase.GENERATE))
        throw new ConjectureException.Unsatisfiable("Unable to satisfy assumptions after " + callCount + " calls");
      return;
    }
    List<ConjectureResult> results = new ArrayList<>(interestingExamples.values());
    results.sort((l, r) -> Util.compareSortKey(l.buffer(), r.buffer()));
    if (!config.reportMultipleBugs) results = results.subList(0, 1);
    List<Throwable> failures = new ArrayList<>();
    for (ConjectureResult result : results) {
      failures.add(result.cause != null ? result.cause :
          new ConjectureException("Found failing example for " + result.interestingOrigin));
    }
    if (failures.size() > 1) throw new ConjectureException.MultipleFailures(failures);
    Throwable failure = failures.get(0);
    if (failure instanceof RuntimeException) throw (RuntimeException) failure;
    if (failure instanceof Error) throw (Error) failure;
    throw new ConjectureException("Test failed", failure);
  }

  /* Execution */

  /**
   * Run the test against the tape, or return what a previous run of it produced. Answers from the tree may have a
   * shorter tape than the one given, or be the shared {@link ConjectureResult#OVERRUN} when the tape is known to be
   * too short.
   */
  public ConjectureResult cachedTestFunction(byte[] buffer) {
    ByteBuffer key = ByteBuffer.wrap(buffer.clone());
    ConjectureResult cached = cache.get(key);
    if (cached != null) return cached;
    ConjectureResult result = tree.lookup(buffer);
    if (result == null) result = testFunction(ConjectureData.forBuffer(buffer));
    cache.put(key, result);
    return result;
  }

  /** Replay the given choices. The result is recorded like any other execution. */
  public ConjectureResult cachedTestFunction(List<ChoiceNode> choices) {
    ConjectureResult result = testFunction(ConjectureData.forChoices(choices, config.bufferSize));
    if (result.status != Status.OVERRUN) cache.put(ByteBuffer.wrap(result.buffer()), result);
    return result;
  }

  /** Data that reads the prefix and then random bytes, limited by the size bound */
  public ConjectureData newConjectureData(byte[] prefix) {
    return new ConjectureData(config.bufferSize, (data, n) -> {
      byte[] result;
      if (data.index() < prefix.length) {
        result = Arrays.copyOfRange(prefix, data.index(), Math.min(prefix.length, data.index() + n));
        if (result.length < n) result = Util.concat(result, Util.uniform(random, n - result.length));
      } else result = Util.uniform(random, n);
      return zeroBound(data, result);
    });
  }

  /**
   * Execute the test on the data and record the outcome: the tree, the pool of mutation targets, the Pareto front, the
   * best example per target and the best example per failure. Also checks every exit condition.
   */
  public ConjectureResult testFunction(ConjectureData data) {
    if (System.currentTimeMillis() - startMillis >= HUNG_TEST_TIME_LIMIT_MILLIS)
      failHealthCheck(HealthCheck.HUNG_TEST, "The test has been running for at least five minutes");
    callCount++;
    try {
      test.run(data);
      if (config.deadlinePerExampleMillis != null && !data.isFrozen() &&
          data.elapsedNanos() > config.deadlinePerExampleMillis * 1_000_000L) {
        data.conclude(Status.INTERESTING, DEADLINE_EXCEEDED, new ConjectureException(
            "Deadline of " + config.deadlinePerExampleMillis + "ms exceeded, took " +
                data.elapsedNanos() / 1_000_000L + "ms"));
      }
    } catch (StopTest e) {
      if (e.testCounter != data.testCounter) {
        saveBuffer(data.buffer());
        throw e;
      }
    } catch (ConjectureException.UnsatisfiedAssumption e) {
      if (!data.isFrozen()) data.conclude(Status.INVALID, null, null);
    } catch (RuntimeException | Error e) {
      saveBuffer(data.buffer());
      throw e;
    } finally {
      data.freeze();
    }
    ConjectureResult result = data.asResult();
    log.debug("Call {}: {}", callCount, describe(result));

    targetSelector.add(result);
    if (result.status == Status.VALID) validExamples++;
    if (paretoFront.add(result) && database() != null) saveBuffer(result.buffer(), subKey("pareto"));
    if (result.status.compareTo(Status.VALID) >= 0) noteTargets(result);

    if (callCount % CACHE_RESET_FREQUENCY == 0 && interestingExamples.isEmpty()) tree.reset();
    tree.record(result, cap());

    if (result.status == Status.INTERESTING) noteInteresting(result);

    if (config.timeBudgetMillis != null && System.currentTimeMillis() - startMillis >= config.timeBudgetMillis)
      exitWith(ExitReason.TIMEOUT);
    if (interestingExamples.isEmpty()) {
      if (validExamples >= config.maxExamples) exitWith(ExitReason.MAX_EXAMPLES);
      if (callCount >= config.maxIterations) exitWith(ExitReason.MAX_ITERATIONS);
    }
    if (tree.isExhausted()) exitWith(ExitReason.FINISHED);

    recordForHealthCheck(data, result);
    return result;
  }

  private void noteTargets(ConjectureResult result) {
    for (Map.Entry<String, Double> entry : result.targetObservations.entrySet()) {
      ConjectureResult existing = bestExamplesOfTargets.get(entry.getKey());
      if (existing == null) {
        bestExamplesOfTargets.put(entry.getKey(), result);
        continue;
      }
      double existingScore = existing.targetObservations.get(entry.getKey());
      if (entry.getValue() < existingScore) continue;
      if (entry.getValue() > existingScore || result.simplerThan(existing))
        bestExamplesOfTargets.put(entry.getKey(), result);
    }
  }

  private void noteInteresting(ConjectureResult result) {
    InterestingOrigin key = result.interestingOrigin;
    ConjectureResult existing = interestingExamples.get(key);
    boolean changed = false;
    if (existing == null) {
      if (interestingExamples.size() >= config.maxInterestingOrigins) {
        log.debug("Ignoring failure {}, already tracking {} distinct failures", key, interestingExamples.size());
        return;
      }
      changed = true;
    } else if (result.simplerThan(existing)) {
      shrinks++;
      downgradeBuffer(existing.buffer());
      changed = true;
    }
    if (changed) {
      saveBuffer(result.buffer());
      interestingExamples.put(key, result);
      shrunkExamples.remove(key);
    }
    if (shrinks >= config.maxShrinks) exitWith(ExitReason.MAX_SHRINKS);
  }

  /** Size bound past which generated bytes are zeroed */
  int cap() { return config.bufferSize / 2; }

  /**
   * Keep generated data under control by replacing bytes with zeros once the data is too deep or too long. The
   * replaced bytes are recorded as forced so the tree does not try to vary them.
   */
  byte[] zeroBound(ConjectureData data, byte[] result) {
    int n = result.length;
    if (data.depth() * 2 >= ConjectureData.MAX_DEPTH || data.index() >= cap()) {
      data.markForced(data.index(), data.index() + n);
      return new byte[n];
    }
    if (data.index() + n >= cap()) {
      int keep = cap() - data.index();
      data.markForced(cap(), data.index() + n);
      byte[] bounded = new byte[n];
      System.arraycopy(result, 0, bounded, 0, keep);
      return bounded;
    }
    return result;
  }

  /** A prefix leading somewhere the tree has not fully explored */
  public byte[] generateNovelPrefix() { return tree.generateNovelPrefix(random, cap()); }

  /* Phases */

  private void reuseExistingExamples() {
    ExampleDatabase db = database();
    if (db == null || !config.phases.contains(Phase.REUSE)) return;
    log.debug("Reusing examples from database");
    List<byte[]> corpus = new ArrayList<>(db.fetch(databaseKey));
    corpus.sort(Util.SORT_KEY);
    int desiredSize = Math.max(2, (int) Math.ceil(0.1 * config.maxExamples));
    for (byte[] extraKey : Arrays.asList(subKey("secondary"), subKey("pareto"))) {
      if (corpus.size() >= desiredSize) break;
      List<byte[]> extra = new ArrayList<>(db.fetch(extraKey));
      int shortfall = desiredSize - corpus.size();
      if (extra.size() > shortfall) {
        Collections.shuffle(extra, random);
        extra = new ArrayList<>(extra.subList(0, shortfall));
      }
      extra.sort(Util.SORT_KEY);
      corpus.addAll(extra);
    }
    for (byte[] existing : corpus) {
      ConjectureData data = ConjectureData.forBuffer(existing);
      try {
        testFunction(data);
      } finally {
        if (data.status() != Status.INTERESTING || !data.isFrozen()) {
          db.delete(databaseKey, existing);
          db.delete(subKey("secondary"), existing);
        }
      }
    }
  }

  private void generateNewExamples() {
    if (!config.phases.contains(Phase.GENERATE)) return;
    ConjectureResult zeroData = cachedTestFunction(new byte[config.bufferSize]);
    if (zeroData.status == Status.OVERRUN ||
        (zeroData.status == Status.VALID && zeroData.length() * 2 > config.bufferSize)) {
      failHealthCheck(HealthCheck.LARGE_BASE_EXAMPLE, "The smallest natural example for the test is extremely large. " +
          "Consider reducing the size of the data drawn or giving it simpler defaults");
    }
    boolean allForced = true;
    for (int i = 0; i < cap() && allForced; i++) allForced = i < zeroData.length() && zeroData.isForced(i);
    if (allForced) exitWith(ExitReason.FINISHED);

    healthCheckState = new HealthCheckState();
    int count = 0;
    while (interestingExamples.isEmpty() && (count < 10 || healthCheckState != null)) {
      testFunction(newConjectureData(generateNovelPrefix()));
      count++;
      maybeOptimise();
    }

    Function<ConjectureResult, ConjectureData.DrawBytes> mutator = newMutator();
    int mutations = 0;
    List<ConjectureResult> zeroBoundQueue = new ArrayList<>();
    while (interestingExamples.isEmpty()) {
      ConjectureData data;
      if (!zeroBoundQueue.isEmpty()) {
        // Data that hit the bound has zeros bunched to the right, so redistribute them
        ConjectureResult overdrawn = zeroBoundQueue.remove(zeroBoundQueue.size() - 1);
        byte[] buffer = overdrawn.buffer();
        for (int i = 0; i < buffer.length; i++) if (overdrawn.isForced(i)) buffer[i] = 0;
        Util.shuffle(random, buffer);
        data = new ConjectureData(config.bufferSize, (d, n) -> {
          byte[] result = new byte[n];
          if (d.index() < buffer.length) System.arraycopy(buffer, d.index(), result, 0,
              Math.min(n, buffer.length - d.index()));
          return zeroBound(d, result);
        });
        testFunction(data);
      } else {
        ConjectureResult origin = targetSelector.select();
        mutations++;
        data = new ConjectureData(config.bufferSize, mutator.apply(origin));
        ConjectureResult result = testFunction(data);
        if (result.status.compareTo(origin.status) > 0) mutations = 0;
        else if (result.status.compareTo(origin.status) < 0 || mutations >= MAX_MUTATIONS) {
          mutations = 0;
          mutator = newMutator();
        }
      }
      if (data.hitZeroBound()) zeroBoundQueue.add(data.asResult());
      maybeOptimise();
    }
  }

  private void maybeOptimise() {
    if (optimised || bestExamplesOfTargets.isEmpty() || !config.phases.contains(Phase.TARGET)) return;
    if (validExamples < Math.max(1, config.maxExamples / 2)) return;
    optimiseTargets();
  }

  private void optimiseTargets() {
    if (optimised || !config.phases.contains(Phase.TARGET)) return;
    optimised = true;
    log.debug("Optimising {} targets", bestExamplesOfTargets.size());
    boolean anyImprovements = true;
    while (anyImprovements && interestingExamples.isEmpty()) {
      anyImprovements = false;
      for (Map.Entry<String, ConjectureResult> entry : new ArrayList<>(bestExamplesOfTargets.entrySet())) {
        Optimiser optimiser = new Optimiser(this, entry.getValue(), entry.getKey());
        optimiser.run();
        if (optimiser.improvements() > 0) anyImprovements = true;
        if (!interestingExamples.isEmpty()) break;
      }
    }
  }

  private void shrinkInterestingExamples() {
    if (!config.phases.contains(Phase.SHRINK) || interestingExamples.isEmpty()) return;
    config.reporter.report("Found " + interestingExamples.size() + " distinct failure" +
        (interestingExamples.size() == 1 ? "" : "s") + ", shrinking");

    List<ConjectureResult> existing = new ArrayList<>(interestingExamples.values());
    existing.sort((l, r) -> Util.compareSortKey(l.buffer(), r.buffer()));
    for (ConjectureResult prev : existing) {
      ConjectureResult replayed = testFunction(ConjectureData.forBuffer(prev.buffer()));
      if (replayed.status != Status.INTERESTING) {
        flakyMessage = "Example for " + prev.interestingOrigin + " no longer fails";
        exitWith(ExitReason.FLAKY);
      }
      if (!prev.interestingOrigin.equals(replayed.interestingOrigin)) {
        flakyMessage = "Example for " + prev.interestingOrigin + " failed differently, as " +
            replayed.interestingOrigin;
        exitWith(ExitReason.FLAKY);
      }
    }

    clearSecondaryKey();

    while (shrunkExamples.size() < interestingExamples.size()) {
      Map.Entry<InterestingOrigin, ConjectureResult> next = null;
      for (Map.Entry<InterestingOrigin, ConjectureResult> entry : interestingExamples.entrySet()) {
        if (shrunkExamples.contains(entry.getKey())) continue;
        if (next == null || SHRINK_ORDER.compare(entry, next) < 0) next = entry;
      }
      InterestingOrigin target = next.getKey();
      config.reporter.report("Shrinking " + target);
      shrink(next.getValue(), result -> result.status == Status.INTERESTING && target.equals(result.interestingOrigin));
      shrunkExamples.add(target);
    }
  }

  private static final Comparator<Map.Entry<InterestingOrigin, ConjectureResult>> SHRINK_ORDER =
      Comparator.<Map.Entry<InterestingOrigin, ConjectureResult>, byte[]>comparing(e -> e.getValue().buffer(),
          Util.SORT_KEY).thenComparing(e -> e.getKey().toString());

  private void clearSecondaryKey() {
    ExampleDatabase db = database();
    if (db == null || !config.phases.contains(Phase.REUSE)) return;
    List<byte[]> corpus = new ArrayList<>(db.fetch(subKey("secondary")));
    corpus.sort(Util.SORT_KEY);
    for (byte[] candidate : corpus) {
      byte[] worst = null;
      for (ConjectureResult result : interestingExamples.values()) {
        if (worst == null || Util.compareSortKey(result.buffer(), worst) > 0) worst = result.buffer();
      }
      if (Util.compareSortKey(candidate, worst) > 0) break;
      cachedTestFunction(candidate);
      db.delete(subKey("secondary"), candidate);
    }
  }

  /** Shrink the example while it keeps satisfying the predicate, returning the smallest found */
  public ConjectureResult shrink(ConjectureResult example, Predicate<ConjectureResult> predicate) {
    Shrinker shrinker = new Shrinker(this, example, predicate);
    shrinker.shrink();
    return shrinker.shrinkTarget();
  }

  /* Mutation */

  @FunctionalInterface
  private interface Mutation {
    byte[] draw(ConjectureData data, int n, ConjectureResult origin);
  }

  private static byte[] existingBytes(ConjectureData data, int n, ConjectureResult origin) {
    byte[] result = new byte[n];
    for (int i = 0; i < n; i++) result[i] = (byte) origin.byteAt(data.index() + i);
    return result;
  }

  /**
   * A fresh mutator. It picks three strategies, and for each origin it is applied to generates a novel prefix that
   * takes precedence over the strategies.
   */
  private Function<ConjectureResult, ConjectureData.DrawBytes> newMutator() {
    Mutation drawNew = (data, n, origin) -> Util.uniform(random, n);
    Mutation drawExisting = ConjectureRunner::existingBytes;
    // Keeps everything before the last block of the origin
    Mutation redrawLast = (data, n, origin) -> {
      int lastBlockStart = origin.blocks.isEmpty() ? 0 : origin.blocks.get(origin.blocks.size() - 1).start;
      return data.index() + n <= lastBlockStart ? existingBytes(data, n, origin) : Util.uniform(random, n);
    };
    Mutation drawSmaller = (data, n, origin) -> {
      byte[] existing = existingBytes(data, n, origin);
      byte[] r = Util.uniform(random, n);
      return Util.compareUnsigned(r, existing) <= 0 ? r : Util.drawPredecessor(random, existing);
    };
    Mutation drawLarger = (data, n, origin) -> {
      byte[] existing = existingBytes(data, n, origin);
      byte[] r = Util.uniform(random, n);
      return Util.compareUnsigned(r, existing) >= 0 ? r : Util.drawSuccessor(random, existing);
    };
    Mutation reuseExisting = (data, n, origin) -> {
      List<Integer> starts = new ArrayList<>();
      for (Block block : data.blocks()) if (block.length() == n) starts.add(block.start);
      if (starts.isEmpty()) return Util.uniform(random, n);
      int start = starts.get(random.nextInt(starts.size()));
      return Arrays.copyOfRange(data.buffer(), start, start + n);
    };
    Mutation flipBit = (data, n, origin) -> {
      byte[] buf = existingBytes(data, n, origin);
      buf[random.nextInt(n)] ^= (byte) (1 << random.nextInt(8));
      return buf;
    };
    Mutation drawZero = (data, n, origin) -> new byte[n];
    Mutation drawMax = (data, n, origin) -> {
      byte[] buf = new byte[n];
      Arrays.fill(buf, (byte) 0xFF);
      return buf;
    };
    Mutation drawConstant = (data, n, origin) -> {
      byte[] buf = new byte[n];
      Arrays.fill(buf, (byte) random.nextInt(256));
      return buf;
    };
    List<Mutation> options = Arrays.asList(drawNew, redrawLast, redrawLast, reuseExisting, reuseExisting,
        drawExisting, drawSmaller, drawLarger, flipBit, drawZero, drawMax, drawZero, drawMax, drawConstant);
    Mutation[] bits = new Mutation[3];
    for (int i = 0; i < bits.length; i++) bits[i] = options.get(random.nextInt(options.size()));

    return origin -> {
      byte[] prefix = generateNovelPrefix();
      return (data, n) -> {
        byte[] result;
        if (data.index() + n > origin.length()) result = Util.uniform(random, n);
        else result = bits[random.nextInt(bits.length)].draw(data, n, origin);
        if (data.index() < prefix.length) {
          int k = Math.min(n, prefix.length - data.index());
          System.arraycopy(prefix, data.index(), result, 0, k);
        }
        return zeroBound(data, result);
      };
    };
  }

  /* Health checks */

  private static class HealthCheckState {
    int validExamples;
    int invalidExamples;
    int overrunExamples;
    long drawNanos;
  }

  private void recordForHealthCheck(ConjectureData data, ConjectureResult result) {
    if (result.status == Status.INTERESTING) healthCheckState = null;
    HealthCheckState state = healthCheckState;
    if (state == null) return;
    for (long nanos : data.drawTimes()) state.drawNanos += nanos;
    if (result.status == Status.VALID) state.validExamples++;
    else if (result.status == Status.INVALID) state.invalidExamples++;
    else state.overrunExamples++;
    log.debug("Health check state: {} valid, {} invalid, {} overrun, {}ms drawing", state.validExamples,
        state.invalidExamples, state.overrunExamples, state.drawNanos / 1_000_000L);

    if (state.validExamples == 10) {
      healthCheckState = null;
      return;
    }
    if (state.overrunExamples == 20) {
      failHealthCheck(HealthCheck.DATA_TOO_LARGE, "Examples routinely exceeded the max allowable size (" +
          state.overrunExamples + " overran while generating " + state.validExamples + " valid ones)");
    }
    if (state.invalidExamples == 50) {
      failHealthCheck(HealthCheck.FILTER_TOO_MUCH, "The test is filtering out a lot of data (" +
          state.invalidExamples + " rejected but only " + state.validExamples + " valid)");
    }
    if (state.drawNanos > 1_000_000_000L) {
      failHealthCheck(HealthCheck.TOO_SLOW, "Data generation is extremely slow: only " + state.validExamples +
          " valid examples in " + state.drawNanos / 1_000_000L + "ms");
    }
  }

  private void failHealthCheck(HealthCheck check, String msg) {
    if (config.suppressedHealthChecks.contains(check)) {
      log.debug("Suppressed health check {}: {}", check, msg);
      return;
    }
    throw new ConjectureException.FailedHealthCheck(check, msg);
  }

  /* Database */

  private ExampleDatabase database() { return databaseKey == null ? null : config.database; }

  private byte[] subKey(String name) {
    return Util.concat(databaseKey, ("." + name).getBytes(StandardCharsets.UTF_8));
  }

  private void saveBuffer(byte[] buffer) {
    if (database() != null) saveBuffer(buffer, databaseKey);
  }

  private void saveBuffer(byte[] buffer, byte[] key) {
    if (database() != null) database().save(key, buffer);
  }

  private void downgradeBuffer(byte[] buffer) {
    if (database() != null) database().move(databaseKey, subKey("secondary"), buffer);
  }

  /* Exit */

  /** Thrown to unwind out of the phases once an exit condition is hit */
  private static class RunIsComplete extends RuntimeException {
    RunIsComplete() { super(null, null, false, false); }
  }

  private void exitWith(ExitReason reason) {
    exitReason = reason;
    if (running) throw new RunIsComplete();
  }

  private static final InterestingOrigin DEADLINE_EXCEEDED = InterestingOrigin.of("DeadlineExceeded");

  private String describe(ConjectureResult result) {
    String status = result.status == Status.INTERESTING ? "INTERESTING (" + result.interestingOrigin + ")" :
        result.status.toString();
    return result.length() + " bytes " + Util.hex(result.buffer()) + " -> " + status;
  }

  /* Accessors */

  public Random random() { return random; }

  /** Best example per failure origin */
  public Map<InterestingOrigin, ConjectureResult> interestingExamples() {
    return Collections.unmodifiableMap(interestingExamples);
  }

  /** Best example per target label */
  public Map<String, ConjectureResult> bestExamplesOfTargets() {
    return Collections.unmodifiableMap(bestExamplesOfTargets);
  }

  public ParetoFront paretoFront() { return paretoFront; }

  /** Null until an exit condition is hit */
  public ExitReason exitReason() { return exitReason; }

  public int callCount() { return callCount; }

  public int validExamples() { return validExamples; }

  /** Number of times a failure was replaced by a simpler one */
  public int shrinks() { return shrinks; }

  public DataTree tree() { return tree; }

  /** Configuration for the {@link ConjectureRunner}. Can use {@link #builder()} to build the config easier */
  public static class Config {
    /** Create a {@link Builder} for easy building */
    public static Builder builder() { return new Builder(); }

    /** See {@link Builder#maxExamples(Integer)} */
    public final int maxExamples;
    /** See {@link Builder#maxIterations(Integer)} */
    public final int maxIterations;
    /** See {@link Builder#timeBudgetMillis(Long)} */
    public final Long timeBudgetMillis;
    /** See {@link Builder#bufferSize(Integer)} */
    public final int bufferSize;
    /** See {@link Builder#database(ExampleDatabase)} */
    public final ExampleDatabase database;
    /** See {@link Builder#databaseKey(String)} */
    public final String databaseKey;
    /** See {@link Builder#suppressedHealthChecks(Set)} */
    public final Set<HealthCheck> suppressedHealthChecks;
    /** See {@link Builder#phases(Set)} */
    public final Set<Phase> phases;
    /** See {@link Builder#reportMultipleBugs(Boolean)} */
    public final boolean reportMultipleBugs;
    /** See {@link Builder#deadlinePerExampleMillis(Long)} */
    public final Long deadlinePerExampleMillis;
    /** See {@link Builder#maxShrinks(Integer)} */
    public final int maxShrinks;
    /** See {@link Builder#maxInterestingOrigins(Integer)} */
    public final int maxInterestingOrigins;
    /** See {@link Builder#maxShrinkStall(Integer)} */
    public final int maxShrinkStall;
    /** See {@link Builder#random(Random)} */
    public final Random random;
    /** See {@link Builder#reporter(Reporter)} */
    public final Reporter reporter;

    public Config(int maxExamples, int maxIterations, Long timeBudgetMillis, int bufferSize, ExampleDatabase database,
        String databaseKey, Set<HealthCheck> suppressedHealthChecks, Set<Phase> phases, boolean reportMultipleBugs,
        Long deadlinePerExampleMillis, int maxShrinks, int maxInterestingOrigins, int maxShrinkStall, Random random,
        Reporter reporter) {
      if (maxExamples < 1) throw new IllegalArgumentException("Max examples must be positive");
      if (bufferSize < 2) throw new IllegalArgumentException("Buffer size too small");
      this.maxExamples = maxExamples;
      this.maxIterations = maxIterations;
      this.timeBudgetMillis = timeBudgetMillis;
      this.bufferSize = bufferSize;
      this.database = database;
      this.databaseKey = databaseKey;
      EnumSet<HealthCheck> suppressed = EnumSet.noneOf(HealthCheck.class);
      suppressed.addAll(Objects.requireNonNull(suppressedHealthChecks));
      this.suppressedHealthChecks = Collections.unmodifiableSet(suppressed);
      EnumSet<Phase> enabled = EnumSet.noneOf(Phase.class);
      enabled.addAll(Objects.requireNonNull(phases));
      this.phases = Collections.unmodifiableSet(enabled);
      this.reportMultipleBugs = reportMultipleBugs;
      this.deadlinePerExampleMillis = deadlinePerExampleMillis;
      this.maxShrinks = maxShrinks;
      this.maxInterestingOrigins = maxInterestingOrigins;
      this.maxShrinkStall = maxShrinkStall;
      this.random = Objects.requireNonNull(random);
      this.reporter = Objects.requireNonNull(reporter);
    }

    /** Builder to make creating {@link Config}s easier. Every setting has a default. */
    public static class Builder {
      /** See {@link #maxExamples(Integer)} */
      public Integer maxExamples;
      /** Valid examples to run before stopping when no failure is found. Default is 100. */
      public Builder maxExamples(Integer maxExamples) {
        this.maxExamples = maxExamples;
        return this;
      }
      /** See {@link #maxExamples(Integer)} */
      public int maxExamplesDefault() { return 100; }

      /** See {@link #maxIterations(Integer)} */
      public Integer maxIterations;
      /**
       * Calls of any status to run before stopping when no failure is found. Default is ten times
       * {@link #maxExamples(Integer)}, but at least 1000.
       */
      public Builder maxIterations(Integer maxIterations) {
        this.maxIterations = maxIterations;
        return this;
      }
      /** See {@link #maxIterations(Integer)} */
      public int maxIterationsDefault() {
        return Math.max((maxExamples == null ? maxExamplesDefault() : maxExamples) * 10, 1000);
      }

      /** See {@link #timeBudgetMillis(Long)} */
      public Long timeBudgetMillis;
      /** Wall clock budget for the run. Default is null, meaning no limit. */
      public Builder timeBudgetMillis(Long timeBudgetMillis) {
        this.timeBudgetMillis = timeBudgetMillis;
        return this;
      }

      /** See {@link #bufferSize(Integer)} */
      public Integer bufferSize;
      /** Maximum tape size. Generation zeroes bytes beyond half of it. Default is {@link ConjectureData#BUFFER_SIZE}. */
      public Builder bufferSize(Integer bufferSize) {
        this.bufferSize = bufferSize;
        return this;
      }
      /** See {@link #bufferSize(Integer)} */
      public int bufferSizeDefault() { return ConjectureData.BUFFER_SIZE; }

      /** See {@link #derandomize(boolean)} */
      public boolean derandomize;
      /**
       * If true and no {@link #random(Random)} is set, the random source is seeded from the database key so runs
       * are repeatable. Default is false.
       */
      public Builder derandomize(boolean derandomize) {
        this.derandomize = derandomize;
        return this;
      }

      /** See {@link #database(ExampleDatabase)} */
      public ExampleDatabase database;
      /** Where failing examples are saved for later runs. Default is null, meaning nothing is saved. */
      public Builder database(ExampleDatabase database) {
        this.database = database;
        return this;
      }

      /** See {@link #databaseKey(String)} */
      public String databaseKey;
      /** The key this test's examples are saved under. The database is unused without one. Default is null. */
      public Builder databaseKey(String databaseKey) {
        this.databaseKey = databaseKey;
        return this;
      }

      /** See {@link #suppressedHealthChecks(Set)} */
      public Set<HealthCheck> suppressedHealthChecks;
      /** Health checks that only log instead of failing the run. Default is none. */
      public Builder suppressedHealthChecks(Set<HealthCheck> suppressedHealthChecks) {
        this.suppressedHealthChecks = suppressedHealthChecks;
        return this;
      }
      /** See {@link #suppressedHealthChecks(Set)} */
      public Set<HealthCheck> suppressedHealthChecksDefault() { return EnumSet.noneOf(HealthCheck.class); }

      /** See {@link #phases(Set)} */
      public Set<Phase> phases;
      /** The phases to run. Default is all of them. */
      public Builder phases(Set<Phase> phases) {
        this.phases = phases;
        return this;
      }
      /** See {@link #phases(Set)} */
      public Set<Phase> phasesDefault() { return EnumSet.allOf(Phase.class); }

      /** See {@link #reportMultipleBugs(Boolean)} */
      public Boolean reportMultipleBugs;
      /** Whether every distinct failure is raised or just the simplest. Default is true. */
      public Builder reportMultipleBugs(Boolean reportMultipleBugs) {
        this.reportMultipleBugs = reportMultipleBugs;
        return this;
      }

      /** See {@link #deadlinePerExampleMillis(Long)} */
      public Long deadlinePerExampleMillis;
      /**
       * An execution that otherwise passes but takes longer than this is treated as a failure. Default is null,
       * meaning no deadline.
       */
      public Builder deadlinePerExampleMillis(Long deadlinePerExampleMillis) {
        this.deadlinePerExampleMillis = deadlinePerExampleMillis;
        return this;
      }

      /** See {@link #maxShrinks(Integer)} */
      public Integer maxShrinks;
      /** Successful shrinks after which the run stops. Default is 500. */
      public Builder maxShrinks(Integer maxShrinks) {
        this.maxShrinks = maxShrinks;
        return this;
      }

      /** See {@link #maxInterestingOrigins(Integer)} */
      public Integer maxInterestingOrigins;
      /** Distinct failures to track. Later ones are ignored. Default is 10. */
      public Builder maxInterestingOrigins(Integer maxInterestingOrigins) {
        this.maxInterestingOrigins = maxInterestingOrigins;
        return this;
      }

      /** See {@link #maxShrinkStall(Integer)} */
      public Integer maxShrinkStall;
      /** Calls a shrink pass may make in one sweep without shrinking before it is skipped. Default is 200. */
      public Builder maxShrinkStall(Integer maxShrinkStall) {
        this.maxShrinkStall = maxShrinkStall;
        return this;
      }

      /** See {@link #random(Random)} */
      public Random random;
      /** The source of randomness. Default depends on {@link #derandomize(boolean)}. */
      public Builder random(Random random) {
        this.random = random;
        return this;
      }
      /** See {@link #random(Random)} */
      public Random randomDefault() {
        if (!derandomize) return new Random();
        return new Random(databaseKey == null ? 0 : databaseKey.hashCode());
      }

      /** See {@link #reporter(Reporter)} */
      public Reporter reporter;
      /** Where progress messages go. Default is {@link Reporter#SILENT}. */
      public Builder reporter(Reporter reporter) {
        this.reporter = reporter;
        return this;
      }

      /** Build the config */
      public Config build() {
        return new Config(
            maxExamples == null ? maxExamplesDefault() : maxExamples,
            maxIterations == null ? maxIterationsDefault() : maxIterations,
            timeBudgetMillis,
            bufferSize == null ? bufferSizeDefault() : bufferSize,
            database,
            databaseKey,
            suppressedHealthChecks == null ? suppressedHealthChecksDefault() : suppressedHealthChecks,
            phases == null ? phasesDefault() : phases,
            reportMultipleBugs == null || reportMultipleBugs,
            deadlinePerExampleMillis,
            maxShrinks == null ? 500 : maxShrinks,
            maxInterestingOrigins == null ? 10 : maxInterestingOrigins,
            maxShrinkStall == null ? 200 : maxShrinkStall,
            random == null ? randomDefault() : random,
            reporter == null ? Reporter.SILENT : reporter
        );
      }
    }
  }
}
