package conj.engine;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Consumer;
import java.util.function.Predicate;

import conj.engine.shrinking.FloatShrinker;
import conj.engine.shrinking.IntegerShrinker;
import conj.engine.shrinking.LengthShrinker;
import conj.engine.shrinking.LexicalShrinker;
import conj.engine.shrinking.Minimizer;
import conj.engine.shrinking.OrderingShrinker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shrinks one example with respect to a predicate. The current best example is the shrink target, and every named
 * pass proposes tapes that replace it only if they satisfy the predicate and are strictly smaller under the sort key.
 *
 * Passes are run in escalating groups until a full sweep makes no change. A pass that goes
 * {@link ConjectureRunner.Config#maxShrinkStall} calls without an improvement is stopped for that sweep, keeping
 * whatever it already found.
 */
public class Shrinker {
  private static final Logger log = LoggerFactory.getLogger(Shrinker.class);

  /** A named shrink pass and the work it has done */
  public static class ShrinkPass {
    public final String name;
    private final Runnable body;
    private int runs;
    private int calls;
    private int shrinks;
    private int deletions;

    ShrinkPass(String name, Runnable body) {
      this.name = name;
      this.body = body;
    }

    public int runs() { return runs; }

    public int calls() { return calls; }

    public int shrinks() { return shrinks; }

    /** Bytes removed from the shrink target while this pass ran */
    public int deletions() { return deletions; }

    @Override
    public String toString() { return "ShrinkPass(" + name + ")"; }
  }

  /** Unwinds out of a pass that stopped making progress */
  private static class PassStalled extends RuntimeException {
    PassStalled() { super(null, null, false, false); }
  }

  private final ConjectureRunner runner;
  private final Predicate<ConjectureResult> predicate;
  private final Map<ByteBuffer, ConjectureResult> cache = new HashMap<>();
  private final Set<ByteBuffer> shrinkingPrefixes = new HashSet<>();
  private final Map<Integer, Boolean> shrinkingBlockCache = new HashMap<>();
  private final Set<Integer> changedBlocks = new HashSet<>();
  private final Map<String, ShrinkPass> passes = new LinkedHashMap<>();
  private final List<List<ShrinkPass>> groups = new ArrayList<>();
  private final int initialSize;
  private final int initialCalls;
  private ConjectureResult shrinkTarget;
  private ShrinkPass currentPass;
  private int stall;
  private int shrinks;

  public Shrinker(ConjectureRunner runner, ConjectureResult initial, Predicate<ConjectureResult> predicate) {
    this.runner = Objects.requireNonNull(runner);
    this.predicate = Objects.requireNonNull(predicate);
    this.shrinkTarget = Objects.requireNonNull(initial);
    this.initialSize = initial.length();
    this.initialCalls = runner.callCount();
    cache.put(ByteBuffer.wrap(initial.buffer()), initial);

    addPass("alphabet_minimize", this::alphabetMinimize);
    addPass("remove_discarded", this::removeDiscarded);
    addPass("lower_common_block_offset", this::lowerCommonBlockOffset);
    groups.add(Arrays.asList(
        addPass("zero_examples", this::zeroExamples),
        addPass("adaptive_example_deletion", this::adaptiveExampleDeletion),
        addPass("pass_to_descendant", this::passToDescendant),
        addPass("reorder_examples", this::reorderExamples)));
    groups.add(Arrays.asList(
        addPass("minimize_floats", this::minimizeFloats),
        addPass("minimize_duplicated_blocks", this::minimizeDuplicatedBlocks),
        addPass("minimize_individual_blocks", this::minimizeIndividualBlocks),
        addPass("redistribute_block_pairs", this::redistributeBlockPairs)));
    groups.add(Arrays.asList(
        addPass("block_program(\"-XX\")", blockProgram("-XX")),
        addPass("block_program(\"XX\")", blockProgram("XX")),
        addPass("example_deletion_with_block_lowering", this::exampleDeletionWithBlockLowering)));
  }

  private ShrinkPass addPass(String name, Runnable body) {
    ShrinkPass pass = new ShrinkPass(name, body);
    passes.put(name, pass);
    return pass;
  }

  /** The smallest example found so far */
  public ConjectureResult shrinkTarget() { return shrinkTarget; }

  /** Number of times the shrink target was replaced */
  public int shrinks() { return shrinks; }

  /** Test function calls made since this shrinker was created */
  public int calls() { return runner.callCount() - initialCalls; }

  public Collection<ShrinkPass> passes() { return Collections.unmodifiableCollection(passes.values()); }

  /**
   * Shrink to a fixed point. Stopping early, e.g. because the runner hit a limit, still leaves the best example found
   * as the shrink target.
   */
  public void shrink() {
    try {
      // An all zero tape is assumed to be as simple as it gets
      if (Util.allZero(shrinkTarget.buffer()) || incorporateNewBuffer(new byte[shrinkTarget.length()])) return;
      runPass("alphabet_minimize");
      while (sweep()) runPass("lower_common_block_offset");
    } finally {
      logProfile();
    }
  }

  /** One pass over the groups, widening until something changes. Returns true if the target changed. */
  private boolean sweep() {
    ConjectureResult initial = shrinkTarget;
    runPass("remove_discarded");
    for (int level = 0; level < groups.size(); level++) {
      for (int g = 0; g <= level; g++) {
        for (ShrinkPass pass : groups.get(g)) runPass(pass);
      }
      if (shrinkTarget != initial) return true;
    }
    return false;
  }

  /** Run the named pass once */
  public void runPass(String name) {
    ShrinkPass pass = passes.get(name);
    if (pass == null) throw new ConjectureException.InvalidArgument("No shrink pass named " + name);
    runPass(pass);
  }

  private void runPass(ShrinkPass pass) {
    log.debug("Shrink pass {}", pass.name);
    int startShrinks = shrinks;
    int startCalls = runner.callCount();
    int size = shrinkTarget.length();
    ShrinkPass previous = currentPass;
    currentPass = pass;
    stall = 0;
    try {
      pass.body.run();
    } catch (PassStalled e) {
      log.debug("Shrink pass {} stopped after {} calls without progress", pass.name, stall);
    } finally {
      currentPass = previous;
      pass.calls += runner.callCount() - startCalls;
      pass.shrinks += shrinks - startShrinks;
      pass.deletions += size - shrinkTarget.length();
      pass.runs++;
    }
  }

  private void logProfile() {
    if (!log.isDebugEnabled()) return;
    int calls = calls();
    log.debug("Shrinking made {} calls of which {} shrank. This deleted {} bytes out of {}.",
        calls, shrinks, initialSize - shrinkTarget.length(), initialSize);
    List<ShrinkPass> sorted = new ArrayList<>(passes.values());
    sorted.sort(Comparator.comparingInt((ShrinkPass p) -> -p.calls).thenComparingInt(p -> -p.runs)
        .thenComparingInt(p -> p.deletions).thenComparingInt(p -> p.shrinks));
    for (boolean useful : new boolean[] { true, false }) {
      log.debug(useful ? "Useful passes:" : "Useless passes:");
      for (ShrinkPass p : sorted) {
        if (p.calls == 0 || (p.shrinks != 0) != useful) continue;
        log.debug("  * {} ran {} times, making {} calls of which {} shrank, deleting {} bytes",
            p.name, p.runs, p.calls, p.shrinks, p.deletions);
      }
    }
  }

  /* Incorporating */

  /** True if the tape is the current target or was incorporated */
  private boolean considerNewBuffer(byte[] buffer) {
    return Util.startsWith(buffer, shrinkTarget.buffer()) || incorporateNewBuffer(buffer);
  }

  /**
   * Try the tape as a new shrink target. Tapes that are not smaller than the target, or that are a strict prefix of
   * it and so certain to overrun, are rejected without running.
   */
  private boolean incorporateNewBuffer(byte[] buffer) {
    if (buffer.length > shrinkTarget.length()) buffer = Arrays.copyOf(buffer, shrinkTarget.length());
    ConjectureResult existing = cache.get(ByteBuffer.wrap(buffer));
    if (existing != null) return incorporateResult(existing);
    byte[] current = shrinkTarget.buffer();
    if (!Util.sortKeyLess(buffer, current)) return false;
    if (Util.startsWith(current, buffer)) return false;
    ConjectureResult before = shrinkTarget;
    cachedTestFunction(buffer);
    return shrinkTarget != before;
  }

  private ConjectureResult cachedTestFunction(byte[] buffer) {
    ByteBuffer key = ByteBuffer.wrap(buffer.clone());
    ConjectureResult cached = cache.get(key);
    if (cached != null) return cached;
    int before = runner.callCount();
    ConjectureResult result = runner.cachedTestFunction(buffer);
    cache.put(key, result);
    boolean improved = incorporateResult(result);
    if (!improved && runner.callCount() > before && currentPass != null &&
        ++stall > runner.config.maxShrinkStall) {
      throw new PassStalled();
    }
    return result;
  }

  private boolean incorporateResult(ConjectureResult result) {
    if (result.status.compareTo(Status.VALID) < 0) return false;
    cache.putIfAbsent(ByteBuffer.wrap(result.buffer()), result);
    if (predicate.test(result) && result.simplerThan(shrinkTarget)) {
      updateShrinkTarget(result);
      return true;
    }
    return false;
  }

  private void updateShrinkTarget(ConjectureResult newTarget) {
    shrinks++;
    stall = 0;
    List<Block> oldBlocks = shrinkTarget.blocks;
    List<Block> newBlocks = newTarget.blocks;
    boolean sameShape = oldBlocks.size() == newBlocks.size();
    for (int i = 0; i < oldBlocks.size() && sameShape; i++) {
      sameShape = oldBlocks.get(i).start == newBlocks.get(i).start && oldBlocks.get(i).end == newBlocks.get(i).end;
    }
    if (!sameShape) changedBlocks.clear();
    else {
      for (Block block : oldBlocks) {
        if (!Arrays.equals(shrinkTarget.blockBytes(block), newTarget.blockBytes(block))) changedBlocks.add(block.index);
      }
    }
    log.debug("Shrunk to {} bytes: {}", newTarget.length(), Util.hex(newTarget.buffer()));
    shrinkTarget = newTarget;
    shrinkingBlockCache.clear();
  }

  /* Block bookkeeping */

  /** Mark blocks whose lowering shortened the tape */
  private void markShrinking(int[] blockIndices) {
    byte[] buffer = shrinkTarget.buffer();
    for (int i : blockIndices) {
      if (Boolean.TRUE.equals(shrinkingBlockCache.get(i))) continue;
      shrinkingBlockCache.put(i, true);
      shrinkingPrefixes.add(ByteBuffer.wrap(Arrays.copyOf(buffer, shrinkTarget.blocks.get(i).start)));
    }
  }

  /** True if lowering the block was seen to shorten the tape, possibly on an earlier target with the same prefix */
  private boolean isShrinkingBlock(int i) {
    if (shrinkingPrefixes.isEmpty()) return false;
    return shrinkingBlockCache.computeIfAbsent(i, k -> shrinkingPrefixes.contains(
        ByteBuffer.wrap(Arrays.copyOf(shrinkTarget.buffer(), shrinkTarget.blocks.get(k).start))));
  }

  /** A payload block can change value without changing the shape of the data */
  private boolean isPayloadBlock(int i) {
    return !isShrinkingBlock(i) && !shrinkTarget.blocks.get(i).forced;
  }

  private BigInteger blockValue(int i) {
    return Util.bytesToBigInteger(shrinkTarget.blockBytes(shrinkTarget.blocks.get(i)));
  }

  private static boolean fits(BigInteger value, int size) { return value.signum() >= 0 && value.bitLength() <= size * 8; }

  /**
   * Replace each of the blocks with b, right aligned. When the tape then gets shorter, also try deleting the regions
   * most likely to have been lost so the rest still lines up.
   */
  private boolean tryShrinkingBlocks(int[] blockIndices, byte[] b) {
    List<Block> blocks = shrinkTarget.blocks;
    byte[] initialAttempt = shrinkTarget.buffer();
    int count = 0;
    for (int index : blockIndices) {
      if (index >= blocks.size()) break;
      Block block = blocks.get(index);
      int n = Math.min(block.length(), b.length);
      System.arraycopy(b, b.length - n, initialAttempt, block.end - n, n);
      count++;
    }
    if (count == 0) return false;
    int[] used = Arrays.copyOf(blockIndices, count);
    int start = blocks.get(used[0]).start;
    int end = blocks.get(used[count - 1]).end;

    ConjectureResult initialData = cachedTestFunction(initialAttempt);
    if (initialData.status == Status.INTERESTING) return initialData == shrinkTarget;
    if (initialData.status.compareTo(Status.VALID) < 0) return false;
    if (initialData.length() < end) return false;
    int lostData = shrinkTarget.length() - initialData.length();
    if (lostData <= 0) return false;

    markShrinking(used);
    Set<List<Integer>> regions = new LinkedHashSet<>();
    regions.add(Arrays.asList(end, end + lostData));

    int last = used[count - 1];
    for (int j = last + 1; j <= last + 2; j++) {
      if (j >= Math.min(initialData.blocks.size(), blocks.size())) continue;
      // A block just after that lost size keeps its value if its leading bytes are deleted
      Block before = blocks.get(j);
      Block after = initialData.blocks.get(j);
      int lost = before.length() - after.length();
      if (lost <= 0 || before.start != after.start) continue;
      regions.add(Arrays.asList(before.start, before.start + lost));
    }

    for (Span span : shrinkTarget.spans) {
      if (span.start > start || span.end <= end || span.index >= initialData.spans.size()) continue;
      Span replacement = initialData.spans.get(span.index);
      List<Span> inOriginal = new ArrayList<>();
      for (Span c : span.children) if (c.start >= end) inOriginal.add(c);
      List<Span> inReplaced = new ArrayList<>();
      for (Span c : replacement.children) if (c.start >= end) inReplaced.add(c);
      if (inReplaced.size() >= inOriginal.size() || inReplaced.isEmpty()) continue;
      // Keep the rightmost children rather than the leftmost
      regions.add(Arrays.asList(inOriginal.get(0).start,
          inOriginal.get(inOriginal.size() - inReplaced.size()).start));
    }

    List<List<Integer>> ordered = new ArrayList<>(regions);
    ordered.sort(Comparator.comparingInt((List<Integer> r) -> r.get(1) - r.get(0)).reversed());
    for (List<Integer> region : ordered) {
      int u = region.get(0);
      int v = region.get(1);
      if (v > initialAttempt.length || u >= v) continue;
      if (incorporateNewBuffer(Util.withRemoved(initialAttempt, u, v))) return true;
    }
    return false;
  }

  /**
   * Visit every non-trivial span of the current target, parents before children. Indices are looked up again after
   * each visit since the target may have changed.
   */
  private void forEachNonTrivialSpan(Consumer<Span> action) {
    Deque<int[]> stack = new ArrayDeque<>();
    stack.push(new int[] { 0, -1 });
    while (!stack.isEmpty()) {
      int[] entry = stack.pop();
      List<Span> spans = shrinkTarget.spans;
      int spanIndex = entry[0];
      if (entry[1] >= 0) {
        if (entry[0] >= spans.size() || entry[1] >= spans.get(entry[0]).children.size()) continue;
        spanIndex = spans.get(entry[0]).children.get(entry[1]).index;
      }
      if (spanIndex >= spans.size() || spans.get(spanIndex).trivial) continue;
      action.accept(spans.get(spanIndex));
      spans = shrinkTarget.spans;
      if (spanIndex >= spans.size() || spans.get(spanIndex).trivial) continue;
      for (int i = 0; i < spans.get(spanIndex).children.size(); i++) stack.push(new int[] { spanIndex, i });
    }
  }

  /* Passes */

  /**
   * Replace most bytes with 0 or 1. Equivalent tapes then tend to share a representation, which makes later caching
   * more effective. Only run once, at the start.
   */
  private void alphabetMinimize() {
    for (int c : new int[] { 1, 0 }) {
      Set<Integer> alphabet = new TreeSet<>();
      for (byte b : shrinkTarget.buffer()) if ((b & 0xFF) > c) alphabet.add(b & 0xFF);
      if (alphabet.isEmpty()) continue;
      List<Integer> symbols = new ArrayList<>(alphabet);
      LengthShrinker.shrink(symbols, reduced -> {
        Set<Integer> keep = new HashSet<>(reduced);
        byte[] attempt = shrinkTarget.buffer();
        for (int i = 0; i < attempt.length; i++) {
          int b = attempt[i] & 0xFF;
          if (b > c && !keep.contains(b)) attempt[i] = (byte) c;
        }
        return considerNewBuffer(attempt);
      }, runner.random(), false);
    }
  }

  /** Delete every discarded span at once */
  private void removeDiscarded() {
    while (shrinkTarget.hasDiscards) {
      List<int[]> discarded = new ArrayList<>();
      for (Span span : shrinkTarget.spans) {
        if (span.discarded && (discarded.isEmpty() || span.start >= discarded.get(discarded.size() - 1)[1])) {
          discarded.add(new int[] { span.start, span.end });
        }
      }
      if (discarded.isEmpty()) break;
      byte[] attempt = shrinkTarget.buffer();
      for (int i = discarded.size() - 1; i >= 0; i--) {
        attempt = Util.withRemoved(attempt, discarded.get(i)[0], discarded.get(i)[1]);
      }
      if (!incorporateNewBuffer(attempt)) break;
    }
  }

  /** Replace each span with zeros, or with as many zeros as the zeroed span actually used */
  private void zeroExamples() {
    forEachNonTrivialSpan(span -> {
      byte[] buffer = shrinkTarget.buffer();
      int u = span.start;
      int v = span.end;
      byte[] zeroed = buffer.clone();
      Arrays.fill(zeroed, u, v, (byte) 0);
      ConjectureResult attempt = cachedTestFunction(zeroed);
      if (span.index >= attempt.spans.size()) return;
      Span inReplacement = attempt.spans.get(span.index);
      int used = inReplacement.length();
      if (!predicate.test(attempt) && inReplacement.end < attempt.length() && used < span.length()) {
        incorporateNewBuffer(Util.concat(Arrays.copyOf(buffer, u), new byte[used],
            Arrays.copyOfRange(buffer, v, buffer.length)));
      }
    });
  }

  /** Delete children of each span, the main way the tape gets shorter */
  private void adaptiveExampleDeletion() {
    forEachNonTrivialSpan(span -> {
      ExampleParts parts = new ExampleParts(span);
      LengthShrinker.shrink(parts.pieces, parts::incorporate, runner.random(), false);
    });
  }

  /** Sort the children of each span by sort key */
  private void reorderExamples() {
    forEachNonTrivialSpan(span -> {
      ExampleParts parts = new ExampleParts(span);
      OrderingShrinker.shrink(parts.pieces, parts::incorporate, Util.SORT_KEY, runner.random());
    });
  }

  /** The children of a span cut out of the target, for shrinkers working on sequences of them */
  private class ExampleParts {
    final byte[] prefix;
    final byte[] suffix;
    final List<byte[]> pieces = new ArrayList<>();

    ExampleParts(Span span) {
      byte[] buffer = shrinkTarget.buffer();
      for (Span child : span.children) pieces.add(Arrays.copyOfRange(buffer, child.start, child.end));
      if (pieces.isEmpty()) pieces.add(Arrays.copyOfRange(buffer, span.start, span.end));
      prefix = Arrays.copyOf(buffer, span.start);
      suffix = Arrays.copyOfRange(buffer, span.end, buffer.length);
    }

    boolean incorporate(List<byte[]> replacement) {
      byte[] middle = Util.concat(replacement.toArray(new byte[0][]));
      return incorporateNewBuffer(Util.concat(prefix, middle, suffix));
    }
  }

  /** Replace each span with a smaller span of the same label inside it, which handles recursive structures */
  private void passToDescendant() {
    forEachNonTrivialSpan(span -> {
      byte[] buffer = shrinkTarget.buffer();
      Set<ByteBuffer> distinct = new HashSet<>();
      List<byte[]> descendants = new ArrayList<>();
      for (Span d : shrinkTarget.spans) {
        if (d.start >= span.start && d.end <= span.end && d.length() < span.length() && d.label == span.label) {
          byte[] bytes = Arrays.copyOfRange(buffer, d.start, d.end);
          if (distinct.add(ByteBuffer.wrap(bytes))) descendants.add(bytes);
        }
      }
      descendants.sort(Util.SORT_KEY);
      for (byte[] d : descendants) {
        if (incorporateNewBuffer(Util.concat(Arrays.copyOf(buffer, span.start), d,
            Arrays.copyOfRange(buffer, span.end, buffer.length)))) break;
      }
    });
  }

  /** Shrink each drawn float through its value rather than its bytes */
  private void minimizeFloats() {
    for (int i = 0; i < shrinkTarget.spans.size(); i++) {
      Span span = shrinkTarget.spans.get(i);
      if (span.label != ConjectureData.DRAW_FLOAT_LABEL || span.endBlock - span.startBlock < 2) continue;
      Block lexBlock = shrinkTarget.blocks.get(span.startBlock);
      Block signBlock = shrinkTarget.blocks.get(span.startBlock + 1);
      if (lexBlock.length() != 8 || signBlock.length() != 1 || lexBlock.forced) continue;
      if (shrinkTarget.byteAt(signBlock.start) != 0) {
        byte[] attempt = shrinkTarget.buffer();
        attempt[signBlock.start] = 0;
        incorporateNewBuffer(attempt);
      }
      double value = Floats.lexToFloat(Util.bytesToLong(shrinkTarget.blockBytes(lexBlock)));
      FloatShrinker.shrink(value, f -> {
        if (Double.doubleToRawLongBits(f) < 0 || lexBlock.end > shrinkTarget.length()) return false;
        byte[] attempt = shrinkTarget.buffer();
        byte[] encoded = Util.longToBytes(Floats.floatToLex(f), 8);
        if (Arrays.equals(encoded, Arrays.copyOfRange(attempt, lexBlock.start, lexBlock.end))) return true;
        System.arraycopy(encoded, 0, attempt, lexBlock.start, 8);
        return incorporateNewBuffer(attempt);
      }, runner.random(), false);
    }
  }

  /** Lower blocks that share a value together, for tests that depend on the equality */
  private void minimizeDuplicatedBlocks() {
    Map<ByteBuffer, Integer> counts = new HashMap<>();
    for (Block block : shrinkTarget.blocks) {
      byte[] canon = Util.nonZeroSuffix(shrinkTarget.blockBytes(block));
      if (canon.length > 0) counts.merge(ByteBuffer.wrap(canon), 1, Integer::sum);
    }
    List<ByteBuffer> duplicated = new ArrayList<>();
    for (Map.Entry<ByteBuffer, Integer> entry : counts.entrySet()) if (entry.getValue() > 1) duplicated.add(entry.getKey());
    duplicated.sort(Comparator.comparingInt((ByteBuffer b) -> counts.get(b) * b.remaining()).reversed()
        .thenComparing((l, r) -> Util.compareUnsigned(r.array(), l.array())));
    for (ByteBuffer value : duplicated) {
      List<Integer> targets = new ArrayList<>();
      for (Block block : shrinkTarget.blocks) {
        if (ByteBuffer.wrap(Util.nonZeroSuffix(shrinkTarget.blockBytes(block))).equals(value)) targets.add(block.index);
      }
      if (targets.size() <= 1) continue;
      int[] indices = targets.stream().mapToInt(Integer::intValue).toArray();
      Minimizer.minimize(value.array(), b -> tryShrinkingBlocks(indices, b), false);
    }
  }

  /** Lexically shrink each block, last first */
  private void minimizeIndividualBlocks() {
    for (int i = shrinkTarget.blocks.size() - 1; i >= 0; i--) {
      if (i >= shrinkTarget.blocks.size()) continue;
      Block block = shrinkTarget.blocks.get(i);
      if (block.trivial()) continue;
      int[] indices = { i };
      LexicalShrinker.shrink(shrinkTarget.blockBytes(block), b -> tryShrinkingBlocks(indices, b), runner.random(),
          false);
    }
  }

  /**
   * Move value from an earlier block to a later one of the same size while keeping their sum. Finds e.g. m = 1,
   * n = 255 when the test needs m + n to reach 256.
   */
  private void redistributeBlockPairs() {
    for (int i = 0; i < shrinkTarget.blocks.size(); i++) {
      for (int j = i + 1; j < shrinkTarget.blocks.size(); j++) {
        if (i >= shrinkTarget.blocks.size()) return;
        Block first = shrinkTarget.blocks.get(i);
        if (first.allZero || !isPayloadBlock(i)) break;
        Block second = shrinkTarget.blocks.get(j);
        if (!isPayloadBlock(j) || first.length() != second.length()) continue;
        int u = first.start;
        int v = first.end;
        int r = second.start;
        int s = second.end;
        BigInteger m = blockValue(i);
        BigInteger n = blockValue(j);
        Predicate<BigInteger[]> trial = xy -> {
          if (s > shrinkTarget.length() || !fits(xy[0], v - u) || !fits(xy[1], s - r)) return false;
          byte[] attempt = shrinkTarget.buffer();
          System.arraycopy(Util.bigIntegerToBytes(xy[0], v - u), 0, attempt, u, v - u);
          System.arraycopy(Util.bigIntegerToBytes(xy[1], s - r), 0, attempt, r, s - r);
          return incorporateNewBuffer(attempt);
        };
        // Moving one unit working is the sign that a bigger move is worth trying
        if (trial.test(new BigInteger[] { m.subtract(BigInteger.ONE), n.add(BigInteger.ONE) }) &&
            m.compareTo(BigInteger.ONE) > 0) {
          BigInteger total = blockValue(i).add(blockValue(j));
          IntegerShrinker.shrink(blockValue(i), x -> trial.test(new BigInteger[] { x, total.subtract(x) }),
              runner.random(), false);
        }
      }
    }
  }

  /**
   * Rewrite runs of consecutive blocks, one command per block: "-" lowers the block by one and "X" deletes it. The
   * program is skipped where a block can not be lowered.
   */
  private Runnable blockProgram(String description) {
    return () -> {
      int n = description.length();
      int i = 0;
      while (i + n <= shrinkTarget.blocks.size()) {
        byte[] attempt = shrinkTarget.buffer();
        boolean failed = false;
        for (int k = n - 1; k >= 0 && !failed; k--) {
          Block block = shrinkTarget.blocks.get(i + k);
          char command = description.charAt(k);
          if (command == '-') {
            BigInteger value = Util.bytesToBigInteger(Arrays.copyOfRange(attempt, block.start, block.end));
            if (value.signum() == 0) failed = true;
            else {
              byte[] lowered = Util.bigIntegerToBytes(value.subtract(BigInteger.ONE), block.length());
              System.arraycopy(lowered, 0, attempt, block.start, lowered.length);
            }
          } else if (command == 'X') {
            attempt = Util.withRemoved(attempt, block.start, block.end);
          } else throw new ConjectureException.InvalidArgument("Unknown block command " + command);
        }
        if (failed || !incorporateNewBuffer(attempt)) i++;
      }
    };
  }

  /**
   * Delete a span after a shrinking block while lowering that block by one. Gets unstuck where a count and the
   * elements it counts have to change together.
   */
  private void exampleDeletionWithBlockLowering() {
    int i = 0;
    while (i < shrinkTarget.blocks.size()) {
      if (!isShrinkingBlock(i)) {
        i++;
        continue;
      }
      Block block = shrinkTarget.blocks.get(i);
      int u = block.start;
      int v = block.end;
      int j = 0;
      while (j < shrinkTarget.spans.size()) {
        if (v > shrinkTarget.length()) break;
        BigInteger n = Util.bytesToBigInteger(Arrays.copyOfRange(shrinkTarget.buffer(), u, v));
        if (n.signum() == 0) break;
        Span span = shrinkTarget.spans.get(j);
        if (span.start < v || span.length() == 0) {
          j++;
          continue;
        }
        byte[] attempt = shrinkTarget.buffer();
        System.arraycopy(Util.bigIntegerToBytes(n.subtract(BigInteger.ONE), v - u), 0, attempt, u, v - u);
        if (!incorporateNewBuffer(Util.withRemoved(attempt, span.start, span.end))) j++;
      }
      i++;
    }
  }

  /**
   * Lower the common offset of all blocks changed since tracking was last cleared. Breaks the slow zig-zag where two
   * blocks can each only shrink a little because of the other.
   */
  private void lowerCommonBlockOffset() {
    if (changedBlocks.size() <= 1) return;
    List<Block> blocks = shrinkTarget.blocks;
    List<Integer> changed = new ArrayList<>();
    for (int i : new TreeSet<>(changedBlocks)) if (i < blocks.size() && !blocks.get(i).trivial()) changed.add(i);
    if (changed.isEmpty()) return;
    byte[] buffer = shrinkTarget.buffer();
    List<BigInteger> values = new ArrayList<>();
    for (int i : changed) values.add(blockValue(i));
    BigInteger offset = Collections.min(values);
    List<BigInteger> deltas = new ArrayList<>();
    for (BigInteger value : values) deltas.add(value.subtract(offset));
    BigInteger newOffset = IntegerShrinker.shrink(offset, o -> {
      byte[] attempt = buffer.clone();
      for (int k = 0; k < changed.size(); k++) {
        Block block = blocks.get(changed.get(k));
        BigInteger value = deltas.get(k).add(o);
        if (!fits(value, block.length())) return false;
        System.arraycopy(Util.bigIntegerToBytes(value, block.length()), 0, attempt, block.start, block.length());
      }
      return incorporateNewBuffer(attempt);
    }, runner.random(), false);
    if (newOffset.equals(offset)) changedBlocks.clear();
  }
}
