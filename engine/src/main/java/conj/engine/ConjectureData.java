package conj.engine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The record of one attempt at running a test. Draws consume bytes from a source and append them to the tape, while
 * spans, blocks and top-level choice nodes describe the structure of what was drawn. Once concluded via one of the
 * mark methods the data is frozen and control leaves the test through a {@link StopTest}.
 *
 * Not thread safe. One instance belongs to one execution.
 */
public class ConjectureData {
  public static final long TOP_LABEL = Util.labelFor("top");
  public static final long DRAW_BITS_LABEL = Util.labelFor("draw_bits");
  public static final long INTEGER_RANGE_LABEL = Util.labelFor("integer_range");
  public static final long BIASED_COIN_LABEL = Util.labelFor("biased_coin");
  public static final long BIASED_COIN_INNER_LABEL = Util.labelFor("biased_coin_inner");
  public static final long SAMPLE_IN_SAMPLER_LABEL = Util.labelFor("sample_in_sampler");
  public static final long ONE_FROM_MANY_LABEL = Util.labelFor("one_from_many");
  public static final long DRAW_FLOAT_LABEL = Util.labelFor("draw_float");

  /** Default tape size limit */
  public static final int BUFFER_SIZE = 8 * 1024;
  /** Spans nested deeper than this make the data invalid */
  public static final int MAX_DEPTH = 100;

  private static final AtomicLong TEST_COUNTER = new AtomicLong();

  /** Source of raw bytes for a draw */
  @FunctionalInterface
  public interface DrawBytes {
    /** Return n bytes for the draw starting at {@link ConjectureData#index()}, or fewer to signal overrun */
    byte[] draw(ConjectureData data, int n);
  }

  /** Create data that replays the given tape. Reading past its end is an overrun. */
  public static ConjectureData forBuffer(byte[] buffer) {
    byte[] copy = buffer.clone();
    return new ConjectureData(copy.length, (data, n) -> Arrays.copyOfRange(copy, data.index, data.index + n));
  }

  /** Create data that replays the given nodes. See {@link #forChoices(List, int)}. */
  public static ConjectureData forChoices(List<ChoiceNode> choices) { return forChoices(choices, BUFFER_SIZE); }

  /**
   * Create data that replays the given nodes in order. A null entry draws the simplest value its draw allows. A draw
   * whose kind or constraints differ from the node at its position, or a draw past the end of the list, is an overrun.
   * Raw bit draws made outside a typed draw read zeros.
   */
  public static ConjectureData forChoices(List<ChoiceNode> choices, int maxLength) {
    ConjectureData data = new ConjectureData(maxLength, (d, n) -> new byte[n]);
    data.template = new ArrayList<>(choices);
    return data;
  }

  /** Unique counter used to match {@link StopTest} signals to this data */
  public final long testCounter = TEST_COUNTER.incrementAndGet();
  public final int maxLength;
  /** Scores for targeted search, by label */
  public final Map<String, Double> targetObservations = new LinkedHashMap<>();
  /** Free-text events noted by the test */
  public final Map<String, String> events = new LinkedHashMap<>();
  /** Anything else the surrounding layer wants to carry along with the result */
  public final Map<String, Object> extraInformation = new LinkedHashMap<>();

  private final DrawBytes source;
  private List<ChoiceNode> template;
  private int templateIndex;

  private byte[] buffer = new byte[64];
  private int index;
  private Status status = Status.VALID;
  private boolean frozen;
  private InterestingOrigin interestingOrigin;
  private Throwable cause;
  private boolean hitZeroBound;
  private boolean hasDiscards;

  private final BitSet forcedIndices = new BitSet();
  private final Map<Integer, Integer> maskedIndices = new TreeMap<>();
  private final List<Block> blocks = new ArrayList<>();
  private final List<SpanRecord> spanRecords = new ArrayList<>();
  private final Deque<SpanRecord> openSpans = new ArrayDeque<>();
  private final List<ChoiceNode> nodes = new ArrayList<>();
  private final List<Long> drawTimes = new ArrayList<>();

  private int drawDepth;
  private boolean zeroMode;
  private boolean replayForcing;

  private final long startNanos = System.nanoTime();
  private long finishNanos;
  private List<Span> spans;
  private ConjectureResult result;

  public ConjectureData(int maxLength, DrawBytes source) {
    this.maxLength = maxLength;
    this.source = Objects.requireNonNull(source);
    startSpan(TOP_LABEL);
  }

  /* Typed draws */

  /** Draw a long in [min, max]. See {@link #drawInteger(ChoiceConstraints.ForInteger, Long)}. */
  public long drawInteger(long min, long max) { return drawInteger(new ChoiceConstraints.ForInteger(min, max), null); }

  public long drawInteger(ChoiceConstraints.ForInteger constraints) { return drawInteger(constraints, null); }

  /**
   * Draw a long satisfying the constraints, shrinking towards {@link ChoiceConstraints.ForInteger#shrinkTowards}. With
   * weights, a sampler first decides between each weighted value and an unweighted draw.
   */
  public long drawInteger(ChoiceConstraints.ForInteger constraints, Long forced) {
    return choice(constraints, forced, f -> {
      if (constraints.weights != null) {
        List<Long> keys = new ArrayList<>(constraints.weights.keySet());
        double[] weights = new double[keys.size() + 1];
        double total = 0;
        for (int i = 0; i < keys.size(); i++) {
          weights[i + 1] = constraints.weights.get(keys.get(i));
          total += weights[i + 1];
        }
        weights[0] = 1 - total;
        Integer forcedIndex = null;
        if (f != null) forcedIndex = keys.contains(f) ? keys.indexOf(f) + 1 : 0;
        int picked = new Sampler(weights).sample(this, forcedIndex);
        if (picked > 0) return keys.get(picked - 1);
      }
      return integerRange(constraints.min, constraints.max, constraints.shrinkTowards, f);
    });
  }

  public boolean drawBoolean(double p) { return drawBoolean(p, null); }

  /** Draw a boolean that is true with probability p. All zero bytes give false where p allows it. */
  public boolean drawBoolean(double p, Boolean forced) {
    return choice(new ChoiceConstraints.ForBoolean(p), forced, f -> biasedCoin(p, f));
  }

  public double drawFloat(double min, double max, boolean allowNan) {
    return drawFloat(new ChoiceConstraints.ForFloat(min, max, allowNan), null);
  }

  /**
   * Draw a double as 64 lexicographically encoded bits of magnitude followed by a sign bit. Values outside the
   * constraints are mapped back into them.
   */
  public double drawFloat(ChoiceConstraints.ForFloat constraints, Double forced) {
    return choice(constraints, forced, f -> {
      startSpan(DRAW_FLOAT_LABEL);
      Long forcedLex = f == null ? null : Floats.floatToLex(f);
      Long forcedSign = f == null ? null : (Double.doubleToRawLongBits(f) < 0 ? 1L : 0L);
      double value = Floats.lexToFloat(drawBits(64, forcedLex));
      if (drawBits(1, forcedSign) == 1) value = -value;
      stopSpan(false);
      return Floats.canonicalize(clamp(constraints, value));
    });
  }

  public byte[] drawBytes(int minSize, int maxSize) {
    return drawBytes(new ChoiceConstraints.ForBytes(minSize, maxSize), null);
  }

  /** Draw a byte array, one byte per collection element */
  public byte[] drawBytes(ChoiceConstraints.ForBytes constraints, byte[] forced) {
    return choice(constraints, forced, f -> {
      Many many = new Many(this, constraints.minSize, constraints.maxSize,
          Many.defaultAverageSize(constraints.minSize, constraints.maxSize));
      byte[] result = new byte[Math.min(constraints.maxSize, 64)];
      int count = 0;
      while (many.more(f == null ? null : many.count() < f.length)) {
        long b = drawBits(8, f == null ? null : (long) (f[count] & 0xFF));
        if (count == result.length) result = Arrays.copyOf(result, Math.min(constraints.maxSize, result.length * 2));
        result[count++] = (byte) b;
      }
      return Arrays.copyOf(result, count);
    });
  }

  public String drawString(String alphabet, int minSize, int maxSize) {
    return drawString(new ChoiceConstraints.ForString(alphabet, minSize, maxSize), null);
  }

  /** Draw a string over the alphabet. Each code point is drawn as an index that shrinks towards the alphabet start. */
  public String drawString(ChoiceConstraints.ForString constraints, String forced) {
    return choice(constraints, forced, f -> {
      int[] forcedPoints = f == null ? null : f.codePoints().toArray();
      Many many = new Many(this, constraints.minSize, constraints.maxSize,
          Many.defaultAverageSize(constraints.minSize, constraints.maxSize));
      StringBuilder sb = new StringBuilder();
      while (many.more(forcedPoints == null ? null : many.count() < forcedPoints.length)) {
        Long forcedIndex = forcedPoints == null ? null :
            (long) constraints.indexOf(forcedPoints[many.count() - 1]);
        int i = (int) integerRange(0, constraints.alphabetSize() - 1, 0, forcedIndex);
        sb.appendCodePoint(constraints.codePointAt(i));
      }
      return sb.toString();
    });
  }

  /** Append the given bytes to the tape as a forced block */
  public void write(byte[] bytes) {
    checkNotFrozen("write");
    startSpan(DRAW_BITS_LABEL);
    drawRaw(bytes.length, bytes.clone(), 0xFF);
    stopSpan(false);
  }

  /* Primitive draws */

  public long drawBits(int n) { return drawBits(n, null); }

  /**
   * Draw an unsigned value of n bits, 0 to 64, as one block of ceil(n / 8) bytes with the unused high bits of the
   * first byte masked off. The block is also recorded as a span of its own.
   */
  public long drawBits(int n, Long forced) {
    checkNotFrozen("drawBits");
    if (n < 0 || n > 64) throw new ConjectureException.InvalidArgument("Bit count must be in [0, 64]: " + n);
    if (forced != null && n < 64 && (forced >>> n) != 0)
      throw new ConjectureException.InvalidArgument("Forced value " + forced + " does not fit in " + n + " bits");
    if (n == 0) return 0;
    int nBytes = (n + 7) / 8;
    int mask = n % 8 == 0 ? 0xFF : (1 << (n % 8)) - 1;
    startSpan(DRAW_BITS_LABEL);
    byte[] bytes = drawRaw(nBytes, forced == null ? null : Util.longToBytes(forced, nBytes), mask);
    stopSpan(false);
    return Util.bytesToLong(bytes);
  }

  private byte[] drawRaw(int nBytes, byte[] forcedBytes, int topMask) {
    if (index + nBytes > maxLength) markOverrun();
    byte[] bytes;
    if (forcedBytes != null) bytes = forcedBytes;
    else if (zeroMode) bytes = new byte[nBytes];
    else {
      byte[] drawn = source.draw(this, nBytes);
      if (drawn == null || drawn.length < nBytes) markOverrun();
      bytes = Arrays.copyOf(drawn, nBytes);
    }
    if (topMask != 0xFF && nBytes > 0) {
      bytes[0] &= topMask;
      maskedIndices.put(index, topMask);
    }
    int start = index;
    ensureCapacity(index + nBytes);
    System.arraycopy(bytes, 0, buffer, index, nBytes);
    index += nBytes;
    boolean forced = forcedBytes != null && !replayForcing;
    if (forced) forcedIndices.set(start, index);
    blocks.add(new Block(blocks.size(), start, index, forced, Util.allZero(bytes)));
    return bytes;
  }

  private void ensureCapacity(int size) {
    if (size > buffer.length) buffer = Arrays.copyOf(buffer, Math.max(size, buffer.length * 2));
  }

  /**
   * Draw a long in [lower, upper] that shrinks towards center. Unless center is at an end of the range, a side bit
   * comes first with zero meaning at or above center. Then the distance from center is drawn with just enough bits,
   * rejecting and redrawing distances that fall outside the range.
   */
  long integerRange(long lower, long upper, long center, Long forced) {
    if (lower > upper) throw new ConjectureException.InvalidArgument("lower " + lower + " > upper " + upper);
    if (forced != null && (forced < lower || forced > upper))
      throw new ConjectureException.InvalidArgument("Forced " + forced + " outside [" + lower + ", " + upper + "]");
    if (lower == upper) {
      drawBits(1, 0L);
      return lower;
    }
    center = Math.max(lower, Math.min(upper, center));
    boolean above;
    if (center == upper) above = false;
    else if (center == lower) above = true;
    else above = drawBits(1, forced == null ? null : (forced < center ? 1L : 0L)) == 0;
    long gap = above ? upper - center : center - lower;
    int bits = 64 - Long.numberOfLeadingZeros(gap);
    Long forcedProbe = forced == null ? null : (above ? forced - center : center - forced);
    long probe;
    do {
      startSpan(INTEGER_RANGE_LABEL);
      probe = drawBits(bits, forcedProbe);
      stopSpan(Long.compareUnsigned(probe, gap) > 0);
    } while (Long.compareUnsigned(probe, gap) > 0);
    return above ? center + probe : center - probe;
  }

  /**
   * Draw a boolean that is true with probability p. Zero is always false and one always true. Any other value is
   * discarded and followed by a forced block holding the result, so the shrinker can replace it with zero or one.
   */
  boolean biasedCoin(double p, Boolean forced) {
    startSpan(BIASED_COIN_LABEL);
    boolean result;
    while (true) {
      if (p <= 0) {
        if (Boolean.TRUE.equals(forced)) throw new ConjectureException.InvalidArgument("Can not force true, p=" + p);
        drawBits(1, 0L);
        result = false;
        break;
      }
      if (p >= 1) {
        if (Boolean.FALSE.equals(forced)) throw new ConjectureException.InvalidArgument("Can not force false, p=" + p);
        drawBits(1, 1L);
        result = true;
        break;
      }
      int falsey = (int) Math.floor(256 * (1 - p));
      int truthy = (int) Math.floor(256 * p);
      double remainder = 256 * p - truthy;
      int bits;
      boolean partial;
      if (falsey + truthy == 256) {
        int m = truthy;
        int n = 256;
        while ((m & 1) == 0 && n > 1) {
          m >>= 1;
          n >>= 1;
        }
        truthy = m;
        falsey = n - m;
        bits = Integer.numberOfTrailingZeros(n);
        partial = false;
      } else {
        bits = 8;
        partial = true;
      }
      int size = 1 << bits;
      long i;
      if (forced == null) {
        startSpan(BIASED_COIN_INNER_LABEL);
        i = drawBits(bits);
        stopSpan(i > 1);
      } else if (partial && ((forced && truthy == 0) || (!forced && falsey == 0))) {
        // The wanted value only exists in the remainder
        i = drawBits(bits, (long) (size - 1));
      } else i = drawBits(bits, forced ? 1L : 0L);

      if (partial && i == size - 1) {
        p = remainder;
        continue;
      }
      if (falsey == 0) result = true;
      else if (truthy == 0) result = false;
      else if (i <= 1) result = i == 1;
      else result = i > falsey;
      if (i > 1) drawBits(bits, result ? 1L : 0L);
      break;
    }
    stopSpan(false);
    return result;
  }

  static double clamp(ChoiceConstraints.ForFloat constraints, double f) {
    if (constraints.permits(f)) return f;
    double range = constraints.max - constraints.min;
    double width = Double.isNaN(range) ? 0 : Math.min(range, Double.MAX_VALUE);
    long mantissa = Double.doubleToRawLongBits(f) & Floats.MANTISSA_MASK;
    double result = constraints.min + width * ((double) mantissa / Floats.MANTISSA_MASK);
    return Math.max(constraints.min, Math.min(constraints.max, result));
  }

  @FunctionalInterface
  private interface Draw<T> {
    T draw(T forced);
  }

  /** Runs a typed draw, applying any template entry and recording a node when it is not nested in another draw */
  @SuppressWarnings("unchecked")
  private <T> T choice(ChoiceConstraints constraints, T forced, Draw<T> draw) {
    checkNotFrozen("draw " + constraints.kind());
    if (forced != null) constraints.validate(forced);
    if (drawDepth > 0) return draw.draw(forced);
    T toForce = forced;
    boolean replay = false;
    boolean zeroForThis = false;
    if (template != null) {
      if (templateIndex >= template.size()) markOverrun();
      ChoiceNode node = template.get(templateIndex++);
      if (node == null) zeroForThis = true;
      else if (node.kind != constraints.kind() || !node.constraints.equals(constraints)) markOverrun();
      else if (forced == null) {
        toForce = (T) node.value;
        replay = true;
      }
    }
    int start = index;
    long drawStart = System.nanoTime();
    boolean wasZeroMode = zeroMode;
    drawDepth++;
    zeroMode = wasZeroMode || zeroForThis;
    replayForcing = replay;
    T value;
    try {
      value = draw.draw(toForce);
    } finally {
      drawDepth--;
      zeroMode = wasZeroMode;
      replayForcing = false;
    }
    drawTimes.add(System.nanoTime() - drawStart);
    nodes.add(new ChoiceNode(constraints.kind(), constraints, value, forced != null, start, index, nodes.size()));
    return value;
  }

  /* Spans */

  /** Open a span with the given label. Nesting beyond {@link #MAX_DEPTH} marks the data invalid. */
  public void startSpan(long label) {
    checkNotFrozen("startSpan");
    SpanRecord parent = openSpans.peek();
    SpanRecord record = new SpanRecord(spanRecords.size(), label, index, openSpans.size(),
        parent == null ? -1 : parent.index, blocks.size());
    spanRecords.add(record);
    openSpans.push(record);
    if (depth() > MAX_DEPTH) markInvalid();
  }

  /** Close the innermost span. A discarded span is one the test threw away. */
  public void stopSpan(boolean discard) {
    if (frozen) return;
    if (openSpans.size() <= 1) throw new ConjectureException.InvalidState("stopSpan without matching startSpan");
    SpanRecord record = openSpans.pop();
    record.end = index;
    record.endBlock = blocks.size();
    record.discarded = discard;
    if (discard) hasDiscards = true;
  }

  /** Depth of the innermost open span, zero for the top span */
  public int depth() { return openSpans.size() - 1; }

  /* Conclusion */

  public void markInteresting(InterestingOrigin origin) { markInteresting(origin, null); }

  /** Conclude as a failure with the given origin */
  public void markInteresting(InterestingOrigin origin, Throwable cause) {
    concludeTest(Status.INTERESTING, Objects.requireNonNull(origin), cause);
  }

  public void markInvalid() { concludeTest(Status.INVALID, null, null); }

  public void markOverrun() { concludeTest(Status.OVERRUN, null, null); }

  private void concludeTest(Status status, InterestingOrigin origin, Throwable cause) {
    conclude(status, origin, cause);
    throw new StopTest(testCounter);
  }

  /** Conclude and freeze without unwinding, for callers outside the test such as the runner */
  void conclude(Status status, InterestingOrigin origin, Throwable cause) {
    checkNotFrozen("conclude");
    this.status = status;
    this.interestingOrigin = origin;
    this.cause = cause;
    freeze();
  }

  /** Reject the data unless the condition holds */
  public void assume(boolean condition) {
    if (!condition) throw new ConjectureException.UnsatisfiedAssumption();
  }

  /** Reject the data */
  public void reject() { throw new ConjectureException.UnsatisfiedAssumption(); }

  /** Record a target score. Higher scores are better. */
  public void target(String label, double score) {
    checkNotFrozen("target");
    targetObservations.put(label, score);
  }

  public void noteEvent(String key, String value) {
    checkNotFrozen("noteEvent");
    events.put(key, value);
  }

  /** Stop recording. Closes any open spans. Safe to call more than once. */
  public void freeze() {
    if (frozen) return;
    finishNanos = System.nanoTime();
    while (!openSpans.isEmpty()) {
      SpanRecord record = openSpans.pop();
      record.end = index;
      record.endBlock = blocks.size();
    }
    frozen = true;
    List<Span> built = new ArrayList<>(spanRecords.size());
    for (SpanRecord record : spanRecords) {
      boolean trivial = true;
      for (int i = record.startBlock; i < record.endBlock && trivial; i++) trivial = blocks.get(i).trivial();
      Span span = new Span(record.index, record.label, record.start, record.end, record.depth, record.parent,
          record.discarded, record.startBlock, record.endBlock, trivial);
      built.add(span);
      if (span.parent >= 0) built.get(span.parent).mutableChildren.add(span);
    }
    spans = Collections.unmodifiableList(built);
  }

  /** Immutable snapshot of frozen data, cached after the first call */
  public ConjectureResult asResult() {
    if (!frozen) throw new ConjectureException.InvalidState("Data must be frozen first");
    if (result == null) result = new ConjectureResult(this);
    return result;
  }

  private void checkNotFrozen(String operation) {
    if (frozen) throw new ConjectureException.Frozen(operation);
  }

  /* Accessors */

  public boolean isFrozen() { return frozen; }

  /** The conclusion. Data that is not yet frozen reports {@link Status#VALID}. */
  public Status status() { return status; }

  public InterestingOrigin interestingOrigin() { return interestingOrigin; }

  public Throwable cause() { return cause; }

  /** Current tape position */
  public int index() { return index; }

  /** Copy of the tape so far */
  public byte[] buffer() { return Arrays.copyOf(buffer, index); }

  public List<Block> blocks() { return Collections.unmodifiableList(blocks); }

  /** Spans in opening order, only available once frozen */
  public List<Span> spans() {
    if (!frozen) throw new ConjectureException.InvalidState("Spans are built on freeze");
    return spans;
  }

  public List<ChoiceNode> nodes() { return Collections.unmodifiableList(nodes); }

  /** Nanos spent in each top-level draw */
  public List<Long> drawTimes() { return Collections.unmodifiableList(drawTimes); }

  public boolean isForced(int i) { return forcedIndices.get(i); }

  BitSet forcedIndices() { return forcedIndices; }

  Map<Integer, Integer> maskedIndices() { return maskedIndices; }

  public boolean hasDiscards() { return hasDiscards; }

  public boolean hitZeroBound() { return hitZeroBound; }

  /** Marks bytes a source decided not to vary, e.g. past a size bound */
  void markForced(int start, int end) {
    forcedIndices.set(start, end);
    hitZeroBound = true;
  }

  /** Wall clock nanos from creation until freezing, or until now if still running */
  public long elapsedNanos() { return (frozen ? finishNanos : System.nanoTime()) - startNanos; }

  @Override
  public String toString() {
    return "ConjectureData(" + (frozen ? status : "ACTIVE") + ", " + index + " bytes, " + nodes.size() + " choices)";
  }

  private static class SpanRecord {
    final int index;
    final long label;
    final int start;
    final int depth;
    final int parent;
    final int startBlock;
    int end;
    int endBlock;
    boolean discarded;

    SpanRecord(int index, long label, int start, int depth, int parent, int startBlock) {
      this.index = index;
      this.label = label;
      this.start = start;
      this.depth = depth;
      this.parent = parent;
      this.startBlock = startBlock;
    }
  }
}
