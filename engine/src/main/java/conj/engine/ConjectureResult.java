package conj.engine;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/** Immutable snapshot of frozen {@link ConjectureData}, safe to cache and compare */
public class ConjectureResult {
  /** Shared result for any tape the runner already knows will overrun */
  public static final ConjectureResult OVERRUN = new ConjectureResult();

  public final Status status;
  /** Set only when {@link #status} is {@link Status#INTERESTING} */
  public final InterestingOrigin interestingOrigin;
  /** The throwable behind the failure, if any */
  public final Throwable cause;
  private final byte[] buffer;
  public final List<Block> blocks;
  public final List<Span> spans;
  public final List<ChoiceNode> nodes;
  public final List<Long> drawTimes;
  public final Map<String, Double> targetObservations;
  public final Map<String, String> events;
  public final Map<String, Object> extraInformation;
  /** Mask applied to the byte at each partially drawn index */
  public final Map<Integer, Integer> maskedIndices;
  public final boolean hasDiscards;
  private final BitSet forcedIndices;

  private ConjectureResult() {
    status = Status.OVERRUN;
    interestingOrigin = null;
    cause = null;
    buffer = new byte[0];
    blocks = Collections.emptyList();
    spans = Collections.emptyList();
    nodes = Collections.emptyList();
    drawTimes = Collections.emptyList();
    targetObservations = Collections.emptyMap();
    events = Collections.emptyMap();
    extraInformation = Collections.emptyMap();
    maskedIndices = Collections.emptyMap();
    hasDiscards = false;
    forcedIndices = new BitSet();
  }

  ConjectureResult(ConjectureData data) {
    status = data.status();
    interestingOrigin = data.interestingOrigin();
    cause = data.cause();
    buffer = data.buffer();
    blocks = Collections.unmodifiableList(new ArrayList<>(data.blocks()));
    spans = data.spans();
    nodes = Collections.unmodifiableList(new ArrayList<>(data.nodes()));
    drawTimes = Collections.unmodifiableList(new ArrayList<>(data.drawTimes()));
    targetObservations = Collections.unmodifiableMap(new LinkedHashMap<>(data.targetObservations));
    events = Collections.unmodifiableMap(new LinkedHashMap<>(data.events));
    extraInformation = Collections.unmodifiableMap(new LinkedHashMap<>(data.extraInformation));
    maskedIndices = Collections.unmodifiableMap(new TreeMap<>(data.maskedIndices()));
    hasDiscards = data.hasDiscards();
    forcedIndices = (BitSet) data.forcedIndices().clone();
  }

  /** Copy of the tape */
  public byte[] buffer() { return buffer.clone(); }

  /** Tape length */
  public int length() { return buffer.length; }

  /** Unsigned tape byte at the index */
  public int byteAt(int i) { return buffer[i] & 0xFF; }

  /** True if the byte at the index was forced and so can not vary */
  public boolean isForced(int i) { return forcedIndices.get(i); }

  /** Bytes of the given block */
  public byte[] blockBytes(Block block) {
    byte[] result = new byte[block.length()];
    System.arraycopy(buffer, block.start, result, 0, result.length);
    return result;
  }

  /** Bytes of the given span */
  public byte[] spanBytes(Span span) {
    byte[] result = new byte[span.length()];
    System.arraycopy(buffer, span.start, result, 0, result.length);
    return result;
  }

  /** True if this result is strictly simpler than the other under the sort key */
  public boolean simplerThan(ConjectureResult other) { return Util.sortKeyLess(buffer, other.buffer); }

  @Override
  public String toString() {
    return "ConjectureResult(" + status + (interestingOrigin == null ? "" : ", " + interestingOrigin) +
        ", " + buffer.length + " bytes)";
  }
}
