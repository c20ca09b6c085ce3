package conj.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A labelled region of the tape recorded between {@link ConjectureData#startSpan(long)} and
 * {@link ConjectureData#stopSpan(boolean)}. Spans form a tree rooted at the top span covering the whole tape, and the
 * shrinker treats each one as a candidate unit for deletion, zeroing or reordering.
 */
public class Span {
  /** Position in the span list, which is in order of opening */
  public final int index;
  public final long label;
  /** Tape start, inclusive */
  public final int start;
  /** Tape end, exclusive */
  public final int end;
  /** Zero for the top span */
  public final int depth;
  /** Index of the parent span, or -1 for the top span */
  public final int parent;
  /** True if the test threw this region away, e.g. a rejected collection element */
  public final boolean discarded;
  /** First block inside the span, inclusive */
  public final int startBlock;
  /** Last block inside the span, exclusive */
  public final int endBlock;
  /** True if every block inside is trivial */
  public final boolean trivial;
  /** Direct children in tape order */
  public final List<Span> children;

  final List<Span> mutableChildren = new ArrayList<>();

  Span(int index, long label, int start, int end, int depth, int parent, boolean discarded,
      int startBlock, int endBlock, boolean trivial) {
    this.index = index;
    this.label = label;
    this.start = start;
    this.end = end;
    this.depth = depth;
    this.parent = parent;
    this.discarded = discarded;
    this.startBlock = startBlock;
    this.endBlock = endBlock;
    this.trivial = trivial;
    children = Collections.unmodifiableList(mutableChildren);
  }

  public int length() { return end - start; }

  @Override
  public String toString() {
    return "Span(" + index + ", label=" + Long.toHexString(label) + ", " + start + ".." + end + ", depth=" + depth +
        (discarded ? ", discarded" : "") + ")";
  }
}
