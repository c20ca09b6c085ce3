package conj.engine;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Random;
import java.util.function.Consumer;

/**
 * An approximate Pareto front of valid results. Each add only compares against a random sample of at most ten
 * existing members, so a member may occasionally be dominated by another, but never by one it was compared with.
 */
public class ParetoFront implements Iterable<ConjectureResult> {
  /** How many existing members each add is compared with */
  public static final int SAMPLE_SIZE = 10;

  /** Relation between two results */
  public enum Dominance {
    NO_DOMINANCE,
    EQUAL,
    LEFT_DOMINATES,
    RIGHT_DOMINATES
  }

  /**
   * Left dominates right if it is no worse in every way and strictly simpler: it sorts before right, has a status at
   * least as good, has the same origin if interesting, and scores at least as well on every target both observed.
   * Identical tapes are equal.
   */
  public static Dominance dominance(ConjectureResult left, ConjectureResult right) {
    byte[] leftBuf = left.buffer();
    byte[] rightBuf = right.buffer();
    int cmp = Util.compareSortKey(leftBuf, rightBuf);
    if (cmp == 0) return Dominance.EQUAL;
    if (cmp > 0) {
      Dominance result = dominance(right, left);
      return result == Dominance.LEFT_DOMINATES ? Dominance.RIGHT_DOMINATES : result;
    }
    if (left.status.compareTo(right.status) < 0) return Dominance.NO_DOMINANCE;
    if (left.status == Status.INTERESTING && !left.interestingOrigin.equals(right.interestingOrigin))
      return Dominance.NO_DOMINANCE;
    for (Entry<String, Double> entry : left.targetObservations.entrySet()) {
      Double other = right.targetObservations.get(entry.getKey());
      if (other != null && other > entry.getValue()) return Dominance.NO_DOMINANCE;
    }
    return Dominance.LEFT_DOMINATES;
  }

  private final Random random;
  private final List<Consumer<ConjectureResult>> evictionListeners = new ArrayList<>();
  private final List<ConjectureResult> front = new ArrayList<>();
  private final Map<ByteBuffer, Integer> contained = new HashMap<>();
  private ConjectureResult pending;

  public ParetoFront(Random random) {
    this.random = random;
  }

  /** Register a listener called with each member removed because something dominates it */
  public void onEvict(Consumer<ConjectureResult> listener) { evictionListeners.add(listener); }

  /**
   * Try to add the result. Returns true if it is a member afterwards and was not one before. Results below
   * {@link Status#VALID} are never added.
   */
  public boolean add(ConjectureResult data) {
    if (data.status.compareTo(Status.VALID) < 0) return false;
    if (front.isEmpty()) {
      addInternal(data);
      return true;
    }
    if (contains(data)) return false;
    addInternal(data);
    pending = data;
    try {
      List<ConjectureResult> dominators = new ArrayList<>();
      dominators.add(data);
      int i = front.size() - 1;
      int stopping = Math.max(0, front.size() - SAMPLE_SIZE);
      while (i >= stopping) {
        swap(i, random.nextInt(i + 1));
        ConjectureResult existing = front.get(i);
        boolean alreadyReplaced = false;
        boolean broke = false;
        int j = 0;
        while (j < dominators.size()) {
          ConjectureResult v = dominators.get(j);
          Dominance dom = dominance(existing, v);
          if (dom == Dominance.LEFT_DOMINATES) {
            if (!alreadyReplaced) {
              alreadyReplaced = true;
              dominators.set(j, existing);
              j++;
            } else {
              Collections.swap(dominators, j, dominators.size() - 1);
              dominators.remove(dominators.size() - 1);
            }
            remove(v);
          } else if (dom == Dominance.RIGHT_DOMINATES) {
            remove(existing);
            broke = true;
            break;
          } else if (dom == Dominance.EQUAL) {
            broke = true;
            break;
          } else j++;
        }
        if (!broke) dominators.add(existing);
        i--;
      }
      return contains(data);
    } finally {
      pending = null;
    }
  }

  public boolean contains(ConjectureResult data) { return contained.containsKey(ByteBuffer.wrap(data.buffer())); }

  public int size() { return front.size(); }

  @Override
  public Iterator<ConjectureResult> iterator() { return Collections.unmodifiableList(front).iterator(); }

  private void addInternal(ConjectureResult data) {
    contained.put(ByteBuffer.wrap(data.buffer()), front.size());
    front.add(data);
  }

  private void remove(ConjectureResult data) {
    Integer i = contained.get(ByteBuffer.wrap(data.buffer()));
    if (i == null) return;
    swap(i, front.size() - 1);
    front.remove(front.size() - 1);
    contained.remove(ByteBuffer.wrap(data.buffer()));
    if (data != pending) for (Consumer<ConjectureResult> listener : evictionListeners) listener.accept(data);
  }

  private void swap(int i, int j) {
    if (i == j) return;
    Collections.swap(front, i, j);
    contained.put(ByteBuffer.wrap(front.get(i).buffer()), i);
    contained.put(ByteBuffer.wrap(front.get(j).buffer()), j);
  }
}
