package conj.engine.shrinking;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.function.Predicate;

import conj.engine.Util;

/**
 * Moves a sequence towards sorted order under a comparator without changing its elements. Tries a full sort first,
 * then sorts growing regions, then makes a single greedy pass of adjacent swaps.
 *
 * @param <T> the element type
 */
public class OrderingShrinker<T> extends ValueShrinker<List<T>> {
  private final Comparator<? super T> comparator;

  public static <T> List<T> shrink(List<T> initial, Predicate<List<T>> predicate, Comparator<? super T> comparator,
      Random random) {
    OrderingShrinker<T> shrinker = new OrderingShrinker<>(initial, predicate, comparator, random, false);
    shrinker.run();
    return shrinker.current();
  }

  public OrderingShrinker(List<T> initial, Predicate<List<T>> predicate, Comparator<? super T> comparator,
      Random random, boolean full) {
    super(Collections.unmodifiableList(new ArrayList<>(initial)), predicate, random, full);
    this.comparator = comparator;
  }

  @Override
  public boolean incorporate(List<T> value) { return super.incorporate(Collections.unmodifiableList(value)); }

  @Override
  protected void checkInvariants(List<T> value) {
    if (value.size() != current.size())
      throw new IllegalArgumentException("Reordering changed size from " + current.size() + " to " + value.size());
  }

  @Override
  protected boolean leftIsBetter(List<T> left, List<T> right) {
    for (int i = 0; i < left.size(); i++) {
      int cmp = comparator.compare(left.get(i), right.get(i));
      if (cmp != 0) return cmp < 0;
    }
    return false;
  }

  @Override
  protected boolean shortCircuit() {
    List<T> sorted = new ArrayList<>(current);
    sorted.sort(comparator);
    return consider(sorted);
  }

  @Override
  protected void runStep() {
    sortRegions();
    swapAdjacent();
  }

  /** Sort as long a region as possible starting at each index */
  private void sortRegions() {
    int i = 0;
    while (i + 1 < current.size()) {
      int start = i;
      List<T> base = current;
      int k = Util.findInteger(n -> {
        if (start + n > base.size()) return false;
        List<T> attempt = new ArrayList<>(base);
        attempt.subList(start, start + n).sort(comparator);
        return consider(attempt);
      });
      i += Math.max(1, k);
    }
  }

  private void swapAdjacent() {
    List<T> attempt = new ArrayList<>(current);
    for (int i = 0; i + 1 < attempt.size(); i++) {
      int j = i + 1;
      while (j > 0 && comparator.compare(attempt.get(j - 1), attempt.get(j)) > 0) {
        List<T> swapped = new ArrayList<>(attempt);
        Collections.swap(swapped, j - 1, j);
        if (consider(swapped)) attempt = swapped;
        j--;
      }
    }
  }
}
