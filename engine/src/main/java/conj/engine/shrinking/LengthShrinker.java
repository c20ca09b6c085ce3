package conj.engine.shrinking;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.function.Predicate;

import conj.engine.Util;

/**
 * Deletes elements from a sequence while the predicate holds. Elements are visited in random order, and from each
 * one a run of following elements is deleted, growing by doubling and then binary search. An element that can not be
 * deleted on its own is required and is not tried again.
 *
 * @param <T> the element type
 */
public class LengthShrinker<T> extends ValueShrinker<List<LengthShrinker.Element<T>>> {

  /** Wrapper giving each original element an identity, so equal values at different positions stay distinct */
  public static final class Element<T> {
    final int id;
    final T value;

    Element(int id, T value) {
      this.id = id;
      this.value = value;
    }
  }

  private final Set<Integer> required = new HashSet<>();

  /** Shrink the list to a fixed point and return the smallest found */
  public static <T> List<T> shrink(List<T> initial, Predicate<List<T>> predicate, Random random) {
    return shrink(initial, predicate, random, true);
  }

  public static <T> List<T> shrink(List<T> initial, Predicate<List<T>> predicate, Random random, boolean full) {
    List<Element<T>> elements = new ArrayList<>(initial.size());
    for (int i = 0; i < initial.size(); i++) elements.add(new Element<>(i, initial.get(i)));
    LengthShrinker<T> shrinker = new LengthShrinker<>(elements, ls -> predicate.test(values(ls)), random, full);
    shrinker.run();
    return values(shrinker.current());
  }

  private static <T> List<T> values(List<Element<T>> elements) {
    List<T> result = new ArrayList<>(elements.size());
    for (Element<T> element : elements) result.add(element.value);
    return result;
  }

  private LengthShrinker(List<Element<T>> initial, Predicate<List<Element<T>>> predicate, Random random,
      boolean full) {
    super(Collections.unmodifiableList(initial), predicate, random, full);
  }

  @Override
  protected Object seenKey(List<Element<T>> value) {
    List<Integer> ids = new ArrayList<>(value.size());
    for (Element<T> element : value) ids.add(element.id);
    return ids;
  }

  @Override
  protected boolean shortCircuit() { return consider(Collections.emptyList()) || current.size() <= 1; }

  @Override
  protected boolean leftIsBetter(List<Element<T>> left, List<Element<T>> right) { return left.size() < right.size(); }

  @Override
  protected void runStep() {
    List<Element<T>> order = new ArrayList<>(current);
    Collections.shuffle(order, random);
    for (Element<T> element : order) {
      if (required.contains(element.id)) continue;
      List<Element<T>> base = current;
      int start = base.indexOf(element);
      if (start < 0) continue;
      int deleted = Util.findInteger(k -> {
        if (start + k > base.size()) return false;
        List<Element<T>> attempt = new ArrayList<>(base.subList(0, start));
        attempt.addAll(base.subList(start + k, base.size()));
        return consider(Collections.unmodifiableList(attempt));
      });
      if (deleted == 0) required.add(element.id);
    }
  }
}
