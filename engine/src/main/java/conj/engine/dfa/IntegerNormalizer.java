package conj.engine.dfa;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.function.IntPredicate;

import conj.engine.Util;

/**
 * Maps non-negative integers to a canonical value believed equivalent for all relevant purposes. Each value is
 * treated as the largest canonical value at or below it.
 */
public class IntegerNormalizer {
  private final TreeSet<Integer> values = new TreeSet<>();

  public IntegerNormalizer() { values.add(0); }

  public int normalize(int value) {
    if (value < 0) throw new IllegalArgumentException("Negative value " + value);
    return values.floor(value);
  }

  /**
   * Check whether the test agrees on the value and its canonical form. If not, add a new canonical value between them
   * that the test treats like the value. Returns true if the canonical values changed.
   */
  public boolean distinguish(int value, IntPredicate test) {
    int canonical = normalize(value);
    if (canonical == value) return false;
    boolean valueTest = test.test(value);
    if (test.test(canonical) == valueTest) return false;
    int newCanon = value - Util.findInteger(k -> {
      int candidate = value - k;
      return candidate > canonical && test.test(candidate) == valueTest;
    });
    values.add(newCanon);
    return true;
  }

  /** The canonical values in ascending order */
  public List<Integer> values() { return new ArrayList<>(values); }

  @Override
  public String toString() { return "IntegerNormalizer(" + values + ")"; }
}
