package conj.engine.shrinking;

import java.util.HashSet;
import java.util.Objects;
import java.util.Random;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Base for shrinkers that improve a single value while a predicate holds. Subclasses define what "better" means
 * and the steps that propose candidates. Every candidate is checked at most once.
 *
 * @param <T> the value type
 */
public abstract class ValueShrinker<T> {
  protected final Random random;
  /** Whether {@link #run()} loops to a fixed point or runs a single step */
  protected final boolean full;
  private final Predicate<T> predicate;
  private final Set<Object> seen = new HashSet<>();
  protected T current;
  private int changes;

  protected ValueShrinker(T initial, Predicate<T> predicate, Random random, boolean full) {
    this.current = Objects.requireNonNull(initial);
    this.predicate = Objects.requireNonNull(predicate);
    this.random = random;
    this.full = full;
  }

  public T current() { return current; }

  /** Number of successful replacements so far */
  public int changes() { return changes; }

  /** Improve the value, stopping after one step unless in full mode */
  public void run() {
    if (shortCircuit()) return;
    if (full) {
      int prev = -1;
      while (changes != prev) {
        prev = changes;
        runStep();
      }
    } else runStep();
  }

  /** Try the value as a replacement. True if it was better than current and satisfied the predicate. */
  public boolean incorporate(T value) {
    checkInvariants(value);
    if (!leftIsBetter(value, current)) return false;
    if (!seen.add(seenKey(value))) return false;
    if (predicate.test(value)) {
      changes++;
      current = value;
      return true;
    }
    return false;
  }

  /** True if the value is already current or was incorporated */
  public boolean consider(T value) {
    if (seenKey(value).equals(seenKey(current))) return true;
    return incorporate(value);
  }

  /** Key the value is remembered and compared by. Must have value equality. */
  protected Object seenKey(T value) { return value; }

  /** Fail for values this shrinker can not handle */
  protected void checkInvariants(T value) { }

  /** Try cheap wins. Returning true ends the run. */
  protected abstract boolean shortCircuit();

  /** True if left is strictly simpler than right */
  protected abstract boolean leftIsBetter(T left, T right);

  protected abstract void runStep();
}
