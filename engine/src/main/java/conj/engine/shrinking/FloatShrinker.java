package conj.engine.shrinking;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Random;
import java.util.function.Predicate;

import conj.engine.Floats;

/**
 * Shrinks a double towards the simplest value under the lexicographic float encoding. Positive values are simpler
 * than their negations.
 */
public class FloatShrinker extends ValueShrinker<Double> {
  /** Every double at or above this is an integer */
  public static final double MAX_PRECISE_INTEGER = 0x1p53;

  public static double shrink(double initial, Predicate<Double> predicate, Random random, boolean full) {
    FloatShrinker shrinker = new FloatShrinker(initial, predicate, random, full);
    shrinker.run();
    return shrinker.current();
  }

  public FloatShrinker(double initial, Predicate<Double> predicate, Random random, boolean full) {
    super(Floats.canonicalize(initial), predicate, random, full);
  }

  @Override
  public boolean incorporate(Double value) { return super.incorporate(Floats.canonicalize(value)); }

  @Override
  protected boolean leftIsBetter(Double left, Double right) {
    int cmp = Floats.compareLex(Floats.floatToLex(left), Floats.floatToLex(right));
    if (cmp != 0) return cmp < 0;
    return isNegative(right) && !isNegative(left);
  }

  private static boolean isNegative(double f) { return Double.doubleToRawLongBits(f) < 0; }

  @Override
  protected boolean shortCircuit() {
    for (double g : new double[] { Double.MAX_VALUE, Double.POSITIVE_INFINITY, Double.NaN }) consider(g);
    return Double.isInfinite(current) || Double.isNaN(current);
  }

  @Override
  protected void runStep() {
    if (isNegative(current)) consider(-current);
    double value = current;
    double magnitude = Math.abs(value);
    double sign = isNegative(value) ? -1 : 1;
    if (magnitude >= MAX_PRECISE_INTEGER) {
      IntegerShrinker.shrink(new BigDecimal(magnitude).toBigInteger(),
          i -> consider(sign * i.doubleValue()), random, false);
      return;
    }
    // Small changes to the value that are large lexical changes
    for (int p = 0; p < 10; p++) {
      double scale = Math.scalb(1.0, p);
      double scaled = value * scale;
      consider(Math.floor(scaled) / scale);
      consider(Math.ceil(scaled) / scale);
    }
    double currentSign = isNegative(current) ? -1 : 1;
    if (consider((double) (long) current.doubleValue())) {
      // Just an integer now
      IntegerShrinker.shrink(BigInteger.valueOf((long) Math.abs(current)),
          i -> consider(currentSign * i.doubleValue()), random, false);
      return;
    }
    magnitude = Math.abs(current);
    double whole = Math.floor(magnitude);
    double fraction = magnitude - whole;
    IntegerShrinker.shrink(BigInteger.valueOf((long) whole),
        i -> consider(currentSign * (i.doubleValue() + fraction)), random, false);
  }
}
