package conj.engine.shrinking;

import java.math.BigInteger;
import java.util.Random;
import java.util.function.Predicate;

import conj.engine.Util;

/** Shrinks a non-negative integer towards zero */
public class IntegerShrinker extends ValueShrinker<BigInteger> {

  public static BigInteger shrink(BigInteger initial, Predicate<BigInteger> predicate, Random random, boolean full) {
    IntegerShrinker shrinker = new IntegerShrinker(initial, predicate, random, full);
    shrinker.run();
    return shrinker.current();
  }

  public static long shrink(long initial, Predicate<Long> predicate, Random random) {
    return shrink(BigInteger.valueOf(initial), v -> predicate.test(v.longValueExact()), random, false).longValueExact();
  }

  public IntegerShrinker(BigInteger initial, Predicate<BigInteger> predicate, Random random, boolean full) {
    super(initial, predicate, random, full);
    checkInvariants(initial);
  }

  @Override
  protected void checkInvariants(BigInteger value) {
    if (value.signum() < 0) throw new IllegalArgumentException("Negative value " + value);
  }

  @Override
  protected boolean leftIsBetter(BigInteger left, BigInteger right) { return left.compareTo(right) < 0; }

  @Override
  protected boolean shortCircuit() {
    for (int i = 0; i < 2; i++) {
      if (consider(BigInteger.valueOf(i))) return true;
    }
    maskHighBits();
    if (current.bitLength() > 8) {
      consider(current.shiftRight(current.bitLength() - 8));
      consider(current.and(BigInteger.valueOf(0xFF)));
    }
    return current.equals(BigInteger.valueOf(2));
  }

  @Override
  protected void runStep() {
    shiftRight();
    shrinkByMultiples(2);
    shrinkByMultiples(1);
  }

  private void shiftRight() {
    BigInteger base = current;
    int size = base.bitLength();
    Util.findInteger(k -> k <= size && consider(base.shiftRight(k)));
  }

  private void maskHighBits() {
    BigInteger base = current;
    int n = base.bitLength();
    Util.findInteger(k -> {
      if (k >= n) return false;
      BigInteger mask = BigInteger.ONE.shiftLeft(n - k).subtract(BigInteger.ONE);
      return consider(base.and(mask));
    });
  }

  private void shrinkByMultiples(int k) {
    BigInteger base = current;
    BigInteger step = BigInteger.valueOf(k);
    Util.findInteger(n -> {
      BigInteger attempt = base.subtract(step.multiply(BigInteger.valueOf(n)));
      return attempt.signum() >= 0 && consider(attempt);
    });
  }
}
