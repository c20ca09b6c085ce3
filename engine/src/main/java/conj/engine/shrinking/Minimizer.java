package conj.engine.shrinking;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;
import java.util.function.IntPredicate;
import java.util.function.Predicate;

import conj.engine.Floats;
import conj.engine.Util;

/**
 * Lexicographic minimizer for a fixed size block of bytes. Starting from a block satisfying the condition it makes
 * local changes that keep the condition true and never make the block larger. When run to completion the
 * lexicographic predecessor of the answer does not satisfy the condition, and no single byte of it can be lowered
 * while holding the others fixed.
 */
public class Minimizer {

  /** Minimize to a fixed point */
  public static byte[] minimize(byte[] initial, Predicate<byte[]> condition) { return minimize(initial, condition, true); }

  /** Minimize. Without full mode the main loop runs just once. */
  public static byte[] minimize(byte[] initial, Predicate<byte[]> condition, boolean full) {
    Minimizer minimizer = new Minimizer(initial, condition, full);
    minimizer.run();
    return minimizer.current();
  }

  private final int size;
  private final Predicate<byte[]> condition;
  private final boolean full;
  private final Set<ByteBuffer> seen = new HashSet<>();
  private byte[] current;
  private int changes;

  public Minimizer(byte[] initial, Predicate<byte[]> condition, boolean full) {
    this.current = initial.clone();
    this.size = current.length;
    this.condition = condition;
    this.full = full;
  }

  public byte[] current() { return current.clone(); }

  public int changes() { return changes; }

  /** Try the buffer as a replacement for the current one */
  public boolean incorporate(byte[] buffer) {
    if (buffer.length != size) throw new IllegalArgumentException("Expected " + size + " bytes, got " + buffer.length);
    if (Util.compareUnsigned(buffer, current) >= 0) return false;
    if (!seen.add(ByteBuffer.wrap(buffer.clone()))) return false;
    if (condition.test(buffer.clone())) {
      current = buffer.clone();
      changes++;
      return true;
    }
    return false;
  }

  public void run() {
    if (Util.allZero(current)) return;
    if (size == 1) {
      minimizeAsInteger();
      return;
    }
    if (incorporate(new byte[size])) return;
    byte[] one = new byte[size];
    one[size - 1] = 1;
    if (incorporate(one)) return;

    int canZero = 0;
    while (current[canZero] == 0) canZero++;
    byte[] zeroBase = current;
    binarySearch(canZero, size, mid -> {
      byte[] attempt = zeroBase.clone();
      Arrays.fill(attempt, 0, mid, (byte) 0);
      return Arrays.equals(attempt, current) || incorporate(attempt);
    });

    byte[] shiftBase = current;
    binarySearch(0, size, mid -> {
      if (mid == 0) return true;
      if (mid == size) return false;
      byte[] attempt = new byte[size];
      System.arraycopy(shiftBase, 0, attempt, mid, size - mid);
      return incorporate(attempt);
    });

    int changeCounter = -1;
    boolean first = true;
    while ((first || full) && changeCounter < changes) {
      first = false;
      changeCounter = changes;
      sort();
      floatHack();
      shift();
      shrinkIndices();
      rotateSuffixes();
      minimizeAsInteger();
      partialSort();
    }
  }

  /** Shift each byte right as far as it will go */
  private void shift() {
    int prev = -1;
    while (prev != changes) {
      prev = changes;
      for (int i = 0; i < size; i++) {
        byte[] block = current.clone();
        int c = block[i] & 0xFF;
        for (int k = 32 - Integer.numberOfLeadingZeros(c); k > 0; k--) {
          block[i] = (byte) (c >> k);
          if (incorporate(block)) break;
        }
      }
    }
  }

  private void rotateSuffixes() {
    int significant = 0;
    while (significant < size && current[significant] == 0) significant++;
    if (significant == size) return;
    for (int i = 1; i < size - significant; i++) {
      byte[] rotated = new byte[size];
      int leftLength = i;
      int rightLength = size - significant - i;
      System.arraycopy(current, significant + i, rotated, significant, rightLength);
      System.arraycopy(current, significant, rotated, significant + rightLength, leftLength);
      incorporate(rotated);
    }
  }

  private void shrinkIndices() {
    for (int i = 0; i < size; i++) {
      int index = i;
      minimizeInt(BigInteger.valueOf(current[i] & 0xFF), c -> {
        if ((current[index] & 0xFF) == c.intValue()) return true;
        byte[] attempt = current.clone();
        attempt[index] = (byte) c.intValue();
        return incorporate(attempt);
      });
    }
  }

  private boolean incorporateInt(BigInteger i) { return incorporate(Util.bigIntegerToBytes(i, size)); }

  private BigInteger currentInt() { return Util.bytesToBigInteger(current); }

  /**
   * An eight byte block with the top bit set may be an encoded float. Shrinks that are natural for floats are tried,
   * which are valid whether or not it really is one.
   */
  private void floatHack() {
    if (size != 8 || (current[0] & 0x80) == 0) return;
    long i = Util.bytesToLong(current);
    double f = Floats.lexToFloat(i);
    if (Floats.isSimple(f)) {
      incorporateFloat(f);
      return;
    }
    for (double g : new double[] { Double.NaN, Double.POSITIVE_INFINITY, Double.MAX_VALUE }) {
      long j = Floats.floatToLex(g);
      if (Long.compareUnsigned(j, i) < 0 && incorporateFloat(g)) {
        f = g;
        i = j;
      }
    }
    if (Double.isInfinite(f) || Double.isNaN(f)) return;
    for (double g : new double[] { Math.floor(f), Math.ceil(f) }) {
      if (incorporateFloat(g)) return;
    }
    if (f > 2) incorporateFloat(f - 1);
  }

  private boolean incorporateFloat(double f) { return incorporate(Util.longToBytes(Floats.floatToLex(f), 8)); }

  private void minimizeAsInteger() {
    minimizeInt(currentInt(), c -> c.equals(currentInt()) || incorporateInt(c));
  }

  private void sort() {
    byte[] sorted = new byte[size];
    int[] unsigned = new int[size];
    for (int i = 0; i < size; i++) unsigned[i] = current[i] & 0xFF;
    Arrays.sort(unsigned);
    for (int i = 0; i < size; i++) sorted[i] = (byte) unsigned[i];
    incorporate(sorted);
  }

  private void partialSort() {
    byte[] ps = current.clone();
    for (int i = 0; i < size - 1; i++) {
      int j = i + 1;
      while (j > 0 && (ps[j - 1] & 0xFF) > (ps[j] & 0xFF)) {
        byte[] swapped = ps.clone();
        swapped[j] = ps[j - 1];
        swapped[j - 1] = ps[j];
        if (incorporate(swapped)) ps = swapped;
        j--;
      }
    }
  }

  /** Find where f changes value between lo and hi, assuming it is monotonic. Used for its side effects. */
  static void binarySearch(int lo, int hi, IntPredicate f) {
    boolean loVal = f.test(lo);
    boolean hiVal = f.test(hi);
    if (loVal == hiVal) return;
    while (lo + 1 < hi) {
      int mid = (lo + hi) >>> 1;
      if (f.test(mid) == loVal) lo = mid;
      else hi = mid;
    }
  }

  /** Find the smallest value for which f is true, starting from c, where f(c) is true */
  static BigInteger minimizeInt(BigInteger c, Predicate<BigInteger> f) {
    BigInteger two = BigInteger.valueOf(2);
    if (c.signum() == 0) return c;
    if (f.test(BigInteger.ZERO)) return BigInteger.ZERO;
    if (c.equals(BigInteger.ONE) || f.test(BigInteger.ONE)) return BigInteger.ONE;
    if (c.equals(two)) return two;
    BigInteger hi;
    if (f.test(c.subtract(BigInteger.ONE))) hi = c.subtract(BigInteger.ONE);
    else if (f.test(c.subtract(two))) hi = c.subtract(two);
    else return c;
    BigInteger lo = BigInteger.ONE;
    while (lo.add(BigInteger.ONE).compareTo(hi) < 0) {
      BigInteger mid = lo.add(hi).shiftRight(1);
      if (f.test(mid)) hi = mid;
      else lo = mid;
    }
    return hi;
  }
}
