package conj.engine;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.function.IntPredicate;

/** Utility functions */
public class Util {
  private Util() { }

  /** Shortlex order over byte tapes: shorter first, then unsigned byte-wise */
  public static final Comparator<byte[]> SORT_KEY = Util::compareSortKey;

  /** Compare two tapes by length, then unsigned lexicographically */
  public static int compareSortKey(byte[] left, byte[] right) {
    if (left.length != right.length) return Integer.compare(left.length, right.length);
    return compareUnsigned(left, right);
  }

  /** Unsigned lexicographic compare, shorter prefix is smaller */
  public static int compareUnsigned(byte[] left, byte[] right) {
    int len = Math.min(left.length, right.length);
    for (int i = 0; i < len; i++) {
      int cmp = Integer.compare(left[i] & 0xFF, right[i] & 0xFF);
      if (cmp != 0) return cmp;
    }
    return Integer.compare(left.length, right.length);
  }

  /** True if left is strictly simpler than right under the sort key */
  public static boolean sortKeyLess(byte[] left, byte[] right) { return compareSortKey(left, right) < 0; }

  /** Big-endian unsigned value of up to 8 bytes */
  public static long bytesToLong(byte[] bytes) { return bytesToLong(bytes, 0, bytes.length); }

  /** Big-endian unsigned value of the given range, which must be at most 8 bytes long */
  public static long bytesToLong(byte[] bytes, int start, int end) {
    if (end - start > 8) throw new IllegalArgumentException("Too many bytes for long: " + (end - start));
    long result = 0;
    for (int i = start; i < end; i++) result = (result << 8) | (bytes[i] & 0xFF);
    return result;
  }

  /** Big-endian encoding of the low size bytes of value */
  public static byte[] longToBytes(long value, int size) {
    byte[] result = new byte[size];
    for (int i = size - 1; i >= 0 && i >= size - 8; i--) {
      result[i] = (byte) value;
      value >>>= 8;
    }
    return result;
  }

  public static BigInteger bytesToBigInteger(byte[] bytes) { return new BigInteger(1, bytes); }

  /** Big-endian fixed-size encoding. Value must be non-negative and fit in size bytes. */
  public static byte[] bigIntegerToBytes(BigInteger value, int size) {
    if (value.signum() < 0 || value.bitLength() > size * 8)
      throw new IllegalArgumentException("Value " + value + " does not fit in " + size + " bytes");
    byte[] raw = value.toByteArray();
    byte[] result = new byte[size];
    int copy = Math.min(raw.length, size);
    System.arraycopy(raw, raw.length - copy, result, size - copy, copy);
    return result;
  }

  /**
   * Find a large n such that f(n) is true and f(n + 1) is false, assuming f(0) is true. Probes small values first,
   * then doubles, then binary searches between the last success and first failure.
   */
  public static int findInteger(IntPredicate f) {
    for (int i = 1; i < 5; i++) {
      if (!f.test(i)) return i - 1;
    }
    int lo = 4;
    int hi = 5;
    while (f.test(hi)) {
      lo = hi;
      hi *= 2;
    }
    while (lo + 1 < hi) {
      int mid = (lo + hi) >>> 1;
      if (f.test(mid)) lo = mid;
      else hi = mid;
    }
    return lo;
  }

  /** Copy of the buffer with [start, end) removed */
  public static byte[] withRemoved(byte[] buffer, int start, int end) {
    byte[] result = new byte[buffer.length - (end - start)];
    System.arraycopy(buffer, 0, result, 0, start);
    System.arraycopy(buffer, end, result, start, buffer.length - end);
    return result;
  }

  /** Concatenate the given arrays */
  public static byte[] concat(byte[]... parts) {
    int len = 0;
    for (byte[] part : parts) len += part.length;
    byte[] result = new byte[len];
    int index = 0;
    for (byte[] part : parts) {
      System.arraycopy(part, 0, result, index, part.length);
      index += part.length;
    }
    return result;
  }

  public static boolean startsWith(byte[] bytes, byte[] prefix) {
    if (prefix.length > bytes.length) return false;
    for (int i = 0; i < prefix.length; i++) if (bytes[i] != prefix[i]) return false;
    return true;
  }

  public static boolean allZero(byte[] bytes) { return allZero(bytes, 0, bytes.length); }

  public static boolean allZero(byte[] bytes, int start, int end) {
    for (int i = start; i < end; i++) if (bytes[i] != 0) return false;
    return true;
  }

  /** Longest suffix of the bytes that starts with a non-zero byte */
  public static byte[] nonZeroSuffix(byte[] bytes) {
    int i = 0;
    while (i < bytes.length && bytes[i] == 0) i++;
    return Arrays.copyOfRange(bytes, i, bytes.length);
  }

  /** A simple mask is 2^n - 1, keeping the low n bits */
  public static boolean isSimpleMask(int mask) { return (mask & (mask + 1)) == 0; }

  /** Stable 64-bit label for a name, taken from the head of its MD5 digest */
  public static long labelFor(String name) {
    try {
      byte[] digest = MessageDigest.getInstance("MD5").digest(name.getBytes(StandardCharsets.UTF_8));
      return bytesToLong(digest, 0, 8);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException(e);
    }
  }

  /** N uniformly random bytes */
  public static byte[] uniform(Random random, int n) {
    byte[] result = new byte[n];
    random.nextBytes(result);
    return result;
  }

  /** Random bytes that are lexicographically no larger than the given ones */
  public static byte[] drawPredecessor(Random random, byte[] bytes) {
    byte[] result = new byte[bytes.length];
    boolean anyStrict = false;
    for (int i = 0; i < bytes.length; i++) {
      int x = bytes[i] & 0xFF;
      int c;
      if (!anyStrict) {
        c = random.nextInt(x + 1);
        if (c < x) anyStrict = true;
      } else c = random.nextInt(256);
      result[i] = (byte) c;
    }
    return result;
  }

  /** Random bytes that are lexicographically no smaller than the given ones */
  public static byte[] drawSuccessor(Random random, byte[] bytes) {
    byte[] result = new byte[bytes.length];
    boolean anyStrict = false;
    for (int i = 0; i < bytes.length; i++) {
      int x = bytes[i] & 0xFF;
      int c;
      if (!anyStrict) {
        c = x + random.nextInt(256 - x);
        if (c > x) anyStrict = true;
      } else c = random.nextInt(256);
      result[i] = (byte) c;
    }
    return result;
  }

  /** Remove a random element by swapping it to the end. Changes ordering. */
  public static <T> T popRandom(Random random, List<T> values) {
    int i = random.nextInt(values.size());
    int last = values.size() - 1;
    T result = values.get(i);
    values.set(i, values.get(last));
    values.remove(last);
    return result;
  }

  /** Fisher-Yates over a byte array */
  public static void shuffle(Random random, byte[] bytes) {
    for (int i = bytes.length - 1; i > 0; i--) {
      int j = random.nextInt(i + 1);
      byte tmp = bytes[i];
      bytes[i] = bytes[j];
      bytes[j] = tmp;
    }
  }

  /** Hex dump for debug output */
  public static String hex(byte[] bytes) {
    StringBuilder sb = new StringBuilder(bytes.length * 2);
    for (byte b : bytes) sb.append(Character.forDigit((b >> 4) & 0xF, 16)).append(Character.forDigit(b & 0xF, 16));
    return sb.toString();
  }
}
