package conj.engine;

/**
 * Lexicographic encoding of non-negative doubles into unsigned 64-bit integers. Small integral values encode as
 * themselves. Everything else has the top bit set, a permuted exponent so that larger exponents (and then smaller
 * negative exponents) come later, and the fractional mantissa bits reversed so that simpler fractions come first.
 * The sign is not part of the encoding and is drawn as a separate bit.
 */
public class Floats {
  private Floats() { }

  public static final int MAX_EXPONENT = 0x7FF;
  public static final int BIAS = 1023;
  public static final long MANTISSA_MASK = (1L << 52) - 1;
  /** Largest integral float encoded in simple form is below this */
  public static final double MAX_SIMPLE = 0x1p56;

  private static final int[] ENCODING_TABLE = new int[MAX_EXPONENT + 1];
  private static final int[] DECODING_TABLE = new int[MAX_EXPONENT + 1];

  static {
    int i = 0;
    for (int e = BIAS; e < MAX_EXPONENT; e++) ENCODING_TABLE[i++] = e;
    for (int e = BIAS - 1; e >= 0; e--) ENCODING_TABLE[i++] = e;
    ENCODING_TABLE[i] = MAX_EXPONENT;
    for (int j = 0; j < ENCODING_TABLE.length; j++) DECODING_TABLE[ENCODING_TABLE[j]] = j;
  }

  static int decodeExponent(int e) { return ENCODING_TABLE[e]; }

  static int encodeExponent(int e) { return DECODING_TABLE[e]; }

  static long reverseBits(long x, int n) {
    if (n == 0) return 0;
    return Long.reverse(x) >>> (64 - n);
  }

  static long updateMantissa(int unbiasedExponent, long mantissa) {
    if (unbiasedExponent <= 0) return reverseBits(mantissa, 52);
    if (unbiasedExponent <= 51) {
      int fractionalBits = 52 - unbiasedExponent;
      long fractionalPart = mantissa & ((1L << fractionalBits) - 1);
      mantissa ^= fractionalPart;
      mantissa |= reverseBits(fractionalPart, fractionalBits);
    }
    return mantissa;
  }

  /** Integral, finite and small enough to be encoded directly */
  public static boolean isSimple(double f) {
    if (Double.isNaN(f) || Double.isInfinite(f)) return false;
    if (Math.rint(f) != f) return false;
    return Math.abs(f) < MAX_SIMPLE;
  }

  /** Decode an unsigned 64-bit lex value */
  public static double lexToFloat(long i) {
    if ((i >>> 63) != 0) {
      int exponent = decodeExponent((int) ((i >>> 52) & MAX_EXPONENT));
      long mantissa = updateMantissa(exponent - BIAS, i & MANTISSA_MASK);
      return Double.longBitsToDouble(((long) exponent << 52) | mantissa);
    }
    return (double) (i & ((1L << 56) - 1));
  }

  /** Encode the magnitude of f. The sign bit is ignored. */
  public static long floatToLex(double f) {
    if (isSimple(f)) return (long) Math.abs(f);
    return baseFloatToLex(f);
  }

  static long baseFloatToLex(double f) {
    long i = Double.doubleToRawLongBits(canonicalize(f)) & Long.MAX_VALUE;
    int exponent = (int) (i >>> 52);
    long mantissa = updateMantissa(exponent - BIAS, i & MANTISSA_MASK);
    return (1L << 63) | ((long) encodeExponent(exponent) << 52) | mantissa;
  }

  /** Every NaN maps to {@link Double#NaN} */
  public static double canonicalize(double f) { return Double.isNaN(f) ? Double.NaN : f; }

  /** Compare two lex encodings as unsigned */
  public static int compareLex(long left, long right) { return Long.compareUnsigned(left, right); }

  /** True if left has a strictly simpler encoding than right */
  public static boolean lexLess(double left, double right) {
    return compareLex(floatToLex(left), floatToLex(right)) < 0;
  }
}
