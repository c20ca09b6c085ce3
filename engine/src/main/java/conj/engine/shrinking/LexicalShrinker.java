package conj.engine.shrinking;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.function.Predicate;

import conj.engine.Floats;
import conj.engine.Util;

/** Shrinks a fixed size block of bytes towards the lexicographically smallest */
public class LexicalShrinker extends ValueShrinker<byte[]> {

  public static byte[] shrink(byte[] initial, Predicate<byte[]> predicate, Random random, boolean full) {
    LexicalShrinker shrinker = new LexicalShrinker(initial, predicate, random, full);
    shrinker.run();
    return shrinker.current();
  }

  public LexicalShrinker(byte[] initial, Predicate<byte[]> predicate, Random random, boolean full) {
    super(initial.clone(), predicate, random, full);
  }

  private int size() { return current.length; }

  @Override
  protected Object seenKey(byte[] value) { return ByteBuffer.wrap(value); }

  @Override
  protected void checkInvariants(byte[] value) {
    if (value.length != size())
      throw new IllegalArgumentException("Expected " + size() + " bytes, got " + value.length);
  }

  @Override
  protected boolean leftIsBetter(byte[] left, byte[] right) { return Util.compareUnsigned(left, right) < 0; }

  @Override
  protected boolean shortCircuit() { return false; }

  @Override
  protected void runStep() {
    floatHack();
    minimizeAsInteger();
    partialSort();
  }

  private BigInteger currentInt() { return Util.bytesToBigInteger(current); }

  private boolean incorporateInt(BigInteger i) { return incorporate(Util.bigIntegerToBytes(i, size())); }

  /**
   * An eight byte block with the top bit set may be an encoded float. Shrinks that are natural for the float are
   * tried, and they are valid whether or not it really is one.
   */
  private void floatHack() {
    if (size() != 8 || (current[0] & 0x80) == 0) return;
    double f = Floats.lexToFloat(Util.bytesToLong(current));
    if (Floats.isSimple(f)) {
      incorporate(Util.longToBytes(Floats.floatToLex(f), 8));
      return;
    }
    FloatShrinker.shrink(f, g -> {
      if (Double.doubleToRawLongBits(g) < 0) return false;
      byte[] attempt = Util.longToBytes(Floats.floatToLex(g), 8);
      return Util.compareUnsigned(attempt, current) == 0 || incorporate(attempt);
    }, random, false);
  }

  private void minimizeAsInteger() {
    IntegerShrinker.shrink(currentInt(), c -> c.equals(currentInt()) || incorporateInt(c), random, full);
  }

  private void partialSort() {
    List<Integer> bytes = new ArrayList<>(size());
    for (byte b : current) bytes.add(b & 0xFF);
    OrderingShrinker.shrink(bytes, ls -> {
      byte[] attempt = new byte[ls.size()];
      for (int i = 0; i < attempt.length; i++) attempt[i] = (byte) (int) ls.get(i);
      return consider(attempt);
    }, Integer::compare, random);
  }
}
