package conj.engine.dfa;

import java.math.BigInteger;

/** The language of a DFA as a random access collection in shortlex order. Works for infinite languages too. */
public class DFAIndex {
  private final DFA dfa;
  private BigInteger length;

  public DFAIndex(DFA dfa) { this.dfa = dfa; }

  public boolean isInfinite() { return dfa.maxLength(dfa.start()) == DFA.INFINITE; }

  /** Number of strings in the language. Fails for an infinite language. */
  public BigInteger length() {
    if (isInfinite()) throw new IllegalStateException("Language is infinite");
    if (length == null) {
      BigInteger total = BigInteger.ZERO;
      int max = dfa.maxLength(dfa.start());
      for (int k = 0; k <= max; k++) total = total.add(dfa.countStrings(dfa.start(), k));
      length = total;
    }
    return length;
  }

  /** The string at the given rank */
  public byte[] get(BigInteger rank) {
    if (rank.signum() < 0) throw new IndexOutOfBoundsException("Negative index " + rank);
    BigInteger running = rank;
    int max = dfa.maxLength(dfa.start());
    int size = 0;
    while (true) {
      BigInteger n = dfa.countStrings(dfa.start(), size);
      if (n.compareTo(running) > 0) break;
      running = running.subtract(n);
      size++;
      if (size > max) throw new IndexOutOfBoundsException("Index " + rank + " out of range [0, " + length() + ")");
    }
    byte[] result = new byte[size];
    int state = dfa.start();
    for (int i = 0; i < size; i++) {
      boolean found = false;
      for (int[] t : dfa.transitions(state)) {
        BigInteger skip = dfa.countStrings(t[1], size - i - 1);
        if (running.compareTo(skip) < 0) {
          result[i] = (byte) t[0];
          state = t[1];
          found = true;
          break;
        }
        running = running.subtract(skip);
      }
      if (!found) throw new IllegalStateException("Count mismatch at index " + i);
    }
    return result;
  }

  public byte[] get(long rank) { return get(BigInteger.valueOf(rank)); }

  /** The rank of the string, the inverse of {@link #get(BigInteger)} */
  public BigInteger index(byte[] string) {
    if (!dfa.matches(string)) throw new IllegalArgumentException("String is not in the language");
    BigInteger result = BigInteger.ZERO;
    for (int k = 0; k < string.length; k++) result = result.add(dfa.countStrings(dfa.start(), k));
    int state = dfa.start();
    for (int i = 0; i < string.length; i++) {
      int remainder = string.length - i - 1;
      int c = string[i] & 0xFF;
      for (int d = 0; d < c; d++) result = result.add(dfa.countStrings(dfa.transition(state, d), remainder));
      state = dfa.transition(state, c);
    }
    return result;
  }
}
