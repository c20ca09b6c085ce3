package conj.engine.dfa;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;

/** A DFA with an explicit table of states. Missing transitions go to {@link #DEAD}. */
public class ConcreteDFA extends DFA {
  /** The implicit state that accepts nothing */
  public static final int DEAD = -1;

  /** Create a {@link Builder} for easy building */
  public static Builder builder() { return new Builder(); }

  private final int[][] table;
  private final BitSet accepting;
  private final int start;

  public ConcreteDFA(int[][] table, BitSet accepting, int start) {
    this.table = new int[table.length][];
    for (int i = 0; i < table.length; i++) {
      if (table[i].length != ALPHABET_SIZE)
        throw new IllegalArgumentException("State " + i + " has " + table[i].length + " transitions");
      this.table[i] = table[i].clone();
    }
    this.accepting = (BitSet) accepting.clone();
    if (start < 0 || start >= table.length) throw new IllegalArgumentException("Invalid start state " + start);
    this.start = start;
  }

  public int stateCount() { return table.length; }

  @Override
  public int start() { return start; }

  @Override
  public boolean isAccepting(int state) { return state != DEAD && accepting.get(state); }

  @Override
  public int transition(int state, int c) {
    if (state == DEAD) return DEAD;
    return table[state][c];
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    ConcreteDFA other = (ConcreteDFA) o;
    return start == other.start && accepting.equals(other.accepting) && Arrays.deepEquals(table, other.table);
  }

  @Override
  public int hashCode() { return 31 * (31 * start + accepting.hashCode()) + Arrays.deepHashCode(table); }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("ConcreteDFA(start=").append(start).append(", accepting=").append(accepting);
    for (int i = 0; i < table.length; i++) {
      sb.append(", ").append(i).append(": [");
      boolean first = true;
      int c = 0;
      while (c < ALPHABET_SIZE) {
        int target = table[i][c];
        int end = c;
        while (end + 1 < ALPHABET_SIZE && table[i][end + 1] == target) end++;
        if (target != DEAD) {
          if (!first) sb.append(", ");
          sb.append(c == end ? String.valueOf(c) : c + "-" + end).append("->").append(target);
          first = false;
        }
        c = end + 1;
      }
      sb.append(']');
    }
    return sb.append(')').toString();
  }

  /** Builds a {@link ConcreteDFA} from states and byte range transitions */
  public static class Builder {
    private final List<int[]> table = new ArrayList<>();
    private final BitSet accepting = new BitSet();
    private int start;

    /** Add a state with no transitions and return its number */
    public int addState(boolean accepting) {
      int[] row = new int[ALPHABET_SIZE];
      Arrays.fill(row, DEAD);
      table.add(row);
      if (accepting) this.accepting.set(table.size() - 1);
      return table.size() - 1;
    }

    /** See {@link #transition(int, int, int, int)} */
    public Builder transition(int from, int c, int to) { return transition(from, c, c, to); }

    /** Go from one state to another on any byte in [lo, hi] */
    public Builder transition(int from, int lo, int hi, int to) {
      if (lo < 0 || hi >= ALPHABET_SIZE || lo > hi) throw new IllegalArgumentException("Invalid range " + lo + "-" + hi);
      if (to < 0 || to >= table.size()) throw new IllegalArgumentException("Unknown state " + to);
      Arrays.fill(table.get(from), lo, hi + 1, to);
      return this;
    }

    /** The start state. Default is 0. */
    public Builder start(int start) {
      this.start = start;
      return this;
    }

    public ConcreteDFA build() { return new ConcreteDFA(table.toArray(new int[0][]), accepting, start); }
  }
}
