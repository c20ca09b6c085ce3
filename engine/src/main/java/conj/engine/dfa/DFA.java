package conj.engine.dfa;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * A deterministic finite automaton over bytes with integer states. States may be computed lazily as the automaton is
 * walked, so subclasses only define the start state, acceptance and single transitions. Everything derived from those
 * is cached per instance.
 */
public abstract class DFA {
  /** Max length of an infinite language */
  public static final int INFINITE = Integer.MAX_VALUE;
  public static final int ALPHABET_SIZE = 256;

  private final Map<Integer, Set<Integer>> reachableCache = new HashMap<>();
  private final Map<Integer, Boolean> deadCache = new HashMap<>();
  private final Map<Integer, Integer> maxLengthCache = new HashMap<>();
  private final Map<Long, BigInteger> countCache = new HashMap<>();

  public abstract int start();

  public abstract boolean isAccepting(int state);

  /** The state reached from the given state on reading byte c, 0 to 255 */
  public abstract int transition(int state, int c);

  /** Byte and state pairs leading out of the state, skipping those that lead to dead states */
  public List<int[]> transitions(int state) {
    List<int[]> result = new ArrayList<>();
    for (int c = 0; c < ALPHABET_SIZE; c++) {
      int j = transition(state, c);
      if (!isDead(j)) result.add(new int[] { c, j });
    }
    return result;
  }

  /** True if the automaton accepts the string */
  public boolean matches(byte[] s) {
    int state = start();
    for (byte b : s) state = transition(state, b & 0xFF);
    return isAccepting(state);
  }

  /** Every [start, end) pair for which the substring is accepted */
  public List<int[]> allMatchingRegions(byte[] string) {
    List<int[]> results = new ArrayList<>();
    Deque<Object[]> stack = new ArrayDeque<>();
    List<Integer> all = new ArrayList<>();
    for (int i = 0; i < string.length; i++) all.add(i);
    stack.push(new Object[] { 0, start(), all });
    while (!stack.isEmpty()) {
      Object[] entry = stack.pop();
      int k = (Integer) entry[0];
      int state = (Integer) entry[1];
      @SuppressWarnings("unchecked")
      List<Integer> indices = (List<Integer>) entry[2];
      if (isDead(state)) continue;
      if (isAccepting(state)) for (int i : indices) results.add(new int[] { i, i + k });
      Map<Integer, List<Integer>> nextByState = new LinkedHashMap<>();
      for (int i : indices) {
        if (i + k < string.length) {
          int next = transition(state, string[i + k] & 0xFF);
          nextByState.computeIfAbsent(next, x -> new ArrayList<>()).add(i);
        }
      }
      for (Map.Entry<Integer, List<Integer>> next : nextByState.entrySet()) {
        stack.push(new Object[] { k + 1, next.getKey(), next.getValue() });
      }
    }
    return results;
  }

  /** Every state reachable from the state by a non-empty string */
  public Set<Integer> reachable(int state) {
    Set<Integer> cached = reachableCache.get(state);
    if (cached != null) return cached;
    Set<Integer> reached = new HashSet<>();
    Deque<Integer> queue = new ArrayDeque<>();
    queue.add(state);
    while (!queue.isEmpty()) {
      int j = queue.poll();
      for (int c = 0; c < ALPHABET_SIZE; c++) {
        int k = transition(j, c);
        if (reached.add(k) && k != state) queue.add(k);
      }
    }
    Set<Integer> result = Collections.unmodifiableSet(reached);
    reachableCache.put(state, result);
    return result;
  }

  /** True if no string is accepted starting from the state */
  public boolean isDead(int state) {
    Boolean cached = deadCache.get(state);
    if (cached != null) return cached;
    boolean dead = !isAccepting(state);
    if (dead) {
      for (int j : reachable(state)) {
        if (isAccepting(j)) {
          dead = false;
          break;
        }
      }
    }
    deadCache.put(state, dead);
    return dead;
  }

  /** Length of the longest string accepted from the state, or {@link #INFINITE} */
  public int maxLength(int state) {
    Integer cached = maxLengthCache.get(state);
    if (cached != null) return cached;
    int result;
    if (isDead(state)) result = 0;
    else if (reachable(state).contains(state)) result = INFINITE;
    else {
      result = 0;
      for (int[] t : transitions(state)) {
        int next = maxLength(t[1]);
        if (next == INFINITE) {
          result = INFINITE;
          break;
        }
        result = Math.max(result, next + 1);
      }
    }
    maxLengthCache.put(state, result);
    return result;
  }

  /** Number of strings of length k accepted from the state */
  public BigInteger countStrings(int state, int k) {
    if (k < 0) throw new IllegalArgumentException("Negative length " + k);
    long key = ((long) state << 32) | (k & 0xFFFFFFFFL);
    BigInteger cached = countCache.get(key);
    if (cached != null) return cached;
    BigInteger result;
    if (k == 0) result = isAccepting(state) ? BigInteger.ONE : BigInteger.ZERO;
    else if (k > maxLength(state)) result = BigInteger.ZERO;
    else {
      result = BigInteger.ZERO;
      for (int[] t : transitions(state)) result = result.add(countStrings(t[1], k - 1));
    }
    countCache.put(key, result);
    return result;
  }

  /** All accepted strings of length k in ascending lexicographic order */
  public List<byte[]> allMatchingStringsOfLength(int k) {
    List<byte[]> results = new ArrayList<>();
    if (k == 0) {
      if (isAccepting(start())) results.add(new byte[0]);
      return results;
    }
    if (countStrings(start(), k).signum() == 0) return results;
    // A path through the automaton, grown to the first match then moved on to its successor
    int[] path = new int[k];
    int[] states = new int[k + 1];
    states[0] = start();
    int length = 0;
    while (true) {
      while (length < k) {
        boolean extended = false;
        for (int[] t : transitions(states[length])) {
          if (countStrings(t[1], k - length - 1).signum() > 0) {
            path[length] = t[0];
            states[length + 1] = t[1];
            length++;
            extended = true;
            break;
          }
        }
        if (!extended) throw new IllegalStateException("Count mismatch at length " + length);
      }
      byte[] match = new byte[k];
      for (int i = 0; i < k; i++) match[i] = (byte) path[i];
      results.add(match);
      while (true) {
        if (length == 0) return results;
        if (path[length - 1] == 255) length--;
        else {
          path[length - 1]++;
          states[length] = transition(states[length - 1], path[length - 1]);
          if (countStrings(states[length], k - length).signum() > 0) break;
        }
      }
    }
  }

  /** Lazily iterate all accepted strings in shortlex order, which may never end */
  public Iterator<byte[]> allMatchingStrings() {
    int max = maxLength(start());
    return new Iterator<byte[]>() {
      int length = 0;
      Iterator<byte[]> current = Collections.emptyIterator();

      @Override
      public boolean hasNext() {
        while (!current.hasNext()) {
          if (length > max || (max == INFINITE && length == Integer.MAX_VALUE)) return false;
          current = allMatchingStringsOfLength(length++).iterator();
        }
        return true;
      }

      @Override
      public byte[] next() {
        if (!hasNext()) throw new NoSuchElementException();
        return current.next();
      }
    };
  }

  /**
   * A concrete copy with states numbered in breadth first order and dead states removed. Two minimal automata for the
   * same language have equal canonical forms.
   */
  public ConcreteDFA canonicalise() {
    Map<Integer, Integer> stateMap = new HashMap<>();
    List<Integer> reverse = new ArrayList<>();
    Set<Integer> seen = new HashSet<>();
    Deque<Integer> queue = new ArrayDeque<>();
    queue.add(start());
    while (!queue.isEmpty()) {
      int state = queue.poll();
      if (stateMap.containsKey(state)) continue;
      stateMap.put(state, reverse.size());
      reverse.add(state);
      for (int[] t : transitions(state)) {
        if (seen.add(t[1])) queue.add(t[1]);
      }
    }
    ConcreteDFA.Builder builder = ConcreteDFA.builder();
    for (int state : reverse) builder.addState(isAccepting(state));
    for (int i = 0; i < reverse.size(); i++) {
      for (int[] t : transitions(reverse.get(i))) builder.transition(i, t[0], stateMap.get(t[1]));
    }
    return builder.build();
  }

  /** True if both automata accept exactly the same strings, by Hopcroft and Karp's merging of state pairs */
  public boolean equivalent(DFA other) {
    Map<Long, Long> table = new HashMap<>();
    Deque<int[]> queue = new ArrayDeque<>();
    queue.add(new int[] { start(), other.start() });
    while (!queue.isEmpty()) {
      int[] pair = queue.poll();
      long selfKey = pair[0] & 0xFFFFFFFFL;
      long otherKey = (1L << 32) | (pair[1] & 0xFFFFFFFFL);
      long selfRoot = find(table, selfKey);
      long otherRoot = find(table, otherKey);
      if (selfRoot == otherRoot) continue;
      if (isAccepting(pair[0]) != other.isAccepting(pair[1])) return false;
      table.put(selfRoot, otherRoot);
      for (int c = 0; c < ALPHABET_SIZE; c++) queue.add(new int[] { transition(pair[0], c), other.transition(pair[1], c) });
    }
    return true;
  }

  private static long find(Map<Long, Long> table, long key) {
    List<Long> trail = new ArrayList<>();
    trail.add(key);
    Long next;
    while ((next = table.get(trail.get(trail.size() - 1))) != null && !next.equals(trail.get(trail.size() - 1))) {
      trail.add(next);
    }
    long root = trail.get(trail.size() - 1);
    for (long t : trail) table.put(t, root);
    return root;
  }
}
