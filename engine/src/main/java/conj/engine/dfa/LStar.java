package conj.engine.dfa;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import conj.engine.ConjectureException;
import conj.engine.Util;

/**
 * Learns a DFA for a language given only a membership test, using a variant of Angluin's L* algorithm. States are
 * rows of membership answers for the string followed by each experiment. Bytes are collapsed through an
 * {@link IntegerNormalizer} so large runs of equivalent bytes cost a single query.
 * <p>
 * The learned {@link #dfa()} is lazily computed and is only valid for the {@link #generation()} it was made in. Call
 * {@link DFA#canonicalise()} on it to keep a copy.
 */
public class LStar {
  private static final Logger log = LoggerFactory.getLogger(LStar.class);

  private final Predicate<byte[]> membership;
  private final List<byte[]> experiments = new ArrayList<>();
  private final IntegerNormalizer normalizer = new IntegerNormalizer();
  private final Map<List<Boolean>, byte[]> rowsToCanonical = new HashMap<>();
  private final Map<ByteBuffer, byte[]> canonicalizationCache = new HashMap<>();
  private final Map<ByteBuffer, Boolean> memberCache = new HashMap<>();
  private int generation;
  private LearnedDFA dfa;

  public LStar(Predicate<byte[]> membership) {
    this.membership = membership;
    addExperiment(new byte[0]);
  }

  /** Incremented every time the predicted DFA changes */
  public int generation() { return generation; }

  /** The current prediction, invalid once {@link #generation()} moves on */
  public LearnedDFA dfa() { return dfa; }

  public List<byte[]> experiments() { return Collections.unmodifiableList(experiments); }

  public IntegerNormalizer normalizer() { return normalizer; }

  /** Cached membership check */
  public boolean member(byte[] s) {
    return memberCache.computeIfAbsent(ByteBuffer.wrap(s.clone()), k -> membership.test(k.array().clone()));
  }

  /**
   * The representative string of the state this string leads to. Stable until the model is changed by further
   * learning.
   */
  public byte[] canonicalize(byte[] string) {
    ByteBuffer key = ByteBuffer.wrap(string.clone());
    byte[] cached = canonicalizationCache.get(key);
    if (cached != null) return cached;
    List<Boolean> row = new ArrayList<>(experiments.size());
    for (byte[] e : experiments) row.add(member(Util.concat(string, e)));
    byte[] result = rowsToCanonical.computeIfAbsent(row, r -> key.array());
    canonicalizationCache.put(key, result);
    return result;
  }

  /**
   * Change the model until it gives the right answer for the string. Later learning of other strings may break this
   * again, but calling this repeatedly over a fixed set of strings until the generation stops changing always
   * terminates. See {@link #learnAll(Collection)}.
   */
  public void learn(byte[] s) {
    boolean correct = member(s);
    if (dfa.matches(s) == correct) return;
    while (true) {
      LearnedDFA current = dfa;
      List<Integer> states = new ArrayList<>();
      states.add(current.start());
      // After reading n bytes, replacing them with the label of the state reached keeps the answer
      int n = Util.findInteger(i -> {
        if (i > s.length) return false;
        while (i >= states.size()) {
          states.add(current.transition(states.get(states.size() - 1), s[states.size() - 1] & 0xFF));
        }
        return member(Util.concat(current.label(states.get(i)), suffix(s, i))) == correct;
      });
      if (n == s.length) {
        if (current.matches(s) != correct) throw new IllegalStateException("Learned model disagrees on string");
        break;
      }
      // Reading byte n goes to the wrong state. Either the byte is wrongly normalized or we need a new experiment.
      byte[] prefix = new byte[n];
      System.arraycopy(s, 0, prefix, 0, n);
      byte[] suffix = suffix(s, n + 1);
      if (normalizer.distinguish(s[n] & 0xFF, x -> member(Util.concat(prefix, new byte[] { (byte) x }, suffix)))) {
        log.trace("New normalized byte value, now {}", normalizer);
        dfaChanged();
        continue;
      }
      addExperiment(suffix);
    }
  }

  /** Learn every string until learning stops changing the model */
  public void learnAll(Collection<byte[]> strings) {
    while (true) {
      int prev = generation;
      for (byte[] s : strings) learn(s);
      if (prev == generation) return;
    }
  }

  private void addExperiment(byte[] e) {
    experiments.add(e.clone());
    log.trace("Added experiment {}, {} total", Util.hex(e), experiments.size());
    dfaChanged();
  }

  private void dfaChanged() {
    generation++;
    rowsToCanonical.clear();
    canonicalizationCache.clear();
    dfa = new LearnedDFA();
  }

  private static byte[] suffix(byte[] s, int from) {
    byte[] result = new byte[s.length - from];
    System.arraycopy(s, from, result, 0, result.length);
    return result;
  }

  /** A lazily calculated DFA whose states are labelled by a canonical string that reaches them */
  public class LearnedDFA extends DFA {
    private final int generation = LStar.this.generation;
    private final List<byte[]> states = new ArrayList<>();
    private final Map<ByteBuffer, Integer> stateToIndex = new HashMap<>();
    private final Map<Long, Integer> transitionCache = new HashMap<>();

    LearnedDFA() {
      byte[] initial = canonicalize(new byte[0]);
      states.add(initial);
      stateToIndex.put(ByteBuffer.wrap(initial), 0);
    }

    private void checkChanged() {
      if (generation != LStar.this.generation) {
        throw new ConjectureException.InvalidState("The underlying model has changed so this DFA is no longer valid. " +
            "Call canonicalise() on it to keep a previously learned DFA.");
      }
    }

    /** The canonical string reaching the state */
    public byte[] label(int state) { return states.get(state).clone(); }

    @Override
    public int start() {
      checkChanged();
      return 0;
    }

    @Override
    public boolean isAccepting(int state) {
      checkChanged();
      return member(states.get(state));
    }

    @Override
    public int transition(int state, int c) {
      checkChanged();
      int normalized = normalizer.normalize(c);
      long key = ((long) state << 8) | normalized;
      Integer cached = transitionCache.get(key);
      if (cached != null) return cached;
      byte[] label = canonicalize(Util.concat(states.get(state), new byte[] { (byte) normalized }));
      Integer result = stateToIndex.get(ByteBuffer.wrap(label));
      if (result == null) {
        result = states.size();
        states.add(label);
        stateToIndex.put(ByteBuffer.wrap(label), result);
      }
      transitionCache.put(key, result);
      return result;
    }
  }
}
