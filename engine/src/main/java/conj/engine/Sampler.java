package conj.engine;

import java.util.Arrays;
import java.util.Comparator;
import java.util.PriorityQueue;

/**
 * Weighted sampling of indices using Vose's alias method. Each table row is (base, alternate, alternate chance) with
 * base never larger than alternate, and rows are sorted, so lowering either the row draw or the coin always gives a
 * lower index.
 */
public class Sampler {
  /** Each row is {base, alternate} */
  private final int[][] rows;
  /** Chance of picking the alternate, one per row */
  private final double[] alternateChances;

  public Sampler(double[] weights) {
    int n = weights.length;
    if (n == 0) throw new ConjectureException.InvalidArgument("No weights given");
    double total = 0;
    for (double w : weights) {
      if (!(w >= 0)) throw new ConjectureException.InvalidArgument("Bad weight: " + w);
      total += w;
    }
    if (!(total > 0)) throw new ConjectureException.InvalidArgument("Weights sum to zero");

    int[] alternates = new int[n];
    Double[] chances = new Double[n];
    Arrays.fill(alternates, -1);
    double[] scaled = new double[n];
    PriorityQueue<Integer> small = new PriorityQueue<>();
    PriorityQueue<Integer> large = new PriorityQueue<>();
    for (int i = 0; i < n; i++) {
      scaled[i] = (weights[i] / total) * n;
      if (scaled[i] == 1) chances[i] = 0.0;
      else if (scaled[i] < 1) small.add(i);
      else large.add(i);
    }
    while (!small.isEmpty() && !large.isEmpty()) {
      int lo = small.poll();
      int hi = large.poll();
      alternates[lo] = hi;
      chances[lo] = 1 - scaled[lo];
      scaled[hi] = (scaled[hi] + scaled[lo]) - 1;
      if (scaled[hi] < 1) small.add(hi);
      else if (scaled[hi] == 1) chances[hi] = 0.0;
      else large.add(hi);
    }
    // Leftovers are only off by floating point error
    while (!large.isEmpty()) chances[large.poll()] = 0.0;
    while (!small.isEmpty()) chances[small.poll()] = 0.0;

    int[][] table = new int[n][];
    double[] tableChances = new double[n];
    Integer[] order = new Integer[n];
    for (int i = 0; i < n; i++) {
      int base = i;
      int alternate = alternates[i] < 0 ? i : alternates[i];
      double chance = chances[i];
      if (alternate < base) {
        int tmp = base;
        base = alternate;
        alternate = tmp;
        chance = 1 - chance;
      }
      table[i] = new int[] { base, alternate };
      tableChances[i] = chance;
      order[i] = i;
    }
    Arrays.sort(order, Comparator.<Integer>comparingInt(i -> table[i][0])
        .thenComparingInt(i -> table[i][1])
        .thenComparingDouble(i -> tableChances[i]));
    rows = new int[n][];
    alternateChances = new double[n];
    for (int i = 0; i < n; i++) {
      rows[i] = table[order[i]];
      alternateChances[i] = tableChances[order[i]];
    }
  }

  /** Number of outcomes */
  public int size() { return rows.length; }

  /** Draw an index from the data */
  public int sample(ConjectureData data) { return sample(data, null); }

  /** Draw an index from the data, writing the bytes that select the forced index if one is given */
  public int sample(ConjectureData data, Integer forced) {
    Integer forcedRow = null;
    Boolean forcedAlternate = null;
    if (forced != null) {
      for (int i = 0; i < rows.length && forcedRow == null; i++) {
        if (rows[i][0] == forced && alternateChances[i] < 1) {
          forcedRow = i;
          forcedAlternate = false;
        } else if (rows[i][1] == forced && alternateChances[i] > 0) {
          forcedRow = i;
          forcedAlternate = true;
        }
      }
      if (forcedRow == null) throw new ConjectureException.InvalidArgument("Index " + forced + " can not be sampled");
    }
    data.startSpan(ConjectureData.SAMPLE_IN_SAMPLER_LABEL);
    int i = (int) data.integerRange(0, rows.length - 1, 0, forcedRow == null ? null : (long) forcedRow);
    boolean useAlternate = data.biasedCoin(alternateChances[i], forcedAlternate);
    data.stopSpan(false);
    return useAlternate ? rows[i][1] : rows[i][0];
  }
}
