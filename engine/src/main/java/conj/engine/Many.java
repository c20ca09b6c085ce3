package conj.engine;

/**
 * Helper for drawing variable-sized collections. Each call to {@link #more()} draws a continuation coin inside its
 * own span, so the shrinker can delete whole elements by deleting spans. Typical use:
 * <pre>
 *   Many elements = new Many(data, 0, 10, 3);
 *   while (elements.more()) list.add(drawElement(data));
 * </pre>
 */
public class Many {
  private final ConjectureData data;
  public final int minSize;
  public final int maxSize;
  /** Probability of drawing another element once the min size is met */
  public final double pContinue;

  private int count;
  private int rejections;
  private boolean drawn;
  private boolean forceStop;
  private boolean rejected;

  public Many(ConjectureData data, int minSize, int maxSize, double averageSize) {
    if (minSize < 0 || minSize > maxSize) throw new ConjectureException.InvalidArgument(
        "Bad size range [" + minSize + ", " + maxSize + "]");
    this.data = data;
    this.minSize = minSize;
    this.maxSize = maxSize;
    this.pContinue = calcPContinue(averageSize - minSize, maxSize - minSize);
  }

  /** The average size used when a caller has no preference */
  public static double defaultAverageSize(int minSize, int maxSize) {
    return Math.min(Math.max(minSize * 2, minSize + 5), 0.5 * (minSize + maxSize));
  }

  /** Number of elements accepted so far */
  public int count() { return count; }

  /** Whether another element should be drawn */
  public boolean more() { return more(null); }

  boolean more(Boolean forced) {
    if (drawn) data.stopSpan(rejected);
    drawn = true;
    rejected = false;
    data.startSpan(ConjectureData.ONE_FROM_MANY_LABEL);
    boolean shouldContinue;
    if (minSize == maxSize) shouldContinue = count < minSize;
    else {
      Boolean forcedResult = forced;
      if (forceStop) forcedResult = false;
      else if (count < minSize) forcedResult = true;
      else if (count >= maxSize) forcedResult = false;
      shouldContinue = data.drawBoolean(pContinue, forcedResult);
    }
    if (shouldContinue) {
      count++;
      return true;
    }
    data.stopSpan(false);
    return false;
  }

  /** Reject the last element. Its span is marked discarded. Too many rejections end the collection or the test. */
  public void reject() {
    if (count <= 0) throw new IllegalStateException("Nothing to reject");
    count--;
    rejections++;
    rejected = true;
    if (rejections > Math.max(3, 2 * count)) {
      if (count < minSize) data.markInvalid();
      else forceStop = true;
    }
  }

  static double calcPContinue(double desiredAvg, int maxSize) {
    if (desiredAvg >= maxSize) return 1.0;
    double pContinue = 1 - 1.0 / (1 + desiredAvg);
    if (pContinue == 0) return pContinue;
    // The infinite series underestimates the average for small max sizes, so search upwards
    double hi = 1.0;
    while (desiredAvg - pContinueToAvg(pContinue, maxSize) > 0.01) {
      double mid = (pContinue + hi) / 2;
      if (pContinueToAvg(mid, maxSize) <= desiredAvg) pContinue = mid;
      else hi = mid;
      if (hi - pContinue < 1e-12) break;
    }
    return pContinue;
  }

  static double pContinueToAvg(double pContinue, int maxSize) {
    if (pContinue >= 1) return maxSize;
    return (1.0 / (1 - pContinue) - 1) * (1 - Math.pow(pContinue, maxSize));
  }
}
