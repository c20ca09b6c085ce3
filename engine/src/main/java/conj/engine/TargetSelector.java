package conj.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Bounded pool of examples to mutate from. Only examples of the best non-interesting status seen so far are kept,
 * and examples never handed out before are preferred.
 */
public class TargetSelector {
  public static final int DEFAULT_POOL_SIZE = 100;

  private final Random random;
  private final int poolSize;
  private Status bestStatus = Status.OVERRUN;
  private List<ConjectureResult> fresh = new ArrayList<>();
  private List<ConjectureResult> used = new ArrayList<>();

  public TargetSelector(Random random) { this(random, DEFAULT_POOL_SIZE); }

  public TargetSelector(Random random, int poolSize) {
    this.random = random;
    this.poolSize = poolSize;
  }

  public int size() { return fresh.size() + used.size(); }

  public Status bestStatus() { return bestStatus; }

  /** Offer a result. Interesting results and those worse than the best status are ignored. */
  public void add(ConjectureResult result) {
    if (result.status == Status.INTERESTING) return;
    if (result.status.compareTo(bestStatus) < 0) return;
    if (result.status.compareTo(bestStatus) > 0) {
      bestStatus = result.status;
      fresh = new ArrayList<>();
      used = new ArrayList<>();
    }
    fresh.add(result);
    if (size() > poolSize) Util.popRandom(random, used.isEmpty() ? fresh : used);
  }

  /** Pick a fresh example if there is one, otherwise any previously picked one */
  public ConjectureResult select() {
    if (!fresh.isEmpty()) {
      ConjectureResult result = Util.popRandom(random, fresh);
      used.add(result);
      return result;
    }
    if (used.isEmpty()) throw new IllegalStateException("Nothing to select");
    return used.get(random.nextInt(used.size()));
  }
}
