package conj.engine;

import java.util.Arrays;
import java.util.List;
import java.util.function.ToIntFunction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hill climber for one target score. Repeatedly picks a span of the current best example, regenerates everything from
 * its start and keeps the attempt if it scores higher. Failing that, the regenerated span alone is spliced back into
 * the original tape and tried. Gives up after {@link #MAX_FAILURES} consecutive failures.
 */
public class Optimiser {
  private static final Logger log = LoggerFactory.getLogger(Optimiser.class);

  public static final int MAX_FAILURES = 10;

  private final ConjectureRunner runner;
  private final String target;
  private ConjectureResult current;
  private int improvements;

  public Optimiser(ConjectureRunner runner, ConjectureResult start, String target) {
    this.runner = runner;
    this.current = start;
    this.target = target;
  }

  /** Run both span selection strategies */
  public void run() {
    doHillClimbing(this::lastNonEmptySpan);
    doHillClimbing(this::randomNonEmptySpan);
    log.debug("Optimised {} with {} improvements to score {}", target, improvements, score(current));
  }

  public ConjectureResult current() { return current; }

  public int improvements() { return improvements; }

  private double score(ConjectureResult result) {
    return result.targetObservations.getOrDefault(target, Double.NEGATIVE_INFINITY);
  }

  private boolean consider(ConjectureResult result) {
    if (result.status.compareTo(Status.VALID) < 0) return false;
    if (score(result) > score(current)) {
      current = result;
      improvements++;
      return true;
    }
    return false;
  }

  private int lastNonEmptySpan(ConjectureResult result) {
    List<Span> spans = result.spans;
    int i = spans.size() - 1;
    while (spans.get(i).length() == 0) i--;
    return i;
  }

  private int randomNonEmptySpan(ConjectureResult result) {
    List<Span> spans = result.spans;
    while (true) {
      int i = runner.random().nextInt(spans.size());
      if (spans.get(i).length() > 0) return i;
    }
  }

  private void doHillClimbing(ToIntFunction<ConjectureResult> selectSpan) {
    int failures = 0;
    while (failures < MAX_FAILURES && current.status.compareTo(Status.VALID) <= 0 && current.length() > 0) {
      if (attemptToImprove(selectSpan.applyAsInt(current))) failures = 0;
      else failures++;
    }
  }

  private boolean attemptToImprove(int spanIndex) {
    ConjectureResult data = current;
    Span span = data.spans.get(spanIndex);
    byte[] buffer = data.buffer();
    byte[] prefix = Arrays.copyOf(buffer, span.start);
    ConjectureResult attempt = runner.testFunction(runner.newConjectureData(prefix));
    if (consider(attempt)) return true;
    if (spanIndex >= attempt.spans.size()) return false;
    byte[] replacement = attempt.spanBytes(attempt.spans.get(spanIndex));
    byte[] suffix = Arrays.copyOfRange(buffer, span.end, buffer.length);
    return consider(runner.cachedTestFunction(Util.concat(prefix, replacement, suffix)));
  }
}
