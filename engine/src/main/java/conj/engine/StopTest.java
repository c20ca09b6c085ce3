package conj.engine;

/**
 * Signal thrown to unwind out of a test function once its data has been frozen. Carries the test counter of the data
 * that raised it so the runner can tell a signal from the current execution apart from a stale one.
 */
public class StopTest extends RuntimeException {
  /** The {@link ConjectureData#testCounter} of the data that was concluded */
  public final long testCounter;

  public StopTest(long testCounter) {
    super("Stop test " + testCounter, null, false, false);
    this.testCounter = testCounter;
  }
}
