package conj.engine;

/**
 * The test being run. It draws from the data and concludes it, either by returning normally (valid), calling
 * {@link ConjectureData#markInvalid()} or {@link ConjectureData#markInteresting(InterestingOrigin)}.
 */
@FunctionalInterface
public interface TestFunction {
  /** Run against the data. May throw {@link StopTest} via the data's mark methods. */
  void run(ConjectureData data);

  /** A checked variant for tests that throw */
  @FunctionalInterface
  interface Throwing {
    void run(ConjectureData data) throws Throwable;
  }

  /**
   * Adapt a test that signals failure by throwing. Anything thrown other than the engine's own control signals and
   * failed assumptions marks the data interesting with an origin derived from the throwable.
   */
  static TestFunction failuresAsInteresting(Throwing fn) {
    return data -> {
      try {
        fn.run(data);
      } catch (StopTest | ConjectureException.UnsatisfiedAssumption e) {
        throw e;
      } catch (Throwable t) {
        data.markInteresting(InterestingOrigin.fromThrowable(t), t);
      }
    };
  }
}
