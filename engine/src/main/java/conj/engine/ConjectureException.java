package conj.engine;

import java.util.Collections;
import java.util.List;

/** Base class for all engine exceptions */
public class ConjectureException extends RuntimeException {
  public ConjectureException(String msg) { super(msg); }
  public ConjectureException(String msg, Throwable cause) { super(msg, cause); }

  /** Thrown by the test to reject the current data. The runner turns this into {@link Status#INVALID}. */
  public static class UnsatisfiedAssumption extends ConjectureException {
    public UnsatisfiedAssumption() { super("Unsatisfied assumption"); }
    public UnsatisfiedAssumption(String msg) { super(msg); }
  }

  /** Thrown when frozen data is asked to draw or change */
  public static class Frozen extends ConjectureException {
    public Frozen(String operation) { super("Cannot call " + operation + " on frozen data"); }
  }

  /** Thrown for constraints or forced values that make no sense */
  public static class InvalidArgument extends ConjectureException {
    public InvalidArgument(String msg) { super(msg); }
  }

  /** Thrown when an object is used after the state it depends on has moved on */
  public static class InvalidState extends ConjectureException {
    public InvalidState(String msg) { super(msg); }
  }

  /** Thrown when a health check fails and has not been suppressed */
  public static class FailedHealthCheck extends ConjectureException {
    /** The failed check */
    public final ConjectureRunner.HealthCheck check;

    public FailedHealthCheck(ConjectureRunner.HealthCheck check, String msg) {
      super(msg + " (" + check + ")");
      this.check = check;
    }
  }

  /** Thrown when a stored failure does not reproduce the same way */
  public static class Flaky extends ConjectureException {
    public Flaky(String msg) { super(msg); }
  }

  /** Thrown when generation never produced a single valid example */
  public static class Unsatisfiable extends ConjectureException {
    public Unsatisfiable(String msg) { super(msg); }
  }

  /** Bundles every distinct failure found in a run */
  public static class MultipleFailures extends ConjectureException {
    /** The distinct failures, smallest example first */
    public final List<Throwable> failures;

    public MultipleFailures(List<Throwable> failures) {
      super("Found " + failures.size() + " distinct failures");
      this.failures = Collections.unmodifiableList(failures);
      for (Throwable failure : failures) addSuppressed(failure);
    }
  }
}
