package conj.engine;

import java.util.Objects;

/**
 * Identity of a failure, used to group failing examples so that distinct bugs are tracked and shrunk separately.
 * When derived from a throwable it is the exception class plus the top frame it was raised from.
 */
public class InterestingOrigin implements Comparable<InterestingOrigin> {
  /** The failure kind, usually the exception class name */
  public final String kind;
  /** The failure location, usually "File.java:123", or empty */
  public final String location;

  public InterestingOrigin(String kind, String location) {
    this.kind = Objects.requireNonNull(kind);
    this.location = Objects.requireNonNull(location);
  }

  /** Origin with just a kind and no location */
  public static InterestingOrigin of(String kind) { return new InterestingOrigin(kind, ""); }

  /** Origin from the throwable's class and the first frame of its stack trace */
  public static InterestingOrigin fromThrowable(Throwable t) {
    StackTraceElement[] trace = t.getStackTrace();
    String location = "";
    if (trace.length > 0) location = trace[0].getFileName() + ":" + trace[0].getLineNumber();
    return new InterestingOrigin(t.getClass().getName(), location);
  }

  @Override
  public int compareTo(InterestingOrigin o) { return toString().compareTo(o.toString()); }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    InterestingOrigin other = (InterestingOrigin) o;
    return kind.equals(other.kind) && location.equals(other.location);
  }

  @Override
  public int hashCode() { return Objects.hash(kind, location); }

  @Override
  public String toString() { return location.isEmpty() ? kind : kind + " at " + location; }
}
