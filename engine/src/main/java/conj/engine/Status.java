package conj.engine;

/**
 * Final status of a frozen test case, ordered from worst to best. Data that is still being drawn from has no status
 * yet; see {@link ConjectureData#isFrozen()}.
 */
public enum Status {
  /** Ran out of tape or choices */
  OVERRUN,
  /** Rejected by the test, e.g. a failed assumption */
  INVALID,
  /** Completed normally */
  VALID,
  /** Found a failure */
  INTERESTING
}
