package conj.engine;

import java.util.Arrays;
import java.util.Objects;

/** One recorded top-level draw: its kind, constraints, realized value and where it sits on the tape */
public class ChoiceNode {
  public final ChoiceKind kind;
  public final ChoiceConstraints constraints;
  /** Long, Boolean, Double, String or byte[] depending on {@link #kind} */
  public final Object value;
  /** True if the caller fixed the value, in which case shrinking can not change it */
  public final boolean wasForced;
  /** Start of the draw on the tape, inclusive */
  public final int start;
  /** End of the draw on the tape, exclusive */
  public final int end;
  /** Position in the node list */
  public final int index;

  public ChoiceNode(ChoiceKind kind, ChoiceConstraints constraints, Object value, boolean wasForced,
      int start, int end, int index) {
    this.kind = Objects.requireNonNull(kind);
    this.constraints = Objects.requireNonNull(constraints);
    if (constraints.kind() != kind) throw new IllegalArgumentException("Constraints for " + constraints.kind());
    this.value = Objects.requireNonNull(value);
    this.wasForced = wasForced;
    this.start = start;
    this.end = end;
    this.index = index;
  }

  /** A template node that replays this value. Position information is ignored on replay. */
  public static ChoiceNode of(ChoiceConstraints constraints, Object value) {
    return new ChoiceNode(constraints.kind(), constraints, value, false, -1, -1, -1);
  }

  /** Same kind, constraints and value, ignoring position */
  public boolean sameChoice(ChoiceNode other) {
    return kind == other.kind && constraints.equals(other.constraints) && valueEquals(value, other.value);
  }

  static boolean valueEquals(Object left, Object right) {
    if (left instanceof byte[] && right instanceof byte[]) return Arrays.equals((byte[]) left, (byte[]) right);
    if (left instanceof Double && right instanceof Double) return Double.compare((Double) left, (Double) right) == 0;
    return left.equals(right);
  }

  @Override
  public String toString() {
    String valueStr = value instanceof byte[] ? Util.hex((byte[]) value) : String.valueOf(value);
    return kind + "(" + valueStr + (wasForced ? ", forced" : "") + ")@" + start + ".." + end;
  }
}
