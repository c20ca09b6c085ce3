package conj.engine;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/** Constraints payload for a draw, one final subclass per {@link ChoiceKind} */
public abstract class ChoiceConstraints {
  private ChoiceConstraints() { }

  /** The kind these constraints apply to */
  public abstract ChoiceKind kind();

  /** Throw {@link ConjectureException.InvalidArgument} if the value can not be produced under these constraints */
  public abstract void validate(Object value);

  protected static ConjectureException.InvalidArgument invalid(String msg) {
    return new ConjectureException.InvalidArgument(msg);
  }

  /** Inclusive long range with a shrink target and optional point weights */
  public static final class ForInteger extends ChoiceConstraints {
    public final long min;
    public final long max;
    /** The value the draw shrinks towards, clamped into the range */
    public final long shrinkTowards;
    /** Probabilities for specific values, summing to less than one. Null for none. */
    public final Map<Long, Double> weights;

    public ForInteger(long min, long max) { this(min, max, 0, null); }

    public ForInteger(long min, long max, long shrinkTowards, Map<Long, Double> weights) {
      if (min > max) throw invalid("min " + min + " > max " + max);
      this.min = min;
      this.max = max;
      this.shrinkTowards = Math.max(min, Math.min(max, shrinkTowards));
      if (weights != null) {
        double total = 0;
        for (Map.Entry<Long, Double> entry : weights.entrySet()) {
          if (entry.getKey() < min || entry.getKey() > max) throw invalid("Weighted value out of range: " + entry);
          if (!(entry.getValue() > 0)) throw invalid("Weight must be positive: " + entry);
          total += entry.getValue();
        }
        if (weights.isEmpty() || total >= 1) throw invalid("Weights must be non-empty and sum below 1: " + total);
        this.weights = Collections.unmodifiableMap(new TreeMap<>(weights));
      } else this.weights = null;
    }

    @Override
    public ChoiceKind kind() { return ChoiceKind.INTEGER; }

    @Override
    public void validate(Object value) {
      if (!(value instanceof Long)) throw invalid("Expected Long, got " + value);
      long v = (Long) value;
      if (v < min || v > max) throw invalid("Value " + v + " outside [" + min + ", " + max + "]");
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (!(o instanceof ForInteger)) return false;
      ForInteger other = (ForInteger) o;
      return min == other.min && max == other.max && shrinkTowards == other.shrinkTowards &&
          Objects.equals(weights, other.weights);
    }

    @Override
    public int hashCode() { return Objects.hash(min, max, shrinkTowards, weights); }

    @Override
    public String toString() {
      return "ForInteger(min=" + min + ", max=" + max + ", shrinkTowards=" + shrinkTowards + ", weights=" + weights + ")";
    }
  }

  /** Probability of true */
  public static final class ForBoolean extends ChoiceConstraints {
    public final double p;

    public ForBoolean(double p) {
      if (Double.isNaN(p)) throw invalid("Probability is NaN");
      this.p = p;
    }

    @Override
    public ChoiceKind kind() { return ChoiceKind.BOOLEAN; }

    @Override
    public void validate(Object value) {
      if (!(value instanceof Boolean)) throw invalid("Expected Boolean, got " + value);
      boolean v = (Boolean) value;
      if (v && p <= 0) throw invalid("Can not force true with p=" + p);
      if (!v && p >= 1) throw invalid("Can not force false with p=" + p);
    }

    @Override
    public boolean equals(Object o) {
      return this == o || (o instanceof ForBoolean && Double.compare(p, ((ForBoolean) o).p) == 0);
    }

    @Override
    public int hashCode() { return Double.hashCode(p); }

    @Override
    public String toString() { return "ForBoolean(p=" + p + ")"; }
  }

  /** Inclusive float range, optionally allowing NaN */
  public static final class ForFloat extends ChoiceConstraints {
    public final double min;
    public final double max;
    public final boolean allowNan;

    public ForFloat(double min, double max, boolean allowNan) {
      if (Double.isNaN(min) || Double.isNaN(max) || min > max) throw invalid("Bad float range [" + min + ", " + max + "]");
      this.min = min;
      this.max = max;
      this.allowNan = allowNan;
    }

    /** True if the value can come out of a draw with these constraints */
    public boolean permits(double value) {
      if (Double.isNaN(value)) return allowNan;
      return min <= value && value <= max;
    }

    @Override
    public ChoiceKind kind() { return ChoiceKind.FLOAT; }

    @Override
    public void validate(Object value) {
      if (!(value instanceof Double)) throw invalid("Expected Double, got " + value);
      if (!permits((Double) value)) throw invalid("Value " + value + " not permitted by " + this);
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (!(o instanceof ForFloat)) return false;
      ForFloat other = (ForFloat) o;
      return Double.compare(min, other.min) == 0 && Double.compare(max, other.max) == 0 && allowNan == other.allowNan;
    }

    @Override
    public int hashCode() { return Objects.hash(min, max, allowNan); }

    @Override
    public String toString() { return "ForFloat(min=" + min + ", max=" + max + ", allowNan=" + allowNan + ")"; }
  }

  /** Strings over an ordered alphabet of code points, earlier code points being simpler */
  public static final class ForString extends ChoiceConstraints {
    private final int[] alphabet;
    public final int minSize;
    public final int maxSize;

    public ForString(String alphabet, int minSize, int maxSize) {
      this(alphabet.codePoints().toArray(), minSize, maxSize);
    }

    public ForString(int[] alphabet, int minSize, int maxSize) {
      if (minSize < 0 || minSize > maxSize) throw invalid("Bad size range [" + minSize + ", " + maxSize + "]");
      if (alphabet.length == 0 && maxSize > 0) throw invalid("Empty alphabet with non-zero max size");
      this.alphabet = alphabet.clone();
      this.minSize = minSize;
      this.maxSize = maxSize;
    }

    public int alphabetSize() { return alphabet.length; }

    public int codePointAt(int index) { return alphabet[index]; }

    /** Index of the code point in the alphabet, or -1 */
    public int indexOf(int codePoint) {
      for (int i = 0; i < alphabet.length; i++) if (alphabet[i] == codePoint) return i;
      return -1;
    }

    @Override
    public ChoiceKind kind() { return ChoiceKind.STRING; }

    @Override
    public void validate(Object value) {
      if (!(value instanceof String)) throw invalid("Expected String, got " + value);
      int[] points = ((String) value).codePoints().toArray();
      if (points.length < minSize || points.length > maxSize) throw invalid("String size out of range: " + value);
      for (int point : points) if (indexOf(point) < 0) throw invalid("Code point not in alphabet: " + point);
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (!(o instanceof ForString)) return false;
      ForString other = (ForString) o;
      return minSize == other.minSize && maxSize == other.maxSize && Arrays.equals(alphabet, other.alphabet);
    }

    @Override
    public int hashCode() { return 31 * Objects.hash(minSize, maxSize) + Arrays.hashCode(alphabet); }

    @Override
    public String toString() {
      return "ForString(alphabetSize=" + alphabet.length + ", minSize=" + minSize + ", maxSize=" + maxSize + ")";
    }
  }

  /** Byte arrays with a size range */
  public static final class ForBytes extends ChoiceConstraints {
    public final int minSize;
    public final int maxSize;

    public ForBytes(int minSize, int maxSize) {
      if (minSize < 0 || minSize > maxSize) throw invalid("Bad size range [" + minSize + ", " + maxSize + "]");
      this.minSize = minSize;
      this.maxSize = maxSize;
    }

    @Override
    public ChoiceKind kind() { return ChoiceKind.BYTES; }

    @Override
    public void validate(Object value) {
      if (!(value instanceof byte[])) throw invalid("Expected byte[], got " + value);
      int len = ((byte[]) value).length;
      if (len < minSize || len > maxSize) throw invalid("Byte array size out of range: " + len);
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (!(o instanceof ForBytes)) return false;
      ForBytes other = (ForBytes) o;
      return minSize == other.minSize && maxSize == other.maxSize;
    }

    @Override
    public int hashCode() { return Objects.hash(minSize, maxSize); }

    @Override
    public String toString() { return "ForBytes(minSize=" + minSize + ", maxSize=" + maxSize + ")"; }
  }
}
