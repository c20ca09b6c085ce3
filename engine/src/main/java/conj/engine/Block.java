package conj.engine;

/** A contiguous run of tape bytes produced by one primitive draw */
public class Block {
  /** Position in the block list */
  public final int index;
  /** Tape start, inclusive */
  public final int start;
  /** Tape end, exclusive */
  public final int end;
  /** True if the bytes were forced by the caller rather than read from the source */
  public final boolean forced;
  /** True if every byte is zero */
  public final boolean allZero;

  public Block(int index, int start, int end, boolean forced, boolean allZero) {
    this.index = index;
    this.start = start;
    this.end = end;
    this.forced = forced;
    this.allZero = allZero;
  }

  public int length() { return end - start; }

  /** A trivial block can not be made any simpler */
  public boolean trivial() { return forced || allZero; }

  @Override
  public String toString() { return "Block(" + index + ", " + start + ".." + end + (forced ? ", forced" : "") + ")"; }
}
