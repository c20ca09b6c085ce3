package conj.examples.simple;

import conj.engine.*;
import conj.extras.DirectoryDatabase;

import java.nio.file.Path;
import java.nio.file.Paths;

public class Main {
  public static void main(String[] args) {
    // Failing examples are kept here so a second run replays them straight away
    Path dbDir = Paths.get(System.getProperty("conj.databaseDir", ".conjecture/examples"));
    System.out.println("Using example database at " + dbDir.toAbsolutePath());

    ConjectureRunner runner = new ConjectureRunner(
        TestFunction.failuresAsInteresting(Main::parsedValueMatchesJava),
        ConjectureRunner.Config.builder().
            database(new DirectoryDatabase(dbDir)).
            databaseKey("conj.examples.simple.Main.parsedValueMatchesJava").
            maxExamples(500).
            reporter(Reporter.STDOUT).build()
    );

    System.out.println("Running");
    runner.run();
    System.out.println("Run complete (" + runner.exitReason() + ") after " + runner.callCount() + " calls, " +
        runner.shrinks() + " shrinks");
    if (runner.interestingExamples().isEmpty()) {
      System.out.println("No failures found");
      return;
    }
    for (ConjectureResult result : runner.interestingExamples().values()) {
      // Replay the shrunk tape to show the input the test saw
      ConjectureData data = ConjectureData.forBuffer(result.buffer());
      String str = numberString(data);
      System.out.println("Failing input '" + str + "' from " + result.length() + " bytes, cause: " + result.cause);
    }
  }

  /** Draw something shaped like a number, the sign, digits and an optional fraction */
  public static String numberString(ConjectureData data) {
    String sign = new String[] { "", "+", "-" }[(int) data.drawInteger(0, 2)];
    String num = data.drawString("0123456789", 1, 5);
    String frac = data.drawBoolean(0.5) ? "." + data.drawString("0123456789", 1, 5) : "";
    return sign + num + frac;
  }

  public static void parsedValueMatchesJava(ConjectureData data) {
    String str = numberString(data);
    double expected = Double.parseDouble(str);
    double actual = parseNumber(str).toDouble();
    if (expected != actual) throw new AssertionError("Parsed '" + str + "' as " + actual + ", expected " + expected);
  }

  public static Num parseNumber(String str) {
    if (str.isEmpty()) throw new NumberFormatException("Empty string");
    int index = 0;
    boolean neg = false;
    if (str.charAt(0) == '+') index++;
    else if (str.charAt(0) == '-') {
      neg = true;
      index++;
    }
    StringBuilder num = new StringBuilder();
    while (index < str.length()) {
      char chr = str.charAt(index);
      if (chr < '0' || chr > '9') break;
      num.append(chr);
      index++;
    }
    if (num.length() == 0) throw new NumberFormatException("No leading number(s)");
    StringBuilder frac = new StringBuilder();
    if (index < str.length() && str.charAt(index) == '.') {
      index++;
      while (index < str.length()) {
        char chr = str.charAt(index);
        if (chr < '0' || chr > '9') break;
        frac.append(chr);
        index++;
      }
      if (frac.length() == 0) throw new NumberFormatException("Decimal without trailing numbers(s)");
    }
    if (index != str.length()) throw new NumberFormatException("Unknown char: " + str.charAt(index));
    return new Num(neg, num.toString(), frac.toString());
  }

  public static class Num {
    public final boolean neg;
    public final String num;
    public final String frac;

    public Num(boolean neg, String num, String frac) {
      this.neg = neg;
      this.num = num;
      this.frac = frac;
    }

    /** Deliberately wrong for negative numbers with a fraction, the sign only applies to the whole part */
    public double toDouble() {
      double whole = Double.parseDouble(num);
      double fraction = frac.isEmpty() ? 0 : Double.parseDouble("0." + frac);
      return (neg ? -whole : whole) + fraction;
    }

    @Override
    public String toString() { return "Num(neg=" + neg + ", num=" + num + ", frac=" + frac + ")"; }
  }
}
