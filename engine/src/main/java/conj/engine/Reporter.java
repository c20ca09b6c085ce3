package conj.engine;

/** Sink for human readable progress messages from a run */
@FunctionalInterface
public interface Reporter {
  /** Drops everything */
  Reporter SILENT = msg -> { };
  /** Writes each message on its own line to standard out */
  Reporter STDOUT = System.out::println;

  void report(String msg);
}
