package ca.gc.cra.s3.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Result channel of the {@code s3} commands. Decoded ACLs, bucket verdicts, status tables and usage text go to
 * stdout here; Logback keeps diagnostics on stderr, so piping a command's output captures results only.
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter capture;

  private CliPrinter() {}

  /**
   * Writes one result line.
   *
   * @param line text to emit
   */
  public static void println(String line) {
    out().println(line);
  }

  /**
   * Writes result lines in order and flushes once.
   *
   * @param lines text to emit
   */
  public static void println(Iterable<String> lines) {
    PrintWriter out = out();
    lines.forEach(out::println);
    out.flush();
  }

  static void setWriterForTesting(PrintWriter writer) {
    capture = writer;
  }

  static void clearTestWriter() {
    capture = null;
  }

  private static PrintWriter out() {
    PrintWriter writer = capture;
    return writer != null ? writer : STDOUT;
  }
}
