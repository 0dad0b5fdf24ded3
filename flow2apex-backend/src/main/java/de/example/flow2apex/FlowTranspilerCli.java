package de.example.flow2apex;

import de.example.flow2apex.engine.FlowTranspileException;
import de.example.flow2apex.parse.FlowParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Command line entry: {@code flow2apex <flow-file> [-o <output-file>]}.
 * Runs without starting the Spring context.
 */
public final class FlowTranspilerCli {
  private static final Logger log = LoggerFactory.getLogger(FlowTranspilerCli.class);

  static final int OK = 0;
  static final int FAILED = 1;
  static final int USAGE = 2;

  private final PrintStream stdout;
  private final PrintStream stderr;

  public FlowTranspilerCli(PrintStream stdout, PrintStream stderr) {
    this.stdout = stdout;
    this.stderr = stderr;
  }

  public static void main(String[] args) {
    System.exit(new FlowTranspilerCli(System.out, System.err).run(args));
  }

  public int run(String[] args) {
    Path input = null;
    Path output = null;
    for (int i = 0; i < args.length; i++) {
      String a = args[i];
      switch (a) {
        case "-h", "--help" -> {
          printUsage(stdout);
          return OK;
        }
        case "-o", "--output" -> {
          if (i + 1 >= args.length) return usageError("Missing value for " + a);
          output = Path.of(args[++i]);
        }
        default -> {
          if (a.startsWith("-")) return usageError("Unknown option: " + a);
          if (input != null) return usageError("Only one flow file can be given");
          input = Path.of(a);
        }
      }
    }
    if (input == null) return usageError("No flow file given");
    if (!Files.isRegularFile(input)) {
      stderr.println("ERROR: Flow file not found: " + input);
      return FAILED;
    }

    try {
      String code = new FlowTranspiler().transpile(input);
      if (output == null) {
        stdout.print(code);
      } else {
        Files.writeString(output, code, StandardCharsets.UTF_8);
        stdout.println("Pseudocode written to " + output);
      }
      return OK;
    } catch (FlowTranspileException | FlowParseException e) {
      log.error("Transpiling {} failed", input, e);
      stderr.println("ERROR: " + e.getMessage());
      return FAILED;
    } catch (IOException e) {
      stderr.println("ERROR: Cannot write " + output + ": " + e.getMessage());
      return FAILED;
    }
  }

  private int usageError(String message) {
    stderr.println("ERROR: " + message);
    printUsage(stderr);
    return USAGE;
  }

  private static void printUsage(PrintStream out) {
    out.println("Usage: flow2apex <flow-file> [-o <output-file>]");
    out.println();
    out.println("Converts a Salesforce Flow metadata XML file into Apex-like pseudocode.");
    out.println();
    out.println("Options:");
    out.println("  -o, --output <file>   write the pseudocode to <file> instead of stdout");
    out.println("  -h, --help            show this help");
  }
}
