package FA;

import FA.Codec.AutomatonFormatException;
import FA.Codec.Formats;
import FA.Codec.NativeFormat;
import FA.Model.Automaton;
import FA.Model.AutomatonException;
import FA.Model.AutomatonValidator;
import FA.Model.ErrorKind;
import FA.Report.BatchValidation;
import FA.Report.ResultsReport;
import FA.Simulation.SimulationResult;
import FA.Simulation.Simulator;
import FA.Simulation.TraceStep;
import FA.Strings.StringOps;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class FACommandLine {
  static final int EXIT_OK = 0;
  static final int EXIT_ERROR = 1;

  public static void main(String[] args) {
    String outFile = null;
    List<String> positional = new ArrayList<>();

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if ("--debug".equalsIgnoreCase(arg)) {
        // read by slf4j-simple when the first logger is created
        System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "debug");
      } else if ("--out".equalsIgnoreCase(arg)) {
        // Require a value that isn't another flag
        if (i + 1 >= args.length || args[i + 1].startsWith("--")) {
          System.err.println("Missing value for --out");
          printUsageAndExit();
        }
        outFile = args[++i];
      } else if (arg.startsWith("--")) {
        printUsageAndExit();
      } else {
        positional.add(arg);
      }
    }

    if (positional.size() < 2) {
      printUsageAndExit();
    }
    System.exit(execute(positional, outFile, System.out, System.err));
  }

  private static void printUsageAndExit() {
    System.out.println("FA [--debug] [--out <file>] <command> <automaton file> [args...]");
    System.out.println("[--debug] : Additional debug output");
    System.out.println("[--out <file>] : Write the report (or the automaton) to a file instead of the console");
    System.out.println();
    System.out.println("<command> : one of the choices below:");
    System.out.println("  run <file> <input>... : Simulate each input, printing the trace.");
    System.out.println("  batch <file> <a,b,...> : Validate a comma-separated list of strings.");
    System.out.println("  closure <file> <state> : ε-closure of a state.");
    System.out.println("  prefixes|suffixes|substrings <file> <string> : String operation with verdicts.");
    System.out.println("  kleene|positive <file> <max length> : Closure over the automaton's alphabet, with verdicts.");
    System.out.println("  check <file> : Report missing initial/accepting states and DFA transitions.");
    System.out.println("  convert <file> <output file> : Re-encode, format chosen by the output extension.");
    System.out.println("  determinize <file> : Subset construction and minimization.");
    System.out.println();
    System.out.println("<automaton file> : .txt/.fa (native), .jff (JFLAP) or .afd/.json (JSON).");
    System.exit(EXIT_OK);
  }

  /**
   * Run one command.
   * @param positional - command, automaton file, then command arguments
   * @param outFile - file for the report, or null for {@code out}
   * @return process exit status
   */
  static int execute(List<String> positional, String outFile, PrintStream out, PrintStream err) {
    final String command = positional.get(0).toLowerCase(Locale.ROOT);
    final Path file = Paths.get(positional.get(1));
    final List<String> rest = positional.subList(2, positional.size());

    try {
      final Automaton automaton = Formats.read(file);
      if ("convert".equals(command)) {
        requireArgs(rest, 1, command);
        AutomatonValidator.requireValid(automaton);
        Formats.write(Paths.get(rest.get(0)), automaton);
        out.println("Written to " + rest.get(0));
        return EXIT_OK;
      }
      if ("determinize".equals(command) && outFile != null) {
        Formats.write(Paths.get(outFile), Determinizer.determinize(automaton));
        out.println("Written to " + outFile);
        return EXIT_OK;
      }

      final String report = report(command, automaton, rest);
      if (outFile != null) {
        Files.writeString(Paths.get(outFile), report, StandardCharsets.UTF_8);
        out.println("Written to " + outFile);
      } else {
        out.print(report);
      }
      return EXIT_OK;
    } catch (AutomatonException e) {
      err.println(e.getKind() + ": " + e.getMessage());
    } catch (AutomatonFormatException e) {
      err.println(e.getKind() + ": " + e.getMessage());
    } catch (IOException e) {
      err.println("I/O error: " + e.getMessage());
    }
    return EXIT_ERROR;
  }

  static String report(String command, Automaton automaton, List<String> rest) {
    return switch (command) {
      case "run" -> runAll(automaton, rest);
      case "batch" -> ResultsReport.batch(BatchValidation.validate(automaton, String.join(",", rest)));
      case "closure" -> {
        requireArgs(rest, 1, command);
        yield "ε-closure(" + rest.get(0) + ") = {"
            + String.join(",", Simulator.epsilonClosureOf(automaton, rest.get(0))) + "}\n";
      }
      case "prefixes" -> ResultsReport.prefixes(automaton, stringArg(rest));
      case "suffixes" -> ResultsReport.suffixes(automaton, stringArg(rest));
      case "substrings" -> ResultsReport.substrings(automaton, stringArg(rest));
      case "kleene" -> {
        requireArgs(rest, 1, command);
        yield ResultsReport.kleeneClosure(automaton, StringOps.parseLength(rest.get(0)));
      }
      case "positive" -> {
        requireArgs(rest, 1, command);
        yield ResultsReport.positiveClosure(automaton, StringOps.parseLength(rest.get(0)));
      }
      case "check" -> check(automaton);
      case "determinize" -> describe(Determinizer.determinize(automaton));
      default -> throw new AutomatonException(ErrorKind.INVALID_ARGUMENT, "Unknown command: " + command);
    };
  }

  private static String runAll(Automaton automaton, List<String> inputs) {
    StringBuilder sb = new StringBuilder();
    // no input argument means the empty string
    List<String> all = inputs.isEmpty() ? List.of("") : inputs;
    for (String input : all) {
      SimulationResult result = Simulator.run(automaton, input);
      sb.append("Input '").append(input.isEmpty() ? Automaton.EPSILON : input).append("'\n");
      for (TraceStep step : result.getTrace()) {
        sb.append("  ").append(step).append('\n');
      }
      result.getError().ifPresent(kind -> sb.append("  ").append(kind).append('\n'));
      sb.append("  ").append(result.getMessage()).append('\n');
    }
    return sb.toString();
  }

  private static String check(Automaton automaton) {
    List<AutomatonValidator.Problem> problems = AutomatonValidator.validate(automaton);
    if (problems.isEmpty()) {
      return "Automaton is fully defined\n";
    }
    StringBuilder sb = new StringBuilder();
    for (AutomatonValidator.Problem p : problems) {
      sb.append(p.kind()).append(": ").append(p.message()).append('\n');
    }
    return sb.toString();
  }

  private static String describe(Automaton automaton) {
    return "Minimized DFA size: " + automaton.getStates().size() + "\n"
        + new NativeFormat().encode(automaton);
  }

  private static String stringArg(List<String> rest) {
    // an omitted string argument is the empty string
    return rest.isEmpty() ? "" : rest.get(0);
  }

  private static void requireArgs(List<String> rest, int count, String command) {
    if (rest.size() < count) {
      throw new AutomatonException(ErrorKind.INVALID_ARGUMENT,
          command + " needs " + count + " argument(s)");
    }
  }
}
