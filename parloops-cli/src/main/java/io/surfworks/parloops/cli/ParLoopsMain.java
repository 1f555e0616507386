package io.surfworks.parloops.cli;

import io.surfworks.parloops.config.AttributePolicy;
import io.surfworks.parloops.config.DilationPolicy;
import io.surfworks.parloops.config.LoweringConfigLoader;
import io.surfworks.parloops.config.LoweringOptions;
import io.surfworks.parloops.diag.Diagnostic;
import io.surfworks.parloops.dialect.IrVerifier;
import io.surfworks.parloops.ir.Module;
import io.surfworks.parloops.lowering.LegalizeToParallelLoopsPass;
import io.surfworks.parloops.lowering.LoweringPasses;
import io.surfworks.parloops.pass.PassContext;
import io.surfworks.parloops.pass.PassManager;
import io.surfworks.parloops.pass.PassRegistry;
import io.surfworks.parloops.pass.PassResult;
import io.surfworks.parloops.pass.PipelineResult;
import io.surfworks.parloops.text.IrParseException;
import io.surfworks.parloops.text.IrParser;
import io.surfworks.parloops.text.IrPrinter;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public final class ParLoopsMain {

    static final String EXAMPLE = """
        module @example {
          func.func @row_sum(%input: memref<2x3xf32>, %init: memref<f32>, %out: memref<2xf32>) {
            "lhlo.reduce"(%input, %init, %out) ({
            ^bb0(%lhs: memref<f32>, %rhs: memref<f32>, %res: memref<f32>):
              "lhlo.add"(%lhs, %rhs, %res) : (memref<f32>, memref<f32>, memref<f32>) -> ()
              "lhlo.terminator"() : () -> ()
            }) {dimensions = dense<[1]>} : (memref<2x3xf32>, memref<f32>, memref<2xf32>) -> ()
            "std.return"() : () -> ()
          }
          func.func @max_pool(%input: memref<4x4xf32>, %init: memref<f32>, %out: memref<2x2xf32>) {
            "lhlo.reduce_window"(%input, %init, %out) ({
            ^bb0(%lhs: memref<f32>, %rhs: memref<f32>, %res: memref<f32>):
              "lhlo.maximum"(%lhs, %rhs, %res) : (memref<f32>, memref<f32>, memref<f32>) -> ()
              "lhlo.terminator"() : () -> ()
            }) {window_dimensions = dense<[2, 2]>, window_strides = dense<[2, 2]>, padding = dense<[[0, 0], [0, 0]]>} : (memref<4x4xf32>, memref<f32>, memref<2x2xf32>) -> ()
            "std.return"() : () -> ()
          }
        }
        """;

    private ParLoopsMain() {
    }

    public static void main(String[] args) {
        int code = run(args, System.out, System.err);
        if (code != 0) {
            System.exit(code);
        }
    }

    /**
     * Runs one command and returns the process exit code.
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length == 0) {
            printUsage(out);
            return 1;
        }

        String command = args[0];
        switch (command) {
            case "--help", "-h" -> {
                printUsage(out);
                return 0;
            }
            case "--lower" -> {
                return runLower(args, out, err);
            }
            case "--example" -> {
                out.println("=== Input ===");
                out.println(EXAMPLE);
                return lower(EXAMPLE, "<example>", LoweringOptions.defaults(), null, out, err);
            }
            case "--list-passes" -> {
                for (PassRegistry.Registration registration : LoweringPasses.defaultRegistry().registrations()) {
                    out.printf("  %-36s %s%n", registration.name(), registration.description());
                }
                return 0;
            }
            default -> {
                err.println("Unknown command: " + command);
                printUsage(err);
                return 1;
            }
        }
    }

    private static void printUsage(PrintStream out) {
        out.println("ParLoops CLI - LHLO to parallel loop lowering");
        out.println();
        out.println("Usage: parloops <command> [options]");
        out.println();
        out.println("Commands:");
        out.println("  --lower FILE             Lower lhlo.reduce and lhlo.reduce_window in FILE");
        out.println("  --example                Lower a built-in row-sum and max-pool example");
        out.println("  --list-passes            List registered passes");
        out.println("  --help, -h               Print this help message");
        out.println();
        out.println("Options for --lower:");
        out.println("  --config FILE            Read lowering options from a JSON file");
        out.println("  --strict-attributes      Refuse reduce_window ops without strides or padding");
        out.println("  --reject-dilation        Refuse reduce_window ops with dilation attributes");
        out.println("  --output FILE            Write the lowered IR to FILE instead of stdout");
    }

    private static int runLower(String[] args, PrintStream out, PrintStream err) {
        if (args.length < 2 || args[1].startsWith("--")) {
            err.println("Error: --lower requires a FILE argument");
            return 1;
        }
        Path inputPath = Path.of(args[1]);
        Path configPath = null;
        Path outputPath = null;
        boolean strictAttributes = false;
        boolean rejectDilation = false;

        for (int i = 2; i < args.length; i++) {
            switch (args[i]) {
                case "--config", "--output" -> {
                    if (i + 1 >= args.length) {
                        err.println("Error: " + args[i] + " requires a FILE argument");
                        return 1;
                    }
                    Path path = Path.of(args[i + 1]);
                    if (args[i].equals("--config")) {
                        configPath = path;
                    } else {
                        outputPath = path;
                    }
                    i++;
                }
                case "--strict-attributes" -> strictAttributes = true;
                case "--reject-dilation" -> rejectDilation = true;
                default -> {
                    err.println("Unknown option: " + args[i]);
                    return 1;
                }
            }
        }

        if (!Files.exists(inputPath)) {
            err.println("Error: File not found: " + inputPath);
            return 1;
        }

        LoweringOptions options;
        try {
            options = configPath != null ? LoweringConfigLoader.load(configPath) : LoweringConfigLoader.load();
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
        if (strictAttributes) {
            options = options.withAttributePolicy(AttributePolicy.STRICT);
        }
        if (rejectDilation) {
            options = options.withDilationPolicy(DilationPolicy.REJECT);
        }

        try {
            String text = Files.readString(inputPath);
            return lower(text, inputPath.toString(), options, outputPath, out, err);
        } catch (IOException e) {
            err.println("Error reading file: " + e.getMessage());
            return 1;
        }
    }

    private static int lower(String text, String sourceName, LoweringOptions options, Path outputPath,
                             PrintStream out, PrintStream err) {
        Module module;
        try {
            module = IrParser.parse(text, sourceName);
        } catch (IrParseException e) {
            err.println("Error parsing " + sourceName + ": " + e.getMessage());
            return 1;
        }

        List<String> errors = new IrVerifier().validate(module);
        if (!errors.isEmpty()) {
            err.println("Input verification failed:");
            for (String error : errors) {
                err.println("  - " + error);
            }
            return 1;
        }

        PassManager pm = new PassManager()
                .addPass(LoweringPasses.defaultRegistry().create(LegalizeToParallelLoopsPass.NAME, options))
                .enableVerifier(options.verifyAfterLowering());
        PassContext context = new PassContext();
        PipelineResult result = pm.run(module, context);

        for (Diagnostic diagnostic : context.diagnostics().diagnostics()) {
            err.println(diagnostic);
        }
        if (!result.succeeded()) {
            List<String> failures = new ArrayList<>();
            for (PassResult failure : result.failures()) {
                failures.add("@" + failure.functionName() + ": " + failure.message());
            }
            err.println("Lowering failed:");
            failures.forEach(f -> err.println("  - " + f));
            return 1;
        }

        String lowered = IrPrinter.print(module);
        if (outputPath == null) {
            out.print(lowered);
            return 0;
        }
        try {
            Files.writeString(outputPath, lowered);
        } catch (IOException e) {
            err.println("Error writing " + outputPath + ": " + e.getMessage());
            return 1;
        }
        out.println("Lowered " + result.totalRewrites() + " op(s) into " + outputPath);
        return 0;
    }
}
