package nadra.cli;

import nadra.NadraException;
import nadra.Transpiler;
import nadra.codegen.PythonGenerator;
import nadra.lexer.TokenStream;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public final class Main {

    static final String USAGE = "Usage: nadra [--indent N] [--verbose] [-o output.py] [input.nadra]";

    private Main() {}

    public static void main(String[] args) throws Exception {
        System.exit(run(args, System.in, System.out, System.err));
    }

    /** Exit status: 0 ok, 1 translation or I/O failure, 2 bad usage. */
    static int run(String[] args, InputStream stdin, PrintStream out, PrintStream err) {
        Path input = null;
        Path output = null;
        String indent = PythonGenerator.DEFAULT_INDENT;
        boolean verbose = false;

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "--verbose", "-v" -> verbose = true;
                case "--indent" -> {
                    if (++i >= args.length) return usage(err, "--indent needs a value");
                    try {
                        int n = Integer.parseInt(args[i]);
                        if (n <= 0) return usage(err, "--indent must be positive");
                        indent = " ".repeat(n);
                    } catch (NumberFormatException e) {
                        return usage(err, "--indent expects a number, got '" + args[i] + "'");
                    }
                }
                case "-o", "--output" -> {
                    if (++i >= args.length) return usage(err, a + " needs a path");
                    output = Path.of(args[i]);
                }
                default -> {
                    if (a.startsWith("-") || input != null) return usage(err, "Unexpected argument: " + a);
                    input = Path.of(a);
                }
            }
        }

        Transpiler transpiler = new Transpiler(indent);

        if (input == null) {
            var reader = new BufferedReader(new InputStreamReader(stdin, StandardCharsets.UTF_8));
            try {
                new Repl(transpiler, reader, out, err).run();
                return 0;
            } catch (IOException e) {
                err.println("Error reading input: " + e.getMessage());
                return 1;
            }
        }

        try {
            // 1. Reading
            String source = Files.readString(input, StandardCharsets.UTF_8);
            if (verbose) err.println("[1/4] Reading: " + input);

            // 2. Lexer
            TokenStream tokens = Transpiler.tokenize(source);
            if (verbose) err.println("[2/4] Lexer: " + tokens.size() + " tokens");

            // 3. Parser
            var program = Transpiler.parse(tokens);
            if (verbose) err.println("[3/4] Parser: " + program.size() + " top-level statements");

            // 4. Python
            String python = new PythonGenerator(indent).generateProgram(program);
            if (verbose) err.println("[4/4] Generator: " + python.lines().count() + " lines");

            if (output == null) {
                out.println(python);
            } else {
                Files.writeString(output, python + "\n", StandardCharsets.UTF_8);
                if (verbose) err.println("Wrote " + output);
            }
            return 0;
        } catch (NadraException e) {
            err.println(input + ": " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            return 1;
        }
    }

    private static int usage(PrintStream err, String problem) {
        err.println(problem);
        err.println(USAGE);
        return 2;
    }
}
