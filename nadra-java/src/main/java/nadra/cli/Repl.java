package nadra.cli;

import nadra.NadraException;
import nadra.Transpiler;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;

/**
 * Interactive session: every line read is translated on its own and printed.
 * A failing line reports its error and the session carries on.
 */
public final class Repl {

    static final String PROMPT = "expr > ";
    static final String QUIT = ".quit";

    private final Transpiler transpiler;
    private final BufferedReader in;
    private final PrintStream out;
    private final PrintStream err;

    public Repl(Transpiler transpiler, BufferedReader in, PrintStream out, PrintStream err) {
        this.transpiler = transpiler;
        this.in = in;
        this.out = out;
        this.err = err;
    }

    /** Returns the number of lines that failed to translate. */
    public int run() throws IOException {
        int failures = 0;
        while (true) {
            out.print(PROMPT);
            out.flush();

            String line = in.readLine();
            if (line == null || line.trim().equals(QUIT)) break;
            if (line.isBlank()) continue;

            try {
                out.println(transpiler.transpile(line.trim()));
            } catch (NadraException e) {
                err.println(e.getMessage());
                failures++;
            }
        }
        return failures;
    }
}
