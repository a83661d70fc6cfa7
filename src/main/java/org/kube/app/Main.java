package org.kube.app;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.kube.core.algebra.Turn;
import org.kube.core.id.TurnMapper;
import org.kube.solving.core.SolveCore;
import org.kube.solving.core.SolveCoreException;
import org.kube.solving.core.SolveRequest;
import org.kube.solving.core.SolveResponse;

import java.io.PrintStream;
import java.util.List;

/**
 * Command-line entry point: solves the scramble given as arguments.
 *
 * <p>Arguments are joined and parsed as one scramble, so {@code F R u}, {@code "F,R,u"} and
 * {@code FRu} are equivalent. The solution is printed on one line, followed by the turn count.</p>
 */
public class Main {
    static final int EXIT_OK = 0;
    static final int EXIT_INVALID_INPUT = 2;
    static final int EXIT_SOLVE_FAILED = 3;

    private static final Logger log = LogManager.getLogger(Main.class);

    /**
     * Launches the solver CLI.
     *
     * @param args scramble symbols.
     */
    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    /**
     * Runs one CLI invocation against the given streams.
     *
     * @return process exit status.
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        return run(args, out, err, SolveCore.builder().build());
    }

    static int run(String[] args, PrintStream out, PrintStream err, SolveCore solver) {
        TurnMapper mapper = TurnMapper.standard();
        List<Turn> scramble;
        try {
            scramble = mapper.parse(String.join(" ", args));
        } catch (TurnMapper.UnknownTokenException ex) {
            err.println("[" + SolveCore.REASON_INVALID_TOKEN + "] " + ex.getMessage());
            return EXIT_INVALID_INPUT;
        }

        try {
            SolveResponse response = solver.solve(SolveRequest.builder()
                    .scrambleTokens(mapper.toSymbols(scramble))
                    .build());
            out.println(String.join(" ", response.getSolutionTokens()));
            out.println("turns: " + response.getTurnCount());
            return EXIT_OK;
        } catch (SolveCoreException ex) {
            log.debug("solve failed for scramble of {} turns", scramble.size(), ex);
            err.println(ex.getMessage());
            return EXIT_SOLVE_FAILED;
        }
    }
}
