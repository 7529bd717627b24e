package org.relaypad.app;

import org.relaypad.chain.core.ChainCore;
import org.relaypad.chain.cost.TransitionCostException;
import org.relaypad.complexity.CodeComplexityCalculator;
import org.relaypad.complexity.CodeSheetParser;
import org.relaypad.complexity.DoorCode;
import org.relaypad.core.id.SymbolIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Command-line entry point: prints door-code complexity totals.
 *
 * <pre>
 * Main &lt;code-file&gt; [depth...]
 * </pre>
 * Depths default to 3 and 26.
 */
public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int[] DEFAULT_DEPTHS = {3, 26};

    /**
     * Launches the complexity report.
     *
     * @param args code file path followed by optional depths.
     */
    public static void main(String[] args) {
        int status = run(args, System.out);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Runs the report against an output stream.
     *
     * @return process exit status.
     */
    static int run(String[] args, PrintStream out) {
        if (args.length == 0) {
            out.println("Usage: Main <code-file> [depth...]");
            return 2;
        }

        List<DoorCode> codes;
        int[] depths;
        try {
            codes = CodeSheetParser.parse(Files.readString(Path.of(args[0]), StandardCharsets.UTF_8));
            depths = parseDepths(args);
        } catch (IOException e) {
            log.error("Cannot read code file {}", args[0], e);
            return 1;
        } catch (IllegalArgumentException e) {
            log.error("Invalid input: {}", e.getMessage());
            return 1;
        }

        log.info("Loaded {} door codes from {}", codes.size(), args[0]);
        CodeComplexityCalculator calculator = new CodeComplexityCalculator(ChainCore.defaultCore());
        try {
            for (int depth : depths) {
                out.println("Sum of complexities at depth " + depth + ": " + calculator.totalComplexity(codes, depth));
            }
        } catch (TransitionCostException | SymbolIndex.UnknownSymbolException e) {
            log.error("Cannot compute complexity: {}", e.getMessage());
            return 1;
        }
        return 0;
    }

    private static int[] parseDepths(String[] args) {
        if (args.length == 1) {
            return DEFAULT_DEPTHS.clone();
        }
        int[] depths = new int[args.length - 1];
        for (int i = 1; i < args.length; i++) {
            depths[i - 1] = Integer.parseInt(args[i].trim());
            if (depths[i - 1] < 0) {
                throw new IllegalArgumentException("depth must be >= 0, got " + depths[i - 1]);
            }
        }
        return depths;
    }
}
