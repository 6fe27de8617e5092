package org.dxworks.notebookdeps;

import org.dxworks.notebookdeps.model.AnalysisResult;
import org.dxworks.notebookdeps.model.BatchFailure;
import org.dxworks.notebookdeps.model.BatchOutcome;
import org.dxworks.notebookdeps.model.Block;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

public class App {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        Path[] paths = parseArgs(args);
        if (paths == null) {
            System.err.println("Usage: java -jar notebookdeps.jar --input <notebook.json> --output <result.json>");
            System.err.println("   or: java -jar notebookdeps.jar <notebook.json> <result.json>");
            System.err.println("  <notebook.json>: {\"blocks\": [...]} as exported by the notebook loader");
            System.err.println("  <result.json>:   per-block defined/used variables and imported modules");
            System.exit(EXIT_USAGE);
        }
        System.exit(run(paths[0], paths[1], NotebookDepsConfig.load()));
    }

    static Path[] parseArgs(String[] args) {
        String input = null;
        String output = null;
        if (args.length == 2 && !args[0].startsWith("--") && !args[1].startsWith("--")) {
            input = args[0];
            output = args[1];
        } else if (args.length == 4) {
            for (int i = 0; i < args.length; i += 2) {
                switch (args[i]) {
                    case "--input" -> input = args[i + 1];
                    case "--output" -> output = args[i + 1];
                    default -> {
                        return null;
                    }
                }
            }
        }
        if (input == null || output == null) {
            return null;
        }
        return new Path[]{Paths.get(input), Paths.get(output)};
    }

    public static int run(Path input, Path output, NotebookDepsConfig config) {
        System.out.println("Starting notebook analysis...");
        System.out.println("Input: " + input.toAbsolutePath());

        Instant startTime = Instant.now();
        BatchAnalyzer batchAnalyzer = new BatchAnalyzer(config);
        BatchOutcome outcome;
        try {
            String json = Files.readString(input, StandardCharsets.UTF_8);
            List<Block> blocks = BatchAnalyzer.readBlocks(json);
            System.out.println("Found " + blocks.size() + " blocks");
            outcome = batchAnalyzer.analyze(blocks);
        } catch (IOException | RuntimeException e) {
            outcome = BatchOutcome.failure(BatchFailure.of(e));
        }

        try {
            if (output.getParent() != null) {
                Files.createDirectories(output.getParent());
            }
            Files.writeString(output, batchAnalyzer.writeJson(outcome), StandardCharsets.UTF_8);
        } catch (IOException e) {
            System.err.println("Failed to write " + output + ": " + e.getMessage());
            return EXIT_FAILURE;
        }

        if (!outcome.isSuccess()) {
            System.err.println("Error: " + outcome.getFailure().errorMessage);
            return EXIT_FAILURE;
        }

        int errorCount = 0;
        for (AnalysisResult result : outcome.getResults()) {
            if (result.hasError()) {
                errorCount++;
                System.err.println("  Error analyzing block " + result.id + ": "
                        + result.error.type + ": " + result.error.message);
            }
        }

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Analysis complete!");
        System.out.println("Analyzed blocks: " + outcome.getResults().size());
        if (errorCount > 0) {
            System.out.println("Blocks with errors: " + errorCount);
        }
        System.out.println("Duration: " + Duration.between(startTime, Instant.now()).toMillis() + " ms");
        System.out.println("Output written to: " + output.toAbsolutePath());
        System.out.println("=".repeat(60));
        return EXIT_OK;
    }
}
