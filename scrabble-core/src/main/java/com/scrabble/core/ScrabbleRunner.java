package com.scrabble.core;

import com.scrabble.core.gaddag.Gaddag;
import com.scrabble.core.gaddag.GaddagBuilder;
import com.scrabble.core.gaddag.GaddagCodec;
import com.scrabble.core.movegen.GaddagMoveGenerator;
import com.scrabble.core.movegen.GenerationConstraints;
import com.scrabble.core.movegen.GenerationResult;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line entry point. {@code build} compiles a word list into a serialized GADDAG and
 * {@code moves} lists the plays available to a rack, best first.
 */
public final class ScrabbleRunner {

    private static final Logger LOGGER = Logger.getLogger(ScrabbleRunner.class.getName());

    static final String GADDAG_SUFFIX = ".gaddag";

    private ScrabbleRunner() {
    }

    public static void main(String[] args) {
        run(args, System.out);
    }

    /**
     * Runs one command, printing its output to {@code out}.
     *
     * @return {@code true} if the command completed
     */
    static boolean run(String[] args, PrintStream out) {
        if (args.length == 0) {
            printUsage();
            return false;
        }
        try {
            switch (args[0]) {
                case "build":
                    if (args.length != 3) {
                        printUsage();
                        return false;
                    }
                    build(Paths.get(args[1]), Paths.get(args[2]), out);
                    return true;
                case "moves":
                    if (args.length < 3) {
                        printUsage();
                        return false;
                    }
                    moves(args, out);
                    return true;
                default:
                    printUsage();
                    return false;
            }
        } catch (NumberFormatException ex) {
            LOGGER.log(Level.SEVERE, "Failed to parse arguments", ex);
            printUsage();
        } catch (CancellationException ex) {
            LOGGER.log(Level.WARNING, "Move generation cancelled: " + ex.getMessage(), ex);
        } catch (IllegalArgumentException | UncheckedIOException ex) {
            LOGGER.log(Level.SEVERE, ex.getMessage(), ex);
        }
        return false;
    }

    private static void build(Path wordList, Path target, PrintStream out) {
        Gaddag gaddag = GaddagBuilder.build(readWords(wordList));
        byte[] bytes = GaddagCodec.serialize(gaddag);
        try {
            Files.write(target, bytes);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write " + target, ex);
        }
        out.printf("Wrote %d nodes (%d bytes) to %s%n", gaddag.nodeCount(), bytes.length, target);
    }

    private static void moves(String[] args, PrintStream out) {
        Path dictionary = Paths.get(args[1]);
        Rack rack = Rack.of(args[2]);
        Path boardPath = null;
        boolean parallel = false;
        int moveLimit = 0;
        long timeMillis = 0L;
        int top = 0;

        for (int index = 3; index < args.length; index++) {
            String option = args[index];
            if ("--parallel".equals(option)) {
                parallel = true;
            } else if (option.startsWith("--limit=")) {
                moveLimit = Integer.parseInt(option.substring("--limit=".length()));
            } else if (option.startsWith("--timeMillis=")) {
                timeMillis = Long.parseLong(option.substring("--timeMillis=".length()));
            } else if (option.startsWith("--top=")) {
                top = Integer.parseInt(option.substring("--top=".length()));
            } else if (boardPath == null && !option.startsWith("--")) {
                boardPath = Paths.get(option);
            } else {
                throw new IllegalArgumentException("Unrecognised argument: " + option);
            }
        }
        if (timeMillis < 0L || top < 0) {
            throw new IllegalArgumentException("timeMillis and top must be non-negative");
        }

        Gaddag gaddag = loadDictionary(dictionary);
        Board board = boardPath == null ? new Board() : Board.parse(readLines(boardPath));
        GenerationConstraints constraints = new GenerationConstraints(moveLimit, Duration.ofMillis(timeMillis),
                parallel ? GenerationConstraints.Mode.PAR : GenerationConstraints.Mode.SEQ);

        GenerationResult result = new GaddagMoveGenerator(gaddag).generate(board, rack, constraints);
        List<Move> moves = new ArrayList<>(result.moves());
        moves.sort(Comparator.comparingInt(Move::score).reversed().thenComparing(Move::toString));
        int shown = top == 0 ? moves.size() : Math.min(top, moves.size());
        for (int i = 0; i < shown; i++) {
            out.println(moves.get(i));
        }
        out.printf("%d moves from %d anchors in %.2f ms%n", moves.size(), result.anchorsSearched(),
                result.elapsedMillis());
    }

    static Gaddag loadDictionary(Path path) {
        if (path.getFileName() != null && path.getFileName().toString().endsWith(GADDAG_SUFFIX)) {
            try {
                return GaddagCodec.deserialize(Files.readAllBytes(path));
            } catch (IOException ex) {
                throw new UncheckedIOException("Failed to read " + path, ex);
            }
        }
        return GaddagBuilder.build(readWords(path));
    }

    private static List<String> readWords(Path path) {
        List<String> words = new ArrayList<>();
        for (String line : readLines(path)) {
            String word = line.trim();
            if (!word.isEmpty()) {
                words.add(word);
            }
        }
        LOGGER.info(() -> String.format("Read %d words from %s", words.size(), path));
        return words;
    }

    private static List<String> readLines(Path path) {
        try {
            return Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read " + path, ex);
        }
    }

    private static void printUsage() {
        System.err.println("Usage: ScrabbleRunner build <wordList> <out.gaddag>");
        System.err.println("       ScrabbleRunner moves <wordList|dict.gaddag> <rack> [boardFile] [--parallel] "
                + "[--limit=<moves>] [--timeMillis=<value>] [--top=<count>]");
    }
}
