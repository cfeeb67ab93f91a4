package com.phillippitts.pptxmerger.cli;

import com.phillippitts.pptxmerger.exception.InvalidInputException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Interactive selection of the merge order: lists candidate files and reads a permutation of
 * their 1-based numbers, asking again until the answer names every file exactly once.
 */
class SlideOrderPrompt {

    private final BufferedReader in;
    private final PrintStream out;
    private final String extension;

    SlideOrderPrompt(BufferedReader in, PrintStream out, String extension) {
        this.in = in;
        this.out = out;
        this.extension = extension;
    }

    /**
     * @param candidates files to order, at least one
     * @return the candidates in the chosen order
     * @throws InvalidInputException if input ends before a valid order is entered
     */
    List<Path> choose(List<Path> candidates) {
        out.println();
        out.println("Found the following " + extension + " files:");
        out.println();
        for (int i = 0; i < candidates.size(); i++) {
            out.printf("  %d. %s%n", i + 1, candidates.get(i).getFileName());
        }
        out.println();
        out.println("Enter the desired order as space-separated numbers (e.g., 2 1 3):");

        while (true) {
            out.print("> ");
            out.flush();
            String line = readLine();
            if (line == null) {
                throw new InvalidInputException("No merge order entered");
            }
            Optional<List<Integer>> order = parsePermutation(line, candidates.size());
            if (order.isPresent()) {
                List<Path> ordered = new ArrayList<>();
                for (int index : order.get()) {
                    ordered.add(candidates.get(index - 1));
                }
                return ordered;
            }
            out.println("Invalid input. Please enter each file number exactly once, separated by spaces.");
        }
    }

    /**
     * Parses a space-separated permutation of {@code 1..size}.
     *
     * @return the numbers in entered order, or empty if the line is not such a permutation
     */
    static Optional<List<Integer>> parsePermutation(String line, int size) {
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        String[] tokens = trimmed.split("\\s+");
        if (tokens.length != size) {
            return Optional.empty();
        }
        boolean[] seen = new boolean[size + 1];
        List<Integer> result = new ArrayList<>();
        for (String token : tokens) {
            int value;
            try {
                value = Integer.parseInt(token);
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
            if (value < 1 || value > size || seen[value]) {
                return Optional.empty();
            }
            seen[value] = true;
            result.add(value);
        }
        return Optional.of(result);
    }

    private String readLine() {
        try {
            return in.readLine();
        } catch (IOException e) {
            throw new InvalidInputException("Cannot read merge order: " + e.getMessage());
        }
    }
}
