package com.phillippitts.pptxmerger.cli;

import com.phillippitts.pptxmerger.config.properties.MergeProperties;
import com.phillippitts.pptxmerger.exception.InvalidInputException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Turns command line arguments into validated input paths, or lists candidate packages
 * in a folder for interactive selection.
 */
@Component
public class InputResolver {

    private final String extension;

    public InputResolver(MergeProperties properties) {
        this.extension = properties.getInputExtension().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves each argument against {@code workingDir} and validates it.
     *
     * @throws InvalidInputException if an input does not exist, is not a regular file or has the
     *                               wrong extension
     */
    public List<Path> resolve(List<String> arguments, Path workingDir) {
        List<Path> result = new ArrayList<>();
        for (String argument : arguments) {
            Path path;
            try {
                path = workingDir.resolve(argument).toAbsolutePath().normalize();
            } catch (InvalidPathException e) {
                throw new InvalidInputException(argument, "not a valid path");
            }
            if (!Files.exists(path)) {
                throw new InvalidInputException(argument, "file does not exist");
            }
            if (!Files.isRegularFile(path)) {
                throw new InvalidInputException(argument, "not a regular file");
            }
            if (!hasInputExtension(path)) {
                throw new InvalidInputException(argument, "expected a " + extension + " file");
            }
            result.add(path);
        }
        return result;
    }

    /**
     * Lists packages in {@code folder}, sorted by file name, leaving out {@code exclude}.
     *
     * @throws InvalidInputException if the folder cannot be listed
     */
    public List<Path> discover(Path folder, Path exclude) {
        Path excluded = exclude == null ? null : exclude.toAbsolutePath().normalize();
        try (Stream<Path> entries = Files.list(folder)) {
            return entries
                    .map(p -> p.toAbsolutePath().normalize())
                    .filter(Files::isRegularFile)
                    .filter(this::hasInputExtension)
                    .filter(p -> !p.equals(excluded))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            throw new InvalidInputException(folder.toString(), "cannot list folder: " + e.getMessage());
        }
    }

    boolean hasInputExtension(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(extension);
    }
}
