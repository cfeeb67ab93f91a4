package com.phillippitts.pptxmerger.service.naming;

import com.phillippitts.pptxmerger.domain.PartKind;
import com.phillippitts.pptxmerger.exception.MergeExceptionBuilder;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Picks collision-free file names for parts copied into a destination folder.
 *
 * <p>Numbered kinds continue the folder's sequence: with {@code slide1.xml} and {@code slide4.xml}
 * present the next slide is {@code slide5.xml}. Other parts keep their original name when it is
 * free and otherwise get a {@code _1}, {@code _2}, ... suffix before the extension.
 *
 * <p>The allocator only scans; it does not reserve. A name stays free until the caller creates the
 * file, which is safe because a merge runs on a single thread.
 */
@Component
public class PartNameAllocator {

    /**
     * @param destFolder       destination folder (may not exist yet)
     * @param kind             kind of the part being copied
     * @param originalFileName file name in the source package, used by {@link PartKind#OTHER}
     * @return a file name not present in {@code destFolder} at call time
     */
    public String nextName(Path destFolder, PartKind kind, String originalFileName) {
        Objects.requireNonNull(destFolder, "destFolder must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (kind.isNumbered()) {
            return kind.fileName(maxSequence(destFolder, kind) + 1);
        }
        Objects.requireNonNull(originalFileName, "originalFileName must not be null");
        return uniqueName(destFolder, originalFileName);
    }

    private int maxSequence(Path destFolder, PartKind kind) {
        if (!Files.isDirectory(destFolder)) {
            return 0;
        }
        try (Stream<Path> entries = Files.list(destFolder)) {
            return entries
                    .map(p -> p.getFileName().toString())
                    .mapToInt(kind::sequenceOf)
                    .filter(n -> n >= 0)
                    .max()
                    .orElse(0);
        } catch (IOException e) {
            throw MergeExceptionBuilder.create("Cannot scan destination folder")
                    .metadata("folder", destFolder)
                    .cause(e)
                    .build();
        }
    }

    private static String uniqueName(Path destFolder, String originalFileName) {
        if (!Files.exists(destFolder.resolve(originalFileName))) {
            return originalFileName;
        }
        int dot = originalFileName.lastIndexOf('.');
        String base = dot > 0 ? originalFileName.substring(0, dot) : originalFileName;
        String ext = dot > 0 ? originalFileName.substring(dot) : "";
        int i = 1;
        String candidate;
        do {
            candidate = base + "_" + i + ext;
            i++;
        } while (Files.exists(destFolder.resolve(candidate)));
        return candidate;
    }
}
