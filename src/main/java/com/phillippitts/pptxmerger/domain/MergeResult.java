package com.phillippitts.pptxmerger.domain;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Immutable summary of a completed merge.
 *
 * @param output         path of the written package
 * @param totalSlides    number of entries in the merged slide list
 * @param inputs         per-input contribution, in merge order
 * @param partsCopied    parts copied into the base package (slides and all dependencies)
 * @param partsSkipped   dependency references skipped because the part was missing in its source
 * @param elapsed        wall-clock duration of the merge
 */
public record MergeResult(
        Path output,
        int totalSlides,
        List<InputSummary> inputs,
        int partsCopied,
        int partsSkipped,
        Duration elapsed
) {

    public MergeResult {
        Objects.requireNonNull(output, "Output path must not be null");
        inputs = List.copyOf(inputs);
        Objects.requireNonNull(elapsed, "Elapsed duration must not be null");
    }

    /**
     * Contribution of one input package.
     *
     * @param fileName       input file name
     * @param slidesImported slides taken from this input (for the base input, its original count)
     * @param base           true for the first input, whose package becomes the output
     */
    public record InputSummary(String fileName, int slidesImported, boolean base) {}
}
