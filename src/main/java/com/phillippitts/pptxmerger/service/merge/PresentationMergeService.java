package com.phillippitts.pptxmerger.service.merge;

import com.phillippitts.pptxmerger.config.logging.MdcScope;
import com.phillippitts.pptxmerger.config.properties.MergeProperties;
import com.phillippitts.pptxmerger.domain.MergeResult;
import com.phillippitts.pptxmerger.exception.InvalidInputException;
import com.phillippitts.pptxmerger.exception.MergeExceptionBuilder;
import com.phillippitts.pptxmerger.exception.PptxMergerException;
import com.phillippitts.pptxmerger.service.archive.PackageArchiver;
import com.phillippitts.pptxmerger.service.copy.DependencyCopier;
import com.phillippitts.pptxmerger.service.metrics.MergeMetrics;
import com.phillippitts.pptxmerger.service.xml.XmlPartStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Merges presentation packages into one.
 *
 * <p>The first input becomes the base package: its slides, masters and settings are kept as they
 * are. Slides of every further input are appended in their own list order, each carrying its own
 * copy of the layouts, masters, themes, charts, notes and media it references.
 *
 * <p>The service is stateless; per-call state lives in a {@link MergeSession} inside a private
 * scratch directory that is removed on every exit path.
 */
@Service
public class PresentationMergeService {

    private static final Logger LOG = LogManager.getLogger(PresentationMergeService.class);

    private final PackageArchiver archiver;
    private final XmlPartStore store;
    private final DependencyCopier copier;
    private final MergeMetrics metrics;
    private final MergeProperties properties;

    public PresentationMergeService(PackageArchiver archiver,
                                    XmlPartStore store,
                                    DependencyCopier copier,
                                    MergeMetrics metrics,
                                    MergeProperties properties) {
        this.archiver = archiver;
        this.store = store;
        this.copier = copier;
        this.metrics = metrics;
        this.properties = properties;
    }

    /**
     * Merges {@code inputs} in order and writes the result to {@code output}.
     *
     * @param inputs ordered presentation packages; the first one is the base
     * @param output file to write; replaced if it exists, untouched if the merge fails
     * @return summary of the merge
     * @throws InvalidInputException if no inputs are given
     * @throws PptxMergerException   if reading, copying or writing fails
     */
    public MergeResult merge(List<Path> inputs, Path output) {
        if (inputs == null || inputs.isEmpty()) {
            throw new InvalidInputException("At least one input package is required");
        }
        Objects.requireNonNull(output, "output must not be null");

        long start = System.nanoTime();
        try (MdcScope ignored = MdcScope.newMerge()) {
            LOG.info("Merging {} package(s) into {}", inputs.size(), output);
            try {
                MergeResult result = mergeInWorkDir(inputs, output, start);
                metrics.recordSuccess(result);
                LOG.info("Merged {} slide(s) from {} package(s) into {} in {} ms", result.totalSlides(),
                        inputs.size(), result.output(), result.elapsed().toMillis());
                return result;
            } catch (RuntimeException e) {
                metrics.recordFailure(System.nanoTime() - start, e);
                LOG.warn("Merge into {} failed: {}", output, e.getMessage());
                throw e;
            }
        }
    }

    private MergeResult mergeInWorkDir(List<Path> inputs, Path output, long start) {
        Path workDir = createWorkDir();
        try {
            MergeSession.Collaborators collaborators =
                    new MergeSession.Collaborators(archiver, store, copier, properties.isRegisterMasters());

            MergeSession session = openBase(collaborators, inputs.get(0), workDir);

            for (int i = 1; i < inputs.size(); i++) {
                Path input = inputs.get(i);
                int index = i;
                try (MdcScope ignored = MdcScope.put(MdcScope.SOURCE, input.getFileName().toString())) {
                    guard(input, () -> session.importSlides(input, index));
                }
            }

            return guard(output, () -> session.finish(output, Duration.ofNanos(System.nanoTime() - start)));
        } finally {
            deleteWorkDir(workDir);
        }
    }

    private static MergeSession openBase(MergeSession.Collaborators collaborators, Path base, Path workDir) {
        try (MdcScope ignored = MdcScope.put(MdcScope.SOURCE, base.getFileName().toString())) {
            return guard(base, () -> MergeSession.open(collaborators, base, workDir));
        }
    }

    /**
     * Runs one step for a source input, wrapping unexpected failures with the source's name.
     */
    private static <T> T guard(Path input, Supplier<T> step) {
        try {
            return step.get();
        } catch (PptxMergerException e) {
            throw e;
        } catch (RuntimeException e) {
            throw MergeExceptionBuilder.create("Unexpected failure while merging package")
                    .source(input.getFileName().toString())
                    .cause(e)
                    .build();
        }
    }

    private Path createWorkDir() {
        try {
            String tempDir = properties.getTempDir();
            if (tempDir != null && !tempDir.isBlank()) {
                return Files.createTempDirectory(Path.of(tempDir), properties.getWorkDirPrefix());
            }
            return Files.createTempDirectory(properties.getWorkDirPrefix());
        } catch (IOException e) {
            throw MergeExceptionBuilder.create("Cannot create scratch directory")
                    .metadata("prefix", properties.getWorkDirPrefix())
                    .cause(e)
                    .build();
        }
    }

    private static void deleteWorkDir(Path workDir) {
        try {
            FileSystemUtils.deleteRecursively(workDir);
        } catch (IOException e) {
            LOG.warn("Could not remove scratch directory {}: {}", workDir, e.toString());
        }
    }
}
