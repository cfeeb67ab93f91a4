package com.phillippitts.pptxmerger.cli;

import com.phillippitts.pptxmerger.config.properties.MergeProperties;
import com.phillippitts.pptxmerger.exception.InvalidInputException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InputResolverTest {

    private final InputResolver resolver = new InputResolver(new MergeProperties());

    @TempDir
    Path tempDir;

    @Test
    void resolvesRelativeInputsAgainstWorkingDir() throws IOException {
        Files.createFile(tempDir.resolve("b.pptx"));
        Files.createFile(tempDir.resolve("A.PPTX"));

        List<Path> inputs = resolver.resolve(List.of("b.pptx", "A.PPTX"), tempDir);

        assertThat(inputs).containsExactly(tempDir.resolve("b.pptx").toAbsolutePath(),
                tempDir.resolve("A.PPTX").toAbsolutePath());
    }

    @Test
    void rejectsMissingFile() {
        assertThatThrownBy(() -> resolver.resolve(List.of("absent.pptx"), tempDir))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("absent.pptx")
                .hasMessageContaining("does not exist");
    }

    @Test
    void rejectsWrongExtension() throws IOException {
        Files.createFile(tempDir.resolve("notes.docx"));

        assertThatThrownBy(() -> resolver.resolve(List.of("notes.docx"), tempDir))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining(".pptx");
    }

    @Test
    void rejectsDirectory() throws IOException {
        Files.createDirectory(tempDir.resolve("folder.pptx"));

        assertThatThrownBy(() -> resolver.resolve(List.of("folder.pptx"), tempDir))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("not a regular file");
    }

    @Test
    void discoverListsPackagesSortedAndSkipsOutput() throws IOException {
        Files.createFile(tempDir.resolve("c.pptx"));
        Files.createFile(tempDir.resolve("a.pptx"));
        Files.createFile(tempDir.resolve("merged.pptx"));
        Files.createFile(tempDir.resolve("readme.txt"));
        Files.createDirectory(tempDir.resolve("dir.pptx"));

        List<Path> found = resolver.discover(tempDir, tempDir.resolve("merged.pptx"));

        assertThat(found).extracting(p -> p.getFileName().toString()).containsExactly("a.pptx", "c.pptx");
    }
}
