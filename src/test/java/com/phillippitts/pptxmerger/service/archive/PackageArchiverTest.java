package com.phillippitts.pptxmerger.service.archive;

import com.phillippitts.pptxmerger.PackageInspector;
import com.phillippitts.pptxmerger.PresentationFixtures;
import com.phillippitts.pptxmerger.config.properties.MergeProperties;
import com.phillippitts.pptxmerger.exception.ArchiveReadException;
import com.phillippitts.pptxmerger.exception.ArchiveWriteException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PackageArchiverTest {

    private final PackageArchiver archiver = new PackageArchiver(new MergeProperties());

    @TempDir
    Path tempDir;

    @Test
    void extractsEveryEntryPreservingPaths() throws IOException {
        Path deck = PresentationFixtures.deck().slides(2).write(tempDir.resolve("deck.pptx"));

        int files = archiver.extract(deck, tempDir.resolve("tree"));

        assertThat(files).isEqualTo(PackageInspector.open(deck).entryNames().size());
        assertThat(tempDir.resolve("tree/ppt/slides/slide2.xml")).isRegularFile();
        assertThat(tempDir.resolve("tree/ppt/slides/_rels/slide1.xml.rels")).isRegularFile();
        assertThat(tempDir.resolve("tree/[Content_Types].xml")).isRegularFile();
    }

    @Test
    void archivePutsContentTypesFirstAndUsesForwardSlashes() throws IOException {
        Path tree = tempDir.resolve("tree");
        Files.createDirectories(tree.resolve("ppt/slides"));
        Files.writeString(tree.resolve("ppt/slides/slide1.xml"), "<a/>");
        Files.createDirectories(tree.resolve("_rels"));
        Files.writeString(tree.resolve("_rels/.rels"), "<b/>");
        Files.writeString(tree.resolve("[Content_Types].xml"), "<Types/>");

        Path out = tempDir.resolve("out.pptx");
        int entries = archiver.archive(tree, out);

        assertThat(entries).isEqualTo(3);
        assertThat(PackageInspector.open(out).entryNames())
                .containsExactly("[Content_Types].xml", "_rels/.rels", "ppt/slides/slide1.xml");
    }

    @Test
    void roundTripPreservesBytes() throws IOException {
        Path deck = PresentationFixtures.deck().slides(1).imageOnSlide(1).write(tempDir.resolve("deck.pptx"));
        archiver.extract(deck, tempDir.resolve("tree"));
        Path copy = tempDir.resolve("copy.pptx");

        archiver.archive(tempDir.resolve("tree"), copy);

        PackageInspector original = PackageInspector.open(deck);
        PackageInspector rebuilt = PackageInspector.open(copy);
        assertThat(rebuilt.entryNames()).containsExactlyInAnyOrderElementsOf(original.entryNames());
        assertThat(rebuilt.bytes("ppt/media/image1.png")).isEqualTo(original.bytes("ppt/media/image1.png"));
    }

    @Test
    void nonZipInputRaisesArchiveReadException() throws IOException {
        Path notZip = tempDir.resolve("fake.pptx");
        Files.writeString(notZip, "this is not a zip archive", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> archiver.extract(notZip, tempDir.resolve("tree")))
                .isInstanceOf(ArchiveReadException.class)
                .hasMessageContaining("fake.pptx");
    }

    @Test
    void missingInputRaisesArchiveReadException() {
        assertThatThrownBy(() -> archiver.extract(tempDir.resolve("absent.pptx"), tempDir.resolve("tree")))
                .isInstanceOf(ArchiveReadException.class);
    }

    @Test
    void entryEscapingTheRootIsRejected() throws IOException {
        Path evil = tempDir.resolve("evil.pptx");
        try (OutputStream out = Files.newOutputStream(evil); ZipOutputStream zip = new ZipOutputStream(out)) {
            zip.putNextEntry(new ZipEntry("../outside.xml"));
            zip.write("<x/>".getBytes(StandardCharsets.UTF_8));
            zip.closeEntry();
        }

        assertThatThrownBy(() -> archiver.extract(evil, tempDir.resolve("tree")))
                .isInstanceOf(ArchiveReadException.class)
                .hasMessageContaining("escapes");
        assertThat(tempDir.resolve("outside.xml")).doesNotExist();
    }

    @Test
    void copyPartNeverOverwrites() throws IOException {
        Path source = tempDir.resolve("a.xml");
        Path dest = tempDir.resolve("out/b.xml");
        Files.writeString(source, "<a/>");

        archiver.copyPart(source, dest);

        assertThat(dest).hasContent("<a/>");
        assertThatThrownBy(() -> archiver.copyPart(source, dest)).isInstanceOf(ArchiveWriteException.class);
    }
}
