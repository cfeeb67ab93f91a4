package com.phillippitts.pptxmerger.service.copy;

import com.phillippitts.pptxmerger.PresentationFixtures;
import com.phillippitts.pptxmerger.config.properties.MergeProperties;
import com.phillippitts.pptxmerger.domain.PartKind;
import com.phillippitts.pptxmerger.domain.Relationship;
import com.phillippitts.pptxmerger.service.archive.PackageArchiver;
import com.phillippitts.pptxmerger.service.contenttype.ContentTypeRegistry;
import com.phillippitts.pptxmerger.service.naming.PartNameAllocator;
import com.phillippitts.pptxmerger.service.xml.PartPaths;
import com.phillippitts.pptxmerger.service.xml.RelationshipsPart;
import com.phillippitts.pptxmerger.service.xml.XmlPartStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DependencyCopierTest {

    private final XmlPartStore store = new XmlPartStore();
    private final PackageArchiver archiver = new PackageArchiver(new MergeProperties());
    private final DependencyCopier copier = new DependencyCopier(new PartNameAllocator(), store, archiver);

    @TempDir
    Path tempDir;

    private Path baseRoot;
    private ContentTypeRegistry baseTypes;

    @BeforeEach
    void setUp() throws IOException {
        Path base = PresentationFixtures.deck().slides(3).layouts(2).textPrefix("Base")
                .write(tempDir.resolve("base.pptx"));
        archiver.extract(base, tempDir.resolve("base"));
        baseRoot = tempDir.resolve("base/ppt");
        baseTypes = ContentTypeRegistry.load(store, tempDir.resolve("base"));
    }

    @Test
    void copiesSlideWithWholeDependencyGraph() throws IOException {
        CopyContext context = contextFor(PresentationFixtures.deck().slides(1).chartOnSlide(1).imageOnSlide(1)
                .textPrefix("Src"));

        String dest = copier.copyWithDependencies(context, "slides/slide1.xml");

        assertThat(dest).isEqualTo("slides/slide4.xml");
        assertThat(context.nameMap()).containsEntry("slideLayouts/slideLayout1.xml", "slideLayouts/slideLayout3.xml")
                .containsEntry("slideMasters/slideMaster1.xml", "slideMasters/slideMaster2.xml")
                .containsEntry("theme/theme1.xml", "theme/theme2.xml")
                .containsEntry("charts/chart1.xml", "charts/chart1.xml")
                .containsEntry("charts/style1.xml", "charts/style1.xml")
                .containsEntry("embeddings/Microsoft_Excel_Worksheet1.xlsx", "embeddings/Microsoft_Excel_Worksheet1.xlsx")
                .containsEntry("media/image1.png", "media/image1.png");
        assertThat(baseRoot.resolve("slides/_rels/slide4.xml.rels")).isRegularFile();
        assertThat(baseRoot.resolve("slides/_rels/slide1.xml.rels")).isRegularFile();
    }

    @Test
    void rewritesTargetsRelativeToNewOwner() {
        CopyContext context = contextFor(PresentationFixtures.deck().slides(1).textPrefix("Src"));

        copier.copyWithDependencies(context, "slides/slide1.xml");

        assertThat(targets("slides/slide4.xml")).contains("../slideLayouts/slideLayout3.xml");
        assertThat(targets("slideLayouts/slideLayout3.xml")).containsExactly("../slideMasters/slideMaster2.xml");
        assertThat(targets("slideMasters/slideMaster2.xml"))
                .containsExactly("../slideLayouts/slideLayout3.xml", "../theme/theme2.xml");
    }

    @Test
    void baseRelationshipsAreUntouched() throws IOException {
        byte[] before = Files.readAllBytes(baseRoot.resolve("slides/_rels/slide1.xml.rels"));
        CopyContext context = contextFor(PresentationFixtures.deck().slides(1).textPrefix("Src"));

        copier.copyWithDependencies(context, "slides/slide1.xml");

        assertThat(Files.readAllBytes(baseRoot.resolve("slides/_rels/slide1.xml.rels"))).isEqualTo(before);
    }

    @Test
    void sharedDependencyIsCopiedOncePerSource() {
        CopyContext context = contextFor(PresentationFixtures.deck().slides(2).slideLayout(1, 1).slideLayout(2, 1)
                .textPrefix("Src"));

        String first = copier.copyWithDependencies(context, "slides/slide1.xml");
        String second = copier.copyWithDependencies(context, "slides/slide2.xml");

        assertThat(first).isEqualTo("slides/slide4.xml");
        assertThat(second).isEqualTo("slides/slide5.xml");
        assertThat(context.copiedOfKind(PartKind.SLIDE_LAYOUT)).containsExactly("slideLayouts/slideLayout3.xml");
        assertThat(context.copiedOfKind(PartKind.SLIDE_MASTER)).containsExactly("slideMasters/slideMaster2.xml");
    }

    @Test
    void copyingTheSamePartTwiceIsIdempotent() {
        CopyContext context = contextFor(PresentationFixtures.deck().slides(1).textPrefix("Src"));

        String first = copier.copyWithDependencies(context, "slides/slide1.xml");
        int copied = context.partsCopied();
        String again = copier.copyWithDependencies(context, "slides/slide1.xml");

        assertThat(again).isEqualTo(first);
        assertThat(context.partsCopied()).isEqualTo(copied);
    }

    @Test
    void cyclicReferencesTerminate() {
        CopyContext context = contextFor(PresentationFixtures.deck().slides(1).notesOnSlide(1).textPrefix("Src"));

        String dest = copier.copyWithDependencies(context, "slides/slide1.xml");

        assertThat(context.nameMap()).containsKey("notesSlides/notesSlide1.xml");
        String notes = context.mappedPath("notesSlides/notesSlide1.xml").orElseThrow();
        assertThat(targets(notes)).contains(PartPaths.relativize(PartPaths.folderOf(notes), dest));
    }

    @Test
    void externalTargetsAreLeftAlone() {
        CopyContext context = contextFor(PresentationFixtures.deck().slides(1).externalLinkOnSlide(1).textPrefix("Src"));

        String dest = copier.copyWithDependencies(context, "slides/slide1.xml");

        assertThat(targets(dest)).contains("https://example.com/Src");
    }

    @Test
    void missingDependencyIsSkippedAndTargetKept() {
        CopyContext context = contextFor(PresentationFixtures.deck().slides(1).danglingReferenceOnSlide(1)
                .textPrefix("Src"));

        String dest = copier.copyWithDependencies(context, "slides/slide1.xml");

        assertThat(context.partsSkipped()).isEqualTo(1);
        assertThat(context.isCopied("media/missing1.png")).isFalse();
        assertThat(targets(dest)).contains("../media/missing1.png");
    }

    @Test
    void missingPartIsReturnedUnchanged() {
        CopyContext context = contextFor(PresentationFixtures.deck().slides(1).textPrefix("Src"));

        String result = copier.copyWithDependencies(context, "slides/slide99.xml");

        assertThat(result).isEqualTo("slides/slide99.xml");
        assertThat(context.isCopied("slides/slide99.xml")).isFalse();
        assertThat(context.partsSkipped()).isEqualTo(1);
    }

    @Test
    void registersContentTypesForCopiedParts() {
        CopyContext context = contextFor(PresentationFixtures.deck().slides(1).chartOnSlide(1).textPrefix("Src"));

        copier.copyWithDependencies(context, "slides/slide1.xml");

        assertThat(baseTypes.overrideFor("/ppt/slides/slide4.xml")).hasValue(PresentationFixtures.CT_SLIDE);
        assertThat(baseTypes.overrideFor("/ppt/charts/chart1.xml")).hasValue(PresentationFixtures.CT_CHART);
        assertThat(baseTypes.overrideFor("/ppt/charts/style1.xml")).hasValue(PresentationFixtures.CT_CHART_STYLE);
        assertThat(baseTypes.defaultFor("xlsx")).hasValue(PresentationFixtures.CT_XLSX);
        assertThat(baseTypes.covers("/ppt/embeddings/Microsoft_Excel_Worksheet1.xlsx")).isTrue();
    }

    private CopyContext contextFor(PresentationFixtures.DeckBuilder source) {
        try {
            Path file = source.write(tempDir.resolve("source-" + System.nanoTime() + ".pptx"));
            Path tree = tempDir.resolve("src-" + System.nanoTime());
            archiver.extract(file, tree);
            return CopyContext.builder()
                    .sourceName(file.getFileName().toString())
                    .source(tree.resolve("ppt"), "ppt", ContentTypeRegistry.load(store, tree))
                    .destination(baseRoot, "ppt", baseTypes)
                    .build();
        } catch (IOException e) {
            throw new AssertionError(e);
        }
    }

    private List<String> targets(String partPath) {
        RelationshipsPart rels = RelationshipsPart.of(store.load(baseRoot.resolve(PartPaths.relationshipsPathOf(partPath))));
        return rels.list().stream().map(Relationship::target).toList();
    }
}
