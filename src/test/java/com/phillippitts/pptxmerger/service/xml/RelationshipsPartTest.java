package com.phillippitts.pptxmerger.service.xml;

import com.phillippitts.pptxmerger.domain.Relationship;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RelationshipsPartTest {

    private static final String SLIDE_LAYOUT = OoxmlNamespaces.OFFICE_RELATIONSHIPS + "/slideLayout";
    private static final String HYPERLINK = OoxmlNamespaces.OFFICE_RELATIONSHIPS + "/hyperlink";

    private final XmlPartStore store = new XmlPartStore();
    private RelationshipsPart rels;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() throws IOException {
        Path file = tempDir.resolve("slide1.xml.rels");
        Files.writeString(file, "<Relationships xmlns=\"" + OoxmlNamespaces.PACKAGE_RELATIONSHIPS + "\">"
                + "<Relationship Id=\"rId1\" Type=\"" + SLIDE_LAYOUT + "\" Target=\"../slideLayouts/slideLayout1.xml\"/>"
                + "<Relationship Id=\"rId7\" Type=\"" + OoxmlNamespaces.REL_TYPE_SLIDE + "\" Target=\"slides/slide1.xml\"/>"
                + "<Relationship Id=\"rIdLink\" Type=\"" + HYPERLINK + "\" Target=\"https://example.com\" TargetMode=\"External\"/>"
                + "</Relationships>", StandardCharsets.UTF_8);
        rels = RelationshipsPart.of(store.load(file));
    }

    @Test
    void listsRelationshipsInDocumentOrder() {
        List<Relationship> all = rels.list();

        assertThat(all).extracting(Relationship::id).containsExactly("rId1", "rId7", "rIdLink");
        assertThat(all.get(2).targetMode()).isEqualTo("External");
        assertThat(all.get(2).isInternal()).isFalse();
    }

    @Test
    void filtersByType() {
        assertThat(rels.ofType(OoxmlNamespaces.REL_TYPE_SLIDE))
                .extracting(Relationship::target)
                .containsExactly("slides/slide1.xml");
    }

    @Test
    void nextIdIsAboveHighestNumericId() {
        assertThat(rels.nextId()).isEqualTo("rId8");
    }

    @Test
    void addAllocatesFreshIds() {
        Relationship first = rels.add(OoxmlNamespaces.REL_TYPE_SLIDE, "slides/slide2.xml");
        Relationship second = rels.add(OoxmlNamespaces.REL_TYPE_SLIDE, "slides/slide3.xml");

        assertThat(first.id()).isEqualTo("rId8");
        assertThat(second.id()).isEqualTo("rId9");
        assertThat(rels.find("rId9")).hasValueSatisfying(r -> assertThat(r.target()).isEqualTo("slides/slide3.xml"));
    }

    @Test
    void setTargetRewritesExistingRelationship() {
        rels.setTarget("rId1", "../slideLayouts/slideLayout12.xml");

        assertThat(rels.find("rId1")).hasValueSatisfying(
                r -> assertThat(r.target()).isEqualTo("../slideLayouts/slideLayout12.xml"));
    }

    @Test
    void setTargetRejectsUnknownId() {
        assertThatThrownBy(() -> rels.setTarget("rId99", "x.xml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("rId99");
    }
}
