package com.phillippitts.pptxmerger.service.contenttype;

import com.phillippitts.pptxmerger.service.xml.XmlPartStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ContentTypeRegistryTest {

    private static final String NS = "http://schemas.openxmlformats.org/package/2006/content-types";
    private static final String SLIDE = "application/vnd.openxmlformats-officedocument.presentationml.slide+xml";

    private final XmlPartStore store = new XmlPartStore();

    @TempDir
    Path tempDir;

    @Test
    void readsDefaultsAndOverrides() throws IOException {
        ContentTypeRegistry registry = registry("base", "<Default Extension=\"png\" ContentType=\"image/png\"/>"
                + "<Override PartName=\"/ppt/slides/slide1.xml\" ContentType=\"" + SLIDE + "\"/>");

        assertThat(registry.defaultFor("PNG")).hasValue("image/png");
        assertThat(registry.overrideFor("/ppt/slides/slide1.xml")).hasValue(SLIDE);
        assertThat(registry.covers("/ppt/media/image9.png")).isTrue();
        assertThat(registry.covers("/ppt/media/clip.wav")).isFalse();
    }

    @Test
    void contentTypeOfPrefersOverrideOverDefault() throws IOException {
        ContentTypeRegistry registry = registry("base", "<Default Extension=\"xml\" ContentType=\"application/xml\"/>"
                + "<Override PartName=\"/ppt/slides/slide1.xml\" ContentType=\"" + SLIDE + "\"/>");

        assertThat(registry.contentTypeOf("/PPT/Slides/Slide1.xml")).hasValue(SLIDE);
        assertThat(registry.contentTypeOf("/ppt/diagrams/data1.xml")).hasValue("application/xml");
        assertThat(registry.contentTypeOf("/ppt/media/clip.wav")).isEmpty();
        assertThat(registry.contentTypeOf("/ppt/media/noextension")).isEmpty();
    }

    @Test
    void registerOverrideIsIdempotent() throws IOException {
        ContentTypeRegistry registry = registry("base", "");

        assertThat(registry.registerOverride("/ppt/slides/slide2.xml", SLIDE)).isTrue();
        assertThat(registry.registerOverride("/ppt/slides/slide2.xml", SLIDE)).isFalse();
        assertThat(registry.getDocument().getElementsByTagNameNS(NS, "Override").getLength()).isEqualTo(1);
    }

    @Test
    void mergeDefaultsAddsOnlyMissingExtensions() throws IOException {
        ContentTypeRegistry base = registry("base", "<Default Extension=\"xml\" ContentType=\"application/xml\"/>"
                + "<Override PartName=\"/ppt/presentation.xml\" ContentType=\"x\"/>");
        ContentTypeRegistry source = registry("source", "<Default Extension=\"xml\" ContentType=\"application/xml\"/>"
                + "<Default Extension=\"xlsx\" ContentType=\"application/vnd.openxmlformats-officedocument.spreadsheetml.sheet\"/>");

        int added = base.mergeDefaults(source);

        assertThat(added).isEqualTo(1);
        assertThat(base.defaultFor("xlsx")).isPresent();
        assertThat(base.getDocument().getElementsByTagNameNS(NS, "Default").getLength()).isEqualTo(2);
        // new defaults are placed ahead of the overrides
        assertThat(base.getDocument().getDocumentElement().getLastChild().getLocalName()).isEqualTo("Override");
    }

    @Test
    void conflictingDefaultKeepsFirstMapping() throws IOException {
        ContentTypeRegistry base = registry("base", "<Default Extension=\"png\" ContentType=\"image/png\"/>");
        ContentTypeRegistry source = registry("source", "<Default Extension=\"png\" ContentType=\"image/x-png\"/>");

        int added = base.mergeDefaults(source);

        assertThat(added).isZero();
        assertThat(base.defaultFor("png")).hasValue("image/png");
    }

    @Test
    void savesBackToPackageRoot() throws IOException {
        ContentTypeRegistry registry = registry("base", "");
        registry.registerOverride("/ppt/charts/chart1.xml", "chart");

        registry.save(store);

        assertThat(ContentTypeRegistry.load(store, tempDir.resolve("base")).overrideFor("/ppt/charts/chart1.xml"))
                .hasValue("chart");
    }

    private ContentTypeRegistry registry(String folder, String entries) throws IOException {
        Path root = Files.createDirectories(tempDir.resolve(folder));
        Files.writeString(root.resolve("[Content_Types].xml"),
                "<?xml version=\"1.0\" encoding=\"UTF-8\"?><Types xmlns=\"" + NS + "\">" + entries + "</Types>",
                StandardCharsets.UTF_8);
        return ContentTypeRegistry.load(store, root);
    }
}
