package com.phillippitts.pptxmerger.service.contenttype;

import com.phillippitts.pptxmerger.service.xml.OoxmlNamespaces;
import com.phillippitts.pptxmerger.service.xml.XmlPartStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The content-type manifest ({@code [Content_Types].xml}) of one package.
 *
 * <p>Overrides map an exact part name to a type and may be added freely; registering the same
 * part name twice is a no-op. Defaults map a file extension to a type for the whole package, so
 * an extension that is already mapped is never remapped: the first mapping wins.
 */
public final class ContentTypeRegistry {

    private static final Logger LOG = LogManager.getLogger(ContentTypeRegistry.class);

    private static final String DEFAULT = "Default";
    private static final String OVERRIDE = "Override";

    private final Document document;
    private final Path location;

    private ContentTypeRegistry(Document document, Path location) {
        this.document = document;
        this.location = location;
    }

    /**
     * Loads the manifest at the root of an extracted package.
     *
     * @param store       part store used to parse the manifest
     * @param packageRoot root of the extracted package
     * @return registry bound to {@code packageRoot/[Content_Types].xml}
     */
    public static ContentTypeRegistry load(XmlPartStore store, Path packageRoot) {
        Path location = packageRoot.resolve(OoxmlNamespaces.CONTENT_TYPES_PART);
        return new ContentTypeRegistry(store.load(location), location);
    }

    /**
     * Adds an override for a part unless one already exists for that part name.
     *
     * @param partName    part name with leading slash, e.g. {@code /ppt/slides/slide3.xml}
     * @param contentType content type to register
     * @return true if an entry was added
     */
    public boolean registerOverride(String partName, String contentType) {
        if (overrideFor(partName).isPresent()) {
            return false;
        }
        Element element = document.createElementNS(OoxmlNamespaces.CONTENT_TYPES, OVERRIDE);
        element.setAttribute("PartName", partName);
        element.setAttribute("ContentType", contentType);
        document.getDocumentElement().appendChild(element);
        return true;
    }

    /**
     * Adds every default of {@code source} whose extension this manifest does not map yet.
     *
     * @param source manifest of the package being merged in
     * @return number of defaults added
     */
    public int mergeDefaults(ContentTypeRegistry source) {
        int added = 0;
        for (Element sourceDefault : source.elements(DEFAULT)) {
            String extension = sourceDefault.getAttribute("Extension");
            String contentType = sourceDefault.getAttribute("ContentType");
            Optional<String> existing = defaultFor(extension);
            if (existing.isEmpty()) {
                Element element = document.createElementNS(OoxmlNamespaces.CONTENT_TYPES, DEFAULT);
                element.setAttribute("Extension", extension);
                element.setAttribute("ContentType", contentType);
                insertDefault(element);
                added++;
            } else if (!existing.get().equals(contentType)) {
                LOG.warn("Keeping content type '{}' for extension '{}'; source package maps it to '{}'",
                        existing.get(), extension, contentType);
            }
        }
        return added;
    }

    public Optional<String> overrideFor(String partName) {
        for (Element element : elements(OVERRIDE)) {
            if (element.getAttribute("PartName").equalsIgnoreCase(partName)) {
                return Optional.of(element.getAttribute("ContentType"));
            }
        }
        return Optional.empty();
    }

    public Optional<String> defaultFor(String extension) {
        for (Element element : elements(DEFAULT)) {
            if (element.getAttribute("Extension").equalsIgnoreCase(extension)) {
                return Optional.of(element.getAttribute("ContentType"));
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves the type a reader would assign to a part: its override, else the default for its
     * extension.
     *
     * @param partName part name with leading slash
     * @return effective content type, empty if the manifest does not cover the part
     */
    public Optional<String> contentTypeOf(String partName) {
        Optional<String> override = overrideFor(partName);
        if (override.isPresent()) {
            return override;
        }
        int dot = partName.lastIndexOf('.');
        return dot >= 0 ? defaultFor(partName.substring(dot + 1)) : Optional.empty();
    }

    /**
     * @return true if the part has an override or its extension has a default
     */
    public boolean covers(String partName) {
        return contentTypeOf(partName).isPresent();
    }

    public void save(XmlPartStore store) {
        store.save(document, location);
    }

    public Document getDocument() {
        return document;
    }

    // Defaults conventionally precede overrides; keep new ones with the existing defaults.
    private void insertDefault(Element element) {
        List<Element> overrides = elements(OVERRIDE);
        Element root = document.getDocumentElement();
        if (overrides.isEmpty()) {
            root.appendChild(element);
        } else {
            root.insertBefore(element, overrides.get(0));
        }
    }

    private List<Element> elements(String localName) {
        NodeList nodes = document.getElementsByTagNameNS(OoxmlNamespaces.CONTENT_TYPES, localName);
        List<Element> result = new ArrayList<>(nodes.getLength());
        for (int i = 0; i < nodes.getLength(); i++) {
            result.add((Element) nodes.item(i));
        }
        return result;
    }

    @Override
    public String toString() {
        return "ContentTypeRegistry[" + location + ", defaults=" + elements(DEFAULT).size()
                + ", overrides=" + elements(OVERRIDE).size() + "]";
    }
}
