package com.phillippitts.pptxmerger.service.merge;

import com.phillippitts.pptxmerger.service.xml.OoxmlNamespaces;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Editable view over a presentation part ({@code ppt/presentation.xml}): its slide list and
 * slide master list.
 */
final class PresentationDocument {

    private static final String SLIDE_ID_LIST = "sldIdLst";
    private static final String SLIDE_ID = "sldId";
    private static final String MASTER_ID_LIST = "sldMasterIdLst";
    private static final String MASTER_ID = "sldMasterId";
    private static final String LAYOUT_ID = "sldLayoutId";

    // Children of p:presentation that precede p:sldIdLst in schema order.
    private static final Set<String> BEFORE_SLIDE_LIST = Set.of(MASTER_ID_LIST, "notesMasterIdLst", "handoutMasterIdLst");

    private final Document document;

    private PresentationDocument(Document document) {
        this.document = document;
    }

    static PresentationDocument of(Document document) {
        Objects.requireNonNull(document, "document must not be null");
        return new PresentationDocument(document);
    }

    /**
     * A slide list entry.
     *
     * @param id             numeric slide id
     * @param relationshipId id of the presentation relationship that points at the slide part
     */
    record SlideRef(long id, String relationshipId) {}

    Optional<Element> slideIdList() {
        return childElement(document.getDocumentElement(), SLIDE_ID_LIST);
    }

    /**
     * Returns the slide list, creating an empty one in its schema position if absent.
     */
    Element ensureSlideIdList() {
        Optional<Element> existing = slideIdList();
        if (existing.isPresent()) {
            return existing.get();
        }
        Element root = document.getDocumentElement();
        Element list = document.createElementNS(OoxmlNamespaces.PRESENTATIONML, qualified(SLIDE_ID_LIST));
        Node anchor = null;
        for (Node child = root.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child instanceof Element e && isPresentationMl(e) && BEFORE_SLIDE_LIST.contains(e.getLocalName())) {
                anchor = child;
            }
        }
        Node insertBefore = anchor != null ? nextElementOrNull(anchor) : firstElementOrNull(root);
        root.insertBefore(list, insertBefore);
        return list;
    }

    /**
     * @return slide list entries in display order; empty if there is no slide list
     */
    List<SlideRef> slideRefs() {
        List<SlideRef> refs = new ArrayList<>();
        slideIdList().ifPresent(list -> {
            for (Element entry : childElements(list, SLIDE_ID)) {
                refs.add(new SlideRef(parseId(entry.getAttribute("id"), 0L),
                        entry.getAttributeNS(OoxmlNamespaces.OFFICE_RELATIONSHIPS, "id")));
            }
        });
        return refs;
    }

    /**
     * @return highest slide id in the list, never below the reserved floor of 256
     */
    long maxSlideId() {
        long max = OoxmlNamespaces.MIN_SLIDE_ID;
        for (SlideRef ref : slideRefs()) {
            max = Math.max(max, ref.id());
        }
        return max;
    }

    void appendSlide(long id, String relationshipId) {
        Element list = ensureSlideIdList();
        Element entry = document.createElementNS(OoxmlNamespaces.PRESENTATIONML, qualified(SLIDE_ID));
        entry.setAttribute("id", Long.toString(id));
        entry.setAttributeNS(OoxmlNamespaces.OFFICE_RELATIONSHIPS, relationshipQualified("id"), relationshipId);
        list.appendChild(entry);
    }

    /**
     * @return highest slide master id in the master list, never below the reserved floor
     */
    long maxMasterId() {
        long max = OoxmlNamespaces.MIN_MASTER_ID;
        Optional<Element> list = childElement(document.getDocumentElement(), MASTER_ID_LIST);
        if (list.isPresent()) {
            for (Element entry : childElements(list.get(), MASTER_ID)) {
                max = Math.max(max, parseId(entry.getAttribute("id"), max));
            }
        }
        return max;
    }

    void appendMaster(long id, String relationshipId) {
        Element root = document.getDocumentElement();
        Element list = childElement(root, MASTER_ID_LIST).orElseGet(() -> {
            Element created = document.createElementNS(OoxmlNamespaces.PRESENTATIONML, qualified(MASTER_ID_LIST));
            root.insertBefore(created, firstElementOrNull(root));
            return created;
        });
        Element entry = document.createElementNS(OoxmlNamespaces.PRESENTATIONML, qualified(MASTER_ID));
        entry.setAttribute("id", Long.toString(id));
        entry.setAttributeNS(OoxmlNamespaces.OFFICE_RELATIONSHIPS, relationshipQualified("id"), relationshipId);
        list.appendChild(entry);
    }

    Document getDocument() {
        return document;
    }

    /**
     * @return the {@code p:sldLayoutId} entries of a slide master part, in document order
     */
    static List<Element> layoutIdEntries(Document slideMaster) {
        List<Element> result = new ArrayList<>();
        NodeList nodes = slideMaster.getElementsByTagNameNS(OoxmlNamespaces.PRESENTATIONML, LAYOUT_ID);
        for (int i = 0; i < nodes.getLength(); i++) {
            result.add((Element) nodes.item(i));
        }
        return result;
    }

    static long parseId(String value, long fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private String qualified(String localName) {
        String prefix = document.getDocumentElement().getPrefix();
        return prefix == null ? localName : prefix + ":" + localName;
    }

    private String relationshipQualified(String localName) {
        String prefix = document.getDocumentElement().lookupPrefix(OoxmlNamespaces.OFFICE_RELATIONSHIPS);
        return (prefix == null ? "r" : prefix) + ":" + localName;
    }

    private static boolean isPresentationMl(Element element) {
        return OoxmlNamespaces.PRESENTATIONML.equals(element.getNamespaceURI());
    }

    private static Optional<Element> childElement(Element parent, String localName) {
        List<Element> matches = childElements(parent, localName);
        return matches.isEmpty() ? Optional.empty() : Optional.of(matches.get(0));
    }

    private static List<Element> childElements(Element parent, String localName) {
        List<Element> result = new ArrayList<>();
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child instanceof Element e && isPresentationMl(e) && localName.equals(e.getLocalName())) {
                result.add(e);
            }
        }
        return result;
    }

    private static Node firstElementOrNull(Element parent) {
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child instanceof Element) {
                return child;
            }
        }
        return null;
    }

    private static Node nextElementOrNull(Node node) {
        for (Node sibling = node.getNextSibling(); sibling != null; sibling = sibling.getNextSibling()) {
            if (sibling instanceof Element) {
                return sibling;
            }
        }
        return null;
    }
}
