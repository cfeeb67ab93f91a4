package com.phillippitts.pptxmerger.service.xml;

import com.phillippitts.pptxmerger.domain.Relationship;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Editable view over a relationships part ({@code *.rels}).
 *
 * <p>Tracks the highest numeric {@code rIdN} identifier so that {@link #add(String, String)}
 * always allocates an id unused within this owner's set. Ids that do not follow the
 * {@code rIdN} form are left alone and never reused.
 */
public final class RelationshipsPart {

    private static final String RELATIONSHIP = "Relationship";
    private static final String ID_PREFIX = "rId";
    private static final Pattern NUMERIC_ID = Pattern.compile(ID_PREFIX + "(\\d{1,9})");

    private final Document document;
    private int maxNumericId;

    private RelationshipsPart(Document document) {
        this.document = document;
        this.maxNumericId = scanMaxNumericId();
    }

    public static RelationshipsPart of(Document document) {
        Objects.requireNonNull(document, "document must not be null");
        return new RelationshipsPart(document);
    }

    public List<Relationship> list() {
        List<Relationship> result = new ArrayList<>();
        for (Element element : elements()) {
            result.add(toRelationship(element));
        }
        return result;
    }

    public List<Relationship> ofType(String type) {
        return list().stream().filter(r -> type.equals(r.type())).toList();
    }

    public Optional<Relationship> find(String id) {
        return findElement(id).map(RelationshipsPart::toRelationship);
    }

    /**
     * @return the next unused identifier: {@code rId} + (highest numeric suffix + 1)
     */
    public String nextId() {
        return ID_PREFIX + (maxNumericId + 1);
    }

    /**
     * Appends an internal relationship with a freshly allocated id.
     *
     * @param type   relationship type URI
     * @param target target reference relative to the owning part's folder
     * @return the added relationship
     */
    public Relationship add(String type, String target) {
        String id = nextId();
        Element element = document.createElementNS(OoxmlNamespaces.PACKAGE_RELATIONSHIPS, RELATIONSHIP);
        element.setAttribute("Id", id);
        element.setAttribute("Type", type);
        element.setAttribute("Target", target);
        document.getDocumentElement().appendChild(element);
        maxNumericId++;
        return toRelationship(element);
    }

    /**
     * Rewrites the target of an existing relationship.
     *
     * @throws IllegalArgumentException if no relationship has this id
     */
    public void setTarget(String id, String target) {
        Element element = findElement(id)
                .orElseThrow(() -> new IllegalArgumentException("No relationship with id " + id));
        element.setAttribute("Target", target);
    }

    public Document getDocument() {
        return document;
    }

    private Optional<Element> findElement(String id) {
        for (Element element : elements()) {
            if (id.equals(element.getAttribute("Id"))) {
                return Optional.of(element);
            }
        }
        return Optional.empty();
    }

    private List<Element> elements() {
        NodeList nodes = document.getElementsByTagNameNS(OoxmlNamespaces.PACKAGE_RELATIONSHIPS, RELATIONSHIP);
        List<Element> result = new ArrayList<>(nodes.getLength());
        for (int i = 0; i < nodes.getLength(); i++) {
            result.add((Element) nodes.item(i));
        }
        return result;
    }

    private int scanMaxNumericId() {
        int max = 0;
        for (Element element : elements()) {
            Matcher m = NUMERIC_ID.matcher(element.getAttribute("Id"));
            if (m.matches()) {
                max = Math.max(max, Integer.parseInt(m.group(1)));
            }
        }
        return max;
    }

    private static Relationship toRelationship(Element element) {
        String mode = element.hasAttribute("TargetMode") ? element.getAttribute("TargetMode") : null;
        return new Relationship(
                element.getAttribute("Id"),
                element.getAttribute("Type"),
                element.getAttribute("Target"),
                mode);
    }
}
