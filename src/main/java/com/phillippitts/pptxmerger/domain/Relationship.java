package com.phillippitts.pptxmerger.domain;

import java.util.Objects;

/**
 * A typed edge from an owning part (or the package root) to a target.
 *
 * @param id         locally scoped identifier, unique within the owner's relationship set (e.g. "rId3")
 * @param type       relationship type URI
 * @param target     target reference as written in the relationships part
 * @param targetMode "External" for external targets, null or "Internal" otherwise
 */
public record Relationship(String id, String type, String target, String targetMode) {

    public static final String EXTERNAL_MODE = "External";

    public Relationship {
        Objects.requireNonNull(id, "Relationship id must not be null");
    }

    /**
     * An internal target points at another part of the same package. External mode targets and
     * targets carrying a URI scheme ({@code http:}, {@code mailto:}, {@code file:}) are external.
     */
    public boolean isInternal() {
        if (target == null || target.isBlank()) {
            return false;
        }
        if (EXTERNAL_MODE.equalsIgnoreCase(targetMode)) {
            return false;
        }
        return !hasScheme(target);
    }

    private static boolean hasScheme(String target) {
        int colon = target.indexOf(':');
        if (colon <= 0) {
            return false;
        }
        int slash = target.indexOf('/');
        return slash < 0 || colon < slash;
    }
}
