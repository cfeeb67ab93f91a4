package com.phillippitts.pptxmerger.service.xml;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Forward-slash path arithmetic for part names. Part paths are relative to the package's
 * content root (e.g. {@code slides/slide3.xml}) and never use host separators.
 */
public final class PartPaths {

    private static final String PARENT = "../";

    private PartPaths() {}

    /**
     * @return folder of the part, or "" for a part directly under the content root
     */
    public static String folderOf(String partPath) {
        int slash = partPath.lastIndexOf('/');
        return slash < 0 ? "" : partPath.substring(0, slash);
    }

    public static String fileNameOf(String partPath) {
        int slash = partPath.lastIndexOf('/');
        return slash < 0 ? partPath : partPath.substring(slash + 1);
    }

    public static String join(String folder, String fileName) {
        return folder.isEmpty() ? fileName : folder + "/" + fileName;
    }

    /**
     * @return path of the relationships part that belongs to the given part,
     *         e.g. {@code slides/_rels/slide3.xml.rels}
     */
    public static String relationshipsPathOf(String partPath) {
        String relsFile = fileNameOf(partPath) + OoxmlNamespaces.RELS_EXTENSION;
        return join(join(folderOf(partPath), OoxmlNamespaces.RELS_FOLDER), relsFile);
    }

    /**
     * Package part name of a content-root relative path, as used in {@code [Content_Types].xml}.
     *
     * @param contentRoot content root folder within the package, e.g. {@code ppt}
     * @param partPath    content-root relative path
     * @return part name with a leading slash, e.g. {@code /ppt/slides/slide3.xml}
     */
    public static String partName(String contentRoot, String partPath) {
        return "/" + join(contentRoot, partPath);
    }

    /**
     * Resolves an internal relationship target against the folder of the part that owns it.
     * Package-absolute targets ({@code /ppt/...}) are made relative to the content root first.
     * Leading parent markers left after normalization are stripped.
     *
     * @param contentRoot content root folder within the package
     * @param ownerFolder content-root relative folder of the owning part
     * @param target      target reference as written in the relationships part
     * @return normalized content-root relative path
     */
    public static String resolveTarget(String contentRoot, String ownerFolder, String target) {
        String path;
        if (target.startsWith("/")) {
            path = stripContentRoot(contentRoot, target);
        } else {
            path = join(ownerFolder, target);
        }
        String normalized = normalize(path);
        while (normalized.startsWith(PARENT)) {
            normalized = normalized.substring(PARENT.length());
        }
        return normalized;
    }

    /**
     * Converts a package-absolute reference ({@code /ppt/slides/slide1.xml}) to a content-root
     * relative one. Relative references are returned unchanged.
     */
    public static String stripContentRoot(String contentRoot, String target) {
        if (!target.startsWith("/")) {
            return target;
        }
        String withoutSlash = target.substring(1);
        String prefix = contentRoot.isEmpty() ? "" : contentRoot + "/";
        return withoutSlash.startsWith(prefix) ? withoutSlash.substring(prefix.length()) : withoutSlash;
    }

    /**
     * Relative reference from a folder to a part, both content-root relative.
     * {@code relativize("slides", "slideLayouts/slideLayout2.xml")} is
     * {@code ../slideLayouts/slideLayout2.xml}.
     */
    public static String relativize(String fromFolder, String toPath) {
        List<String> from = segments(fromFolder);
        List<String> to = segments(toPath);
        int common = 0;
        while (common < from.size() && common < to.size() - 1 && from.get(common).equals(to.get(common))) {
            common++;
        }
        StringBuilder sb = new StringBuilder();
        for (int i = common; i < from.size(); i++) {
            sb.append(PARENT);
        }
        sb.append(String.join("/", to.subList(common, to.size())));
        return sb.toString();
    }

    /**
     * Collapses "." and ".." segments. Parent markers that climb above the start are kept.
     */
    static String normalize(String path) {
        Deque<String> stack = new ArrayDeque<>();
        int leadingParents = 0;
        for (String segment : path.replace('\\', '/').split("/")) {
            if (segment.isEmpty() || ".".equals(segment)) {
                continue;
            }
            if ("..".equals(segment)) {
                if (stack.isEmpty()) {
                    leadingParents++;
                } else {
                    stack.removeLast();
                }
            } else {
                stack.addLast(segment);
            }
        }
        return PARENT.repeat(leadingParents) + String.join("/", stack);
    }

    private static List<String> segments(String path) {
        List<String> result = new ArrayList<>();
        for (String segment : path.split("/")) {
            if (!segment.isEmpty()) {
                result.add(segment);
            }
        }
        return result;
    }
}
