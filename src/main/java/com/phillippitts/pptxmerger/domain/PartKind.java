package com.phillippitts.pptxmerger.domain;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Known kinds of presentation parts, each with its folder under the content root, its
 * numbered file-name convention and the content type registered as an override for it.
 *
 * <p>{@link #OTHER} covers media, embeddings, diagrams, chart styles and anything else without a
 * numbered convention; those keep their original file name where possible and get their
 * content type from the source package.
 */
public enum PartKind {

    SLIDE("slides", "slide",
            "application/vnd.openxmlformats-officedocument.presentationml.slide+xml"),
    SLIDE_LAYOUT("slideLayouts", "slideLayout",
            "application/vnd.openxmlformats-officedocument.presentationml.slideLayout+xml"),
    SLIDE_MASTER("slideMasters", "slideMaster",
            "application/vnd.openxmlformats-officedocument.presentationml.slideMaster+xml"),
    CHART("charts", "chart",
            "application/vnd.openxmlformats-officedocument.drawingml.chart+xml"),
    THEME("theme", "theme",
            "application/vnd.openxmlformats-officedocument.theme+xml"),
    NOTES_SLIDE("notesSlides", "notesSlide",
            "application/vnd.openxmlformats-officedocument.presentationml.notesSlide+xml"),
    NOTES_MASTER("notesMasters", "notesMaster",
            "application/vnd.openxmlformats-officedocument.presentationml.notesMaster+xml"),
    HANDOUT_MASTER("handoutMasters", "handoutMaster",
            "application/vnd.openxmlformats-officedocument.presentationml.handoutMaster+xml"),
    OTHER(null, null, null);

    private final String folder;
    private final String filePrefix;
    private final String contentType;
    private final Pattern fileNamePattern;

    PartKind(String folder, String filePrefix, String contentType) {
        this.folder = folder;
        this.filePrefix = filePrefix;
        this.contentType = contentType;
        this.fileNamePattern = filePrefix == null ? null : Pattern.compile(Pattern.quote(filePrefix) + "(\\d+)\\.xml");
    }

    /**
     * Classifies a part by its folder and file name. Both must match a numbered kind; a file in a
     * known folder that does not follow the kind's naming (for example {@code charts/style1.xml})
     * is {@link #OTHER}.
     *
     * @param folder   content-root relative folder, e.g. {@code slides}
     * @param fileName file name, e.g. {@code slide3.xml}
     * @return matching kind, never null
     */
    public static PartKind classify(String folder, String fileName) {
        for (PartKind kind : values()) {
            if (kind.isNumbered() && kind.folder.equals(folder) && kind.fileNamePattern.matcher(fileName).matches()) {
                return kind;
            }
        }
        return OTHER;
    }

    /**
     * Extracts the numeric suffix from a file name following this kind's convention.
     *
     * @return the number, or -1 when the name does not follow the convention
     */
    public int sequenceOf(String fileName) {
        if (!isNumbered()) {
            return -1;
        }
        Matcher m = fileNamePattern.matcher(fileName);
        if (!m.matches()) {
            return -1;
        }
        try {
            return Integer.parseInt(m.group(1));
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    /**
     * @return file name for the given sequence number, e.g. {@code slideLayout12.xml}
     */
    public String fileName(int sequence) {
        if (!isNumbered()) {
            throw new IllegalStateException(name() + " has no numbered naming convention");
        }
        return filePrefix + sequence + ".xml";
    }

    public boolean isNumbered() {
        return filePrefix != null;
    }

    public String getFolder() {
        return folder;
    }

    /**
     * @return override content type, or null for {@link #OTHER}
     */
    public String getContentType() {
        return contentType;
    }
}
