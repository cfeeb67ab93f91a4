package com.phillippitts.pptxmerger.service.xml;

/**
 * Namespace URIs, relationship types and fixed part names used by presentation packages.
 */
public final class OoxmlNamespaces {

    private OoxmlNamespaces() {}

    public static final String PRESENTATIONML = "http://schemas.openxmlformats.org/presentationml/2006/main";
    public static final String OFFICE_RELATIONSHIPS = "http://schemas.openxmlformats.org/officeDocument/2006/relationships";
    public static final String CONTENT_TYPES = "http://schemas.openxmlformats.org/package/2006/content-types";
    public static final String PACKAGE_RELATIONSHIPS = "http://schemas.openxmlformats.org/package/2006/relationships";

    public static final String REL_TYPE_OFFICE_DOCUMENT = OFFICE_RELATIONSHIPS + "/officeDocument";
    public static final String REL_TYPE_SLIDE = OFFICE_RELATIONSHIPS + "/slide";
    public static final String REL_TYPE_SLIDE_MASTER = OFFICE_RELATIONSHIPS + "/slideMaster";

    public static final String CONTENT_TYPES_PART = "[Content_Types].xml";
    public static final String ROOT_RELATIONSHIPS_PART = "_rels/.rels";
    public static final String DEFAULT_MAIN_PART = "ppt/presentation.xml";
    public static final String RELS_FOLDER = "_rels";
    public static final String RELS_EXTENSION = ".rels";

    /** Slide ids below this value are reserved by the file format. */
    public static final long MIN_SLIDE_ID = 256L;
    /** Slide master and layout ids start above this value. */
    public static final long MIN_MASTER_ID = 2_147_483_647L;
}
