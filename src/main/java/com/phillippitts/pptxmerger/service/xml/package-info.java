/**
 * XML part store: DOM parsing and serialization of package parts, relationships parts and
 * forward-slash part path arithmetic.
 *
 * <p>Binary parts (media, embedded workbooks) never pass through this package; they are copied
 * byte-for-byte by {@link com.phillippitts.pptxmerger.service.archive.PackageArchiver}.
 *
 * @since 1.0
 */
package com.phillippitts.pptxmerger.service.xml;
