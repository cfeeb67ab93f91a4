/**
 * Dependency copier: recursive copy of a part's relationship graph from a source package into
 * the base package, with per-source deduplication through {@link
 * com.phillippitts.pptxmerger.service.copy.CopyContext}.
 *
 * @since 1.0
 */
package com.phillippitts.pptxmerger.service.copy;
