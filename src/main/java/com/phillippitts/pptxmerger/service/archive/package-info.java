/**
 * Archive I/O: extraction of package archives into working trees and re-archiving of the merged
 * tree.
 *
 * @since 1.0
 */
package com.phillippitts.pptxmerger.service.archive;
