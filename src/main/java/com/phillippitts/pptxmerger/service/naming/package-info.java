/**
 * Destination file-name allocation for copied parts.
 *
 * @since 1.0
 */
package com.phillippitts.pptxmerger.service.naming;
