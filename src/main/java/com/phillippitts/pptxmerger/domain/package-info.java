/**
 * Domain types of the presentation merge: part kinds, relationships and merge results.
 *
 * @since 1.0
 */
package com.phillippitts.pptxmerger.domain;
