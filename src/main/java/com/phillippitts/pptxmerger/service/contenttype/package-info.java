/**
 * Content-type manifest handling: idempotent override registration and additive,
 * first-writer-wins merging of extension defaults.
 *
 * @since 1.0
 */
package com.phillippitts.pptxmerger.service.contenttype;
