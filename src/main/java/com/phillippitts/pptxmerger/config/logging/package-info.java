/**
 * Logging context helpers.
 */
package com.phillippitts.pptxmerger.config.logging;
