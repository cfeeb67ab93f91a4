/**
 * Command line surface: option parsing, input validation and the interactive order prompt.
 */
package com.phillippitts.pptxmerger.cli;
