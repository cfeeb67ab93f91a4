/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions extend from a common unchecked base so the command layer can map them to
 * process exit codes in one place.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.pptxmerger.exception.PptxMergerException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.pptxmerger.exception.ArchiveReadException} - Input is not a
 *       readable zip package</li>
 *   <li>{@link com.phillippitts.pptxmerger.exception.ArchiveWriteException} - Output package or
 *       one of its parts cannot be written</li>
 *   <li>{@link com.phillippitts.pptxmerger.exception.PartParseException} - A manifest or
 *       presentation XML part is malformed</li>
 *   <li>{@link com.phillippitts.pptxmerger.exception.InvalidInputException} - Caller supplied no
 *       usable inputs (exit code 1)</li>
 *   <li>{@link com.phillippitts.pptxmerger.exception.MergeException} - Catch-all for unexpected
 *       failures during the copy/merge pass</li>
 * </ul>
 *
 * <p>A missing dependency part inside an otherwise valid package is not an error and never
 * raises one of these exceptions.
 *
 * @see com.phillippitts.pptxmerger.cli.MergeCommand
 * @since 1.0
 */
package com.phillippitts.pptxmerger.exception;
