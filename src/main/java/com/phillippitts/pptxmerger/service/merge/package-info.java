/**
 * Package merge orchestration: base package setup, per-input slide import, master registration
 * and final archiving.
 */
package com.phillippitts.pptxmerger.service.merge;
