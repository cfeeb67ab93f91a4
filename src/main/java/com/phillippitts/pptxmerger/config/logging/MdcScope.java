package com.phillippitts.pptxmerger.config.logging;

import org.apache.logging.log4j.ThreadContext;

import java.util.UUID;

/**
 * Puts a value into Log4j2's MDC (ThreadContext) for the duration of a try-with-resources block.
 *
 * <p>Keys used by the merge engine:</p>
 * <ul>
 *   <li>{@value #MERGE_ID}: generated id of one merge call</li>
 *   <li>{@value #SOURCE}: file name of the input currently being merged</li>
 * </ul>
 *
 * <p>On close the previous value of the key is restored (or the key removed), so nested scopes
 * for the same key behave correctly.</p>
 */
public final class MdcScope implements AutoCloseable {

    public static final String MERGE_ID = "mergeId";
    public static final String SOURCE = "source";

    private final String key;
    private final String previous;

    private MdcScope(String key, String value) {
        this.key = key;
        this.previous = ThreadContext.get(key);
        ThreadContext.put(key, value);
    }

    public static MdcScope put(String key, String value) {
        return new MdcScope(key, value);
    }

    /**
     * Opens a scope carrying a freshly generated merge id.
     */
    public static MdcScope newMerge() {
        return new MdcScope(MERGE_ID, UUID.randomUUID().toString().substring(0, 8));
    }

    @Override
    public void close() {
        if (previous == null) {
            ThreadContext.remove(key);
        } else {
            ThreadContext.put(key, previous);
        }
    }
}
