package com.edushield.audit.sink;

import com.edushield.audit.AuditRecord;
import java.io.Closeable;
import java.io.IOException;

/**
 * Destination for sanitized audit records.
 * <p>
 * Called only from the audit dispatcher thread. A failed {@link #write} may be retried
 * with the same record, so implementations must tolerate a repeated call after a throw.
 */
public interface AuditSink extends Closeable {

    /** Short name used in logs and metric tags. */
    String name();

    /**
     * Delivers one record.
     *
     * @throws IOException if the record could not be written
     */
    void write(AuditRecord record) throws IOException;

    @Override
    default void close() throws IOException {
        // nothing to release
    }
}
