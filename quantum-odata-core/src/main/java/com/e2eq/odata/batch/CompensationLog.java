package com.e2eq.odata.batch;

import java.util.List;

/**
 * Receives the compensation intents of a failed changeset. Entries arrive in reverse execution
 * order. Implementations record them; they are never executed against the data engine.
 */
public interface CompensationLog {
    void record(String changesetId, List<CompensationEntry> entries);
}
