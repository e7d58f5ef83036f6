package com.e2eq.odata.batch;

import org.jboss.logging.Logger;

import java.util.List;

public class LoggingCompensationLog implements CompensationLog {
    private static final Logger LOG = Logger.getLogger(LoggingCompensationLog.class);

    @Override
    public void record(String changesetId, List<CompensationEntry> entries) {
        if (entries.isEmpty()) {
            LOG.warnf("Changeset %s failed on its first operation; nothing to compensate", changesetId);
            return;
        }
        LOG.warnf("Changeset %s failed; %d operation(s) would need compensation (not executed)",
                changesetId, entries.size());
        for (CompensationEntry entry : entries) {
            LOG.warnf("Changeset %s compensation: %s for operation %d (%s %s) entity=%s",
                    changesetId, entry.action(), entry.operationIndex(), entry.method(), entry.url(),
                    entry.entityId());
        }
    }
}
