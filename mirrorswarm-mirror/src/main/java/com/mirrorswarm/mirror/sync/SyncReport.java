package com.mirrorswarm.mirror.sync;

import java.util.List;

/**
 * Result of a bulk sync: how many items succeeded, and a line per failure.
 */
public record SyncReport(int succeeded, List<String> failures) {

    public SyncReport {
        failures = List.copyOf(failures);
    }

    public String summary(String what) {
        StringBuilder sb = new StringBuilder("Synced ").append(succeeded).append(' ').append(what).append('.');
        if (!failures.isEmpty()) {
            sb.append(' ').append(failures.size()).append(" failed:");
            failures.forEach(f -> sb.append("\n- ").append(f));
        }
        return sb.toString();
    }
}
