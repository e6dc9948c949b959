package com.openrangelabs.pmpulse.ingestion.notification;

import com.openrangelabs.pmpulse.ingestion.entity.SyncFailureAlert;
import com.openrangelabs.pmpulse.ingestion.entity.SyncRun;
import com.openrangelabs.pmpulse.ingestion.model.FailureDetail;

import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.UUID;

/**
 * Rendered failure alert, shared by every channel
 */
public record AlertMessage(UUID connectionId, int consecutiveFailures, String subject, String body,
                           List<String> recipients) {

    static final int RECENT_FAILURES_SHOWN = 3;

    private static final DateTimeFormatter STARTED_FORMAT = DateTimeFormatter.ofPattern("MMM d, yyyy h:mm a");

    public AlertMessage {
        recipients = recipients == null ? List.of() : List.copyOf(recipients);
    }

    public static AlertMessage forFailures(SyncFailureAlert alert, SyncRun lastRun, List<FailureDetail> details,
                                           List<String> recipients) {
        int failures = alert.getConsecutiveFailures();
        StringBuilder body = new StringBuilder()
                .append("The sync has failed ").append(failures).append(" consecutive times.\n\n");

        if (lastRun != null) {
            body.append("Last sync attempt:\n")
                    .append("Mode: ").append(lastRun.getMode()).append('\n');
            if (lastRun.getStartedAt() != null) {
                body.append("Started: ").append(lastRun.getStartedAt().format(STARTED_FORMAT)).append('\n');
            }
            if (lastRun.getErrorSummary() != null) {
                body.append("\nError summary:\n").append(lastRun.getErrorSummary()).append('\n');
            }
        }

        if (!details.isEmpty()) {
            body.append("\nRecent failures:\n");
            details.subList(Math.max(0, details.size() - RECENT_FAILURES_SHOWN), details.size())
                    .forEach(detail -> body.append("- ").append(detail.occurredAt()).append(": ")
                            .append(detail.error()).append('\n'));
        }

        body.append("\nAcknowledge the alert to stop further notifications until the next failure.");
        return new AlertMessage(alert.getConnectionId(), failures,
                failures + " Consecutive Sync Failures", body.toString(), recipients);
    }
}
