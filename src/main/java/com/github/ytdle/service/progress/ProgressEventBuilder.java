package com.github.ytdle.service.progress;

import com.github.ytdle.model.JobSnapshot;
import com.github.ytdle.model.JobStatus;
import com.github.ytdle.model.ProgressUpdate;
import lombok.NonNull;
import org.springframework.stereotype.Component;

/**
 * Builder for constructing ProgressUpdate events from job state.
 * Centralizes the status messages shown to consumers.
 */
@Component
public class ProgressEventBuilder {

    /**
     * Lifecycle event for a job that changed status.
     *
     * @param snapshot Job state after the change
     * @param detail Optional extra text (retry reason, failure cause)
     * @return ProgressUpdate event
     */
    public ProgressUpdate buildStatusChange(@NonNull JobSnapshot snapshot, String detail) {
        return ProgressUpdate.forSnapshot(snapshot, buildMessage(snapshot, detail));
    }

    /**
     * Transfer progress reported by the fetch adapter, stamped with the job's identity.
     *
     * @param snapshot Job state with the progress applied
     * @param reported Update as parsed from the tool output
     * @return ProgressUpdate event
     */
    public ProgressUpdate buildTransferProgress(@NonNull JobSnapshot snapshot, @NonNull ProgressUpdate reported) {
        return ProgressUpdate.forSnapshot(snapshot, reported.getMessage());
    }

    private String buildMessage(JobSnapshot snapshot, String detail) {
        String base = snapshot.getStatus() == JobStatus.QUEUED && snapshot.getAttempts() > 0
                ? "Queued for attempt " + (snapshot.getAttempts() + 1)
                : snapshot.getStatus().getDisplayName();
        return detail == null || detail.isBlank() ? base : base + ": " + detail;
    }
}
