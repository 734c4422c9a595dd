package com.vaultwave.backend.download;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Hands newly created jobs to the packaging pool once the creating transaction has committed,
 * so the worker never looks for a row that is not visible yet.
 */
@Component
@Slf4j
public class DownloadJobDispatcher {

    private final DownloadPackagingWorker worker;
    private final TaskExecutor packagingExecutor;

    public DownloadJobDispatcher(DownloadPackagingWorker worker,
                                 @Qualifier("packagingExecutor") TaskExecutor packagingExecutor) {
        this.worker = worker;
        this.packagingExecutor = packagingExecutor;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onJobRequested(DownloadJobRequestedEvent event) {
        Long jobId = event.jobId();
        try {
            packagingExecutor.execute(() -> worker.execute(jobId));
            log.debug("Dispatched download job {}", jobId);
        } catch (TaskRejectedException e) {
            log.warn("Packaging pool rejected download job {}: {}", jobId, e.getMessage());
            worker.markRejected(jobId);
        }
    }
}
