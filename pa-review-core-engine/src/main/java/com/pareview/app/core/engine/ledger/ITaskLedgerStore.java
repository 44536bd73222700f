package com.pareview.app.core.engine.ledger;

import com.pareview.app.integration.enumerations.RunStatus;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Persistence for run ledgers.
 *
 * <p>Ledgers are keyed by run identifier and share nothing across runs, so no cross-run locking
 * is needed. Within a run every update goes through {@link #compareAndSave}: the write only
 * succeeds when the stored revision still equals the revision the caller read.</p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * store.findByRunId(runId)
 *     .flatMap(ledger -> store.compareAndSave(mutate(ledger), ledger.getRevision()));
 * }</pre>
 *
 * <p>Returned ledgers are detached copies; mutating them never affects the store.</p>
 */
public interface ITaskLedgerStore {

    Mono<Void> initialize();

    Mono<Void> shutdown();

    /**
     * Stores a new ledger at revision 0. Fails if a ledger already exists for the run.
     */
    Mono<TaskLedger> create(TaskLedger ledger);

    /**
     * @return the ledger, or empty if the run is unknown
     */
    Mono<TaskLedger> findByRunId(String runId);

    /**
     * Replaces the stored ledger if its revision equals {@code expectedRevision}.
     * The saved ledger carries revision {@code expectedRevision + 1}.
     *
     * @return the saved ledger, or an error of
     *         {@link com.pareview.app.core.exception.ConcurrentLedgerUpdateException} on a lost race
     */
    Mono<TaskLedger> compareAndSave(TaskLedger updated, long expectedRevision);

    Flux<TaskLedger> findAll();

    Flux<TaskLedger> findByStatus(RunStatus status);
}
