package com.pareview.app.core.engine.ledger.impl;

import com.pareview.app.core.engine.ledger.ITaskLedgerStore;
import com.pareview.app.core.engine.ledger.TaskLedger;
import com.pareview.app.core.engine.misc.ReviewObjectMapper;
import com.pareview.app.core.exception.ConcurrentLedgerUpdateException;
import com.pareview.app.core.exception.LedgerInvariantViolationException;
import com.pareview.app.core.exception.RunNotFoundException;
import com.pareview.app.core.exception.codes.PaReviewInternalErrorCodes;
import com.pareview.app.integration.enumerations.RunStatus;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory ledger store. Ledgers are kept as serialized documents so callers only ever see copies.
 *
 * <p>Suitable for tests and single-process runs; contents are lost on shutdown.</p>
 */
@Slf4j
public class InMemoryTaskLedgerStore implements ITaskLedgerStore {

    private final Map<String, byte[]> ledgers = new ConcurrentHashMap<>();
    private final ReviewObjectMapper mapper = ReviewObjectMapper.getInstance();

    @Override
    public Mono<Void> initialize() {
        return Mono.fromRunnable(() -> log.info("In-memory task ledger store initialized"));
    }

    @Override
    public Mono<Void> shutdown() {
        return Mono.fromRunnable(() -> {
            log.info("In-memory task ledger store shutting down, discarding {} ledgers", ledgers.size());
            ledgers.clear();
        });
    }

    @Override
    public Mono<TaskLedger> create(TaskLedger ledger) {
        return Mono.fromCallable(() -> {
            ledger.validateInvariants();
            TaskLedger initial = ledger.toBuilder().revision(0).build();
            byte[] document = mapper.writeValueAsBytes(initial);
            if (ledgers.putIfAbsent(initial.getRunId(), document) != null) {
                throw new LedgerInvariantViolationException(PaReviewInternalErrorCodes.LEDGER_ALREADY_EXISTS,
                        Map.of("runId", initial.getRunId()));
            }
            log.debug("Created ledger: runId={}, tasks={}", initial.getRunId(), initial.getTasks().size());
            return decode(document);
        });
    }

    @Override
    public Mono<TaskLedger> findByRunId(String runId) {
        return Mono.fromCallable(() -> {
            byte[] document = ledgers.get(runId);
            return document == null ? null : decode(document);
        });
    }

    @Override
    public Mono<TaskLedger> compareAndSave(TaskLedger updated, long expectedRevision) {
        return Mono.fromCallable(() -> {
            updated.validateInvariants();
            String runId = updated.getRunId();
            byte[][] saved = new byte[1][];
            ledgers.compute(runId, (key, existing) -> {
                if (existing == null) {
                    throw new RunNotFoundException(runId);
                }
                long actualRevision = decode(existing).getRevision();
                if (actualRevision != expectedRevision) {
                    throw new ConcurrentLedgerUpdateException(runId, expectedRevision, actualRevision);
                }
                saved[0] = mapper.writeValueAsBytes(updated.toBuilder().revision(expectedRevision + 1).build());
                return saved[0];
            });
            log.debug("Saved ledger: runId={}, revision={}", runId, expectedRevision + 1);
            return decode(saved[0]);
        });
    }

    @Override
    public Flux<TaskLedger> findAll() {
        return Flux.defer(() -> Flux.fromIterable(ledgers.values()).map(this::decode));
    }

    @Override
    public Flux<TaskLedger> findByStatus(RunStatus status) {
        return findAll().filter(ledger -> ledger.getStatus() == status);
    }

    private TaskLedger decode(byte[] document) {
        return mapper.readValue(document, TaskLedger.class);
    }
}
