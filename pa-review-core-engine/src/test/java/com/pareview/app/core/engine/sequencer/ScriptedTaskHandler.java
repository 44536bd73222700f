package com.pareview.app.core.engine.sequencer;

import com.pareview.app.core.engine.task.IReviewTaskContext;
import com.pareview.app.core.engine.task.IReviewTaskHandler;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Test handler that emits a small payload, or whatever the current script says.
 */
class ScriptedTaskHandler implements IReviewTaskHandler {

    private final String taskId;
    private final boolean humanInput;
    private final AtomicInteger executions = new AtomicInteger();
    private volatile Supplier<Mono<Object>> script;

    ScriptedTaskHandler(String taskId) {
        this(taskId, false);
    }

    ScriptedTaskHandler(String taskId, boolean humanInput) {
        this.taskId = taskId;
        this.humanInput = humanInput;
        succeed();
    }

    ScriptedTaskHandler succeed() {
        this.script = () -> Mono.just(Map.of("task", taskId, "attempt", executions.get()));
        return this;
    }

    ScriptedTaskHandler failWith(RuntimeException error) {
        this.script = () -> Mono.error(error);
        return this;
    }

    ScriptedTaskHandler respondWith(Supplier<Mono<Object>> script) {
        this.script = script;
        return this;
    }

    int getExecutions() {
        return executions.get();
    }

    @Override
    public String taskId() {
        return taskId;
    }

    @Override
    public Mono<Object> execute(IReviewTaskContext context) {
        executions.incrementAndGet();
        return script.get();
    }

    @Override
    public boolean requiresHumanInput() {
        return humanInput;
    }

    @Override
    public boolean readsSubmission() {
        return "intake".equals(taskId);
    }
}
