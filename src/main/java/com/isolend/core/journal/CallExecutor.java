package com.isolend.core.journal;

import com.isolend.exception.BaseException;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Runs every protocol entry point as one atomic call.
 *
 * <p>Calls are serialized by a fair lock, so a call sees no interleaving from other callers.
 * The lock is reentrant: a call that triggers another entry point (an EXEC target calling back
 * into a pool, a superpool depositing into a pool) runs the inner call inside the outer one with
 * its own savepoint. Any exception rolls the journal back to the savepoint of the call that
 * raised it and propagates unchanged. Buffered events are published once the outermost call
 * commits. Views go through {@link #read} and take the same lock.
 */
@Component
public class CallExecutor {

    private static final Logger log = LoggerFactory.getLogger(CallExecutor.class);

    private final ReentrantLock callLock = new ReentrantLock(true);
    private final StateJournal stateJournal;
    private final ApplicationEventPublisher applicationEventPublisher;

    public CallExecutor(StateJournal stateJournal, ApplicationEventPublisher applicationEventPublisher) {
        this.stateJournal = stateJournal;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    public <T> T execute(String operation, Supplier<T> call) {
        List<ApplicationEvent> events;
        T result;
        callLock.lock();
        try {
            StateJournal.Savepoint savepoint = stateJournal.begin();
            try {
                result = call.get();
            } catch (BaseException e) {
                stateJournal.rollback(savepoint);
                log.debug("{} reverted: {}", operation, e.getMessage());
                throw e;
            } catch (RuntimeException e) {
                stateJournal.rollback(savepoint);
                log.error("{} reverted on unexpected failure", operation, e);
                throw e;
            }
            events = stateJournal.commit(savepoint);
            events.forEach(applicationEventPublisher::publishEvent);
        } finally {
            callLock.unlock();
        }
        return result;
    }

    /**
     * Evaluates a view under the call lock, so it observes only committed state. Inside a call
     * it sees that call's own writes.
     */
    public <T> T read(Supplier<T> view) {
        callLock.lock();
        try {
            return view.get();
        } finally {
            callLock.unlock();
        }
    }

    public void run(String operation, Runnable call) {
        execute(operation, () -> {
            call.run();
            return null;
        });
    }
}
