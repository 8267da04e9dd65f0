package com.demo.rent.service;

import com.demo.rent.service.error.RentGateException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Runs state-mutating operations one at a time, each all-or-nothing.
 *
 * <p>The outermost call on a thread opens a JDBC transaction; a call made from
 * inside a running operation (a payout recipient calling back in) gets a
 * savepoint, so its failure undoes only its own writes. Signals emitted during
 * an operation are buffered per frame and published only once the outermost
 * frame has committed.
 */
@Slf4j
@Component
public class LedgerSequencer {

    private final ReentrantLock lock = new ReentrantLock(true);
    private final ThreadLocal<Deque<List<Object>>> frames = ThreadLocal.withInitial(ArrayDeque::new);

    private final TransactionTemplate tx;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    public LedgerSequencer(PlatformTransactionManager transactionManager,
                           ApplicationEventPublisher publisher,
                           Clock clock) {
        this.tx = new TransactionTemplate(transactionManager);
        this.tx.setPropagationBehavior(TransactionDefinition.PROPAGATION_NESTED);
        this.publisher = publisher;
        this.clock = clock;
    }

    public <T> T execute(String operation, Supplier<T> action) {
        lock.lock();
        try {
            Deque<List<Object>> stack = frames.get();
            List<Object> frame = new ArrayList<>();
            stack.push(frame);
            T result;
            try {
                result = tx.execute(status -> action.get());
            } catch (RentGateException e) {
                log.warn("{} rejected [{}]: {}", operation, e.getCode(), e.getMessage());
                throw e;
            } finally {
                stack.pop();
                if (stack.isEmpty()) {
                    frames.remove();
                }
            }
            if (stack.isEmpty()) {
                frame.forEach(publisher::publishEvent);
            } else {
                stack.peek().addAll(frame);
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    public void run(String operation, Runnable action) {
        execute(operation, () -> {
            action.run();
            return null;
        });
    }

    /** Buffers a signal in the current operation; dropped if the operation aborts. */
    public void emit(Object signal) {
        Deque<List<Object>> stack = frames.get();
        if (stack.isEmpty()) {
            frames.remove();
            throw new IllegalStateException("Signal emitted outside a ledger operation: " + signal);
        }
        stack.peek().add(signal);
    }

    /** Host time in epoch seconds. */
    public long now() {
        return clock.instant().getEpochSecond();
    }
}
