package io.jsoninject.standalone.server;

import io.jsoninject.core.spi.InjectionListener;
import java.util.concurrent.atomic.AtomicLong;

/** Counts injection outcomes for the health endpoint. */
public final class InjectionCounters implements InjectionListener {

    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    @Override
    public void onInjectionStarted(InjectionStartedEvent event) {
        // only outcomes are counted
    }

    @Override
    public void onInjectionCompleted(InjectionCompletedEvent event) {
        completed.incrementAndGet();
    }

    @Override
    public void onInjectionFailed(InjectionFailedEvent event) {
        failed.incrementAndGet();
    }

    public long completed() {
        return completed.get();
    }

    public long failed() {
        return failed.get();
    }
}
