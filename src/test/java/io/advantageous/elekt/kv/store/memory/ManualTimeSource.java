package io.advantageous.elekt.kv.store.memory;

import io.advantageous.reakt.reactor.TimeSource;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

class ManualTimeSource implements TimeSource {

    private final AtomicLong time = new AtomicLong(System.currentTimeMillis());

    @Override
    public long getTime() {
        return time.get();
    }

    void advance(final Duration duration) {
        time.addAndGet(duration.toMillis());
    }
}
