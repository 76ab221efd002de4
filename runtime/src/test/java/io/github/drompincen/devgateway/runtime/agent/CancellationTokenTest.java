package io.github.drompincen.devgateway.runtime.agent;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class CancellationTokenTest {

    @Test
    void cancelRunsCallbacksOnce() {
        CancellationToken token = new CancellationToken();
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(calls::incrementAndGet);

        assertThat(token.cancel()).isTrue();
        assertThat(token.cancel()).isFalse();

        assertThat(token.isCancelled()).isTrue();
        assertThat(calls).hasValue(1);
    }

    @Test
    void callbackRegisteredAfterCancelRunsImmediately() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        AtomicInteger calls = new AtomicInteger();

        token.onCancel(calls::incrementAndGet);

        assertThat(calls).hasValue(1);
    }
}
