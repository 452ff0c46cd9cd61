package com.agentcollab.orchestrator.support;

import com.agentcollab.orchestrator.orchestration.ExecutionCancelledException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CancellationTokenTest {

    @Test
    void cancel_firstReasonWinsAndCallbacksRunOnce() {
        CancellationToken token = new CancellationToken();
        AtomicInteger fired = new AtomicInteger();
        token.onCancel(fired::incrementAndGet);

        token.cancel("first");
        token.cancel("second");

        assertThat(token.isCancelled()).isTrue();
        assertThat(token.reason()).isEqualTo("first");
        assertThat(fired).hasValue(1);
        assertThatThrownBy(token::throwIfCancelled)
                .isInstanceOf(ExecutionCancelledException.class)
                .hasMessage("first");
    }

    @Test
    void onCancel_alreadyCancelled_runsImmediately() {
        CancellationToken token = new CancellationToken();
        token.cancel("done");
        AtomicInteger fired = new AtomicInteger();

        token.onCancel(fired::incrementAndGet);

        assertThat(fired).hasValue(1);
    }

    @Test
    void closedRegistration_notNotified() {
        CancellationToken token = new CancellationToken();
        AtomicInteger fired = new AtomicInteger();
        CancellationToken.Registration reg = token.onCancel(fired::incrementAndGet);

        reg.close();
        token.cancel("later");

        assertThat(fired).hasValue(0);
    }

    @Test
    void interruptOnCancel_interruptFlagClearedOnClose() {
        CancellationToken token = new CancellationToken();

        try (CancellationToken.Registration ignored = token.interruptOnCancel()) {
            token.cancel("stop");
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        }

        assertThat(Thread.interrupted()).isFalse();
    }

    @Test
    void interruptOnCancel_cancelFromAnotherThreadAfterClose_doesNotInterrupt() throws Exception {
        CancellationToken token = new CancellationToken();
        token.interruptOnCancel().close();

        Thread canceller = new Thread(() -> token.cancel("late"));
        canceller.start();
        canceller.join();

        assertThat(token.isCancelled()).isTrue();
        assertThat(Thread.interrupted()).isFalse();
    }

    @Test
    void disarmedInterrupter_leavesTargetAlone() throws Exception {
        CancellationToken.Interrupter interrupter = new CancellationToken.Interrupter(Thread.currentThread());

        interrupter.disarm();
        // a cancelling thread that picked the callback up before disarm runs it only now
        Thread late = new Thread(interrupter);
        late.start();
        late.join();

        assertThat(Thread.interrupted()).isFalse();
    }
}
