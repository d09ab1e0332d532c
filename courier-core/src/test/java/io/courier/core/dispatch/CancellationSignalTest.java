package io.courier.core.dispatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.helpers.test.AssertSubscriber;
import io.smallrye.mutiny.helpers.test.UniAssertSubscriber;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("CancellationSignal")
class CancellationSignalTest {

    @Nested
    @DisplayName("state")
    class State {

        @Test
        @DisplayName("starts uncancelled and stays cancelled once fired")
        void shouldLatchCancellation() {
            CancellationSignal signal = CancellationSignal.create();

            assertThat(signal.isCancelled()).isFalse();
            signal.cancel();
            signal.cancel();

            assertThat(signal.isCancelled()).isTrue();
        }

        @Test
        @DisplayName("throwIfCancelled throws only after cancel")
        void shouldThrowOnlyWhenCancelled() {
            CancellationSignal signal = CancellationSignal.create();

            assertThatCode(signal::throwIfCancelled).doesNotThrowAnyException();
            signal.cancel();
            assertThatThrownBy(signal::throwIfCancelled)
                    .isInstanceOf(CancellationException.class);
        }

        @Test
        @DisplayName("NONE cannot be cancelled")
        void shouldRejectCancellingNone() {
            assertThatThrownBy(CancellationSignal.NONE::cancel)
                    .isInstanceOf(UnsupportedOperationException.class);
            assertThat(CancellationSignal.NONE.isCancelled()).isFalse();
        }
    }

    @Nested
    @DisplayName("callbacks")
    class Callbacks {

        @Test
        @DisplayName("runs each callback once on cancel")
        void shouldRunCallbacksOnce() {
            CancellationSignal signal = CancellationSignal.create();
            AtomicInteger calls = new AtomicInteger();
            signal.onCancel(calls::incrementAndGet);

            signal.cancel();
            signal.cancel();

            assertThat(calls).hasValue(1);
        }

        @Test
        @DisplayName("runs a callback registered after cancel immediately")
        void shouldRunLateCallbackImmediately() {
            CancellationSignal signal = CancellationSignal.create();
            signal.cancel();
            AtomicBoolean ran = new AtomicBoolean();

            signal.onCancel(() -> ran.set(true));

            assertThat(ran).isTrue();
        }

        @Test
        @DisplayName("does not run an unregistered callback")
        void shouldSkipUnregisteredCallback() {
            CancellationSignal signal = CancellationSignal.create();
            AtomicBoolean ran = new AtomicBoolean();

            signal.onCancel(() -> ran.set(true)).unregister();
            signal.cancel();

            assertThat(ran).isFalse();
        }

        @Test
        @DisplayName("keeps running callbacks after one throws")
        void shouldIsolateFailingCallback() {
            CancellationSignal signal = CancellationSignal.create();
            AtomicBoolean secondRan = new AtomicBoolean();
            signal.onCancel(
                    () -> {
                        throw new IllegalStateException("callback failure");
                    });
            signal.onCancel(() -> secondRan.set(true));

            assertThatCode(signal::cancel).doesNotThrowAnyException();
            assertThat(secondRan).isTrue();
        }
    }

    @Nested
    @DisplayName("guard")
    class Guard {

        @Test
        @DisplayName("passes the item through when not cancelled")
        void shouldPassItemThrough() {
            CancellationSignal signal = CancellationSignal.create();

            String item = signal.guard(Uni.createFrom().item("value")).await().indefinitely();

            assertThat(item).isEqualTo("value");
        }

        @Test
        @DisplayName("fails a pending Uni and cancels it when the signal fires")
        void shouldFailPendingUni() {
            CancellationSignal signal = CancellationSignal.create();
            AtomicBoolean upstreamCancelled = new AtomicBoolean();
            Uni<String> pending =
                    Uni.createFrom()
                            .<String>emitter(emitter -> {})
                            .onCancellation()
                            .invoke(() -> upstreamCancelled.set(true));

            UniAssertSubscriber<String> subscriber =
                    signal.guard(pending).subscribe().withSubscriber(UniAssertSubscriber.create());
            subscriber.assertNotTerminated();
            signal.cancel();

            subscriber.assertFailedWith(CancellationException.class);
            assertThat(upstreamCancelled).isTrue();
        }

        @Test
        @DisplayName("does not subscribe to the operation when already cancelled")
        void shouldNotSubscribeWhenAlreadyCancelled() {
            CancellationSignal signal = CancellationSignal.create();
            signal.cancel();
            AtomicBoolean subscribed = new AtomicBoolean();

            UniAssertSubscriber<String> subscriber =
                    signal.guard(
                                    Uni.createFrom()
                                            .item(
                                                    () -> {
                                                        subscribed.set(true);
                                                        return "value";
                                                    }))
                            .subscribe()
                            .withSubscriber(UniAssertSubscriber.create());

            subscriber.assertFailedWith(CancellationException.class);
            assertThat(subscribed).isFalse();
        }

        @Test
        @DisplayName("completes a stream at the element after the signal fires")
        void shouldStopStreamAtElementBoundary() {
            CancellationSignal signal = CancellationSignal.create();
            Multi<Integer> numbers =
                    Multi.createFrom()
                            .range(0, 100)
                            .onItem()
                            .invoke(
                                    i -> {
                                        if (i == 3) {
                                            signal.cancel();
                                        }
                                    });

            AssertSubscriber<Integer> subscriber =
                    signal.guard(numbers).subscribe().withSubscriber(AssertSubscriber.create(100));

            subscriber.assertCompleted();
            assertThat(subscriber.getItems()).containsExactly(0, 1, 2);
        }
    }
}
