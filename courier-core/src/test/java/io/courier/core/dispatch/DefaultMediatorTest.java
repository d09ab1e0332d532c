package io.courier.core.dispatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.courier.core.TestMessages.Add;
import io.courier.core.TestMessages.CountTo;
import io.courier.core.TestMessages.CreateUser;
import io.courier.core.TestMessages.Echo;
import io.courier.core.TestMessages.GetValue;
import io.courier.core.TestMessages.UserCreated;
import io.courier.core.behavior.CachingBehavior;
import io.courier.core.cache.InMemoryCacheStore;
import io.courier.core.exception.HandlerNotFoundException;
import io.courier.core.handler.DefaultHandlerRegistry;
import io.courier.core.handler.NotificationHandler;
import io.courier.core.pipeline.PipelineBehavior;
import io.courier.core.request.BaseRequest;
import io.courier.core.request.CachePriority;
import io.courier.core.request.CacheableRequest;
import io.courier.core.request.Command;
import io.courier.core.result.Unit;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.helpers.test.AssertSubscriber;
import io.smallrye.mutiny.helpers.test.UniAssertSubscriber;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("DefaultMediator")
class DefaultMediatorTest {

    private DefaultHandlerRegistry registry;
    private DefaultMediator mediator;

    @BeforeEach
    void setUp() {
        registry = new DefaultHandlerRegistry();
        mediator = new DefaultMediator(registry);
    }

    @Nested
    @DisplayName("send (query)")
    class SendQuery {

        @Test
        @DisplayName("returns the handler's response")
        void shouldReturnHandlerResponse() {
            registry.registerRequestHandler(
                    Add.class,
                    (request, signal) -> Uni.createFrom().item(request.left() + request.right()));

            Integer sum = mediator.send(new Add(2, 3)).await().indefinitely();

            assertThat(sum).isEqualTo(5);
        }

        @Test
        @DisplayName("does nothing until subscribed")
        void shouldBeLazy() {
            AtomicInteger invocations = new AtomicInteger();
            registry.registerRequestHandler(
                    Echo.class,
                    (request, signal) -> {
                        invocations.incrementAndGet();
                        return Uni.createFrom().item(request.text());
                    });

            Uni<String> pending = mediator.send(new Echo("hi"));

            assertThat(invocations).hasValue(0);
            assertThat(pending.await().indefinitely()).isEqualTo("hi");
            assertThat(invocations).hasValue(1);
        }

        @Test
        @DisplayName("is idempotent for a stateless handler")
        void shouldReturnSameResultForRepeatedSends() {
            AtomicInteger invocations = new AtomicInteger();
            registry.registerRequestHandler(
                    Echo.class,
                    (request, signal) -> {
                        invocations.incrementAndGet();
                        return Uni.createFrom().item(request.text().toUpperCase());
                    });

            String first = mediator.send(new Echo("hi")).await().indefinitely();
            String second = mediator.send(new Echo("hi")).await().indefinitely();

            assertThat(first).isEqualTo(second).isEqualTo("HI");
            assertThat(invocations).hasValue(2);
        }

        @Test
        @DisplayName("fails with HandlerNotFoundException when no handler is registered")
        void shouldFailWithoutHandler() {
            assertThatThrownBy(() -> mediator.send(new Echo("hi")).await().indefinitely())
                    .isInstanceOf(HandlerNotFoundException.class)
                    .hasMessageContaining("Echo");
        }

        @Test
        @DisplayName("fails with HandlerNotFoundException even when behaviors are registered")
        void shouldFailWithoutHandlerThroughBehaviors() {
            List<String> trace = new CopyOnWriteArrayList<>();
            registry.registerBehavior(tracing("outer", trace));
            registry.registerBehavior(tracing("inner", trace));

            assertThatThrownBy(() -> mediator.send(new Echo("hi")).await().indefinitely())
                    .isInstanceOf(HandlerNotFoundException.class);
            assertThat(trace).containsExactly("before outer", "before inner");
        }

        @Test
        @DisplayName("propagates handler failures unchanged")
        void shouldPropagateHandlerFailure() {
            IllegalStateException failure = new IllegalStateException("handler broke");
            registry.registerRequestHandler(
                    Echo.class, (request, signal) -> Uni.createFrom().failure(failure));

            assertThatThrownBy(() -> mediator.send(new Echo("hi")).await().indefinitely())
                    .isSameAs(failure);
        }

        @Test
        @DisplayName("propagates an exception thrown synchronously by the handler")
        void shouldPropagateThrownException() {
            registry.registerRequestHandler(
                    Echo.class,
                    (request, signal) -> {
                        throw new IllegalArgumentException("bad input");
                    });

            assertThatThrownBy(() -> mediator.send(new Echo("hi")).await().indefinitely())
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("bad input");
        }

        @Test
        @DisplayName("rejects a null request")
        void shouldRejectNullRequest() {
            assertThatThrownBy(() -> mediator.send((Echo) null))
                    .isInstanceOf(NullPointerException.class);
        }
    }

    @Nested
    @DisplayName("behavior chain")
    class BehaviorChain {

        @Test
        @DisplayName("runs before-steps in registration order and after-steps in reverse")
        void shouldNestBehaviors() {
            List<String> trace = new CopyOnWriteArrayList<>();
            registry.registerBehavior(tracing("A", trace));
            registry.registerBehavior(tracing("B", trace));
            registry.registerRequestHandler(
                    Echo.class,
                    (request, signal) -> {
                        trace.add("handler");
                        return Uni.createFrom().item(request.text());
                    });

            mediator.send(new Echo("hi")).await().indefinitely();

            assertThat(trace)
                    .containsExactly("before A", "before B", "handler", "after B", "after A");
        }

        @Test
        @DisplayName("answers from a short-circuiting behavior without any handler")
        void shouldShortCircuitWithoutHandler() {
            InMemoryCacheStore store = new InMemoryCacheStore();
            CachingBehavior<CacheableRequest<Object>, Object> caching = new CachingBehavior<>(store);
            registry.registerBehavior(CacheableRequest.class, caching);
            GetValue request = new GetValue("a");
            store.set(
                    caching.cacheKey(request),
                    "cached-a",
                    Duration.ofMinutes(5),
                    CachePriority.NORMAL);

            String result = mediator.send(request).await().indefinitely();

            assertThat(result).isEqualTo("cached-a");
        }

        @Test
        @DisplayName("passes the caller's cancellation signal to behaviors and handler")
        void shouldThreadSignal() {
            CancellationSignal signal = CancellationSignal.create();
            List<CancellationSignal> seen = new CopyOnWriteArrayList<>();
            registry.registerBehavior(
                    (PipelineBehavior<BaseRequest, Object>)
                            (request, next, s) -> {
                                seen.add(s);
                                return next.proceed();
                            });
            registry.registerRequestHandler(
                    Echo.class,
                    (request, s) -> {
                        seen.add(s);
                        return Uni.createFrom().item(request.text());
                    });

            mediator.send(new Echo("hi"), signal).await().indefinitely();

            assertThat(seen).containsExactly(signal, signal);
        }
    }

    @Nested
    @DisplayName("send (command)")
    class SendCommand {

        @Test
        @DisplayName("invokes the command handler and completes with no item")
        void shouldInvokeCommandHandler() {
            List<String> created = new ArrayList<>();
            registry.registerCommandHandler(
                    CreateUser.class,
                    (command, signal) -> {
                        created.add(command.name());
                        return Uni.createFrom().voidItem();
                    });

            Void result = mediator.send(new CreateUser("ada")).await().indefinitely();

            assertThat(result).isNull();
            assertThat(created).containsExactly("ada");
        }

        @Test
        @DisplayName("routes through behaviors with Unit as the response")
        void shouldExposeUnitToBehaviors() {
            AtomicReference<Object> observed = new AtomicReference<>();
            registry.registerBehavior(
                    Command.class,
                    (PipelineBehavior<Command, Object>)
                            (command, next, signal) ->
                                    next.proceed().onItem().invoke(observed::set));
            registry.registerCommandHandler(
                    CreateUser.class, (command, signal) -> Uni.createFrom().voidItem());

            mediator.send(new CreateUser("ada")).await().indefinitely();

            assertThat(observed).hasValue(Unit.VALUE);
        }

        @Test
        @DisplayName("fails with HandlerNotFoundException when no command handler exists")
        void shouldFailWithoutHandler() {
            assertThatThrownBy(() -> mediator.send(new CreateUser("ada")).await().indefinitely())
                    .isInstanceOf(HandlerNotFoundException.class)
                    .extracting(e -> ((HandlerNotFoundException) e).getKind())
                    .isEqualTo(HandlerNotFoundException.HandlerKind.COMMAND);
        }
    }

    @Nested
    @DisplayName("publish")
    class Publish {

        @Test
        @DisplayName("completes immediately with zero handlers")
        void shouldCompleteWithoutHandlers() {
            UniAssertSubscriber<Void> subscriber =
                    mediator.publish(new UserCreated("ada"))
                            .subscribe()
                            .withSubscriber(UniAssertSubscriber.create());

            subscriber.assertCompleted();
        }

        @Test
        @DisplayName("invokes each of N handlers exactly once")
        void shouldInvokeEveryHandlerOnce() {
            AtomicInteger first = new AtomicInteger();
            AtomicInteger second = new AtomicInteger();
            AtomicInteger third = new AtomicInteger();
            registry.registerNotificationHandler(UserCreated.class, counting(first));
            registry.registerNotificationHandler(UserCreated.class, counting(second));
            registry.registerNotificationHandler(UserCreated.class, counting(third));

            mediator.publish(new UserCreated("ada")).await().indefinitely();

            assertThat(first).hasValue(1);
            assertThat(second).hasValue(1);
            assertThat(third).hasValue(1);
        }

        @Test
        @DisplayName("starts every handler before any of them completes")
        void shouldStartHandlersConcurrently() {
            CompletableFuture<Void> allStarted = new CompletableFuture<>();
            AtomicInteger started = new AtomicInteger();
            for (int i = 0; i < 3; i++) {
                registry.registerNotificationHandler(
                        UserCreated.class,
                        (notification, signal) -> {
                            if (started.incrementAndGet() == 3) {
                                allStarted.complete(null);
                            }
                            return Uni.createFrom().completionStage(allStarted);
                        });
            }

            mediator.publish(new UserCreated("ada")).await().atMost(Duration.ofSeconds(5));

            assertThat(started).hasValue(3);
        }

        @Test
        @DisplayName("completes only after the slowest handler")
        void shouldWaitForSlowestHandler() {
            CompletableFuture<Void> slow = new CompletableFuture<>();
            AtomicBoolean fastDone = new AtomicBoolean();
            registry.registerNotificationHandler(
                    UserCreated.class,
                    (notification, signal) ->
                            Uni.createFrom().voidItem().onItem().invoke(() -> fastDone.set(true)));
            registry.registerNotificationHandler(
                    UserCreated.class,
                    (notification, signal) -> Uni.createFrom().completionStage(slow));

            UniAssertSubscriber<Void> subscriber =
                    mediator.publish(new UserCreated("ada"))
                            .subscribe()
                            .withSubscriber(UniAssertSubscriber.create());

            assertThat(fastDone).isTrue();
            subscriber.assertNotTerminated();
            slow.complete(null);
            subscriber.assertCompleted();
        }

        @Test
        @DisplayName("lets siblings finish and reports the first failure with the rest suppressed")
        void shouldReportFirstFailure() {
            CompletableFuture<Void> a = new CompletableFuture<>();
            CompletableFuture<Void> b = new CompletableFuture<>();
            AtomicBoolean survivorRan = new AtomicBoolean();
            registry.registerNotificationHandler(
                    UserCreated.class, (n, signal) -> Uni.createFrom().completionStage(a));
            registry.registerNotificationHandler(
                    UserCreated.class, (n, signal) -> Uni.createFrom().completionStage(b));
            registry.registerNotificationHandler(
                    UserCreated.class,
                    (n, signal) ->
                            Uni.createFrom().voidItem().onItem().invoke(() -> survivorRan.set(true)));

            UniAssertSubscriber<Void> subscriber =
                    mediator.publish(new UserCreated("ada"))
                            .subscribe()
                            .withSubscriber(UniAssertSubscriber.create());
            IllegalStateException second = new IllegalStateException("b failed first");
            IllegalStateException first = new IllegalStateException("a failed later");
            b.completeExceptionally(second);
            subscriber.assertNotTerminated();
            a.completeExceptionally(first);

            subscriber.assertFailedWith(IllegalStateException.class, "b failed first");
            assertThat(subscriber.getFailure()).isSameAs(second);
            assertThat(second.getSuppressed()).containsExactly(first);
            assertThat(survivorRan).isTrue();
        }

        @Test
        @DisplayName("does not apply behaviors")
        void shouldSkipBehaviors() {
            AtomicInteger behaviorCalls = new AtomicInteger();
            registry.registerBehavior(
                    (PipelineBehavior<BaseRequest, Object>)
                            (request, next, signal) -> {
                                behaviorCalls.incrementAndGet();
                                return next.proceed();
                            });
            registry.registerNotificationHandler(
                    UserCreated.class, (n, signal) -> Uni.createFrom().voidItem());

            mediator.publish(new UserCreated("ada")).await().indefinitely();

            assertThat(behaviorCalls).hasValue(0);
        }

        @Test
        @DisplayName("refuses to start when the signal already fired")
        void shouldNotStartWhenCancelled() {
            AtomicInteger calls = new AtomicInteger();
            registry.registerNotificationHandler(UserCreated.class, counting(calls));
            CancellationSignal signal = CancellationSignal.create();
            signal.cancel();

            assertThatThrownBy(
                            () ->
                                    mediator.publish(new UserCreated("ada"), signal)
                                            .await()
                                            .indefinitely())
                    .isInstanceOf(CancellationException.class);
            assertThat(calls).hasValue(0);
        }

        @Test
        @DisplayName("subscribes handlers on the configured executor")
        void shouldUseNotificationExecutor() {
            ExecutorService executor = Executors.newFixedThreadPool(2);
            try {
                DefaultMediator pooled = new DefaultMediator(registry, executor);
                List<String> threads = new CopyOnWriteArrayList<>();
                String caller = Thread.currentThread().getName();
                registry.registerNotificationHandler(
                        UserCreated.class,
                        (n, signal) -> {
                            threads.add(Thread.currentThread().getName());
                            return Uni.createFrom().voidItem();
                        });

                pooled.publish(new UserCreated("ada")).await().atMost(Duration.ofSeconds(5));

                assertThat(threads).hasSize(1).doesNotContain(caller);
            } finally {
                executor.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("stream")
    class Stream {

        @Test
        @DisplayName("emits the handler's elements lazily")
        void shouldStreamElements() {
            registry.registerStreamHandler(
                    CountTo.class,
                    (request, signal) -> Multi.createFrom().range(1, request.limit() + 1));

            AssertSubscriber<Integer> subscriber =
                    mediator.stream(new CountTo(3))
                            .subscribe()
                            .withSubscriber(AssertSubscriber.create(2));

            subscriber.assertItems(1, 2);
            subscriber.request(5);
            subscriber.assertCompleted().assertItems(1, 2, 3);
        }

        @Test
        @DisplayName("stops at the next element when the signal fires, without an error")
        void shouldStopOnCancellation() {
            CancellationSignal signal = CancellationSignal.create();
            AtomicInteger produced = new AtomicInteger();
            registry.registerStreamHandler(
                    CountTo.class,
                    (request, s) ->
                            Multi.createFrom()
                                    .range(0, request.limit())
                                    .onItem()
                                    .invoke(
                                            i -> {
                                                produced.incrementAndGet();
                                                if (i == 2) {
                                                    s.cancel();
                                                }
                                            }));

            AssertSubscriber<Integer> subscriber =
                    mediator.stream(new CountTo(1_000), signal)
                            .subscribe()
                            .withSubscriber(AssertSubscriber.create(Long.MAX_VALUE));

            subscriber.assertCompleted().assertItems(0, 1);
            assertThat(produced).hasValue(3);
        }

        @Test
        @DisplayName("cancels production when the consumer cancels")
        void shouldPropagateConsumerCancellation() {
            AtomicBoolean upstreamCancelled = new AtomicBoolean();
            registry.registerStreamHandler(
                    CountTo.class,
                    (request, signal) ->
                            Multi.createFrom()
                                    .range(0, request.limit())
                                    .onCancellation()
                                    .invoke(() -> upstreamCancelled.set(true)));

            AssertSubscriber<Integer> subscriber =
                    mediator.stream(new CountTo(100))
                            .subscribe()
                            .withSubscriber(AssertSubscriber.create(1));
            subscriber.assertItems(0);
            subscriber.cancel();

            assertThat(upstreamCancelled).isTrue();
        }

        @Test
        @DisplayName("fails with HandlerNotFoundException when no stream handler exists")
        void shouldFailWithoutHandler() {
            AssertSubscriber<Integer> subscriber =
                    mediator.stream(new CountTo(3))
                            .subscribe()
                            .withSubscriber(AssertSubscriber.create(1));

            subscriber.assertFailedWith(HandlerNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("cancellation of send")
    class SendCancellation {

        @Test
        @DisplayName("fails a pending send and cancels the handler's work")
        void shouldCancelPendingSend() {
            AtomicBoolean handlerCancelled = new AtomicBoolean();
            registry.registerRequestHandler(
                    Echo.class,
                    (request, signal) ->
                            Uni.createFrom()
                                    .<String>emitter(emitter -> {})
                                    .onCancellation()
                                    .invoke(() -> handlerCancelled.set(true)));
            CancellationSignal signal = CancellationSignal.create();

            UniAssertSubscriber<String> subscriber =
                    mediator.send(new Echo("hi"), signal)
                            .subscribe()
                            .withSubscriber(UniAssertSubscriber.create());
            signal.cancel();

            subscriber.assertFailedWith(CancellationException.class);
            assertThat(handlerCancelled).isTrue();
        }

        @Test
        @DisplayName("never invokes the handler when the signal already fired")
        void shouldSkipHandlerWhenAlreadyCancelled() {
            AtomicInteger invocations = new AtomicInteger();
            registry.registerRequestHandler(
                    Echo.class,
                    (request, signal) -> {
                        invocations.incrementAndGet();
                        return Uni.createFrom().item(request.text());
                    });
            CancellationSignal signal = CancellationSignal.create();
            signal.cancel();

            assertThatThrownBy(() -> mediator.send(new Echo("hi"), signal).await().indefinitely())
                    .isInstanceOf(CancellationException.class);
            assertThat(invocations).hasValue(0);
        }
    }

    // --- Test Helpers ---

    private static PipelineBehavior<BaseRequest, Object> tracing(String name, List<String> trace) {
        return (request, next, signal) -> {
            trace.add("before " + name);
            return next.proceed().onItem().invoke(response -> trace.add("after " + name));
        };
    }

    private static NotificationHandler<UserCreated> counting(AtomicInteger counter) {
        return (notification, signal) -> {
            counter.incrementAndGet();
            return Uni.createFrom().voidItem();
        };
    }
}
