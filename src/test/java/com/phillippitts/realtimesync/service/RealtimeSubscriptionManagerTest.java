package com.phillippitts.realtimesync.service;

import com.phillippitts.realtimesync.domain.ChangeEvent;
import com.phillippitts.realtimesync.domain.ConnectionStateSnapshot;
import com.phillippitts.realtimesync.domain.EventFilter;
import com.phillippitts.realtimesync.domain.EventType;
import com.phillippitts.realtimesync.domain.HealthStatus;
import com.phillippitts.realtimesync.domain.Subscription;
import com.phillippitts.realtimesync.testutil.FakeChannelProvider.Behavior;
import com.phillippitts.realtimesync.testutil.FakeChannelProvider.FakeChannel;
import com.phillippitts.realtimesync.testutil.RealtimeFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.phillippitts.realtimesync.domain.ConnectionStatus.CONNECTED;
import static com.phillippitts.realtimesync.domain.ConnectionStatus.CONNECTING;
import static com.phillippitts.realtimesync.domain.ConnectionStatus.IDLE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class RealtimeSubscriptionManagerTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private RealtimeFixture fx;
    private RealtimeSubscriptionManager manager;

    @BeforeEach
    void setUp() {
        fx = new RealtimeFixture();
        manager = fx.manager;
    }

    @AfterEach
    void tearDown() {
        fx.close();
    }

    @Test
    void firstSubscriptionOpensTheSharedChannel() {
        assertThat(manager.getConnectionState().status()).isEqualTo(IDLE);

        manager.subscribe("a", EventFilter.allEvents("public", "leads"), e -> { });
        manager.subscribe("b", EventFilter.allEvents("public", "conversations"), e -> { });

        await().atMost(WAIT).until(() -> manager.getConnectionState().status() == CONNECTED);
        assertThat(fx.provider.openCount.get()).isEqualTo(1);
        assertThat(manager.getHealthStatus().activeSubscriptions()).isEqualTo(2);
    }

    @Test
    void duplicateIdKeepsExistingSubscription() {
        List<String> calls = new CopyOnWriteArrayList<>();
        Registration first = manager.subscribe("dup", EventFilter.allEvents("public", "leads"), e -> calls.add("first"));
        Registration second = manager.subscribe("dup", EventFilter.allEvents("public", "leads"), e -> calls.add("second"));

        assertThat(fx.registry.size()).isEqualTo(1);
        manager.forceSync();
        assertThat(calls).containsExactly("first");

        // Either handle removes the single entry
        second.remove();
        assertThat(fx.registry.isEmpty()).isTrue();
        first.remove();
        assertThat(fx.registry.isEmpty()).isTrue();
    }

    @Test
    void removingLastSubscriptionTearsDownTheChannel() {
        Registration a = manager.subscribe("a", EventFilter.allEvents("public", "leads"), e -> { });
        Registration b = manager.subscribe("b", EventFilter.allEvents("public", "leads"), e -> { });
        await().atMost(WAIT).until(() -> manager.getConnectionState().status() == CONNECTED);
        FakeChannel channel = fx.provider.lastChannel();

        a.remove();
        assertThat(manager.getConnectionState().status()).isEqualTo(CONNECTED);

        b.close();
        assertThat(manager.getConnectionState().status()).isEqualTo(IDLE);
        assertThat(channel.isClosed()).isTrue();
        assertThat(manager.getHealthStatus().channelStatus()).isEqualTo("none");
    }

    @Test
    void unsubscribeUnknownIdReturnsFalse() {
        assertThat(manager.unsubscribe("missing")).isFalse();
        assertThat(manager.getConnectionState().status()).isEqualTo(IDLE);
    }

    @Test
    void subscribeAfterTeardownReconnects() {
        Registration a = manager.subscribe("a", EventFilter.allEvents("public", "leads"), e -> { });
        await().atMost(WAIT).until(() -> manager.getConnectionState().status() == CONNECTED);
        a.remove();

        manager.subscribe("a", EventFilter.allEvents("public", "leads"), e -> { });

        await().atMost(WAIT).until(() -> manager.getConnectionState().status() == CONNECTED);
        assertThat(fx.provider.openCount.get()).isEqualTo(2);
    }

    @Test
    void routesEventsToMatchingSubscriptionsOnly() {
        List<ChangeEvent> x = new CopyOnWriteArrayList<>();
        List<ChangeEvent> y = new CopyOnWriteArrayList<>();
        manager.subscribe("X", EventFilter.of("*", "public", "leads"), x::add);
        manager.subscribe("Y", EventFilter.of("insert", "public", "conversations"), y::add);
        await().atMost(WAIT).until(() -> manager.getConnectionState().status() == CONNECTED);
        FakeChannel channel = fx.provider.lastChannel();

        channel.emitPayload("{\"eventType\":\"INSERT\",\"schema\":\"public\",\"table\":\"conversations\","
                + "\"new\":{\"id\":7},\"old\":null}");
        assertThat(x).isEmpty();
        assertThat(y).singleElement().extracting(ChangeEvent::eventType).isEqualTo(EventType.INSERT);

        channel.emitPayload("{\"eventType\":\"UPDATE\",\"schema\":\"public\",\"table\":\"leads\","
                + "\"new\":{\"id\":3},\"old\":{\"id\":3}}");
        assertThat(x).singleElement().extracting(ChangeEvent::table).isEqualTo("leads");
        assertThat(y).hasSize(1);
    }

    @Test
    void throwingCallbackDoesNotStarveOthers() {
        List<ChangeEvent> b = new CopyOnWriteArrayList<>();
        manager.subscribe("A", EventFilter.allEvents("public", "leads"), e -> {
            throw new IllegalStateException("consumer bug");
        });
        manager.subscribe("B", EventFilter.allEvents("public", "leads"), b::add);
        await().atMost(WAIT).until(() -> manager.getConnectionState().status() == CONNECTED);

        fx.provider.lastChannel().emitPayload(
                "{\"eventType\":\"DELETE\",\"schema\":\"public\",\"table\":\"leads\",\"old\":{\"id\":1}}");

        assertThat(b).hasSize(1);
        assertThat(b.get(0).newRow()).isNull();
        assertThat(manager.getConnectionState().status()).isEqualTo(CONNECTED);
        assertThat(manager.getHealthStatus().failures()).isZero();
    }

    @Test
    void connectionListenerIsCalledImmediately() {
        List<ConnectionStateSnapshot> seen = new CopyOnWriteArrayList<>();

        Registration registration = manager.addConnectionListener(seen::add);

        assertThat(seen).singleElement().satisfies(s -> {
            assertThat(s.status()).isEqualTo(IDLE);
            assertThat(s.connected()).isFalse();
            assertThat(s.maxReconnectAttempts()).isEqualTo(5);
        });

        registration.remove();
        manager.subscribe("a", EventFilter.allEvents("public", "leads"), e -> { });
        await().atMost(WAIT).until(() -> manager.getConnectionState().status() == CONNECTED);
        assertThat(seen).hasSize(1);
    }

    @Test
    void forceReconnectWithoutSubscriptionsIsNoOp() {
        manager.forceReconnect();

        assertThat(manager.getConnectionState().status()).isEqualTo(IDLE);
        assertThat(fx.provider.openCount.get()).isZero();
    }

    @Test
    void forceSyncCuesEverySubscription() {
        List<ChangeEvent> leads = new CopyOnWriteArrayList<>();
        List<ChangeEvent> conversations = new CopyOnWriteArrayList<>();
        manager.subscribe("leads", EventFilter.of("update", "public", "leads"), leads::add);
        manager.subscribe("conversations", EventFilter.of("insert", "sales", "conversations"), conversations::add);

        int cued = manager.forceSync();

        assertThat(cued).isEqualTo(2);
        assertThat(leads).singleElement().satisfies(e -> {
            assertThat(e.isPollUpdate()).isTrue();
            assertThat(e.schema()).isEqualTo("public");
            assertThat(e.table()).isEqualTo("leads");
        });
        assertThat(conversations).singleElement().extracting(ChangeEvent::schema).isEqualTo("sales");
    }

    @Test
    void healthStatusReflectsTrackerAndChannel() {
        fx.provider.script(Behavior.ERROR);
        manager.subscribe("a", EventFilter.allEvents("public", "leads"), e -> { });
        await().atMost(WAIT).until(() -> manager.getConnectionState().status() == CONNECTED);

        HealthStatus health = manager.getHealthStatus();

        assertThat(health.attempts()).isEqualTo(2);
        assertThat(health.successes()).isEqualTo(1);
        assertThat(health.failures()).isEqualTo(1);
        assertThat(health.consecutiveFailures()).isZero();
        assertThat(health.successRate()).isEqualTo(0.5);
        assertThat(health.healthy()).isFalse();
        assertThat(health.activeSubscriptions()).isEqualTo(1);
        assertThat(health.channelStatus()).isEqualTo("joined");
        assertThat(health.connectionStatus()).isEqualTo(CONNECTED);
        assertThat(health.lastSuccessAt()).isNotNull();
        assertThat(health.lastFailureAt()).isNotNull();
    }

    @Test
    void cleanupIsIdempotent() {
        manager.subscribe("a", EventFilter.allEvents("public", "leads"), e -> { });
        await().atMost(WAIT).until(() -> manager.getConnectionState().status() == CONNECTED);

        manager.cleanup();
        manager.cleanup();

        assertThat(manager.getConnectionState().status()).isEqualTo(IDLE);
        assertThat(fx.registry.isEmpty()).isTrue();
        assertThat(fx.heartbeat.isRunning()).isFalse();
        assertThat(fx.polling.isActive()).isFalse();
        assertThat(fx.provider.lastChannel().isClosed()).isTrue();
    }

    @Test
    void cleanupDropsListeners() {
        List<ConnectionStateSnapshot> seen = new CopyOnWriteArrayList<>();
        manager.addConnectionListener(seen::add);

        manager.cleanup();
        manager.subscribe("a", EventFilter.allEvents("public", "leads"), e -> { });

        assertThat(manager.getConnectionState().status()).isIn(CONNECTING, CONNECTED);
        assertThat(seen).hasSize(1);
    }

    @Test
    void listenerMaySubscribeWhileAnotherThreadUnsubscribes() throws Exception {
        AtomicBoolean once = new AtomicBoolean();
        CountDownLatch listenerEntered = new CountDownLatch(1);
        manager.addConnectionListener(snapshot -> {
            if (snapshot.status() != CONNECTED || !once.compareAndSet(false, true)) {
                return;
            }
            listenerEntered.countDown();
            try {
                Thread.sleep(300);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            manager.subscribe("late", EventFilter.allEvents("public", "leads"), e -> { });
        });
        manager.subscribe("a", EventFilter.allEvents("public", "leads"), e -> { });
        assertThat(listenerEntered.await(5, TimeUnit.SECONDS)).isTrue();

        CompletableFuture<Boolean> unsubscribe = CompletableFuture.supplyAsync(() -> manager.unsubscribe("a"));

        assertThat(unsubscribe.get(3, TimeUnit.SECONDS)).isTrue();
        await().atMost(WAIT).until(() -> fx.registry.get("late").isPresent()
                && manager.getConnectionState().status() == CONNECTED);
    }

    @Test
    void cleanupWaitsForRunningCallbackAndNothingRunsAfterwards() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        AtomicBoolean finished = new AtomicBoolean();
        List<ChangeEvent> received = new CopyOnWriteArrayList<>();
        manager.subscribe("slow", EventFilter.allEvents("public", "leads"), e -> {
            received.add(e);
            entered.countDown();
            try {
                Thread.sleep(200);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            finished.set(true);
        });
        await().atMost(WAIT).until(() -> manager.getConnectionState().status() == CONNECTED);
        FakeChannel channel = fx.provider.lastChannel();
        String payload = "{\"eventType\":\"INSERT\",\"schema\":\"public\",\"table\":\"leads\",\"new\":{\"id\":1}}";

        CompletableFuture<Void> delivery = CompletableFuture.runAsync(() -> channel.emitPayload(payload));
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
        manager.cleanup();

        assertThat(finished).isTrue();
        delivery.get(5, TimeUnit.SECONDS);
        fx.dispatcher.dispatch(new ChangeEvent(EventType.INSERT, "public", "leads", null, null));
        assertThat(received).hasSize(1);
    }

    @Test
    void rejectsInvalidSubscriptions() {
        assertThatThrownBy(() -> manager.subscribe(new Subscription(" ", EventFilter.allEvents("public", "leads"), e -> { })))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> manager.subscribe("a", null, e -> { }))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> manager.subscribe("a", EventFilter.allEvents("public", "leads"), null))
                .isInstanceOf(NullPointerException.class);
        assertThat(fx.registry.isEmpty()).isTrue();
    }
}
