package com.example.concierge.assistant.conversation;

import com.example.concierge.assistant.config.AssistantSessionProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class SessionLockRegistryTest {

    @Test
    void returnsWorkResultAndReleases() {
        SessionLockRegistry locks = new SessionLockRegistry(new AssistantSessionProperties());
        assertThat(locks.withLock("a", () -> 42)).isEqualTo(42);
        assertThat(locks.isLocked("a")).isFalse();
    }

    @Test
    void secondTurnOfSameSessionTimesOutWhileFirstHoldsLock() throws Exception {
        AssistantSessionProperties props = new AssistantSessionProperties();
        props.setLockTimeout(Duration.ofMillis(100));
        SessionLockRegistry locks = new SessionLockRegistry(props);
        CountDownLatch release = new CountDownLatch(1);

        CompletableFuture<Boolean> holder = CompletableFuture.supplyAsync(() -> locks.withLock("a", () -> {
            try {
                return release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }));
        await().atMost(Duration.ofSeconds(2)).until(() -> locks.isLocked("a"));

        assertThatThrownBy(() -> locks.withLock("a", () -> "late")).isInstanceOf(IllegalStateException.class);
        assertThat(locks.withLock("b", () -> "other session")).isEqualTo("other session");

        release.countDown();
        assertThat(holder.get(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void unusedLocksAreReleasedForCollection() {
        SessionLockRegistry locks = new SessionLockRegistry(new AssistantSessionProperties());
        for (int i = 0; i < 1_000; i++) {
            locks.withLock("s-" + i, () -> null);
        }

        await().atMost(Duration.ofSeconds(10)).pollInterval(Duration.ofMillis(100)).until(() -> {
            System.gc();
            return locks.size() == 0;
        });
    }

    @Test
    void heldLockStaysRegisteredUnderCollection() throws Exception {
        AssistantSessionProperties props = new AssistantSessionProperties();
        props.setLockTimeout(Duration.ofMillis(100));
        SessionLockRegistry locks = new SessionLockRegistry(props);
        CountDownLatch release = new CountDownLatch(1);

        CompletableFuture<Boolean> holder = CompletableFuture.supplyAsync(() -> locks.withLock("a", () -> {
            try {
                return release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }));
        await().atMost(Duration.ofSeconds(2)).until(() -> locks.isLocked("a"));
        System.gc();

        assertThat(locks.isLocked("a")).isTrue();
        assertThatThrownBy(() -> locks.withLock("a", () -> "late")).isInstanceOf(IllegalStateException.class);

        release.countDown();
        assertThat(holder.get(2, TimeUnit.SECONDS)).isTrue();
    }
}
