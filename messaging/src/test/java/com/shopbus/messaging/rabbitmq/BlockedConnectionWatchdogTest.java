package com.shopbus.messaging.rabbitmq;

import com.rabbitmq.client.BlockedCallback;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.UnblockedCallback;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BlockedConnectionWatchdogTest {

    @Mock
    private Connection connection;

    private ScheduledExecutorService scheduler;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void shouldAbortConnectionBlockedPastTimeout() {
        BlockedConnectionWatchdog watchdog =
                new BlockedConnectionWatchdog(connection, Duration.ofMillis(50), scheduler);

        watchdog.onBlocked("low on memory");

        verify(connection, timeout(2000)).abort();
    }

    @Test
    void shouldDisarmWhenUnblockedInTime() {
        BlockedConnectionWatchdog watchdog =
                new BlockedConnectionWatchdog(connection, Duration.ofSeconds(30), scheduler);

        watchdog.onBlocked("low on disk");
        assertThat(watchdog.isArmed()).isTrue();
        watchdog.onUnblocked();

        assertThat(watchdog.isArmed()).isFalse();
        verify(connection, never()).abort();
    }

    @Test
    void shouldArmOnlyOnceForRepeatedBlocks() {
        BlockedConnectionWatchdog watchdog =
                new BlockedConnectionWatchdog(connection, Duration.ofMillis(100), scheduler);

        watchdog.onBlocked("low on memory");
        watchdog.onBlocked("low on memory");

        verify(connection, timeout(2000).times(1)).abort();
    }

    @Test
    void shouldRouteBrokerCallbacksThroughInstalledListener() throws Exception {
        BlockedConnectionWatchdog watchdog =
                new BlockedConnectionWatchdog(connection, Duration.ofSeconds(30), scheduler);
        ArgumentCaptor<BlockedCallback> blocked = ArgumentCaptor.forClass(BlockedCallback.class);
        ArgumentCaptor<UnblockedCallback> unblocked = ArgumentCaptor.forClass(UnblockedCallback.class);

        watchdog.install();
        verify(connection).addBlockedListener(blocked.capture(), unblocked.capture());

        blocked.getValue().handle("resource alarm");
        assertThat(watchdog.isArmed()).isTrue();
        unblocked.getValue().handle();
        assertThat(watchdog.isArmed()).isFalse();
    }
}
