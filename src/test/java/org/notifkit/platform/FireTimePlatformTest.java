package org.notifkit.platform;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.notifkit.model.ChannelConfig;
import org.notifkit.model.Importance;
import org.notifkit.model.NotificationDescriptor;
import org.notifkit.model.RepeatInterval;
import org.notifkit.notifications.error.CapacityExceededException;
import org.notifkit.notifications.error.PlatformException;
import org.notifkit.support.MutableClock;
import org.notifkit.support.RecordingNotifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FireTimePlatformTest {

    private static final Instant NOW = Instant.parse("2024-03-10T12:00:00Z");

    private RecordingNotifier sink;
    private FireTimePlatform platform;

    @BeforeEach
    void setUp() {
        sink = new RecordingNotifier();
        platform = new FireTimePlatform(sink, PermissionPrompt.granting(), new MutableClock(NOW));
    }

    @AfterEach
    void tearDown() {
        platform.shutdown();
    }

    private static NotificationDescriptor descriptor(String id, int delaySeconds) {
        return new NotificationDescriptor("T", "B", delaySeconds, id);
    }

    @Test
    @DisplayName("Nothing is scheduled before a channel exists")
    void channelRequired() {
        PlatformException ex = assertThrows(PlatformException.class, () -> platform.schedule(descriptor("a", 10)));
        assertTrue(ex.getMessage().contains("channel"));
    }

    @Test
    void nullChannelRegistersDefaults() {
        platform.registerChannel(null);

        assertEquals(ChannelConfig.defaults(), platform.channel());
    }

    @Test
    @DisplayName("The 501st pending notification is refused")
    void capIsFiveHundred() {
        platform.registerChannel(ChannelConfig.defaults());
        for (int i = 0; i < 500; i++) {
            platform.schedule(descriptor("n" + i, 3600));
        }

        assertThrows(CapacityExceededException.class, () -> platform.schedule(descriptor("overflow", 3600)));
        assertEquals(500, platform.pendingCount());
    }

    @Test
    @DisplayName("Fixed repeats start at the absolute fire time")
    void repeatsUseAbsoluteTime() {
        platform.registerChannel(ChannelConfig.defaults());
        NotificationDescriptor d = descriptor("weekly", 90);
        d.setRepeats(true);
        d.setRepeatInterval(RepeatInterval.WEEKLY);

        platform.schedule(d);

        assertEquals(Optional.of(NOW.plus(Duration.ofSeconds(90))), platform.nextFireOf("weekly"));
    }

    @Test
    @DisplayName("The badge is shown only when the channel allows it")
    void badgeFollowsChannel() throws Exception {
        platform.registerChannel(new ChannelConfig("quiet", "Quiet", "", Importance.LOW,
                false, false, false, false));
        CountDownLatch received = new CountDownLatch(2);
        platform.setDeliveryListener(new DeliveryListener() {
            @Override
            public void onReceived(String identifier, String title, String body) {
                received.countDown();
            }

            @Override
            public void onTapped(String identifier, String title, String body) {
            }
        });
        NotificationDescriptor quiet = descriptor("quiet", 0);
        quiet.setBadgeOverride(4);
        platform.schedule(quiet);

        platform.registerChannel(ChannelConfig.defaults());
        NotificationDescriptor loud = descriptor("loud", 0);
        loud.setBadgeOverride(3);
        platform.schedule(loud);

        assertTrue(received.await(5, TimeUnit.SECONDS));
        assertEquals(List.of(3), sink.badges);
        assertEquals(2, sink.shown.size());
    }

    @Test
    void permissionGrantedUntilSystemSaysOtherwise() {
        FireTimePlatform revoked = new FireTimePlatform(sink, new PermissionPrompt() {
            @Override
            public void request(Consumer<Boolean> answer) {
                answer.accept(true);
            }

            @Override
            public Optional<Boolean> systemSetting() {
                return Optional.of(false);
            }
        }, new MutableClock(NOW));
        try {
            assertTrue(revoked.hasPermission());
            assertFalse(revoked.refreshPermission());
            assertFalse(revoked.hasPermission());
        } finally {
            revoked.shutdown();
        }
    }
}
