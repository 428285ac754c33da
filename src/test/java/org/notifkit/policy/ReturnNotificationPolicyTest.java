package org.notifkit.policy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.notifkit.model.NotificationDescriptor;
import org.notifkit.model.RepeatInterval;
import org.notifkit.model.ReturnNotificationConfig;
import org.notifkit.support.MutableClock;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReturnNotificationPolicyTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

    /**
     * Records the calls in order, as "schedule:id", "cancel:id", "clear", "refresh" and "flush".
     */
    private static final class RecordingCommands implements NotificationCommands {
        final List<String> calls = new ArrayList<>();
        final List<NotificationDescriptor> scheduled = new ArrayList<>();

        @Override
        public boolean schedule(NotificationDescriptor descriptor) {
            calls.add("schedule:" + descriptor.getIdentifier());
            scheduled.add(descriptor);
            return true;
        }

        @Override
        public boolean cancel(String identifier) {
            calls.add("cancel:" + identifier);
            return true;
        }

        @Override
        public void clearDisplayed() {
            calls.add("clear");
        }

        @Override
        public boolean refreshPermission() {
            calls.add("refresh");
            return true;
        }

        @Override
        public void requestFlush() {
            calls.add("flush");
        }
    }

    private MutableClock clock;
    private RecordingCommands commands;
    private ReturnNotificationPolicy policy;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        commands = new RecordingCommands();
        policy = new ReturnNotificationPolicy(commands, clock);
    }

    @Nested
    class Background {

        @Test
        @DisplayName("Going to background schedules the return notification after the configured hours")
        void schedulesReturnNotification() {
            policy.onBackgrounded();

            assertEquals(List.of("cancel:return_notification", "schedule:return_notification", "flush"),
                    commands.calls);
            NotificationDescriptor d = commands.scheduled.get(0);
            assertEquals(24 * 3600, d.getFireDelaySeconds());
            assertEquals(ReturnNotificationConfig.GROUP, d.getGroupKey());
            assertEquals(RepeatInterval.NONE, d.getRepeatInterval());
            assertEquals(START.getEpochSecond(), policy.lastForegroundUnixSeconds());
        }

        @Test
        void repeatingConfigIsCarriedOver() {
            ReturnNotificationConfig d = ReturnNotificationConfig.defaults();
            policy.configure(new ReturnNotificationConfig(true, d.title(), d.body(), 2, true, RepeatInterval.WEEKLY,
                    d.identifier(), d.urgentTitle(), d.urgentBody(), d.urgentDelaySeconds()));
            commands.calls.clear();

            policy.onBackgrounded();

            NotificationDescriptor scheduled = commands.scheduled.get(0);
            assertTrue(scheduled.isRepeating());
            assertEquals(RepeatInterval.WEEKLY, scheduled.getRepeatInterval());
            assertEquals(7200, scheduled.getFireDelaySeconds());
        }

        @Test
        void disabledPolicyOnlyRecordsTheTime() {
            policy.setEnabled(false);
            commands.calls.clear();

            policy.onBackgrounded();

            assertEquals(List.of("flush"), commands.calls);
        }
    }

    @Nested
    class Foreground {

        @Test
        @DisplayName("A short absence cancels, clears and refreshes without an urgent notification")
        void shortAbsence() {
            policy.onBackgrounded();
            clock.advance(Duration.ofHours(2));
            commands.calls.clear();

            policy.onForegrounded();

            assertEquals(List.of("cancel:return_notification", "cancel:return_notification_urgent",
                    "clear", "refresh", "flush"), commands.calls);
            assertEquals(START.plus(Duration.ofHours(2)).getEpochSecond(), policy.lastForegroundUnixSeconds());
        }

        @Test
        @DisplayName("A long absence schedules the urgent notification after the cancellations")
        void longAbsenceSchedulesUrgent() {
            policy.onBackgrounded();
            clock.advance(Duration.ofHours(25));
            commands.calls.clear();
            commands.scheduled.clear();

            policy.onForegrounded();

            assertEquals(List.of("cancel:return_notification", "cancel:return_notification_urgent",
                    "clear", "refresh", "schedule:return_notification_urgent", "flush"), commands.calls);
            NotificationDescriptor urgent = commands.scheduled.get(0);
            assertEquals(60, urgent.getFireDelaySeconds());
            assertEquals(ReturnNotificationConfig.GROUP, urgent.getGroupKey());
        }

        @Test
        @DisplayName("An unknown last foreground time counts as no absence")
        void firstLaunchIsNotAnAbsence() {
            assertEquals(0d, policy.hoursSinceLastForeground());

            policy.onForegrounded();

            assertTrue(commands.scheduled.isEmpty());
        }

        @Test
        void restoredTimestampIsMeasuredAgainst() {
            policy.restore(null, START.minus(Duration.ofHours(30)).getEpochSecond());

            assertEquals(30d, policy.hoursSinceLastForeground(), 0.001);
            policy.onForegrounded();
            assertEquals(1, commands.scheduled.size());
        }
    }

    @Nested
    class Configuration {

        @Test
        @DisplayName("Changing the identifier cancels the notifications under the old one")
        void identifierChangeCancelsOld() {
            ReturnNotificationConfig d = ReturnNotificationConfig.defaults();

            policy.configure(new ReturnNotificationConfig(true, d.title(), d.body(), 24, false, null,
                    "comeback", d.urgentTitle(), d.urgentBody(), 60));

            assertEquals(List.of("cancel:return_notification", "cancel:return_notification_urgent", "flush"),
                    commands.calls);
            assertEquals("comeback", policy.config().identifier());
            assertEquals(RepeatInterval.DAILY, policy.config().repeatInterval());
        }

        @Test
        void disablingCancelsBoth() {
            policy.setEnabled(false);

            assertEquals(List.of("cancel:return_notification", "cancel:return_notification_urgent", "flush"),
                    commands.calls);
        }

        @Test
        void restoreNormalizesWithoutSideEffects() {
            ReturnNotificationConfig d = ReturnNotificationConfig.defaults();

            policy.restore(new ReturnNotificationConfig(false, " ", d.body(), 0, false, null, d.identifier(),
                    null, null, 10), 0L);

            assertTrue(commands.calls.isEmpty());
            assertEquals(1, policy.config().hoursBeforeNotification());
            assertEquals(d.title(), policy.config().title());
            assertEquals(0L, policy.lastForegroundUnixSeconds());
        }
    }
}
