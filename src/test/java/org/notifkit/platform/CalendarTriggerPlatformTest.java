package org.notifkit.platform;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.notifkit.model.NotificationDescriptor;
import org.notifkit.model.NotificationStatus;
import org.notifkit.model.RepeatInterval;
import org.notifkit.notifications.error.CapacityExceededException;
import org.notifkit.notifications.error.PlatformException;
import org.notifkit.support.MutableClock;
import org.notifkit.support.RecordingNotifier;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CalendarTriggerPlatformTest {

    private static final Instant NOW = Instant.parse("2024-01-01T08:00:00Z");

    private MutableClock clock;
    private RecordingNotifier sink;
    private CalendarTriggerPlatform platform;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        sink = new RecordingNotifier();
        platform = new CalendarTriggerPlatform(sink, PermissionPrompt.granting(), clock, true);
    }

    @AfterEach
    void tearDown() {
        platform.shutdown();
    }

    private static NotificationDescriptor descriptor(String id, int delaySeconds) {
        return new NotificationDescriptor("Title " + id, "Body " + id, delaySeconds, id);
    }

    @Nested
    class Scheduling {

        @Test
        @DisplayName("The 65th pending notification is refused")
        void capIsSixtyFour() {
            for (int i = 0; i < 64; i++) {
                platform.schedule(descriptor("n" + i, 3600));
            }

            assertEquals(64, platform.maxPending());
            assertThrows(CapacityExceededException.class, () -> platform.schedule(descriptor("overflow", 3600)));
            platform.schedule(descriptor("n0", 7200));
            assertEquals(64, platform.pendingCount());
        }

        @Test
        void idsAreSequentialAndStatusFollowsThem() {
            int first = platform.schedule(descriptor("a", 3600));
            int second = platform.schedule(descriptor("b", 3600));

            assertEquals(first + 1, second);
            assertEquals(NotificationStatus.SCHEDULED, platform.queryStatus("a", first));
            assertEquals(NotificationStatus.UNKNOWN, platform.queryStatus("a", second));
            assertEquals(NotificationStatus.NOT_FOUND, platform.queryStatus("zzz", 1));
        }

        @Test
        @DisplayName("A cancel carrying an outdated id is ignored")
        void staleCancelIgnored() {
            int id = platform.schedule(descriptor("a", 3600));

            platform.cancel("a", id + 100);
            assertEquals(NotificationStatus.SCHEDULED, platform.queryStatus("a", id));

            platform.cancel("a", id);
            assertEquals(NotificationStatus.NOT_FOUND, platform.queryStatus("a", id));
        }

        @Test
        void missingIdentifierIsRefused() {
            assertThrows(PlatformException.class, () -> platform.schedule(descriptor(null, 10)));
        }

        @Test
        void shutDownBackendRefusesWork() {
            platform.shutdown();

            assertThrows(PlatformException.class, () -> platform.schedule(descriptor("late", 10)));
        }
    }

    @Nested
    class Repeats {

        @Test
        @DisplayName("Daily repeats fire at the wall-clock time of the first occurrence")
        void dailyUsesCalendarTime() {
            NotificationDescriptor d = descriptor("daily", 3600);
            d.setRepeats(true);
            d.setRepeatInterval(RepeatInterval.DAILY);

            platform.schedule(d);

            assertEquals(Optional.of(Instant.parse("2024-01-01T09:00:00Z")), platform.nextFireOf("daily"));
        }

        @Test
        @DisplayName("Custom repeats shorter than a minute are raised to a minute")
        void customRepeatHasAFloor() {
            NotificationDescriptor d = descriptor("custom", 0);
            d.setRepeats(true);
            d.setRepeatInterval(RepeatInterval.CUSTOM);
            d.setCustomRepeatSeconds(10);

            platform.schedule(d);

            assertEquals(Optional.of(NOW.plus(CalendarTriggerPlatform.MIN_REPEAT_INTERVAL)),
                    platform.nextFireOf("custom"));
        }
    }

    @Nested
    class Badge {

        @Test
        void autoIncrementCountsEverySchedule() {
            platform.schedule(descriptor("a", 3600));
            platform.schedule(descriptor("b", 3600));

            assertEquals(2, platform.badgeCount());
        }

        @Test
        @DisplayName("Clearing displayed notifications resets the badge")
        void clearResetsBadge() {
            platform.schedule(descriptor("a", 3600));

            platform.cancelAllDisplayed();

            assertEquals(0, platform.badgeCount());
            assertEquals(1, sink.clearCalls);
            assertEquals(List.of(0), sink.badges);
        }

        @Test
        void overrideBecomesCounterWithoutAutoIncrement() {
            CalendarTriggerPlatform manual = new CalendarTriggerPlatform(sink, PermissionPrompt.granting(), clock, false);
            try {
                NotificationDescriptor d = descriptor("a", 3600);
                d.setBadgeOverride(7);
                manual.schedule(d);
                manual.schedule(descriptor("b", 3600));

                assertEquals(7, manual.badgeCount());
            } finally {
                manual.shutdown();
            }
        }
    }

    @Nested
    class Delivery {

        @Test
        @DisplayName("A due notification is shown, reported, and can be tapped")
        void firesAndReportsTap() throws Exception {
            CountDownLatch received = new CountDownLatch(1);
            List<String> tapped = new CopyOnWriteArrayList<>();
            platform.setDeliveryListener(new DeliveryListener() {
                @Override
                public void onReceived(String identifier, String title, String body) {
                    received.countDown();
                }

                @Override
                public void onTapped(String identifier, String title, String body) {
                    tapped.add(identifier + ":" + title);
                }
            });

            int id = platform.schedule(descriptor("now", 0));

            assertTrue(received.await(5, TimeUnit.SECONDS));
            assertEquals(List.of("now|Title now|Body now"), sink.shown);
            assertEquals(List.of(1), sink.badges);
            assertEquals(NotificationStatus.DELIVERED, platform.queryStatus("now", id));

            sink.activate("now");
            assertEquals(List.of("now:Title now"), tapped);

            platform.cancelAllDisplayed();
            assertEquals(NotificationStatus.EXPIRED, platform.queryStatus("now", id));
        }
    }

    @Nested
    class Permission {

        @Test
        @DisplayName("Permission starts undecided and follows the prompt's answer")
        void promptDecides() {
            AtomicReference<Boolean> answer = new AtomicReference<>();
            assertFalse(platform.hasPermission());

            platform.requestPermission(answer::set);

            assertEquals(Boolean.TRUE, answer.get());
            assertTrue(platform.hasPermission());
        }

        @Test
        void decidedPermissionIsNotAskedAgain() {
            CountDownLatch asked = new CountDownLatch(2);
            CalendarTriggerPlatform denying = new CalendarTriggerPlatform(sink, a -> {
                asked.countDown();
                a.accept(false);
            }, clock, true);
            try {
                AtomicReference<Boolean> answer = new AtomicReference<>();
                denying.requestPermission(answer::set);
                denying.requestPermission(answer::set);

                assertEquals(Boolean.FALSE, answer.get());
                assertEquals(1, asked.getCount());
            } finally {
                denying.shutdown();
            }
        }
    }
}
