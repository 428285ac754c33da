package org.notifkit.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NotificationDescriptorTest {

    @Nested
    class Validation {

        @Test
        @DisplayName("Title, body and a non-negative delay make a valid descriptor")
        void minimalDescriptorIsValid() {
            NotificationDescriptor d = new NotificationDescriptor("Title", "Body", 0, "id");

            assertTrue(d.isValid());
            assertTrue(d.validationErrors().isEmpty());
        }

        @Test
        @DisplayName("Every problem is reported at once")
        void collectsAllProblems() {
            NotificationDescriptor d = new NotificationDescriptor("", null, -5, "id");

            List<String> errors = d.validationErrors();

            assertFalse(d.isValid());
            assertEquals(3, errors.size());
            assertTrue(errors.get(2).contains("-5"));
        }

        @Test
        @DisplayName("Delays beyond one year are refused")
        void delayBeyondOneYear() {
            NotificationDescriptor d = new NotificationDescriptor("T", "B",
                    NotificationDescriptor.MAX_DELAY_SECONDS + 1, "id");

            assertEquals(1, d.validationErrors().size());
        }

        @Test
        @DisplayName("A repeating custom interval needs a period")
        void customRepeatNeedsPeriod() {
            NotificationDescriptor d = new NotificationDescriptor("T", "B", 10, "id");
            d.setRepeats(true);
            d.setRepeatInterval(RepeatInterval.CUSTOM);

            assertEquals(List.of("custom repeat without a positive interval"), d.validationErrors());

            d.setCustomRepeatSeconds(120);
            assertTrue(d.validationErrors().isEmpty());
        }
    }

    @Test
    @DisplayName("Repeating requires both the flag and an interval")
    void repeatingNeedsFlagAndInterval() {
        NotificationDescriptor d = new NotificationDescriptor();
        d.setRepeats(true);
        assertFalse(d.isRepeating());

        d.setRepeatInterval(RepeatInterval.DAILY);
        assertTrue(d.isRepeating());

        d.setRepeatInterval(null);
        assertEquals(RepeatInterval.NONE, d.getRepeatInterval());
    }

    @Test
    @DisplayName("copyFrom takes every field and reset restores defaults")
    void copyAndReset() {
        NotificationDescriptor source = new NotificationDescriptor("T", "B", 30, "id");
        source.setSubtitle("S");
        source.setGroupKey("g");
        source.setSoundName("chime");
        source.setBadgeOverride(3);

        NotificationDescriptor copy = new NotificationDescriptor();
        copy.copyFrom(source);

        assertEquals("S", copy.getSubtitle());
        assertEquals("g", copy.getGroupKey());
        assertEquals("chime", copy.getSoundName());
        assertEquals(3, copy.getBadgeOverride());
        assertEquals(30, copy.getFireDelaySeconds());

        copy.reset();
        assertEquals(NotificationDescriptor.DEFAULT_SOUND, copy.getSoundName());
        assertEquals(NotificationDescriptor.NO_BADGE, copy.getBadgeOverride());
        assertEquals(0, copy.getFireDelaySeconds());
    }
}
