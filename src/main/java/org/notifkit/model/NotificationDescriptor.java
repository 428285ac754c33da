package org.notifkit.model;

import org.notifkit.pool.Poolable;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable description of one local notification. Instances are recycled through the engine's
 * descriptor pool, so callers must not keep a reference after handing one to the engine.
 */
public final class NotificationDescriptor implements Poolable {

    public static final int MAX_DELAY_SECONDS = 365 * 24 * 3600;
    public static final String DEFAULT_SOUND = "default";
    public static final String DEFAULT_GROUP = "default_group";
    public static final int NO_BADGE = -1;

    private String title;
    private String body;
    private String subtitle;
    private int fireDelaySeconds;
    private String identifier;
    private boolean repeats;
    private RepeatInterval repeatInterval = RepeatInterval.NONE;
    private int customRepeatSeconds;
    private String soundName = DEFAULT_SOUND;
    private String groupKey = DEFAULT_GROUP;
    private int badgeOverride = NO_BADGE;

    public NotificationDescriptor() {
    }

    public NotificationDescriptor(String title, String body, int fireDelaySeconds, String identifier) {
        this.title = title;
        this.body = body;
        this.fireDelaySeconds = fireDelaySeconds;
        this.identifier = identifier;
    }

    public boolean isValid() {
        return notEmpty(title) && notEmpty(body) && fireDelaySeconds >= 0;
    }

    /**
     * Lists every reason the descriptor would be rejected, including a delay above one year and a
     * custom repeat without an interval.
     */
    public List<String> validationErrors() {
        List<String> errors = new ArrayList<>(3);
        if (!notEmpty(title)) {
            errors.add("missing title");
        }
        if (!notEmpty(body)) {
            errors.add("missing body");
        }
        if (fireDelaySeconds < 0) {
            errors.add("negative fire delay: " + fireDelaySeconds);
        } else if (fireDelaySeconds > MAX_DELAY_SECONDS) {
            errors.add("fire delay beyond one year: " + fireDelaySeconds);
        }
        if (isRepeating() && repeatInterval == RepeatInterval.CUSTOM && customRepeatSeconds <= 0) {
            errors.add("custom repeat without a positive interval");
        }
        return errors;
    }

    public boolean isRepeating() {
        return repeats && repeatInterval != RepeatInterval.NONE;
    }

    @Override
    public void reset() {
        title = null;
        body = null;
        subtitle = null;
        identifier = null;
        fireDelaySeconds = 0;
        repeats = false;
        repeatInterval = RepeatInterval.NONE;
        customRepeatSeconds = 0;
        soundName = DEFAULT_SOUND;
        groupKey = DEFAULT_GROUP;
        badgeOverride = NO_BADGE;
    }

    public void copyFrom(NotificationDescriptor source) {
        title = source.title;
        body = source.body;
        subtitle = source.subtitle;
        fireDelaySeconds = source.fireDelaySeconds;
        identifier = source.identifier;
        repeats = source.repeats;
        repeatInterval = source.repeatInterval;
        customRepeatSeconds = source.customRepeatSeconds;
        soundName = source.soundName;
        groupKey = source.groupKey;
        badgeOverride = source.badgeOverride;
    }

    private static boolean notEmpty(String value) {
        return value != null && !value.isEmpty();
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getBody() {
        return body;
    }

    public void setBody(String body) {
        this.body = body;
    }

    public String getSubtitle() {
        return subtitle;
    }

    public void setSubtitle(String subtitle) {
        this.subtitle = subtitle;
    }

    public int getFireDelaySeconds() {
        return fireDelaySeconds;
    }

    public void setFireDelaySeconds(int fireDelaySeconds) {
        this.fireDelaySeconds = fireDelaySeconds;
    }

    public String getIdentifier() {
        return identifier;
    }

    public void setIdentifier(String identifier) {
        this.identifier = identifier;
    }

    public boolean isRepeats() {
        return repeats;
    }

    public void setRepeats(boolean repeats) {
        this.repeats = repeats;
    }

    public RepeatInterval getRepeatInterval() {
        return repeatInterval;
    }

    public void setRepeatInterval(RepeatInterval repeatInterval) {
        this.repeatInterval = repeatInterval == null ? RepeatInterval.NONE : repeatInterval;
    }

    public int getCustomRepeatSeconds() {
        return customRepeatSeconds;
    }

    public void setCustomRepeatSeconds(int customRepeatSeconds) {
        this.customRepeatSeconds = customRepeatSeconds;
    }

    public String getSoundName() {
        return soundName;
    }

    public void setSoundName(String soundName) {
        this.soundName = soundName;
    }

    public String getGroupKey() {
        return groupKey;
    }

    public void setGroupKey(String groupKey) {
        this.groupKey = groupKey;
    }

    public int getBadgeOverride() {
        return badgeOverride;
    }

    public void setBadgeOverride(int badgeOverride) {
        this.badgeOverride = badgeOverride;
    }

    @Override
    public String toString() {
        return "NotificationDescriptor{" +
                "identifier='" + identifier + '\'' +
                ", title='" + title + '\'' +
                ", fireDelaySeconds=" + fireDelaySeconds +
                ", repeatInterval=" + repeatInterval +
                ", groupKey='" + groupKey + '\'' +
                '}';
    }
}
