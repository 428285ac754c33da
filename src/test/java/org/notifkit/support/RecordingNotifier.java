package org.notifkit.support;

import org.notifkit.notifications.DesktopNotifier;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Desktop sink that keeps what it was asked to show.
 */
public final class RecordingNotifier implements DesktopNotifier {

    public final List<String> shown = new CopyOnWriteArrayList<>();
    public final List<Integer> badges = new CopyOnWriteArrayList<>();
    public volatile int clearCalls;
    private volatile Consumer<String> activation;

    @Override
    public void notify(String tag, String title, String message) {
        shown.add(tag + "|" + title + "|" + message);
    }

    @Override
    public void setActivationListener(Consumer<String> listener) {
        this.activation = listener;
    }

    @Override
    public void clearAll() {
        clearCalls++;
    }

    @Override
    public void showBadge(int count) {
        badges.add(count);
    }

    public void activate(String tag) {
        Consumer<String> listener = activation;
        if (listener != null) {
            listener.accept(tag);
        }
    }
}
