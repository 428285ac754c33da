package org.notifkit.platform;

/**
 * Receives deliveries from a backend. Called on the backend's timer thread.
 */
public interface DeliveryListener {

    void onReceived(String identifier, String title, String body);

    void onTapped(String identifier, String title, String body);
}
