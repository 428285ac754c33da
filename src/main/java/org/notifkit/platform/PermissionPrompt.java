package org.notifkit.platform;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * Asks the user whether notifications may be shown.
 */
@FunctionalInterface
public interface PermissionPrompt {

    /**
     * Shows the prompt. {@code answer} must be called exactly once, on any thread.
     */
    void request(Consumer<Boolean> answer);

    /**
     * Permission as currently configured outside the application, when the host can tell.
     */
    default Optional<Boolean> systemSetting() {
        return Optional.empty();
    }

    static PermissionPrompt granting() {
        return answer -> answer.accept(Boolean.TRUE);
    }
}
