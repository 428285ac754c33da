package org.notifkit.dispatch;

import java.util.concurrent.CancellationException;

/**
 * Provides the ability to cancel an asynchronous engine operation.
 */
public final class CancellationSignal {
    private boolean canceled;
    private OnCancelListener onCancelListener;

    /**
     * Returns true if the operation has been canceled.
     */
    public boolean isCanceled() {
        synchronized (this) {
            return canceled;
        }
    }

    /**
     * @throws CancellationException if the operation has been canceled
     */
    public void throwIfCanceled() {
        if (isCanceled()) {
            throw new CancellationException("Operation canceled");
        }
    }

    /**
     * Cancels the operation and signals the cancellation listener. An operation that has not
     * started yet is canceled as soon as it does.
     */
    public void cancel() {
        synchronized (this) {
            if (!canceled) {
                canceled = true;
                if (onCancelListener != null) {
                    onCancelListener.onCancel();
                }
            }
        }
    }

    /**
     * Sets the listener called on cancellation. If {@link #cancel()} already happened, the listener
     * runs immediately. The listener runs under this signal's lock, so it can never fire after it
     * has been replaced.
     *
     * @param listener the listener, or null to remove the current one
     */
    public void setOnCancelListener(OnCancelListener listener) {
        synchronized (this) {
            onCancelListener = listener;
            if (canceled && listener != null) {
                listener.onCancel();
            }
        }
    }

    /**
     * Listens for cancellation.
     */
    public interface OnCancelListener {
        void onCancel();
    }
}
