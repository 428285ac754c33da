package org.notifkit.pool;

/**
 * Object that can be recycled through an {@link ObjectPool}.
 */
public interface Poolable {

    /**
     * Restores every field to its freshly constructed value.
     */
    void reset();
}
