package io.deskscale.retheme;

import io.deskscale.exception.RethemeException;

/**
 * Re-renders the boot-splash theme at an integer scale. Calls are slow and cannot be cancelled once started;
 * applying the same factor twice is harmless.
 */
@FunctionalInterface
public interface Rethemer {
    void apply(int factor) throws RethemeException;
}
