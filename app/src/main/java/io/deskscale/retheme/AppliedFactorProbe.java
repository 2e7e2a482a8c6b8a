package io.deskscale.retheme;

/** Cheap synchronous lookup of the factor the boot splash currently uses. */
@FunctionalInterface
public interface AppliedFactorProbe {
    int UNKNOWN = 0;

    /** @return the applied factor, or {@link #UNKNOWN} */
    int currentFactor();
}
