package io.deskscale.retheme;

public interface ScaleListener {
    default void onScalingStarted() {}

    default void onScalingDone() {}
}
