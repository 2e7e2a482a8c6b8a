package io.deskscale.retheme;

/** Start and end signals of a scale operation. Delivery is best effort. */
public interface ScaleNotifier {
    void scalingStarted();

    void scalingDone();
}
