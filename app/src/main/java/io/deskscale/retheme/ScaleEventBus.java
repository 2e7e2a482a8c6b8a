package io.deskscale.retheme;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * {@link ScaleNotifier} that fans signals out to registered listeners on the emitting thread. A listener that
 * throws is logged and skipped; the remaining listeners still run.
 */
public final class ScaleEventBus implements ScaleNotifier {
    private static final Logger logger = LogManager.getLogger(ScaleEventBus.class);

    private final List<ScaleListener> listeners = new CopyOnWriteArrayList<>();

    public void addListener(ScaleListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ScaleListener listener) {
        listeners.remove(listener);
    }

    @Override
    public void scalingStarted() {
        logger.debug("Emitting SetScaleFactorStarted to {} listener(s)", listeners.size());
        for (var listener : listeners) {
            try {
                listener.onScalingStarted();
            } catch (RuntimeException e) {
                logger.warn("Scale listener {} failed on start", listener, e);
            }
        }
    }

    @Override
    public void scalingDone() {
        logger.debug("Emitting SetScaleFactorDone to {} listener(s)", listeners.size());
        for (var listener : listeners) {
            try {
                listener.onScalingDone();
            } catch (RuntimeException e) {
                logger.warn("Scale listener {} failed on done", listener, e);
            }
        }
    }
}
