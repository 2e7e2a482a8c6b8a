package io.deskscale.settings;

import com.google.common.base.Splitter;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Per-monitor scale factors and their {@code name=1.25;other=1.00} text form.
 */
public final class ScreenFactors {
    private static final Logger logger = LogManager.getLogger(ScreenFactors.class);

    /** Key that carries the factor for every monitor when no individual entry applies. */
    public static final String ALL = "ALL";

    private static final Splitter PAIR_SPLITTER = Splitter.on(';').omitEmptyStrings();
    private static final Splitter KV_SPLITTER = Splitter.on('=').limit(2);

    private ScreenFactors() {}

    /** Parses the stored form. Pairs without '=' or with an unparseable value are skipped. */
    public static Map<String, Double> parse(String joined) {
        var result = new LinkedHashMap<String, Double>();
        for (var pair : PAIR_SPLITTER.split(joined)) {
            var kv = KV_SPLITTER.splitToList(pair);
            if (kv.size() != 2) {
                continue;
            }
            try {
                result.put(kv.get(0), Double.parseDouble(kv.get(1)));
            } catch (NumberFormatException e) {
                logger.warn("Skipping malformed screen factor '{}': {}", pair, e.getMessage());
            }
        }
        return result;
    }

    /** Joins the map with two decimals per value, in the map's iteration order. */
    public static String join(Map<String, Double> factors) {
        return factors.entrySet().stream()
                .map(e -> e.getKey() + "=" + format(e.getValue()))
                .collect(Collectors.joining(";"));
    }

    public static String format(double factor) {
        return String.format(Locale.ROOT, "%.2f", factor);
    }

    /**
     * The single factor that stands for the whole map: the sole value, else the {@link #ALL} entry, else 1.0.
     */
    public static double representative(Map<String, Double> factors) {
        if (factors.isEmpty()) {
            return 1.0;
        }
        if (factors.size() == 1) {
            return factors.values().iterator().next();
        }
        var all = factors.get(ALL);
        return all != null ? all : 1.0;
    }
}
