package io.deskscale;

import com.google.common.base.Splitter;
import io.deskscale.exception.GlobalExceptionHandler;
import io.deskscale.exception.ScaleValidationException;
import io.deskscale.retheme.ScaleListener;
import io.deskscale.util.DeskscaleConfigPaths;
import io.deskscale.util.Json;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Command line entry point.
 *
 * <pre>
 * deskscale [--config-dir DIR] [--no-notify] set-factors NAME=FACTOR...
 * deskscale [--config-dir DIR] [--no-notify] set-scale FACTOR
 * deskscale [--config-dir DIR] status
 * </pre>
 *
 * Set commands wait for the boot-splash re-theme to finish before exiting.
 */
public final class DeskscaleMain {
    private static final Logger logger = LogManager.getLogger(DeskscaleMain.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    static final String OPT_CONFIG_DIR = "config-dir";
    static final String OPT_NO_NOTIFY = "no-notify";
    private static final Set<String> FLAGS = Set.of(OPT_NO_NOTIFY);

    private static final String USAGE =
            """
            usage: deskscale [--config-dir DIR] [--no-notify] set-factors NAME=FACTOR...
                   deskscale [--config-dir DIR] [--no-notify] set-scale FACTOR
                   deskscale [--config-dir DIR] status""";

    /** Parsed command line: {@code --key value}, {@code --key=value} and bare flags, then positional words. */
    record Invocation(Map<String, String> options, List<String> arguments) {
        boolean hasFlag(String name) {
            return options.containsKey(name);
        }

        @Nullable
        String option(String name) {
            return options.get(name);
        }
    }

    /** Snapshot printed by {@code status}. */
    public record ScaleStatus(
            Path configDir,
            double scaleFactor,
            int windowScale,
            int cursorSize,
            Map<String, Double> screenFactors,
            boolean rethemeActive,
            @Nullable Integer pendingFactor) {}

    private DeskscaleMain() {}

    public static void main(String[] args) {
        Thread.setDefaultUncaughtExceptionHandler(new GlobalExceptionHandler());
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Invocation invocation;
        try {
            invocation = parseArgs(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }
        if (invocation.arguments().isEmpty()) {
            err.println(USAGE);
            return EXIT_USAGE;
        }

        var configDir = DeskscaleConfigPaths.getConfigDir(Optional.ofNullable(invocation.option(OPT_CONFIG_DIR)));
        DeskscaleConfig config;
        try {
            config = DeskscaleConfig.load(configDir);
        } catch (IllegalArgumentException e) {
            err.println("Invalid configuration: " + e.getMessage());
            return EXIT_USAGE;
        }

        try (var session = ScaleSession.open(config, configDir)) {
            return execute(session, invocation, out, err);
        }
    }

    static int execute(ScaleSession session, Invocation invocation, PrintStream out, PrintStream err) {
        var command = invocation.arguments().get(0);
        var rest = invocation.arguments().subList(1, invocation.arguments().size());
        boolean notify = !invocation.hasFlag(OPT_NO_NOTIFY);
        var manager = session.getScaleManager();

        session.getEvents().addListener(new ScaleListener() {
            @Override
            public void onScalingStarted() {
                out.println("SetScaleFactorStarted");
            }

            @Override
            public void onScalingDone() {
                out.println("SetScaleFactorDone");
            }
        });
        try {
            switch (command) {
                case "set-factors" -> manager.setScreenScaleFactors(parseFactors(rest), notify);
                case "set-scale" -> {
                    if (rest.size() != 1) {
                        throw new IllegalArgumentException("set-scale takes exactly one factor");
                    }
                    manager.setScaleFactor(parseFactor(rest.get(0)), notify);
                }
                case "status" -> {
                    out.println(Json.toJson(status(session)));
                    return EXIT_OK;
                }
                default -> throw new IllegalArgumentException("unknown command: " + command);
            }
        } catch (IllegalArgumentException | ScaleValidationException e) {
            err.println(e.getMessage());
            return EXIT_USAGE;
        }

        try {
            var timeout = session.getConfig().rethemeTimeout().plusSeconds(5);
            if (!session.getRethemeQueue().awaitIdle(timeout)) {
                err.println("Boot-splash re-theme still running after " + timeout.toSeconds() + "s");
                return EXIT_FAILURE;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for re-theme", e);
            return EXIT_FAILURE;
        }
        return EXIT_OK;
    }

    static ScaleStatus status(ScaleSession session) {
        var manager = session.getScaleManager();
        var queue = session.getRethemeQueue();
        var pending = queue.pendingFactor();
        return new ScaleStatus(
                session.getConfigDir(),
                manager.getScaleFactor(),
                manager.getWindowScale(),
                manager.getCursorSize(),
                manager.getScreenScaleFactors(),
                queue.isActive(),
                pending.isPresent() ? pending.getAsInt() : null);
    }

    static Invocation parseArgs(String[] args) {
        var options = new HashMap<String, String>();
        var arguments = new ArrayList<String>();
        for (int i = 0; i < args.length; i++) {
            var arg = args[i];
            if (!arguments.isEmpty() || !arg.startsWith("--")) {
                arguments.add(arg);
                continue;
            }
            var withoutPrefix = arg.substring(2);
            if (withoutPrefix.contains("=")) {
                var parts = withoutPrefix.split("=", 2);
                options.put(parts[0], parts[1]);
            } else if (FLAGS.contains(withoutPrefix)) {
                options.put(withoutPrefix, "");
            } else if (i + 1 < args.length) {
                options.put(withoutPrefix, args[++i]);
            } else {
                throw new IllegalArgumentException("missing value for --" + withoutPrefix);
            }
        }
        return new Invocation(options, arguments);
    }

    static Map<String, Double> parseFactors(List<String> pairs) {
        if (pairs.isEmpty()) {
            throw new IllegalArgumentException("set-factors needs at least one NAME=FACTOR");
        }
        var factors = new LinkedHashMap<String, Double>();
        for (var pair : pairs) {
            var kv = Splitter.on('=').limit(2).splitToList(pair);
            if (kv.size() != 2 || kv.get(0).isBlank()) {
                throw new IllegalArgumentException("expected NAME=FACTOR, got '" + pair + "'");
            }
            factors.put(kv.get(0), parseFactor(kv.get(1)));
        }
        return factors;
    }

    private static double parseFactor(String text) {
        try {
            return Double.parseDouble(text.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not a number: '" + text + "'", e);
        }
    }
}
