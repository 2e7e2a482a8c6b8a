package io.deskscale.retheme;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Splitter;
import io.deskscale.exception.RethemeException;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runs an external command that rebuilds the boot-splash theme. Every {@value #FACTOR_PLACEHOLDER} in the
 * command template is replaced with the requested factor.
 */
public final class CommandRethemer implements Rethemer {
    private static final Logger logger = LogManager.getLogger(CommandRethemer.class);

    public static final String FACTOR_PLACEHOLDER = "{factor}";
    static final int MAX_LOGGED_LINES = 200;

    private final List<String> template;
    private final Duration timeout;

    public CommandRethemer(String commandTemplate, Duration timeout) {
        this(Splitter.on(Pattern.compile("\\s+")).omitEmptyStrings().splitToList(commandTemplate), timeout);
    }

    public CommandRethemer(List<String> template, Duration timeout) {
        if (template.isEmpty()) {
            throw new IllegalArgumentException("re-theme command is empty");
        }
        this.template = List.copyOf(template);
        this.timeout = timeout;
    }

    List<String> commandFor(int factor) {
        var factorText = Integer.toString(factor);
        return template.stream()
                .map(arg -> arg.replace(FACTOR_PLACEHOLDER, factorText))
                .toList();
    }

    @Override
    public void apply(int factor) throws RethemeException {
        var command = commandFor(factor);
        var commandText = String.join(" ", command);
        logger.info("Re-theming boot splash: {}", commandText);

        Path output;
        try {
            output = Files.createTempFile("deskscale-retheme-", ".log");
        } catch (IOException e) {
            throw new RethemeException(factor, "cannot create output file", e);
        }
        try {
            var pb = new ProcessBuilder(command);
            pb.redirectErrorStream(true);
            pb.redirectOutput(output.toFile());
            var proc = pb.start();
            boolean finished = proc.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                proc.destroyForcibly();
                throw new RethemeException(factor, "command timed out after " + timeout.toSeconds() + "s");
            }
            logOutput(output);
            if (proc.exitValue() != 0) {
                throw new RethemeException(factor, "command exited with status " + proc.exitValue());
            }
        } catch (IOException e) {
            throw new RethemeException(factor, "failed running '" + commandText + "'", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RethemeException(factor, "interrupted", e);
        } finally {
            try {
                Files.deleteIfExists(output);
            } catch (IOException e) {
                logger.debug("Could not delete {}: {}", output, e.toString());
            }
        }
    }

    /** Logs at most {@value #MAX_LOGGED_LINES} lines of output. Undecodable bytes are replaced, not fatal. */
    private static void logOutput(Path output) {
        try (var is = Files.newInputStream(output);
                var isr = new InputStreamReader(is, UTF_8);
                var br = new BufferedReader(isr)) {
            String line;
            int count = 0;
            while ((line = br.readLine()) != null) {
                if (++count > MAX_LOGGED_LINES) {
                    logger.debug("[retheme] ... output truncated after {} lines", MAX_LOGGED_LINES);
                    return;
                }
                logger.debug("[retheme] {}", line);
            }
        } catch (IOException e) {
            logger.debug("Could not read re-theme output {}: {}", output, e.toString());
        }
    }
}
