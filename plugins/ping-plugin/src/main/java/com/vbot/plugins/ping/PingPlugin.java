package com.vbot.plugins.ping;

import com.vbot.api.BotExtension;
import com.vbot.api.CommandRequest;
import com.vbot.api.MessageRef;
import com.vbot.api.TransportException;
import com.vbot.core.Kernel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Ping - shows latency, processing time and uptime. Available to everyone.
 */
public class PingPlugin implements BotExtension {
    private static final Logger logger = LoggerFactory.getLogger(PingPlugin.class);

    private Kernel kernel;
    private String command = "#ping";

    @Override
    public String getName() {
        return "Ping";
    }

    @Override
    public String getVersion() {
        return "1.1.0";
    }

    @Override
    public void onEnable(Kernel kernel) {
        this.kernel = kernel;
        this.command = kernel.getConfig().publicPrefix + "ping";
        logger.info("✅ Ping plugin ready ({})", command);
    }

    @Override
    public Collection<String> getCommands() {
        return List.of(command);
    }

    @Override
    public void handleCommand(CommandRequest request) throws TransportException {
        Instant now = kernel.getClock().instant();
        String text = buildPong(
                Duration.between(request.message().sentAt(), now),
                request.context() != null ? request.context().elapsed(now) : null,
                Duration.between(kernel.getStartTime(), now));

        // Reuse the acknowledgement placeholder if the pipeline sent one
        Optional<MessageRef> status = request.context() != null
                ? request.context().takeStatusMessage()
                : Optional.empty();
        if (status.isPresent()) {
            try {
                request.transport().editMessage(status.get(), text);
                return;
            } catch (TransportException e) {
                logger.debug("Failed to update ping status message: {}", e.getMessage());
            }
        }
        request.reply(text);
    }

    static String buildPong(Duration latency, Duration processing, Duration uptime) {
        StringBuilder sb = new StringBuilder("🏓 **Pong!**\n");
        sb.append(String.format("**Latency:** `%d ms`\n", Math.max(0, latency.toMillis())));
        if (processing != null)
            sb.append(String.format("**Processing:** `%d ms`\n", processing.toMillis()));
        sb.append("**Uptime:** `").append(formatUptime(uptime)).append("`");
        return sb.toString();
    }

    /**
     * Formats like "1d 2h 3m 4s"; leading zero units are left out.
     */
    static String formatUptime(Duration delta) {
        long total = Math.max(0, delta.getSeconds());
        long days = total / 86400;
        long hours = (total % 86400) / 3600;
        long minutes = (total % 3600) / 60;
        long seconds = total % 60;

        List<String> parts = new ArrayList<>();
        if (days > 0)
            parts.add(days + "d");
        if (hours > 0 || !parts.isEmpty())
            parts.add(hours + "h");
        if (minutes > 0 || !parts.isEmpty())
            parts.add(minutes + "m");
        parts.add(seconds + "s");
        return String.join(" ", parts);
    }
}
