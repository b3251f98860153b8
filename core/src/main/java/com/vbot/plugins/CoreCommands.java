package com.vbot.plugins;

import com.vbot.api.CommandRequest;
import com.vbot.api.TransportException;
import com.vbot.core.Kernel;
import com.vbot.core.config.Configuration;
import com.vbot.core.dispatch.DispatchPipeline;
import com.vbot.core.plugin.CommandRoute;
import com.vbot.core.plugin.LoadResult;
import com.vbot.services.logging.CommandLogStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Built-in commands of the static route table. They are always available, whatever
 * extensions are loaded.
 */
public class CoreCommands {
    private static final Logger logger = LoggerFactory.getLogger(CoreCommands.class);
    public static final String NAME = "CoreCommands";

    private static final String DEFAULT_RULES = "📜 **Group Rules**\n\n" +
            "1. Be respectful.\n" +
            "2. No spam or advertising.\n" +
            "3. Follow the admins' instructions.";

    private final Kernel kernel;

    public CoreCommands(Kernel kernel) {
        this.kernel = kernel;
    }

    public void register(DispatchPipeline pipeline) {
        Configuration config = kernel.getConfig();

        // Public
        pipeline.registerBuiltin(config.publicPrefix + "help", this::handleHelp);
        pipeline.registerBuiltin(config.publicPrefix + "rules", this::handleRules);

        // Developer
        pipeline.registerBuiltin(config.developerPrefix + "stats", this::handleStats);
        pipeline.registerBuiltin(config.developerPrefix + "status", this::handleStats);
        pipeline.registerBuiltin(config.developerPrefix + "plugins", this::handlePlugins);
    }

    // =================================================================================
    // TEXTS (also used by tests)
    // =================================================================================

    public String getHelpText() {
        Configuration config = kernel.getConfig();
        StringBuilder sb = new StringBuilder("🤖 **VBot - Help**\n\n");
        appendTier(sb, "Founder Commands", config.developerPrefix);
        appendTier(sb, "Admin Commands", config.adminPrefix);
        appendTier(sb, "Public Commands", config.publicPrefix);
        sb.append("💡 **Prefixes:**\n")
                .append(config.adminPrefix).append(" - Admin commands\n")
                .append(config.developerPrefix).append(" - Founder commands\n")
                .append(config.publicPrefix).append(" - Public commands");
        return sb.toString();
    }

    private void appendTier(StringBuilder sb, String title, String prefix) {
        List<String> names = new ArrayList<>();
        for (String builtin : kernel.getDispatchPipeline().getBuiltins().keySet()) {
            if (builtin.startsWith(prefix))
                names.add(builtin);
        }
        for (String route : kernel.getCommandRegistry().getRoutes().keySet()) {
            if (route.startsWith(prefix) && !names.contains(route))
                names.add(route);
        }
        if (names.isEmpty())
            return;
        names.sort(String::compareTo);
        sb.append("**").append(title).append(":**\n");
        for (String name : names) {
            sb.append("• ").append(name).append("\n");
        }
        sb.append("\n");
    }

    public String getRulesText() {
        return kernel.getConfig().getPluginSetting(NAME, "rules", DEFAULT_RULES);
    }

    public String getStatsText() {
        Duration uptime = Duration.between(kernel.getStartTime(), kernel.getClock().instant());
        Map<String, CommandRoute> routes = kernel.getCommandRegistry().getRoutes();

        StringBuilder sb = new StringBuilder("📊 **VBot Statistics:**\n\n");
        sb.append(String.format("⏱ **Uptime:** %02d:%02d:%02d\n",
                uptime.toHours(), uptime.toMinutesPart(), uptime.toSecondsPart()));
        sb.append("🔌 **Extensions:** ").append(kernel.getCommandRegistry().getLoaded().size()).append(" loaded, ")
                .append(kernel.getCommandRegistry().getFailed().size()).append(" failed\n");
        sb.append("📋 **Commands:** ").append(kernel.getDispatchPipeline().getBuiltins().size()).append(" built-in, ")
                .append(routes.size()).append(" from extensions\n");

        try {
            CommandLogStore store = kernel.getCommandLogStore();
            sb.append("\n📝 **Command Log:**\n")
                    .append("• Successful: ").append(store.countByOutcome(CommandLogStore.SUCCESS)).append("\n")
                    .append("• Failed: ").append(store.countByOutcome(CommandLogStore.FAILED)).append("\n")
                    .append("• Denied: ").append(store.countByOutcome(CommandLogStore.DENIED)).append("\n");
        } catch (Exception e) {
            logger.warn("Command log unavailable for stats: {}", e.getMessage());
            sb.append("\n📝 Command log unavailable\n");
        }
        return sb.toString();
    }

    public String getPluginsText() {
        List<LoadResult> results = kernel.getLoadResults();
        if (results.isEmpty())
            return "🔌 No extensions loaded.";

        StringBuilder loaded = new StringBuilder();
        StringBuilder failed = new StringBuilder();
        int loadedCount = 0;
        int failedCount = 0;
        for (LoadResult result : results) {
            if (result.isLoaded()) {
                loadedCount++;
                loaded.append("• ").append(result.getName()).append("\n");
            } else {
                failedCount++;
                String error = String.valueOf(result.getFault().getMessage());
                if (error.length() > 50)
                    error = error.substring(0, 50);
                failed.append("• ").append(result.getName()).append(": ").append(error).append("\n");
            }
        }

        StringBuilder sb = new StringBuilder("🔌 **Extensions**\n\n");
        sb.append("**Loaded (").append(loadedCount).append("):**\n").append(loaded);
        if (failedCount > 0)
            sb.append("\n**Failed (").append(failedCount).append("):**\n").append(failed);
        return sb.toString();
    }

    // =================================================================================
    // HANDLERS
    // =================================================================================

    private void handleHelp(CommandRequest request) throws TransportException {
        request.reply(getHelpText());
    }

    private void handleRules(CommandRequest request) throws TransportException {
        request.reply(getRulesText());
    }

    private void handleStats(CommandRequest request) throws TransportException {
        answer(request, getStatsText());
    }

    private void handlePlugins(CommandRequest request) throws TransportException {
        answer(request, getPluginsText());
    }

    // Developer output honours the privacy policy
    private void answer(CommandRequest request, String text) throws TransportException {
        if (kernel.getPrivacyManager().shouldAnswerPrivately(request.message())) {
            request.transport().sendMessage(request.message().senderId(), text);
        } else {
            request.reply(text);
        }
    }
}
