package com.vbot.plugins.roleinfo;

import com.vbot.api.BotExtension;
import com.vbot.api.CommandRequest;
import com.vbot.api.TransportException;
import com.vbot.core.Kernel;
import com.vbot.core.auth.Role;
import com.vbot.core.auth.RoleResolver;
import com.vbot.core.config.Configuration;
import com.vbot.core.plugin.CommandRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Role info - tells users which tier they have in the current chat and which command
 * prefixes they may use. Registers its handlers programmatically and leaves names that
 * another extension already owns alone.
 */
public class RoleInfoPlugin implements BotExtension {
    private static final Logger logger = LoggerFactory.getLogger(RoleInfoPlugin.class);

    private Kernel kernel;
    private final List<String> registered = new ArrayList<>();

    @Override
    public String getName() {
        return "RoleInfo";
    }

    @Override
    public String getVersion() {
        return "1.0.0";
    }

    @Override
    public void onEnable(Kernel kernel) {
        this.kernel = kernel;
        String prefix = kernel.getConfig().publicPrefix;
        CommandRegistry registry = kernel.getCommandRegistry();

        for (String name : List.of(prefix + "role", prefix + "whoami")) {
            if (registry.isHandled(name)) {
                logger.info("Skipping {}; already handled", name);
                continue;
            }
            if (registry.registerHandler("roleinfo", List.of(name), this::handleRole))
                registered.add(name);
        }
        logger.info("✅ RoleInfo plugin loaded: {}", registered);
    }

    List<String> getRegistered() {
        return registered;
    }

    void handleRole(CommandRequest request) throws TransportException {
        RoleResolver roles = kernel.getRoleResolver();
        long userId = request.message().senderId();
        long chatId = request.message().chatId();
        Role role = roles.resolveRole(request.transport(), userId, chatId);
        request.reply(formatRole(role, userId, chatId, kernel.getConfig()));
    }

    static String formatRole(Role role, long userId, long chatId, Configuration config) {
        StringBuilder sb = new StringBuilder("👤 **Role Info**\n\n");
        sb.append("**User ID:** `").append(userId).append("`\n");
        sb.append("**Chat ID:** `").append(chatId).append("`\n");
        sb.append("**Role:** ").append(role.getLabel()).append("\n\n");

        sb.append("**Available prefixes:**\n");
        if (role.isGlobal())
            sb.append("• ").append(config.developerPrefix).append(" Founder commands\n");
        if (role != Role.PUBLIC)
            sb.append("• ").append(config.adminPrefix).append(" Admin commands\n");
        sb.append("• ").append(config.publicPrefix).append(" Public commands");
        return sb.toString();
    }
}
