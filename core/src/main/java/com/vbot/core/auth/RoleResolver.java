package com.vbot.core.auth;

import com.vbot.api.ChatTransport;
import com.vbot.core.config.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Resolves a user in a chat to a privilege tier and decides whether a command may run.
 * <p>
 * Owner and developers come from the configuration. Chat admins are fetched through the
 * transport and cached per chat for {@link Configuration#adminCacheTtlSeconds}. Every
 * failure on the way degrades to "not an admin"; nothing here throws to the caller.
 */
public class RoleResolver {
    private static final Logger logger = LoggerFactory.getLogger(RoleResolver.class);

    private final long ownerId;
    private final Set<Long> developerIds;
    private final Set<Long> adminChatIds;
    private final String developerPrefix;
    private final String adminPrefix;
    private final String publicPrefix;
    private final long ttlMillis;
    private final Clock clock;

    private final Map<Long, AdminCacheEntry> adminCache = new ConcurrentHashMap<>();

    public RoleResolver(Configuration config, Clock clock) {
        this.ownerId = config.ownerId;
        this.developerIds = new HashSet<>(config.developerIds);
        this.adminChatIds = new HashSet<>(config.adminChatIds);
        this.developerPrefix = config.developerPrefix;
        this.adminPrefix = config.adminPrefix;
        this.publicPrefix = config.publicPrefix;
        this.ttlMillis = TimeUnit.SECONDS.toMillis(config.adminCacheTtlSeconds);
        this.clock = clock;
    }

    // --- Basic checks ---

    public boolean isOwner(long userId) {
        return ownerId != 0 && userId == ownerId;
    }

    public boolean isDeveloper(long userId) {
        return developerIds.contains(userId);
    }

    public boolean isDeveloperOrOwner(long userId) {
        return isOwner(userId) || isDeveloper(userId);
    }

    public boolean isChatAdmin(ChatTransport transport, long userId, long chatId) {
        if (adminChatIds.contains(chatId))
            return true;

        long now = clock.millis();
        AdminCacheEntry entry = adminCache.get(chatId);
        if (entry == null || entry.isStale(now, ttlMillis)) {
            entry = refresh(transport, chatId, now);
        }
        return entry.contains(userId);
    }

    /**
     * Fetches the admin list. A failed fetch is cached as an empty set for the normal TTL;
     * {@link #invalidate(long)} forces an earlier retry.
     */
    private AdminCacheEntry refresh(ChatTransport transport, long chatId, long now) {
        if (transport == null) {
            logger.warn("No transport available, cannot fetch admins of chat {}", chatId);
            return AdminCacheEntry.empty(chatId, now);
        }
        try {
            List<Long> admins = transport.getChatAdministrators(chatId);
            AdminCacheEntry fresh = new AdminCacheEntry(chatId, admins, now);
            adminCache.put(chatId, fresh);
            logger.debug("Admin cache refreshed: {}", fresh);
            return fresh;
        } catch (Exception e) {
            logger.warn("Failed to fetch admins of chat {}: {}", chatId, e.getMessage());
            AdminCacheEntry empty = AdminCacheEntry.empty(chatId, now);
            adminCache.put(chatId, empty);
            return empty;
        }
    }

    public void invalidate(long chatId) {
        if (adminCache.remove(chatId) != null)
            logger.debug("Admin cache invalidated for chat {}", chatId);
    }

    public void invalidate() {
        adminCache.clear();
        logger.debug("Admin cache cleared");
    }

    // --- Command rules ---

    public CommandTier classifyCommandPrefix(String text) {
        if (text == null || text.isEmpty())
            return CommandTier.NONE;
        // Fixed order: developer before admin before public
        if (text.startsWith(developerPrefix))
            return CommandTier.DEVELOPER;
        if (text.startsWith(adminPrefix))
            return CommandTier.ADMIN;
        if (text.startsWith(publicPrefix))
            return CommandTier.PUBLIC;
        return CommandTier.NONE;
    }

    public boolean authorize(ChatTransport transport, long userId, long chatId, String text) {
        try {
            switch (classifyCommandPrefix(text)) {
                case DEVELOPER:
                    return isDeveloperOrOwner(userId);
                case ADMIN:
                    return isDeveloperOrOwner(userId) || isChatAdmin(transport, userId, chatId);
                case PUBLIC:
                    return true;
                default:
                    return false;
            }
        } catch (RuntimeException e) {
            logger.error("Authorization check failed for user {} in chat {}, denying", userId, chatId, e);
            return false;
        }
    }

    public Role resolveRole(ChatTransport transport, long userId, long chatId) {
        if (isOwner(userId))
            return Role.OWNER;
        if (isDeveloper(userId))
            return Role.DEVELOPER;
        if (isChatAdmin(transport, userId, chatId))
            return Role.CHAT_ADMIN;
        return Role.PUBLIC;
    }

    public String denialMessage(CommandTier tier) {
        switch (tier) {
            case DEVELOPER:
                return "⛔ Access denied. Founder authorization required.";
            case ADMIN:
                return "⛔ Access denied. Admin authorization required.";
            default:
                return "⛔ Access denied.";
        }
    }

    public String getDeveloperPrefix() {
        return developerPrefix;
    }

    public String getAdminPrefix() {
        return adminPrefix;
    }

    public String getPublicPrefix() {
        return publicPrefix;
    }
}
