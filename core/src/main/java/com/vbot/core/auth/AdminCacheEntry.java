package com.vbot.core.auth;

import java.util.Collection;
import java.util.Set;

/**
 * Administrator ids of one chat, stamped with the time they were fetched.
 */
public final class AdminCacheEntry {
    private final long chatId;
    private final Set<Long> memberIds;
    private final long fetchedAt;

    public AdminCacheEntry(long chatId, Collection<Long> memberIds, long fetchedAt) {
        this.chatId = chatId;
        this.memberIds = Set.copyOf(memberIds);
        this.fetchedAt = fetchedAt;
    }

    public static AdminCacheEntry empty(long chatId, long now) {
        return new AdminCacheEntry(chatId, Set.of(), now);
    }

    public boolean isStale(long now, long ttlMillis) {
        return now - fetchedAt >= ttlMillis;
    }

    public boolean contains(long userId) {
        return memberIds.contains(userId);
    }

    public Set<Long> getMemberIds() {
        return memberIds;
    }

    @Override
    public String toString() {
        return "AdminCacheEntry(chat=" + chatId + ", admins=" + memberIds.size() + ", fetchedAt=" + fetchedAt + ")";
    }
}
