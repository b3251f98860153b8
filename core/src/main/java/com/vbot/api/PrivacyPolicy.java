package com.vbot.api;

@FunctionalInterface
public interface PrivacyPolicy {
    boolean shouldAnswerPrivately(ChatMessage message);
}
