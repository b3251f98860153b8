package com.vbot.core.dispatch;

import java.util.Locale;

public final class CommandNames {

    private CommandNames() {
    }

    /**
     * Lower-cased first token without the "@botname" addressing suffix,
     * so "/Play@SomeBot" and "/play" resolve to the same route.
     */
    public static String normalize(String token) {
        if (token == null)
            return "";
        String cmd = token.trim();
        int space = indexOfWhitespace(cmd);
        if (space >= 0)
            cmd = cmd.substring(0, space);
        int at = cmd.indexOf('@');
        if (at >= 0)
            cmd = cmd.substring(0, at);
        return cmd.toLowerCase(Locale.ROOT);
    }

    private static int indexOfWhitespace(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (Character.isWhitespace(s.charAt(i)))
                return i;
        }
        return -1;
    }
}
