package com.banchess.rules;

import java.util.ArrayList;
import java.util.List;

/**
 * BCN（Ban Chess Notation）编解码。
 * <pre>
 *   b:e2e4   黑方禁掉白方 e2e4
 *   m:d2d4   走子
 *   m:e7e8q  升变
 * </pre>
 */
public final class Bcn {

    private Bcn() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static String encode(Action action) {
        return action.type().bcnPrefix() + ":" + action.uci();
    }

    /**
     * 解析单个 BCN 记号。
     * @throws IllegalArgumentException 记号格式错误
     */
    public static Action decode(String token) {
        if (token == null || token.length() < 6 || token.charAt(1) != ':') {
            throw new IllegalArgumentException("bad bcn token: " + token);
        }
        char prefix = token.charAt(0);
        String body = token.substring(2);
        if (body.length() != 4 && body.length() != 5) {
            throw new IllegalArgumentException("bad bcn token: " + token);
        }
        String from = body.substring(0, 2);
        String to = body.substring(2, 4);
        if (prefix == ActionType.BAN.bcnPrefix()) {
            if (body.length() != 4) {
                throw new IllegalArgumentException("ban cannot carry promotion: " + token);
            }
            return Action.ban(from, to);
        }
        if (prefix == ActionType.MOVE.bcnPrefix()) {
            return Action.move(from, to, body.length() == 5 ? body.substring(4) : null);
        }
        throw new IllegalArgumentException("bad bcn prefix: " + token);
    }

    public static List<String> encodeAll(List<? extends Action> actions) {
        List<String> out = new ArrayList<>(actions.size());
        for (Action a : actions) {
            out.add(encode(a));
        }
        return out;
    }

    public static List<Action> decodeAll(List<String> tokens) {
        List<Action> out = new ArrayList<>(tokens.size());
        for (String t : tokens) {
            out.add(decode(t));
        }
        return out;
    }
}
