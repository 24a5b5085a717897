package com.banchess.rules;

/**
 * 动作类型，同时也是局面所处的阶段：等待禁着 / 等待走子。
 */
public enum ActionType {
    BAN("ban", 'b'),
    MOVE("move", 'm');

    private final String wireName;
    private final char bcnPrefix;

    ActionType(String wireName, char bcnPrefix) {
        this.wireName = wireName;
        this.bcnPrefix = bcnPrefix;
    }

    public String wireName() {
        return wireName;
    }

    public char bcnPrefix() {
        return bcnPrefix;
    }

    public static ActionType fromWire(String s) {
        for (ActionType t : values()) {
            if (t.wireName.equalsIgnoreCase(s)) {
                return t;
            }
        }
        throw new IllegalArgumentException("unknown action type: " + s);
    }
}
