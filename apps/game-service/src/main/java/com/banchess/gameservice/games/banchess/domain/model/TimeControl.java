package com.banchess.gameservice.games.banchess.domain.model;

/**
 * 时间控制：初始秒数 + 每步加秒（Fischer）。文本形式 "300+0"。
 */
public record TimeControl(int initialSeconds, int incrementSeconds) {

    public static final TimeControl DEFAULT = new TimeControl(300, 0);

    public TimeControl {
        if (initialSeconds <= 0 || initialSeconds > 3 * 60 * 60) {
            throw new IllegalArgumentException("initial seconds out of range: " + initialSeconds);
        }
        if (incrementSeconds < 0 || incrementSeconds > 180) {
            throw new IllegalArgumentException("increment seconds out of range: " + incrementSeconds);
        }
    }

    /**
     * 解析 "initial+increment"。
     * @throws IllegalArgumentException 格式或数值不合法
     */
    public static TimeControl parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("time control is blank");
        }
        String[] parts = text.trim().split("\\+");
        if (parts.length != 2) {
            throw new IllegalArgumentException("time control must look like 300+0: " + text);
        }
        try {
            return new TimeControl(Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("time control must look like 300+0: " + text, e);
        }
    }

    public long initialMillis() {
        return initialSeconds * 1000L;
    }

    public long incrementMillis() {
        return incrementSeconds * 1000L;
    }

    @Override
    public String toString() {
        return initialSeconds + "+" + incrementSeconds;
    }
}
