package com.banchess.gameservice.games.banchess.domain.model;

import com.banchess.rules.Color;

import java.util.EnumMap;
import java.util.Map;

/**
 * 对局时钟（单个对局独占，只在该对局的工作线程中访问）。
 * ---------------------------------------
 * - 只记录“剩余时间 + 上次切换时刻”，不做定时；到点判负由 TurnClockCoordinator 负责；
 * - 行动方变化时扣除上一方耗时并给其加秒（Fischer）；
 * - 同一方连续行动（走完紧接着禁着）不切换、不加秒。
 */
public class GameClock {

    private final TimeControl timeControl;
    private final Map<Color, Long> remaining = new EnumMap<>(Color.class);
    private Color active;
    private long lastSwitchAt;

    public GameClock(TimeControl timeControl) {
        this.timeControl = timeControl;
        remaining.put(Color.WHITE, timeControl.initialMillis());
        remaining.put(Color.BLACK, timeControl.initialMillis());
    }

    public TimeControl timeControl() {
        return timeControl;
    }

    public Color active() {
        return active;
    }

    /** 开始为 color 计时（对局开始或恢复时调用） */
    public void start(Color color, long now) {
        active = color;
        lastSwitchAt = now;
    }

    /**
     * 切换到 next 方计时。
     * 与当前计时方相同则只结算耗时，不加秒。
     */
    public void switchTo(Color next, long now) {
        if (active == null) {
            start(next, now);
            return;
        }
        charge(now);
        if (active != next) {
            remaining.merge(active, timeControl.incrementMillis(), Long::sum);
            active = next;
        }
    }

    /** 停表（终局） */
    public void stop(long now) {
        if (active != null) {
            charge(now);
            active = null;
        }
    }

    /** 给 color 方加时 */
    public void give(Color color, long millis, long now) {
        if (active != null) {
            charge(now);
        }
        remaining.merge(color, millis, Long::sum);
    }

    /** color 方在 now 时刻的剩余毫秒（不小于 0） */
    public long remaining(Color color, long now) {
        long left = remaining.get(color);
        if (color == active) {
            left -= now - lastSwitchAt;
        }
        return Math.max(0, left);
    }

    /** 从检查点恢复剩余时间 */
    public void restore(long whiteMs, long blackMs) {
        remaining.put(Color.WHITE, whiteMs);
        remaining.put(Color.BLACK, blackMs);
    }

    /**
     * 以上次切换时刻为锚点的视图：只依赖时钟状态，不随读取时间变化。
     * 计时方的实际剩余 = 剩余 - (当前时间 - serverTime)。
     */
    public ClockView view() {
        return new ClockView(
                Math.max(0, remaining.get(Color.WHITE)),
                Math.max(0, remaining.get(Color.BLACK)),
                active == null ? null : active.wireName(),
                lastSwitchAt);
    }

    private void charge(long now) {
        remaining.merge(active, -(now - lastSwitchAt), Long::sum);
        lastSwitchAt = now;
    }
}
