package com.banchess.gameservice.games.banchess.domain.model;

import com.banchess.gameservice.common.ErrorCode;
import com.banchess.gameservice.common.GameException;
import com.banchess.gameservice.games.banchess.domain.constants.GameMessages;
import com.banchess.gameservice.games.banchess.domain.enums.GameMode;
import com.banchess.gameservice.games.banchess.domain.enums.SessionStatus;
import com.banchess.gameservice.games.banchess.domain.enums.TerminationReason;
import com.banchess.rules.Action;
import com.banchess.rules.ActionType;
import com.banchess.rules.BanChessPosition;
import com.banchess.rules.Color;
import com.banchess.rules.GameOutcome;
import com.banchess.rules.IllegalActionException;
import com.banchess.rules.RulesEngine;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * GameSession
 * ---------------------------------------
 * 单个对局的状态机：禁着/走子交替、合法性校验、终局判定、时钟、提和、送时间。
 *
 * 线程模型：
 *  - 非线程安全，只能在该对局的工作线程（SessionMailbox）中调用；
 *  - 对外读取一律通过 {@link #view()} 生成的不可变 SessionView。
 *
 * 拒绝语义：
 *  - 所有校验都在修改任何字段之前完成，被拒绝的动作不会留下任何痕迹；
 *  - 拒绝以 {@link GameException} 抛出，由调用方回给发起连接。
 */
public class GameSession {

    /** 快照中保留的最近事件条数 */
    private static final int RECENT_EVENTS = 10;

    private final String id;
    private final GameMode mode;
    private final Identity white;
    private final Identity black;
    private final RulesEngine rules;
    private final Clock clock;
    private final GameClock gameClock;
    private final long createdAt;

    private SessionStatus status = SessionStatus.WAITING;
    private BanChessPosition position = BanChessPosition.initial();
    private final List<HistoryEntry> history = new ArrayList<>();
    private final List<GameEvent> events = new ArrayList<>();
    private final List<GameEvent> unpublished = new ArrayList<>();
    private GameResult result;
    private Color drawOfferFrom;
    private long startedAt;
    private long endedAt;
    private long lastActionAt;
    private long revision;

    /**
     * @param timeControl 为 null 表示不计时
     */
    public GameSession(String id, GameMode mode, Identity white, Identity black,
                       TimeControl timeControl, RulesEngine rules, Clock clock) {
        this.id = id;
        this.mode = mode;
        this.white = white;
        this.black = black;
        this.rules = rules;
        this.clock = clock;
        this.gameClock = timeControl == null ? null : new GameClock(timeControl);
        this.createdAt = clock.millis();
    }

    // ---------------------------------------------------------------- 生命周期

    /**
     * WAITING → ACTIVE，并为第一个行动方（黑方禁着）启动时钟。
     */
    public void activate() {
        if (status != SessionStatus.WAITING) {
            throw new GameException(ErrorCode.NOT_ACTIVE, GameMessages.formatNotWaiting(status.wireName()));
        }
        long now = clock.millis();
        status = SessionStatus.ACTIVE;
        startedAt = now;
        lastActionAt = now;
        if (gameClock != null) {
            gameClock.start(position.actor(), now);
        }
        revision++;
    }

    // ---------------------------------------------------------------- 动作

    /**
     * 提交一个禁着或走子。
     *
     * @param role   提交方颜色（单人对局由调用方传入当前应行动方）
     * @param action 动作
     * @return 新追加的历史记录
     * @throws GameException NOT_ACTIVE / WRONG_ROLE / WRONG_PHASE / ILLEGAL_ACTION
     */
    public HistoryEntry submitAction(Color role, Action action) {
        requireActive();
        if (action == null) {
            throw new GameException(ErrorCode.PROTOCOL, GameMessages.ACTION_REQUIRED);
        }
        Color expected = position.actor();
        if (role != expected) {
            throw new GameException(ErrorCode.WRONG_ROLE, GameMessages.formatNotYourTurn(expected.wireName()));
        }
        if (action.type() != position.phase()) {
            throw new GameException(ErrorCode.WRONG_PHASE, GameMessages.formatWrongPhase(position.phase().wireName()));
        }
        BanChessPosition next;
        try {
            next = rules.apply(position, action);
        } catch (IllegalActionException e) {
            throw new GameException(ErrorCode.ILLEGAL_ACTION, e.getMessage());
        }

        // 校验全部通过，开始修改状态
        long now = clock.millis();
        HistoryEntry entry = new HistoryEntry(
                history.size() + 1,
                role.wireName(),
                action.type().wireName(),
                action.uci(),
                action.toBcn(),
                next.fen(),
                now,
                now - lastActionAt);
        history.add(entry);
        position = next;
        lastActionAt = now;
        if (action.type() == ActionType.MOVE && drawOfferFrom != null) {
            // 对手走子视为拒绝和棋
            if (drawOfferFrom != role) {
                addEvent(new GameEvent(GameEvent.DRAW_DECLINED, role.wireName(),
                        GameMessages.formatDrawDeclined(participant(role).displayName()), now));
            }
            drawOfferFrom = null;
        }

        // 终局判定与状态迁移同步完成
        GameOutcome outcome = rules.evaluate(next);
        if (outcome.isTerminal()) {
            finish(outcome.winner(), toReason(outcome.termination()), now);
        } else if (gameClock != null) {
            gameClock.switchTo(next.actor(), now);
        }
        revision++;
        return entry;
    }

    /**
     * 认输：不需要合法性校验，直接终局。
     * @param role 认输方
     */
    public void resign(Color role) {
        requireActive();
        finish(role.opposite(), TerminationReason.RESIGNATION, clock.millis());
        revision++;
    }

    /**
     * 时钟到期（由计时器注入）。
     *
     * @param color            到期方
     * @param expectedRevision 计时器启动时的 revision；期间有任何状态变更（新动作、送时间）则本次到期作废
     * @return true 表示本次到期生效
     */
    public boolean timeout(Color color, long expectedRevision) {
        if (status != SessionStatus.ACTIVE || gameClock == null) {
            return false;
        }
        if (revision != expectedRevision || position.actor() != color) {
            return false;
        }
        long now = clock.millis();
        finish(color.opposite(), TerminationReason.TIMEOUT, now);
        revision++;
        return true;
    }

    /**
     * 断线宽限期到期（由重连计时器注入）。
     * 在线对局判对方胜（timeout-forfeit）；单人对局记为放弃（无胜负）。
     *
     * @return true 表示本次判负生效；对局已结束时返回 false
     */
    public boolean forfeit(Color color) {
        if (status != SessionStatus.ACTIVE) {
            return false;
        }
        long now = clock.millis();
        if (mode == GameMode.SOLO) {
            finish(null, TerminationReason.ABANDONMENT, now);
        } else {
            finish(color.opposite(), TerminationReason.TIMEOUT_FORFEIT, now);
        }
        revision++;
        return true;
    }

    /**
     * 提和。对方已有未撤回的提和时直接成和。
     *
     * @return true 表示双方同意，已终局
     */
    public boolean offerDraw(Color role) {
        requireActive();
        requireOnline(GameMessages.DRAW_NOT_IN_SOLO);
        long now = clock.millis();
        if (drawOfferFrom == role.opposite()) {
            finish(null, TerminationReason.DRAW_AGREEMENT, now);
            revision++;
            return true;
        }
        if (drawOfferFrom == role) {
            return false;
        }
        drawOfferFrom = role;
        addEvent(new GameEvent(GameEvent.DRAW_OFFERED, role.wireName(),
                GameMessages.formatDrawOffered(participant(role).displayName()), now));
        revision++;
        return false;
    }

    /**
     * 给对手加时。
     *
     * @param giver   送时间的一方
     * @param seconds 秒数
     */
    public void giveTime(Color giver, int seconds) {
        requireActive();
        requireOnline(GameMessages.GIVE_TIME_NOT_IN_SOLO);
        if (gameClock == null) {
            throw new GameException(ErrorCode.UNSUPPORTED, GameMessages.GIVE_TIME_UNTIMED);
        }
        if (seconds <= 0 || seconds > 300) {
            throw new GameException(ErrorCode.PROTOCOL, GameMessages.GIVE_TIME_RANGE);
        }
        long now = clock.millis();
        Color recipient = giver.opposite();
        gameClock.give(recipient, seconds * 1000L, now);
        addEvent(new GameEvent(GameEvent.TIME_GIVEN, giver.wireName(),
                GameMessages.formatTimeGiven(participant(giver).displayName(), seconds,
                        participant(recipient).displayName()), now));
        revision++;
    }

    /**
     * 记录一条提示性事件（断线/重连等），不影响局面。
     */
    public void recordEvent(String type, Color color, String message) {
        if (status == SessionStatus.FINISHED) {
            return;
        }
        addEvent(new GameEvent(type, color == null ? null : color.wireName(), message, clock.millis()));
        revision++;
    }

    /**
     * 工作线程内部故障：仅结束本局，记为 error。
     */
    public void abort() {
        if (status == SessionStatus.FINISHED) {
            return;
        }
        finish(null, TerminationReason.ERROR, clock.millis());
        revision++;
    }

    // ---------------------------------------------------------------- 恢复

    /**
     * 按检查点重放动作，得到一个进行中的对局。
     * 动作间隔按 moveTimes 还原；时钟按检查点的剩余时间恢复。
     *
     * @throws IllegalActionException 检查点历史与规则不符
     */
    public void restore(List<? extends Action> actions, List<Long> moveTimes,
                        long checkpointStartedAt, Long whiteMs, Long blackMs) {
        if (status != SessionStatus.WAITING || !history.isEmpty()) {
            throw new IllegalStateException("restore requires a fresh session");
        }
        long at = checkpointStartedAt;
        BanChessPosition p = position;
        for (int i = 0; i < actions.size(); i++) {
            Action a = actions.get(i);
            Color actor = p.actor();
            p = rules.apply(p, a);
            long elapsed = (moveTimes != null && i < moveTimes.size()) ? moveTimes.get(i) : 0L;
            at += elapsed;
            history.add(new HistoryEntry(i + 1, actor.wireName(), a.type().wireName(),
                    a.uci(), a.toBcn(), p.fen(), at, elapsed));
        }
        position = p;
        long now = clock.millis();
        status = SessionStatus.ACTIVE;
        startedAt = checkpointStartedAt;
        lastActionAt = now;
        if (gameClock != null) {
            if (whiteMs != null && blackMs != null) {
                gameClock.restore(whiteMs, blackMs);
            }
            gameClock.start(position.actor(), now);
        }
        GameOutcome outcome = rules.evaluate(position);
        if (outcome.isTerminal()) {
            finish(outcome.winner(), toReason(outcome.termination()), now);
        }
        revision++;
    }

    // ---------------------------------------------------------------- 查询

    public String id() {
        return id;
    }

    public GameMode mode() {
        return mode;
    }

    public SessionStatus status() {
        return status;
    }

    public BanChessPosition position() {
        return position;
    }

    public GameResult result() {
        return result;
    }

    public long revision() {
        return revision;
    }

    public List<HistoryEntry> history() {
        return Collections.unmodifiableList(history);
    }

    public Identity participant(Color color) {
        return color == Color.WHITE ? white : black;
    }

    /**
     * 取走自上次调用以来新产生的事件（用于单独推送 game-event）。
     */
    public List<GameEvent> drainNewEvents() {
        if (unpublished.isEmpty()) {
            return List.of();
        }
        List<GameEvent> out = List.copyOf(unpublished);
        unpublished.clear();
        return out;
    }

    /**
     * 生成当前状态的不可变视图。
     */
    public SessionView view() {
        boolean active = status == SessionStatus.ACTIVE;
        List<String> legal;
        if (active) {
            List<Action> actions = rules.legalActions(position);
            legal = new ArrayList<>(actions.size());
            for (Action a : actions) {
                legal.add(a.uci());
            }
        } else {
            legal = List.of();
        }
        return new SessionView(
                id,
                mode,
                status,
                white,
                black,
                position.fen(),
                active ? position.phase() : null,
                active ? position.actor() : null,
                position.bannedMove() == null ? null : position.bannedMove().uci(),
                rules.inCheck(position),
                List.copyOf(history),
                List.copyOf(legal),
                result,
                gameClock == null ? null : gameClock.timeControl().toString(),
                gameClock == null ? null : gameClock.view(),
                List.copyOf(events),
                drawOfferFrom,
                revision,
                createdAt,
                startedAt,
                endedAt);
    }

    // ---------------------------------------------------------------- 内部

    private void requireActive() {
        if (status == SessionStatus.FINISHED) {
            throw new GameException(ErrorCode.NOT_ACTIVE, GameMessages.GAME_ALREADY_OVER);
        }
        if (status != SessionStatus.ACTIVE) {
            throw new GameException(ErrorCode.NOT_ACTIVE, GameMessages.GAME_NOT_STARTED);
        }
    }

    private void requireOnline(String message) {
        if (mode == GameMode.SOLO) {
            throw new GameException(ErrorCode.UNSUPPORTED, message);
        }
    }

    private void addEvent(GameEvent event) {
        events.add(event);
        if (events.size() > RECENT_EVENTS) {
            events.remove(0);
        }
        unpublished.add(event);
    }

    private void finish(Color winner, TerminationReason reason, long now) {
        status = SessionStatus.FINISHED;
        result = new GameResult(winner, reason);
        endedAt = now;
        drawOfferFrom = null;
        if (gameClock != null) {
            gameClock.stop(now);
        }
    }

    private static TerminationReason toReason(GameOutcome.Termination termination) {
        switch (termination) {
            case CHECKMATE:
                return TerminationReason.CHECKMATE;
            case STALEMATE:
                return TerminationReason.STALEMATE;
            case INSUFFICIENT_MATERIAL:
                return TerminationReason.INSUFFICIENT_MATERIAL;
            default:
                throw new IllegalArgumentException("not terminal: " + termination);
        }
    }
}
