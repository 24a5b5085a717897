package com.banchess.gameservice.games.banchess.service;

import com.banchess.gameservice.games.banchess.application.matchmaking.EnqueueResult;
import com.banchess.gameservice.games.banchess.application.matchmaking.LeaveResult;
import com.banchess.gameservice.games.banchess.domain.model.HistoryEntry;
import com.banchess.gameservice.games.banchess.domain.model.Identity;
import com.banchess.gameservice.games.banchess.domain.model.StateSnapshot;
import com.banchess.gameservice.platform.auth.Credentials;
import com.banchess.rules.Action;

import java.util.concurrent.CompletableFuture;

/**
 * Ban Chess 服务接口：连接上的每条客户端指令对应一个方法。
 *
 * 同步方法的拒绝以 {@link com.banchess.gameservice.common.GameException} 抛出；
 * 需要进入对局信箱的方法返回 CompletableFuture，拒绝以异常完成。
 * 成功后的状态推送由广播统一完成，调用方只需处理错误回执。
 */
public interface BanChessService {

    /** 传输层连接建立（preAuthenticated 可为 null） */
    void connectionOpened(String connectionId, Identity preAuthenticated);

    /** 客户端订阅了个人队列；已预认证的连接此时收到 authenticated */
    void connectionReady(String connectionId);

    /** 传输层连接关闭：离开对局；用户最后一条连接关闭时移出匹配队列 */
    void connectionClosed(String connectionId);

    Identity authenticate(String connectionId, Credentials credentials);

    /**
     * 创建单人自对弈并回复 game-created。
     * @param timeControl 如 "300+0"；null 使用默认，"none" 表示不计时
     */
    String createSolo(String connectionId, String timeControl);

    EnqueueResult joinQueue(String connectionId, String timeControl);

    LeaveResult leaveQueue(String connectionId);

    CompletableFuture<StateSnapshot> attach(String connectionId, String sessionId);

    void detach(String connectionId);

    CompletableFuture<HistoryEntry> submitAction(String connectionId, String sessionId, Action action);

    CompletableFuture<Void> resign(String connectionId, String sessionId);

    /** @return true 表示双方同意，已成和 */
    CompletableFuture<Boolean> offerDraw(String connectionId, String sessionId);

    /** @param seconds null 使用默认秒数 */
    CompletableFuture<Void> giveTime(String connectionId, String sessionId, Integer seconds);
}
