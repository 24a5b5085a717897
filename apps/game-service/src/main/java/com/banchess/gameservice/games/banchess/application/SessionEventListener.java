package com.banchess.gameservice.games.banchess.application;

import com.banchess.gameservice.games.banchess.domain.model.GameEvent;
import com.banchess.gameservice.games.banchess.domain.model.SessionView;

/**
 * 对局变更监听器。
 * 回调在该对局的工作线程上执行，实现方不得阻塞（广播、定时器登记、尽力而为的持久化）。
 */
public interface SessionEventListener {

    /**
     * 对局状态已变更（revision 递增）。
     * @param view 变更后的不可变视图
     */
    void onSessionChanged(SessionView view);

    /**
     * 对局产生了新的提示性事件（送时间、提和、断线/重连）。
     */
    default void onGameEvent(SessionView view, GameEvent event) {
    }
}
