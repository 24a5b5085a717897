package com.banchess.rules;

import java.util.List;

/**
 * Ban Chess 规则引擎：纯函数、无状态、确定性。
 */
public interface RulesEngine {

    /**
     * 当前局面下行动方的全部合法动作（BAN 阶段为禁着集合，MOVE 阶段为走子集合）。
     * 已终局的局面返回空集合。
     */
    List<Action> legalActions(BanChessPosition position);

    /**
     * 应用一个动作，返回新局面。
     * @throws IllegalActionException 动作不合法，原局面不受影响
     */
    BanChessPosition apply(BanChessPosition position, Action action);

    /** 终局判定 */
    GameOutcome evaluate(BanChessPosition position);

    /** 轮走方是否被将军 */
    boolean inCheck(BanChessPosition position);

    /**
     * 从初始局面按顺序重放动作序列。
     * @throws IllegalActionException 序列中任一动作不合法
     */
    default BanChessPosition replay(List<? extends Action> actions) {
        BanChessPosition p = BanChessPosition.initial();
        for (Action a : actions) {
            p = apply(p, a);
        }
        return p;
    }
}
