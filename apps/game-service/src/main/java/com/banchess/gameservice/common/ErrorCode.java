package com.banchess.gameservice.common;

/**
 * 错误码。wire 上以枚举名原样输出（error{code}）。
 */
public enum ErrorCode {
    /** 消息格式错误、缺字段 */
    PROTOCOL,
    /** 未认证连接发送了非 authenticate 消息 */
    UNAUTHENTICATED,
    /** 凭证校验失败 */
    AUTH_FAILED,
    /** 对局不在进行中 */
    NOT_ACTIVE,
    /** 不是该方行动 */
    WRONG_ROLE,
    /** 禁着阶段提交走子，或反之 */
    WRONG_PHASE,
    /** 规则引擎拒绝 */
    ILLEGAL_ACTION,
    /** 观战者尝试执行玩家操作 */
    NOT_A_PLAYER,
    SESSION_NOT_FOUND,
    GAME_NOT_FOUND,
    /** 座位已被另一条在线连接占用 */
    SEAT_TAKEN,
    NOT_ATTACHED,
    /** 已有进行中的对局，不能再排队 */
    ALREADY_IN_GAME,
    INVALID_TIME_CONTROL,
    /** 当前对局模式不支持该操作 */
    UNSUPPORTED,
    INTERNAL
}
