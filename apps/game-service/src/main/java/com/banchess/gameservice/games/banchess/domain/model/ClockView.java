package com.banchess.gameservice.games.banchess.domain.model;

/**
 * 双方时钟快照。剩余时间对应 serverTime 时刻，客户端以此为基准在本地走表。
 *
 * @param whiteMs    白方在 serverTime 时的剩余毫秒
 * @param blackMs    黑方在 serverTime 时的剩余毫秒
 * @param active     正在走表的一方（"white" / "black"），停表时为 null
 * @param serverTime 上次切换计时方（或加时、停表）的服务端时间
 */
public record ClockView(long whiteMs, long blackMs, String active, long serverTime) {
}
