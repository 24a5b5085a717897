package com.banchess.gameservice.games.banchess.domain.model;

/**
 * 已应用的一条动作记录，追加后不再修改。
 *
 * @param ply        序号，从 1 开始
 * @param color      行动方（"white" / "black"）
 * @param type       "ban" / "move"
 * @param action     UCI 文本，如 e2e4、e7e8q
 * @param bcn        BCN 记号，如 b:e2e4
 * @param fen        动作应用后的 FEN
 * @param timestamp  服务端时间戳（毫秒）
 * @param elapsedMs  距上一动作的耗时（毫秒）
 */
public record HistoryEntry(int ply,
                           String color,
                           String type,
                           String action,
                           String bcn,
                           String fen,
                           long timestamp,
                           long elapsedMs) {
}
