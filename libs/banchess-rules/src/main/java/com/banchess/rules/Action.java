package com.banchess.rules;

/**
 * 玩家动作：禁着或走子。
 * <p>
 * 禁着只指定 from/to，不区分升变类型（禁掉 e7e8 即禁掉该路线的所有升变）。
 */
public sealed interface Action permits BanAction, MoveAction {

    int from();

    int to();

    ActionType type();

    /** UCI 风格文本，如 e2e4 / e7e8q */
    String uci();

    /** BCN 记号，如 b:e2e4 / m:e7e8q */
    default String toBcn() {
        return Bcn.encode(this);
    }

    static BanAction ban(String from, String to) {
        return new BanAction(Square.parse(from), Square.parse(to));
    }

    static MoveAction move(String from, String to) {
        return new MoveAction(Square.parse(from), Square.parse(to), null);
    }

    static MoveAction move(String from, String to, String promotion) {
        PieceType promo = (promotion == null || promotion.isBlank())
                ? null
                : PieceType.fromFenChar(promotion.trim().charAt(0));
        return new MoveAction(Square.parse(from), Square.parse(to), promo);
    }
}
