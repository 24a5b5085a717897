package com.banchess.gameservice.common;

/**
 * 业务拒绝异常：携带错误码，只回给发起方，不影响对局状态。
 */
public class GameException extends RuntimeException {

    private final ErrorCode code;

    public GameException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
