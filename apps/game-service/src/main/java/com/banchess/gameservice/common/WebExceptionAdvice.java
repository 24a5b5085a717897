package com.banchess.gameservice.common;

import com.banchess.web.common.ApiResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 全局异常映射处理器。
 */
@RestControllerAdvice
public class WebExceptionAdvice {
    /**
     * 参数不合法（如无法解析的 id、limit 越界）。
     * @return HTTP 400
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Object>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.badRequest(e.getMessage()));
    }

    /**
     * 业务拒绝：对局/记录不存在映射为 404，其余映射为 409。
     */
    @ExceptionHandler(GameException.class)
    public ResponseEntity<ApiResponse<Object>> game(GameException e) {
        if (e.getCode() == ErrorCode.SESSION_NOT_FOUND || e.getCode() == ErrorCode.GAME_NOT_FOUND) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.notFound(e.getMessage()));
        }
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiResponse.conflict(e.getMessage()));
    }

    /**
     * 非法状态（流程冲突）。
     * @return HTTP 409
     */
    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiResponse<Object>> conflict(IllegalStateException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiResponse.conflict(e.getMessage()));
    }
}
