package com.banchess.web.common;

import java.io.Serializable;

/**
 * 统一 API 响应格式
 *
 * @param <T> 响应数据类型
 */
public record ApiResponse<T>(
    /**
     * 响应状态码
     * 200: 成功
     * 400: 参数错误
     * 404: 对局或记录不存在
     * 409: 业务状态冲突
     */
    int code,

    /**
     * 响应消息
     */
    String message,

    /**
     * 响应数据
     */
    T data
) implements Serializable {

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(200, "success", data);
    }

    public static <T> ApiResponse<T> error(int code, String message) {
        return new ApiResponse<>(code, message, null);
    }

    public static <T> ApiResponse<T> badRequest(String message) {
        return error(400, message);
    }

    public static <T> ApiResponse<T> notFound(String message) {
        return error(404, message);
    }

    public static <T> ApiResponse<T> conflict(String message) {
        return error(409, message);
    }

    public boolean isSuccess() {
        return code == 200;
    }
}
