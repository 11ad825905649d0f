package com.racehub.web.common;

import java.io.Serializable;

/**
 * 统一 REST 响应外壳。
 * <p>
 * code 沿用 HTTP 语义：200 成功，400 参数错误，404 资源不存在，409 业务状态冲突，500 服务端错误。
 *
 * @param code    响应状态码
 * @param message 提示信息（失败时为可直接展示的原因）
 * @param data    响应数据，失败时为 null
 * @param <T>     响应数据类型
 */
public record ApiResponse<T>(int code, String message, T data) implements Serializable {

    public static final int OK = 200;

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(OK, "success", data);
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

    public static <T> ApiResponse<T> serverError(String message) {
        return error(500, message);
    }

    /**
     * 远程调用方判断：code 为 200 且带数据才算有效响应。
     */
    public boolean hasData() {
        return code == OK && data != null;
    }
}
