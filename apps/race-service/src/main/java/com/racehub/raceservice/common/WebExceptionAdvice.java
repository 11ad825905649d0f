package com.racehub.raceservice.common;

import com.racehub.raceservice.race.domain.error.RaceException;
import com.racehub.web.common.ApiResponse;
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
     * 处理比赛域拒绝（RaceException），HTTP 状态取自错误码。
     * @param e 领域异常
     * @return 对应状态码，响应体 message 为提示文案，data 为错误码
     */
    @ExceptionHandler(RaceException.class)
    public ResponseEntity<ApiResponse<String>> raceError(RaceException e) {
        int status = e.getCode().httpStatus();
        return ResponseEntity.status(status).body(new ApiResponse<>(status, e.getMessage(), e.getCode().name()));
    }

    /**
     * 处理参数不合法异常（IllegalArgumentException）。
     * @param e 参数非法异常
     * @return HTTP 400（Bad Request），响应体为异常信息
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Object>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.badRequest(e.getMessage()));
    }

    /**
     * 处理非法状态异常（IllegalStateException）。
     * @param e 状态非法异常
     * @return HTTP 409（Conflict），响应体为异常信息
     */
    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiResponse<Object>> conflict(IllegalStateException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiResponse.conflict(e.getMessage()));
    }
}
