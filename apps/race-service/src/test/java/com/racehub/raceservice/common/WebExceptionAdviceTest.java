package com.racehub.raceservice.common;

import com.racehub.raceservice.race.domain.error.ErrorCode;
import com.racehub.raceservice.race.domain.error.RaceException;
import com.racehub.web.common.ApiResponse;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

class WebExceptionAdviceTest {

    private final WebExceptionAdvice advice = new WebExceptionAdvice();

    @Test
    void raceErrorUsesStatusOfErrorCode() {
        ResponseEntity<ApiResponse<String>> resp =
                advice.raceError(new RaceException(ErrorCode.ROOM_NOT_FOUND, "房间不存在"));

        assertThat(resp.getStatusCode().value()).isEqualTo(404);
        assertThat(resp.getBody().code()).isEqualTo(404);
        assertThat(resp.getBody().message()).isEqualTo("房间不存在");
        assertThat(resp.getBody().data()).isEqualTo("ROOM_NOT_FOUND");
    }

    @Test
    void illegalArgumentMapsToBadRequest() {
        ResponseEntity<ApiResponse<Object>> resp = advice.badRequest(new IllegalArgumentException("bad"));

        assertThat(resp.getStatusCode().value()).isEqualTo(400);
        assertThat(resp.getBody().message()).isEqualTo("bad");
        assertThat(resp.getBody().data()).isNull();
    }

    @Test
    void illegalStateMapsToConflict() {
        ResponseEntity<ApiResponse<Object>> resp = advice.conflict(new IllegalStateException("busy"));

        assertThat(resp.getStatusCode().value()).isEqualTo(409);
    }
}
