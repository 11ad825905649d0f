package com.racehub.raceservice.race.interfaces.http;

import com.racehub.raceservice.race.application.room.RoomRegistry;
import com.racehub.raceservice.race.domain.enums.RacePhase;
import com.racehub.raceservice.race.domain.model.RoomSummary;
import com.racehub.raceservice.race.interfaces.http.dto.RoomListResponse;
import com.racehub.raceservice.race.interfaces.ws.dto.RaceMessages.RoomList;
import com.racehub.web.common.ApiResponse;
import org.junit.jupiter.api.Test;
import org.springframework.security.oauth2.jwt.Jwt;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RoomListControllerTest {

    @Test
    void listsRoomsWithCallerBalance() {
        RoomRegistry registry = mock(RoomRegistry.class);
        RoomSummary lobby = new RoomSummary("duck-race-main", "Duck Race", "system", "system", 2000,
                0, 5, true, RacePhase.WAITING, 0, 1);
        when(registry.roomList("u1")).thenReturn(new RoomList(List.of(lobby), 9000L));
        Jwt jwt = Jwt.withTokenValue("token").header("alg", "RS256").subject("u1").build();

        ApiResponse<RoomListResponse> response = new RoomListController(registry).list(jwt);

        assertThat(response.code()).isEqualTo(ApiResponse.OK);
        assertThat(response.data().getRooms()).containsExactly(lobby);
        assertThat(response.data().getYourBalance()).isEqualTo(9000L);
    }
}
