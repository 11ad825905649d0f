package com.racehub.raceservice.race.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.racehub.raceservice.race.domain.enums.RacePhase;

/**
 * 大厅展示用的房间摘要，由房间在每次处理完命令后发布，读取方无需进入房间上下文。
 */
public record RoomSummary(String roomId,
                          String roomName,
                          String creatorId,
                          String creatorUsername,
                          long betAmount,
                          int playerCount,
                          int maxPlayers,
                          @JsonProperty("isPersistent") boolean persistent,
                          RacePhase phase,
                          int readyCount,
                          @JsonIgnore long createdSeq) {
}
