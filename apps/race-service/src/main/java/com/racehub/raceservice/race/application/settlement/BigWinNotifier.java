package com.racehub.raceservice.race.application.settlement;

import com.racehub.raceservice.infrastructure.client.chat.ChatNotifyClient;
import com.racehub.raceservice.infrastructure.client.chat.dto.NotifyPushRequest;
import com.racehub.raceservice.race.domain.model.Settlement;
import com.racehub.raceservice.race.domain.model.SettlementEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * 大奖播报（fire-and-forget），失败只记日志。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BigWinNotifier {

    public static final String TYPE = "BIG_WIN";

    private final ChatNotifyClient chatNotifyClient;

    public void notifyBigWin(Settlement settlement, SettlementEntry entry) {
        try {
            chatNotifyClient.push(NotifyPushRequest.builder()
                    .userId(null)
                    .type(TYPE)
                    .title("鸭子赛跑大奖")
                    .content(entry.username() + " 赢得了 " + entry.winnings())
                    .payload(Map.of(
                            "userId", entry.userId(),
                            "roomId", settlement.roomId(),
                            "roundId", settlement.roundId(),
                            "winnings", entry.winnings()))
                    .build());
            log.info("大奖播报已发送: userId={}, roundId={}, winnings={}",
                    entry.userId(), settlement.roundId(), entry.winnings());
        } catch (Exception e) {
            log.warn("大奖播报失败: userId={}, roundId={}", entry.userId(), settlement.roundId(), e);
        }
    }
}
