package com.racehub.raceservice.race.application.room;

import com.racehub.raceservice.application.wallet.WalletGateway;
import com.racehub.raceservice.platform.config.RaceProperties;
import com.racehub.raceservice.platform.transport.Envelope;
import com.racehub.raceservice.race.domain.constants.GameMessages;
import com.racehub.raceservice.race.domain.error.ErrorCode;
import com.racehub.raceservice.race.domain.error.RaceException;
import com.racehub.raceservice.race.domain.model.PlayerIdentity;
import com.racehub.raceservice.race.domain.model.RoomSummary;
import com.racehub.raceservice.race.interfaces.ws.dto.MessageTypes;
import com.racehub.raceservice.race.interfaces.ws.dto.RaceMessages.RoomDeleted;
import com.racehub.raceservice.race.interfaces.ws.dto.RaceMessages.RoomEvent;
import com.racehub.raceservice.race.interfaces.ws.dto.RaceMessages.RoomList;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * RoomRegistry（大厅）
 * ----------------------------------------
 * 进程内的房间目录：建房、列房、销毁，并把会话命令路由到所在房间。
 *
 * 维护两张表：
 *  - rooms    ：roomId → 房间 actor；
 *  - userRooms：userId → roomId，用户加入时先占位，房间拒绝后释放，保证一人一房。
 *
 * 本类的方法可被任意连接线程并发调用，只读写并发容器，不接触房间内部状态。
 */
@Slf4j
@Service
public class RoomRegistry implements RoomListener {

    public static final String SYSTEM_USER_ID = "system";

    private final RaceRoomFactory roomFactory;
    private final PlayerNotifier notifier;
    private final WalletGateway walletGateway;
    private final RaceProperties props;

    private final Map<String, RaceRoom> rooms = new ConcurrentHashMap<>();
    private final Map<String, String> userRooms = new ConcurrentHashMap<>();
    private final AtomicLong createdSeq = new AtomicLong();

    public RoomRegistry(RaceRoomFactory roomFactory, PlayerNotifier notifier,
                        WalletGateway walletGateway, RaceProperties props) {
        this.roomFactory = roomFactory;
        this.notifier = notifier;
        this.walletGateway = walletGateway;
        this.props = props;
    }

    /**
     * 启动时创建常驻大厅房间。
     */
    @EventListener(ApplicationReadyEvent.class)
    public void createDefaultRoom() {
        RaceProperties.DefaultRoom def = props.getDefaultRoom();
        if (!def.isEnabled() || rooms.containsKey(def.getRoomId())) {
            return;
        }
        RaceRoom room = roomFactory.create(def.getRoomId(), def.getName(),
                new PlayerIdentity(SYSTEM_USER_ID, SYSTEM_USER_ID), def.getBetAmount(), true,
                createdSeq.incrementAndGet(), this);
        rooms.put(room.roomId(), room);
        log.info("常驻房间已创建: roomId={}, betAmount={}", room.roomId(), def.getBetAmount());
    }

    // ========== 查询 ==========

    /**
     * 房间摘要快照，按创建顺序。
     */
    public List<RoomSummary> listRooms() {
        return rooms.values().stream()
                .map(RaceRoom::summary)
                .sorted(Comparator.comparingLong(RoomSummary::createdSeq))
                .toList();
    }

    /**
     * ROOM_LIST 载荷：房间列表 + 当前用户余额（钱包不可用时为 null）。
     */
    public RoomList roomList(String userId) {
        return new RoomList(listRooms(), walletGateway.getBalance(userId));
    }

    public Optional<String> roomOf(String userId) {
        return Optional.ofNullable(userRooms.get(userId));
    }

    // ========== 命令 ==========

    /**
     * 建房并让建房人入座、按建房金额下注。
     * @return roomId
     * @throws RaceException INVALID_WAGER / ALREADY_IN_ROOM / INSUFFICIENT_BALANCE
     */
    public String createRoom(PlayerIdentity creator, long betAmount, boolean persistent, String roomName) {
        if (betAmount < props.getMinBet()) {
            throw new RaceException(ErrorCode.INVALID_WAGER, GameMessages.formatMinBet(props.getMinBet()));
        }
        if (userRooms.containsKey(creator.userId())) {
            throw new RaceException(ErrorCode.ALREADY_IN_ROOM, GameMessages.ALREADY_IN_ROOM);
        }
        // 建房前先看余额，避免建出一个建房人下不了注的空房间；钱包不可用时交给下注环节判断
        Long balance = walletGateway.getBalance(creator.userId());
        if (balance != null && balance < betAmount) {
            throw new RaceException(ErrorCode.INSUFFICIENT_BALANCE, GameMessages.INSUFFICIENT_BALANCE);
        }

        String roomId = UUID.randomUUID().toString();
        String name = StringUtils.isNotBlank(roomName) ? roomName.trim() : creator.username() + " 的房间";
        if (userRooms.putIfAbsent(creator.userId(), roomId) != null) {
            throw new RaceException(ErrorCode.ALREADY_IN_ROOM, GameMessages.ALREADY_IN_ROOM);
        }
        RaceRoom room = roomFactory.create(roomId, name, creator, betAmount, persistent,
                createdSeq.incrementAndGet(), this);
        rooms.put(roomId, room);
        log.info("房间已创建: roomId={}, creator={}, betAmount={}, persistent={}",
                roomId, creator.userId(), betAmount, persistent);
        notifier.broadcastAll(Envelope.of(MessageTypes.ROOM_CREATED, new RoomEvent(room.summary())));

        room.join(creator, () -> userRooms.remove(creator.userId(), roomId));
        room.placeBet(creator.userId(), betAmount);
        return roomId;
    }

    /**
     * 加入房间；已在同一房间内视为重新进入。
     * @throws RaceException ROOM_NOT_FOUND / ALREADY_IN_ROOM；ROOM_FULL 由房间异步回报
     */
    public void joinRoom(PlayerIdentity identity, String roomId) {
        RaceRoom room = StringUtils.isBlank(roomId) ? null : rooms.get(roomId);
        if (room == null) {
            throw new RaceException(ErrorCode.ROOM_NOT_FOUND, GameMessages.ROOM_NOT_FOUND);
        }
        String userId = identity.userId();
        String existing = userRooms.putIfAbsent(userId, roomId);
        if (existing != null && !existing.equals(roomId)) {
            throw new RaceException(ErrorCode.ALREADY_IN_ROOM, GameMessages.ALREADY_IN_ROOM);
        }
        Runnable release = existing == null ? () -> userRooms.remove(userId, roomId) : null;
        room.join(identity, release);
    }

    /**
     * 离开当前房间，不在任何房间时为空操作。
     */
    public void leaveRoom(String userId) {
        String roomId = userRooms.remove(userId);
        if (roomId == null) {
            return;
        }
        RaceRoom room = rooms.get(roomId);
        if (room != null) {
            room.leave(userId);
        }
    }

    public void placeBet(String userId, long amount) {
        requireRoom(userId).placeBet(userId, amount);
    }

    public void setReady(String userId, boolean ready) {
        requireRoom(userId).setReady(userId, ready);
    }

    // ========== 连接生命周期 ==========

    /**
     * 新连接建立：若该用户仍占着座位，恢复之。
     */
    public void onConnected(PlayerIdentity identity) {
        String roomId = userRooms.get(identity.userId());
        RaceRoom room = roomId == null ? null : rooms.get(roomId);
        if (room != null) {
            room.reattach(identity.userId());
        }
    }

    /**
     * 连接断开（关闭或心跳超时）：座位保留到宽限期结束。
     */
    public void onDisconnected(String userId) {
        String roomId = userRooms.get(userId);
        RaceRoom room = roomId == null ? null : rooms.get(roomId);
        if (room != null) {
            room.disconnect(userId);
        }
    }

    private RaceRoom requireRoom(String userId) {
        String roomId = userRooms.get(userId);
        RaceRoom room = roomId == null ? null : rooms.get(roomId);
        if (room == null) {
            throw new RaceException(ErrorCode.NOT_IN_ROOM, GameMessages.NOT_IN_ROOM);
        }
        return room;
    }

    // ========== RoomListener（房间线程回调） ==========

    @Override
    public void onSummaryChanged(RaceRoom room, RoomSummary summary) {
        if (rooms.get(room.roomId()) != room) {
            return;
        }
        notifier.broadcastAll(Envelope.of(MessageTypes.ROOM_UPDATED, new RoomEvent(summary)));
    }

    @Override
    public void onPlayerRemoved(String roomId, String userId) {
        userRooms.remove(userId, roomId);
    }

    @Override
    public void onRoomClosed(RaceRoom room) {
        String roomId = room.roomId();
        if (!rooms.remove(roomId, room)) {
            return;
        }
        userRooms.entrySet().removeIf(e -> e.getValue().equals(roomId));
        log.info("房间已销毁: roomId={}", roomId);
        notifier.broadcastAll(Envelope.of(MessageTypes.ROOM_DELETED, new RoomDeleted(roomId)));
    }

    int roomCount() {
        return rooms.size();
    }
}
