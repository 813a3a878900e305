package com.meshcall.signaling.controller;

import com.meshcall.protocol.Identifiers;
import com.meshcall.signaling.model.RoomResponse;
import com.meshcall.signaling.service.RoomNotFoundException;
import com.meshcall.signaling.service.RoomRegistry;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 현재 열린 방과 참가자를 조회하는 읽기 전용 API. 방 생성/삭제는 WebSocket join과 정리 작업으로만 일어난다.
 */
@RestController
@RequestMapping("/api/rooms")
public class RoomController {

    private final RoomRegistry roomRegistry;

    public RoomController(RoomRegistry roomRegistry) {
        this.roomRegistry = roomRegistry;
    }

    @GetMapping
    public ResponseEntity<List<RoomResponse>> listRooms() {
        List<RoomResponse> rooms = roomRegistry.listRooms().stream()
                .map(RoomResponse::from)
                .toList();
        return ResponseEntity.ok(rooms);
    }

    @GetMapping("/{roomId}")
    public ResponseEntity<RoomResponse> getRoom(@PathVariable String roomId) {
        String normalized = Identifiers.normalizeRoomId(roomId);
        return roomRegistry.findRoom(normalized)
                .map(snapshot -> ResponseEntity.ok(RoomResponse.from(snapshot)))
                .orElseThrow(() -> new RoomNotFoundException(normalized));
    }
}
