package com.meshcall.signaling.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 주기적으로 빈 방을 정리한다. 방을 지우는 유일한 경로다.
 */
@Component
public class RoomSweepScheduler {

    private static final Logger log = LoggerFactory.getLogger(RoomSweepScheduler.class);

    private final RoomRegistry roomRegistry;

    public RoomSweepScheduler(RoomRegistry roomRegistry) {
        this.roomRegistry = roomRegistry;
    }

    @Scheduled(fixedDelayString = "${signaling.rooms.sweep-interval:PT5M}",
            initialDelayString = "${signaling.rooms.sweep-interval:PT5M}")
    public void sweepIdleRooms() {
        int removed = roomRegistry.sweep();
        if (removed > 0) {
            log.info("Room sweep removed {} inactive room(s)", removed);
        } else {
            log.debug("Room sweep found nothing to remove");
        }
    }
}
