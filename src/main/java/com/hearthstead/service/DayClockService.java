package com.hearthstead.service;

import com.hearthstead.model.DayReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Advances the settlement one day per period when the clock is switched on.
 */
@Service
@ConditionalOnProperty(prefix = "settlement.clock", name = "enabled", havingValue = "true")
public class DayClockService {

    private static final Logger log = LoggerFactory.getLogger(DayClockService.class);

    private final GameService gameService;

    public DayClockService(GameService gameService) {
        this.gameService = gameService;
    }

    @Scheduled(fixedRateString = "${settlement.clock.day-length-ms:3000}")
    public void tick() {
        DayReport report = gameService.endDay();
        log.debug("Clock closed day {}", report.day);
    }
}
