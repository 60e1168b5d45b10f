package com.hearthstead.controller;

import com.hearthstead.model.ActionResult;
import com.hearthstead.model.DayReport;
import com.hearthstead.model.Difficulty;
import com.hearthstead.model.SettlementSnapshot;
import com.hearthstead.service.GameService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class SettlementControllerTest {

    private GameService gameService;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        gameService = mock(GameService.class);
        mvc = MockMvcBuilders.standaloneSetup(new SettlementController(gameService)).build();
    }

    @Test
    void snapshotIsServed() throws Exception {
        SettlementSnapshot snapshot = new SettlementSnapshot();
        snapshot.day = 7;
        snapshot.population = 9;
        when(gameService.snapshot()).thenReturn(snapshot);

        mvc.perform(get("/api/settlement"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.day").value(7))
                .andExpect(jsonPath("$.population").value(9));
    }

    // ===== Outcome to status =====

    @Test
    void successIsOk() throws Exception {
        when(gameService.build("les")).thenReturn(ActionResult.success("Lumber Mill built"));

        mvc.perform(post("/api/buildings/les"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.outcome").value("SUCCESS"));
    }

    @Test
    void unknownIdIsNotFound() throws Exception {
        when(gameService.mine("dance")).thenReturn(ActionResult.invalidReference("Unknown action 'dance'"));

        mvc.perform(post("/api/mine/dance"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Unknown action 'dance'"));
    }

    @Test
    void badQuantityIsBadRequest() throws Exception {
        when(gameService.trade("wood", -1.0, true)).thenReturn(ActionResult.invalidQuantity("Trade amount must be positive"));

        mvc.perform(post("/api/market/wood/buy").param("amount", "-1"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void domainRefusalsAreConflicts() throws Exception {
        when(gameService.researchTechnology("ecology")).thenReturn(ActionResult.prerequisiteUnmet("needs basic_agriculture"));
        when(gameService.discoverSecret("memory_crystal")).thenReturn(ActionResult.unaffordable("costs more"));

        mvc.perform(post("/api/research/technologies/ecology")).andExpect(status().isConflict());
        mvc.perform(post("/api/lore/memory_crystal")).andExpect(status().isConflict());
    }

    @Test
    void statusMapping() {
        assertEquals(409, SettlementController.statusFor(ActionResult.alreadyUnlocked("x")).value());
        assertEquals(400, SettlementController.statusFor(ActionResult.invalidQuantity("x")).value());
    }

    // ===== Routing =====

    @Test
    void workersAreAssignedByCount() throws Exception {
        when(gameService.assignWorkers("les", 3)).thenReturn(ActionResult.success());

        mvc.perform(put("/api/workers/les").param("count", "3")).andExpect(status().isOk());
        verify(gameService).assignWorkers("les", 3);
    }

    @Test
    void sellingRoutesToTrade() throws Exception {
        when(gameService.trade("rock", 4.0, false)).thenReturn(ActionResult.success());

        mvc.perform(post("/api/market/rock/sell").param("amount", "4")).andExpect(status().isOk());
        verify(gameService).trade("rock", 4.0, false);
    }

    @Test
    void unknownQuoteIsNotFound() throws Exception {
        when(gameService.quote("mithril")).thenReturn(Optional.empty());

        mvc.perform(get("/api/market/mithril")).andExpect(status().isNotFound());
    }

    @Test
    void characterRoutes() throws Exception {
        when(gameService.tradeWithCharacter("mine_master", "rock", 5.0)).thenReturn(ActionResult.success());
        when(gameService.completeQuest("forest_elder", "protect_sacred_grove")).thenReturn(ActionResult.success());

        mvc.perform(post("/api/characters/mine_master/trade/rock").param("amount", "5")).andExpect(status().isOk());
        mvc.perform(post("/api/characters/forest_elder/quests/protect_sacred_grove")).andExpect(status().isOk());
    }

    @Test
    void newGameTakesDifficulty() throws Exception {
        when(gameService.newGame(Difficulty.EASY)).thenReturn(new SettlementSnapshot());

        mvc.perform(post("/api/game").param("difficulty", "EASY")).andExpect(status().isOk());
        verify(gameService).newGame(Difficulty.EASY);
    }

    @Test
    void endDayReturnsTheReport() throws Exception {
        DayReport report = new DayReport(4);
        report.foodShortage = true;
        when(gameService.endDay()).thenReturn(report);

        mvc.perform(post("/api/day/end"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.day").value(4))
                .andExpect(jsonPath("$.foodShortage").value(true));
    }
}
