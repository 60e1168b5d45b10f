package com.hearthstead.controller;

import com.hearthstead.model.ActionResult;
import com.hearthstead.model.DayReport;
import com.hearthstead.model.Difficulty;
import com.hearthstead.model.LegacyResult;
import com.hearthstead.model.MarketQuote;
import com.hearthstead.model.SettlementSnapshot;
import com.hearthstead.service.GameService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
public class SettlementController {

    private final GameService gameService;

    public SettlementController(GameService gameService) {
        this.gameService = gameService;
    }

    @GetMapping("/settlement")
    public SettlementSnapshot snapshot() {
        return gameService.snapshot();
    }

    @PostMapping("/game")
    public SettlementSnapshot newGame(@RequestParam(defaultValue = "NORMAL") Difficulty difficulty) {
        return gameService.newGame(difficulty);
    }

    @GetMapping("/market")
    public List<MarketQuote> quotes() {
        return gameService.quotes();
    }

    @GetMapping("/market/{resource}")
    public ResponseEntity<MarketQuote> quote(@PathVariable String resource) {
        return gameService.quote(resource)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/legacy")
    public LegacyResult legacy() {
        return gameService.legacy();
    }

    @PostMapping("/mine/{action}")
    public ResponseEntity<ActionResult> mine(@PathVariable String action) {
        return respond(gameService.mine(action));
    }

    @PostMapping("/buildings/{type}")
    public ResponseEntity<ActionResult> build(@PathVariable String type) {
        return respond(gameService.build(type));
    }

    @PutMapping("/workers/{building}")
    public ResponseEntity<ActionResult> assignWorkers(@PathVariable String building, @RequestParam int count) {
        return respond(gameService.assignWorkers(building, count));
    }

    @PostMapping("/craft/{recipe}")
    public ResponseEntity<ActionResult> craft(@PathVariable String recipe) {
        return respond(gameService.craft(recipe));
    }

    @PostMapping("/market/{resource}/buy")
    public ResponseEntity<ActionResult> buy(@PathVariable String resource, @RequestParam double amount) {
        return respond(gameService.trade(resource, amount, true));
    }

    @PostMapping("/market/{resource}/sell")
    public ResponseEntity<ActionResult> sell(@PathVariable String resource, @RequestParam double amount) {
        return respond(gameService.trade(resource, amount, false));
    }

    @PostMapping("/research/technologies/{id}")
    public ResponseEntity<ActionResult> researchTechnology(@PathVariable String id) {
        return respond(gameService.researchTechnology(id));
    }

    @PostMapping("/research/resources/{resource}")
    public ResponseEntity<ActionResult> researchFromStock(@PathVariable String resource) {
        return respond(gameService.researchFromStock(resource));
    }

    @PostMapping("/lore/{secret}")
    public ResponseEntity<ActionResult> discover(@PathVariable String secret) {
        return respond(gameService.discoverSecret(secret));
    }

    @PostMapping("/characters/{id}/talk")
    public ResponseEntity<ActionResult> talk(@PathVariable String id) {
        return respond(gameService.talk(id));
    }

    @PostMapping("/characters/{id}/trade/{resource}")
    public ResponseEntity<ActionResult> tradeWithCharacter(@PathVariable String id, @PathVariable String resource,
                                                           @RequestParam double amount) {
        return respond(gameService.tradeWithCharacter(id, resource, amount));
    }

    @PostMapping("/characters/{id}/quests/{quest}")
    public ResponseEntity<ActionResult> completeQuest(@PathVariable String id, @PathVariable String quest) {
        return respond(gameService.completeQuest(id, quest));
    }

    @PostMapping("/multiplier")
    public ResponseEntity<ActionResult> toggleMultiplier() {
        return respond(gameService.toggleMultiplier());
    }

    @PostMapping("/day/end")
    public DayReport endDay() {
        return gameService.endDay();
    }

    static ResponseEntity<ActionResult> respond(ActionResult result) {
        return ResponseEntity.status(statusFor(result)).body(result);
    }

    static HttpStatus statusFor(ActionResult result) {
        switch (result.getOutcome()) {
            case SUCCESS:
                return HttpStatus.OK;
            case INVALID_REFERENCE:
                return HttpStatus.NOT_FOUND;
            case INVALID_QUANTITY:
                return HttpStatus.BAD_REQUEST;
            default:
                return HttpStatus.CONFLICT;
        }
    }
}
