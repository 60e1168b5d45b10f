package com.hearthstead.handler;

import com.hearthstead.model.ActionResult;
import com.hearthstead.model.DayReport;
import com.hearthstead.service.GameService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * JSON command channel. Clients send {"action": ...}; each reply carries the result and a
 * fresh snapshot. Day ends are pushed to every open session.
 */
@Component
public class SettlementWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(SettlementWebSocketHandler.class);

    private final GameService gameService;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<WebSocketSession> activeSessions = new CopyOnWriteArrayList<>();

    public SettlementWebSocketHandler(GameService gameService) {
        this.gameService = gameService;
        gameService.addDayListener(this::broadcastDayEnd);
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        activeSessions.add(session);
        ObjectNode msg = objectMapper.createObjectNode();
        msg.put("event", "snapshot");
        msg.set("snapshot", objectMapper.valueToTree(gameService.snapshot()));
        send(session, new TextMessage(msg.toString()));
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        activeSessions.remove(session);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        JsonNode json;
        try {
            json = objectMapper.readTree(message.getPayload());
        } catch (IOException e) {
            log.debug("Malformed message from {}: {}", session.getId(), e.getMessage());
            reply(session, ActionResult.invalidQuantity("Malformed JSON"));
            return;
        }
        ActionResult result = dispatch(json);
        reply(session, result);
    }

    ActionResult dispatch(JsonNode json) {
        String action = json.path("action").asText("");
        switch (action) {
            case "snapshot":
                return ActionResult.success();
            case "mine":
                return gameService.mine(text(json, "id"));
            case "build":
                return gameService.build(text(json, "building"));
            case "storehouse":
                return gameService.buildStorehouse();
            case "assign_workers":
                return gameService.assignWorkers(text(json, "building"), json.path("count").asInt(0));
            case "craft":
                return gameService.craft(text(json, "recipe"));
            case "trade":
                return gameService.trade(text(json, "resource"), json.path("amount").asDouble(0),
                        json.path("buying").asBoolean(true));
            case "research":
                return gameService.researchTechnology(text(json, "technology"));
            case "research_resource":
                return gameService.researchFromStock(text(json, "resource"));
            case "discover":
                return gameService.discoverSecret(text(json, "secret"));
            case "talk":
                return gameService.talk(text(json, "character"));
            case "character_trade":
                return gameService.tradeWithCharacter(text(json, "character"), text(json, "resource"),
                        json.path("amount").asDouble(0));
            case "complete_quest":
                return gameService.completeQuest(text(json, "character"), text(json, "quest"));
            case "toggle_multiplier":
                return gameService.toggleMultiplier();
            case "end_day":
                DayReport report = gameService.endDay();
                return ActionResult.success("Day " + report.day + " ended");
            default:
                return ActionResult.invalidReference("Unknown action '" + action + "'");
        }
    }

    private static String text(JsonNode json, String field) {
        return json.path(field).asText("");
    }

    private void reply(WebSocketSession session, ActionResult result) throws IOException {
        ObjectNode msg = objectMapper.createObjectNode();
        msg.put("event", "result");
        msg.set("result", objectMapper.valueToTree(result));
        msg.set("snapshot", objectMapper.valueToTree(gameService.snapshot()));
        send(session, new TextMessage(msg.toString()));
    }

    private void broadcastDayEnd(DayReport report) {
        if (activeSessions.isEmpty()) return;
        ObjectNode msg = objectMapper.createObjectNode();
        msg.put("event", "day_end");
        msg.set("report", objectMapper.valueToTree(report));
        msg.set("snapshot", objectMapper.valueToTree(gameService.snapshot()));
        TextMessage tm = new TextMessage(msg.toString());
        for (WebSocketSession s : activeSessions) {
            if (!s.isOpen()) continue;
            try {
                send(s, tm);
            } catch (IOException e) {
                log.warn("Could not push day end to {}: {}", s.getId(), e.getMessage());
            }
        }
    }

    private void send(WebSocketSession session, TextMessage message) throws IOException {
        // Concurrent writes on one session corrupt the frame
        synchronized (session) {
            session.sendMessage(message);
        }
    }

    int sessionCount() {
        return activeSessions.size();
    }
}
