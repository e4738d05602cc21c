package com.memquest.gateway.http;

import com.memquest.agent.MemoryAugmenter;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class ChatController {

    private final MemoryAugmenter augmenter;

    public ChatController(MemoryAugmenter augmenter) {
        this.augmenter = augmenter;
    }

    @PostMapping("/v1/chat")
    public Map<String, Object> chat(@RequestBody Map<String, Object> body) {
        var result = augmenter.augment(
                MemoryController.string(body, "agent_id"),
                MemoryController.string(body, "user_id"),
                MemoryController.string(body, "tenant_id"),
                MemoryController.string(body, "message"),
                MemoryController.tags(body.get("tags")));
        return Map.of(
                "prompt", result.prompt(),
                "memories", result.memories().stream().map(MemoryController::toWire).toList());
    }
}
