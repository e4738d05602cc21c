package com.memquest.gateway.http;

import com.memquest.agent.MemoryAugmenter;
import com.memquest.shared.model.MemoryHit;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ChatControllerTest {

    @Test
    void chatReturnsAugmentedPrompt() throws Exception {
        var augmenter = mock(MemoryAugmenter.class);
        var hit = new MemoryHit("m1", "User is vegan", 0.4, "lucene", Map.of());
        when(augmenter.augment("agent-a", "u1", "t1", "dinner?", List.of("food")))
                .thenReturn(new MemoryAugmenter.Augmented("[Recalled memories]\n- User is vegan\n\n[User message]\ndinner?",
                        List.of(hit)));
        var mvc = MockMvcBuilders.standaloneSetup(new ChatController(augmenter)).build();

        mvc.perform(post("/v1/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"message": "dinner?", "user_id": "u1", "tenant_id": "t1",
                                 "agent_id": "agent-a", "tags": ["food"]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.memories[0].id").value("m1"))
                .andExpect(jsonPath("$.prompt").value(org.hamcrest.Matchers.containsString("User is vegan")));
    }
}
