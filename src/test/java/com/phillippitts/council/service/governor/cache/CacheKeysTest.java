package com.phillippitts.council.service.governor.cache;

import com.phillippitts.council.service.gateway.ChatMessage;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CacheKeysTest {

    @Test
    void shouldBeStableForSameInput() {
        List<ChatMessage> messages = List.of(ChatMessage.system("classify"), ChatMessage.user("2+2?"));

        assertThat(CacheKeys.forCall("gpt-5.1", messages)).isEqualTo(CacheKeys.forCall("gpt-5.1", messages))
                .hasSize(64)
                .matches("[0-9a-f]+");
    }

    @Test
    void shouldDifferByBackend() {
        List<ChatMessage> messages = List.of(ChatMessage.user("2+2?"));

        assertThat(CacheKeys.forCall("gpt-5.1", messages)).isNotEqualTo(CacheKeys.forCall("grok-4", messages));
    }

    @Test
    void shouldDifferByRoleAndContent() {
        String user = CacheKeys.forCall("gpt-5.1", List.of(ChatMessage.user("2+2?")));

        assertThat(user).isNotEqualTo(CacheKeys.forCall("gpt-5.1", List.of(ChatMessage.system("2+2?"))));
        assertThat(user).isNotEqualTo(CacheKeys.forCall("gpt-5.1", List.of(ChatMessage.user("2+3?"))));
    }
}
