package com.example.seoagent.service.llm;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ChatModelTextGeneratorTest {

    @Test
    void shouldFailFastWhenModelMissing() {
        ChatModelTextGenerator generator = new ChatModelTextGenerator(Optional.empty());

        assertFalse(generator.isConfigured());
        assertThrows(TextGenerationException.class, () -> generator.generateText("prompt", 100));
    }

    @Test
    void shouldSendSystemAndUserMessagesWithTokenLimit() {
        // Given
        ChatModel chatModel = mock(ChatModel.class);
        when(chatModel.chat(any(ChatRequest.class)))
                .thenReturn(ChatResponse.builder().aiMessage(AiMessage.from("Findings\n- Slow pages")).build());
        ChatModelTextGenerator generator = new ChatModelTextGenerator(Optional.of(chatModel));

        // When
        String text = generator.generateText("Analyze example.com", 1500);

        // Then
        assertEquals("Findings\n- Slow pages", text);
        ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
        verify(chatModel).chat(captor.capture());
        assertEquals(2, captor.getValue().messages().size());
        assertEquals(1500, captor.getValue().maxOutputTokens());
    }

    @Test
    void shouldWrapModelErrors() {
        ChatModel chatModel = mock(ChatModel.class);
        when(chatModel.chat(any(ChatRequest.class))).thenThrow(new RuntimeException("429 Too Many Requests"));
        ChatModelTextGenerator generator = new ChatModelTextGenerator(Optional.of(chatModel));

        TextGenerationException error = assertThrows(TextGenerationException.class,
                () -> generator.generateText("prompt", 100));

        assertEquals("Chat model call failed: 429 Too Many Requests", error.getMessage());
    }

    @Test
    void shouldRejectBlankResponse() {
        ChatModel chatModel = mock(ChatModel.class);
        when(chatModel.chat(any(ChatRequest.class)))
                .thenReturn(ChatResponse.builder().aiMessage(AiMessage.from(" ")).build());
        ChatModelTextGenerator generator = new ChatModelTextGenerator(Optional.of(chatModel));

        assertThrows(TextGenerationException.class, () -> generator.generateText("prompt", 100));
    }
}
