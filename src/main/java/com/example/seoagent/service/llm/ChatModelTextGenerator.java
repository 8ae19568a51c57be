package com.example.seoagent.service.llm;

import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Генерация текста через langchain4j ChatModel.
 */
@Slf4j
@Service
public class ChatModelTextGenerator implements TextGenerator {

    static final String SYSTEM_MESSAGE =
            "You are an expert SEO analyst. Provide detailed, actionable insights based on the data provided.";

    private final ChatModel chatModel;

    public ChatModelTextGenerator(Optional<ChatModel> chatModel) {
        this.chatModel = chatModel.orElse(null);
    }

    @Override
    public String generateText(String prompt, int maxTokens) {
        if (chatModel == null) {
            throw new TextGenerationException("Chat model is not configured");
        }

        ChatResponse response;
        try {
            ChatRequest request = ChatRequest.builder()
                    .messages(SystemMessage.from(SYSTEM_MESSAGE), UserMessage.from(prompt))
                    .maxOutputTokens(maxTokens)
                    .build();
            response = chatModel.chat(request);
        } catch (Exception e) {
            log.error("Error calling chat model: {}", e.getMessage(), e);
            throw new TextGenerationException("Chat model call failed: " + e.getMessage(), e);
        }

        if (response == null || response.aiMessage() == null) {
            throw new TextGenerationException("No response from chat model");
        }
        String text = response.aiMessage().text();
        if (text == null || text.isBlank()) {
            throw new TextGenerationException("Empty response from chat model");
        }
        return text;
    }

    public boolean isConfigured() {
        return chatModel != null;
    }
}
