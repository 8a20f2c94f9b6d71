package com.example.chatrelay.mcp;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;

@Configuration
public class ToolRegistrationConfig {

    private final ConversationTools conversationTools;

    public ToolRegistrationConfig(ConversationTools conversationTools) {
        this.conversationTools = conversationTools;
    }

    @Bean
    public ToolCallbackProvider toolCallbacks() {
        return MethodToolCallbackProvider.builder()
                .toolObjects(conversationTools)
                .build();
    }
}
