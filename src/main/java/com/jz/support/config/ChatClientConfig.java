package com.jz.support.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
public class ChatClientConfig {

    // 无记忆（不装任何 Advisor），每个模型名一个 client；上下文由流水线自己拼
    @Bean
    @Primary
    public Map<String, ChatClient> statelessChatClients(ChatModel chatModel, ModelProperties models) {
        Map<String, ChatClient> m = new LinkedHashMap<>();
        for (String name : models.getAvailable()) {
            m.put(name, ChatClient.builder(chatModel)
                    .defaultOptions(ChatOptions.builder().model(name).build())
                    .build());
        }
        return m;
    }
}
