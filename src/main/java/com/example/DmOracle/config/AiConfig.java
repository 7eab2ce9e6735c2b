package com.example.DmOracle.config;

import com.example.DmOracle.llm.ChatClientLanguageModel;
import com.example.DmOracle.llm.LanguageModelClient;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.deepseek.DeepSeekChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AiConfig {

    public static final String PRECISE_MODEL = "preciseModel";
    public static final String CREATIVE_MODEL = "creativeModel";

    private static final String SYSTEM_PROMPT =
            "You are the Dungeon Master's Oracle, an expert assistant for Dungeons & Dragons 5th Edition.";

    /**
     * Build the oracle ChatClient using DeepSeek when available, otherwise fall back to OpenAI.
     * Neither model bean exists when its API key is not configured.
     */
    @Bean
    public ChatClient oracleChatClient(
            ObjectProvider<DeepSeekChatModel> deepSeekProvider,
            ObjectProvider<OpenAiChatModel> openAiProvider
    ) {
        DeepSeekChatModel deepseekModel = deepSeekProvider.getIfAvailable();
        if (deepseekModel != null) {
            return ChatClient.builder(deepseekModel)
                    .defaultSystem(SYSTEM_PROMPT)
                    .build();
        }

        OpenAiChatModel openAiModel = openAiProvider.getIfAvailable();
        if (openAiModel != null) {
            return ChatClient.builder(openAiModel)
                    .defaultSystem(SYSTEM_PROMPT)
                    .build();
        }

        throw new IllegalStateException("No ChatModel beans are available to build a ChatClient");
    }

    /**
     * Low temperature client for classification and SQL generation.
     */
    @Bean(PRECISE_MODEL)
    public LanguageModelClient preciseModel(@Qualifier("oracleChatClient") ChatClient chatClient,
                                            OracleProperties props) {
        return new ChatClientLanguageModel("precise", chatClient,
                props.llm().preciseTemperature(), props.llm().timeout());
    }

    /**
     * Higher temperature client for answer synthesis and narration.
     */
    @Bean(CREATIVE_MODEL)
    public LanguageModelClient creativeModel(@Qualifier("oracleChatClient") ChatClient chatClient,
                                             OracleProperties props) {
        return new ChatClientLanguageModel("creative", chatClient,
                props.llm().creativeTemperature(), props.llm().timeout());
    }
}
