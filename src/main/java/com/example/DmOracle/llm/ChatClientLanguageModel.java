package com.example.DmOracle.llm;

import com.example.DmOracle.exception.LanguageModelException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * {@link LanguageModelClient} backed by a Spring AI {@link ChatClient}.
 *
 * The blocking call runs on boundedElastic and is cut off after the configured timeout.
 * A thread that has already been interrupted issues no call at all.
 */
public class ChatClientLanguageModel implements LanguageModelClient {

    private static final Logger log = LoggerFactory.getLogger(ChatClientLanguageModel.class);

    private final String name;
    private final ChatClient chatClient;
    private final ChatOptions options;
    private final Duration timeout;

    public ChatClientLanguageModel(String name, ChatClient chatClient, double temperature, Duration timeout) {
        this.name = name;
        this.chatClient = chatClient;
        this.options = ChatOptions.builder().temperature(temperature).build();
        this.timeout = timeout;
    }

    @Override
    public String generate(String prompt) {
        if (Thread.currentThread().isInterrupted()) {
            throw new LanguageModelException("Request was cancelled before the " + name + " model call");
        }
        log.debug("[{}] prompt ({} chars)", name, prompt.length());
        try {
            String content = Mono.fromCallable(() -> chatClient.prompt()
                            .options(options)
                            .user(prompt)
                            .call()
                            .content())
                    .subscribeOn(Schedulers.boundedElastic())
                    .timeout(timeout)
                    .block();
            return content == null ? "" : content;
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                throw new LanguageModelException("Request was cancelled during the " + name + " model call", cause);
            }
            if (cause instanceof TimeoutException) {
                throw new LanguageModelException(
                        "The " + name + " model call timed out after " + timeout.toMillis() + " ms", cause);
            }
            throw new LanguageModelException(String.valueOf(cause.getMessage()), cause);
        }
    }
}
