package com.example.DmOracle.service;

import com.example.DmOracle.model.AnswerResult;
import com.example.DmOracle.model.ChatLog;
import com.example.DmOracle.repository.ChatLogRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Audit trail of answered questions. Persistence problems are logged and
 * never affect the answer returned to the caller.
 */
@Service
@RequiredArgsConstructor
public class ChatLogService {

    private static final Logger log = LoggerFactory.getLogger(ChatLogService.class);

    private final ChatLogRepository chatLogRepository;
    private final ObjectMapper objectMapper;

    public void recordAnswer(String question, AnswerResult result) {
        try {
            ChatLog chatLog = new ChatLog();
            chatLog.setSessionId(result.sessionId());
            chatLog.setRoute(result.route().label());
            chatLog.setRetrievalSucceeded(result.retrievalSucceeded());
            chatLog.setQuestion(question);
            chatLog.setAnswer(result.answer());
            chatLog.setSourcesJson(serializeSources(result.sources()));
            if (result.metadata().get(HybridOracleService.META_ATTEMPTS) instanceof Integer attempts) {
                chatLog.setAttemptsUsed(attempts);
            }
            if (result.metadata().get(HybridOracleService.META_QUERY) instanceof String query) {
                chatLog.setGeneratedQuery(query);
            }

            chatLogRepository.save(chatLog);
        } catch (RuntimeException e) {
            log.warn("Failed to record chat log for session {}", result.sessionId(), e);
        }
    }

    private String serializeSources(List<String> sources) {
        if (sources == null || sources.isEmpty()) {
            return "[]";
        }
        try {
            return objectMapper.writeValueAsString(sources);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize sources for chat log", e);
            return "[]";
        }
    }
}
