package com.linlay.chatrunner.memory;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.linlay.chatrunner.config.ConversationMemoryProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Recent exchanges per conversation, kept in memory.
 * <p>
 * An exchange is one user message and the assistant text that answered it. Only the last
 * {@code window-size} exchanges of a conversation are kept; tool traffic of earlier turns is not
 * replayed. Conversations are keyed by owner and id, so one user never sees another user's history.
 * The least recently used conversations are evicted once {@code max-conversations} is reached.
 */
@Service
public class ConversationMemory {

    private static final Logger log = LoggerFactory.getLogger(ConversationMemory.class);

    private final ConversationMemoryProperties properties;
    private final Cache<String, Deque<Exchange>> conversations;

    public ConversationMemory(ConversationMemoryProperties properties) {
        this.properties = properties;
        this.conversations = Caffeine.newBuilder()
                .maximumSize(properties.getMaxConversations())
                .build();
    }

    public List<Message> loadHistory(String userId, String conversationId) {
        if (!StringUtils.hasText(conversationId)) {
            return List.of();
        }
        Deque<Exchange> exchanges = conversations.getIfPresent(key(userId, conversationId));
        if (exchanges == null) {
            return List.of();
        }
        List<Message> messages = new ArrayList<>();
        synchronized (exchanges) {
            for (Exchange exchange : exchanges) {
                messages.add(new UserMessage(exchange.userText()));
                if (StringUtils.hasText(exchange.assistantText())) {
                    messages.add(new AssistantMessage(exchange.assistantText()));
                }
            }
        }
        return List.copyOf(messages);
    }

    public void append(String userId, String conversationId, String userText, String assistantText) {
        if (!StringUtils.hasText(conversationId) || !StringUtils.hasText(userText)) {
            return;
        }
        Deque<Exchange> exchanges = conversations.get(key(userId, conversationId), ignored -> new ArrayDeque<>());
        synchronized (exchanges) {
            exchanges.addLast(new Exchange(userText, assistantText == null ? "" : assistantText));
            while (exchanges.size() > properties.getWindowSize()) {
                exchanges.removeFirst();
            }
        }
        log.debug("Conversation {} now holds {} exchange(s)", conversationId, exchanges.size());
    }

    public void clear(String userId, String conversationId) {
        conversations.invalidate(key(userId, conversationId));
    }

    private String key(String userId, String conversationId) {
        return (userId == null ? "" : userId) + '\u0000' + conversationId.trim();
    }

    private record Exchange(String userText, String assistantText) {
    }
}
