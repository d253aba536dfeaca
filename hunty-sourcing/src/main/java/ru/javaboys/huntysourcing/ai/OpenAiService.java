package ru.javaboys.huntysourcing.ai;

import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;

public interface OpenAiService {
    <T> T structuredTalkToChatGPT(SystemMessage systemMessage, UserMessage userMessage, Class<T> classType);
}
