package ru.javaboys.huntysourcing.ai;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class OpenAiServiceImpl implements OpenAiService {

    private final ChatClient chatClient;

    @Override
    public <T> T structuredTalkToChatGPT(SystemMessage systemMessage, UserMessage userMessage, Class<T> classType) {
        List<Message> promptMessages = List.of(systemMessage, userMessage);
        log.debug("Structured prompt for {}", classType.getSimpleName());

        return chatClient
                .prompt(new Prompt(promptMessages))
                .call()
                .entity(classType);
    }
}
