package com.nevis.corpus.service;

import com.nevis.corpus.exception.CollaboratorException;
import com.nevis.corpus.infra.RateLimiter;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RetriableException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.Locale;

@Service
@Slf4j
public class GeminiCollaboratorClient implements CollaboratorClient {

    public static final String CHAT_LIMIT = "chat_limit";

    private final ChatModel chatModel;
    private final RateLimiter chatLimiter;

    public GeminiCollaboratorClient(
        ChatModel chatModel,
        @Qualifier("chatLimiter") RateLimiter chatLimiter
    ) {
        this.chatModel = chatModel;
        this.chatLimiter = chatLimiter;
    }

    @Override
    @Retryable(
        retryFor = RetriableException.class,
        maxAttemptsExpression = "${app.collaborator.max-attempts:3}",
        backoff = @Backoff(delayExpression = "${app.collaborator.backoff-ms:2000}", multiplier = 2),
        recover = "recoverText"
    )
    public String sendText(String prompt) {
        log.debug("Sending text request ({} chars)", prompt.length());
        String response;
        try {
            response = chatLimiter.execute(CHAT_LIMIT, 1, () -> chatModel.chat(prompt));
        } catch (RetriableException e) {
            log.warn("Transient collaborator failure: {}", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            throw new CollaboratorException("Text request failed: " + e.getMessage(), e);
        }
        return requireText(response);
    }

    @Override
    @Retryable(
        retryFor = RetriableException.class,
        maxAttemptsExpression = "${app.collaborator.max-attempts:3}",
        backoff = @Backoff(delayExpression = "${app.collaborator.backoff-ms:2000}", multiplier = 2),
        recover = "recoverImage"
    )
    public String sendImage(String prompt, Path imagePath) {
        UserMessage message = UserMessage.from(
            ImageContent.from(readBase64(imagePath), mimeTypeOf(imagePath)),
            TextContent.from(prompt)
        );

        log.debug("Sending image request for {}", imagePath.getFileName());
        ChatResponse response;
        try {
            response = chatLimiter.execute(CHAT_LIMIT, 1, () -> chatModel.chat(message));
        } catch (RetriableException e) {
            log.warn("Transient collaborator failure for {}: {}", imagePath.getFileName(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            throw new CollaboratorException("Image request failed for " + imagePath.getFileName() + ": " + e.getMessage(), e);
        }
        if (response == null || response.aiMessage() == null) {
            throw new CollaboratorException("Collaborator returned no message for " + imagePath.getFileName());
        }
        return requireText(response.aiMessage().text());
    }

    @Recover
    public String recoverText(RetriableException e, String prompt) {
        throw new CollaboratorException("Collaborator unavailable after retries: " + e.getMessage(), e);
    }

    @Recover
    public String recoverImage(RetriableException e, String prompt, Path imagePath) {
        throw new CollaboratorException("Collaborator unavailable after retries for " + imagePath.getFileName() + ": " + e.getMessage(), e);
    }

    private static String requireText(String response) {
        if (response == null) {
            throw new CollaboratorException("Collaborator returned no text");
        }
        return response;
    }

    private static String readBase64(Path imagePath) {
        try {
            return Base64.getEncoder().encodeToString(Files.readAllBytes(imagePath));
        } catch (IOException e) {
            throw new CollaboratorException("Cannot read image " + imagePath + ": " + e.getMessage(), e);
        }
    }

    static String mimeTypeOf(Path imagePath) {
        String name = imagePath.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".png")) {
            return "image/png";
        }
        return "image/jpeg";
    }
}
