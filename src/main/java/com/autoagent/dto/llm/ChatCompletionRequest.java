package com.autoagent.dto.llm;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import lombok.Data;

/**
 * Request body of an OpenAI-compatible {@code /chat/completions} call.
 * <p>
 * Lombok's {@code @Data} annotation is used to generate standard boilerplate code.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatCompletionRequest {

    /**
     * The model identifier, e.g. {@code "gpt-4o-mini"} or {@code "llama3"}.
     */
    private String model;

    /**
     * System instructions followed by the user prompt.
     */
    private List<ChatMessage> messages;

    private Boolean stream;

    public ChatCompletionRequest(String model, List<ChatMessage> messages) {
        this.model = model;
        this.messages = messages;
        this.stream = Boolean.FALSE;
    }
}
