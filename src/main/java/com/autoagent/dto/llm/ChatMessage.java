package com.autoagent.dto.llm;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One message of a chat-completions conversation.
 * <p>
 * Lombok annotations are used to reduce boilerplate code.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessage {

    /**
     * {@code "system"} for the agent's persona, {@code "user"} for the prompt,
     * {@code "assistant"} for generated replies.
     */
    private String role;

    private String content;
}
