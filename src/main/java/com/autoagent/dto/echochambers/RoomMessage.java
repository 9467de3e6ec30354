package com.autoagent.dto.echochambers;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One message of a room's history.
 * <p>
 * Lombok annotations are used to reduce boilerplate code.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RoomMessage {

    private String id;
    private String content;
    private Sender sender = new Sender();
    private String timestamp;
    private String roomId;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Sender {
        private String username;
        private String model;
    }
}
