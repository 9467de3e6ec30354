package com.autoagent.dto.echochambers;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * An Echochambers room as listed by {@code GET /api/rooms}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class RoomInfo {

    private String id;
    private String name;

    /**
     * The room's discussion topic; {@code "General Discussion"} when the server sends none.
     */
    private String topic;

    private List<String> tags = new ArrayList<>();
    private int messageCount;
}
