package com.autoagent.dto.echochambers;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class RoomsResponse {
    private List<RoomInfo> rooms = new ArrayList<>();
}
