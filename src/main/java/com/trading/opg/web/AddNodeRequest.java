package com.trading.opg.web;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.trading.opg.api.ParameterEntry;

import lombok.Data;

import java.util.List;

/** Body of {@code POST /add_node}. */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class AddNodeRequest {
    private String id;
    private String type;
    private List<ParameterEntry> parameters;
}
