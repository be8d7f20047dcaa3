package com.example.asyncdemo.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Response of the combined endpoint: both halves of the fan-out plus a note.
 */
@JsonPropertyOrder({"product", "todo", "message"})
public record CombinedResult(
    ProductRecord product,
    @JsonProperty("todo") RemoteItem remoteItem,
    String message
) {}
