package com.example.asyncdemo.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Todo item fetched from the external JSON API.
 *
 * The owner is called {@code userId} on the wire. Every field is required, so
 * a body that is missing one, or carries it as null, fails to decode.
 */
public record RemoteItem(
    @JsonProperty(value = "id", required = true) Integer id,
    @JsonProperty(value = "userId", required = true) Integer ownerId,
    @JsonProperty(value = "title", required = true) String title,
    @JsonProperty(value = "completed", required = true) Boolean completed
) {
    public RemoteItem {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(ownerId, "userId");
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(completed, "completed");
    }
}
