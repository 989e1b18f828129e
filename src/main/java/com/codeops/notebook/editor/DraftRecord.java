package com.codeops.notebook.editor;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Serialized form of the local draft. A missing record means there is no draft.
 *
 * @param open       always true while a draft exists
 * @param title      note title
 * @param body       serialized markup
 * @param color      note color
 * @param editingRef the persisted note being edited, null for a new note
 * @param timestamp  epoch millis of the last write
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DraftRecord(
        @JsonProperty("isOpen") boolean open,
        String title,
        String body,
        String color,
        EditingRef editingRef,
        long timestamp
) {}
