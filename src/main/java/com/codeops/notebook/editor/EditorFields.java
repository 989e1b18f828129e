package com.codeops.notebook.editor;

/**
 * The editable fields of the open note. {@code body} is the editing surface's serialized markup.
 */
public record EditorFields(String title, String body, String color) {

    public static final EditorFields EMPTY = new EditorFields("", "", null);

    public boolean hasTitle() {
        return title != null && !title.isBlank();
    }

    /**
     * Returns a copy with the non-null arguments applied.
     */
    public EditorFields merge(String newTitle, String newBody, String newColor) {
        return new EditorFields(
                newTitle != null ? newTitle : title,
                newBody != null ? newBody : body,
                newColor != null ? newColor : color
        );
    }
}
