package com.codeops.notebook.event;

public enum ChangeType {
    INSERTED,
    DELETED
}
