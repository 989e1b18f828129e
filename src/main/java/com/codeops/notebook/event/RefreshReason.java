package com.codeops.notebook.event;

public enum RefreshReason {
    LOCAL_MUTATION,
    COLLABORATOR_CHANGE
}
