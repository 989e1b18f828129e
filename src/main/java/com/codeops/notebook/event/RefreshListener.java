package com.codeops.notebook.event;

@FunctionalInterface
public interface RefreshListener {

    void onRefresh(RefreshReason reason);
}
