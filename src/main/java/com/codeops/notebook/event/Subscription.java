package com.codeops.notebook.event;

/**
 * Handle for a refresh subscription. Closing it more than once is harmless.
 */
public interface Subscription extends AutoCloseable {

    @Override
    void close();
}
