package com.codeops.notebook.editor;

import java.util.Optional;

/**
 * Key/value persistence scoped to the device, not the account.
 */
public interface DraftStore {

    Optional<String> get(String key);

    void set(String key, String value);

    /**
     * Removes the key. Removing an absent key is a no-op.
     */
    void delete(String key);
}
