package com.codeops.notebook.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Editor tuning bound to the {@code codeops.notebook} prefix.
 */
@ConfigurationProperties(prefix = "codeops.notebook")
@Getter
@Setter
public class NotebookProperties {

    /** Directory holding the device-local draft files. */
    private String draftDirectory = System.getProperty("java.io.tmpdir") + "/codeops-notebook/drafts";

    private Duration autosaveDelay = AppConstants.DEFAULT_AUTOSAVE_DELAY;

    private Duration savedDisplay = AppConstants.DEFAULT_SAVED_DISPLAY;

    private Duration draftMaxAge = AppConstants.DEFAULT_DRAFT_MAX_AGE;
}
