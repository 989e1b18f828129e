package com.codeops.notebook.config;

import com.codeops.notebook.editor.AutosaveEngine;
import com.codeops.notebook.editor.DraftSession;
import com.codeops.notebook.editor.DraftStore;
import com.codeops.notebook.editor.FileDraftStore;
import com.codeops.notebook.service.NoteService;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the device-local editor: the draft store, the draft session and the autosave engine.
 * All editor timers and the recovery mount tick run on one single-threaded scheduler.
 */
@Configuration
@Slf4j
public class EditorConfig {

    @Bean
    public Clock notebookClock() {
        return Clock.systemUTC();
    }

    /**
     * Single-threaded scheduler for autosave timers and deferred recovery steps.
     *
     * @param notebookClock clock used to compute trigger times
     * @return the scheduler
     */
    @Bean
    public ThreadPoolTaskScheduler editorTaskScheduler(Clock notebookClock) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("notebook-editor-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setClock(notebookClock);
        return scheduler;
    }

    @Bean
    public DraftStore draftStore(NotebookProperties properties) {
        Path directory = Path.of(properties.getDraftDirectory());
        log.info("Draft store directory: {}", directory.toAbsolutePath());
        return new FileDraftStore(directory);
    }

    @Bean
    public DraftSession draftSession(DraftStore draftStore, ObjectMapper objectMapper, Clock notebookClock,
                                     ThreadPoolTaskScheduler editorTaskScheduler, NotebookProperties properties) {
        return new DraftSession(draftStore, objectMapper, notebookClock, editorTaskScheduler,
                properties.getDraftMaxAge());
    }

    @Bean
    public AutosaveEngine autosaveEngine(ThreadPoolTaskScheduler editorTaskScheduler, NoteService noteService,
                                         DraftSession draftSession, NotebookProperties properties) {
        return new AutosaveEngine(editorTaskScheduler, noteService::applyAutosave, draftSession::currentFields,
                properties.getAutosaveDelay(), properties.getSavedDisplay());
    }
}
