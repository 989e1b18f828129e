package com.codeops.notebook.controller;

import com.codeops.notebook.config.AppConstants;
import com.codeops.notebook.event.NotebookRefreshCoordinator;
import com.codeops.notebook.event.Subscription;
import com.codeops.notebook.security.SecurityUtils;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.UUID;

/**
 * Streams refresh signals for the current user as Server-Sent Events. Each event tells the
 * client to re-read its notebook view.
 */
@RestController
@RequestMapping(AppConstants.API_PREFIX)
@PreAuthorize("isAuthenticated()")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Events", description = "Notebook refresh stream")
public class NotebookEventsController {

    private final NotebookRefreshCoordinator refreshCoordinator;

    @GetMapping(path = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamEvents() {
        UUID userId = SecurityUtils.getCurrentUserId();
        SseEmitter emitter = new SseEmitter(AppConstants.EVENT_STREAM_TIMEOUT_MS);

        Subscription subscription = refreshCoordinator.subscribe(userId, reason -> {
            try {
                emitter.send(SseEmitter.event().name("refresh").data(reason.name()));
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
        emitter.onCompletion(subscription::close);
        emitter.onTimeout(subscription::close);
        emitter.onError(e -> subscription.close());

        log.debug("Opened refresh stream for user {}", userId);
        return emitter;
    }
}
