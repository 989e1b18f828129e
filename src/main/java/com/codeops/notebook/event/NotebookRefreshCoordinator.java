package com.codeops.notebook.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Single invalidation point for merged notebook views. Views are never cached or patched in
 * place; subscribers are told to recompute when a local mutation commits or a collaborator
 * row for their user changes.
 */
@Component
@Slf4j
public class NotebookRefreshCoordinator {

    private final Map<UUID, List<RefreshListener>> listeners = new ConcurrentHashMap<>();

    /**
     * Registers a listener for one user's refresh signals.
     *
     * @param userId   the user whose view the listener renders
     * @param listener callback invoked on every refresh for that user
     * @return a handle that removes the listener when closed
     */
    public Subscription subscribe(UUID userId, RefreshListener listener) {
        listeners.computeIfAbsent(userId, id -> new CopyOnWriteArrayList<>()).add(listener);
        log.debug("Refresh subscriber added for user {}", userId);
        return () -> unsubscribe(userId, listener);
    }

    /**
     * Tells every subscriber of the user to recompute its view. A listener that throws is dropped.
     *
     * @param userId the user whose view is stale
     * @param reason what triggered the refresh
     */
    public void refresh(UUID userId, RefreshReason reason) {
        List<RefreshListener> userListeners = listeners.get(userId);
        if (userListeners == null || userListeners.isEmpty()) {
            return;
        }
        for (RefreshListener listener : userListeners) {
            try {
                listener.onRefresh(reason);
            } catch (RuntimeException e) {
                log.warn("Dropping refresh subscriber for user {}: {}", userId, e.getMessage());
                unsubscribe(userId, listener);
            }
        }
    }

    public int subscriberCount(UUID userId) {
        List<RefreshListener> userListeners = listeners.get(userId);
        return userListeners == null ? 0 : userListeners.size();
    }

    @TransactionalEventListener(fallbackExecution = true)
    public void onCollaboratorChanged(NoteCollaboratorChangedEvent event) {
        refresh(event.userId(), RefreshReason.COLLABORATOR_CHANGE);
    }

    @TransactionalEventListener(fallbackExecution = true)
    public void onNotebookMutated(NotebookMutatedEvent event) {
        log.debug("Refreshing {} user view(s) after {}", event.affectedUserIds().size(), event.action());
        event.affectedUserIds().forEach(userId -> refresh(userId, RefreshReason.LOCAL_MUTATION));
    }

    private void unsubscribe(UUID userId, RefreshListener listener) {
        listeners.computeIfPresent(userId, (id, list) -> {
            list.remove(listener);
            return list.isEmpty() ? null : list;
        });
    }
}
