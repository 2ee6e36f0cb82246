package org.sessionsync.interfaces;

import org.sessionsync.model.CollaborationEvent;

/** Receives collaboration events of the type it was registered for. */
@FunctionalInterface
public interface CollaborationListener {

    void onEvent(CollaborationEvent event) throws Exception;
}
