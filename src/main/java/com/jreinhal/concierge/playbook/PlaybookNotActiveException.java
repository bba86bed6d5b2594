package com.jreinhal.concierge.playbook;

import com.jreinhal.concierge.exception.ConciergeException;

public class PlaybookNotActiveException extends ConciergeException {
    public PlaybookNotActiveException(String playbookId, String supersededBy) {
        super("playbook_not_active", supersededBy != null
                ? "Playbook " + playbookId + " was superseded by " + supersededBy
                : "Playbook " + playbookId + " is no longer active");
    }
}
