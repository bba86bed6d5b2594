package com.jreinhal.concierge.graph;

import java.util.Locale;

public enum NodeType {
    CUSTOMER,
    TICKET,
    AGENT,
    RESOLUTION,
    ARTICLE,
    PLAYBOOK;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
