package com.jreinhal.concierge.playbook;

public enum PlaybookStatus {
    ACTIVE,
    SUPERSEDED;
}
