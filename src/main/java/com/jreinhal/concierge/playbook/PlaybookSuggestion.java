package com.jreinhal.concierge.playbook;

public record PlaybookSuggestion(Playbook playbook, double relevance, String reason) {
}
