package com.jreinhal.concierge.playbook;

public record PlaybookEdge(String fromStepId, String toStepId) {
}
