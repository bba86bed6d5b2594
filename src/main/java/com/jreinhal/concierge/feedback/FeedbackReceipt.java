package com.jreinhal.concierge.feedback;

public record FeedbackReceipt(String requestId, int score, boolean goldenPathRecorded, String pathId) {
}
