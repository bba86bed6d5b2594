package com.jreinhal.concierge.feedback;

public enum GoldenPathOutcome {
    APPROVED,
    CORRECTED,
    POSITIVE_SCORE;
}
