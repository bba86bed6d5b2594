package com.jreinhal.concierge.graph;

/**
 * Directed relationships. Comments give source and target node types.
 */
public enum EdgeLabel {
    /** customer -> ticket */
    FILED,
    /** ticket -> agent */
    HANDLED_BY,
    /** ticket -> resolution */
    RESOLVED_BY,
    /** resolution -> agent */
    EXECUTED_BY,
    /** resolution -> article */
    USED_ARTICLE,
    /** playbook -> resolution */
    DERIVED_FROM;
}
