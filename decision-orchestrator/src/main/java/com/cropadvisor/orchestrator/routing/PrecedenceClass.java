package com.cropadvisor.orchestrator.routing;

/**
 * Groups intents that share one evaluator precedence order.
 */
public enum PrecedenceClass {
    IRRIGATION,
    STATUS,
    CONTEXT
}
