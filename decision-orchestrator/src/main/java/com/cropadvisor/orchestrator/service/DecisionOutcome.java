package com.cropadvisor.orchestrator.service;

import com.cropadvisor.common.model.Decision;

public record DecisionOutcome(Decision decision, CommitStatus commitStatus) {}
