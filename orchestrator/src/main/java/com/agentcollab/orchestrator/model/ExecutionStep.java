package com.agentcollab.orchestrator.model;

import java.time.Instant;

/**
 * One timestamped step of an agent execution. Step numbers start at 1 and
 * are dense within one execution.
 */
public record ExecutionStep(int stepNumber, StepType type, String content, Instant timestamp) {}
