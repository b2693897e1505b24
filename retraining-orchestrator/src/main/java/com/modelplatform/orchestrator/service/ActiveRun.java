package com.modelplatform.orchestrator.service;

import com.modelplatform.common.model.RunState;

import java.time.Instant;

/** Snapshot of the run currently holding the pipeline lock. */
public record ActiveRun(String runId, RunState state, Instant startedAt, boolean forceRetrain) {}
