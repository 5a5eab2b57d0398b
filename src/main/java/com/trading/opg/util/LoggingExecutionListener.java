package com.trading.opg.util;

import com.trading.opg.api.ExecutionListener;

import lombok.extern.log4j.Log4j2;

import java.util.List;

/** Traces stage and attempt progress at debug level. */
@Log4j2
public class LoggingExecutionListener implements ExecutionListener {

    @Override
    public void onStageStart(long runId, int stageIndex, List<String> nodeIds) {
        log.debug("[run {}] stage {} -> {}", runId, stageIndex, nodeIds);
    }

    @Override
    public void onAttemptStart(long runId, String nodeId, int attempt) {
        log.debug("[run {}] {} attempt {}", runId, nodeId, attempt);
    }

    @Override
    public void onExecutionEnd(long runId, int succeeded, boolean aborted, boolean cancelled) {
        log.debug("[run {}] end: succeeded={} aborted={} cancelled={}", runId, succeeded, aborted, cancelled);
    }
}
