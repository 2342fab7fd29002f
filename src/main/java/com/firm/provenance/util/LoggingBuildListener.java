package com.firm.provenance.util;

import com.firm.provenance.api.BuildListener;
import com.firm.provenance.api.DerivationNode;
import com.firm.provenance.api.ProvenanceBuildException;

import lombok.extern.log4j.Log4j2;

/**
 * Writes build events to Log4j 2.
 *
 * Starts and insertions go to DEBUG, validated trees to INFO, contaminated
 * targets and rejections to WARN.
 */
@Log4j2
public class LoggingBuildListener implements BuildListener {

    @Override
    public void onBuildStarted(String targetResult) {
        log.debug("Building \"{}\"", targetResult);
    }

    @Override
    public void onNodeInserted(String targetResult, DerivationNode node) {
        if (log.isTraceEnabled())
            log.trace("[{}] {} {} <- {}", targetResult, node.kind().value(), node.id(), node.dependencies());
        else
            log.debug("[{}] inserted {}", targetResult, node.id());
    }

    @Override
    public void onBuildValidated(String targetResult, int nodeCount, boolean targetPure) {
        if (targetPure)
            log.info("Validated \"{}\": {} nodes, target pure", targetResult, nodeCount);
        else
            log.warn("Validated \"{}\": {} nodes, target consumes empirical inputs", targetResult, nodeCount);
    }

    @Override
    public void onBuildRejected(String targetResult, ProvenanceBuildException error) {
        log.warn("Rejected \"{}\": {}", targetResult, error.getMessage());
    }
}
