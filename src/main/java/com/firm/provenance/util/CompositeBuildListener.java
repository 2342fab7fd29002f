package com.firm.provenance.util;

import com.firm.provenance.api.BuildListener;
import com.firm.provenance.api.DerivationNode;
import com.firm.provenance.api.ProvenanceBuildException;

import java.util.Arrays;

/**
 * Fans build events out to several {@link BuildListener} instances.
 *
 * Listeners are held in a copy-on-write array, so events can be delivered
 * from concurrent builds while listeners are being added.
 */
public class CompositeBuildListener implements BuildListener {
    private volatile BuildListener[] listeners = new BuildListener[0];

    public CompositeBuildListener(BuildListener... initial) {
        for (BuildListener l : initial)
            add(l);
    }

    public synchronized void add(BuildListener listener) {
        BuildListener[] old = listeners;
        BuildListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    @Override
    public void onBuildStarted(String targetResult) {
        for (BuildListener l : listeners)
            l.onBuildStarted(targetResult);
    }

    @Override
    public void onNodeInserted(String targetResult, DerivationNode node) {
        for (BuildListener l : listeners)
            l.onNodeInserted(targetResult, node);
    }

    @Override
    public void onBuildValidated(String targetResult, int nodeCount, boolean targetPure) {
        for (BuildListener l : listeners)
            l.onBuildValidated(targetResult, nodeCount, targetPure);
    }

    @Override
    public void onBuildRejected(String targetResult, ProvenanceBuildException error) {
        for (BuildListener l : listeners)
            l.onBuildRejected(targetResult, error);
    }
}
