package com.firm.provenance.registry;

import com.firm.provenance.api.BuildListener;
import com.firm.provenance.api.DuplicateTreeException;
import com.firm.provenance.api.ProvenanceBuildException;
import com.firm.provenance.api.UnknownTreeException;
import com.firm.provenance.engine.ProvenanceTree;

import java.util.*;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import lombok.extern.log4j.Log4j2;

/**
 * Owns the frozen provenance trees, keyed by target name.
 *
 * This is the only mutable surface of the library. Each derivation is built
 * privately in a {@link TreeBuild}; the registry mutex is held only while the
 * validated tree is inserted, so independent builds can run in parallel.
 *
 * Names are insert-once: registering a name that is already present is a
 * {@link DuplicateTreeException}, never a silent overwrite. A rejected build
 * leaves the registry unchanged.
 */
@Log4j2
public final class DerivationRegistry {
    private final Object lock = new Object();
    private final Map<String, ProvenanceTree> trees = new TreeMap<>();

    private final BuildListener listener;
    private final PurityPolicy purityPolicy;

    public DerivationRegistry() {
        this(BuildListener.NO_OP, PurityPolicy.ALLOW_EMPIRICAL);
    }

    public DerivationRegistry(BuildListener listener, PurityPolicy purityPolicy) {
        this.listener = Objects.requireNonNull(listener, "listener");
        this.purityPolicy = Objects.requireNonNull(purityPolicy, "purityPolicy");
    }

    public static Builder builder() {
        return new Builder();
    }

    public PurityPolicy purityPolicy() {
        return purityPolicy;
    }

    /**
     * Opens a build for {@code targetResult}.
     *
     * @throws DuplicateTreeException if a tree with that name is already stored.
     */
    public TreeBuild startBuild(String targetResult) {
        Objects.requireNonNull(targetResult, "targetResult");
        TreeBuild build = new TreeBuild(this, targetResult, listener);
        listener.onBuildStarted(targetResult);
        synchronized (lock) {
            if (trees.containsKey(targetResult)) {
                DuplicateTreeException e = new DuplicateTreeException(targetResult);
                listener.onBuildRejected(targetResult, e);
                throw e;
            }
        }
        return build;
    }

    /**
     * Runs one derivation module through start, insert and finish.
     *
     * @return The stored tree.
     * @throws ProvenanceBuildException if the derivation is invalid.
     */
    public ProvenanceTree register(String targetResult, Derivation derivation) {
        TreeBuild build = startBuild(targetResult);
        derivation.define(build);
        return build.finishBuild();
    }

    /**
     * Builds independent derivations concurrently on {@code executor}.
     *
     * Validation failures do not abort the batch; each one is reported in its
     * own {@link BuildOutcome}. Any other exception thrown by a derivation is a
     * bug in that module and is rethrown.
     *
     * @return One outcome per name, in name order.
     */
    public List<BuildOutcome> registerAll(Map<String, Derivation> derivations, ExecutorService executor) {
        List<Callable<BuildOutcome>> tasks = new ArrayList<>(derivations.size());
        for (Map.Entry<String, Derivation> e : new TreeMap<>(derivations).entrySet()) {
            tasks.add(() -> {
                try {
                    return BuildOutcome.valid(register(e.getKey(), e.getValue()));
                } catch (ProvenanceBuildException ex) {
                    return BuildOutcome.rejected(e.getKey(), ex);
                }
            });
        }

        List<BuildOutcome> outcomes = new ArrayList<>(tasks.size());
        try {
            for (Future<BuildOutcome> f : executor.invokeAll(tasks))
                outcomes.add(f.get());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while registering derivations", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re)
                throw re;
            if (cause instanceof Error err)
                throw err;
            throw new IllegalStateException("Derivation failed", cause);
        }
        return outcomes;
    }

    void store(ProvenanceTree tree) {
        synchronized (lock) {
            if (trees.containsKey(tree.targetResult()))
                throw new DuplicateTreeException(tree.targetResult());
            trees.put(tree.targetResult(), tree);
        }
        log.debug("Stored tree \"{}\" ({} nodes)", tree.targetResult(), tree.size());
    }

    /**
     * Strict lookup by target name.
     *
     * @throws UnknownTreeException if nothing is registered under that name.
     */
    public ProvenanceTree tree(String targetResult) {
        return find(targetResult).orElseThrow(() -> new UnknownTreeException(targetResult));
    }

    public Optional<ProvenanceTree> find(String targetResult) {
        synchronized (lock) {
            return Optional.ofNullable(trees.get(targetResult));
        }
    }

    public boolean contains(String targetResult) {
        synchronized (lock) {
            return trees.containsKey(targetResult);
        }
    }

    /** Registered names in order. */
    public List<String> names() {
        synchronized (lock) {
            return List.copyOf(trees.keySet());
        }
    }

    public int size() {
        synchronized (lock) {
            return trees.size();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Reports whether each registered target is free of empirical inputs.
     *
     * @return One entry per tree, in name order.
     */
    public List<AuditEntry> auditAll() {
        List<ProvenanceTree> snapshot;
        synchronized (lock) {
            snapshot = new ArrayList<>(trees.values());
        }
        List<AuditEntry> entries = new ArrayList<>(snapshot.size());
        for (ProvenanceTree tree : snapshot) {
            entries.add(new AuditEntry(tree.targetResult(), tree.isTargetPure(),
                    tree.contaminationSources(tree.targetId())));
        }
        long impure = entries.stream().filter(e -> !e.pure()).count();
        if (impure > 0)
            log.debug("Audit: {} of {} targets consume empirical inputs", impure, entries.size());
        return entries;
    }

    /** Programmatic configuration for a registry. */
    public static final class Builder {
        private BuildListener listener = BuildListener.NO_OP;
        private PurityPolicy purityPolicy = PurityPolicy.ALLOW_EMPIRICAL;

        private Builder() {
        }

        public Builder listener(BuildListener listener) {
            this.listener = listener;
            return this;
        }

        public Builder purityPolicy(PurityPolicy purityPolicy) {
            this.purityPolicy = purityPolicy;
            return this;
        }

        public DerivationRegistry build() {
            return new DerivationRegistry(listener, purityPolicy);
        }
    }
}
