package com.vidnyan.cpg.application.port.out;

import com.vidnyan.cpg.domain.analysis.FunctionAnalysis;
import com.vidnyan.cpg.domain.analysis.ModuleAnalysis;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Port for storing analyzed modules.
 * Implemented by adapters that keep analyses in memory, in a database, etc.
 */
public interface AnalysisRepository {

    void save(ModuleAnalysis module);

    /**
     * Look up a module and record the access.
     */
    Optional<ModuleAnalysis> findModule(String name);

    Optional<FunctionAnalysis> findFunction(String module, String function, int arity);

    List<ModuleAnalysis> findAll();

    boolean remove(String name);

    /**
     * Access bookkeeping of a stored module.
     */
    Optional<AccessInfo> accessInfo(String name);

    /**
     * Drop modules not accessed since {@code cutoff}.
     * @return number of modules removed
     */
    int evictUnusedSince(Instant cutoff);

    record AccessInfo(Instant storedAt, Instant lastAccess, long accessCount) {}
}
