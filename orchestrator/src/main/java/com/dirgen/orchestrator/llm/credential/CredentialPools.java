package com.dirgen.orchestrator.llm.credential;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The credential pools of all remote providers, by provider name.
 */
public class CredentialPools {

    private final Map<String, CredentialPool> pools = new LinkedHashMap<>();

    public CredentialPools(Collection<CredentialPool> pools) {
        pools.forEach(p -> this.pools.put(p.provider(), p));
    }

    public Optional<CredentialPool> get(String provider) {
        return Optional.ofNullable(pools.get(provider));
    }

    public List<CredentialStats> stats() {
        return pools.values().stream().map(CredentialPool::stats).toList();
    }
}
