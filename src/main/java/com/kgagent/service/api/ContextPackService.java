package com.kgagent.service.api;

import com.kgagent.model.ContextPack;

/**
 * Supplies context packs. Packs are read-only once loaded.
 */
public interface ContextPackService {

    /**
     * @param packId pack id, or null for the configured default pack.
     * @throws com.kgagent.exception.KgAgentException if the pack cannot be found or parsed.
     */
    ContextPack getPack(String packId);

    ContextPack getDefaultPack();

    /**
     * Drops every cached pack so the next lookup reloads it.
     */
    void invalidateAll();
}
