package com.kgagent.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.kgagent.config.KgAgentProperties;
import com.kgagent.config.PackCachePolicy;
import com.kgagent.exception.KgAgentException;
import com.kgagent.model.ContextPack;
import com.kgagent.service.api.ContextPackService;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.CompletionException;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

/**
 * Loads context packs from {@code <packs.directory>/<id>.json} or, failing that, from the
 * classpath under {@code packs/}. Loaded packs are cached according to the injected
 * {@link PackCachePolicy}.
 */
@Service
@Slf4j
public class ContextPackServiceImpl implements ContextPackService {

    private static final Pattern PACK_ID = Pattern.compile("[A-Za-z0-9_-]+");

    private final KgAgentProperties properties;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final LoadingCache<String, ContextPack> cache;

    public ContextPackServiceImpl(KgAgentProperties properties, PackCachePolicy policy) {
        this.properties = properties;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(policy.maxAge())
                .maximumSize(policy.maxEntries())
                .ticker(policy.ticker())
                .build(this::load);
    }

    @Override
    public ContextPack getPack(String packId) {
        String id = packId == null || packId.isBlank() ? properties.getPacks().getDefaultPack() : packId.trim();
        if (!PACK_ID.matcher(id).matches()) {
            throw new KgAgentException("Invalid context pack id: '" + id + "'");
        }
        try {
            return cache.get(id);
        } catch (CompletionException e) {
            throw e.getCause() instanceof KgAgentException kg ? kg : new KgAgentException(e.getMessage(), e);
        }
    }

    @Override
    public ContextPack getDefaultPack() {
        return getPack(null);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.info("Context pack cache cleared");
    }

    private ContextPack load(String id) {
        ContextPack pack = readPack(id);
        if (pack.getId() == null) {
            pack.setId(id);
        }
        if (pack.getTasks().isEmpty()) {
            throw new KgAgentException("Context pack '" + id + "' declares no tasks.");
        }
        log.info("Loaded context pack '{}' with {} task(s) and {} graph(s)", id, pack.getTasks().size(), pack.getGraphs().size());
        return pack;
    }

    private ContextPack readPack(String id) {
        String fileName = id + ".json";
        try {
            String directory = properties.getPacks().getDirectory();
            if (directory != null && !directory.isBlank()) {
                Path file = Paths.get(directory, fileName);
                if (Files.isRegularFile(file)) {
                    log.debug("Reading context pack from {}", file);
                    return objectMapper.readValue(file.toFile(), ContextPack.class);
                }
            }
            ClassPathResource resource = new ClassPathResource("packs/" + fileName);
            if (!resource.exists()) {
                throw new KgAgentException("Unknown context pack '" + id + "'.");
            }
            try (InputStream in = resource.getInputStream()) {
                return objectMapper.readValue(in, ContextPack.class);
            }
        } catch (IOException e) {
            throw new KgAgentException("Failed to read context pack '" + id + "': " + e.getMessage(), e);
        }
    }
}
