package com.kgagent.service.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.github.benmanes.caffeine.cache.Ticker;
import com.kgagent.config.KgAgentProperties;
import com.kgagent.config.PackCachePolicy;
import com.kgagent.exception.KgAgentException;
import com.kgagent.model.ContextPack;
import com.kgagent.model.TaskType;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ContextPackServiceImplTest {

    private static final String OVERRIDE_PACK = """
            {
              "id": "wobd",
              "label": "Override",
              "federation_endpoint": "http://localhost/federation/sparql",
              "graphs": {"nde": {"iri": "https://purl.org/okn/frink/kg/nde", "endpoint": "http://localhost/nde/sparql"}},
              "default_graphs": ["nde"],
              "tasks": [{"id": "entity_lookup", "required_slots": ["q"]}]
            }
            """;

    @TempDir
    Path packsDir;

    private final AtomicLong nanos = new AtomicLong();
    private final Ticker ticker = nanos::get;
    private KgAgentProperties properties;
    private ContextPackServiceImpl service;

    @BeforeEach
    void setUp() {
        properties = new KgAgentProperties();
        service = new ContextPackServiceImpl(properties, new PackCachePolicy(Duration.ofHours(1), 4, ticker));
    }

    @Test
    void getPack_bundledPack_hasGraphsAndTasks() {
        ContextPack pack = service.getPack("wobd");

        assertThat(pack.getId()).isEqualTo("wobd");
        assertThat(pack.getGraphs()).containsKeys("nde", "gene-expression-atlas-okn", "wikidata", "ubergraph");
        assertThat(pack.getFederationEndpoint()).isEqualTo("https://frink.apps.renci.org/federation/sparql");
        assertThat(pack.requireTask(TaskType.GENES_IN_EXPERIMENT).getRequiredSlots()).contains("experiment_id");
    }

    @Test
    void getPack_nullOrBlank_usesDefaultPack() {
        assertThat(service.getPack(null).getId()).isEqualTo("wobd");
        assertThat(service.getPack("  ").getId()).isEqualTo("wobd");
        assertThat(service.getDefaultPack()).isSameAs(service.getPack("wobd"));
    }

    @Test
    void getPack_cachedUntilMaxAge() {
        ContextPack first = service.getPack("wobd");
        nanos.addAndGet(Duration.ofMinutes(59).toNanos());
        assertThat(service.getPack("wobd")).isSameAs(first);

        nanos.addAndGet(Duration.ofMinutes(2).toNanos());
        assertThat(service.getPack("wobd")).isNotSameAs(first);
    }

    @Test
    void invalidateAll_forcesReload() {
        ContextPack first = service.getPack("wobd");

        service.invalidateAll();

        assertThat(service.getPack("wobd")).isNotSameAs(first);
    }

    @Test
    void getPack_directoryOverridesClasspath() throws IOException {
        Files.writeString(packsDir.resolve("wobd.json"), OVERRIDE_PACK);
        properties.getPacks().setDirectory(packsDir.toString());

        ContextPack pack = service.getPack("wobd");

        assertThat(pack.getLabel()).isEqualTo("Override");
        assertThat(pack.getGraphs()).containsOnlyKeys("nde");
    }

    @Test
    void getPack_unknownId_fails() {
        assertThatThrownBy(() -> service.getPack("nope"))
                .isInstanceOf(KgAgentException.class)
                .hasMessage("Unknown context pack 'nope'.");
    }

    @Test
    void getPack_pathLikeId_isRejected() {
        assertThatThrownBy(() -> service.getPack("../etc/passwd"))
                .isInstanceOf(KgAgentException.class)
                .hasMessageContaining("Invalid context pack id");
    }

    @Test
    void getPack_malformedFile_reportsReadFailure() throws IOException {
        Files.writeString(packsDir.resolve("broken.json"), "{ not json");
        properties.getPacks().setDirectory(packsDir.toString());

        assertThatThrownBy(() -> service.getPack("broken"))
                .isInstanceOf(KgAgentException.class)
                .hasMessageContaining("Failed to read context pack 'broken'");
    }
}
