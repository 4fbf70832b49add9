package com.blackboard.contract;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * A single write-once entry on the blackboard.
 *
 * Ids are assigned by the fact store at append time and are strictly increasing.
 * A fact is never updated; superseding information is a new fact listing the old
 * one in {@code depends_on}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Fact(
    @JsonProperty("id") long id,
    @JsonProperty("kind") String kind,
    @JsonProperty("producer") String producer,
    @JsonProperty("payload") Map<String, Object> payload,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("round") int round,
    @JsonProperty("depends_on") Set<Long> dependsOn
) {

    public Fact {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(producer, "producer");
        Objects.requireNonNull(createdAt, "createdAt");
        payload = Payloads.freeze(payload);
        dependsOn = dependsOn == null || dependsOn.isEmpty()
            ? Collections.emptySortedSet()
            : Collections.unmodifiableSortedSet(new TreeSet<>(dependsOn));
    }

    public boolean isKind(String candidate) {
        return kind.equals(candidate);
    }

    public boolean dependsOn(long factId) {
        return dependsOn.contains(factId);
    }

    public String text(String key) {
        return Payloads.text(payload, key);
    }

    public List<String> texts(String key) {
        return Payloads.texts(payload, key);
    }

    public double number(String key, double fallback) {
        return Payloads.number(payload, key, fallback);
    }

    public boolean flag(String key, boolean fallback) {
        return Payloads.flag(payload, key, fallback);
    }
}
