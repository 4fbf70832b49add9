package com.blackboard.store;

import com.blackboard.contract.Fact;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable view of the fact log at version T: exactly the facts with {@code id <= T}.
 *
 * Backed by the store's arena without copying. Slots below {@link #size()} are
 * never rewritten, so the view stays stable while writers keep appending.
 */
public final class FactSnapshot {

    static final FactSnapshot EMPTY = new FactSnapshot(new Fact[0], 0, Map.of());

    private final Fact[] arena;
    private final int size;
    private final Map<String, KindIndex> index;

    FactSnapshot(Fact[] arena, int size, Map<String, KindIndex> index) {
        this.arena = arena;
        this.size = size;
        this.index = index;
    }

    /**
     * Builds a detached snapshot from facts already in id order. Intended for
     * replaying exported logs and for exercising agents in isolation.
     */
    public static FactSnapshot of(List<Fact> facts) {
        Fact[] copy = facts.toArray(new Fact[0]);
        Map<String, int[]> positions = new HashMap<>();
        Map<String, Integer> counts = new HashMap<>();
        for (int i = 0; i < copy.length; i++) {
            if (i > 0 && copy[i].id() <= copy[i - 1].id()) {
                throw new IllegalArgumentException("facts must be in strictly increasing id order");
            }
            String kind = copy[i].kind();
            int count = counts.getOrDefault(kind, 0);
            int[] slots = positions.computeIfAbsent(kind, k -> new int[copy.length]);
            slots[count] = i;
            counts.put(kind, count + 1);
        }
        Map<String, KindIndex> index = new HashMap<>();
        positions.forEach((kind, slots) -> index.put(kind, new KindIndex(slots, counts.get(kind))));
        return new FactSnapshot(copy, copy.length, Map.copyOf(index));
    }

    /** Highest id visible, 0 when empty. */
    public long version() {
        return size == 0 ? 0 : arena[size - 1].id();
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public List<Fact> facts() {
        return Collections.unmodifiableList(Arrays.asList(arena).subList(0, size));
    }

    public List<Fact> query(String kind) {
        KindIndex slice = index.get(kind);
        if (slice == null) {
            return List.of();
        }
        List<Fact> result = new ArrayList<>(slice.size());
        for (int i = 0; i < slice.size(); i++) {
            result.add(arena[slice.positions()[i]]);
        }
        return Collections.unmodifiableList(result);
    }

    public int count(String kind) {
        KindIndex slice = index.get(kind);
        return slice == null ? 0 : slice.size();
    }

    public boolean contains(String kind) {
        return count(kind) > 0;
    }

    public Set<String> kinds() {
        return index.keySet();
    }

    public Optional<Fact> find(long id) {
        if (size == 0) {
            return Optional.empty();
        }
        long first = arena[0].id();
        long offset = id - first;
        if (offset >= 0 && offset < size && arena[(int) offset].id() == id) {
            return Optional.of(arena[(int) offset]);
        }
        // detached snapshots may carry gaps
        for (int i = 0; i < size; i++) {
            if (arena[i].id() == id) {
                return Optional.of(arena[i]);
            }
        }
        return Optional.empty();
    }

    /**
     * Highest id among facts of the given kinds, 0 when none exist.
     */
    public long latestIdOf(Collection<String> kinds) {
        long latest = 0;
        for (String kind : kinds) {
            KindIndex slice = index.get(kind);
            if (slice != null && slice.size() > 0) {
                latest = Math.max(latest, arena[slice.positions()[slice.size() - 1]].id());
            }
        }
        return latest;
    }

    /**
     * Facts of a kind that no later fact of the same kind supersedes through depends_on.
     */
    public List<Fact> current(String kind) {
        List<Fact> all = query(kind);
        Set<Long> superseded = new HashSet<>();
        for (Fact fact : all) {
            superseded.addAll(fact.dependsOn());
        }
        if (superseded.isEmpty()) {
            return all;
        }
        return all.stream()
            .filter(fact -> !superseded.contains(fact.id()))
            .toList();
    }

    /** Facts of a kind that list {@code factId} in their depends_on set. */
    public List<Fact> derivedFrom(String kind, long factId) {
        return query(kind).stream()
            .filter(fact -> fact.dependsOn(factId))
            .toList();
    }

    Map<String, KindIndex> index() {
        return index;
    }

    record KindIndex(int[] positions, int size) {
    }
}
