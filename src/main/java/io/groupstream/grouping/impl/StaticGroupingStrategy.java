package io.groupstream.grouping.impl;

import io.groupstream.grouping.type.GroupingStrategy;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Groups taken from configuration ({@code staticGroups: {entity: group}}).
 * Derived logs are assumed to exist already.
 */
@Slf4j
public final class StaticGroupingStrategy implements GroupingStrategy {
    private final Map<String, String> groups;

    public StaticGroupingStrategy(final Map<String, String> groups) {
        this.groups = Map.copyOf(groups);
    }

    @Override
    public Optional<String> groupOf(final String entityId) {
        return Optional.ofNullable(groups.get(entityId));
    }

    @Override
    public List<String> groups() {
        return List.copyOf(new TreeSet<>(groups.values()));
    }

    @Override
    public List<String> entitiesIn(final String group) {
        return groups.entrySet().stream()
                .filter(e -> e.getValue().equals(group))
                .map(Map.Entry::getKey)
                .sorted()
                .collect(Collectors.toList());
    }

    @Override
    public void createDerivedLog(final String group) {
        log.debug("Static grouping: derived log for group [{}] is managed externally", group);
    }

    @Override
    public void removeDerivedLog(final String group) {
        log.debug("Static grouping: derived log for group [{}] is managed externally", group);
    }

    @Override
    public String readinessIssue() {
        return groups.isEmpty() ? "no static groups configured" : null;
    }
}
