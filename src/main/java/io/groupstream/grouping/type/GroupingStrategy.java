package io.groupstream.grouping.type;

import java.util.List;
import java.util.Optional;

/**
 * Maps entities to groups and owns each group's derived log.
 * <p>
 * Implementations talk to an external metadata service; every method may throw
 * {@link io.groupstream.core.error.ServiceUnavailableException} when it is unreachable.
 */
public interface GroupingStrategy {

    /** Group of {@code entityId}, empty when the entity has no known group. */
    Optional<String> groupOf(String entityId);

    /** All groups currently known. */
    List<String> groups();

    List<String> entitiesIn(String group);

    /** Creates the group's derived log if it does not exist yet. */
    void createDerivedLog(String group);

    void removeDerivedLog(String group);

    /**
     * Whether the strategy can serve lookups.
     *
     * @return {@code null} when ready, otherwise the reason it is not
     */
    String readinessIssue();
}
