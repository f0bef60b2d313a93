package org.colonysim.runtime.presence;

import java.util.List;

/**
 * The anonymized presence view: aggregate counts plus one dot per registered colonist.
 * <p>
 * Contains no colonist identifier in any field. Dot order is registration order and is not
 * meaningful.
 *
 * @param totalCount    number of registered colonists.
 * @param idleCount     number of idle colonists.
 * @param foragingCount number of foraging colonists.
 * @param dots          position and activity of every registered colonist.
 */
public record PresenceSummary(int totalCount, int idleCount, int foragingCount, List<PresenceDot> dots) {

    public static final PresenceSummary EMPTY = new PresenceSummary(0, 0, 0, List.of());

    public PresenceSummary {
        dots = List.copyOf(dots);
    }

    public PresenceCounts counts() {
        return new PresenceCounts(totalCount, idleCount, foragingCount);
    }
}
