package org.rostilos.branchtree.topology.ancestry;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.TreeSet;

/**
 * Pure parent selection over already gathered evidence. No git access happens here.
 *
 * <p>Tiers, strongest first:
 * <ol>
 *   <li>naming: the longest other branch {@code B} with {@code target} starting with {@code B + "/"} or
 *       {@code B + "-"}</li>
 *   <li>ancestry: among commit ancestors of the target, the one with the smallest positive distance, seeded
 *       with the base branch holding the {@code base..target} distance; ties go to the lexically smaller name
 *       and the result counts only if it is not the base</li>
 *   <li>fallback: the base branch</li>
 * </ol>
 */
public final class ParentSelector {

    private ParentSelector() {
        // Utility class
    }

    /**
     * Select the parent of {@code target}.
     *
     * @param target     branch whose parent is wanted
     * @param candidates every known branch name; the target and the base are ignored
     * @param baseBranch the base branch
     * @param baseline   {@code base..target} commit count, empty when it could not be computed
     * @param distances  {@code C..target} counts, only for candidates whose tip is an ancestor of the target
     */
    public static ParentInference select(
            String target,
            Collection<String> candidates,
            String baseBranch,
            OptionalInt baseline,
            Map<String, Integer> distances
    ) {
        Optional<String> byNaming = byNaming(target, candidates, baseBranch);
        if (byNaming.isPresent()) {
            return ParentInference.naming(byNaming.get());
        }
        return byDistance(target, candidates, baseBranch, baseline, distances)
                .map(ParentInference::ancestry)
                .orElseGet(() -> ParentInference.fallback(baseBranch));
    }

    public static Optional<String> byNaming(String target, Collection<String> candidates, String baseBranch) {
        String best = null;
        for (String candidate : candidates) {
            if (candidate.equals(target) || candidate.equals(baseBranch)) {
                continue;
            }
            if (!target.startsWith(candidate + "/") && !target.startsWith(candidate + "-")) {
                continue;
            }
            // equal-length matches would be the same name
            if (best == null || candidate.length() > best.length()) {
                best = candidate;
            }
        }
        return Optional.ofNullable(best);
    }

    public static Optional<String> byDistance(
            String target,
            Collection<String> candidates,
            String baseBranch,
            OptionalInt baseline,
            Map<String, Integer> distances
    ) {
        String best = baseBranch;
        int bestDistance = baseline.orElse(Integer.MAX_VALUE);

        for (String candidate : new TreeSet<>(candidates)) {
            if (candidate.equals(target) || candidate.equals(baseBranch)) {
                continue;
            }
            Integer distance = distances.get(candidate);
            if (distance != null && distance > 0 && distance < bestDistance) {
                best = candidate;
                bestDistance = distance;
            }
        }
        return best.equals(baseBranch) ? Optional.empty() : Optional.of(best);
    }
}
