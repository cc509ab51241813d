package projectelastic.domain.model;

import projectelastic.domain.solution.ConsolidationNotice;
import projectelastic.domain.solution.IntegrationPointResult;
import projectelastic.domain.solution.NodalDisplacement;
import projectelastic.domain.solution.Solution;

import java.util.List;

/**
 * Resumen exportable de una solución: todo salvo los mallados, que ya están en el
 * {@link ModelDefinition} correspondiente.
 */
public record SolutionSummary(
        int degreesOfFreedom,
        int fixedDofCount,
        long elapsedNanos,
        List<NodalDisplacement> nodalDisplacements,
        List<IntegrationPointResult> results,
        List<ConsolidationNotice> notices
) {
    public static SolutionSummary of(Solution solution) {
        return new SolutionSummary(
                solution.getDegreesOfFreedom(),
                solution.getFixedDofCount(),
                solution.getElapsedNanos(),
                solution.getNodalDisplacements(),
                solution.getResults(),
                solution.getNotices());
    }
}
