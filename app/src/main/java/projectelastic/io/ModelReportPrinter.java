package projectelastic.io;

import lombok.extern.slf4j.Slf4j;
import projectelastic.config.SolverConfig;
import projectelastic.domain.boundary.Boundaries;
import projectelastic.domain.boundary.DisplacementConstraint;
import projectelastic.domain.geometry.Geometry;
import projectelastic.domain.load.Load;
import projectelastic.domain.load.Loads;
import projectelastic.domain.mesh.Element;
import projectelastic.domain.mesh.Mesh;
import projectelastic.domain.mesh.Node;
import projectelastic.domain.solution.IntegrationPointResult;
import projectelastic.domain.solution.NodalDisplacement;
import projectelastic.domain.solution.Solution;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Informe de diagnóstico en texto de un modelo y su solución.
 * <p>
 * Cada bloque se trunca a {@link SolverConfig#getReportRowLimit()} filas; el límite se
 * recibe en el constructor y no hay estado global de formato.
 */
@Slf4j
public class ModelReportPrinter {

    private final int rowLimit;

    public ModelReportPrinter(SolverConfig config) {
        this.rowLimit = Math.max(0, config.getReportRowLimit());
    }

    /**
     * Emite el informe del modelo por el log (nivel INFO).
     */
    public void printModel(Mesh mesh, Geometry geometry, Boundaries boundaries, Loads loads) {
        log.info("\n{}", renderModel(mesh, geometry, boundaries, loads));
    }

    public void printSolution(Solution solution) {
        log.info("\n{}", renderSolution(solution));
    }

    public String renderModel(Mesh mesh, Geometry geometry, Boundaries boundaries, Loads loads) {
        StringBuilder sb = new StringBuilder();
        block(sb, "NODOS", mesh.nodes(), ModelReportPrinter::formatNode);
        block(sb, "ELEMENTOS", mesh.elements(), ModelReportPrinter::formatElement);
        block(sb, "PUNTOS", geometry.points(), p -> format("%6d  x=%12.5g  y=%12.5g", p.id(), p.x(), p.y()));
        block(sb, "LINEAS", geometry.lines(), l -> format("%6d  %d -> %d", l.id(), l.startPointId(), l.endPointId()));
        block(sb, "APOYOS EN NODOS", boundaries.onNodes(), ModelReportPrinter::formatConstraint);
        block(sb, "APOYOS EN PUNTOS", boundaries.onPoints(), ModelReportPrinter::formatConstraint);
        block(sb, "APOYOS EN LINEAS", boundaries.onLines(), ModelReportPrinter::formatConstraint);
        block(sb, "CARGAS EN NODOS", loads.onNodes(), ModelReportPrinter::formatLoad);
        block(sb, "CARGAS EN PUNTOS", loads.onPoints(), ModelReportPrinter::formatLoad);
        block(sb, "CARGAS EN LINEAS", loads.onLines(), ModelReportPrinter::formatLoad);
        return sb.toString();
    }

    public String renderSolution(Solution solution) {
        StringBuilder sb = new StringBuilder();
        sb.append(format("GDL=%d  fijos=%d  tiempo=%.3f ms%n",
                solution.getDegreesOfFreedom(), solution.getFixedDofCount(), solution.getElapsedNanos() / 1e6));
        block(sb, "DESPLAZAMIENTOS", solution.getNodalDisplacements(), ModelReportPrinter::formatDisplacement);
        block(sb, "PUNTOS DE INTEGRACION", solution.getResults(), ModelReportPrinter::formatResult);
        if (solution.hasNotices()) {
            block(sb, "AVISOS", solution.getNotices(), n -> n.kind() + ": " + n.message());
        }
        return sb.toString();
    }

    private <T> void block(StringBuilder sb, String title, List<T> rows, Function<T, String> formatter) {
        sb.append("--- ").append(title).append(" (").append(rows.size()).append(") ---").append(System.lineSeparator());
        int shown = Math.min(rowLimit, rows.size());
        for (int i = 0; i < shown; i++) {
            sb.append(formatter.apply(rows.get(i))).append(System.lineSeparator());
        }
        if (rows.size() > shown) {
            sb.append("... ").append(rows.size() - shown).append(" filas más").append(System.lineSeparator());
        }
    }

    private static String formatNode(Node n) {
        return format("%6d  x=%12.5g  y=%12.5g", n.id(), n.x(), n.y());
    }

    private static String formatElement(Element e) {
        return format("%6d  %-5s nodos=%s  orden=%d  E=%.4g  nu=%.3f  t=%.4g  %s",
                e.id(), e.topology(), Arrays.toString(e.nodeIds()), e.integrationOrder(),
                e.section().youngsModulus(), e.section().poissonsRatio(), e.section().thickness(),
                e.section().planarAssumption());
    }

    private static String formatConstraint(DisplacementConstraint c) {
        return format("%6d  objetivo=%d  x=%s  y=%s", c.id(), c.targetId(), c.x(), c.y());
    }

    private static String formatLoad(Load l) {
        return format("%6d  objetivo=%d  fx=%12.5g  fy=%12.5g", l.id(), l.targetId(), l.fx(), l.fy());
    }

    private static String formatDisplacement(NodalDisplacement d) {
        return format("%6d  dx=%12.5e  dy=%12.5e  total=%12.5e", d.nodeId(), d.dx(), d.dy(), d.total());
    }

    private static String formatResult(IntegrationPointResult r) {
        return format("%6d  elem=%d  sx=%12.5e  sy=%12.5e  sxy=%12.5e  s1=%12.5e  s3=%12.5e  vm=%12.5e",
                r.point().id(), r.point().elementId(), r.stressX(), r.stressY(), r.stressXY(),
                r.principal1(), r.principal3(), r.vonMises());
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
