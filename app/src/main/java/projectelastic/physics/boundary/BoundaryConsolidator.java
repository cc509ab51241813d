package projectelastic.physics.boundary;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import lombok.extern.slf4j.Slf4j;
import projectelastic.config.SolverConfig;
import projectelastic.domain.boundary.AxisConstraint;
import projectelastic.domain.boundary.Boundaries;
import projectelastic.domain.boundary.DisplacementConstraint;
import projectelastic.domain.exception.FemModelException;
import projectelastic.domain.geometry.Geometry;
import projectelastic.domain.geometry.Line;
import projectelastic.domain.geometry.Point;
import projectelastic.domain.load.Load;
import projectelastic.domain.load.Loads;
import projectelastic.domain.mesh.Element;
import projectelastic.domain.mesh.ElementTopology;
import projectelastic.domain.mesh.Mesh;
import projectelastic.domain.mesh.Node;
import projectelastic.domain.solution.ConsolidationNotice;
import projectelastic.physics.element.ShapeFunctions;

import java.util.ArrayList;
import java.util.List;

/**
 * Reduce todos los apoyos y cargas (sobre nodos, puntos o líneas) a una tabla por nodo.
 * <p>
 * REGLAS:
 * <ul>
 * <li>Punto → nodo más cercano.</li>
 * <li>Línea → todos los nodos sobre el segmento (tolerancia {@link SolverConfig#getLineTolerance()}).</li>
 * <li>Varios apoyos en un mismo eje: {@link AxisConstraint#merge(List)} en el orden nodos, puntos, líneas.</li>
 * <li>Varias cargas en un mismo nodo: suma por componentes.</li>
 * <li>Carga lineal: reparto por arista de elemento con coeficientes de las funciones de forma
 *     (½, ½ o ⅙, ⅙, ⅔) multiplicados por la longitud de la arista.</li>
 * </ul>
 * Una línea sin nodos produce un aviso en la solución, o un error si
 * {@link SolverConfig#isStrictLineResolution()} está activo.
 */
@Slf4j
public class BoundaryConsolidator {

    private final SolverConfig config;

    public BoundaryConsolidator(SolverConfig config) {
        this.config = config;
    }

    public NodalBoundaryTable consolidate(Mesh mesh, Geometry geometry, Boundaries boundaries, Loads loads) {
        int dofCount = mesh.totalDof();
        List<ConsolidationNotice> notices = new ArrayList<>();

        AxisConstraint[] constraints = resolveConstraints(mesh, geometry, boundaries, notices, dofCount);
        double[] nodalLoads = resolveLoads(mesh, geometry, loads, notices, dofCount);

        NodalBoundaryTable table = new NodalBoundaryTable(constraints, nodalLoads, notices);
        log.debug("Consolidación completada: {} GDL fijos, {} prescritos, {} avisos.",
                table.fixedDofCount(), table.prescribedDofCount(), notices.size());
        return table;
    }

    // --- APOYOS ---

    private AxisConstraint[] resolveConstraints(Mesh mesh, Geometry geometry, Boundaries boundaries,
                                                List<ConsolidationNotice> notices, int dofCount) {
        List<ObjectArrayList<AxisConstraint>> pending = new ArrayList<>(dofCount);
        for (int i = 0; i < dofCount; i++) {
            pending.add(null);
        }

        for (DisplacementConstraint c : boundaries.onNodes()) {
            addConstraint(pending, mesh.nodeIndex(c.targetId()), c);
        }

        for (DisplacementConstraint c : boundaries.onPoints()) {
            Point point = geometry.point(c.targetId());
            addConstraint(pending, NodeLocator.nearestNode(mesh, point.x(), point.y()), c);
        }

        for (DisplacementConstraint c : boundaries.onLines()) {
            IntArrayList nodes = nodesOnLine(mesh, geometry, c.targetId());
            if (nodes.isEmpty()) {
                reportEmptyLine(notices, ConsolidationNotice.Kind.EMPTY_LINE_BOUNDARY, c.targetId(), c.id());
                continue;
            }
            for (int i = 0; i < nodes.size(); i++) {
                addConstraint(pending, nodes.getInt(i), c);
            }
        }

        AxisConstraint[] resolved = new AxisConstraint[dofCount];
        for (int dof = 0; dof < dofCount; dof++) {
            ObjectArrayList<AxisConstraint> definitions = pending.get(dof);
            if (definitions == null) {
                resolved[dof] = AxisConstraint.FREE;
                continue;
            }
            if (definitions.size() > 1) {
                log.warn("Varios apoyos definidos sobre el nodo {} (eje {}): {}. Se aplica la regla de prioridad.",
                        mesh.nodeAt(dof / 2).id(), dof % 2 == 0 ? "X" : "Y", definitions);
            }
            resolved[dof] = AxisConstraint.merge(definitions);
        }
        return resolved;
    }

    private static void addConstraint(List<ObjectArrayList<AxisConstraint>> pending, int nodeIndex, DisplacementConstraint c) {
        append(pending, 2 * nodeIndex, c.x());
        append(pending, 2 * nodeIndex + 1, c.y());
    }

    private static void append(List<ObjectArrayList<AxisConstraint>> pending, int dof, AxisConstraint value) {
        ObjectArrayList<AxisConstraint> list = pending.get(dof);
        if (list == null) {
            list = new ObjectArrayList<>(2);
            pending.set(dof, list);
        }
        list.add(value);
    }

    // --- CARGAS ---

    private double[] resolveLoads(Mesh mesh, Geometry geometry, Loads loads,
                                  List<ConsolidationNotice> notices, int dofCount) {
        double[] nodal = new double[dofCount];

        for (Load load : loads.onNodes()) {
            addForce(nodal, mesh.nodeIndex(load.targetId()), load.fx(), load.fy());
        }

        for (Load load : loads.onPoints()) {
            Point point = geometry.point(load.targetId());
            addForce(nodal, NodeLocator.nearestNode(mesh, point.x(), point.y()), load.fx(), load.fy());
        }

        for (Load load : loads.onLines()) {
            IntArrayList nodes = nodesOnLine(mesh, geometry, load.targetId());
            if (nodes.isEmpty()) {
                reportEmptyLine(notices, ConsolidationNotice.Kind.EMPTY_LINE_LOAD, load.targetId(), load.id());
                continue;
            }
            distributeLineLoad(mesh, new IntOpenHashSet(nodes), load, nodal);
        }
        return nodal;
    }

    /**
     * Reparte una carga por unidad de longitud sobre las aristas de los elementos que
     * caen en la línea. Los nodos de cada arista se recorren en el orden de la
     * conectividad del elemento, de modo que los vértices preceden al nodo intermedio.
     */
    private void distributeLineLoad(Mesh mesh, IntOpenHashSet nodesOnLine, Load load, double[] nodal) {
        for (Element element : mesh.elements()) {
            int[] elementNodes = mesh.elementNodeIndices(element);
            IntArrayList onLine = new IntArrayList(3);
            for (int index : elementNodes) {
                if (nodesOnLine.contains(index)) {
                    onLine.add(index);
                }
            }
            if (onLine.size() < 2) {
                continue;
            }

            ElementTopology topology = element.topology();
            checkEdgeNodeCount(topology, onLine.size(), element.id(), load.targetId());

            Node first = mesh.nodeAt(onLine.getInt(0));
            Node second = mesh.nodeAt(onLine.getInt(1));
            double edgeLength = Math.sqrt(first.squaredDistanceTo(second.x(), second.y()));

            double[] coefficients = ShapeFunctions.lineLoadCoefficients(topology);
            for (int i = 0; i < coefficients.length; i++) {
                double factor = coefficients[i] * edgeLength;
                addForce(nodal, onLine.getInt(i), factor * load.fx(), factor * load.fy());
            }
        }
    }

    private static void checkEdgeNodeCount(ElementTopology topology, int count, int elementId, int lineId) {
        int expected = topology.edgeNodeCount();
        if (count == expected) {
            return;
        }
        if (topology.isQuadratic() && count == 2) {
            throw FemModelException.validation("La carga sobre la línea " + lineId
                    + " no termina en vértices del elemento cuadrático " + elementId + ".");
        }
        throw FemModelException.validation("El elemento " + topology + " " + elementId + " tiene " + count
                + " nodos sobre la línea " + lineId + " (se esperaban " + expected + ").");
    }

    private static void addForce(double[] nodal, int nodeIndex, double fx, double fy) {
        nodal[2 * nodeIndex] += fx;
        nodal[2 * nodeIndex + 1] += fy;
    }

    // --- LÍNEAS ---

    private IntArrayList nodesOnLine(Mesh mesh, Geometry geometry, int lineId) {
        Line line = geometry.line(lineId);
        Point start = geometry.point(line.startPointId());
        Point end = geometry.point(line.endPointId());
        return NodeLocator.nodesOnSegment(mesh, start.x(), start.y(), end.x(), end.y(), config.getLineTolerance());
    }

    private void reportEmptyLine(List<ConsolidationNotice> notices, ConsolidationNotice.Kind kind, int lineId, int definitionId) {
        String what = kind == ConsolidationNotice.Kind.EMPTY_LINE_LOAD ? "carga" : "apoyo";
        String message = "No se han encontrado nodos sobre la línea " + lineId
                + "; se ignora la definición de " + what + " " + definitionId + ".";
        if (config.isStrictLineResolution()) {
            throw FemModelException.validation(message);
        }
        log.warn(message);
        notices.add(new ConsolidationNotice(kind, lineId, definitionId, message));
    }
}
