package projectelastic.domain.model;

import lombok.Builder;
import projectelastic.domain.boundary.Boundaries;
import projectelastic.domain.boundary.DisplacementConstraint;
import projectelastic.domain.geometry.Geometry;
import projectelastic.domain.geometry.Line;
import projectelastic.domain.geometry.Point;
import projectelastic.domain.load.Load;
import projectelastic.domain.load.Loads;
import projectelastic.domain.mesh.Element;
import projectelastic.domain.mesh.Mesh;
import projectelastic.domain.mesh.Node;

import java.util.List;

/**
 * Definición completa de un modelo en forma serializable (JSON).
 * <p>
 * Es una instantánea plana de las cuatro entradas del cálculo: mallado, geometría,
 * apoyos y cargas. Las listas nulas se tratan como vacías.
 */
@Builder
public record ModelDefinition(
        String name,
        List<Node> nodes,
        List<Element> elements,
        List<Point> points,
        List<Line> lines,
        List<DisplacementConstraint> boundariesOnNodes,
        List<DisplacementConstraint> boundariesOnPoints,
        List<DisplacementConstraint> boundariesOnLines,
        List<Load> loadsOnNodes,
        List<Load> loadsOnPoints,
        List<Load> loadsOnLines
) {
    public ModelDefinition {
        nodes = copyOrEmpty(nodes);
        elements = copyOrEmpty(elements);
        points = copyOrEmpty(points);
        lines = copyOrEmpty(lines);
        boundariesOnNodes = copyOrEmpty(boundariesOnNodes);
        boundariesOnPoints = copyOrEmpty(boundariesOnPoints);
        boundariesOnLines = copyOrEmpty(boundariesOnLines);
        loadsOnNodes = copyOrEmpty(loadsOnNodes);
        loadsOnPoints = copyOrEmpty(loadsOnPoints);
        loadsOnLines = copyOrEmpty(loadsOnLines);
    }

    /**
     * Captura el estado actual de las entradas de un cálculo.
     */
    public static ModelDefinition from(String name, Mesh mesh, Geometry geometry, Boundaries boundaries, Loads loads) {
        return ModelDefinition.builder()
                .name(name)
                .nodes(mesh.nodes())
                .elements(mesh.elements())
                .points(geometry.points())
                .lines(geometry.lines())
                .boundariesOnNodes(boundaries.onNodes())
                .boundariesOnPoints(boundaries.onPoints())
                .boundariesOnLines(boundaries.onLines())
                .loadsOnNodes(loads.onNodes())
                .loadsOnPoints(loads.onPoints())
                .loadsOnLines(loads.onLines())
                .build();
    }

    public Mesh toMesh() {
        return Mesh.of(nodes, elements);
    }

    public Geometry toGeometry() {
        Geometry geometry = new Geometry();
        points.forEach(p -> geometry.addPoint(p.id(), p.x(), p.y()));
        lines.forEach(l -> geometry.addLine(l.id(), l.startPointId(), l.endPointId()));
        return geometry;
    }

    public Boundaries toBoundaries() {
        return Boundaries.of(boundariesOnNodes, boundariesOnPoints, boundariesOnLines);
    }

    public Loads toLoads() {
        return Loads.of(loadsOnNodes, loadsOnPoints, loadsOnLines);
    }

    private static <T> List<T> copyOrEmpty(List<T> list) {
        return list == null ? List.of() : List.copyOf(list);
    }
}
