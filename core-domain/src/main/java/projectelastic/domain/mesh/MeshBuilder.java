package projectelastic.domain.mesh;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import projectelastic.domain.exception.FemModelException;

/**
 * Fase de construcción del mallado con contenedores ampliables (inserción amortizada O(1)).
 * <p>
 * Los identificadores pueden darse explícitamente o generarse como el máximo actual + 1
 * (empezando en 1). {@link #build()} congela el contenido en un {@link Mesh} inmutable.
 */
public class MeshBuilder {

    private final ObjectArrayList<Node> nodes = new ObjectArrayList<>();
    private final ObjectArrayList<Element> elements = new ObjectArrayList<>();
    private final IntOpenHashSet nodeIds = new IntOpenHashSet();
    private final IntOpenHashSet elementIds = new IntOpenHashSet();
    private int maxNodeId = 0;
    private int maxElementId = 0;

    MeshBuilder() {
    }

    /**
     * Añade un nodo con identificador autoincremental.
     *
     * @return El identificador asignado.
     */
    public int addNode(double x, double y) {
        return addNode(maxNodeId + 1, x, y);
    }

    /**
     * Añade un nodo con identificador explícito.
     *
     * @throws FemModelException si el identificador ya existe.
     */
    public int addNode(int id, double x, double y) {
        if (!nodeIds.add(id)) {
            throw FemModelException.validation("Identificador de nodo duplicado: " + id);
        }
        nodes.add(new Node(id, x, y));
        maxNodeId = Math.max(maxNodeId, id);
        return id;
    }

    /**
     * Añade un elemento con identificador autoincremental.
     *
     * @return El identificador asignado.
     */
    public int addElement(int[] nodeIds, int integrationOrder, SectionProperties section) {
        return addElement(maxElementId + 1, nodeIds, integrationOrder, section);
    }

    public int addElement(int id, int[] nodeIds, int integrationOrder, SectionProperties section) {
        return addElement(new Element(id, nodeIds, integrationOrder, section));
    }

    public int addElement(Element element) {
        if (!elementIds.add(element.id())) {
            throw FemModelException.validation("Identificador de elemento duplicado: " + element.id());
        }
        elements.add(element);
        maxElementId = Math.max(maxElementId, element.id());
        return element.id();
    }

    /**
     * Identificadores de nodo en orden de inserción (útil para generadores de mallado).
     */
    public IntArrayList nodeIds() {
        IntArrayList ids = new IntArrayList(nodes.size());
        for (Node node : nodes) {
            ids.add(node.id());
        }
        return ids;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int elementCount() {
        return elements.size();
    }

    /**
     * Congela el mallado. Valida que toda la conectividad apunte a nodos existentes.
     */
    public Mesh build() {
        return Mesh.of(nodes, elements);
    }
}
