package projectelastic.domain.mesh;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import projectelastic.domain.exception.FemModelException;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Mallado inmutable: nodos y elementos con acceso O(1) por identificador.
 * <p>
 * Internamente los nodos y elementos se guardan en arrays densos; la posición de un nodo
 * en el array es su índice de grados de libertad (2·i para X, 2·i+1 para Y).
 * Se construye mediante {@link MeshBuilder} o {@link #of(Collection, Collection)}.
 */
public final class Mesh {

    private static final int NOT_FOUND = -1;

    private final Node[] nodes;
    private final Element[] elements;
    private final Int2IntOpenHashMap nodeIndexById;
    private final Int2IntOpenHashMap elementIndexById;

    private Mesh(Node[] nodes, Element[] elements) {
        this.nodes = nodes;
        this.elements = elements;
        this.nodeIndexById = buildIndex(nodes.length, i -> nodes[i].id(), "nodo");
        this.elementIndexById = buildIndex(elements.length, i -> elements[i].id(), "elemento");

        // Validación de conectividad: todos los nodos referenciados deben existir
        for (Element element : elements) {
            for (int nodeId : element.nodeIds()) {
                if (!nodeIndexById.containsKey(nodeId)) {
                    throw FemModelException.validation("El elemento " + element.id()
                            + " referencia el nodo " + nodeId + ", que no existe en el mallado.");
                }
            }
        }
    }

    public static Mesh of(Collection<Node> nodes, Collection<Element> elements) {
        Objects.requireNonNull(nodes, "La lista de nodos no puede ser nula.");
        Objects.requireNonNull(elements, "La lista de elementos no puede ser nula.");
        return new Mesh(nodes.toArray(new Node[0]), elements.toArray(new Element[0]));
    }

    public static MeshBuilder builder() {
        return new MeshBuilder();
    }

    private static Int2IntOpenHashMap buildIndex(int size, java.util.function.IntUnaryOperator idAt, String label) {
        Int2IntOpenHashMap index = new Int2IntOpenHashMap(size);
        index.defaultReturnValue(NOT_FOUND);
        for (int i = 0; i < size; i++) {
            int id = idAt.applyAsInt(i);
            if (index.put(id, i) != NOT_FOUND) {
                throw FemModelException.validation("Identificador de " + label + " duplicado: " + id);
            }
        }
        index.trim();
        return index;
    }

    public int numberOfNodes() {
        return nodes.length;
    }

    public int numberOfElements() {
        return elements.length;
    }

    /**
     * Número total de grados de libertad antes de aplicar apoyos (2 por nodo).
     */
    public int totalDof() {
        return 2 * nodes.length;
    }

    public boolean isEmpty() {
        return nodes.length == 0 || elements.length == 0;
    }

    public List<Node> nodes() {
        return Collections.unmodifiableList(Arrays.asList(nodes));
    }

    public List<Element> elements() {
        return Collections.unmodifiableList(Arrays.asList(elements));
    }

    public Node nodeAt(int index) {
        if (index < 0 || index >= nodes.length) {
            throw new IndexOutOfBoundsException("El índice de nodo " + index + " está fuera de los límites [0, " + (nodes.length - 1) + "].");
        }
        return nodes[index];
    }

    public boolean containsNode(int nodeId) {
        return nodeIndexById.containsKey(nodeId);
    }

    /**
     * Posición densa del nodo con el identificador dado.
     *
     * @throws FemModelException si el nodo no existe.
     */
    public int nodeIndex(int nodeId) {
        int index = nodeIndexById.get(nodeId);
        if (index == NOT_FOUND) {
            throw FemModelException.validation("El nodo " + nodeId + " no existe en el mallado.");
        }
        return index;
    }

    public Node node(int nodeId) {
        return nodes[nodeIndex(nodeId)];
    }

    public int elementIndex(int elementId) {
        int index = elementIndexById.get(elementId);
        if (index == NOT_FOUND) {
            throw FemModelException.validation("El elemento " + elementId + " no existe en el mallado.");
        }
        return index;
    }

    public Element element(int elementId) {
        return elements[elementIndex(elementId)];
    }

    /**
     * Índices densos de los nodos del elemento, en el orden de su conectividad.
     */
    public int[] elementNodeIndices(Element element) {
        int[] nodeIds = element.nodeIds();
        int[] indices = new int[nodeIds.length];
        for (int i = 0; i < nodeIds.length; i++) {
            indices[i] = nodeIndexById.get(nodeIds[i]);
        }
        return indices;
    }

    /**
     * Coordenadas de los nodos del elemento como matriz k x 2 ([i][0] = x, [i][1] = y).
     */
    public double[][] elementCoordinates(Element element) {
        int[] indices = elementNodeIndices(element);
        double[][] coords = new double[indices.length][2];
        for (int i = 0; i < indices.length; i++) {
            coords[i][0] = nodes[indices[i]].x();
            coords[i][1] = nodes[indices[i]].y();
        }
        return coords;
    }

    /**
     * Crea el mallado deformado: mismos identificadores y conectividad, coordenadas
     * desplazadas nodo a nodo.
     *
     * @param dispX Desplazamiento X por índice denso de nodo.
     * @param dispY Desplazamiento Y por índice denso de nodo.
     */
    public Mesh withDisplacedNodes(double[] dispX, double[] dispY) {
        if (dispX.length != nodes.length || dispY.length != nodes.length) {
            throw FemModelException.validation("Los desplazamientos (" + dispX.length + ", " + dispY.length
                    + ") no coinciden con el número de nodos (" + nodes.length + ").");
        }
        Node[] moved = new Node[nodes.length];
        for (int i = 0; i < nodes.length; i++) {
            moved[i] = nodes[i].translated(dispX[i], dispY[i]);
        }
        return new Mesh(moved, elements.clone());
    }
}
