package projectelastic.domain.mesh;

import lombok.Builder;
import projectelastic.domain.exception.FemModelException;

import java.util.Arrays;
import java.util.Objects;

/**
 * Elemento finito plano isoparamétrico.
 * <p>
 * Como es un objeto de valor, dos instancias se consideran iguales si todos sus
 * atributos (incluida la lista de nodos) son iguales.
 *
 * @param id               Identificador único del elemento.
 * @param nodeIds          Identificadores de nodo en el orden del convenio de {@link ElementTopology}.
 * @param integrationOrder Número de puntos de Gauss (triángulos: 1, 3, 4, 7; cuadriláteros: 1, 4, 9).
 * @param section          Material, espesor e hipótesis plana.
 */
@Builder
public record Element(
        int id,
        int[] nodeIds,
        int integrationOrder,
        SectionProperties section
) {
    /**
     * Constructor canónico: valida topología, orden de integración y nodos repetidos,
     * y crea una copia defensiva de la conectividad.
     */
    public Element {
        Objects.requireNonNull(nodeIds, "La conectividad del elemento no puede ser nula.");
        Objects.requireNonNull(section, "Las propiedades de sección no pueden ser nulas.");

        ElementTopology topology = ElementTopology.fromNodeCount(nodeIds.length);
        if (!topology.supportsIntegrationOrder(integrationOrder)) {
            throw FemModelException.unsupported("Orden de integración " + integrationOrder + " no implementado para "
                    + topology + " (soportados: " + topology.supportedIntegrationOrders() + ").");
        }
        if (Arrays.stream(nodeIds).distinct().count() != nodeIds.length) {
            throw FemModelException.validation("El elemento " + id + " repite nodos: " + Arrays.toString(nodeIds));
        }
        nodeIds = nodeIds.clone();
    }

    public ElementTopology topology() {
        return ElementTopology.fromNodeCount(nodeIds.length);
    }

    public int nodeCount() {
        return nodeIds.length;
    }

    /**
     * Devuelve una copia de la conectividad para que el estado interno no pueda modificarse.
     */
    @Override
    public int[] nodeIds() {
        return nodeIds.clone();
    }

    // Métodos equals y hashCode estándar para records con arrays.
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Element that = (Element) o;
        return id == that.id
                && integrationOrder == that.integrationOrder
                && Arrays.equals(nodeIds, that.nodeIds)
                && section.equals(that.section);
    }

    @Override
    public int hashCode() {
        int result = Integer.hashCode(id);
        result = 31 * result + Arrays.hashCode(nodeIds);
        result = 31 * result + Integer.hashCode(integrationOrder);
        result = 31 * result + section.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return "Element[id=" + id + ", nodeIds=" + Arrays.toString(nodeIds)
                + ", integrationOrder=" + integrationOrder + ", section=" + section + "]";
    }
}
