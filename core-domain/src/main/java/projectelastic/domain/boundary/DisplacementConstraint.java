package projectelastic.domain.boundary;

import java.util.Objects;

/**
 * Apoyo tal y como lo introduce el usuario, antes de resolverlo a nodos.
 *
 * @param id       Identificador dentro de su lista (nodos, puntos o líneas).
 * @param targetId Id del nodo, punto o línea sobre el que actúa.
 * @param x        Estado del eje X.
 * @param y        Estado del eje Y.
 */
public record DisplacementConstraint(int id, int targetId, AxisConstraint x, AxisConstraint y) {

    public DisplacementConstraint {
        Objects.requireNonNull(x, "La restricción X no puede ser nula.");
        Objects.requireNonNull(y, "La restricción Y no puede ser nula.");
    }
}
