package projectelastic.domain.load;

/**
 * Fuerza aplicada sobre un nodo, un punto o una línea.
 * En líneas, (fx, fy) es una carga por unidad de longitud.
 */
public record Load(int id, int targetId, double fx, double fy) {
}
