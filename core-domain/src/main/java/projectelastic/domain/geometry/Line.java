package projectelastic.domain.geometry;

/**
 * Segmento recto entre dos puntos geométricos, identificados por su id.
 */
public record Line(int id, int startPointId, int endPointId) {
}
