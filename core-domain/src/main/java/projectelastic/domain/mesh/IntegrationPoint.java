package projectelastic.domain.mesh;

/**
 * Punto de integración (Gauss) generado durante el postproceso.
 *
 * @param id        Identificador correlativo (1..M) en orden elemento / punto de Gauss.
 * @param elementId Elemento al que pertenece.
 * @param x         Coordenada X global.
 * @param y         Coordenada Y global.
 */
public record IntegrationPoint(int id, int elementId, double x, double y) {
}
