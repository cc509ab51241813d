package projectelastic.domain.mesh;

/**
 * Nodo del mallado: identificador único y coordenadas globales 2D.
 *
 * @param id Identificador del nodo (asignado por el llamador o autoincremental).
 * @param x  Coordenada X global.
 * @param y  Coordenada Y global.
 */
public record Node(int id, double x, double y) {

    /**
     * Distancia euclídea al cuadrado hasta un punto (evita la raíz en búsquedas de vecino más cercano).
     */
    public double squaredDistanceTo(double px, double py) {
        double dx = x - px;
        double dy = y - py;
        return dx * dx + dy * dy;
    }

    /**
     * Devuelve una copia del nodo desplazada (dx, dy), conservando el identificador.
     */
    public Node translated(double dx, double dy) {
        return new Node(id, x + dx, y + dy);
    }
}
