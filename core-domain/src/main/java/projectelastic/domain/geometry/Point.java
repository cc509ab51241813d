package projectelastic.domain.geometry;

/**
 * Punto geométrico de referencia, independiente del mallado.
 * Se usa para situar apoyos y cargas que después se resuelven al nodo más cercano.
 */
public record Point(int id, double x, double y) {

    public double distanceTo(Point other) {
        return Math.hypot(other.x - x, other.y - y);
    }
}
