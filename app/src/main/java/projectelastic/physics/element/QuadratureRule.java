package projectelastic.physics.element;

/**
 * Conjunto fijo de puntos de Gauss (ξ, η) y pesos.
 */
public record QuadratureRule(double[] xi, double[] eta, double[] weights) {

    public QuadratureRule {
        if (xi.length != eta.length || xi.length != weights.length) {
            throw new IllegalArgumentException("Los arrays de la regla de cuadratura deben tener la misma longitud ("
                    + xi.length + ", " + eta.length + ", " + weights.length + ").");
        }
        xi = xi.clone();
        eta = eta.clone();
        weights = weights.clone();
    }

    public int size() {
        return weights.length;
    }

    @Override
    public double[] xi() {
        return xi.clone();
    }

    @Override
    public double[] eta() {
        return eta.clone();
    }

    @Override
    public double[] weights() {
        return weights.clone();
    }

    public double xi(int i) {
        return xi[i];
    }

    public double eta(int i) {
        return eta[i];
    }

    public double weight(int i) {
        return weights[i];
    }

    public double weightSum() {
        double sum = 0.0;
        for (double w : weights) {
            sum += w;
        }
        return sum;
    }
}
