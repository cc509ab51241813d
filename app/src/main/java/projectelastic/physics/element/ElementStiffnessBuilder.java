package projectelastic.physics.element;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import projectelastic.domain.exception.FemModelException;
import projectelastic.domain.mesh.Element;
import projectelastic.domain.mesh.ElementTopology;
import projectelastic.domain.mesh.SectionProperties;

/**
 * Constructor de matrices elementales para elasticidad plana lineal.
 * <p>
 * MÉTODO:
 * <ol>
 * <li>Matriz constitutiva D (3x3) según la hipótesis plana.</li>
 * <li>En cada punto de Gauss: jacobiano J, su inversa y B = B1 · B2 · B3, donde
 *     B1 selecciona las componentes de deformación, B2 = diag(J⁻ᵀ, J⁻ᵀ) y B3 contiene
 *     las derivadas locales de las funciones de forma.</li>
 * <li>Ke = t · Σ w · Bᵀ · D · B · det(J).</li>
 * </ol>
 * Sin estado: todos los métodos son puros.
 */
public final class ElementStiffnessBuilder {

    /**
     * Selector de deformaciones: [εx, εy, γxy] a partir de [∂u/∂x, ∂u/∂y, ∂v/∂x, ∂v/∂y].
     */
    private static final double[][] STRAIN_SELECTOR = {
            {1, 0, 0, 0},
            {0, 0, 0, 1},
            {0, 1, 1, 0}
    };

    private ElementStiffnessBuilder() {
    }

    /**
     * Matriz constitutiva D.
     * <ul>
     * <li>Tensión plana: E/(1−ν²) · [[1, ν, 0], [ν, 1, 0], [0, 0, (1−ν)/2]]</li>
     * <li>Deformación plana: E/((1+ν)(1−2ν)) · [[1−ν, ν, 0], [ν, 1−ν, 0], [0, 0, 0.5−ν]]</li>
     * </ul>
     */
    public static DMatrixRMaj materialMatrix(SectionProperties section) {
        double e = section.youngsModulus();
        double nu = section.poissonsRatio();

        return switch (section.planarAssumption()) {
            case PLANE_STRESS -> {
                double factor = e / (1.0 - nu * nu);
                DMatrixRMaj d = new DMatrixRMaj(new double[][]{
                        {1.0, nu, 0.0},
                        {nu, 1.0, 0.0},
                        {0.0, 0.0, (1.0 - nu) / 2.0}
                });
                CommonOps_DDRM.scale(factor, d);
                yield d;
            }
            case PLANE_STRAIN -> {
                double factor = e / ((1.0 + nu) * (1.0 - 2.0 * nu));
                DMatrixRMaj d = new DMatrixRMaj(new double[][]{
                        {1.0 - nu, nu, 0.0},
                        {nu, 1.0 - nu, 0.0},
                        {0.0, 0.0, 0.5 - nu}
                });
                CommonOps_DDRM.scale(factor, d);
                yield d;
            }
        };
    }

    /**
     * Evalúa B y det(J) en el punto local (ξ, η).
     *
     * @param element Elemento (para la topología y los mensajes de error).
     * @param coords  Coordenadas nodales k x 2 en el orden de la conectividad.
     * @throws FemModelException (VALIDATION) si det(J) ≤ 0: elemento degenerado o invertido.
     */
    public static StrainDisplacement strainDisplacement(Element element, double[][] coords, double xi, double eta) {
        ElementTopology topology = element.topology();
        int k = topology.nodeCount();
        double[][] dN = ShapeFunctions.derivatives(topology, xi, eta);

        // 1. Jacobiano J = [[dX/dξ, dX/dη], [dY/dξ, dY/dη]]
        double dxDxi = 0.0;
        double dxDeta = 0.0;
        double dyDxi = 0.0;
        double dyDeta = 0.0;
        for (int i = 0; i < k; i++) {
            dxDxi += dN[0][i] * coords[i][0];
            dxDeta += dN[1][i] * coords[i][0];
            dyDxi += dN[0][i] * coords[i][1];
            dyDeta += dN[1][i] * coords[i][1];
        }
        double detJ = dxDxi * dyDeta - dxDeta * dyDxi;
        if (!(detJ > 0.0)) {
            throw FemModelException.validation("El elemento " + element.id()
                    + " tiene un jacobiano no positivo (det J = " + detJ + ") en (ξ=" + xi + ", η=" + eta
                    + "): elemento degenerado o con numeración horaria.");
        }

        // 2. J⁻ᵀ en bloque diagonal (4x4)
        DMatrixRMaj jacobian = new DMatrixRMaj(new double[][]{
                {dxDxi, dxDeta},
                {dyDxi, dyDeta}
        });
        DMatrixRMaj inverse = new DMatrixRMaj(2, 2);
        CommonOps_DDRM.invert(jacobian, inverse);
        DMatrixRMaj inverseTransposed = CommonOps_DDRM.transpose(inverse, null);

        DMatrixRMaj b2 = new DMatrixRMaj(4, 4);
        CommonOps_DDRM.insert(inverseTransposed, b2, 0, 0);
        CommonOps_DDRM.insert(inverseTransposed, b2, 2, 2);

        // 3. Derivadas locales dispuestas por grado de libertad (4 x 2k)
        DMatrixRMaj b3 = new DMatrixRMaj(4, 2 * k);
        for (int i = 0; i < k; i++) {
            b3.set(0, 2 * i, dN[0][i]);
            b3.set(1, 2 * i, dN[1][i]);
            b3.set(2, 2 * i + 1, dN[0][i]);
            b3.set(3, 2 * i + 1, dN[1][i]);
        }

        // 4. B = B1 · B2 · B3
        DMatrixRMaj b1b2 = new DMatrixRMaj(3, 4);
        CommonOps_DDRM.mult(new DMatrixRMaj(STRAIN_SELECTOR), b2, b1b2);
        DMatrixRMaj b = new DMatrixRMaj(3, 2 * k);
        CommonOps_DDRM.mult(b1b2, b3, b);

        return new StrainDisplacement(b, detJ);
    }

    /**
     * Matriz de rigidez elemental (2k x 2k) con la regla de Gauss del propio elemento.
     *
     * @param element Elemento con material, espesor y orden de integración.
     * @param coords  Coordenadas nodales k x 2 en el orden de la conectividad.
     */
    public static DMatrixRMaj stiffness(Element element, double[][] coords) {
        ElementTopology topology = element.topology();
        int size = 2 * topology.nodeCount();
        QuadratureRule rule = GaussQuadrature.rule(topology, element.integrationOrder());
        DMatrixRMaj d = materialMatrix(element.section());
        double thickness = element.section().thickness();

        DMatrixRMaj ke = new DMatrixRMaj(size, size);
        DMatrixRMaj btd = new DMatrixRMaj(size, 3);
        DMatrixRMaj btdb = new DMatrixRMaj(size, size);

        for (int g = 0; g < rule.size(); g++) {
            StrainDisplacement sd = strainDisplacement(element, coords, rule.xi(g), rule.eta(g));
            CommonOps_DDRM.multTransA(sd.b(), d, btd);
            CommonOps_DDRM.mult(btd, sd.b(), btdb);
            CommonOps_DDRM.addEquals(ke, thickness * rule.weight(g) * sd.detJ(), btdb);
        }
        return ke;
    }
}
