package projectelastic.physics.element;

import org.ejml.data.DMatrixRMaj;

/**
 * Matriz deformación-desplazamiento B (3 x 2k) evaluada en un punto local,
 * junto con el determinante del jacobiano en ese punto.
 */
public record StrainDisplacement(DMatrixRMaj b, double detJ) {
}
