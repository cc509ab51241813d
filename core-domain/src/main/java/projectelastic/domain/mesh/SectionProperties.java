package projectelastic.domain.mesh;

import lombok.Builder;
import lombok.With;

import java.util.Objects;

/**
 * Propiedades de material y sección de un elemento plano.
 *
 * @param youngsModulus    Módulo de Young (E).
 * @param poissonsRatio    Coeficiente de Poisson (ν).
 * @param thickness        Espesor del elemento (t).
 * @param planarAssumption Hipótesis plana (tensión o deformación plana).
 */
@Builder
@With
public record SectionProperties(
        double youngsModulus,
        double poissonsRatio,
        double thickness,
        PlanarAssumption planarAssumption
) {
    public SectionProperties {
        Objects.requireNonNull(planarAssumption, "La hipótesis plana no puede ser nula.");
    }

    /**
     * Atajo para material homogéneo en tensión plana.
     */
    public static SectionProperties planeStress(double youngsModulus, double poissonsRatio, double thickness) {
        return new SectionProperties(youngsModulus, poissonsRatio, thickness, PlanarAssumption.PLANE_STRESS);
    }

    public static SectionProperties planeStrain(double youngsModulus, double poissonsRatio, double thickness) {
        return new SectionProperties(youngsModulus, poissonsRatio, thickness, PlanarAssumption.PLANE_STRAIN);
    }
}
