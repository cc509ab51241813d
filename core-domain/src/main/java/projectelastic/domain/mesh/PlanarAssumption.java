package projectelastic.domain.mesh;

import com.fasterxml.jackson.annotation.JsonCreator;
import projectelastic.domain.exception.FemModelException;

import java.util.Locale;

/**
 * Hipótesis de comportamiento plano del material.
 */
public enum PlanarAssumption {

    /** Tensión fuera del plano nula (chapas delgadas). */
    PLANE_STRESS,
    /** Deformación fuera del plano nula (secciones largas, muros, presas). */
    PLANE_STRAIN;

    /**
     * Interpreta la hipótesis a partir de un texto libre.
     * Acepta "plane stress", "planestress", "stress", "plane_stress" y sus equivalentes
     * para deformación plana, sin distinguir mayúsculas.
     *
     * @throws FemModelException si el texto no corresponde a ninguna hipótesis.
     */
    @JsonCreator
    public static PlanarAssumption parse(String text) {
        if (text == null) {
            throw FemModelException.validation("La hipótesis plana no puede ser nula.");
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT).replace("_", "").replace(" ", "");
        switch (normalized) {
            case "planestress":
            case "stress":
                return PLANE_STRESS;
            case "planestrain":
            case "strain":
                return PLANE_STRAIN;
            default:
                throw FemModelException.validation(
                        "Hipótesis plana '" + text + "' no definida (usar 'plane stress' o 'plane strain').");
        }
    }
}
