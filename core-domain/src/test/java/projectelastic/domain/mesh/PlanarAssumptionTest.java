package projectelastic.domain.mesh;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projectelastic.domain.exception.FemModelException;

import static org.junit.jupiter.api.Assertions.*;

class PlanarAssumptionTest {

    @Test
    @DisplayName("Parser tolerante: acepta las variantes habituales sin distinguir mayúsculas")
    void parse_shouldAcceptCommonSpellings() {
        assertEquals(PlanarAssumption.PLANE_STRESS, PlanarAssumption.parse("plane stress"));
        assertEquals(PlanarAssumption.PLANE_STRESS, PlanarAssumption.parse("PlaneStress"));
        assertEquals(PlanarAssumption.PLANE_STRESS, PlanarAssumption.parse("STRESS"));
        assertEquals(PlanarAssumption.PLANE_STRESS, PlanarAssumption.parse("PLANE_STRESS"));
        assertEquals(PlanarAssumption.PLANE_STRAIN, PlanarAssumption.parse("plane strain"));
        assertEquals(PlanarAssumption.PLANE_STRAIN, PlanarAssumption.parse("planestrain"));
        assertEquals(PlanarAssumption.PLANE_STRAIN, PlanarAssumption.parse(" strain "));
    }

    @Test
    @DisplayName("Hipótesis desconocida: error de validación")
    void parse_unknown_shouldThrow() {
        FemModelException ex = assertThrows(FemModelException.class, () -> PlanarAssumption.parse("axisymmetric"));
        assertEquals(FemModelException.ErrorType.VALIDATION, ex.getType());
    }
}
