package projectelastic.domain.solution;

import lombok.Builder;
import lombok.Value;
import projectelastic.domain.mesh.Element;
import projectelastic.domain.mesh.IntegrationPoint;
import projectelastic.domain.mesh.Mesh;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resultado inmutable de un cálculo estático lineal.
 * <p>
 * CONTENIDO:
 * - Desplazamientos nodales (en el orden denso del mallado).
 * - Deformaciones y tensiones en cada punto de Gauss (orden elemento a elemento).
 * - Mallado deformado y puntos de integración sobre ambos mallados.
 * <p>
 * Es la única salida que consumen los módulos de exportación y representación.
 */
@Value
@Builder
public class Solution {

    /**
     * Mallado original sobre el que se ha calculado.
     */
    Mesh mesh;

    /**
     * Mallado con las coordenadas desplazadas (original + desplazamiento).
     */
    Mesh deformedMesh;

    List<NodalDisplacement> nodalDisplacements;

    /**
     * Puntos de Gauss en coordenadas del mallado original, ids 1..M.
     */
    List<IntegrationPoint> integrationPoints;

    /**
     * Los mismos puntos de Gauss evaluados sobre el mallado deformado.
     */
    List<IntegrationPoint> deformedIntegrationPoints;

    /**
     * Resultados por punto de Gauss, alineados con {@link #integrationPoints}.
     */
    List<IntegrationPointResult> results;

    /**
     * Vector global de desplazamientos (2N), intercalando X e Y por nodo.
     */
    double[] displacementVector;

    /**
     * Grados de libertad del sistema reducido: 2N menos los ejes fijos.
     */
    int degreesOfFreedom;

    int fixedDofCount;

    /**
     * Avisos no fatales de la resolución de apoyos y cargas.
     */
    @Builder.Default
    List<ConsolidationNotice> notices = Collections.emptyList();

    /**
     * Tiempo de cálculo.
     */
    long elapsedNanos;

    public double[] getDisplacementVector() {
        return displacementVector.clone();
    }

    public NodalDisplacement getNodalDisplacement(int nodeId) {
        return nodalDisplacements.get(mesh.nodeIndex(nodeId));
    }

    public boolean hasNotices() {
        return !notices.isEmpty();
    }

    /**
     * Valores de una variable: por nodo (orden denso) si es de desplazamiento,
     * por punto de integración en otro caso.
     */
    public double[] values(ResultVariable variable) {
        if (variable.isNodal()) {
            double[] values = new double[nodalDisplacements.size()];
            for (int i = 0; i < values.length; i++) {
                values[i] = nodalValue(nodalDisplacements.get(i), variable);
            }
            return values;
        }
        double[] values = new double[results.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = results.get(i).value(variable);
        }
        return values;
    }

    /**
     * Media por elemento de una variable: sobre los nodos del elemento para desplazamientos
     * o sobre sus puntos de Gauss para el resto. Mapa id de elemento → media, en orden de mallado.
     */
    public Map<Integer, Double> elementAverages(ResultVariable variable) {
        Map<Integer, Double> averages = new LinkedHashMap<>();
        if (variable.isNodal()) {
            for (Element element : mesh.elements()) {
                int[] indices = mesh.elementNodeIndices(element);
                double sum = 0.0;
                for (int index : indices) {
                    sum += nodalValue(nodalDisplacements.get(index), variable);
                }
                averages.put(element.id(), sum / indices.length);
            }
            return averages;
        }

        Map<Integer, double[]> accumulators = new LinkedHashMap<>();
        for (IntegrationPointResult result : results) {
            double[] acc = accumulators.computeIfAbsent(result.point().elementId(), k -> new double[2]);
            acc[0] += result.value(variable);
            acc[1] += 1.0;
        }
        accumulators.forEach((elementId, acc) -> averages.put(elementId, acc[0] / acc[1]));
        return averages;
    }

    private static double nodalValue(NodalDisplacement displacement, ResultVariable variable) {
        return switch (variable) {
            case DISPLACEMENT_X -> displacement.dx();
            case DISPLACEMENT_Y -> displacement.dy();
            case DISPLACEMENT_TOTAL -> displacement.total();
            default -> throw new IllegalArgumentException("La variable " + variable + " no es nodal.");
        };
    }
}
