package projectelastic.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Contenedor principal para todas las configuraciones de un cálculo estático.
 * Agrupa las tolerancias geométricas, el control numérico del sistema global
 * y los parámetros del informe de diagnóstico.
 */
@Value
@Builder
@With
public class SolverConfig {

    /**
     * Distancia máxima (en unidades del modelo) entre un nodo y una línea geométrica
     * para considerar que el nodo pertenece a la línea.
     */
    double lineTolerance;

    /**
     * Cociente mínimo admisible entre el menor y el mayor pivote de la factorización
     * de la matriz de rigidez reducida. Por debajo se considera singular.
     */
    double singularityTolerance;

    /**
     * Estrategia de factorización del sistema reducido.
     */
    LinearSolverType linearSolverType;

    /**
     * Si es true, una línea sin nodos del mallado aborta el cálculo.
     * Si es false, se registra un aviso en la solución y la definición se ignora.
     */
    boolean strictLineResolution;

    /**
     * Número máximo de filas que imprime el informe de diagnóstico por cada bloque.
     */
    int reportRowLimit;

    public static SolverConfig defaults() {
        return SolverConfig.builder()
                .lineTolerance(1e-9)
                .singularityTolerance(1e-12)
                .linearSolverType(LinearSolverType.AUTO)
                .strictLineResolution(false)
                .reportRowLimit(20)
                .build();
    }

    /**
     * Estrategias disponibles para resolver el sistema lineal reducido.
     */
    public enum LinearSolverType {
        /**
         * Cholesky si el sistema es simétrico (sin desplazamientos prescritos), LU en otro caso.
         */
        AUTO,
        LU,
        CHOLESKY
    }
}
