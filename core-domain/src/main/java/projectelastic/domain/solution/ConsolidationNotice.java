package projectelastic.domain.solution;

/**
 * Aviso no fatal producido al resolver apoyos y cargas sobre el mallado.
 *
 * @param kind         Origen del aviso.
 * @param lineId       Línea geométrica afectada.
 * @param definitionId Id de la definición de apoyo o carga que se ha ignorado.
 * @param message      Descripción legible.
 */
public record ConsolidationNotice(Kind kind, int lineId, int definitionId, String message) {

    public enum Kind {
        /** Apoyo sobre una línea sin nodos del mallado. */
        EMPTY_LINE_BOUNDARY,
        /** Carga sobre una línea sin nodos del mallado. */
        EMPTY_LINE_LOAD
    }
}
