package projectelastic.domain.boundary;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import projectelastic.domain.exception.FemModelException;
import projectelastic.domain.exception.FemModelException.ErrorType;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Estado de un eje (X o Y) de un nodo respecto a desplazamientos impuestos.
 * <p>
 * Variante etiquetada con tres casos:
 * <ul>
 * <li>{@link Kind#FREE}: grado de libertad incógnita.</li>
 * <li>{@link Kind#FIXED}: desplazamiento nulo; el grado de libertad se elimina del sistema.</li>
 * <li>{@link Kind#PRESCRIBED}: desplazamiento impuesto no nulo.</li>
 * </ul>
 * Un valor prescrito igual a 0 se normaliza a {@link #FIXED}.
 * En JSON se representa como la cadena {@code "free"} o como un número.
 */
public record AxisConstraint(Kind kind, double value) {

    public static final AxisConstraint FREE = new AxisConstraint(Kind.FREE, 0.0);
    public static final AxisConstraint FIXED = new AxisConstraint(Kind.FIXED, 0.0);

    private static final String FREE_TOKEN = "free";

    public enum Kind {
        FREE,
        FIXED,
        PRESCRIBED
    }

    public AxisConstraint {
        Objects.requireNonNull(kind, "El tipo de restricción no puede ser nulo.");
        if (!Double.isFinite(value)) {
            throw FemModelException.validation("El desplazamiento impuesto debe ser finito: " + value);
        }
        if (kind == Kind.PRESCRIBED && value == 0.0) {
            throw FemModelException.validation("Un desplazamiento prescrito nulo debe declararse como FIXED.");
        }
        if (kind != Kind.PRESCRIBED && value != 0.0) {
            throw FemModelException.validation("Solo los ejes prescritos llevan valor (" + kind + ", " + value + ").");
        }
    }

    public static AxisConstraint free() {
        return FREE;
    }

    public static AxisConstraint fixed() {
        return FIXED;
    }

    /**
     * Desplazamiento impuesto. {@code prescribed(0.0)} devuelve {@link #FIXED}.
     */
    public static AxisConstraint prescribed(double value) {
        return value == 0.0 ? FIXED : new AxisConstraint(Kind.PRESCRIBED, value);
    }

    public boolean isFree() {
        return kind == Kind.FREE;
    }

    public boolean isFixed() {
        return kind == Kind.FIXED;
    }

    public boolean isPrescribed() {
        return kind == Kind.PRESCRIBED;
    }

    /**
     * Resuelve varias definiciones sobre el mismo eje de un mismo nodo:
     * si alguna es FIXED el resultado es FIXED; si no, la primera PRESCRIBED; si no, FREE.
     *
     * @param definitions Definiciones en el orden en que fueron introducidas.
     */
    public static AxisConstraint merge(List<AxisConstraint> definitions) {
        AxisConstraint firstPrescribed = null;
        for (AxisConstraint definition : definitions) {
            if (definition.isFixed()) {
                return FIXED;
            }
            if (definition.isPrescribed() && firstPrescribed == null) {
                firstPrescribed = definition;
            }
        }
        return firstPrescribed != null ? firstPrescribed : FREE;
    }

    @JsonValue
    public Object toToken() {
        return switch (kind) {
            case FREE -> FREE_TOKEN;
            case FIXED -> 0.0;
            case PRESCRIBED -> value;
        };
    }

    /**
     * Interpreta el formato de texto/JSON: {@code "free"} o un número (0 = fijo).
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static AxisConstraint fromToken(Object token) {
        if (token instanceof Number number) {
            return prescribed(number.doubleValue());
        }
        if (token instanceof String text) {
            String normalized = text.trim().toLowerCase(Locale.ROOT);
            if (FREE_TOKEN.equals(normalized)) {
                return FREE;
            }
            try {
                return prescribed(Double.parseDouble(normalized));
            } catch (NumberFormatException e) {
                throw new FemModelException(ErrorType.VALIDATION,
                        "Restricción de eje no reconocida: '" + text + "' (usar 'free' o un número).", e);
            }
        }
        throw FemModelException.validation("Restricción de eje no reconocida: " + token);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case FREE -> FREE_TOKEN;
            case FIXED -> "0";
            case PRESCRIBED -> Double.toString(value);
        };
    }
}
