package projectelastic.domain.exception;

import lombok.Getter;

import java.util.Objects;

/**
 * Error de contrato del núcleo de elementos finitos.
 * <p>
 * El mensaje siempre empieza por el tipo entre corchetes (ej: "[VALIDATION] ...")
 * para que el llamador y los logs puedan clasificar el fallo sin inspeccionar la clase.
 */
@Getter
public final class FemModelException extends RuntimeException {

    private final ErrorType type;

    public FemModelException(ErrorType type, String message) {
        super(formatMessage(type, message));
        this.type = type;
    }

    public FemModelException(ErrorType type, String message, Throwable cause) {
        super(formatMessage(type, message), cause);
        this.type = type;
    }

    public static FemModelException validation(String message) {
        return new FemModelException(ErrorType.VALIDATION, message);
    }

    public static FemModelException unsupported(String message) {
        return new FemModelException(ErrorType.UNSUPPORTED_CONFIGURATION, message);
    }

    public static FemModelException numerical(String message) {
        return new FemModelException(ErrorType.NUMERICAL, message);
    }

    private static String formatMessage(ErrorType type, String message) {
        return "[" + Objects.requireNonNull(type, "type") + "] " + Objects.requireNonNull(message, "message");
    }

    /**
     * Familias de error que puede producir un cálculo.
     */
    public enum ErrorType {
        /** Datos de entrada incoherentes (ids, longitudes, referencias, materiales). */
        VALIDATION,
        /** Topología de elemento u orden de integración no soportados. */
        UNSUPPORTED_CONFIGURATION,
        /** Sistema reducido singular o resultado no finito. */
        NUMERICAL
    }
}
