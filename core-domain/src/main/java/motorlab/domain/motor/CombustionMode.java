package motorlab.domain.motor;

/**
 * Modelo de cámara de combustión.
 * <p>
 * En {@link #FINITE_AREA} el diámetro de cámara se deriva de la relación de contracción
 * o del flujo másico por unidad de área (exactamente uno de los dos).
 */
public enum CombustionMode {
    INFINITE_AREA,
    FINITE_AREA
}
