package motorlab.domain.regression;

/**
 * Estado de una muestra de la línea temporal de regresión.
 */
public enum SampleStatus {
    NOMINAL,
    /**
     * El canal superaría el margen estructural: la geometría se congela y la muestra
     * repite el último estado válido.
     */
    BURNTHROUGH_RISK,
    /**
     * Alma agotada en un sólido: la combustión terminó. Empuje nulo y cámara a presión ambiente.
     */
    BURNOUT
}
