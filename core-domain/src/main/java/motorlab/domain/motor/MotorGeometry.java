package motorlab.domain.motor;

import lombok.Builder;
import lombok.With;

import java.util.Objects;

/**
 * Hardware del motor: tobera, cámara, grano e inyector (dimensionado o "tal como se construyó").
 * <p>
 * Es inmutable. La regresión del grano se modela creando copias con {@code withPortDiameter}.
 *
 * @param motorType           Arquitectura a la que pertenece el grano.
 * @param throatArea          Área de garganta (m²).
 * @param expansionRatio      Relación de áreas salida/garganta de la tobera.
 * @param chamberDiameter     Diámetro interior de la cámara (m).
 * @param grainOuterDiameter  Diámetro exterior del grano (m).
 * @param initialPortDiameter Diámetro del canal al encendido (m).
 * @param portDiameter        Diámetro actual del canal (m).
 * @param grainLength         Longitud inicial del grano o de cada segmento BATES (m).
 * @param segmentCount        Número de segmentos BATES (sólidos). En híbridos vale 1.
 * @param injectorFlowArea    Área efectiva del inyector Cd·A (m²). Cero en sólidos.
 * @param oxidizerLoad        Masa de oxidante cargada (kg). Cero en sólidos.
 */
@Builder
@With
public record MotorGeometry(
        MotorType motorType,
        double throatArea,
        double expansionRatio,
        double chamberDiameter,
        double grainOuterDiameter,
        double initialPortDiameter,
        double portDiameter,
        double grainLength,
        int segmentCount,
        double injectorFlowArea,
        double oxidizerLoad
) {

    public MotorGeometry {
        Objects.requireNonNull(motorType, "motorType no puede ser null");
        if (throatArea <= 0 || portDiameter <= 0 || grainLength <= 0) {
            throw new IllegalArgumentException("La geometría requiere garganta, canal y longitud de grano positivos.");
        }
        if (segmentCount < 1) {
            throw new IllegalArgumentException("segmentCount debe ser >= 1, recibido: " + segmentCount);
        }
    }

    public double throatDiameter() {
        return Math.sqrt(4.0 * throatArea / Math.PI);
    }

    public double exitArea() {
        return throatArea * expansionRatio;
    }

    public double portArea() {
        return Math.PI * portDiameter * portDiameter / 4.0;
    }

    /**
     * Longitud actual del grano. En los segmentos BATES las caras extremas también regresan,
     * así que la longitud disminuye lo mismo que crece el diámetro del canal.
     */
    public double currentGrainLength() {
        if (motorType == MotorType.HYBRID) {
            return grainLength;
        }
        return Math.max(0.0, grainLength - (portDiameter - initialPortDiameter));
    }

    /**
     * Espesor de alma restante entre el canal y la superficie exterior (m).
     */
    public double remainingWeb() {
        return Math.max(0.0, (grainOuterDiameter - portDiameter) / 2.0);
    }

    /**
     * Superficie de combustión actual (m²).
     * <ul>
     *     <li>Híbrido: pared del canal, {@code π·D·L}.</li>
     *     <li>Sólido BATES: canal más las dos caras anulares de cada segmento.</li>
     * </ul>
     */
    public double burningArea() {
        double length = currentGrainLength();
        if (motorType == MotorType.HYBRID) {
            return Math.PI * portDiameter * length;
        }
        if (length <= 0 || portDiameter >= grainOuterDiameter) {
            return 0.0;
        }
        double core = Math.PI * portDiameter * length;
        double faces = Math.PI / 2.0 * (grainOuterDiameter * grainOuterDiameter - portDiameter * portDiameter);
        return segmentCount * (core + faces);
    }
}
