package motorlab.domain.uncertainty;

import motorlab.config.MotorConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class UncertaintySpecTest {

    @Test
    @DisplayName("Los nombres de parámetro se aceptan sin distinguir mayúsculas")
    void fromNames_parsesCaseInsensitive() {
        UncertaintySpec spec = UncertaintySpec.fromNames(Map.of("gamma", 0.02, " Tank_Pressure ", 0.05));

        assertEquals(0.02, spec.perturbations().get(UncertainParameter.GAMMA));
        assertEquals(0.05, spec.perturbations().get(UncertainParameter.TANK_PRESSURE));
    }

    @Test
    @DisplayName("Un nombre desconocido o una σ negativa son errores")
    void rejectsInvalidEntries() {
        assertThrows(IllegalArgumentException.class, () -> UncertaintySpec.fromNames(Map.of("presion", 0.1)));
        assertThrows(IllegalArgumentException.class, () -> UncertaintySpec.uniform(-0.1, UncertainParameter.GAMMA));
    }

    @Test
    @DisplayName("Escalar un parámetro solo cambia ese parámetro")
    void scale_changesOnlyTheTargetParameter() {
        // ARRANGE
        MotorConfiguration nominal = MotorConfiguration.getTestingHybrid();

        // ACT
        MotorConfiguration scaled = UncertainParameter.OXIDIZER_DENSITY.scale(nominal, 1.1);

        // ASSERT
        assertEquals(nominal.oxidizer().density() * 1.1, scaled.oxidizer().density(), 1e-9);
        assertEquals(nominal.withOxidizer(scaled.oxidizer()), scaled);
    }

    @Test
    @DisplayName("Los parámetros de hardware necesitan geometría")
    void hardwareParametersRequireGeometry() {
        MotorConfiguration unsized = MotorConfiguration.getTestingHybrid();
        assertThrows(IllegalStateException.class, () -> UncertainParameter.THROAT_AREA.nominalValue(unsized));
        assertThrows(IllegalStateException.class, () -> UncertainParameter.INJECTOR_FLOW_AREA.scale(unsized, 1.01));
    }
}
