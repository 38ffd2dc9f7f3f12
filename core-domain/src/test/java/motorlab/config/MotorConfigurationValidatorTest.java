package motorlab.config;

import motorlab.domain.exception.ValidationException;
import motorlab.domain.injector.PintleSpec;
import motorlab.domain.injector.ShowerheadSpec;
import motorlab.domain.motor.CombustionMode;
import motorlab.domain.motor.MotorType;
import motorlab.domain.motor.OxidizerPhase;
import motorlab.domain.motor.Propellant;
import motorlab.physics.model.StandardAtmosphere;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Reglas de validación y valores por defecto de la entrada cruda.
 */
class MotorConfigurationValidatorTest {

    private MotorConfigurationValidator validator;
    private RawMotorInput hybrid;

    @BeforeEach
    void setUp() {
        validator = new MotorConfigurationValidator();
        hybrid = RawMotorInput.builder()
                .motorType(MotorType.HYBRID)
                .thrust(1000.0)
                .burnTime(10.0)
                .ofRatio(6.5)
                .chamberPressure(20e5)
                .tankPressure(30e5)
                .build();
    }

    // --------------------------------------------------------------------------
    // Valores por defecto
    // --------------------------------------------------------------------------

    @Test
    @DisplayName("Entrada vacía: híbrido HTPB con los valores documentados e inyector de ducha")
    void check_emptyInputGetsDefaults() {
        // ACT
        MotorConfiguration config = validator.check(RawMotorInput.builder().build()).configuration();

        // ASSERT
        assertEquals(MotorType.HYBRID, config.motorType());
        assertEquals(Propellant.HTPB, config.propellant());
        assertEquals(MotorConfigurationValidator.DEFAULT_THRUST, config.thrust());
        assertEquals(MotorConfigurationValidator.DEFAULT_BURN_TIME, config.burnTime());
        assertEquals(MotorConfigurationValidator.DEFAULT_TANK_PRESSURE, config.tankPressure());
        assertEquals(StandardAtmosphere.SEA_LEVEL_PRESSURE, config.atmosphericPressure());
        assertEquals(OxidizerPhase.LIQUID, config.oxidizer().phase());
        assertEquals(ShowerheadSpec.defaults(), config.injector());
        assertEquals(0.0, config.expansionRatio(), "0 = adaptación automática de la tobera.");
        assertFalse(config.hasFixedGeometry());
    }

    @Test
    @DisplayName("Sólido: O/F de formulación del propelente y sin inyector (con aviso si se pasó uno)")
    void check_solidDropsInjector() {
        // ARRANGE
        RawMotorInput raw = RawMotorInput.builder()
                .motorType(MotorType.SOLID)
                .injector(PintleSpec.builder().build())
                .build();

        // ACT
        ValidationReport report = validator.check(raw);

        // ASSERT
        assertEquals(Propellant.APCP, report.configuration().propellant());
        assertEquals(Propellant.APCP.getFormulationOfRatio(), report.configuration().ofRatio());
        assertNull(report.configuration().injector());
        assertTrue(report.hasWarnings());
    }

    @Test
    @DisplayName("La altitud de diseño fija la presión ambiente por ISA")
    void check_designAltitudeSetsAmbientPressure() {
        MotorConfiguration config = validator.check(hybrid.withDesignAltitude(3000.0)).configuration();
        assertEquals(StandardAtmosphere.pressure(3000.0), config.atmosphericPressure(), 1e-9);
    }

    // --------------------------------------------------------------------------
    // Empuje / tiempo / impulso total
    // --------------------------------------------------------------------------

    @Test
    @DisplayName("Dos de tres: impulso total y empuje determinan el tiempo de combustión")
    void check_derivesBurnTimeFromImpulse() {
        // ARRANGE
        RawMotorInput raw = hybrid.withBurnTime(null).withTotalImpulse(5000.0);

        // ACT
        MotorConfiguration config = validator.check(raw).configuration();

        // ASSERT
        assertEquals(5.0, config.burnTime(), 1e-12);
        assertEquals(5000.0, config.totalImpulse(), 1e-9);
    }

    @Test
    @DisplayName("Dos de tres: impulso total y tiempo determinan el empuje")
    void check_derivesThrustFromImpulse() {
        MotorConfiguration config = validator.check(hybrid.withThrust(null).withTotalImpulse(8000.0)).configuration();
        assertEquals(800.0, config.thrust(), 1e-9);
    }

    @Test
    @DisplayName("Los tres valores inconsistentes más de un 1 % se rechazan")
    void check_rejectsInconsistentImpulseTriplet() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> validator.check(hybrid.withTotalImpulse(11_000.0)));
        assertTrue(e.getViolations().get(0).contains("impulso total"));
    }

    @Test
    @DisplayName("Los tres valores consistentes dentro del 1 % se aceptan")
    void check_acceptsConsistentImpulseTriplet() {
        assertDoesNotThrow(() -> validator.check(hybrid.withTotalImpulse(10_050.0)));
    }

    // --------------------------------------------------------------------------
    // Presiones
    // --------------------------------------------------------------------------

    @Test
    @DisplayName("Tanque a 19 bar con cámara a 20 bar: violación que menciona el tanque")
    void check_rejectsTankBelowChamber() {
        // ACT
        ValidationException e = assertThrows(ValidationException.class,
                () -> validator.check(hybrid.withTankPressure(19e5)));

        // ASSERT
        assertEquals(1, e.getViolations().size());
        assertTrue(e.getViolations().get(0).contains("tanque"));
        assertTrue(e.getMessage().contains("tanque"));
    }

    @Test
    @DisplayName("Margen tanque-cámara por debajo del 20 %: se acepta con aviso")
    void check_warnsOnSmallTankMargin() {
        ValidationReport report = validator.check(hybrid.withTankPressure(22e5));
        assertTrue(report.warnings().stream().anyMatch(w -> w.contains("Margen")));
    }

    @Test
    @DisplayName("Se enumeran todas las violaciones, no solo la primera")
    void check_reportsAllViolations() {
        // ARRANGE
        RawMotorInput raw = hybrid
                .withThrust(-5.0)
                .withGamma(0.9)
                .withOfRatio(25.0)
                .withRegressionExponent(1.2);

        // ACT
        ValidationException e = assertThrows(ValidationException.class, () -> validator.check(raw));

        // ASSERT
        List<String> violations = e.getViolations();
        assertEquals(4, violations.size(), "Violaciones: " + violations);
    }

    @Test
    @DisplayName("La presión de cámara debe superar la ambiente")
    void check_rejectsChamberBelowAmbient() {
        RawMotorInput raw = hybrid.withChamberPressure(0.9e5).withTankPressure(1.5e5);
        ValidationException e = assertThrows(ValidationException.class, () -> validator.check(raw));
        assertTrue(e.getViolations().stream().anyMatch(v -> v.contains("atmosférica")));
    }

    // --------------------------------------------------------------------------
    // Modo de combustión e inyector
    // --------------------------------------------------------------------------

    @Test
    @DisplayName("Área finita exige exactamente uno de contracción o flujo másico")
    void check_finiteAreaRequiresExactlyOneSizingInput() {
        RawMotorInput neither = hybrid.withCombustionMode(CombustionMode.FINITE_AREA);
        RawMotorInput both = neither.withContractionRatio(4.0).withMassFlux(500.0);

        assertThrows(ValidationException.class, () -> validator.check(neither));
        assertThrows(ValidationException.class, () -> validator.check(both));
        assertDoesNotThrow(() -> validator.check(neither.withContractionRatio(4.0)));
    }

    @Test
    @DisplayName("Área infinita ignora contracción y flujo másico con aviso")
    void check_infiniteAreaIgnoresFiniteInputs() {
        ValidationReport report = validator.check(hybrid.withContractionRatio(4.0));
        assertNull(report.configuration().contractionRatio());
        assertTrue(report.hasWarnings());
    }

    @Test
    @DisplayName("Pintle con el vástago más ancho que el manguito se rechaza")
    void check_rejectsInvalidPintle() {
        RawMotorInput raw = hybrid.withInjector(PintleSpec.builder().outerDiameter(0.02).pintleDiameter(0.03).build());
        assertThrows(ValidationException.class, () -> validator.check(raw));
    }

    @Test
    @DisplayName("validate devuelve la configuración y no lanza con advertencias")
    void validate_returnsConfiguration() {
        MotorConfiguration config = validator.validate(hybrid.withTankPressure(22e5));
        assertEquals(22e5, config.tankPressure());
    }

    @Test
    @DisplayName("verify no lanza: devuelve las violaciones de una configuración ya construida")
    void verify_returnsViolationsWithoutThrowing() {
        // ARRANGE
        MotorConfiguration broken = MotorConfiguration.getTestingHybrid().withTankPressure(10e5);

        // ACT
        List<String> violations = validator.verify(broken);

        // ASSERT
        assertEquals(1, violations.size());
        assertTrue(validator.verify(MotorConfiguration.getTestingHybrid()).isEmpty());
        assertTrue(validator.verify(MotorConfiguration.getTestingSolid()).isEmpty());
    }
}
