package motorlab.physics.solver;

import motorlab.config.SolverSettings;
import motorlab.domain.exception.ConvergenceException;
import motorlab.domain.exception.InfeasibleDesignException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Constructor;
import java.lang.reflect.Modifier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Relaciones isentrópicas de tobera comparadas con valores de tabla para aire (γ = 1.4).
 */
class IsentropicNozzleTest {

    private static final double AIR_GAMMA = 1.4;

    @Test
    @DisplayName("El constructor debe ser privado para prohibir la instanciación")
    void constructorIsPrivate() throws NoSuchMethodException {
        Constructor<IsentropicNozzle> constructor = IsentropicNozzle.class.getDeclaredConstructor();
        assertTrue(Modifier.isPrivate(constructor.getModifiers()), "El constructor debe ser privado.");
    }

    @Test
    @DisplayName("c* de aire a 300 K coincide con el valor analítico")
    void characteristicVelocity_matchesAnalyticValue() {
        // ACT
        double cStar = IsentropicNozzle.characteristicVelocity(AIR_GAMMA, 287.0, 300.0);

        // ASSERT
        assertEquals(428.530, cStar, 1e-3);
    }

    @Test
    @DisplayName("Relación crítica de presiones para γ = 1.4")
    void criticalPressureRatio_air() {
        assertEquals(0.5283, IsentropicNozzle.criticalPressureRatio(AIR_GAMMA), 1e-4);
    }

    @Test
    @DisplayName("El gasto por la garganta crece estrictamente con la presión de cámara")
    void throatMassFlow_strictlyIncreasesWithChamberPressure() {
        // ARRANGE
        double cStar = IsentropicNozzle.characteristicVelocity(AIR_GAMMA, 287.0, 300.0);
        double throatArea = 1e-4;

        // ACT & ASSERT
        double previous = 0.0;
        for (double pressure = 5e5; pressure <= 60e5; pressure += 5e5) {
            double flow = IsentropicNozzle.throatMassFlow(pressure, throatArea, cStar);
            assertTrue(flow > previous, "ṁ no crece a " + pressure + " Pa");
            previous = flow;
        }
        assertEquals(20e5 * throatArea / cStar, IsentropicNozzle.throatMassFlow(20e5, throatArea, cStar), 1e-12);
    }

    @Test
    @DisplayName("En la garganta la relación de áreas vale 1")
    void areaRatio_isUnityAtThroat() {
        double critical = IsentropicNozzle.criticalPressureRatio(1.25);
        assertEquals(1.0, IsentropicNozzle.areaRatio(1.25, critical), 1e-9);
    }

    @Test
    @DisplayName("Ramal supersónico: ε = 4 da Pe/Pc ≈ 0.0298 (tablas, M ≈ 2.94)")
    void exitPressureRatio_matchesTableValue() {
        // ACT
        double ratio = IsentropicNozzle.exitPressureRatio(AIR_GAMMA, 4.0, 1e-10, 500);

        // ASSERT
        assertEquals(0.029787, ratio, 1e-5);
        assertEquals(4.0, IsentropicNozzle.areaRatio(AIR_GAMMA, ratio), 1e-6, "La inversa debe recuperar ε.");
    }

    @Test
    @DisplayName("Una relación de expansión ≤ 1 no admite flujo supersónico")
    void exitPressureRatio_rejectsSubsonicExpansion() {
        assertThrows(InfeasibleDesignException.class,
                () -> IsentropicNozzle.exitPressureRatio(AIR_GAMMA, 1.0, 1e-9, 100));
    }

    @Test
    @DisplayName("La bisección sin iteraciones suficientes lanza ConvergenceException con el último estimado")
    void exitPressureRatio_reportsNonConvergence() {
        // ACT
        ConvergenceException e = assertThrows(ConvergenceException.class,
                () -> IsentropicNozzle.exitPressureRatio(AIR_GAMMA, 10.0, 1e-12, 3));

        // ASSERT
        assertEquals(3, e.getIterations());
        assertTrue(e.getLastEstimate() > 0 && e.getLastEstimate() < 1);
    }

    @Test
    @DisplayName("Expansión óptima: adapta Pe a la ambiente y se limita en vacío")
    void optimumExpansionRatio_adaptsToAmbient() {
        // ACT
        double epsilon = IsentropicNozzle.optimumExpansionRatio(1.25, 20e5, 101325.0);
        double ratio = IsentropicNozzle.exitPressureRatio(1.25, epsilon, 1e-10, 500);

        // ASSERT
        assertEquals(101325.0 / 20e5, ratio, 1e-6);
        assertEquals(IsentropicNozzle.MAX_EXPANSION_RATIO, IsentropicNozzle.optimumExpansionRatio(1.25, 20e5, 0.0));
    }

    @Test
    @DisplayName("Sin flujo bloqueado no hay expansión óptima")
    void optimumExpansionRatio_requiresChokedFlow() {
        assertThrows(InfeasibleDesignException.class,
                () -> IsentropicNozzle.optimumExpansionRatio(1.25, 1.5e5, 101325.0));
    }

    @Test
    @DisplayName("expand con ε fijo respeta la relación pedida y da velocidad de salida positiva")
    void expand_withFixedExpansionRatio() {
        // ACT
        NozzleExpansion expansion = IsentropicNozzle.expand(1.25, 300.0, 3000.0, 20e5, 101325.0, 6.0, SolverSettings.defaults());

        // ASSERT
        assertEquals(6.0, expansion.expansionRatio());
        assertTrue(expansion.exitVelocity() > 1000.0);
        assertTrue(expansion.pressureRatio() < IsentropicNozzle.criticalPressureRatio(1.25));
    }
}
