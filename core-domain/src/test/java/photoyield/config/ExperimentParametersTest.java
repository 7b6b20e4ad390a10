package photoyield.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import photoyield.domain.exception.InputDataException;
import photoyield.domain.fit.UnknownParameter;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Validación de {@link ExperimentParameters} y selección del desconocido.
 */
class ExperimentParametersTest {

    private ExperimentParameters.ExperimentParametersBuilder builder;

    @BeforeEach
    void setUp() {
        builder = ExperimentParameters.builder()
                .startingConcentration(5e-5)
                .pathLength(1.0)
                .cellVolume(5e-4)
                .analysisWavelength(450)
                .excitationWavelength(365)
                .zeroReferenceWavelength(700)
                .seedPoints(10)
                .startPoint(0)
                .endPoint(20);
    }

    @Test
    @DisplayName("Con el flujo fijado, el desconocido es el rendimiento cuántico")
    void unknownParameter_shouldBeQuantumYieldWhenFluxFixed() {
        ExperimentParameters params = builder.photonFlux(5e14).build();
        assertEquals(UnknownParameter.QUANTUM_YIELD, params.unknownParameter());
    }

    @Test
    @DisplayName("Con qy fijado, el desconocido es el flujo fotónico (actinometría)")
    void unknownParameter_shouldBePhotonFluxWhenYieldFixed() {
        ExperimentParameters params = builder.quantumYield(0.3).build();
        assertEquals(UnknownParameter.PHOTON_FLUX, params.unknownParameter());
    }

    @Test
    @DisplayName("Sin ninguno de los dos fijado no se puede analizar")
    void unknownParameter_shouldFailWhenNothingFixed() {
        ExperimentParameters params = builder.build();
        assertThrows(InputDataException.class, params::unknownParameter);
    }

    @Test
    @DisplayName("Fijar qy y flujo a la vez es un error de entrada")
    void constructor_shouldRejectBothFixed() {
        assertThrows(InputDataException.class, () -> builder.quantumYield(0.3).photonFlux(5e14).build());
    }

    @Test
    @DisplayName("Concentración, camino óptico y volumen deben ser positivos")
    void constructor_shouldRejectNonPositiveGeometry() {
        assertThrows(InputDataException.class, () -> builder.startingConcentration(0).build());
        assertThrows(InputDataException.class, () -> builder.startingConcentration(5e-5).pathLength(-1).build());
        assertThrows(InputDataException.class, () -> builder.pathLength(1).cellVolume(0).build());
    }

    @Test
    @DisplayName("La ventana debe cumplir 0 ≤ inicio < fin y al menos 2 puntos semilla")
    void constructor_shouldRejectInvalidWindow() {
        assertThrows(InputDataException.class, () -> builder.startPoint(20).endPoint(20).build());
        assertThrows(InputDataException.class, () -> builder.startPoint(0).endPoint(20).seedPoints(1).build());
    }

    @Test
    @DisplayName("k negativa se rechaza; sin k se usa la semilla")
    void thermalRateConstant_shouldValidateAndFallBackToSeed() {
        assertThrows(InputDataException.class, () -> builder.thermalRateConstant(-1e-3).build());

        ExperimentParameters noK = builder.thermalRateConstant(null).photonFlux(5e14).build();
        assertEquals(1e-4, noK.thermalRateConstantOr(1e-4));
        assertEquals(0.0, noK.withThermalRateConstant(0.0).thermalRateConstantOr(1e-4));
    }
}
