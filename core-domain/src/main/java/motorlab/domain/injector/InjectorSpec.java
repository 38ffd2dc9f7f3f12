package motorlab.domain.injector;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Parámetros de entrada para dimensionar un inyector. Unión etiquetada por familia:
 * cada variante lleva solo los parámetros que tienen sentido para ella.
 * <p>
 * Convención común: un valor 0 (o null) significa "usar el valor por defecto / automático".
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ShowerheadSpec.class, name = "showerhead"),
        @JsonSubTypes.Type(value = PintleSpec.class, name = "pintle"),
        @JsonSubTypes.Type(value = SwirlSpec.class, name = "swirl")
})
public interface InjectorSpec {

    InjectorFamily family();

    /**
     * Coeficiente de descarga explícito, o null para usar el de la familia.
     */
    Double dischargeCoefficient();

    /**
     * Caída de presión impuesta (Pa). 0 = selección automática.
     */
    double pressureDrop();

    default double resolvedDischargeCoefficient() {
        Double cd = dischargeCoefficient();
        return cd != null ? cd : family().getDefaultDischargeCoefficient();
    }
}
