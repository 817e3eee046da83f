package com.company.fermentation.domain;

import com.company.fermentation.domain.enums.DeviationStatus;
import com.company.fermentation.domain.enums.Parameter;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@AllArgsConstructor
public class ParameterStatuses {
    DeviationStatus ph;
    DeviationStatus temperature;
    DeviationStatus co2;

    public DeviationStatus get(Parameter parameter) {
        switch (parameter) {
            case PH:
                return ph;
            case TEMPERATURE:
                return temperature;
            case CO2:
                return co2;
            default:
                throw new IllegalArgumentException("Unsupported parameter: " + parameter);
        }
    }

    public DeviationStatus worst() {
        return DeviationStatus.worst(List.of(ph, temperature, co2));
    }
}
