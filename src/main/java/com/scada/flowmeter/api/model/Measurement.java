package com.scada.flowmeter.api.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The six quantities every flow meter channel reports.
 * The suffix is the exact spelling used by the SCADA uploader and the table columns.
 */
@Getter
@RequiredArgsConstructor
public enum Measurement {
    MASS_FLOW("MassFlow"),
    MASS_TOTAL("Masstotal"),
    VOLUME_FLOW("VolumeFlow"),
    VOLUME_TOTAL("Volumetotal"),
    TEMPERATURE("Temp"),
    DENSITY("Density");

    private final String suffix;
}
