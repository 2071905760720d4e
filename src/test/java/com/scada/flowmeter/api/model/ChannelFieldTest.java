package com.scada.flowmeter.api.model;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ChannelFieldTest {

    @Test
    void columnName_shouldFollowUploaderNaming() {
        assertEquals("FT1MassFlow", ChannelField.of(1, Measurement.MASS_FLOW).columnName());
        assertEquals("FT4Masstotal", ChannelField.of(4, Measurement.MASS_TOTAL).columnName());
        assertEquals("FT9Volumetotal", ChannelField.of(9, Measurement.VOLUME_TOTAL).columnName());
        assertEquals("FT2Temp", ChannelField.of(2, Measurement.TEMPERATURE).columnName());
    }

    @Test
    void all_shouldListFiftyFourDistinctFieldsInChannelOrder() {
        List<ChannelField> all = ChannelField.all();
        Set<String> names = new HashSet<>();
        all.forEach(field -> names.add(field.columnName()));

        assertEquals(54, all.size());
        assertEquals(54, names.size());
        assertEquals("FT1MassFlow", all.get(0).columnName());
        assertEquals("FT9Density", all.get(53).columnName());
    }

    @Test
    void constructor_withChannelOutOfRange_shouldFail() {
        assertThrows(IllegalArgumentException.class, () -> ChannelField.of(0, Measurement.DENSITY));
        assertThrows(IllegalArgumentException.class, () -> ChannelField.of(10, Measurement.DENSITY));
    }
}
