package com.trading.opg.registry;

import com.trading.opg.api.MissingParameterException;
import com.trading.opg.api.OperationKind;
import com.trading.opg.api.Parameters;
import com.trading.opg.api.UnknownKindException;
import com.trading.opg.ops.AddUnit;

import java.util.EnumSet;
import java.util.List;

import org.junit.Test;
import static org.junit.Assert.*;

public class OperationRegistryTest {

    @Test
    public void testDefaultsRegisterAllKinds() {
        OperationRegistry registry = OperationRegistry.defaults();
        assertEquals(EnumSet.allOf(OperationKind.class), EnumSet.copyOf(registry.kinds()));
        for (OperationKind k : OperationKind.values()) {
            assertEquals(List.of(Parameters.COLUMNS, Parameters.VALUE), registry.lookup(k).requiredParameters());
        }
    }

    @Test
    public void testLookupByWireTag() {
        OperationRegistry registry = OperationRegistry.defaults();
        assertEquals(OperationKind.SMA, registry.lookup("sma").kind());
    }

    @Test(expected = UnknownKindException.class)
    public void testUnknownTag() {
        OperationRegistry.defaults().lookup("MACD");
    }

    @Test
    public void testUnregisteredKindIsUnknown() {
        OperationRegistry registry = OperationRegistry.builder()
                .register(OperationKind.ADD, new AddUnit(), Parameters.COLUMNS)
                .build();
        assertTrue(registry.isRegistered(OperationKind.ADD));
        assertFalse(registry.isRegistered(OperationKind.ADX));
        try {
            registry.lookup(OperationKind.ADX);
            fail("Should have thrown");
        } catch (UnknownKindException e) {
            assertEquals("ADX", e.kind());
        }
    }

    @Test
    public void testMissingParametersListedInRegistryOrder() {
        OperationRegistry registry = OperationRegistry.defaults();
        try {
            registry.validate(OperationKind.SMA, Parameters.empty());
            fail("Should have thrown");
        } catch (MissingParameterException e) {
            assertEquals(OperationKind.SMA, e.kind());
            assertEquals(List.of(Parameters.COLUMNS, Parameters.VALUE), e.missing());
            assertTrue(e.supplied().isEmpty());
            assertTrue(e.getMessage(), e.getMessage().contains("SMA"));
        }
    }

    @Test
    public void testOnlyAbsentNamesReported() {
        OperationRegistry registry = OperationRegistry.defaults();
        try {
            registry.validate(OperationKind.ADD, Parameters.of(List.of("x"), null));
            fail("Should have thrown");
        } catch (MissingParameterException e) {
            assertEquals(List.of(Parameters.VALUE), e.missing());
            assertEquals(List.of(Parameters.COLUMNS, Parameters.VALUE), e.required());
        }
    }

    @Test
    public void testValidParametersPass() {
        OperationRegistry.defaults().validate(OperationKind.ADX, Parameters.of(14, "h", "l", "c"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBuilderRejectsUnknownParameterName() {
        OperationRegistry.builder().register(OperationKind.ADD, new AddUnit(), "sources");
    }
}
