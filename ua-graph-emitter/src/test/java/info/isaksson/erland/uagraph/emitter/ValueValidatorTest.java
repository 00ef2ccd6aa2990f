package info.isaksson.erland.uagraph.emitter;

import info.isaksson.erland.uagraph.model.NodeClass;
import info.isaksson.erland.uagraph.model.NodeSetTables;
import info.isaksson.erland.uagraph.model.error.ValidationException;
import info.isaksson.erland.uagraph.model.value.UaFloatingPoint;
import info.isaksson.erland.uagraph.model.value.UaInteger;
import info.isaksson.erland.uagraph.model.value.UaListOf;
import info.isaksson.erland.uagraph.model.value.UaString;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ValueValidatorTest {

    @Test
    void matchingBuiltInTypePasses() {
        NodeSetTables tables = TablesBuilder.plant(new UaFloatingPoint("Double", 1.0)).build();

        assertDoesNotThrow(() -> ValueValidator.validate(tables, tables.nodes));
    }

    @Test
    void mismatchesAreCollectedByDisplayName() {
        NodeSetTables tables = TablesBuilder.plant(UaString.of("fast"))
                .node("ns=2;i=12", NodeClass.VARIABLE, 2, "Label", "", UaInteger.int32(4), "i=12", null)
                .build();

        ValidationException ex = assertThrows(ValidationException.class,
                () -> ValueValidator.validate(tables, tables.nodes));
        assertEquals(List.of("Flow", "Label"), ex.getInvalidDisplayNames());
        assertTrue(ex.getMessage().startsWith("Invalid Value for rows with the following display names"));
    }

    @Test
    void valuesOutsideTheBuiltInsAreNotChecked() {
        NodeSetTables tables = TablesBuilder.plant(
                new UaListOf("Double", List.of(new UaFloatingPoint("Double", 1.0)))).build();

        assertDoesNotThrow(() -> ValueValidator.validate(tables, tables.nodes));
    }

    @Test
    void dataTypeOutsideTheGraphIsNotChecked() {
        NodeSetTables tables = new TablesBuilder(TablesBuilder.PLANT)
                .node("ns=1;i=1", NodeClass.VARIABLE, 1, "Count", "", UaString.of("x"), "i=6", null)
                .build();

        assertDoesNotThrow(() -> ValueValidator.validate(tables, tables.nodes));
    }

    @Test
    void valueWithoutDataTypeFails() {
        NodeSetTables tables = new TablesBuilder(TablesBuilder.PLANT)
                .node("ns=1;i=1", NodeClass.VARIABLE, 1, "Loose", "", UaInteger.int32(1), null, null)
                .build();

        ValidationException ex = assertThrows(ValidationException.class,
                () -> ValueValidator.validate(tables, tables.nodes));
        assertTrue(ex.getMessage().contains("no DataType"));
    }

    @Test
    void writerValidatesBeforeWritingUnlessDisabled() {
        NodeSetTables tables = TablesBuilder.plant(UaString.of("fast")).build();

        assertThrows(ValidationException.class,
                () -> NodeSetWriter.writeToString(tables, TablesBuilder.PLANT, WriteOptions.defaults()));

        WriteOptions lenient = WriteOptions.defaults();
        lenient.validateValues = false;
        assertTrue(NodeSetWriter.writeToString(tables, TablesBuilder.PLANT, lenient).xml.contains("<String"));
    }
}
