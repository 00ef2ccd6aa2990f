package info.isaksson.erland.uagraph.navigation;

import info.isaksson.erland.uagraph.model.NodeClass;
import info.isaksson.erland.uagraph.model.error.EmptyInputException;
import info.isaksson.erland.uagraph.model.error.UnknownTypeException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class InstanceDeclarationsTest {

    private static GraphFixture motors() {
        GraphFixture f = GraphFixture.withStandardTypes();
        f.subtype("MotorType", NodeClass.OBJECT_TYPE, "BaseObjectType");
        f.member("MotorType", "MotorType.Speed", "Speed", "HasComponent", "Mandatory");
        f.member("MotorType", "MotorType.Serial", "SerialNumber", "HasProperty", "Optional");
        f.member("MotorType", "MotorType.Note", "Note", "HasProperty", null);
        f.subtype("ElectricMotorType", NodeClass.OBJECT_TYPE, "MotorType");
        f.member("ElectricMotorType", "ElectricMotorType.Speed", "Speed", "HasComponent", "Mandatory");
        f.member("ElectricMotorType", "Winding", "<Winding>", "HasComponent", "OptionalPlaceholder");
        f.member("Winding", "Winding.Temperature", "Temperature", "HasComponent", "Mandatory");
        return f;
    }

    private static List<String> paths(List<InstanceDeclaration> rows) {
        return rows.stream().map(d -> d.browsePath).collect(Collectors.toList());
    }

    @Test
    void memberWithoutModellingRuleIsNotDeclared() {
        GraphFixture f = GraphFixture.withStandardTypes();
        int t = f.subtype("T", NodeClass.OBJECT_TYPE, "BaseObjectType");
        int p = f.member("T", "P", "P", "HasProperty", "Mandatory");
        f.member("T", "Q", "Q", "HasProperty", null);

        List<InstanceDeclaration> rows = InstanceDeclarations.fullyInherited(List.of(t), f.nodes, f.references);

        assertEquals(List.of("", "P"), paths(rows));
        assertEquals(new InstanceDeclaration(t, "", t, t, List.of()), rows.get(0));
        assertEquals(new InstanceDeclaration(p, "P", t, t, List.of("Mandatory")), rows.get(1));
    }

    @Test
    void mostDerivedDeclarationWinsAndPlaceholderChildrenAreDropped() {
        GraphFixture f = motors();
        int electric = f.id("ElectricMotorType");

        List<InstanceDeclaration> rows = InstanceDeclarations.fullyInherited(List.of(electric), f.nodes, f.references);

        assertEquals(List.of("", "<Winding>", "SerialNumber", "Speed"), paths(rows));
        InstanceDeclaration speed = rows.get(3);
        assertEquals(f.id("ElectricMotorType.Speed"), speed.instanceId);
        assertEquals(electric, speed.superTypeId);
        InstanceDeclaration serial = rows.get(2);
        assertEquals(f.id("MotorType"), serial.superTypeId);
        assertEquals(List.of("Optional"), serial.modellingRulePath);
        assertEquals(List.of("OptionalPlaceholder"), rows.get(1).modellingRulePath);
        assertTrue(rows.stream().allMatch(d -> d.typeId == electric));
    }

    @Test
    void eachRequestedTypeGetsItsOwnTree() {
        GraphFixture f = motors();
        int motor = f.id("MotorType");
        int electric = f.id("ElectricMotorType");

        List<InstanceDeclaration> rows = InstanceDeclarations.fullyInherited(List.of(electric, motor), f.nodes, f.references);

        List<InstanceDeclaration> ofMotor = rows.stream().filter(d -> d.typeId == motor).collect(Collectors.toList());
        assertEquals(List.of("", "SerialNumber", "Speed"), paths(ofMotor));
        assertEquals(f.id("MotorType.Speed"), ofMotor.get(2).instanceId);
        assertEquals(motor, rows.get(0).typeId);
    }

    @Test
    void placeholderRulePathsLongerThanOneArePruned() {
        assertTrue(InstanceDeclarations.belowPlaceholder(List.of("Mandatory", "OptionalPlaceholder")));
        assertTrue(InstanceDeclarations.belowPlaceholder(List.of("MandatoryPlaceholder", "Optional")));
        assertFalse(InstanceDeclarations.belowPlaceholder(List.of("OptionalPlaceholder")));
        assertFalse(InstanceDeclarations.belowPlaceholder(List.of("Mandatory", "Optional")));
        assertFalse(InstanceDeclarations.belowPlaceholder(List.of()));
    }

    @Test
    void placeholderNestedUnderAMemberIsDropped() {
        GraphFixture f = GraphFixture.withStandardTypes();
        int switchType = f.subtype("SwitchType", NodeClass.OBJECT_TYPE, "BaseObjectType");
        f.member("SwitchType", "Ports", "Ports", "HasComponent", "Mandatory");
        f.member("Ports", "Port", "<Port>", "HasComponent", "OptionalPlaceholder");
        f.member("SwitchType", "Uplink", "<Uplink>", "HasComponent", "MandatoryPlaceholder");

        List<InstanceDeclaration> rows = InstanceDeclarations.fullyInherited(List.of(switchType), f.nodes, f.references);

        assertEquals(List.of("", "<Uplink>", "Ports"), paths(rows));
        assertEquals(List.of("MandatoryPlaceholder"), rows.get(1).modellingRulePath);
    }

    @Test
    void emptyRequestsAreRejected() {
        GraphFixture f = motors();

        assertThrows(EmptyInputException.class,
                () -> InstanceDeclarations.fullyInherited(List.of(), f.nodes, f.references));
        assertThrows(EmptyInputException.class,
                () -> InstanceDeclarations.fullyInherited(List.of(1), List.of(), f.references));
    }

    @Test
    void nonTypeIdsAreReportedAsUnknown() {
        GraphFixture f = motors();
        int speed = f.id("MotorType.Speed");

        UnknownTypeException ex = assertThrows(UnknownTypeException.class,
                () -> InstanceDeclarations.fullyInherited(List.of(f.id("MotorType"), speed, 12345), f.nodes, f.references));
        assertEquals(List.of(speed, 12345), ex.getMissingIds());
    }
}
