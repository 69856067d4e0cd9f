package com.routely.backend.fare;

import com.routely.backend.TestNetworks;
import com.routely.backend.exception.IntegrityException;
import com.routely.backend.exception.InvalidPassengerTypeException;
import com.routely.backend.model.FareType;
import com.routely.backend.model.NetworkData;
import com.routely.backend.model.PassengerCategory;
import com.routely.backend.network.NetworkSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

import static com.routely.backend.TestNetworks.passengerType;
import static com.routely.backend.TestNetworks.rule;
import static org.junit.jupiter.api.Assertions.*;

class FareTableBuilderTest {

    private FareTableBuilder builder;
    private NetworkData data;
    private NetworkSnapshot network;

    @BeforeEach
    void setUp() {
        builder = new FareTableBuilder("5:10");
        data = TestNetworks.twoLines();
        network = TestNetworks.build(data);
    }

    @Test
    void testBuild_IndexesRulesAndPassengerTypes() {
        // When
        FareTable table = builder.build(network, data.getFareRules(), data.getPassengerTypes());

        // Then
        assertEquals(3, table.ruleCount());
        assertEquals("L2", table.rule("L2", 2).getLineId());
        assertEquals(FareType.ZONE, table.fareType("L1"));
        assertEquals(List.of("adult", "student", "child"),
                table.passengerTypes().stream().map(type -> type.getId()).collect(Collectors.toList()));
        assertEquals(1, table.groupDiscounts().getBrackets().size());
        assertThrows(InvalidPassengerTypeException.class, () -> table.passengerType("nobody"));
    }

    @Test
    void testBuild_LaterChangesToInputDoNotReachTable() {
        // Given
        FareTable table = builder.build(network, data.getFareRules(), data.getPassengerTypes());

        // When
        data.getFareRules().get(0).setBaseFare(new BigDecimal("999"));
        data.getPassengerTypes().get(2).setDiscountPercentage(BigDecimal.ZERO);

        // Then
        assertEquals(0, new BigDecimal("10").compareTo(table.rule("L1", 1).getBaseFare()));
        assertEquals(0, new BigDecimal("50").compareTo(table.passengerType("child").getDiscountPercentage()));
    }

    @Test
    void testBuild_CoverageGapIsNotFatal() {
        // Given
        data.getFareRules().remove(2);

        // When
        FareTable table = builder.build(network, data.getFareRules(), data.getPassengerTypes());

        // Then
        assertFalse(table.hasRule("L2", 2));
    }

    @Test
    void testBuild_DuplicateRule_Throws() {
        data.getFareRules().add(rule("L1", 1, 12, 0));
        assertThrows(IntegrityException.class,
                () -> builder.build(network, data.getFareRules(), data.getPassengerTypes()));
    }

    @Test
    void testBuild_RuleForUnknownLine_Throws() {
        data.getFareRules().add(rule("L9", 1, 12, 0));
        assertThrows(IntegrityException.class,
                () -> builder.build(network, data.getFareRules(), data.getPassengerTypes()));
    }

    @Test
    void testBuild_NegativeFare_Throws() {
        data.getFareRules().add(rule("L1", 3, -1, 0));
        assertThrows(IntegrityException.class,
                () -> builder.build(network, data.getFareRules(), data.getPassengerTypes()));
    }

    @Test
    void testBuild_DiscountAboveHundred_Throws() {
        data.getPassengerTypes().add(passengerType("free", PassengerCategory.CHILD, 120));
        assertThrows(IntegrityException.class,
                () -> builder.build(network, data.getFareRules(), data.getPassengerTypes()));
    }
}
