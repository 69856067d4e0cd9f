package com.routely.backend;

import com.routely.backend.fare.FareTable;
import com.routely.backend.fare.FareTableBuilder;
import com.routely.backend.fare.GroupDiscountSchedule;
import com.routely.backend.model.FareType;
import com.routely.backend.model.Line;
import com.routely.backend.model.NetworkData;
import com.routely.backend.model.PassengerCategory;
import com.routely.backend.model.PassengerType;
import com.routely.backend.model.Station;
import com.routely.backend.model.TransferLink;
import com.routely.backend.model.ZoneFareRule;
import com.routely.backend.network.NetworkModelBuilder;
import com.routely.backend.network.NetworkSnapshot;
import com.routely.backend.service.PlannerSnapshot;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Small hand-made networks shared by the tests.
 *
 * <pre>
 * L1: A - B - C          (5 min, 10 per hop, zone 1)
 *         |  transfer B-B2 (3 min, fee 5)
 * L2:     B2 - D         (5 min, 10 per hop, zone 1 to 2)
 * </pre>
 */
public final class TestNetworks {

    private TestNetworks() {
    }

    public static Station station(String id, String lineId, int zone, double lat, double lon) {
        return Station.builder()
                .id(id)
                .name("Station " + id)
                .lineId(lineId)
                .zoneNumber(zone)
                .lat(lat)
                .lon(lon)
                .build();
    }

    public static Line line(String id, FareType fareType, int minutes, int cost, String... stationIds) {
        return Line.builder()
                .id(id)
                .companyId("OP")
                .name("Line " + id)
                .color("#000000")
                .fareType(fareType)
                .travelMinutesPerHop(minutes)
                .costPerHop(BigDecimal.valueOf(cost))
                .stationIds(new ArrayList<>(List.of(stationIds)))
                .build();
    }

    public static TransferLink transfer(String id, String a, String b, int minutes, int fee) {
        return TransferLink.builder()
                .id(id)
                .stationAId(a)
                .stationBId(b)
                .walkingMinutes(minutes)
                .walkingDistanceMeters(100)
                .transferFee(BigDecimal.valueOf(fee))
                .active(true)
                .build();
    }

    public static ZoneFareRule rule(String lineId, int zone, int base, int incremental) {
        return ZoneFareRule.builder()
                .lineId(lineId)
                .zoneNumber(zone)
                .baseFare(BigDecimal.valueOf(base))
                .incrementalFare(BigDecimal.valueOf(incremental))
                .build();
    }

    public static PassengerType passengerType(String id, PassengerCategory category, int discount) {
        return PassengerType.builder()
                .id(id)
                .name(id)
                .category(category)
                .discountPercentage(BigDecimal.valueOf(discount))
                .build();
    }

    public static List<PassengerType> passengerTypes() {
        return List.of(
                passengerType("adult", PassengerCategory.ADULT, 0),
                passengerType("student", PassengerCategory.STUDENT, 15),
                passengerType("child", PassengerCategory.CHILD, 50));
    }

    /**
     * Two lines joined by one transfer. Every ride costs a flat 10.
     */
    public static NetworkData twoLines() {
        return NetworkData.builder()
                .stations(new ArrayList<>(List.of(
                        station("A", "L1", 1, 13.700, 100.500),
                        station("B", "L1", 1, 13.710, 100.500),
                        station("C", "L1", 1, 13.720, 100.500),
                        station("B2", "L2", 1, 13.710, 100.501),
                        station("D", "L2", 2, 13.710, 100.520))))
                .lines(new ArrayList<>(List.of(
                        line("L1", FareType.ZONE, 5, 10, "A", "B", "C"),
                        line("L2", FareType.ZONE, 5, 10, "B2", "D"))))
                .transferLinks(new ArrayList<>(List.of(transfer("X1", "B", "B2", 3, 5))))
                .fareRules(new ArrayList<>(List.of(
                        rule("L1", 1, 10, 0),
                        rule("L2", 1, 10, 0),
                        rule("L2", 2, 10, 0))))
                .passengerTypes(new ArrayList<>(passengerTypes()))
                .build();
    }

    /**
     * Two structurally distinct routes from O to T: straight along L1, or across to L2 and back.
     */
    public static NetworkData twoRoutes() {
        return NetworkData.builder()
                .stations(new ArrayList<>(List.of(
                        station("O", "L1", 1, 13.700, 100.500),
                        station("X", "L1", 1, 13.710, 100.500),
                        station("T", "L1", 1, 13.720, 100.500),
                        station("O2", "L2", 1, 13.700, 100.501),
                        station("Y", "L2", 1, 13.710, 100.510),
                        station("T2", "L2", 1, 13.720, 100.501))))
                .lines(new ArrayList<>(List.of(
                        line("L1", FareType.ZONE, 5, 10, "O", "X", "T"),
                        line("L2", FareType.ZONE, 4, 10, "O2", "Y", "T2"))))
                .transferLinks(new ArrayList<>(List.of(
                        transfer("XO", "O", "O2", 1, 0),
                        transfer("XT", "T", "T2", 1, 0))))
                .fareRules(new ArrayList<>(List.of(rule("L1", 1, 10, 0), rule("L2", 1, 10, 0))))
                .passengerTypes(new ArrayList<>(passengerTypes()))
                .build();
    }

    public static NetworkSnapshot build(NetworkData data) {
        return new NetworkModelBuilder().build(data.getStations(), data.getLines(), data.getTransferLinks());
    }

    public static FareTable fareTable(NetworkSnapshot network, NetworkData data, GroupDiscountSchedule schedule) {
        return new FareTableBuilder(schedule).build(network, data.getFareRules(), data.getPassengerTypes());
    }

    public static PlannerSnapshot snapshot(NetworkData data) {
        NetworkSnapshot network = build(data);
        return new PlannerSnapshot(1, LocalDateTime.of(2024, 1, 1, 0, 0), network,
                fareTable(network, data, GroupDiscountSchedule.parse("5:10,10:15,20:20")));
    }
}
