package com.routely.backend.fare;

import com.routely.backend.exception.IntegrityException;
import com.routely.backend.model.FareType;
import com.routely.backend.model.Line;
import com.routely.backend.model.PassengerType;
import com.routely.backend.model.Station;
import com.routely.backend.model.ZoneFareRule;
import com.routely.backend.network.NetworkSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

@Component
@Slf4j
public class FareTableBuilder {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final GroupDiscountSchedule groupDiscounts;

    @Autowired
    public FareTableBuilder(@Value("${routely.fare.group-discounts:}") String groupDiscounts) {
        this(GroupDiscountSchedule.parse(groupDiscounts));
    }

    public FareTableBuilder(GroupDiscountSchedule groupDiscounts) {
        this.groupDiscounts = groupDiscounts;
    }

    /**
     * Validates rules and passenger types against the network. Missing zone coverage is only logged,
     * the gap surfaces as a typed error when an itinerary actually needs it.
     */
    public FareTable build(NetworkSnapshot network, List<ZoneFareRule> fareRules, List<PassengerType> passengerTypes) {
        Map<String, ZoneFareRule> rules = new HashMap<>();
        for (ZoneFareRule rule : fareRules) {
            if (rule == null || network.findLine(rule.getLineId()).isEmpty()) {
                throw new IntegrityException("Fare rule references unknown line "
                        + (rule == null ? null : rule.getLineId()));
            }
            if (isNegative(rule.getBaseFare()) || isNegative(rule.getIncrementalFare())) {
                throw new IntegrityException("Fare rule for line " + rule.getLineId() + " zone "
                        + rule.getZoneNumber() + " is missing or negative");
            }
            if (rules.put(FareTable.key(rule.getLineId(), rule.getZoneNumber()), rule.toBuilder().build()) != null) {
                throw new IntegrityException("Duplicate fare rule for line " + rule.getLineId() + " zone "
                        + rule.getZoneNumber());
            }
        }

        Map<String, FareType> fareTypes = new HashMap<>();
        for (Line line : network.lines()) {
            fareTypes.put(line.getId(), line.getFareType() == null ? FareType.ZONE : line.getFareType());
        }

        Map<String, PassengerType> types = new LinkedHashMap<>();
        for (PassengerType type : passengerTypes) {
            if (type == null || type.getId() == null || type.getId().isBlank()) {
                throw new IntegrityException("Passenger type without id");
            }
            BigDecimal discount = type.getDiscountPercentage() == null ? BigDecimal.ZERO : type.getDiscountPercentage();
            if (discount.signum() < 0 || discount.compareTo(HUNDRED) > 0) {
                throw new IntegrityException("Passenger type " + type.getId() + " has discount outside [0, 100]");
            }
            if (types.put(type.getId(), type.toBuilder().discountPercentage(discount).build()) != null) {
                throw new IntegrityException("Duplicate passenger type " + type.getId());
            }
        }

        FareTable table = new FareTable(rules, fareTypes, types, groupDiscounts);
        warnAboutCoverageGaps(network, table);
        log.info("💰 Fare table built: {} rules, {} passenger types, {} group brackets",
                rules.size(), types.size(), groupDiscounts.getBrackets().size());
        return table;
    }

    private void warnAboutCoverageGaps(NetworkSnapshot network, FareTable table) {
        for (Line line : network.lines()) {
            if (!line.isActive()) {
                continue;
            }
            Set<Integer> missing = new TreeSet<>();
            for (String stationId : line.getStationIds()) {
                network.findStation(stationId)
                        .map(Station::getZoneNumber)
                        .filter(zone -> !table.hasRule(line.getId(), zone))
                        .ifPresent(missing::add);
            }
            if (!missing.isEmpty()) {
                log.warn("⚠️ Line {} has no fare rule for zone(s) {}", line.getId(), missing);
            }
        }
    }

    private static boolean isNegative(BigDecimal value) {
        return value == null || value.signum() < 0;
    }
}
