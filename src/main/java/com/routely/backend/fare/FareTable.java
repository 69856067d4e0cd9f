package com.routely.backend.fare;

import com.routely.backend.exception.FareRuleMissingException;
import com.routely.backend.exception.InvalidPassengerTypeException;
import com.routely.backend.model.FareType;
import com.routely.backend.model.PassengerType;
import com.routely.backend.model.ZoneFareRule;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;

/**
 * Flat pricing lookup built alongside a network snapshot: rules keyed by line and zone,
 * fare type per line, passenger types by id and the group brackets.
 */
public final class FareTable {

    private final Map<String, ZoneFareRule> rules;
    private final Map<String, FareType> fareTypes;
    private final Map<String, PassengerType> passengerTypes;
    private final GroupDiscountSchedule groupDiscounts;

    FareTable(Map<String, ZoneFareRule> rules, Map<String, FareType> fareTypes,
            Map<String, PassengerType> passengerTypes, GroupDiscountSchedule groupDiscounts) {
        this.rules = Collections.unmodifiableMap(rules);
        this.fareTypes = Collections.unmodifiableMap(fareTypes);
        this.passengerTypes = Collections.unmodifiableMap(passengerTypes);
        this.groupDiscounts = groupDiscounts;
    }

    public ZoneFareRule rule(String lineId, int zoneNumber) {
        ZoneFareRule rule = rules.get(key(lineId, zoneNumber));
        if (rule == null) {
            throw new FareRuleMissingException(lineId, zoneNumber);
        }
        return rule;
    }

    public boolean hasRule(String lineId, int zoneNumber) {
        return rules.containsKey(key(lineId, zoneNumber));
    }

    public FareType fareType(String lineId) {
        return fareTypes.getOrDefault(lineId, FareType.ZONE);
    }

    public PassengerType passengerType(String passengerTypeId) {
        PassengerType type = passengerTypeId == null ? null : passengerTypes.get(passengerTypeId);
        if (type == null) {
            throw new InvalidPassengerTypeException(passengerTypeId);
        }
        return type;
    }

    // In source order
    public Collection<PassengerType> passengerTypes() {
        return passengerTypes.values();
    }

    public GroupDiscountSchedule groupDiscounts() {
        return groupDiscounts;
    }

    public int ruleCount() {
        return rules.size();
    }

    static String key(String lineId, int zoneNumber) {
        return lineId + "#" + zoneNumber;
    }
}
