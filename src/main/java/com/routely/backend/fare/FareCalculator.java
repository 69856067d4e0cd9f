package com.routely.backend.fare;

import com.routely.backend.exception.FareRuleMissingException;
import com.routely.backend.exception.InvalidPlanRequestException;
import com.routely.backend.model.EdgeKind;
import com.routely.backend.model.FareBreakdown;
import com.routely.backend.model.FareItem;
import com.routely.backend.model.FareType;
import com.routely.backend.model.Itinerary;
import com.routely.backend.model.ItinerarySegment;
import com.routely.backend.model.PassengerType;
import com.routely.backend.model.ZoneFareRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Itemised price of one itinerary for one passenger type.
 *
 * <p>Every ride segment is its own fare item, priced by its line's rule for the zone it departs
 * from. Transfers are charged their fixed fee. The passenger discount applies to rides only,
 * the group discount to the discounted total.
 */
@Component
@Slf4j
public class FareCalculator {

    private static final int MONEY_SCALE = 2;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final String currency;

    public FareCalculator(@Value("${routely.fare.currency:THB}") String currency) {
        this.currency = currency;
    }

    public FareBreakdown price(Itinerary itinerary, FareTable fareTable, String passengerTypeId,
            boolean group, int groupSize) {
        PassengerType passengerType = fareTable.passengerType(passengerTypeId);
        if (group && groupSize < 1) {
            throw new InvalidPlanRequestException("Group size must be at least 1");
        }
        int travellers = group ? groupSize : 1;

        List<FareItem> items;
        try {
            items = itemise(itinerary.getSegments(), fareTable);
        } catch (FareRuleMissingException e) {
            log.error("❌ Cannot price itinerary {}: no fare rule for line {} zone {}",
                    itinerary.getId(), e.getLineId(), e.getZoneNumber());
            throw e;
        }

        BigDecimal rideSubtotal = BigDecimal.ZERO;
        BigDecimal transferFees = BigDecimal.ZERO;
        for (FareItem item : items) {
            if (item.getKind() == EdgeKind.RIDE) {
                rideSubtotal = rideSubtotal.add(item.getAmount());
            } else {
                transferFees = transferFees.add(item.getAmount());
            }
        }

        BigDecimal passengerPercentage = passengerType.getDiscountPercentage();
        BigDecimal passengerDiscount = percentOf(rideSubtotal, passengerPercentage);
        BigDecimal afterPassenger = rideSubtotal.subtract(passengerDiscount).add(transferFees);

        BigDecimal groupPercentage = group ? fareTable.groupDiscounts().discountFor(travellers) : BigDecimal.ZERO;
        BigDecimal groupDiscount = percentOf(afterPassenger, groupPercentage);
        BigDecimal total = money(afterPassenger.subtract(groupDiscount));

        return FareBreakdown.builder()
                .passengerTypeId(passengerType.getId())
                .category(passengerType.getCategory())
                .currency(currency)
                .items(List.copyOf(items))
                .rideSubtotal(money(rideSubtotal))
                .passengerDiscountPercentage(passengerPercentage)
                .passengerDiscount(passengerDiscount)
                .transferFees(money(transferFees))
                .group(group)
                .groupSize(travellers)
                .groupDiscountPercentage(groupPercentage)
                .groupDiscount(groupDiscount)
                .total(total)
                .groupTotal(money(total.multiply(BigDecimal.valueOf(travellers))))
                .build();
    }

    List<FareItem> itemise(List<ItinerarySegment> segments, FareTable fareTable) {
        List<FareItem> items = new ArrayList<>(segments.size());
        for (ItinerarySegment segment : segments) {
            items.add(segment.isTransfer() ? transferItem(segment) : rideItem(segment, fareTable));
        }
        return items;
    }

    private FareItem transferItem(ItinerarySegment segment) {
        BigDecimal fee = segment.getTransferFee() == null ? BigDecimal.ZERO : segment.getTransferFee();
        return FareItem.builder()
                .kind(EdgeKind.TRANSFER)
                .segmentOrder(segment.getOrder())
                .fromStationId(segment.getFromStationId())
                .toStationId(segment.getToStationId())
                .transferFee(money(fee))
                .amount(money(fee))
                .build();
    }

    private FareItem rideItem(ItinerarySegment segment, FareTable fareTable) {
        String lineId = segment.getLineId();
        ZoneFareRule rule = fareTable.rule(lineId, segment.getFromZone());
        FareType fareType = fareTable.fareType(lineId);
        // One hop per segment on per-station lines
        int units = fareType == FareType.PER_STATION
                ? 1
                : Math.abs(segment.getToZone() - segment.getFromZone());
        BigDecimal incremental = rule.getIncrementalFare();
        BigDecimal amount = rule.getBaseFare().add(incremental.multiply(BigDecimal.valueOf(units)));
        return FareItem.builder()
                .kind(EdgeKind.RIDE)
                .segmentOrder(segment.getOrder())
                .lineId(lineId)
                .fromStationId(segment.getFromStationId())
                .toStationId(segment.getToStationId())
                .fareType(fareType)
                .fareUnits(units)
                .baseFare(money(rule.getBaseFare()))
                .incrementalFare(money(incremental))
                .amount(money(amount))
                .build();
    }

    private static BigDecimal percentOf(BigDecimal amount, BigDecimal percentage) {
        if (percentage == null || percentage.signum() == 0) {
            return money(BigDecimal.ZERO);
        }
        return money(amount.multiply(percentage).divide(HUNDRED, MONEY_SCALE + 4, RoundingMode.HALF_UP));
    }

    static BigDecimal money(BigDecimal amount) {
        return amount.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }
}
