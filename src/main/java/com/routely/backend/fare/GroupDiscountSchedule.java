package com.routely.backend.fare;

import lombok.Value;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Group size brackets, e.g. {@code 5:10,10:15,20:20} gives 10% from five travellers,
 * 15% from ten and 20% from twenty. Larger groups never get a smaller discount.
 */
public final class GroupDiscountSchedule {

    private static final GroupDiscountSchedule NONE = new GroupDiscountSchedule(List.of());

    private final List<Bracket> brackets;

    public GroupDiscountSchedule(List<Bracket> brackets) {
        List<Bracket> sorted = new ArrayList<>(brackets);
        sorted.sort(Comparator.comparingInt(Bracket::getMinGroupSize));
        BigDecimal previous = BigDecimal.ZERO;
        int previousSize = 0;
        for (Bracket bracket : sorted) {
            if (bracket.getMinGroupSize() < 1) {
                throw new IllegalArgumentException("Group bracket size must be at least 1");
            }
            if (bracket.getMinGroupSize() == previousSize) {
                throw new IllegalArgumentException("Duplicate group bracket for size " + previousSize);
            }
            BigDecimal discount = bracket.getDiscountPercentage();
            if (discount.signum() < 0 || discount.compareTo(BigDecimal.valueOf(100)) > 0) {
                throw new IllegalArgumentException("Group discount must be within [0, 100]: " + discount);
            }
            if (discount.compareTo(previous) < 0) {
                throw new IllegalArgumentException("Group discount decreases at size " + bracket.getMinGroupSize());
            }
            previous = discount;
            previousSize = bracket.getMinGroupSize();
        }
        this.brackets = List.copyOf(sorted);
    }

    public static GroupDiscountSchedule none() {
        return NONE;
    }

    /**
     * Parses {@code size:percent} pairs separated by commas. Blank input means no group discount.
     */
    public static GroupDiscountSchedule parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return NONE;
        }
        List<Bracket> brackets = new ArrayList<>();
        for (String entry : raw.split(",")) {
            String trimmed = entry.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            String[] parts = trimmed.split(":");
            if (parts.length != 2) {
                throw new IllegalArgumentException("Invalid group bracket '" + trimmed + "', expected size:percent");
            }
            try {
                brackets.add(new Bracket(Integer.parseInt(parts[0].trim()), new BigDecimal(parts[1].trim())));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid group bracket '" + trimmed + "'", e);
            }
        }
        return new GroupDiscountSchedule(brackets);
    }

    public BigDecimal discountFor(int groupSize) {
        BigDecimal discount = BigDecimal.ZERO;
        for (Bracket bracket : brackets) {
            if (groupSize >= bracket.getMinGroupSize()) {
                discount = bracket.getDiscountPercentage();
            }
        }
        return discount;
    }

    public List<Bracket> getBrackets() {
        return brackets;
    }

    @Value
    public static class Bracket {
        int minGroupSize;
        BigDecimal discountPercentage;
    }
}
