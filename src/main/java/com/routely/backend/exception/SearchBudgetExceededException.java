package com.routely.backend.exception;

public class SearchBudgetExceededException extends RoutePlanningException {

    public SearchBudgetExceededException(int budget) {
        super("SEARCH_BUDGET_EXCEEDED", "Route search exceeded " + budget + " frontier pops", true);
    }
}
