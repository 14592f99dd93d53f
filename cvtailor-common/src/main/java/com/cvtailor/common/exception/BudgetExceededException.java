package com.cvtailor.common.exception;

public class BudgetExceededException extends OrchestrationException {

    private final String principal;

    public BudgetExceededException(String principal, String message) {
        super(ErrorKind.BUDGET_EXCEEDED, message);
        this.principal = principal;
    }

    public String getPrincipal() {
        return principal;
    }
}
