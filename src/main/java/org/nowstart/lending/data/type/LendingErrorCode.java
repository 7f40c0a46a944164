package org.nowstart.lending.data.type;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum LendingErrorCode {

    // validation
    INVALID_ASSET(HttpStatus.BAD_REQUEST, "invalid_asset"),
    INVALID_ADDRESS(HttpStatus.BAD_REQUEST, "invalid_address"),
    INVALID_AMOUNT(HttpStatus.BAD_REQUEST, "invalid_amount"),
    INVALID_COLLATERAL_AMOUNT(HttpStatus.BAD_REQUEST, "invalid_collateral_amount"),
    INVALID_LEVERAGE(HttpStatus.UNPROCESSABLE_ENTITY, "invalid_leverage"),
    INVALID_RATE(HttpStatus.BAD_REQUEST, "invalid_rate"),
    INVALID_CONFIGURATION(HttpStatus.BAD_REQUEST, "invalid_configuration"),
    POSITION_NOT_FOUND(HttpStatus.NOT_FOUND, "position_not_found"),
    POSITION_NOT_OPEN(HttpStatus.CONFLICT, "position_not_open"),
    VAULT_NOT_REGISTERED(HttpStatus.NOT_FOUND, "vault_not_registered"),
    VAULT_ALREADY_REGISTERED(HttpStatus.CONFLICT, "vault_already_registered"),

    // authorization
    NOT_POSITION_OWNER(HttpStatus.FORBIDDEN, "not_position_owner"),
    MISSING_ROLE(HttpStatus.FORBIDDEN, "missing_role"),
    VAULT_NOT_CALLER(HttpStatus.FORBIDDEN, "vault_not_caller"),

    // invariants
    LOAN_EXCEEDS_LTV_LIMIT(HttpStatus.UNPROCESSABLE_ENTITY, "loan_exceeds_ltv_limit"),
    INSUFFICIENT_COLLATERAL(HttpStatus.UNPROCESSABLE_ENTITY, "insufficient_collateral"),
    INSUFFICIENT_COLLATERAL_AFTER_WITHDRAWAL(HttpStatus.UNPROCESSABLE_ENTITY, "insufficient_collateral_after_withdrawal"),
    AMOUNT_EXCEEDS_LOAN(HttpStatus.UNPROCESSABLE_ENTITY, "amount_exceeds_loan"),
    POSITION_HEALTHY(HttpStatus.UNPROCESSABLE_ENTITY, "position_healthy"),
    NO_INTEREST_TO_COLLECT(HttpStatus.UNPROCESSABLE_ENTITY, "no_interest_to_collect"),

    // external dependencies
    STALE_PRICE(HttpStatus.SERVICE_UNAVAILABLE, "stale_price"),
    INVALID_PRICE(HttpStatus.BAD_GATEWAY, "invalid_price"),
    PRICE_FEED_NOT_CONFIGURED(HttpStatus.SERVICE_UNAVAILABLE, "price_feed_not_configured"),
    INSUFFICIENT_BALANCE(HttpStatus.UNPROCESSABLE_ENTITY, "insufficient_balance"),
    INSUFFICIENT_ALLOWANCE(HttpStatus.UNPROCESSABLE_ENTITY, "insufficient_allowance"),
    INSUFFICIENT_OUTPUT(HttpStatus.UNPROCESSABLE_ENTITY, "insufficient_output"),
    SWAP_FAILED(HttpStatus.UNPROCESSABLE_ENTITY, "swap_failed"),

    // capacity
    NO_BORROW_CAPACITY(HttpStatus.UNPROCESSABLE_ENTITY, "no_borrow_capacity"),

    // concurrency
    REENTRANT_CALL(HttpStatus.CONFLICT, "reentrant_call"),
    CONCURRENT_UPDATE(HttpStatus.CONFLICT, "concurrent_update");

    private final HttpStatus status;
    private final String code;
}
