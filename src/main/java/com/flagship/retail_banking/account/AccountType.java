package com.flagship.retail_banking.account;

/**
 * Product type of a customer account.
 * None of these permit overdraft: every balance must stay at or above zero.
 */
public enum AccountType {
    SAVINGS,
    CHECKING,
    FIXED_DEPOSIT
}
