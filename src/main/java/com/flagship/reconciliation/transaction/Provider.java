package com.flagship.reconciliation.transaction;

/**
 * Accounting systems a transaction can originate from.
 *
 * Reconciliation always pairs a transaction with one recorded by a different provider.
 */
public enum Provider {
    XERO,
    QUICKBOOKS
}
