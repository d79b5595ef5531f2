package com.cycleindicators.common.model;

/**
 * How a failed indicator whose weight is zero is treated in the success-rate denominator.
 */
public enum FailedWeightPolicy {

    /** Every roster member counts; a zero-weight failure lowers the success rate. */
    COUNT_AS_FAILURE,

    /** Zero-weight failures are left out of the denominator. */
    EXCLUDE
}
