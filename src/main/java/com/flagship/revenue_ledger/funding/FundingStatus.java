package com.flagship.revenue_ledger.funding;

public enum FundingStatus {
    FUNDING,
    LIVE
}
