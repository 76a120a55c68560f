package com.collectiveip.core.domain;

public enum ProposalCategory {
    ASSET_MANAGEMENT,
    REVENUE_POLICY,
    EMERGENCY
}
