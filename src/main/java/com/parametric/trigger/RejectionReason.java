package com.parametric.trigger;

public enum RejectionReason {
    /** No condition matched before the pending timeout. */
    NO_CONDITION_MET,
    /** A condition matched but the policy was no longer active. */
    POLICY_NOT_ACTIVE
}
