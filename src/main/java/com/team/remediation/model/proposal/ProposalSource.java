package com.team.remediation.model.proposal;

/**
 * Where a proposal came from.
 */
public enum ProposalSource {
    /** Drafted by the generative backend from graph and similarity context */
    GENERATED,
    /** Static rule table, used when the backend is unavailable or its output is invalid */
    FALLBACK
}
