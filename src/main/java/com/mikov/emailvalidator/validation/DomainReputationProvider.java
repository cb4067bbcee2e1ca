package com.mikov.emailvalidator.validation;

/**
 * Source of a 0-100 reputation value for a domain.
 *
 * @author zahari.mikov
 */
public interface DomainReputationProvider {

    int NEUTRAL_REPUTATION = 50;

    int reputationOf(final String domain);
}
