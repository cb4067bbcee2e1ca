package com.mikov.emailvalidator.validation;

import org.springframework.stereotype.Component;

/**
 * Reports the same neutral reputation for every domain until a real feed is wired in.
 */
@Component
public class NeutralDomainReputationProvider implements DomainReputationProvider {

    @Override
    public int reputationOf(final String domain) {
        return NEUTRAL_REPUTATION;
    }
}
