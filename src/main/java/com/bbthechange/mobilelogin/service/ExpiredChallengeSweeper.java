package com.bbthechange.mobilelogin.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodically removes expired login challenges and their attempts. DynamoDB TTL deletes
 * them eventually as well, but with no timing guarantee.
 */
@Service
@ConditionalOnProperty(name = "login.sweeper.enabled", havingValue = "true", matchIfMissing = true)
public class ExpiredChallengeSweeper {

    private static final Logger logger = LoggerFactory.getLogger(ExpiredChallengeSweeper.class);

    private final SessionLedgerService sessionLedger;

    public ExpiredChallengeSweeper(SessionLedgerService sessionLedger) {
        this.sessionLedger = sessionLedger;
    }

    @Scheduled(fixedDelayString = "${login.sweep-interval:PT5M}", initialDelayString = "${login.sweep-interval:PT5M}")
    public void sweep() {
        try {
            sessionLedger.sweepExpired();
        } catch (RuntimeException e) {
            // Next run retries; leftover rows are still removed by TTL
            logger.error("Expired challenge sweep failed", e);
        }
    }
}
