package com.flagship.footy_marketplace.membership;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Runs the membership expiry sweep on a cron schedule (hourly by default).
 */
@Component
@ConditionalOnProperty(name = "membership.expiry-sweep.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class MembershipExpirySweeper {

    private final MembershipService membershipService;

    @Scheduled(cron = "${membership.expiry-sweep.cron:0 0 * * * *}")
    public void sweep() {
        try {
            int expired = membershipService.expireMemberships(Instant.now());
            log.debug("Expiry sweep finished: {} memberships expired", expired);
        } catch (Exception e) {
            log.error("Membership expiry sweep failed", e);
        }
    }
}
