package com.mikov.emailvalidator.services;

import com.mikov.emailvalidator.dns.DnsResultCache;
import com.mikov.emailvalidator.validation.DisposableDomainList;
import com.mikov.emailvalidator.validation.RoleAccountList;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic housekeeping: drops expired DNS entries and refreshes the lookup lists.
 *
 * @author zahari.mikov
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MaintenanceTask {

    private final DnsResultCache dnsResultCache;
    private final DisposableDomainList disposableDomainList;
    private final RoleAccountList roleAccountList;

    @Scheduled(fixedDelayString = "${validator.dns.cleanup-interval:PT10M}",
            initialDelayString = "${validator.dns.cleanup-interval:PT10M}")
    public void clearExpiredDnsEntries() {
        final var removed = dnsResultCache.clearExpired();
        log.debug("Removed {} expired DNS cache entries, {} remain", removed, dnsResultCache.size());
    }

    @Scheduled(fixedDelayString = "${validator.lists.refresh-interval:PT6H}",
            initialDelayString = "${validator.lists.refresh-interval:PT6H}")
    public void refreshLists() {
        disposableDomainList.reload();
        roleAccountList.reload();
        log.info("Refreshed lists: {} disposable domains, {} role prefixes",
                disposableDomainList.size(), roleAccountList.size());
    }
}
