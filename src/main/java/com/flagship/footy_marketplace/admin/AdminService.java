package com.flagship.footy_marketplace.admin;

import com.flagship.footy_marketplace.membership.MembershipService;
import com.flagship.footy_marketplace.payment.PaymentIntentService;
import com.flagship.footy_marketplace.payment.PaymentPurpose;
import com.flagship.footy_marketplace.placement.Invoice;
import com.flagship.footy_marketplace.placement.InvoiceStatus;
import com.flagship.footy_marketplace.placement.PlacementInvoiceService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Back-office operations. Every override is logged at WARN so it stands out in the audit trail.
 */
@Service
@Slf4j
public class AdminService {

    private final PlacementInvoiceService placementInvoiceService;
    private final MembershipService membershipService;
    private final PaymentIntentService paymentIntentService;
    private final String currency;

    public AdminService(PlacementInvoiceService placementInvoiceService,
                        MembershipService membershipService,
                        PaymentIntentService paymentIntentService,
                        @Value("${marketplace.currency:usd}") String currency) {
        this.placementInvoiceService = placementInvoiceService;
        this.membershipService = membershipService;
        this.paymentIntentService = paymentIntentService;
        this.currency = currency;
    }

    public Invoice markInvoicePaid(UUID invoiceId) {
        log.warn("Admin override: marking invoice {} paid", invoiceId);
        return placementInvoiceService.markInvoicePaid(invoiceId);
    }

    public Invoice voidInvoice(UUID invoiceId, String reason) {
        log.warn("Admin override: voiding invoice {} ({})", invoiceId, reason);
        return placementInvoiceService.voidInvoice(invoiceId, reason);
    }

    public List<Invoice> unpaidInvoices() {
        return placementInvoiceService.unpaidInvoices();
    }

    public int runExpirySweep() {
        int expired = membershipService.expireMemberships(Instant.now());
        log.info("Manual expiry sweep expired {} memberships", expired);
        return expired;
    }

    /**
     * Membership revenue counts succeeded membership intents, so superseded and cancelled
     * memberships that were paid for are included.
     */
    @Transactional(readOnly = true)
    public RevenueSummary revenue() {
        return new RevenueSummary(
            paymentIntentService.succeededRevenue(PaymentPurpose.MEMBERSHIP),
            paymentIntentService.succeededCount(PaymentPurpose.MEMBERSHIP),
            placementInvoiceService.paidRevenue(),
            placementInvoiceService.countByStatus(InvoiceStatus.PAID),
            currency
        );
    }
}
