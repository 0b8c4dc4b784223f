package com.flagship.footy_marketplace.membership;

import lombok.Value;

/**
 * A pending membership together with the client secret the payer needs to complete the payment.
 */
@Value
public class MembershipCheckout {
    Membership membership;
    String paymentIntentId;
    String clientSecret;
    Membership replaces;
}
