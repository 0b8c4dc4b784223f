package com.flagship.footy_marketplace.placement;

import lombok.Value;

/**
 * A placement and the invoice issued for it.
 */
@Value
public class PlacementRecord {
    Placement placement;
    Invoice invoice;
}
