package com.laddertrader.integration.nonkyc;

import com.laddertrader.domain.orders.OrderSide;
import com.laddertrader.domain.orders.OrderStatus;
import java.math.BigDecimal;
import java.util.Optional;

/**
 * Order as reported by the venue, from REST or from a stream report. {@code status} is empty when
 * the venue status string is not recognised; {@code rawStatus} keeps the original.
 */
public record VenueOrder(
    String orderId,
    String clientReferenceId,
    String symbol,
    OrderSide side,
    Optional<OrderStatus> status,
    String rawStatus,
    BigDecimal price,
    BigDecimal quantity,
    BigDecimal executedQuantity) {}
