package com.laddertrader.integration.nonkyc.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.laddertrader.integration.nonkyc.NonkycResponseParser;
import com.laddertrader.integration.nonkyc.VenueOrder;

/** Parsing for account frames pushed on the stream. */
public final class NonkycStreamReports {
  public static final String REPORT = "report";
  public static final String BALANCES = "currentBalances";

  private NonkycStreamReports() {}

  public static VenueOrder orderReport(JsonNode message) {
    JsonNode params = message.path("params");
    JsonNode payload = params.isMissingNode() || params.isNull() ? message : params;
    if (payload.isArray() && payload.size() > 0) {
      payload = payload.get(0);
    }
    VenueOrder order = NonkycResponseParser.order(payload, null);
    if (order.orderId() == null && order.clientReferenceId() == null) {
      throw new IllegalArgumentException("Report frame carries no order id");
    }
    return order;
  }
}
