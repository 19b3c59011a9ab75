package com.laddertrader.integration.nonkyc.stream;

import com.fasterxml.jackson.databind.JsonNode;

@FunctionalInterface
public interface StreamMessageHandler {
  void onMessage(JsonNode message) throws Exception;
}
