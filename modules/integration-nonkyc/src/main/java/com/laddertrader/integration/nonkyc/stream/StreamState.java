package com.laddertrader.integration.nonkyc.stream;

public enum StreamState {
  DISCONNECTED,
  CONNECTING,
  AUTHENTICATED,
  SUBSCRIBED,
  STREAMING
}
