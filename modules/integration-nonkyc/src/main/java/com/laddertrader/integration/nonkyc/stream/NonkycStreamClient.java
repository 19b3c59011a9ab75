package com.laddertrader.integration.nonkyc.stream;

public interface NonkycStreamClient {
  void subscribe(StreamSubscription subscription);

  void registerHandler(String messageType, StreamMessageHandler handler);

  void setDefaultHandler(StreamMessageHandler handler);

  void start(StreamEventHandler eventHandler);

  void stop();

  StreamState state();

  boolean isConnected();

  long reconnectAttempts();
}
