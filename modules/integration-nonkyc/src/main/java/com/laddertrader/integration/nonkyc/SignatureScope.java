package com.laddertrader.integration.nonkyc;

public enum SignatureScope {
  /** Scheme, host and path are part of the signed message. */
  ABSOLUTE_URL,
  /** Only the path is signed; incompatible with the live venue, opt-in only. */
  PATH_ONLY
}
