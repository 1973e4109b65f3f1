package com.dentfinder.entitlement.api;

public class StoreNotFoundException extends RuntimeException {

  public StoreNotFoundException(long storeId) {
    super("store not found: " + storeId);
  }
}
