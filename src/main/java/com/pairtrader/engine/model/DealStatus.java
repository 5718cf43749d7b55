package com.pairtrader.engine.model;

public enum DealStatus {
    OPEN,
    CLOSED,
    CANCELED
}
