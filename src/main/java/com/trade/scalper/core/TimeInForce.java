package com.trade.scalper.core;

public enum TimeInForce {
    GTC,
    IOC
}
