package com.trade.scalper.strategy;

/**
 * 交易引擎状态
 */
public enum EngineState {
    FLAT,
    IN_POSITION
}
