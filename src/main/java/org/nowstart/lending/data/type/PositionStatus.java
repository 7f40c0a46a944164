package org.nowstart.lending.data.type;

public enum PositionStatus {
    OPEN,
    CLOSED,
    LIQUIDATED
}
