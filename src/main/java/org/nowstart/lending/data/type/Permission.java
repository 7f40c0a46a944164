package org.nowstart.lending.data.type;

public enum Permission {
    ADMIN,
    LEVERAGE
}
