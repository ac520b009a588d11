package com.settleworks.core.domain.effects;

public enum ZoneKind {
    DEFENSE,
    TRADE
}
