package com.routely.backend.model;

public enum EdgeKind {
    RIDE,
    TRANSFER
}
