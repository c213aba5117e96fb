package com.vtb.parity.models;

public enum TargetSide {
    A,
    B
}
