package com.vtb.parity.models;

public enum BundleKind {
    CASE,
    CHAIN
}
