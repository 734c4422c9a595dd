package com.vaultwave.backend.library;

public enum AcquisitionType {
    FREE,
    PURCHASED,
    NYP
}
