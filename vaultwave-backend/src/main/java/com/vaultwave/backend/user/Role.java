package com.vaultwave.backend.user;

public enum Role {
    USER,
    ARTIST,
    ADMIN
}
