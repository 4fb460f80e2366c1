package com.baykanat.cardflow.domain.model;

public enum Role {
    MEMBER,
    ADMIN,
    SYSTEM
}
