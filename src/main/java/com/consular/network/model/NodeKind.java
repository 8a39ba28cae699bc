package com.consular.network.model;

public enum NodeKind {
    PERSON,
    ORGANIZATION
}
