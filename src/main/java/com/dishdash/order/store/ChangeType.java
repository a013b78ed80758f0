package com.dishdash.order.store;

public enum ChangeType {
    CREATED,
    UPDATED,
    DELETED
}
