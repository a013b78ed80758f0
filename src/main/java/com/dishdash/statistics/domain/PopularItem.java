package com.dishdash.statistics.domain;

public record PopularItem(String name, long quantity) {
}
