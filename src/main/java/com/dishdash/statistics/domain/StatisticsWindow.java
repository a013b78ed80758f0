package com.dishdash.statistics.domain;

public enum StatisticsWindow {
    TODAY,
    THIS_WEEK,
    THIS_MONTH,
    ALL_TIME
}
