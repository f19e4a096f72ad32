package com.keystone.persistence;

/** Aggregations supported by {@link DataOperation.Aggregate}. */
public enum AggregateFunction {
    SUM,
    MIN,
    MAX,
    AVG
}
