package org.netpreserve.newsagger.db;

public record StatusCount(String status, long count) {
}
