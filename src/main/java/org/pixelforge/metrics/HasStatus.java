package org.pixelforge.metrics;

public interface HasStatus {
    Status status();
}
