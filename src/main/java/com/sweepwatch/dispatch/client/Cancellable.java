package com.sweepwatch.dispatch.client;

@FunctionalInterface
public interface Cancellable {

    void cancel();
}
