package com.bingohub.realtime.sync;

@FunctionalInterface
public interface NumberCalledHandler {
    void onNumberCalled(int number, CallState state);
}
