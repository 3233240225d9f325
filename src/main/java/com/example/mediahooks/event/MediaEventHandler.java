package com.example.mediahooks.event;

@FunctionalInterface
public interface MediaEventHandler {

    void handle(MediaEvent event);
}
