package com.videoroom.service;

public class InvalidRoomTargetException extends IllegalArgumentException {

    public InvalidRoomTargetException(String message) {
        super(message);
    }
}
