package com.videoroom.model;

public enum EngineCommandKind {
    ADD_PEER,
    REMOVE_PEER,
    MEDIA_EVENT,
    SHUTDOWN
}
