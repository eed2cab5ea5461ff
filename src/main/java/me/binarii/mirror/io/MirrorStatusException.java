package me.binarii.mirror.io;

public class MirrorStatusException extends Exception {

    public MirrorStatusException(String message) {
        super(message);
    }

    public MirrorStatusException(String message, Throwable cause) {
        super(message, cause);
    }

}
