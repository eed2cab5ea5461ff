package me.binarii.mirror.core;

import java.time.Duration;

public class ProbeTimeoutException extends ProbeException {

    public ProbeTimeoutException(String url, Duration deadline) {
        super("probe of " + url + " exceeded " + deadline.toMillis() + "ms");
    }

    public ProbeTimeoutException(String url, Duration deadline, Throwable cause) {
        super("probe of " + url + " exceeded " + deadline.toMillis() + "ms", cause);
    }

}
